package io.vena.geonode;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

/**
 * A variant that is not part of {@link NodeVariantRegistry#standard()},
 * for checking that new kinds of node need nothing but registration.
 */
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"vertices", "id"})
public final class Polyline implements GeometryNode {
	@JsonProperty
	private final List<Point> vertices;

	@JsonProperty
	private final NodeId id;

	public Polyline() {
		this(new ArrayList<>(), NodeId.random());
	}

	@JsonCreator
	public Polyline(
		@JsonProperty(value = "vertices", required = true) @NonNull List<Point> vertices,
		@JsonProperty(value = "id", required = true) @NonNull NodeId id
	) {
		this.vertices = new ArrayList<>(vertices);
		this.id = id;
	}

	/**
	 * @return the live list of vertices; changes to it change this polyline
	 */
	public List<Point> vertices() {
		return vertices;
	}

	public Polyline withVertex(Point vertex) {
		vertices.add(vertex.copy());
		return this;
	}

	@Override
	public NodeId id() {
		return id;
	}
}
