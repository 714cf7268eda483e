package io.vena.geonode;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.ToString;

/**
 * A position in three dimensions.
 */
@Getter
@Setter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"x", "y", "z", "id"})
public final class Point implements GeometryNode {
	@JsonProperty private double x;
	@JsonProperty private double y;
	@JsonProperty private double z;

	@Getter(AccessLevel.NONE)
	@Setter(AccessLevel.NONE)
	@JsonProperty
	private final NodeId id;

	/**
	 * The origin, with a fresh {@link NodeId}.
	 */
	public Point() {
		this(0.0, 0.0, 0.0, NodeId.random());
	}

	@JsonCreator
	public Point(
		@JsonProperty(value = "x", required = true) double x,
		@JsonProperty(value = "y", required = true) double y,
		@JsonProperty(value = "z", required = true) double z,
		@JsonProperty(value = "id", required = true) @NonNull NodeId id
	) {
		this.x = x;
		this.y = y;
		this.z = z;
		this.id = id;
	}

	/**
	 * @return an independent Point with the same coordinates and the same {@link NodeId}
	 */
	public Point copy() {
		return new Point(x, y, z, id);
	}

	@Override
	public NodeId id() {
		return id;
	}
}
