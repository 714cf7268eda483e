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
 * An axis-aligned rectangle positioned by its {@link #anchor() anchor} {@link Point}.
 *
 * <p>
 * The anchor is owned by value. {@link #setAnchor} stores a copy, so the
 * Point passed in and the anchor never affect each other afterward.
 * The anchor is not itself an entry of any {@link NodeCollection}.
 */
@Getter
@Setter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"anchor", "width", "height", "id"})
public final class Rectangle implements GeometryNode {
	@Getter(AccessLevel.NONE)
	@Setter(AccessLevel.NONE)
	@JsonProperty
	private Point anchor;

	@JsonProperty private double width;
	@JsonProperty private double height;

	@Getter(AccessLevel.NONE)
	@Setter(AccessLevel.NONE)
	@JsonProperty
	private final NodeId id;

	/**
	 * A zero-sized rectangle anchored at a fresh origin {@link Point}, with a fresh {@link NodeId}.
	 */
	public Rectangle() {
		this(new Point(), 0.0, 0.0, NodeId.random());
	}

	@JsonCreator
	public Rectangle(
		@JsonProperty(value = "anchor", required = true) @NonNull Point anchor,
		@JsonProperty(value = "width", required = true) double width,
		@JsonProperty(value = "height", required = true) double height,
		@JsonProperty(value = "id", required = true) @NonNull NodeId id
	) {
		this.anchor = anchor;
		this.width = width;
		this.height = height;
		this.id = id;
	}

	/**
	 * @return the Point this rectangle owns. Changes made to it are changes to this rectangle.
	 */
	public Point anchor() {
		return anchor;
	}

	public void setAnchor(@NonNull Point anchor) {
		this.anchor = anchor.copy();
	}

	@Override
	public NodeId id() {
		return id;
	}
}
