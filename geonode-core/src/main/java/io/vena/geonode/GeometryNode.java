package io.vena.geonode;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Optional;

import static com.fasterxml.jackson.annotation.JsonTypeInfo.As.PROPERTY;
import static com.fasterxml.jackson.annotation.JsonTypeInfo.Id.NAME;

/**
 * One entry of a {@link NodeCollection}.
 *
 * <p>
 * Implementations are independent concrete types, each registered under a tag
 * in a {@link NodeVariantRegistry}. The tag is written into the serialized form
 * as the {@value #TAG_PROPERTY} property so the concrete type can be
 * reconstructed without the caller naming it.
 */
@JsonTypeInfo(use = NAME, include = PROPERTY, property = GeometryNode.TAG_PROPERTY)
public interface GeometryNode {
	String TAG_PROPERTY = "geometry_node";

	/**
	 * @return the identifier assigned when this node was constructed. Never changes.
	 */
	NodeId id();

	/**
	 * Narrows this node to <code>type</code> after checking its runtime class.
	 *
	 * @return this node as a <code>T</code>, or {@link Optional#empty()} if it isn't one
	 */
	default <T extends GeometryNode> Optional<T> as(Class<T> type) {
		if (type.isInstance(this)) {
			return Optional.of(type.cast(this));
		} else {
			return Optional.empty();
		}
	}
}
