package io.vena.geonode;

import java.util.function.Supplier;

/**
 * A concrete {@link GeometryNode} type together with the tag that identifies it
 * in serialized data.
 *
 * @param factory produces a default instance with a fresh {@link NodeId}
 */
public record NodeVariant<T extends GeometryNode>(
	String tag,
	Class<T> type,
	Supplier<? extends T> factory
) {
	public NodeVariant {
		if (tag.isEmpty()) {
			throw new IllegalArgumentException("Variant tag can't be empty");
		} else if (tag.equals(GeometryNode.TAG_PROPERTY)) {
			throw new IllegalArgumentException("Variant tag can't be \"" + GeometryNode.TAG_PROPERTY + "\"");
		}
	}

	public static <TT extends GeometryNode> NodeVariant<TT> of(String tag, Class<TT> type, Supplier<? extends TT> factory) {
		return new NodeVariant<>(tag, type, factory);
	}

	public T create() {
		return factory.get();
	}
}
