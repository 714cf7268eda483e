package io.vena.geonode;

import io.vena.geonode.exceptions.UnknownVariantException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableCollection;
import static java.util.Collections.unmodifiableMap;

/**
 * The explicit set of {@link NodeVariant}s that serialization knows about.
 *
 * <p>
 * Built once with a {@link Builder} and read-only afterward.
 * Supporting a new kind of node means registering it here;
 * {@link NodeCollection} itself never needs to change.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class NodeVariantRegistry {
	private final Map<String, NodeVariant<?>> variantsByTag;
	private final Map<Class<?>, NodeVariant<?>> variantsByType;

	/**
	 * {@link Point} (tag <code>Point3</code>) and {@link Rectangle} (tag <code>Rectangle</code>).
	 */
	public static NodeVariantRegistry standard() {
		return STANDARD;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return a builder pre-populated with the variants from this registry
	 */
	public Builder toBuilder() {
		Builder result = new Builder();
		variantsByTag.values().forEach(result::register);
		return result;
	}

	public Optional<NodeVariant<?>> variant(String tag) {
		return Optional.ofNullable(variantsByTag.get(tag));
	}

	@SuppressWarnings("unchecked")
	public <T extends GeometryNode> Optional<NodeVariant<T>> variantOf(Class<T> type) {
		return Optional.ofNullable((NodeVariant<T>) variantsByType.get(type));
	}

	/**
	 * @throws IllegalArgumentException if <code>node</code>'s class is not registered
	 */
	public String tagOf(GeometryNode node) {
		NodeVariant<?> variant = variantsByType.get(node.getClass());
		if (variant == null) {
			throw new IllegalArgumentException("Unregistered node class: " + node.getClass().getName());
		}
		return variant.tag();
	}

	/**
	 * @return a default instance of the variant registered under <code>tag</code>
	 * @throws UnknownVariantException if nothing is registered under <code>tag</code>
	 */
	public GeometryNode create(String tag) {
		return variant(tag)
			.orElseThrow(() -> new UnknownVariantException(tag))
			.create();
	}

	public Collection<NodeVariant<?>> variants() {
		return unmodifiableCollection(variantsByTag.values());
	}

	public boolean isRegistered(Class<?> type) {
		return variantsByType.containsKey(type);
	}

	@Override
	public String toString() {
		return "NodeVariantRegistry" + variantsByTag.keySet();
	}

	public static final class Builder {
		private final List<NodeVariant<?>> variants = new ArrayList<>();

		private Builder() { }

		public <T extends GeometryNode> Builder register(String tag, Class<T> type, Supplier<? extends T> factory) {
			return register(NodeVariant.of(tag, type, factory));
		}

		public Builder register(NodeVariant<?> variant) {
			variants.add(variant);
			return this;
		}

		/**
		 * @throws IllegalArgumentException if two variants share a tag or a class
		 */
		public NodeVariantRegistry build() {
			Map<String, NodeVariant<?>> byTag = new LinkedHashMap<>();
			Map<Class<?>, NodeVariant<?>> byType = new LinkedHashMap<>();
			for (NodeVariant<?> variant: variants) {
				NodeVariant<?> existing = byTag.put(variant.tag(), variant);
				if (existing != null) {
					throw new IllegalArgumentException("Tag \"" + variant.tag() + "\" registered for both " + existing.type().getSimpleName() + " and " + variant.type().getSimpleName());
				}
				existing = byType.put(variant.type(), variant);
				if (existing != null) {
					throw new IllegalArgumentException(variant.type().getSimpleName() + " registered under both \"" + existing.tag() + "\" and \"" + variant.tag() + "\"");
				}
			}
			LOGGER.debug("Built registry with tags {}", byTag.keySet());
			return new NodeVariantRegistry(unmodifiableMap(byTag), unmodifiableMap(byType));
		}
	}

	// LOGGER must be initialized first because build() uses it
	private static final Logger LOGGER = LoggerFactory.getLogger(NodeVariantRegistry.class);

	private static final NodeVariantRegistry STANDARD = builder()
		.register("Point3", Point.class, Point::new)
		.register("Rectangle", Rectangle.class, Rectangle::new)
		.build();
}
