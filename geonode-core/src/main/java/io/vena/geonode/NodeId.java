package io.vena.geonode;

import java.util.UUID;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * The means by which {@link GeometryNode nodes} are identified within
 * a {@link NodeCollection}.
 *
 * <p>
 * A node receives its {@link NodeId} when it is constructed and keeps it for life.
 * The collection stores each node under exactly this value.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class NodeId implements Comparable<NodeId> {
	@NonNull final UUID value;

	public static NodeId random() {
		return new NodeId(UUID.randomUUID());
	}

	public static NodeId of(UUID value) {
		return new NodeId(value);
	}

	/**
	 * @throws IllegalArgumentException if <code>value</code> is not the text form of a UUID
	 */
	public static NodeId from(String value) {
		if (value.length() != CANONICAL_LENGTH) {
			// UUID.fromString is lenient about short groups, so "1-2-3-4-5" would sneak through
			throw new IllegalArgumentException("NodeId must be a " + CANONICAL_LENGTH + "-character UUID: \"" + value + "\"");
		}
		return new NodeId(UUID.fromString(value));
	}

	public UUID uuid() { return value; }

	@Override
	public int compareTo(NodeId other) {
		return value.compareTo(other.value);
	}

	@Override public String toString() { return value.toString(); }

	private static final int CANONICAL_LENGTH = 36;
}
