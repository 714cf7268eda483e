package io.vena.geonode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.stream.Stream;
import lombok.EqualsAndHashCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * A mutable mapping from {@link NodeId} to the {@link GeometryNode} carrying that id.
 *
 * <p>
 * Each node is stored under its own {@link GeometryNode#id() id}; there is no
 * way to store a node under any other key. Entries are kept in ascending id
 * order, so iteration and serialization never depend on the order of insertion.
 *
 * <p>
 * Retrieval by concrete type goes through {@link #getTyped}, which checks the
 * stored node's runtime class and yields {@link Optional#empty()} on a mismatch.
 * The node returned is the stored node itself: its setters are the way to
 * change a node in place.
 *
 * <p>
 * Not thread-safe.
 */
@EqualsAndHashCode
public final class NodeCollection {
	private final NavigableMap<NodeId, GeometryNode> nodesById = new TreeMap<>();

	public NodeCollection() { }

	public static NodeCollection of(GeometryNode... nodes) {
		NodeCollection result = new NodeCollection();
		for (GeometryNode node: nodes) {
			result.push(node);
		}
		return result;
	}

	/**
	 * Stores <code>node</code> under its own id, replacing whatever was there.
	 *
	 * @return the node that was replaced, if any
	 */
	public Optional<GeometryNode> push(GeometryNode node) {
		NodeId id = requireNonNull(node.id(), "node.id()");
		GeometryNode old = nodesById.put(id, node);
		if (old != null && old != node) {
			LOGGER.debug("push({}) replaced existing {}", id, old.getClass().getSimpleName());
		}
		return Optional.ofNullable(old);
	}

	/**
	 * @return the removed node, or {@link Optional#empty()} if there was none with that id
	 */
	public Optional<GeometryNode> remove(NodeId id) {
		GeometryNode removed = nodesById.remove(id);
		if (removed != null) {
			LOGGER.debug("remove({}) removed {}", id, removed.getClass().getSimpleName());
		}
		return Optional.ofNullable(removed);
	}

	public Optional<GeometryNode> get(NodeId id) {
		return Optional.ofNullable(nodesById.get(id));
	}

	/**
	 * @return the node with the given id if it is a <code>T</code>;
	 * otherwise {@link Optional#empty()}, whether the id is absent or the node has some other type.
	 */
	public <T extends GeometryNode> Optional<T> getTyped(NodeId id, Class<T> type) {
		return get(id).flatMap(node -> node.as(type));
	}

	public boolean contains(NodeId id) { return nodesById.containsKey(id); }

	public int size() { return nodesById.size(); }
	public boolean isEmpty() { return nodesById.isEmpty(); }

	/**
	 * @return the ids in ascending order, as a list unaffected by later changes to this collection
	 */
	public List<NodeId> ids() {
		return unmodifiableList(new ArrayList<>(nodesById.keySet()));
	}

	public Stream<GeometryNode> nodes() {
		return nodesById.values().stream();
	}

	public <T extends GeometryNode> Stream<T> nodesOfType(Class<T> type) {
		return nodes().flatMap(node -> node.as(type).stream());
	}

	public void forEach(BiConsumer<NodeId, ? super GeometryNode> action) {
		nodesById.forEach(action);
	}

	/**
	 * @return a read-only view in ascending id order
	 */
	public Map<NodeId, GeometryNode> asMap() {
		return unmodifiableMap(nodesById);
	}

	@Override
	public String toString() {
		return "NodeCollection" + nodesById.values();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(NodeCollection.class);
}
