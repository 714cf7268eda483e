package io.vena.geonode.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.databind.type.LogicalType;
import io.vena.geonode.GeometryNode;
import io.vena.geonode.NodeCollection;
import io.vena.geonode.NodeVariantRegistry;
import io.vena.geonode.exceptions.MalformedFieldsException;
import io.vena.geonode.exceptions.SerializationFailureException;
import io.vena.geonode.exceptions.UnknownVariantException;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map.Entry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link NodeCollection}s to and from snapshots: Jackson {@link JsonNode}
 * trees in the format described by {@link NodeJacksonPlugin}.
 *
 * <p>
 * Every operation either succeeds completely or throws one of the
 * {@link io.vena.geonode.exceptions.SnapshotException} subclasses:
 *
 * <ul>
 *     <li>
 *         {@link UnknownVariantException} when a tag isn't in the registry,
 *     </li>
 *     <li>
 *         {@link MalformedFieldsException} when the data is otherwise unacceptable, and
 *     </li>
 *     <li>
 *         {@link SerializationFailureException} when a collection can't be rendered.
 *     </li>
 * </ul>
 *
 * Instances are immutable and can be shared.
 */
public final class SnapshotCodec {
	@Getter private final NodeVariantRegistry registry;
	@Getter private final SnapshotSettings settings;
	private final ObjectMapper mapper;
	private final ObjectWriter textWriter;

	public SnapshotCodec(NodeVariantRegistry registry, SnapshotSettings settings) {
		this.registry = registry;
		this.settings = settings;
		JsonFactory factory = JsonFactory.builder()
			.enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
			.build();
		this.mapper = new ObjectMapper(factory)
			.registerModule(new NodeJacksonPlugin().moduleFor(registry))
			.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
			.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
		// Coordinates must be JSON numbers; "1.5" is not a coordinate
		mapper.coercionConfigFor(LogicalType.Float)
			.setCoercion(CoercionInputShape.String, CoercionAction.Fail);
		this.textWriter = settings.isIndentOutput()
			? mapper.writerWithDefaultPrettyPrinter()
			: mapper.writer();
	}

	public SnapshotCodec(NodeVariantRegistry registry) {
		this(registry, SnapshotSettings.defaults());
	}

	public static SnapshotCodec standard() {
		return new SnapshotCodec(NodeVariantRegistry.standard());
	}

	public JsonNode toSnapshot(NodeCollection collection) {
		JsonNode result = render(collection, "collection");
		LOGGER.debug("Rendered snapshot of {} node(s)", collection.size());
		return result;
	}

	public JsonNode nodeToSnapshot(GeometryNode node) {
		if (!registry.isRegistered(node.getClass())) {
			throw new SerializationFailureException("Node " + node.id() + " has unregistered class " + node.getClass().getName());
		}
		return render(node, "node " + node.id());
	}

	public String toJson(NodeCollection collection) {
		JsonNode snapshot = toSnapshot(collection);
		try {
			return textWriter.writeValueAsString(snapshot);
		} catch (JsonProcessingException e) {
			throw new SerializationFailureException("Unable to write snapshot as JSON: " + e.getOriginalMessage(), e);
		}
	}

	/**
	 * @return a new collection holding one concrete node per entry of <code>snapshot</code>
	 */
	public NodeCollection fromSnapshot(JsonNode snapshot) {
		NodeCollection result = read(snapshot, NodeCollection.class);
		LOGGER.debug("Read snapshot of {} node(s)", result.size());
		return result;
	}

	public GeometryNode nodeFromSnapshot(JsonNode snapshot) {
		return read(snapshot, GeometryNode.class);
	}

	public NodeCollection fromJson(String json) {
		JsonNode snapshot;
		try {
			snapshot = mapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw new MalformedFieldsException("Snapshot is not valid JSON: " + e.getOriginalMessage(), e);
		}
		return fromSnapshot(snapshot);
	}

	private JsonNode render(Object value, String description) {
		JsonNode result;
		try {
			result = mapper.valueToTree(value);
		} catch (IllegalArgumentException e) {
			throw new SerializationFailureException("Unable to render " + description + ": " + e.getMessage(), e);
		}
		if (settings.isRejectNonFiniteNumbers()) {
			checkFinite(result, "");
		}
		return result;
	}

	private <T> T read(JsonNode snapshot, Class<T> type) {
		if (snapshot == null || !snapshot.isObject()) {
			throw new MalformedFieldsException("Expected a JSON object for " + type.getSimpleName() + "; found " + describe(snapshot));
		}
		try {
			return mapper.readerFor(type).readValue(snapshot);
		} catch (IOException e) {
			InvalidTypeIdException typeIdProblem = invalidTypeIdCause(e);
			if (typeIdProblem == null) {
				throw new MalformedFieldsException("Unable to read " + type.getSimpleName() + ": " + e.getMessage(), e);
			} else if (typeIdProblem.getTypeId() == null) {
				throw new MalformedFieldsException("Missing \"" + GeometryNode.TAG_PROPERTY + "\" tag: " + e.getMessage(), e);
			} else if (registry.variant(typeIdProblem.getTypeId()).isPresent()) {
				// A known tag where a different type is required, like a Rectangle as an anchor
				throw new MalformedFieldsException("Unexpected \"" + typeIdProblem.getTypeId() + "\" tag: " + e.getMessage(), e);
			} else {
				throw new UnknownVariantException(typeIdProblem.getTypeId(), e);
			}
		}
	}

	/**
	 * @return the {@link InvalidTypeIdException} in <code>e</code>'s cause chain, or null
	 */
	private static InvalidTypeIdException invalidTypeIdCause(Throwable e) {
		for (Throwable t = e; t != null; t = (t.getCause() == t) ? null : t.getCause()) {
			if (t instanceof InvalidTypeIdException i) {
				return i;
			}
		}
		return null;
	}

	private static void checkFinite(JsonNode node, String path) {
		if (node.isFloatingPointNumber()) {
			if (!Double.isFinite(node.doubleValue())) {
				throw new SerializationFailureException("Non-finite number " + node.doubleValue() + " at \"" + path + "\"");
			}
		} else if (node.isObject()) {
			for (Iterator<Entry<String, JsonNode>> iter = node.fields(); iter.hasNext(); ) {
				Entry<String, JsonNode> field = iter.next();
				checkFinite(field.getValue(), path + "/" + field.getKey());
			}
		} else if (node.isArray()) {
			for (int i = 0; i < node.size(); i++) {
				checkFinite(node.get(i), path + "/" + i);
			}
		}
	}

	private static String describe(JsonNode snapshot) {
		return snapshot == null ? "nothing" : snapshot.getNodeType().toString();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotCodec.class);
}
