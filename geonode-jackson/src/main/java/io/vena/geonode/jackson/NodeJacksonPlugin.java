package io.vena.geonode.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.jsontype.TypeSerializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.Serializers;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.vena.geonode.GeometryNode;
import io.vena.geonode.NodeCollection;
import io.vena.geonode.NodeId;
import io.vena.geonode.NodeVariantRegistry;
import java.io.IOException;
import java.util.Map.Entry;

import static com.fasterxml.jackson.core.JsonToken.END_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.START_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.VALUE_STRING;

/**
 * Provides JSON serialization/deserialization of {@link NodeCollection}s using Jackson.
 *
 * <p>
 * A collection is written as a JSON object with one field per node, named by the
 * node's {@link NodeId} and holding the node's tagged representation. Fields are
 * written in ascending id order. Nodes are tagged with the names registered in the
 * {@link NodeVariantRegistry} passed to {@link #moduleFor}; classes outside the
 * registry can be neither written nor read.
 *
 * @see SnapshotCodec
 */
public final class NodeJacksonPlugin {

	public static final String MODULE_NAME = "geonode";

	public Module moduleFor(NodeVariantRegistry registry) {
		return new SimpleModule(MODULE_NAME) {
			@Override
			public void setupModule(SetupContext context) {
				super.setupModule(context);
				context.registerSubtypes(namedTypes(registry));
				context.addSerializers(new NodeSerializers(registry));
				context.addDeserializers(new NodeDeserializers());
			}
		};
	}

	private static NamedType[] namedTypes(NodeVariantRegistry registry) {
		return registry.variants().stream()
			.map(v -> new NamedType(v.type(), v.tag()))
			.toArray(NamedType[]::new);
	}

	private static final class NodeSerializers extends Serializers.Base {
		private final NodeVariantRegistry registry;

		NodeSerializers(NodeVariantRegistry registry) {
			this.registry = registry;
		}

		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (NodeId.class.isAssignableFrom(theClass)) {
				return nodeIdSerializer();
			} else if (NodeCollection.class.isAssignableFrom(theClass)) {
				return nodeCollectionSerializer();
			} else {
				return null;
			}
		}

		private JsonSerializer<NodeId> nodeIdSerializer() {
			return new JsonSerializer<NodeId>() {
				@Override
				public void serialize(NodeId value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeString(value.toString());
				}
			};
		}

		private JsonSerializer<NodeCollection> nodeCollectionSerializer() {
			return new JsonSerializer<NodeCollection>() {
				@Override
				public void serialize(NodeCollection value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					TypeSerializer typeSerializer = serializers.findTypeSerializer(NODE_TYPE);
					gen.writeStartObject();
					for (Entry<NodeId, GeometryNode> entry: value.asMap().entrySet()) {
						GeometryNode node = entry.getValue();
						if (!registry.isRegistered(node.getClass())) {
							throw JsonMappingException.from(gen, "Node " + entry.getKey() + " has unregistered class " + node.getClass().getName());
						}
						gen.writeFieldName(entry.getKey().toString());
						serializers
							.findValueSerializer(node.getClass())
							.serializeWithType(node, gen, serializers, typeSerializer);
					}
					gen.writeEndObject();
				}
			};
		}
	}

	private static final class NodeDeserializers extends Deserializers.Base {
		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (NodeId.class.isAssignableFrom(theClass)) {
				return nodeIdDeserializer();
			} else if (NodeCollection.class.isAssignableFrom(theClass)) {
				return nodeCollectionDeserializer();
			} else {
				return null;
			}
		}

		private JsonDeserializer<NodeId> nodeIdDeserializer() {
			return new NodeDeserializer<NodeId>() {
				@Override
				public NodeId deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					if (p.currentToken() != VALUE_STRING) {
						throw MismatchedInputException.from(p, NodeId.class, "Expected NodeId string; found " + p.currentToken());
					}
					return parseNodeId(p.getText(), ctxt);
				}
			};
		}

		private JsonDeserializer<NodeCollection> nodeCollectionDeserializer() {
			return new NodeDeserializer<NodeCollection>() {
				@Override
				public NodeCollection deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					JsonDeserializer<Object> nodeDeserializer = ctxt.findRootValueDeserializer(NODE_TYPE);
					NodeCollection result = new NodeCollection();

					expect(START_OBJECT, p);
					while (p.nextToken() != END_OBJECT) {
						p.nextValue();
						String fieldName = p.currentName();
						NodeId key = parseNodeId(fieldName, ctxt);
						if (result.contains(key)) {
							throw MismatchedInputException.from(p, NodeCollection.class, "Duplicate entry \"" + fieldName + "\"");
						}
						GeometryNode node = (GeometryNode) nodeDeserializer.deserialize(p, ctxt);
						if (!key.equals(node.id())) {
							throw MismatchedInputException.from(p, NodeCollection.class,
								"Entry \"" + fieldName + "\" holds a node whose id is \"" + node.id() + "\"");
						}
						result.push(node);
					}
					return result;
				}
			};
		}
	}

	/**
	 * Common properties all our deserializers have.
	 */
	private abstract static class NodeDeserializer<T> extends JsonDeserializer<T> {
		@Override public boolean isCachable() { return true; }
	}

	private static NodeId parseNodeId(String text, DeserializationContext ctxt) throws IOException {
		try {
			return NodeId.from(text);
		} catch (IllegalArgumentException e) {
			throw ctxt.weirdStringException(text, NodeId.class, e.getMessage());
		}
	}

	private static void expect(JsonToken expected, JsonParser p) throws IOException {
		if (p.currentToken() != expected) {
			throw MismatchedInputException.from(p, (Class<?>) null, "Expected " + expected + "; found " + p.currentToken());
		}
	}

	private static final JavaType NODE_TYPE = TypeFactory.defaultInstance().constructType(GeometryNode.class);

}
