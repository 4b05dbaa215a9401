package protojson;

import com.google.protobuf.Descriptors;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.Message;
import com.google.protobuf.MessageOrBuilder;
import java.util.Objects;
import lombok.Builder;
import protojson.Json.JsonObject;
import protojson.Json.JsonValue;

/**
 * Converts protobuf messages to and from JSON without per-field marshaling code.
 *
 * <p> Decoding fills every defaulted field and rejects input missing a required field; encoding writes every
 * field in declaration order, defaults included. Enum values travel as their symbolic names.
 *
 * @author <a href="mailto:llw599502537@gmail.com">Freeman</a>
 */
public final class ProtoJson {

    private static final Converter defaultConverter = Converter.builder().build();

    private ProtoJson() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Decode JSON text into a generated message class.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Node node = ProtoJson.decode("{\"nodeid\":\"host1\",\"state\":\"AVAILABLE\"}", Node.class);
     * // -> nodeid: "host1" state: AVAILABLE
     * }</pre>
     *
     * @param json         JSON object text, not {@code null}
     * @param messageClass generated message class, not {@code null}
     * @param <T>          message type
     * @return populated message
     */
    public static <T extends Message> T decode(String json, Class<T> messageClass) {
        return defaultConverter.decode(json, messageClass);
    }

    /**
     * Decode JSON text into a {@link DynamicMessage} of the given type.
     *
     * @param json       JSON object text, not {@code null}
     * @param descriptor message type, not {@code null}
     * @return populated message
     */
    public static DynamicMessage decode(String json, Descriptors.Descriptor descriptor) {
        return defaultConverter.decode(json, descriptor);
    }

    /**
     * Encode a message as compact JSON text.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * String json = ProtoJson.encode(node);
     * // -> {"state":"AVAILABLE","nodeid":"host1"}
     * }</pre>
     *
     * @param message message or builder, not {@code null}
     * @return non-null JSON text
     */
    public static String encode(MessageOrBuilder message) {
        return defaultConverter.encode(message);
    }

    /**
     * Encode a message as a JSON tree, without serializing it.
     *
     * @param message message or builder, not {@code null}
     * @return one member per declared field, in declaration order
     */
    public static JsonObject encodeToTree(MessageOrBuilder message) {
        return defaultConverter.encodeToTree(message);
    }

    // ============================================================
    // Converter
    // ============================================================

    /**
     * Immutable, thread-safe converter; message instances passed in must not be mutated concurrently.
     *
     * <pre>{@code
     * var converter = ProtoJson.Converter.builder()
     *         .enumLookupScope(EnumLookupScope.FIELD_TYPE)
     *         .build();
     * }</pre>
     */
    @Builder(toBuilder = true)
    public static final class Converter {

        /**
         * Where symbolic enum names are looked up on decode, {@link EnumLookupScope#MESSAGE_TYPE} by default.
         */
        @Builder.Default
        private final EnumLookupScope enumLookupScope = EnumLookupScope.MESSAGE_TYPE;

        public EnumLookupScope enumLookupScope() {
            return enumLookupScope;
        }

        public <T extends Message> T decode(String json, Class<T> messageClass) {
            Objects.requireNonNull(json, "json");
            Objects.requireNonNull(messageClass, "messageClass");
            return messageClass.cast(decoder().decode(Json.parse(json), newBuilder(messageClass)));
        }

        public DynamicMessage decode(String json, Descriptors.Descriptor descriptor) {
            Objects.requireNonNull(json, "json");
            Objects.requireNonNull(descriptor, "descriptor");
            return (DynamicMessage) decoder().decode(Json.parse(json), DynamicMessage.newBuilder(descriptor));
        }

        /**
         * Decode JSON text into a new message of the same type as {@code prototype}.
         */
        public <T extends Message> T decode(String json, T prototype) {
            Objects.requireNonNull(json, "json");
            return decodeTree(Json.parse(json), prototype);
        }

        /**
         * Decode an already parsed tree into a new message of the same type as {@code prototype}; the prototype
         * itself is not modified.
         */
        @SuppressWarnings("unchecked")
        public <T extends Message> T decodeTree(JsonValue tree, T prototype) {
            Objects.requireNonNull(tree, "tree");
            Objects.requireNonNull(prototype, "prototype");
            return (T) decoder().decode(tree, prototype.newBuilderForType());
        }

        public String encode(MessageOrBuilder message) {
            return Json.stringify(encodeToTree(message));
        }

        public JsonObject encodeToTree(MessageOrBuilder message) {
            Objects.requireNonNull(message, "message");
            return new MessageEncoder().encodeToTree(message);
        }

        private MessageDecoder decoder() {
            return new MessageDecoder(enumLookupScope);
        }
    }

    static Message.Builder newBuilder(Class<?> messageClass) {
        try {
            var method = messageClass.getMethod("newBuilder");
            return (Message.Builder) method.invoke(null);
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new ProtoJsonException.FieldValueConversionException(
                    "Cannot create protobuf builder for " + messageClass.getName(), null, e);
        }
    }
}
