package protojson;

import com.google.protobuf.Descriptors;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.MessageOrBuilder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import protojson.Json.JsonArray;
import protojson.Json.JsonNull;
import protojson.Json.JsonObject;
import protojson.Json.JsonValue;

/**
 * Builds the JSON tree of a message: one member per declared field, in declaration order, including fields
 * at their default value.
 *
 * @author Freeman
 */
final class MessageEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageEncoder.class);

    MessageEncoder() {}

    JsonObject encodeToTree(MessageOrBuilder message) {
        LOGGER.debug("Encoding {} to JSON", message.getDescriptorForType().getFullName());
        return encode(message, new ArrayDeque<>());
    }

    /**
     * @param path message types currently being encoded, innermost first
     */
    private JsonObject encode(MessageOrBuilder message, Deque<Descriptors.Descriptor> path) {
        var descriptor = message.getDescriptorForType();
        path.push(descriptor);
        Map<String, JsonValue> members = new LinkedHashMap<>();
        for (var field : descriptor.getFields()) {
            members.put(field.getName(), encodeField(message, field, path));
        }
        path.pop();
        return new JsonObject(members);
    }

    private JsonValue encodeField(MessageOrBuilder message, FieldDescriptor field, Deque<Descriptors.Descriptor> path) {
        Object value = message.getField(field);
        if (field.isRepeated()) {
            List<?> elements = (List<?>) value;
            List<JsonValue> array = new ArrayList<>(elements.size());
            for (Object element : elements) {
                array.add(FieldValueConverter.toJson(field, element, m -> encode(m, path)));
            }
            return new JsonArray(array);
        }
        // the default instance of a recursive type would recurse forever
        if (field.getType() == FieldDescriptor.Type.MESSAGE
                && !message.hasField(field)
                && path.contains(field.getMessageType())) {
            LOGGER.trace(
                    "Writing null for unset {}.{}, {} is already being encoded",
                    message.getDescriptorForType().getFullName(),
                    field.getName(),
                    field.getMessageType().getFullName());
            return new JsonNull();
        }
        return FieldValueConverter.toJson(field, value, m -> encode(m, path));
    }
}
