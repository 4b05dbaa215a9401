package protojson;

import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Message;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import protojson.Json.JsonArray;
import protojson.Json.JsonObject;
import protojson.Json.JsonValue;
import protojson.ProtoJsonException.FieldValueConversionException;
import protojson.ProtoJsonException.JsonDataMissingException;

/**
 * Populates an empty message builder from a JSON object, field descriptor by field descriptor.
 *
 * <p> Every field with a declared default is explicitly set, present in the input or not, so two inputs that
 * differ only in which defaulted fields they spell out decode to equal messages. JSON members the message
 * type does not declare are ignored.
 *
 * @author Freeman
 */
final class MessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageDecoder.class);

    private final EnumLookupScope enumLookupScope;

    MessageDecoder(EnumLookupScope enumLookupScope) {
        this.enumLookupScope = enumLookupScope;
    }

    /**
     * @param tree    parsed JSON, must be an object
     * @param builder fresh builder of the target type, never returned to the caller on error
     * @return the populated message, built without a further initialization check
     * @throws JsonDataMissingException      if a required field is absent and has no default
     * @throws FieldValueConversionException if the tree is not an object or a value has the wrong shape
     */
    Message decode(JsonValue tree, Message.Builder builder) {
        var descriptor = builder.getDescriptorForType();
        Map<String, JsonValue> members = expectObject(tree, descriptor.getFullName()).value();
        LOGGER.debug("Decoding {} from JSON object with {} members", descriptor.getFullName(), members.size());

        for (var field : descriptor.getFields()) {
            if (members.containsKey(field.getName())) {
                JsonValue value = members.get(field.getName());
                if (field.isRepeated()) {
                    for (var element : expectArray(value, field).value()) {
                        builder.addRepeatedField(field, convert(field, element, builder));
                    }
                } else {
                    builder.setField(field, convert(field, value, builder));
                }
            } else if (field.hasDefaultValue()) {
                // set explicitly: an unset required field with a default is otherwise ambiguous
                LOGGER.trace("Filling default for {}.{}", descriptor.getFullName(), field.getName());
                builder.setField(field, field.getDefaultValue());
            } else if (field.isRequired()) {
                throw new JsonDataMissingException(field.getName());
            }
        }
        return builder.buildPartial();
    }

    private Object convert(FieldDescriptor field, JsonValue value, Message.Builder builder) {
        return FieldValueConverter.fromJson(field, value, builder.getDescriptorForType(), enumLookupScope);
    }

    static JsonObject expectObject(JsonValue value, String typeName) {
        if (value instanceof JsonObject obj) return obj;
        throw new FieldValueConversionException(
                "Expected JSON object for protobuf message " + typeName + ", but got " + Json.kindOf(value), null);
    }

    static JsonArray expectArray(JsonValue value, FieldDescriptor field) {
        if (value instanceof JsonArray arr) return arr;
        throw new FieldValueConversionException(
                "Expected JSON array for repeated field, but got " + Json.kindOf(value), field.getName());
    }
}
