package protojson;

import com.google.protobuf.Descriptors;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.MessageOrBuilder;
import java.util.function.Function;
import protojson.Json.JsonString;
import protojson.Json.JsonValue;
import protojson.ProtoJsonException.UnsupportedFieldTypeException;

/**
 * Converts one value of one field, in either direction.
 *
 * <p> Repeated fields are handled element by element by the caller.
 *
 * @author Freeman
 */
final class FieldValueConverter {

    private FieldValueConverter() {
        throw new UnsupportedOperationException();
    }

    /**
     * JSON element to the value stored by {@code Message.Builder.setField} / {@code addRepeatedField}.
     *
     * @throws UnsupportedFieldTypeException for message and group fields, embedded messages are not decoded
     */
    static Object fromJson(
            FieldDescriptor field, JsonValue value, Descriptors.Descriptor messageType, EnumLookupScope scope) {
        var type = field.getType();
        if (type == FieldDescriptor.Type.ENUM) return EnumResolver.fromJson(field, value, messageType, scope);
        if (TypeCoercion.supports(type)) return TypeCoercion.fromJson(field, value);
        throw new UnsupportedFieldTypeException(field.getName(), type);
    }

    /**
     * Value read by {@code MessageOrBuilder.getField} (one element for repeated fields) to JSON.
     *
     * @param embedded encodes an embedded message to its tree
     * @throws UnsupportedFieldTypeException for group fields
     */
    static JsonValue toJson(
            FieldDescriptor field, Object value, Function<MessageOrBuilder, ? extends JsonValue> embedded) {
        var type = field.getType();
        if (type == FieldDescriptor.Type.ENUM) return new JsonString(EnumResolver.nameOf(field, value));
        if (TypeCoercion.supports(type)) return TypeCoercion.toJson(field, value);
        if (type == FieldDescriptor.Type.MESSAGE) return embedded.apply((MessageOrBuilder) value);
        throw new UnsupportedFieldTypeException(field.getName(), type);
    }
}
