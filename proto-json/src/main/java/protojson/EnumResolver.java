package protojson;

import com.google.protobuf.Descriptors;
import com.google.protobuf.Descriptors.EnumValueDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.ProtocolMessageEnum;
import org.jspecify.annotations.Nullable;
import protojson.Json.JsonNumber;
import protojson.Json.JsonString;
import protojson.Json.JsonValue;
import protojson.ProtoJsonException.FieldValueConversionException;
import protojson.ProtoJsonException.ProtoEnumValueNotFoundException;

/**
 * Translates between an enum field's numbers and the symbolic names used in JSON.
 *
 * @author Freeman
 */
final class EnumResolver {

    private EnumResolver() {
        throw new UnsupportedOperationException();
    }

    /**
     * Resolve a JSON enum value to the field's enum value descriptor.
     *
     * <p> A string is a symbolic name looked up in {@code scope}; a number is looked up in the field's own
     * enum number table.
     *
     * @param field       enum field being decoded
     * @param value       JSON string or number
     * @param messageType type of the message being decoded
     * @param scope       where symbolic names are searched
     * @throws ProtoEnumValueNotFoundException if the name or number is unknown
     */
    static EnumValueDescriptor fromJson(
            FieldDescriptor field, JsonValue value, Descriptors.Descriptor messageType, EnumLookupScope scope) {
        if (value instanceof JsonString s) {
            return byName(field, s.value(), messageType, scope);
        }
        if (value instanceof JsonNumber) {
            int number = TypeCoercion.enumNumber(value, field.getName());
            var evd = field.getEnumType().findValueByNumber(number);
            if (evd == null) throw new ProtoEnumValueNotFoundException(field.getName(), number);
            return evd;
        }
        throw new FieldValueConversionException(
                "Cannot convert JSON " + Json.kindOf(value) + " to enum " + field.getEnumType().getFullName(),
                field.getName());
    }

    static EnumValueDescriptor byName(
            FieldDescriptor field, String name, Descriptors.Descriptor messageType, EnumLookupScope scope) {
        Integer number =
                switch (scope) {
                    case MESSAGE_TYPE -> numberOnMessageType(messageType, name);
                    case FIELD_TYPE -> {
                        var evd = field.getEnumType().findValueByName(name);
                        yield evd == null ? null : evd.getNumber();
                    }
                };
        if (number == null) throw new ProtoEnumValueNotFoundException(field.getName(), name);

        var evd = field.getEnumType().findValueByNumber(number);
        if (evd == null) {
            throw new ProtoEnumValueNotFoundException(
                    "Enum symbol " + name + " of " + messageType.getFullName() + " resolves to number " + number
                            + ", which " + field.getEnumType().getFullName() + " does not define (field: "
                            + field.getName() + ")",
                    field.getName(),
                    name);
        }
        return evd;
    }

    /**
     * Number of the first symbol called {@code name} among the enum types declared on {@code messageType}.
     */
    static @Nullable Integer numberOnMessageType(Descriptors.Descriptor messageType, String name) {
        for (var enumType : messageType.getEnumTypes()) {
            var evd = enumType.findValueByName(name);
            if (evd != null) return evd.getNumber();
        }
        return null;
    }

    /**
     * Symbolic name of an enum value read from a message.
     *
     * @param field enum field being encoded
     * @param value an {@link EnumValueDescriptor}, a generated {@link ProtocolMessageEnum} or a raw {@link Integer}
     * @throws ProtoEnumValueNotFoundException if the field's enum type defines no value with that number
     */
    static String nameOf(FieldDescriptor field, Object value) {
        int number;
        if (value instanceof EnumValueDescriptor evd) number = evd.getNumber();
        else if (value instanceof ProtocolMessageEnum pme) number = pme.getNumber();
        else number = (Integer) value;

        // values outside the number table (e.g. open enum values) are not in findValueByNumber
        var known = field.getEnumType().findValueByNumber(number);
        if (known == null) throw new ProtoEnumValueNotFoundException(field.getName(), number);
        return known.getName();
    }
}
