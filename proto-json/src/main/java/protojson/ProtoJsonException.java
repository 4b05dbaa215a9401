package protojson;

import com.google.protobuf.Descriptors;

/**
 * Base of every error raised while converting between protobuf messages and JSON.
 *
 * <p> All subclasses abort the current decode or encode call; no partially built message is returned.
 * JSON syntax errors are not wrapped, they surface as {@link Json.SyntaxException}.
 *
 * @author Freeman
 */
public abstract class ProtoJsonException extends RuntimeException {

    private final String fieldName;

    protected ProtoJsonException(String message, String fieldName) {
        super(message);
        this.fieldName = fieldName;
    }

    protected ProtoJsonException(String message, String fieldName, Throwable cause) {
        super(message, cause);
        this.fieldName = fieldName;
    }

    /**
     * @return name of the field being converted, or {@code null} when the error is not tied to one field
     */
    public String getFieldName() {
        return fieldName;
    }

    /**
     * A required field is absent from the JSON input and declares no default value.
     */
    public static class JsonDataMissingException extends ProtoJsonException {
        public JsonDataMissingException(String fieldName) {
            super("Field " + fieldName + " is not set in json data", fieldName);
        }
    }

    /**
     * The field's schema type cannot be converted in the requested direction.
     */
    public static class UnsupportedFieldTypeException extends ProtoJsonException {
        private final Descriptors.FieldDescriptor.Type fieldType;

        public UnsupportedFieldTypeException(String fieldName, Descriptors.FieldDescriptor.Type fieldType) {
            super("ProtoType " + fieldType + " not supported yet (field: " + fieldName + ")", fieldName);
            this.fieldType = fieldType;
        }

        public Descriptors.FieldDescriptor.Type getFieldType() {
            return fieldType;
        }
    }

    /**
     * An enum symbol or number is unknown to the schema.
     */
    public static class ProtoEnumValueNotFoundException extends ProtoJsonException {
        private final Object value;

        public ProtoEnumValueNotFoundException(String fieldName, Object value) {
            super("Enum does not have a value " + value + " (field: " + fieldName + ")", fieldName);
            this.value = value;
        }

        public ProtoEnumValueNotFoundException(String message, String fieldName, Object value) {
            super(message, fieldName);
            this.value = value;
        }

        /**
         * @return the symbolic name ({@link String}) or number ({@link Integer}) that was not found
         */
        public Object getValue() {
            return value;
        }
    }

    /**
     * A value could not be converted to the field's representation: wrong JSON kind, unparsable text, or
     * out of range for the target type.
     */
    public static class FieldValueConversionException extends ProtoJsonException {
        public FieldValueConversionException(String message, String fieldName) {
            super(withField(message, fieldName), fieldName);
        }

        public FieldValueConversionException(String message, String fieldName, Throwable cause) {
            super(withField(message, fieldName), fieldName, cause);
        }

        private static String withField(String message, String fieldName) {
            return fieldName == null ? message : message + " (field: " + fieldName + ")";
        }
    }
}
