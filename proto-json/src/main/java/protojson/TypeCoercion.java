package protojson;

import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.FieldDescriptor;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Base64;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import protojson.Json.JsonBoolean;
import protojson.Json.JsonNumber;
import protojson.Json.JsonString;
import protojson.Json.JsonValue;
import protojson.ProtoJsonException.FieldValueConversionException;
import protojson.ProtoJsonException.UnsupportedFieldTypeException;

/**
 * Static mapping from protobuf scalar field type to the conversion between a loosely typed JSON scalar and
 * the value protobuf's reflection API stores for that type.
 *
 * <p> Enum and message fields are not in the table, see {@link EnumResolver} and {@link MessageEncoder}.
 *
 * @author Freeman
 */
final class TypeCoercion {

    private static final BigInteger INT32_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT32_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger INT64_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger INT64_MAX = BigInteger.valueOf(Long.MAX_VALUE);
    private static final BigInteger UINT32_MAX = BigInteger.ONE.shiftLeft(32).subtract(BigInteger.ONE);
    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    // 2^64 has 20 digits
    private static final int MAX_INTEGRAL_DIGITS = 20;

    /**
     * One row of the table.
     */
    interface Scalar {
        Object fromJson(JsonValue value, String fieldName);

        JsonValue toJson(Object value);
    }

    private TypeCoercion() {
        throw new UnsupportedOperationException();
    }

    static boolean supports(FieldDescriptor.Type type) {
        return TABLE.containsKey(type);
    }

    /**
     * Cast a JSON scalar to the representation of {@code field}'s type.
     *
     * @throws UnsupportedFieldTypeException if the field's type is not a scalar type
     * @throws FieldValueConversionException if the value has the wrong kind or is out of range
     */
    static Object fromJson(FieldDescriptor field, JsonValue value) {
        return row(field).fromJson(value, field.getName());
    }

    /**
     * Represent a value read from a message as a JSON scalar.
     *
     * @throws UnsupportedFieldTypeException if the field's type is not a scalar type
     */
    static JsonValue toJson(FieldDescriptor field, Object value) {
        return row(field).toJson(value);
    }

    /**
     * Pre-resolution form of an enum value given as a JSON number or numeric string.
     */
    static int enumNumber(JsonValue value, String fieldName) {
        return (Integer) INT32.fromJson(value, fieldName);
    }

    private static Scalar row(FieldDescriptor field) {
        Scalar scalar = TABLE.get(field.getType());
        if (scalar == null) throw new UnsupportedFieldTypeException(field.getName(), field.getType());
        return scalar;
    }

    private static Map<FieldDescriptor.Type, Scalar> buildTable() {
        var table = new EnumMap<FieldDescriptor.Type, Scalar>(FieldDescriptor.Type.class);
        table.put(FieldDescriptor.Type.BOOL, BOOL);
        table.put(FieldDescriptor.Type.FLOAT, FLOAT);
        table.put(FieldDescriptor.Type.DOUBLE, DOUBLE);
        table.put(FieldDescriptor.Type.INT32, INT32);
        table.put(FieldDescriptor.Type.SINT32, INT32);
        table.put(FieldDescriptor.Type.SFIXED32, INT32);
        table.put(FieldDescriptor.Type.UINT32, UINT32);
        table.put(FieldDescriptor.Type.FIXED32, UINT32);
        table.put(FieldDescriptor.Type.INT64, INT64);
        table.put(FieldDescriptor.Type.SINT64, INT64);
        table.put(FieldDescriptor.Type.SFIXED64, INT64);
        table.put(FieldDescriptor.Type.UINT64, UINT64);
        table.put(FieldDescriptor.Type.FIXED64, UINT64);
        table.put(FieldDescriptor.Type.STRING, STRING);
        table.put(FieldDescriptor.Type.BYTES, BYTES);
        return Collections.unmodifiableMap(table);
    }

    // ============================================================
    // Rows
    // ============================================================

    static final Scalar BOOL = new Scalar() {
        @Override
        public Object fromJson(JsonValue value, String fieldName) {
            if (value instanceof JsonBoolean b) return b.value();
            if (value instanceof JsonString s) {
                if (s.value().equalsIgnoreCase("true")) return true;
                if (s.value().equalsIgnoreCase("false")) return false;
                throw new FieldValueConversionException(
                        "Cannot convert string to bool: expected 'true' or 'false', got '" + s.value() + "'",
                        fieldName);
            }
            if (value instanceof JsonNumber) {
                BigInteger i = integral(value, fieldName, "bool");
                if (i.signum() == 0) return false;
                if (i.equals(BigInteger.ONE)) return true;
                throw new FieldValueConversionException(
                        "Cannot convert number to bool: expected 0 or 1, got " + i, fieldName);
            }
            throw wrongKind(value, fieldName, "bool");
        }

        @Override
        public JsonValue toJson(Object value) {
            return new JsonBoolean((Boolean) value);
        }
    };

    static final Scalar FLOAT = new Scalar() {
        @Override
        public Object fromJson(JsonValue value, String fieldName) {
            return (float) floating(value, fieldName, "float");
        }

        @Override
        public JsonValue toJson(Object value) {
            float f = (Float) value;
            return Float.isFinite(f) ? new JsonNumber(f) : new JsonString(Float.toString(f));
        }
    };

    static final Scalar DOUBLE = new Scalar() {
        @Override
        public Object fromJson(JsonValue value, String fieldName) {
            return floating(value, fieldName, "double");
        }

        @Override
        public JsonValue toJson(Object value) {
            double d = (Double) value;
            return Double.isFinite(d) ? new JsonNumber(d) : new JsonString(Double.toString(d));
        }
    };

    static final Scalar INT32 = new Scalar() {
        @Override
        public Object fromJson(JsonValue value, String fieldName) {
            return inRange(integral(value, fieldName, "int32"), INT32_MIN, INT32_MAX, fieldName, "int32")
                    .intValue();
        }

        @Override
        public JsonValue toJson(Object value) {
            return new JsonNumber((Integer) value);
        }
    };

    // unsigned 32-bit values are stored as the int with the same bit pattern
    static final Scalar UINT32 = new Scalar() {
        @Override
        public Object fromJson(JsonValue value, String fieldName) {
            return (int) inRange(integral(value, fieldName, "uint32"), BigInteger.ZERO, UINT32_MAX, fieldName, "uint32")
                    .longValue();
        }

        @Override
        public JsonValue toJson(Object value) {
            return new JsonNumber(Integer.toUnsignedLong((Integer) value));
        }
    };

    static final Scalar INT64 = new Scalar() {
        @Override
        public Object fromJson(JsonValue value, String fieldName) {
            return inRange(integral(value, fieldName, "int64"), INT64_MIN, INT64_MAX, fieldName, "int64")
                    .longValue();
        }

        @Override
        public JsonValue toJson(Object value) {
            return new JsonNumber((Long) value);
        }
    };

    // unsigned 64-bit values are stored as the long with the same bit pattern
    static final Scalar UINT64 = new Scalar() {
        @Override
        public Object fromJson(JsonValue value, String fieldName) {
            return inRange(integral(value, fieldName, "uint64"), BigInteger.ZERO, UINT64_MAX, fieldName, "uint64")
                    .longValue();
        }

        @Override
        public JsonValue toJson(Object value) {
            long l = (Long) value;
            if (l >= 0) return new JsonNumber(l);
            return new JsonNumber(new BigInteger(Long.toUnsignedString(l)));
        }
    };

    static final Scalar STRING = new Scalar() {
        @Override
        public Object fromJson(JsonValue value, String fieldName) {
            if (value instanceof JsonString || value instanceof JsonNumber || value instanceof JsonBoolean) {
                return Json.toText(value);
            }
            throw wrongKind(value, fieldName, "string");
        }

        @Override
        public JsonValue toJson(Object value) {
            return new JsonString((String) value);
        }
    };

    static final Scalar BYTES = new Scalar() {
        @Override
        public Object fromJson(JsonValue value, String fieldName) {
            if (!(value instanceof JsonString s)) throw wrongKind(value, fieldName, "bytes");
            try {
                return ByteString.copyFrom(Base64.getDecoder().decode(s.value()));
            } catch (IllegalArgumentException e) {
                try {
                    return ByteString.copyFrom(Base64.getUrlDecoder().decode(s.value()));
                } catch (IllegalArgumentException urlSafe) {
                    throw new FieldValueConversionException(
                            "Cannot decode base64 bytes from string: '" + s.value() + "'", fieldName, e);
                }
            }
        }

        @Override
        public JsonValue toJson(Object value) {
            return new JsonString(Base64.getEncoder().encodeToString(((ByteString) value).toByteArray()));
        }
    };

    // after the rows: static initializers run in textual order
    private static final Map<FieldDescriptor.Type, Scalar> TABLE = buildTable();

    // ============================================================
    // Helpers
    // ============================================================

    static double floating(JsonValue value, String fieldName, String typeName) {
        if (value instanceof JsonNumber n) {
            Number number = n.value();
            if (number instanceof Double || number instanceof Float) return number.doubleValue();
            return decimal(value, fieldName, typeName).doubleValue();
        }
        if (value instanceof JsonString s) {
            return switch (s.value()) {
                case "NaN" -> Double.NaN;
                case "Infinity" -> Double.POSITIVE_INFINITY;
                case "-Infinity" -> Double.NEGATIVE_INFINITY;
                default -> decimal(value, fieldName, typeName).doubleValue();
            };
        }
        if (value instanceof JsonBoolean b) return b.value() ? 1d : 0d;
        throw wrongKind(value, fieldName, typeName);
    }

    /**
     * Integral part of a number, numeric string or boolean, truncated toward zero.
     */
    static BigInteger integral(JsonValue value, String fieldName, String typeName) {
        if (value instanceof JsonBoolean b) return b.value() ? BigInteger.ONE : BigInteger.ZERO;
        if (value instanceof JsonNumber n) {
            if (n.value() instanceof Integer || n.value() instanceof Long) return BigInteger.valueOf(n.value().longValue());
            if (n.value() instanceof BigInteger bi) return bi;
        }
        BigDecimal d = decimal(value, fieldName, typeName);
        // digits before the decimal point, bounded before toBigInteger() scales by a power of ten
        long digits = (long) d.precision() - d.scale();
        if (d.signum() == 0 || digits <= 0) return BigInteger.ZERO;
        if (digits > MAX_INTEGRAL_DIGITS) {
            throw new FieldValueConversionException("Value " + d + " out of range for " + typeName, fieldName);
        }
        try {
            return d.toBigInteger();
        } catch (ArithmeticException e) {
            throw new FieldValueConversionException("Value " + d + " out of range for " + typeName, fieldName, e);
        }
    }

    static BigDecimal decimal(JsonValue value, String fieldName, String typeName) {
        if (value instanceof JsonNumber n) {
            Number number = n.value();
            if (number instanceof BigDecimal bd) return bd;
            if (number instanceof BigInteger bi) return new BigDecimal(bi);
            double d = number.doubleValue();
            if (!Double.isFinite(d))
                throw new FieldValueConversionException("Cannot convert " + d + " to " + typeName, fieldName);
            return new BigDecimal(number.toString());
        }
        if (value instanceof JsonString s) {
            try {
                return new BigDecimal(s.value().trim());
            } catch (NumberFormatException e) {
                throw new FieldValueConversionException(
                        "Cannot parse number from string: '" + s.value() + "' for type " + typeName, fieldName, e);
            }
        }
        throw wrongKind(value, fieldName, typeName);
    }

    static BigInteger inRange(BigInteger i, BigInteger min, BigInteger max, String fieldName, String typeName) {
        if (i.compareTo(min) < 0 || i.compareTo(max) > 0) {
            throw new FieldValueConversionException(
                    "Value " + i + " out of range for " + typeName + " [" + min + ", " + max + "]", fieldName);
        }
        return i;
    }

    static FieldValueConversionException wrongKind(JsonValue value, String fieldName, String typeName) {
        return new FieldValueConversionException(
                "Cannot convert JSON " + Json.kindOf(value) + " to " + typeName, fieldName);
    }
}
