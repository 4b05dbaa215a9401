package protojson;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON text codec working on a {@link JsonValue} tree.
 *
 * <p> {@link #parse(String)} turns text into a tree, {@link #stringify(JsonValue)} turns a tree back into
 * compact text. Object members keep their insertion order in both directions.
 *
 * @author Freeman
 */
public final class Json {

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Parse JSON text into a tree.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * JsonValue tree = Json.parse("{\"nodeid\":\"host1\",\"tags\":[1,2]}");
     * // -> JsonObject{nodeid=JsonString[host1], tags=JsonArray[...]}
     * }</pre>
     *
     * @param json JSON text, not {@code null}
     * @return the parsed tree, never {@code null} ({@code "null"} yields {@link JsonNull})
     * @throws SyntaxException if the text is not valid JSON
     */
    public static JsonValue parse(String json) {
        Objects.requireNonNull(json, "json");
        var lexer = new Lexer(json);
        JsonValue v = parseValue(lexer);
        if (lexer.current() != Token.EOF) throw error(lexer, "Trailing characters after top-level value");
        return v;
    }

    /**
     * Serialize a tree to compact JSON text, object members in insertion order.
     *
     * @param value tree to write, not {@code null}
     * @return non-null JSON text
     * @throws WriteException if the tree holds a non-finite number
     */
    public static String stringify(JsonValue value) {
        Objects.requireNonNull(value, "value");
        var sb = new StringBuilder();
        write(sb, value);
        return sb.toString();
    }

    // ============================================================
    // AST
    // ============================================================

    public sealed interface JsonValue permits JsonArray, JsonBoolean, JsonNull, JsonNumber, JsonObject, JsonString {}

    public record JsonArray(List<JsonValue> value) implements JsonValue {}

    public record JsonBoolean(boolean value) implements JsonValue {}

    public record JsonNull() implements JsonValue {}

    public record JsonNumber(Number value) implements JsonValue {}

    public record JsonObject(Map<String, JsonValue> value) implements JsonValue {}

    public record JsonString(String value) implements JsonValue {}

    /**
     * Short, human readable name of a node kind, used in error messages.
     */
    static String kindOf(JsonValue value) {
        if (value instanceof JsonNull) return "null";
        if (value instanceof JsonBoolean) return "boolean";
        if (value instanceof JsonNumber) return "number";
        if (value instanceof JsonString) return "string";
        if (value instanceof JsonArray) return "array";
        return "object";
    }

    /**
     * Textual form of a scalar node: strings unquoted, everything else as JSON text.
     */
    static String toText(JsonValue value) {
        if (value instanceof JsonString s) return s.value();
        return stringify(value);
    }

    // ============================================================
    // Lexer
    // ============================================================

    enum Token {
        LBRACE,
        RBRACE,
        LBRACKET,
        RBRACKET,
        COLON,
        COMMA,
        STRING,
        NUMBER,
        TRUE,
        FALSE,
        NULL,
        EOF
    }

    static final class Lexer {
        private final String s;
        private int pos = 0;
        private int line = 1;
        private int col = 1;
        private Token current;
        private String text;

        Lexer(String s) {
            this.s = s;
            advance();
        }

        Token current() {
            return current;
        }

        /**
         * String contents or number lexeme of the current token.
         */
        String text() {
            return text;
        }

        int line() {
            return line;
        }

        int col() {
            return col;
        }

        void advance() {
            skipWhitespace();
            if (atEnd()) {
                current = Token.EOF;
                return;
            }
            char c = peek();
            switch (c) {
                case '{' -> single(Token.LBRACE);
                case '}' -> single(Token.RBRACE);
                case '[' -> single(Token.LBRACKET);
                case ']' -> single(Token.RBRACKET);
                case ':' -> single(Token.COLON);
                case ',' -> single(Token.COMMA);
                case '"' -> {
                    text = readString();
                    current = Token.STRING;
                }
                case 't' -> literal("true", Token.TRUE);
                case 'f' -> literal("false", Token.FALSE);
                case 'n' -> literal("null", Token.NULL);
                default -> {
                    if (c != '-' && !isDigit(c)) fail("Unexpected character: '" + c + "'");
                    text = readNumber();
                    current = Token.NUMBER;
                }
            }
        }

        private void single(Token token) {
            next();
            current = token;
        }

        private void literal(String keyword, Token token) {
            for (int k = 0; k < keyword.length(); k++) {
                if (atEnd() || peek() != keyword.charAt(k)) fail("Invalid literal, expected '" + keyword + "'");
                next();
            }
            current = token;
        }

        private void skipWhitespace() {
            while (!atEnd()) {
                char c = peek();
                if (c == '\n') {
                    next();
                    line++;
                    col = 1;
                } else if (c == ' ' || c == '\t' || c == '\r') {
                    next();
                } else {
                    return;
                }
            }
        }

        private String readString() {
            next(); // opening quote
            var sb = new StringBuilder();
            while (!atEnd()) {
                char c = next();
                if (c == '"') return sb.toString();
                if (c != '\\') {
                    if (c < 0x20) fail("Unescaped control character in string (ASCII " + (int) c + ")");
                    sb.append(c);
                    continue;
                }
                if (atEnd()) fail("Unterminated escape sequence");
                char e = next();
                switch (e) {
                    case '"', '\\', '/' -> sb.append(e);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> readUnicodeEscape(sb);
                    default -> fail("Invalid escape sequence: \\" + e);
                }
            }
            fail("Unterminated string literal");
            return null;
        }

        private void readUnicodeEscape(StringBuilder sb) {
            char high = (char) readHex4();
            if (Character.isLowSurrogate(high)) fail("Unexpected low surrogate in unicode escape");
            if (!Character.isHighSurrogate(high)) {
                sb.append(high);
                return;
            }
            if (atEnd() || peek() != '\\' || pos + 1 >= s.length() || s.charAt(pos + 1) != 'u') {
                fail("High surrogate not followed by low surrogate in unicode escape");
            }
            next();
            next();
            char low = (char) readHex4();
            if (!Character.isLowSurrogate(low)) fail("Invalid low surrogate in unicode escape");
            sb.append(high).append(low);
        }

        private int readHex4() {
            int cp = 0;
            for (int k = 0; k < 4; k++) {
                if (atEnd()) fail("Unexpected end of input in \\u escape sequence");
                int digit = Character.digit(next(), 16);
                if (digit < 0) fail("Invalid hexadecimal digit in \\u escape sequence");
                cp = (cp << 4) | digit;
            }
            return cp;
        }

        private String readNumber() {
            int start = pos;
            if (peek() == '-') next();
            if (atEnd()) fail("Unexpected end of input while parsing number");
            if (peek() == '0') next();
            else if (isDigit(peek())) digits();
            else fail("Invalid number format (integer part)");
            if (!atEnd() && peek() == '.') {
                next();
                if (atEnd() || !isDigit(peek())) fail("Invalid number format (fractional part)");
                digits();
            }
            if (!atEnd() && (peek() == 'e' || peek() == 'E')) {
                next();
                if (!atEnd() && (peek() == '+' || peek() == '-')) next();
                if (atEnd() || !isDigit(peek())) fail("Invalid number format (exponent part)");
                digits();
            }
            return s.substring(start, pos);
        }

        private void digits() {
            while (!atEnd() && isDigit(peek())) next();
        }

        private boolean atEnd() {
            return pos >= s.length();
        }

        private char peek() {
            return s.charAt(pos);
        }

        private char next() {
            col++;
            return s.charAt(pos++);
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private void fail(String msg) {
            throw new SyntaxException(msg + " at line " + line + ", column " + col);
        }
    }

    // ============================================================
    // Parser
    // ============================================================

    static JsonValue parseValue(Lexer lexer) {
        return switch (lexer.current()) {
            case LBRACE -> parseObject(lexer);
            case LBRACKET -> parseArray(lexer);
            case STRING -> {
                var s = new JsonString(lexer.text());
                lexer.advance();
                yield s;
            }
            case NUMBER -> {
                JsonNumber n;
                try {
                    n = new JsonNumber(parseNumber(lexer.text()));
                } catch (NumberFormatException e) {
                    throw error(lexer, "Number out of range: " + lexer.text());
                }
                lexer.advance();
                yield n;
            }
            case TRUE, FALSE -> {
                var b = new JsonBoolean(lexer.current() == Token.TRUE);
                lexer.advance();
                yield b;
            }
            case NULL -> {
                lexer.advance();
                yield new JsonNull();
            }
            case EOF -> throw error(lexer, "Unexpected end of input while expecting a value");
            default -> throw error(lexer, "Unexpected token: " + lexer.current());
        };
    }

    static JsonObject parseObject(Lexer lexer) {
        expect(lexer, Token.LBRACE);
        Map<String, JsonValue> members = new LinkedHashMap<>();
        if (accept(lexer, Token.RBRACE)) return new JsonObject(members);
        do {
            if (lexer.current() != Token.STRING) throw error(lexer, "Expected string key in object");
            String key = lexer.text();
            lexer.advance();
            expect(lexer, Token.COLON);
            members.put(key, parseValue(lexer));
        } while (accept(lexer, Token.COMMA));
        if (!accept(lexer, Token.RBRACE)) throw error(lexer, "Expected ',' or '}' in object");
        return new JsonObject(members);
    }

    static JsonArray parseArray(Lexer lexer) {
        expect(lexer, Token.LBRACKET);
        List<JsonValue> elements = new ArrayList<>();
        if (accept(lexer, Token.RBRACKET)) return new JsonArray(elements);
        do {
            elements.add(parseValue(lexer));
        } while (accept(lexer, Token.COMMA));
        if (!accept(lexer, Token.RBRACKET)) throw error(lexer, "Expected ',' or ']' in array");
        return new JsonArray(elements);
    }

    static void expect(Lexer lexer, Token t) {
        if (lexer.current() != t) throw error(lexer, "Expected " + t + " but found " + lexer.current());
        lexer.advance();
    }

    static boolean accept(Lexer lexer, Token t) {
        if (lexer.current() != t) return false;
        lexer.advance();
        return true;
    }

    static SyntaxException error(Lexer lexer, String msg) {
        return new SyntaxException(
                msg + " (token: " + lexer.current() + ") at line " + lexer.line() + ", column " + lexer.col());
    }

    /**
     * Integral lexemes with more digits than this stay {@link BigDecimal}.
     */
    static final int MAX_INTEGER_DIGITS = 400;

    /**
     * Smallest exact representation: Integer, Long, BigInteger for integral lexemes; Double when the
     * lexeme round-trips through double, BigDecimal otherwise.
     *
     * @throws NumberFormatException if the exponent does not fit a {@link BigDecimal} scale
     */
    static Number parseNumber(String lexeme) {
        BigDecimal exact = new BigDecimal(lexeme);
        BigDecimal stripped = exact.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            if ((long) stripped.precision() - stripped.scale() > MAX_INTEGER_DIGITS) return exact;
            try {
                long l = stripped.longValueExact();
                if ((int) l == l) return (int) l; // Do NOT use Ternary Operator here!
                return l;
            } catch (ArithmeticException e) {
                return stripped.toBigIntegerExact();
            }
        }
        double d = exact.doubleValue();
        if (Double.isFinite(d) && exact.compareTo(BigDecimal.valueOf(d)) == 0) return d;
        return exact;
    }

    // ============================================================
    // Writer
    // ============================================================

    static void write(StringBuilder out, JsonValue v) {
        if (v instanceof JsonNull) {
            out.append("null");
        } else if (v instanceof JsonBoolean b) {
            out.append(b.value() ? "true" : "false");
        } else if (v instanceof JsonNumber n) {
            writeNumber(out, n.value());
        } else if (v instanceof JsonString s) {
            writeString(out, s.value());
        } else if (v instanceof JsonArray a) {
            out.append('[');
            List<JsonValue> elements = a.value();
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) out.append(',');
                write(out, elements.get(i));
            }
            out.append(']');
        } else if (v instanceof JsonObject o) {
            out.append('{');
            boolean first = true;
            for (var member : o.value().entrySet()) {
                if (!first) out.append(',');
                first = false;
                writeString(out, member.getKey());
                out.append(':');
                write(out, member.getValue());
            }
            out.append('}');
        } else {
            throw new WriteException("Unknown JsonValue type: " + v.getClass());
        }
    }

    static void writeNumber(StringBuilder out, Number n) {
        if (n instanceof BigDecimal bd) {
            out.append(bd.toString());
            return;
        }
        if (!(n instanceof BigInteger)) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d))
                throw new WriteException("Cannot serialize NaN or Infinity as JSON number: " + n);
        }
        out.append(n);
    }

    static void writeString(StringBuilder out, String s) {
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) out.append(String.format("\\u%04x", (int) c));
                    else out.append(c);
                }
            }
        }
        out.append('"');
    }

    // ============================================================
    // Exceptions
    // ============================================================

    /**
     * Base of the errors raised by the JSON text codec itself.
     */
    public abstract static class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }

        public Exception(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Exception thrown when a tree cannot be written as JSON text.
     */
    public static class WriteException extends Exception {
        public WriteException(String message) {
            super(message);
        }
    }

    /**
     * Exception thrown when JSON parsing fails due to malformed JSON syntax.
     */
    public static class SyntaxException extends Exception {
        public SyntaxException(String message) {
            super(message);
        }
    }
}
