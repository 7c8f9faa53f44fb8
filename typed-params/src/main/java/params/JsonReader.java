package params;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Strict JSON text reader producing the {@link JsonValue} tree consumed by the params builder.
 *
 * <p> Numbers are narrowed to the smallest of {@link Integer}, {@link Long}, {@link java.math.BigInteger},
 * {@link Double} or {@link BigDecimal} that represents them exactly.
 */
final class JsonReader {

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

    private final Lexer lexer;
    private final int maxDepth;
    private int depth;

    private JsonReader(String text, int maxDepth) {
        this.lexer = new Lexer(text);
        this.maxDepth = maxDepth;
    }

    static JsonValue read(String text, int maxDepth) {
        Objects.requireNonNull(text, "text");
        var reader = new JsonReader(text, maxDepth);
        JsonValue v = reader.parseValue();
        if (reader.lexer.current() != Token.EOF) throw reader.error("Trailing characters after top-level value");
        return v;
    }

    private JsonValue parseValue() {
        return switch (lexer.current()) {
            case LBRACE -> parseObject();
            case LBRACKET -> parseArray();
            case STRING -> {
                String s = lexer.string();
                lexer.advance();
                yield new JsonString(s);
            }
            case NUMBER -> {
                String n = lexer.number();
                lexer.advance();
                yield new JsonNumber(parseNumber(n));
            }
            case TRUE -> {
                lexer.advance();
                yield new JsonBoolean(true);
            }
            case FALSE -> {
                lexer.advance();
                yield new JsonBoolean(false);
            }
            case NULL -> {
                lexer.advance();
                yield new JsonNull();
            }
            case RBRACE, RBRACKET, COMMA, COLON -> throw error("Unexpected token: " + lexer.current());
            case EOF -> throw error("Unexpected end of input while expecting a value");
        };
    }

    private JsonObject parseObject() {
        enter();
        expect(Token.LBRACE);
        Map<String, JsonValue> m = new LinkedHashMap<>();
        if (!accept(Token.RBRACE)) {
            while (true) {
                if (lexer.current() != Token.STRING) throw error("Expected string key in object");
                String key = lexer.string();
                lexer.advance();
                expect(Token.COLON);
                if (m.put(key, parseValue()) != null) throw error("Duplicate key '" + key + "' in object");
                if (accept(Token.COMMA)) continue;
                if (accept(Token.RBRACE)) break;
                throw error("Expected ',' or '}' in object");
            }
        }
        depth--;
        return new JsonObject(m);
    }

    private JsonArray parseArray() {
        enter();
        expect(Token.LBRACKET);
        List<JsonValue> list = new ArrayList<>();
        if (!accept(Token.RBRACKET)) {
            while (true) {
                list.add(parseValue());
                if (accept(Token.COMMA)) continue;
                if (accept(Token.RBRACKET)) break;
                throw error("Expected ',' or ']' in array");
            }
        }
        depth--;
        return new JsonArray(list);
    }

    private void enter() {
        if (++depth > maxDepth) throw error("Maximum nesting depth of " + maxDepth + " exceeded");
    }

    private void expect(Token t) {
        if (lexer.current() != t) throw error("Expected " + t + " but found " + lexer.current());
        lexer.advance();
    }

    private boolean accept(Token t) {
        if (lexer.current() == t) {
            lexer.advance();
            return true;
        }
        return false;
    }

    private Params.SyntaxException error(String msg) {
        return new Params.SyntaxException(msg + " (token: " + lexer.current() + ")", lexer.line(), lexer.col());
    }

    static Number parseNumber(String s) {
        BigDecimal b = new BigDecimal(s), n = b.stripTrailingZeros();
        if (n.scale() <= 0 && s.indexOf('.') < 0 && s.indexOf('e') < 0 && s.indexOf('E') < 0) {
            try {
                long l = n.longValueExact();
                if ((int) l == l) return (int) l; // Do NOT use Ternary Operator here!
                return l;
            } catch (ArithmeticException e) {
                return n.toBigIntegerExact();
            }
        }
        double d = b.doubleValue();
        return Double.isFinite(d) && b.compareTo(BigDecimal.valueOf(d)) == 0 ? d : b;
    }

    static void escapeTo(StringBuilder out, String s) {
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
                    if (c < 0x20) {
                        out.append("\\u");
                        String hex = Integer.toHexString(c);
                        for (int k = hex.length(); k < 4; k++) out.append('0');
                        out.append(hex);
                    } else {
                        out.append(c);
                    }
                }
            }
        }
    }

    static final class Lexer {
        private final String s;
        private int i = 0, line = 1, col = 1;
        private Token current;
        private String stringValue, numberLexeme;

        Lexer(String s) {
            this.s = s;
            advance();
        }

        Token current() {
            return current;
        }

        String string() {
            return stringValue;
        }

        String number() {
            return numberLexeme;
        }

        int line() {
            return line;
        }

        int col() {
            return col;
        }

        void advance() {
            skipWs();
            if (eof()) {
                current = Token.EOF;
                return;
            }
            char c = peek();
            switch (c) {
                case '{' -> {
                    consume();
                    current = Token.LBRACE;
                }
                case '}' -> {
                    consume();
                    current = Token.RBRACE;
                }
                case '[' -> {
                    consume();
                    current = Token.LBRACKET;
                }
                case ']' -> {
                    consume();
                    current = Token.RBRACKET;
                }
                case ':' -> {
                    consume();
                    current = Token.COLON;
                }
                case ',' -> {
                    consume();
                    current = Token.COMMA;
                }
                case '"' -> {
                    stringValue = readString();
                    current = Token.STRING;
                }
                case 't' -> {
                    readKeyword("true");
                    current = Token.TRUE;
                }
                case 'f' -> {
                    readKeyword("false");
                    current = Token.FALSE;
                }
                case 'n' -> {
                    readKeyword("null");
                    current = Token.NULL;
                }
                default -> {
                    if (c == '-' || isDigit(c)) {
                        numberLexeme = readNumber();
                        current = Token.NUMBER;
                    } else error("Unexpected character: '" + c + "'");
                }
            }
        }

        private void skipWs() {
            while (!eof()) {
                char c = peek();
                if (c == ' ' || c == '\t' || c == '\r') consume();
                else if (c == '\n') {
                    consume();
                    line++;
                    col = 1;
                } else break;
            }
        }

        private String readString() {
            consume(); // opening "
            StringBuilder sb = new StringBuilder();
            while (!eof()) {
                char c = consume();
                if (c == '"') return sb.toString();
                if (c == '\\') {
                    if (eof()) error("Unterminated escape sequence");
                    char e = consume();
                    switch (e) {
                        case '"' -> sb.append('"');
                        case '\\' -> sb.append('\\');
                        case '/' -> sb.append('/');
                        case 'b' -> sb.append('\b');
                        case 'f' -> sb.append('\f');
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        case 'u' -> {
                            int cp = readHex4();
                            if (Character.isHighSurrogate((char) cp)) {
                                if (!eof() && peek() == '\\' && peekNext() == 'u') {
                                    consume();
                                    consume();
                                    int low = readHex4();
                                    if (!Character.isLowSurrogate((char) low))
                                        error("Invalid low surrogate in unicode escape");
                                    sb.appendCodePoint(Character.toCodePoint((char) cp, (char) low));
                                } else error("High surrogate not followed by low surrogate in unicode escape");
                            } else if (Character.isLowSurrogate((char) cp)) {
                                error("Unexpected low surrogate in unicode escape");
                            } else sb.append((char) cp);
                        }
                        default -> error("Invalid escape sequence: \\" + e);
                    }
                } else {
                    if (c < 0x20) error("Unescaped control character in string (ASCII " + (int) c + ")");
                    sb.append(c);
                }
            }
            error("Unterminated string literal");
            return null;
        }

        private int readHex4() {
            int cp = 0;
            for (int k = 0; k < 4; k++) {
                if (eof()) error("Unexpected end of input in \\u escape sequence");
                int v = hexVal(consume());
                if (v < 0) error("Invalid hexadecimal digit in \\u escape sequence");
                cp = (cp << 4) | v;
            }
            return cp;
        }

        private static int hexVal(char c) {
            if (c >= '0' && c <= '9') return c - '0';
            if (c >= 'a' && c <= 'f') return 10 + (c - 'a');
            if (c >= 'A' && c <= 'F') return 10 + (c - 'A');
            return -1;
        }

        private void readKeyword(String kw) {
            for (int k = 0; k < kw.length(); k++) {
                if (eof() || peek() != kw.charAt(k)) error("Invalid literal, expected '" + kw + "'");
                consume();
            }
        }

        private String readNumber() {
            int start = i;
            if (peek() == '-') consume();
            if (eof()) error("Unexpected end of input while parsing number");
            if (peek() == '0') consume();
            else if (isDigit(peek())) while (!eof() && isDigit(peek())) consume();
            else error("Invalid number format (integer part)");
            if (!eof() && peek() == '.') {
                consume();
                if (eof() || !isDigit(peek())) error("Invalid number format (fractional part)");
                while (!eof() && isDigit(peek())) consume();
            }
            if (!eof() && (peek() == 'e' || peek() == 'E')) {
                consume();
                if (!eof() && (peek() == '+' || peek() == '-')) consume();
                if (eof() || !isDigit(peek())) error("Invalid number format (exponent part)");
                while (!eof() && isDigit(peek())) consume();
            }
            return s.substring(start, i);
        }

        private boolean eof() {
            return i >= s.length();
        }

        private char peek() {
            return s.charAt(i);
        }

        private char peekNext() {
            return (i + 1 < s.length()) ? s.charAt(i + 1) : '\0';
        }

        private char consume() {
            char c = s.charAt(i++);
            col++;
            return c;
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private void error(String msg) {
            throw new Params.SyntaxException(msg, line, col);
        }
    }
}
