package json.tiny;

import java.util.ArrayList;
import java.util.Objects;
import java.util.logging.Logger;

import json.tiny.Node.ArrayNode;
import json.tiny.Node.IntegerNode;
import json.tiny.Node.NumberNode;
import json.tiny.Node.ObjectNode;
import json.tiny.Node.StringNode;

import static json.tiny.ParseError.Kind.INVALID_ESCAPE;
import static json.tiny.ParseError.Kind.INVALID_NUMBER;
import static json.tiny.ParseError.Kind.NESTING_TOO_DEEP;
import static json.tiny.ParseError.Kind.TRAILING_GARBAGE;
import static json.tiny.ParseError.Kind.UNESCAPED_CONTROL;
import static json.tiny.ParseError.Kind.UNEXPECTED_END;
import static json.tiny.ParseError.Kind.UNEXPECTED_TOKEN;

/// Recursive descent parser for RFC 8259 JSON text.
///
/// One forward cursor, at most one character of pushback. Every production
/// either returns its value or throws the first [JsonParseException], which
/// the entry points turn into a [ParseResult] or [MultiParseResult]. Nothing
/// after the first failure can overwrite it because nothing after it runs.
///
/// Numbers without a fraction or exponent become integers when they fit in
/// a `long`; all others, including integer literals that overflow a `long`,
/// become doubles. Object members are stored key-sorted and a repeated key keeps
/// the last value.
final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    /// Deepest container nesting accepted. The outermost container is at depth 1.
    static final int MAX_DEPTH = 200;

    private final String in;
    private int pos;

    private JsonParser(String in) {
        this.in = in;
        this.pos = 0;
    }

    /// Parses exactly one value surrounded by optional whitespace.
    static ParseResult parse(String in) {
        Objects.requireNonNull(in, "in must not be null");
        LOG.fine(() -> "Parsing document of " + in.length() + " chars");
        final var parser = new JsonParser(in);
        try {
            final Value result = parser.parseValue(0);
            parser.consumeWhitespace();
            if (parser.pos != in.length()) {
                throw parser.fail(TRAILING_GARBAGE, "unexpected trailing " + describe(in.charAt(parser.pos)));
            }
            return ParseResult.success(result);
        } catch (JsonParseException e) {
            LOG.fine(() -> "Parse failed: " + e.getMessage());
            return ParseResult.failure(e.error());
        }
    }

    /// Parses values one after another until the input is used up or a value
    /// fails. No separator is needed between values.
    static MultiParseResult parseMultiple(String in) {
        Objects.requireNonNull(in, "in must not be null");
        LOG.fine(() -> "Parsing value sequence of " + in.length() + " chars");
        final var parser = new JsonParser(in);
        final var values = new ArrayList<Value>();
        try {
            parser.consumeWhitespace();
            while (parser.pos != in.length()) {
                values.add(parser.parseValue(0));
                parser.consumeWhitespace();
            }
            LOG.finer(() -> "Parsed " + values.size() + " values");
            return new MultiParseResult(values, null);
        } catch (JsonParseException e) {
            LOG.fine(() -> "Parse failed after " + values.size() + " values: " + e.getMessage());
            values.add(Value.ofNull());
            return new MultiParseResult(values, e.error());
        }
    }

    /// @param depth number of containers enclosing the value about to be read
    private Value parseValue(int depth) {
        final char ch = nextToken();

        if (ch == '-' || (ch >= '0' && ch <= '9')) {
            pos--;
            return parseNumber();
        }

        return switch (ch) {
            case 't' -> expect("true", Node.TRUE);
            case 'f' -> expect("false", Node.FALSE);
            case 'n' -> expect("null", Node.NULL);
            case '"' -> new Value(new StringNode(parseString()));
            case '{' -> parseObject(depth + 1);
            case '[' -> parseArray(depth + 1);
            default -> throw fail(UNEXPECTED_TOKEN, "expected value, got " + describe(ch));
        };
    }

    private Value parseObject(int depth) {
        checkDepth(depth);
        final var node = new ObjectNode();
        char ch = nextToken();
        if (ch == '}') {
            return new Value(node);
        }

        while (true) {
            if (ch != '"') {
                throw fail(UNEXPECTED_TOKEN, "expected '\"' in object, got " + describe(ch));
            }
            final String key = parseString();

            ch = nextToken();
            if (ch != ':') {
                throw fail(UNEXPECTED_TOKEN, "expected ':' in object, got " + describe(ch));
            }
            node.members().put(key, parseValue(depth));

            ch = nextToken();
            if (ch == '}') {
                return new Value(node);
            }
            if (ch != ',') {
                throw fail(UNEXPECTED_TOKEN, "expected ',' in object, got " + describe(ch));
            }
            ch = nextToken();
        }
    }

    private Value parseArray(int depth) {
        checkDepth(depth);
        final var node = new ArrayNode();
        char ch = nextToken();
        if (ch == ']') {
            return new Value(node);
        }

        while (true) {
            pos--;
            node.items().add(parseValue(depth));

            ch = nextToken();
            if (ch == ']') {
                return new Value(node);
            }
            if (ch != ',') {
                throw fail(UNEXPECTED_TOKEN, "expected ',' in list, got " + describe(ch));
            }
            nextToken();
        }
    }

    private void checkDepth(int depth) {
        if (depth > MAX_DEPTH) {
            throw fail(NESTING_TOO_DEEP, "exceeded maximum nesting depth");
        }
    }

    private Value parseNumber() {
        final int start = pos;

        if (peek() == '-') {
            pos++;
        }

        // integer part
        if (peek() == '0') {
            pos++;
            if (isDigit(peek())) {
                throw fail(INVALID_NUMBER, "leading 0s not permitted in numbers");
            }
        } else if (peek() >= '1' && peek() <= '9') {
            pos++;
            while (isDigit(peek())) {
                pos++;
            }
        } else {
            throw fail(INVALID_NUMBER, "invalid " + describe(peek()) + " in number");
        }

        final char next = peek();
        if (next != '.' && next != 'e' && next != 'E') {
            try {
                return new Value(new IntegerNode(Long.parseLong(in, start, pos, 10)));
            } catch (NumberFormatException overflow) {
                LOG.finer(() -> "Integer literal out of long range at " + start + ", reading as double");
                return new Value(new NumberNode(Double.parseDouble(in.substring(start, pos))));
            }
        }

        // fraction
        if (peek() == '.') {
            pos++;
            if (!isDigit(peek())) {
                throw fail(INVALID_NUMBER, "at least one digit required in fractional part");
            }
            while (isDigit(peek())) {
                pos++;
            }
        }

        // exponent
        if (peek() == 'e' || peek() == 'E') {
            pos++;
            if (peek() == '+' || peek() == '-') {
                pos++;
            }
            if (!isDigit(peek())) {
                throw fail(INVALID_NUMBER, "at least one digit required in exponent");
            }
            while (isDigit(peek())) {
                pos++;
            }
        }

        return new Value(new NumberNode(Double.parseDouble(in.substring(start, pos))));
    }

    /// Reads string content up to and including the closing quote. The
    /// opening quote has already been consumed.
    ///
    /// A `u` escape is held back until the next character is known so that
    /// an escaped high surrogate followed by an escaped low surrogate becomes
    /// one supplementary code point. A surrogate escape without its partner
    /// is kept as a lone surrogate rather than rejected.
    private String parseString() {
        final var out = new StringBuilder();
        int pending = -1;
        while (true) {
            if (pos == in.length()) {
                throw fail(UNEXPECTED_END, "unexpected end of input in string");
            }

            char ch = in.charAt(pos++);

            if (ch == '"') {
                flush(pending, out);
                return out.toString();
            }

            if (ch < 0x20) {
                throw fail(UNESCAPED_CONTROL, "unescaped " + describe(ch) + " in string");
            }

            if (ch != '\\') {
                flush(pending, out);
                pending = -1;
                out.append(ch);
                continue;
            }

            if (pos == in.length()) {
                throw fail(UNEXPECTED_END, "unexpected end of input in string");
            }

            ch = in.charAt(pos++);

            if (ch == 'u') {
                final int codepoint = readHex4();
                if (pending >= 0 && Character.isHighSurrogate((char) pending)
                        && Character.isLowSurrogate((char) codepoint)) {
                    out.appendCodePoint(Character.toCodePoint((char) pending, (char) codepoint));
                    pending = -1;
                } else {
                    flush(pending, out);
                    pending = codepoint;
                }
                continue;
            }

            flush(pending, out);
            pending = -1;

            out.append(switch (ch) {
                case 'b' -> '\b';
                case 'f' -> '\f';
                case 'n' -> '\n';
                case 'r' -> '\r';
                case 't' -> '\t';
                case '"', '\\', '/' -> ch;
                default -> throw fail(INVALID_ESCAPE, "invalid escape character " + describe(ch));
            });
        }
    }

    private int readHex4() {
        final int end = Math.min(pos + 4, in.length());
        final String hex = in.substring(pos, end);
        if (hex.length() < 4) {
            throw fail(INVALID_ESCAPE, "bad \\u escape: " + hex);
        }
        for (int j = 0; j < 4; j++) {
            if (!isHexDigit(hex.charAt(j))) {
                throw fail(INVALID_ESCAPE, "bad \\u escape: " + hex);
            }
        }
        pos = end;
        return Integer.parseInt(hex, 16);
    }

    private static void flush(int pending, StringBuilder out) {
        if (pending >= 0) {
            out.append((char) pending);
        }
    }

    /// Checks that `literal` starts at the character just read and consumes it.
    private Value expect(String literal, Node result) {
        pos--;
        if (in.startsWith(literal, pos)) {
            pos += literal.length();
            return new Value(result);
        }
        final String got = in.substring(pos, Math.min(pos + literal.length(), in.length()));
        throw fail(UNEXPECTED_TOKEN, "parse error: expected " + literal + ", got " + got);
    }

    /// {@return the next non-whitespace character, consuming it}
    private char nextToken() {
        consumeWhitespace();
        if (pos == in.length()) {
            throw fail(UNEXPECTED_END, "unexpected end of input");
        }
        return in.charAt(pos++);
    }

    private void consumeWhitespace() {
        while (pos < in.length()) {
            final char ch = in.charAt(pos);
            if (ch != ' ' && ch != '\r' && ch != '\n' && ch != '\t') {
                return;
            }
            pos++;
        }
    }

    /// {@return the current character, or NUL past the end of input}
    private char peek() {
        return pos < in.length() ? in.charAt(pos) : '\0';
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isHexDigit(char ch) {
        return (ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'f') || (ch >= 'A' && ch <= 'F');
    }

    private JsonParseException fail(ParseError.Kind kind, String message) {
        return new JsonParseException(new ParseError(kind, message, pos));
    }

    /// Formats `ch` for an error message: printable ASCII as `'c' (99)`,
    /// anything else as its code alone.
    static String describe(char ch) {
        if (ch >= 0x20 && ch <= 0x7f) {
            return "'" + ch + "' (" + (int) ch + ")";
        }
        return "(" + (int) ch + ")";
    }
}
