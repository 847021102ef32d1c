package json.tiny;

import java.util.Objects;

/// Static entry points for reading and writing JSON text.
///
/// ## Example
/// ```java
/// ParseResult result = Json.tryParse("{\"k1\": \"v1\", \"k3\": [\"a\", 123, true]}");
/// if (result.isSuccess()) {
///     Value doc = result.value();
///     doc.get("k3").get(1).longValue(); // 123
///     Json.stringify(doc);              // {"k1": "v1", "k3": ["a", 123, true]}
/// } else {
///     System.err.println(result.errorMessage());
/// }
/// ```
///
/// Parsing follows RFC 8259 with two deliberate leniencies: an escaped
/// surrogate without its partner is kept as a lone surrogate, and a number
/// too large for a `double` becomes an infinite number.
public final class Json {

    /// Containers nested deeper than this fail with
    /// [ParseError.Kind#NESTING_TOO_DEEP].
    public static final int MAX_DEPTH = JsonParser.MAX_DEPTH;

    /// {@return the value of `text`, or a null value if `text` is not a
    /// single valid JSON document} The failure is discarded; use
    /// [#tryParse(String)] when it matters.
    ///
    /// @throws NullPointerException if `text` is `null`
    public static Value parse(String text) {
        return JsonParser.parse(text).value();
    }

    /// Parses a single JSON document surrounded by optional whitespace.
    ///
    /// @return the value, or a null value together with the first failure
    /// @throws NullPointerException if `text` is `null`
    public static ParseResult tryParse(String text) {
        return JsonParser.parse(text);
    }

    /// Parses a single JSON document from UTF-8 bytes, decoded with
    /// [Utf8#decode(byte[])].
    public static ParseResult tryParse(byte[] utf8) {
        return JsonParser.parse(Utf8.decode(utf8));
    }

    /// Parses a single JSON document.
    ///
    /// @throws JsonParseException if `text` is not a single valid JSON document
    /// @throws NullPointerException if `text` is `null`
    public static Value parseOrThrow(String text) {
        final ParseResult result = JsonParser.parse(text);
        if (!result.isSuccess()) {
            throw new JsonParseException(result.error());
        }
        return result.value();
    }

    /// Parses a sequence of JSON documents, concatenated or separated by
    /// whitespace, such as `1 2 3` or `{}{"a": 1}`.
    ///
    /// Empty or all-whitespace input yields no values and no failure.
    ///
    /// @throws NullPointerException if `text` is `null`
    public static MultiParseResult parseMultiple(String text) {
        return JsonParser.parseMultiple(text);
    }

    public static MultiParseResult parseMultiple(byte[] utf8) {
        return JsonParser.parseMultiple(Utf8.decode(utf8));
    }

    /// {@return the canonical compact text of `value`}
    ///
    /// @see Value#toText()
    public static String stringify(Value value) {
        return Objects.requireNonNull(value, "value must not be null").toText();
    }

    /// {@return the canonical compact text of `value` as UTF-8}
    ///
    /// @see Value#toUtf8()
    public static byte[] toUtf8(Value value) {
        return Objects.requireNonNull(value, "value must not be null").toUtf8();
    }

    private Json() {
    }
}
