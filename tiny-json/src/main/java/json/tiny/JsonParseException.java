package json.tiny;

import java.util.Objects;

/// Thrown by [Json#parseOrThrow(String)] when a document is not valid JSON.
///
/// The parser also uses it internally to unwind from the first failure to
/// the entry point, where it is turned into a [ParseResult].
public class JsonParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ParseError error;

    public JsonParseException(ParseError error) {
        super(Objects.requireNonNull(error, "error must not be null").toString());
        this.error = error;
    }

    /// {@return the failure that stopped the parse}
    public ParseError error() {
        return error;
    }

    public ParseError.Kind kind() {
        return error.kind();
    }

    /// {@return the offset into the input where the failure was detected}
    public int position() {
        return error.position();
    }
}
