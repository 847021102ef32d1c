package json.tiny;

import java.util.Objects;

/// The first failure met while parsing a document.
///
/// @param kind     what went wrong
/// @param message  human-readable description, never empty
/// @param position offset into the input where the failure was detected
public record ParseError(Kind kind, String message, int position) {

    /// The classes of parse failure.
    public enum Kind {
        /// Input ended inside a value or where a value was expected.
        UNEXPECTED_END,
        /// A backslash escape that is not one of the JSON escapes, or a bad `u` escape.
        INVALID_ESCAPE,
        /// A raw character below U+0020 inside a string.
        UNESCAPED_CONTROL,
        /// A number that breaks the JSON number grammar.
        INVALID_NUMBER,
        /// Containers nested deeper than [Json#MAX_DEPTH].
        NESTING_TOO_DEEP,
        /// Wrong punctuation or keyword.
        UNEXPECTED_TOKEN,
        /// Non-whitespace after a complete top-level value.
        TRAILING_GARBAGE
    }

    public ParseError {
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("Error message cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return message + " at position " + position;
    }
}
