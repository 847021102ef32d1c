package json.tiny;

import java.util.Objects;
import java.util.Optional;

/// Outcome of parsing a single document.
///
/// On failure [#value()] is null and [#error()] holds the first failure, so
/// check [#isSuccess()] rather than the value's type to tell a document that
/// says `null` from one that did not parse.
///
/// @param value the parsed value, or a null value on failure
/// @param error the failure, or `null` on success
public record ParseResult(Value value, ParseError error) {

    public ParseResult {
        Objects.requireNonNull(value, "value must not be null");
    }

    static ParseResult success(Value value) {
        return new ParseResult(value, null);
    }

    static ParseResult failure(ParseError error) {
        return new ParseResult(Value.ofNull(), Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<ParseError> findError() {
        return Optional.ofNullable(error);
    }

    /// {@return the failure message, or `""` on success}
    public String errorMessage() {
        return error == null ? "" : error.message();
    }
}
