package json.tiny;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Outcome of [Json#parseMultiple(String)].
///
/// On failure [#values()] still holds every value parsed before the failing
/// one, followed by the null value the failing call produced.
///
/// @param values the values in document order, unmodifiable
/// @param error  the failure, or `null` if the whole input parsed
public record MultiParseResult(List<Value> values, ParseError error) {

    public MultiParseResult {
        values = List.copyOf(Objects.requireNonNull(values, "values must not be null"));
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
