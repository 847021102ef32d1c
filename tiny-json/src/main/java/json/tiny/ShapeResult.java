package json.tiny;

import java.util.Optional;

/// Result of a [ShapeValidator] check.
///
/// @param isValid whether the value has the shape
/// @param error   description of the first mismatch, or `null` when valid
public record ShapeResult(boolean isValid, String error) {

    private static final ShapeResult SUCCESS = new ShapeResult(true, null);

    public ShapeResult {
        if (isValid != (error == null)) {
            throw new IllegalArgumentException("a valid result has no error and an invalid one has one");
        }
    }

    public static ShapeResult success() {
        return SUCCESS;
    }

    public static ShapeResult failure(String error) {
        if (error == null || error.isEmpty()) {
            throw new IllegalArgumentException("Error message cannot be null or empty");
        }
        return new ShapeResult(false, error);
    }

    public Optional<String> findError() {
        return Optional.ofNullable(error);
    }
}
