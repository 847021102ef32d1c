package json.tiny;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// One-level structural check of an object against a [Shape].
///
/// Stops at the first problem:
///
/// - the value is not an object;
/// - a field is absent (a member explicitly set to null is present);
/// - a field's tag differs from the expected one. No numeric widening is
///   applied, so a `NUMBER` never satisfies `INTEGER` or the reverse.
public final class ShapeValidator {

    private static final Logger LOG = Logger.getLogger(ShapeValidator.class.getName());

    private ShapeValidator() {
    }

    public static ShapeResult validate(Shape shape, Value value) {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(value, "value must not be null");

        if (!value.isObject()) {
            return reject("expected JSON object, got " + value.toText());
        }

        for (final Shape.Field field : shape.fields()) {
            final Optional<Value> member = value.find(field.name());
            if (member.isEmpty()) {
                return reject("missing field " + field.name() + " in " + value.toText());
            }
            final Type actual = member.get().type();
            if (actual != field.type()) {
                return reject("bad type for " + field.name() + ": expected " + field.type()
                        + ", got " + actual + " in " + value.toText());
            }
        }
        return ShapeResult.success();
    }

    private static ShapeResult reject(String message) {
        LOG.fine(() -> "Shape check failed: " + message);
        return ShapeResult.failure(message);
    }
}
