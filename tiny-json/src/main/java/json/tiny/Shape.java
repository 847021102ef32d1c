package json.tiny;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The fields an object must have, each with the exact [Type] its value
/// must carry. Checked by [ShapeValidator].
///
/// Only direct members are checked, in the order the fields were declared.
///
/// [Type#INTEGER] and [Type#NUMBER] are different tags here. The parser
/// produces `INTEGER` for `1` and `NUMBER` for `1.0` or `1e0`, so a shape
/// must name the tag the producer of the document actually writes.
///
/// ```java
/// Shape point = Shape.builder()
///     .field("x", Type.INTEGER)
///     .field("y", Type.INTEGER)
///     .build();
/// Json.parse("{\"x\": 1, \"y\": 2}").hasShape(point); // true
/// ```
///
/// @param fields the expected fields, unmodifiable
public record Shape(List<Field> fields) {

    /// One expected member.
    public record Field(String name, Type type) {
        public Field {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    public Shape {
        fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
    }

    public static Shape of(String name, Type type) {
        return new Shape(List.of(new Field(name, type)));
    }

    public static Shape of(String name1, Type type1, String name2, Type type2) {
        return new Shape(List.of(new Field(name1, type1), new Field(name2, type2)));
    }

    /// {@return a shape with one field per entry of `fields`, in the map's iteration order}
    public static Shape of(Map<String, Type> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        final var list = new ArrayList<Field>(fields.size());
        fields.forEach((name, type) -> list.add(new Field(name, type)));
        return new Shape(list);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Field> fields = new ArrayList<>();

        private Builder() {
        }

        public Builder field(String name, Type type) {
            fields.add(new Field(name, type));
            return this;
        }

        public Shape build() {
            return new Shape(fields);
        }
    }
}
