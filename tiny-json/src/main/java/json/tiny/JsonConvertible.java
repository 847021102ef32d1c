package json.tiny;

/// Capability of a type that knows how to represent itself as a [Value].
///
/// Domain types implement this to be accepted by the bulk factories
/// [Value#array(Iterable)] and [Value#object(java.util.Map)] and by the
/// mutators [Value#put(String, JsonConvertible)] and
/// [Value#append(JsonConvertible)].
///
/// ## Example
/// ```java
/// record Point(int x, int y) implements JsonConvertible {
///     public Value toValue() {
///         return Value.object(Map.of("x", Value.of(x), "y", Value.of(y)));
///     }
/// }
///
/// Value points = Value.array(List.of(new Point(1, 2), new Point(3, 4)));
/// ```
@FunctionalInterface
public interface JsonConvertible {

    /// {@return a `Value` representing this object} Callers take ownership of
    /// the result; implementations must not keep a reference to it.
    Value toValue();
}
