package json.tiny;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

import json.tiny.Node.ArrayNode;
import json.tiny.Node.BoolNode;
import json.tiny.Node.IntegerNode;
import json.tiny.Node.NumberNode;
import json.tiny.Node.ObjectNode;
import json.tiny.Node.StringNode;

/// A JSON value: null, integer, number, boolean, string, array or object.
///
/// A `Value` is a mutable cell that holds exactly one variant at a time. The
/// string, array and object payloads it holds are owned by it alone:
///
/// - [#copy()] returns a deep clone;
/// - [#move()] hands the payload to a new `Value` and leaves this one null;
/// - values passed to [#put], [#append], [#set] and the bulk factories are
///   copied in, so no cell is ever reachable from two places.
///
/// Objects keep their members sorted by key (UTF-8 byte order), not in
/// insertion order.
///
/// Accessors never throw. Asking for the wrong variant returns a neutral
/// default (`0`, `false`, `""`, an empty container) and indexing a missing
/// element returns a shared read-only null, see [#get(String)].
///
/// `equals`, `hashCode` and `compareTo` follow [ValueComparator]: integers and
/// numbers compare by numeric value, so `Value.of(42).equals(Value.of(42.0))`.
///
/// ## Example
/// ```java
/// Value doc = Value.object();
/// doc.put("name", Value.of("Alice"));
/// doc.getOrCreate("scores").ifPresent(s -> s.append(Value.of(95)));
/// doc.toText(); // {"name": "Alice", "scores": [95]}
/// ```
///
/// Instances are not thread safe. Concurrent reads of a tree that nobody
/// mutates are fine.
public final class Value implements Comparable<Value>, JsonConvertible {

    /// Returned by `get` for absent keys, out-of-range indices and wrong
    /// receivers. Every mutator refuses to touch it.
    private static final Value MISSING = new Value(Node.NULL, true);

    private static final List<Value> EMPTY_ITEMS = List.of();
    private static final SortedMap<String, Value> EMPTY_MEMBERS =
            Collections.unmodifiableSortedMap(new TreeMap<>(ValueComparator.KEY_ORDER));

    private Node node;
    private final boolean readOnly;

    Value(Node node) {
        this(node, false);
    }

    private Value(Node node, boolean readOnly) {
        this.node = node;
        this.readOnly = readOnly;
    }

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    /// {@return a new null value}
    public static Value ofNull() {
        return new Value(Node.NULL);
    }

    public static Value of(boolean value) {
        return new Value(Node.of(value));
    }

    public static Value of(int value) {
        return new Value(new IntegerNode(value));
    }

    public static Value of(long value) {
        return new Value(new IntegerNode(value));
    }

    /// Creates a number. Non-finite values are accepted and serialize as
    /// `null`.
    public static Value of(double value) {
        return new Value(new NumberNode(value));
    }

    /// @throws NullPointerException if `value` is `null`
    public static Value of(String value) {
        return new Value(new StringNode(Objects.requireNonNull(value, "value must not be null")));
    }

    /// {@return the value produced by `convertible`, owned by the caller}
    ///
    /// @throws NullPointerException if `convertible` or its result is `null`
    public static Value of(JsonConvertible convertible) {
        return owned(convertible);
    }

    /// {@return a new empty array}
    public static Value array() {
        return new Value(new ArrayNode());
    }

    public static Value array(JsonConvertible... items) {
        return array(List.of(items));
    }

    /// {@return an array holding a copy of each item, in iteration order}
    ///
    /// @throws NullPointerException if `items` or any item is `null`
    public static Value array(Iterable<? extends JsonConvertible> items) {
        Objects.requireNonNull(items, "items must not be null");
        final var node = new ArrayNode();
        for (final JsonConvertible item : items) {
            node.items().add(owned(item));
        }
        return new Value(node);
    }

    /// {@return an array built by converting each element of `items` with `converter`}
    ///
    /// ```java
    /// Value ids = Value.array(List.of(3L, 5L, 8L), Value::of);
    /// ```
    public static <T> Value array(Iterable<T> items, Function<? super T, ? extends JsonConvertible> converter) {
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(converter, "converter must not be null");
        final var node = new ArrayNode();
        for (final T item : items) {
            node.items().add(owned(converter.apply(item)));
        }
        return new Value(node);
    }

    /// {@return a new empty object}
    public static Value object() {
        return new Value(new ObjectNode());
    }

    /// {@return an object holding a copy of each entry of `members`}
    ///
    /// Member order in the result is key order, whatever the order of `members`.
    ///
    /// @throws NullPointerException if `members` or any key or value is `null`
    public static Value object(Map<String, ? extends JsonConvertible> members) {
        Objects.requireNonNull(members, "members must not be null");
        final var node = new ObjectNode();
        for (final Map.Entry<String, ? extends JsonConvertible> member : members.entrySet()) {
            node.members().put(Objects.requireNonNull(member.getKey(), "member name must not be null"),
                    owned(member.getValue()));
        }
        return new Value(node);
    }

    /// {@return an object built by converting each value of `members` with `converter`}
    public static <T> Value object(Map<String, T> members, Function<? super T, ? extends JsonConvertible> converter) {
        Objects.requireNonNull(members, "members must not be null");
        Objects.requireNonNull(converter, "converter must not be null");
        final var node = new ObjectNode();
        for (final Map.Entry<String, T> member : members.entrySet()) {
            node.members().put(Objects.requireNonNull(member.getKey(), "member name must not be null"),
                    owned(converter.apply(member.getValue())));
        }
        return new Value(node);
    }

    private static Value owned(JsonConvertible convertible) {
        Objects.requireNonNull(convertible, "value must not be null");
        if (convertible instanceof Value value) {
            return value.copy();
        }
        // a converter may hand back a cell it still references
        return Objects.requireNonNull(convertible.toValue(),
                () -> convertible.getClass().getSimpleName() + ".toValue() returned null").copy();
    }

    /// {@return a deep copy of this value}
    @Override
    public Value toValue() {
        return copy();
    }

    // ------------------------------------------------------------------
    // Ownership
    // ------------------------------------------------------------------

    /// {@return a deep clone of this value that shares no cells with it}
    public Value copy() {
        return new Value(node.deepCopy());
    }

    /// Transfers this value's payload to a new `Value` and resets this one to
    /// null. Moving the shared missing sentinel yields a fresh null.
    ///
    /// @return the value that now owns the payload
    public Value move() {
        final Node taken = node;
        if (!readOnly) {
            node = Node.NULL;
        }
        return new Value(taken);
    }

    /// Replaces this value's payload with a deep copy of `value`.
    ///
    /// @return `false` if this is the read-only missing sentinel
    /// @throws NullPointerException if `value` is `null`
    public boolean set(JsonConvertible value) {
        final Value source = owned(value);
        if (readOnly) {
            return false;
        }
        node = source.node;
        return true;
    }

    // ------------------------------------------------------------------
    // Type
    // ------------------------------------------------------------------

    public Type type() {
        return node.type();
    }

    public boolean isNull() {
        return node.type() == Type.NULL;
    }

    /// {@return true if this is an integer or a number}
    public boolean isNumber() {
        return node.type().isNumeric();
    }

    public boolean isInteger() {
        return node.type() == Type.INTEGER;
    }

    public boolean isBool() {
        return node.type() == Type.BOOL;
    }

    public boolean isString() {
        return node.type() == Type.STRING;
    }

    public boolean isArray() {
        return node.type() == Type.ARRAY;
    }

    public boolean isObject() {
        return node.type() == Type.OBJECT;
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    /// {@return the numeric value as a `double`, or `0.0` if this is not numeric}
    public double numberValue() {
        if (node instanceof IntegerNode i) {
            return i.value();
        }
        if (node instanceof NumberNode n) {
            return n.value();
        }
        return 0.0;
    }

    /// {@return the numeric value as a `long`, or `0` if this is not numeric}
    /// A number is truncated toward zero; `NaN` gives `0` and values beyond the `long`
    /// range, infinities included, saturate to `Long.MIN_VALUE` or `Long.MAX_VALUE`.
    public long longValue() {
        if (node instanceof IntegerNode i) {
            return i.value();
        }
        if (node instanceof NumberNode n) {
            return (long) n.value();
        }
        return 0L;
    }

    /// {@return the boolean, or `false` if this is not a boolean}
    public boolean boolValue() {
        return node instanceof BoolNode b && b.value();
    }

    /// {@return the string, or `""` if this is not a string}
    public String stringValue() {
        return node instanceof StringNode s ? s.value() : "";
    }

    /// {@return an unmodifiable view of the elements, or an empty list if this
    /// is not an array} The elements are the live cells of this array.
    public List<Value> arrayItems() {
        return node instanceof ArrayNode a ? Collections.unmodifiableList(a.items()) : EMPTY_ITEMS;
    }

    /// {@return an unmodifiable key-sorted view of the members, or an empty
    /// map if this is not an object} The values are the live cells of this object.
    public SortedMap<String, Value> objectItems() {
        return node instanceof ObjectNode o ? Collections.unmodifiableSortedMap(o.members()) : EMPTY_MEMBERS;
    }

    /// {@return the number of elements if this is an array, otherwise `0`}
    public int size() {
        return node instanceof ArrayNode a ? a.items().size() : 0;
    }

    /// {@return the element at `index`, or the shared read-only null if this is
    /// not an array or `index` is out of range}
    ///
    /// A stored null and a missing element look the same here; use
    /// [#find(int)] to tell them apart.
    public Value get(int index) {
        return find(index).orElse(MISSING);
    }

    /// {@return the member named `key`, or the shared read-only null if this is
    /// not an object or has no such member}
    ///
    /// A member holding null and an absent member look the same here; use
    /// [#find(String)] to tell them apart.
    ///
    /// @throws NullPointerException if `key` is `null`
    public Value get(String key) {
        return find(key).orElse(MISSING);
    }

    /// {@return the element at `index`, or empty if this is not an array or
    /// `index` is out of range}
    public Optional<Value> find(int index) {
        if (node instanceof ArrayNode a && index >= 0 && index < a.items().size()) {
            return Optional.of(a.items().get(index));
        }
        return Optional.empty();
    }

    /// {@return the member named `key`, or empty if this is not an object or
    /// has no such member}
    ///
    /// @throws NullPointerException if `key` is `null`
    public Optional<Value> find(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (node instanceof ObjectNode o) {
            return Optional.ofNullable(o.members().get(key));
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Mutators
    // ------------------------------------------------------------------

    /// Stores a copy of `value` under `key`, replacing any previous member.
    /// A null receiver first becomes an empty object.
    ///
    /// @return `false`, with nothing changed, if this is neither null nor an
    ///         object, or is the read-only missing sentinel
    /// @throws NullPointerException if `key` or `value` is `null`
    public boolean put(String key, JsonConvertible value) {
        Objects.requireNonNull(key, "key must not be null");
        final Value member = owned(value);
        final Optional<ObjectNode> target = objectForWrite();
        target.ifPresent(o -> o.members().put(key, member));
        return target.isPresent();
    }

    /// Returns the live member under `key`, inserting a null member when it is
    /// absent. A null receiver first becomes an empty object.
    ///
    /// Chaining builds nested structure in place:
    /// ```java
    /// Value root = Value.ofNull();
    /// root.getOrCreate("a").flatMap(a -> a.getOrCreate("b")).ifPresent(b -> b.set(Value.of(1)));
    /// // {"a": {"b": 1}}
    /// ```
    ///
    /// @return the member, or empty, with nothing changed, if this is neither
    ///         null nor an object, or is the read-only missing sentinel
    /// @throws NullPointerException if `key` is `null`
    public Optional<Value> getOrCreate(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return objectForWrite().map(o -> o.members().computeIfAbsent(key, k -> ofNull()));
    }

    /// Appends a copy of `value`. A null receiver becomes a one-element array.
    ///
    /// @return `false`, with nothing changed, if this is neither null nor an
    ///         array, or is the read-only missing sentinel
    /// @throws NullPointerException if `value` is `null`
    public boolean append(JsonConvertible value) {
        final Value element = owned(value);
        if (readOnly) {
            return false;
        }
        if (node instanceof ArrayNode a) {
            a.items().add(element);
            return true;
        }
        if (node.type() == Type.NULL) {
            final var vivified = new ArrayNode();
            vivified.items().add(element);
            node = vivified;
            return true;
        }
        return false;
    }

    private Optional<ObjectNode> objectForWrite() {
        if (readOnly) {
            return Optional.empty();
        }
        if (node instanceof ObjectNode o) {
            return Optional.of(o);
        }
        if (node.type() == Type.NULL) {
            final var vivified = new ObjectNode();
            node = vivified;
            return Optional.of(vivified);
        }
        return Optional.empty();
    }

    Node node() {
        return node;
    }

    // ------------------------------------------------------------------
    // Shape
    // ------------------------------------------------------------------

    /// {@return true if this is an object whose fields match `shape`}
    ///
    /// @see ShapeValidator#validate(Shape, Value)
    public boolean hasShape(Shape shape) {
        return ShapeValidator.validate(shape, this).isValid();
    }

    /// {@return the outcome of checking this value against `shape`, with a
    /// message describing the first mismatch}
    public ShapeResult checkShape(Shape shape) {
        return ShapeValidator.validate(shape, this);
    }

    // ------------------------------------------------------------------
    // Serialization
    // ------------------------------------------------------------------

    /// {@return the canonical compact JSON text of this value}
    public String toText() {
        final var out = new StringBuilder();
        JsonWriter.write(this, out);
        return out.toString();
    }

    /// Appends the canonical compact JSON text of this value to `out`.
    ///
    /// @return `out`
    public StringBuilder toText(StringBuilder out) {
        JsonWriter.write(this, Objects.requireNonNull(out, "out must not be null"));
        return out;
    }

    /// {@return the canonical JSON text encoded as UTF-8} Lone surrogates are
    /// written as their own three-byte sequences, see [Utf8#encode(CharSequence)].
    public byte[] toUtf8() {
        return Utf8.encode(toText());
    }

    // ------------------------------------------------------------------
    // Equality and order
    // ------------------------------------------------------------------

    @Override
    public boolean equals(Object obj) {
        return this == obj || obj instanceof Value other && ValueComparator.equal(this, other);
    }

    @Override
    public int hashCode() {
        return ValueComparator.hash(this);
    }

    @Override
    public int compareTo(Value other) {
        return ValueComparator.INSTANCE.compare(this, other);
    }

    /// {@return the same text as [#toText()]}
    @Override
    public String toString() {
        return toText();
    }
}
