package json.tiny;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// Payload of a [Value]. One record per variant so the tag and the payload
/// can never disagree.
///
/// Scalar nodes are immutable and freely shared. [ArrayNode] and
/// [ObjectNode] own mutable containers of [Value] cells and belong to
/// exactly one `Value`.
sealed interface Node permits Node.NullNode, Node.IntegerNode, Node.NumberNode,
        Node.BoolNode, Node.StringNode, Node.ArrayNode, Node.ObjectNode {

    NullNode NULL = new NullNode();
    BoolNode TRUE = new BoolNode(true);
    BoolNode FALSE = new BoolNode(false);

    Type type();

    /// {@return a node equal to this one that shares no mutable state with it}
    Node deepCopy();

    static BoolNode of(boolean b) {
        return b ? TRUE : FALSE;
    }

    record NullNode() implements Node {
        @Override
        public Type type() {
            return Type.NULL;
        }

        @Override
        public Node deepCopy() {
            return this;
        }
    }

    record IntegerNode(long value) implements Node {
        @Override
        public Type type() {
            return Type.INTEGER;
        }

        @Override
        public Node deepCopy() {
            return this;
        }
    }

    record NumberNode(double value) implements Node {
        @Override
        public Type type() {
            return Type.NUMBER;
        }

        @Override
        public Node deepCopy() {
            return this;
        }
    }

    record BoolNode(boolean value) implements Node {
        @Override
        public Type type() {
            return Type.BOOL;
        }

        @Override
        public Node deepCopy() {
            return this;
        }
    }

    record StringNode(String value) implements Node {
        @Override
        public Type type() {
            return Type.STRING;
        }

        @Override
        public Node deepCopy() {
            return this;
        }
    }

    record ArrayNode(List<Value> items) implements Node {
        ArrayNode() {
            this(new ArrayList<>());
        }

        @Override
        public Type type() {
            return Type.ARRAY;
        }

        @Override
        public Node deepCopy() {
            final var copy = new ArrayList<Value>(items.size());
            for (final Value item : items) {
                copy.add(item.copy());
            }
            return new ArrayNode(copy);
        }
    }

    /// Members are kept in a [TreeMap] ordered by [ValueComparator#KEY_ORDER]
    /// so iteration and serialization are always key-sorted.
    record ObjectNode(TreeMap<String, Value> members) implements Node {
        ObjectNode() {
            this(new TreeMap<>(ValueComparator.KEY_ORDER));
        }

        @Override
        public Type type() {
            return Type.OBJECT;
        }

        @Override
        public Node deepCopy() {
            final var copy = new TreeMap<String, Value>(ValueComparator.KEY_ORDER);
            for (final Map.Entry<String, Value> member : members.entrySet()) {
                copy.put(member.getKey(), member.getValue().copy());
            }
            return new ObjectNode(copy);
        }
    }
}
