package json.tiny;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import json.tiny.Node.ArrayNode;
import json.tiny.Node.BoolNode;
import json.tiny.Node.IntegerNode;
import json.tiny.Node.NumberNode;
import json.tiny.Node.ObjectNode;
import json.tiny.Node.StringNode;

/// Structural equality and a total order over [Value]s.
///
/// - Integers and numbers form one numeric class and compare by exact
///   numeric value: `1 == 1.0`, `-0.0 == 0`, and a `long` is never rounded
///   to a `double` for the comparison. NaN equals NaN and sorts above every
///   other number.
/// - Values of different classes order by [Type] ordinal:
///   null < numeric < bool < string < array < object.
/// - Same-class values order by payload: `false < true`, strings by their
///   UTF-8 bytes, arrays element by element, objects pair by pair over the
///   key-sorted `(key, value)` sequence. A proper prefix sorts first.
///
/// [#hash(Value)] is consistent with this equality.
public final class ValueComparator implements Comparator<Value> {

    public static final ValueComparator INSTANCE = new ValueComparator();

    /// Orders strings by their UTF-8 encoding compared byte by byte, which is
    /// Unicode code point order. Lone surrogates sort as the code points they
    /// name. Object keys use this order.
    public static final Comparator<String> KEY_ORDER = ValueComparator::compareStrings;

    private static final double TWO_POW_63 = 0x1p63;

    private ValueComparator() {
    }

    @Override
    public int compare(Value left, Value right) {
        return compareNodes(left.node(), right.node());
    }

    /// {@return true if `left` and `right` are structurally equal}
    public static boolean equal(Value left, Value right) {
        return compareNodes(left.node(), right.node()) == 0;
    }

    /// {@return a hash code consistent with [#equal(Value, Value)]}
    public static int hash(Value value) {
        return hashNode(value.node());
    }

    private static int compareNodes(Node left, Node right) {
        if (left == right) {
            return 0;
        }
        final Type lt = left.type();
        final Type rt = right.type();
        if (lt.isNumeric() && rt.isNumeric()) {
            return compareNumeric(left, right);
        }
        if (lt != rt) {
            return Integer.compare(rank(lt), rank(rt));
        }
        if (left instanceof BoolNode l && right instanceof BoolNode r) {
            return Boolean.compare(l.value(), r.value());
        }
        if (left instanceof StringNode l && right instanceof StringNode r) {
            return compareStrings(l.value(), r.value());
        }
        if (left instanceof ArrayNode l && right instanceof ArrayNode r) {
            return compareArrays(l.items(), r.items());
        }
        if (left instanceof ObjectNode l && right instanceof ObjectNode r) {
            return compareObjects(l.members(), r.members());
        }
        return 0; // both null
    }

    private static int rank(Type type) {
        // INTEGER and NUMBER share a rank
        return type == Type.NUMBER ? Type.INTEGER.ordinal() : type.ordinal();
    }

    private static int compareNumeric(Node left, Node right) {
        if (left instanceof IntegerNode l && right instanceof IntegerNode r) {
            return Long.compare(l.value(), r.value());
        }
        if (left instanceof IntegerNode l && right instanceof NumberNode r) {
            return compareLongToDouble(l.value(), r.value());
        }
        if (left instanceof NumberNode l && right instanceof IntegerNode r) {
            return -compareLongToDouble(r.value(), l.value());
        }
        if (left instanceof NumberNode l && right instanceof NumberNode r) {
            return compareDoubles(l.value(), r.value());
        }
        throw new AssertionError("not numeric: " + left.type() + ", " + right.type());
    }

    private static int compareDoubles(double l, double r) {
        if (l < r) {
            return -1;
        }
        if (l > r) {
            return 1;
        }
        if (l == r) {
            return 0; // covers -0.0 == 0.0
        }
        return Boolean.compare(Double.isNaN(l), Double.isNaN(r));
    }

    private static int compareLongToDouble(long l, double d) {
        if (Double.isNaN(d) || d >= TWO_POW_63) {
            return -1;
        }
        if (d < -TWO_POW_63) {
            return 1;
        }
        // d is in [-2^63, 2^63) so the truncation is exact
        final long whole = (long) d;
        if (l != whole) {
            return Long.compare(l, whole);
        }
        final double fraction = d - whole;
        return fraction > 0 ? -1 : fraction < 0 ? 1 : 0;
    }

    static int compareStrings(String left, String right) {
        final int ln = left.length();
        final int rn = right.length();
        int i = 0;
        int j = 0;
        while (i < ln && j < rn) {
            final int lc = left.codePointAt(i);
            final int rc = right.codePointAt(j);
            if (lc != rc) {
                return Integer.compare(lc, rc);
            }
            i += Character.charCount(lc);
            j += Character.charCount(rc);
        }
        return Boolean.compare(i < ln, j < rn);
    }

    private static int compareArrays(List<Value> left, List<Value> right) {
        final int n = Math.min(left.size(), right.size());
        for (int i = 0; i < n; i++) {
            final int c = compareNodes(left.get(i).node(), right.get(i).node());
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareObjects(Map<String, Value> left, Map<String, Value> right) {
        final Iterator<Map.Entry<String, Value>> li = left.entrySet().iterator();
        final Iterator<Map.Entry<String, Value>> ri = right.entrySet().iterator();
        while (li.hasNext() && ri.hasNext()) {
            final Map.Entry<String, Value> l = li.next();
            final Map.Entry<String, Value> r = ri.next();
            int c = compareStrings(l.getKey(), r.getKey());
            if (c == 0) {
                c = compareNodes(l.getValue().node(), r.getValue().node());
            }
            if (c != 0) {
                return c;
            }
        }
        return Boolean.compare(li.hasNext(), ri.hasNext());
    }

    private static int hashNode(Node node) {
        if (node instanceof IntegerNode i) {
            return Long.hashCode(i.value());
        }
        if (node instanceof NumberNode n) {
            return hashDouble(n.value());
        }
        if (node instanceof BoolNode b) {
            return Boolean.hashCode(b.value());
        }
        if (node instanceof StringNode s) {
            return s.value().hashCode();
        }
        if (node instanceof ArrayNode a) {
            int h = 1;
            for (final Value item : a.items()) {
                h = 31 * h + hashNode(item.node());
            }
            return h;
        }
        if (node instanceof ObjectNode o) {
            int h = 7;
            for (final Map.Entry<String, Value> member : o.members().entrySet()) {
                h = 31 * h + (member.getKey().hashCode() ^ hashNode(member.getValue().node()));
            }
            return h;
        }
        return 0;
    }

    private static int hashDouble(double d) {
        // a whole double must hash like the equal long
        if (d >= -TWO_POW_63 && d < TWO_POW_63 && d == Math.rint(d)) {
            return Long.hashCode((long) d);
        }
        return Double.isNaN(d) ? Double.hashCode(Double.NaN) : Double.hashCode(d);
    }
}
