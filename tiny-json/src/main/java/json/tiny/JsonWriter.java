package json.tiny;

import java.util.List;
import java.util.Map;

import json.tiny.Node.ArrayNode;
import json.tiny.Node.BoolNode;
import json.tiny.Node.IntegerNode;
import json.tiny.Node.NumberNode;
import json.tiny.Node.ObjectNode;
import json.tiny.Node.StringNode;

/// Writes the single canonical text form of a [Value].
///
/// | Variant | Text |
/// |---------|------|
/// | null    | `null` |
/// | bool    | `true` / `false` |
/// | integer | [Long#toString(long)] |
/// | number  | [Double#toString(double)], or `null` when not finite |
/// | string  | quoted, see [#escape(String, StringBuilder)] |
/// | array   | `[1, 2, 3]` |
/// | object  | `{"a": 1, "b": 2}` in key order |
///
/// `Double.toString` always emits a `.` or an exponent, so a number never
/// reads back as an integer.
final class JsonWriter {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private JsonWriter() {
    }

    static void write(Value value, StringBuilder out) {
        write(value.node(), out);
    }

    private static void write(Node node, StringBuilder out) {
        if (node instanceof IntegerNode i) {
            out.append(i.value());
        } else if (node instanceof NumberNode n) {
            writeNumber(n.value(), out);
        } else if (node instanceof BoolNode b) {
            out.append(b.value() ? "true" : "false");
        } else if (node instanceof StringNode s) {
            escape(s.value(), out);
        } else if (node instanceof ArrayNode a) {
            writeArray(a.items(), out);
        } else if (node instanceof ObjectNode o) {
            writeObject(o.members(), out);
        } else {
            out.append("null");
        }
    }

    private static void writeNumber(double d, StringBuilder out) {
        if (Double.isFinite(d)) {
            out.append(d);
        } else {
            out.append("null");
        }
    }

    private static void writeArray(List<Value> items, StringBuilder out) {
        out.append('[');
        boolean first = true;
        for (final Value item : items) {
            if (!first) {
                out.append(", ");
            }
            write(item.node(), out);
            first = false;
        }
        out.append(']');
    }

    private static void writeObject(Map<String, Value> members, StringBuilder out) {
        out.append('{');
        boolean first = true;
        for (final Map.Entry<String, Value> member : members.entrySet()) {
            if (!first) {
                out.append(", ");
            }
            escape(member.getKey(), out);
            out.append(": ");
            write(member.getValue().node(), out);
            first = false;
        }
        out.append('}');
    }

    /// Appends `value` as a quoted JSON string.
    ///
    /// Escapes backslash, quote, the short forms `b f n r t`, every other
    /// control character as a six-character `u00xx` escape, and the line and
    /// paragraph separators U+2028 / U+2029 as `u2028` / `u2029` escapes so
    /// the text can be embedded in a script string literal.
    /// Everything else, lone surrogates included, is copied as is.
    static void escape(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            final char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\u2028' -> out.append("\\u2028");
                case '\u2029' -> out.append("\\u2029");
                default -> {
                    if (ch < 0x20) {
                        out.append("\\u00").append(HEX[ch >> 4]).append(HEX[ch & 0xF]);
                    } else {
                        out.append(ch);
                    }
                }
            }
        }
        out.append('"');
    }
}
