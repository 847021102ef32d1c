package json.tiny;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Construction, accessors and ownership of [Value].
class ValueTest extends TinyJsonTestBase {

    record Point(int x, int y) implements JsonConvertible {
        @Override
        public Value toValue() {
            return Value.object(Map.of("x", Value.of(x), "y", Value.of(y)));
        }
    }

    @Test
    void literalFactoriesSetTheTag() {
        assertThat(Value.ofNull().type()).isEqualTo(Type.NULL);
        assertThat(Value.of(true).type()).isEqualTo(Type.BOOL);
        assertThat(Value.of(7).type()).isEqualTo(Type.INTEGER);
        assertThat(Value.of(7L).type()).isEqualTo(Type.INTEGER);
        assertThat(Value.of(7.5).type()).isEqualTo(Type.NUMBER);
        assertThat(Value.of("s").type()).isEqualTo(Type.STRING);
        assertThat(Value.array().type()).isEqualTo(Type.ARRAY);
        assertThat(Value.object().type()).isEqualTo(Type.OBJECT);
    }

    @Test
    void integerAndNumberAreBothNumeric() {
        assertThat(Value.of(1).isNumber()).isTrue();
        assertThat(Value.of(1.0).isNumber()).isTrue();
        assertThat(Value.of(1).isInteger()).isTrue();
        assertThat(Value.of(1.0).isInteger()).isFalse();
        assertThat(Value.of(true).isNumber()).isFalse();
    }

    @Test
    void accessorsReturnNeutralDefaultsForOtherVariants() {
        final Value str = Value.of("a");
        assertThat(str.numberValue()).isEqualTo(0.0);
        assertThat(str.longValue()).isZero();
        assertThat(str.stringValue()).isEqualTo("a");
        assertThat(str.boolValue()).isFalse();
        assertThat(str.arrayItems()).isEmpty();
        assertThat(str.objectItems()).isEmpty();
        assertThat(str.size()).isZero();

        final Value nul = Value.ofNull();
        assertThat(nul.numberValue()).isEqualTo(0.0);
        assertThat(nul.stringValue()).isEmpty();
    }

    @Test
    void numericAccessorsConvertBetweenIntegerAndNumber() {
        assertThat(Value.of(42).numberValue()).isEqualTo(42.0);
        assertThat(Value.of(-3.9).longValue()).isEqualTo(-3L);
        assertThat(Value.of(Long.MAX_VALUE).longValue()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void longValueOfNonFiniteAndHugeNumbersSaturates() {
        assertThat(Value.of(Double.NaN).longValue()).isZero();
        assertThat(Value.of(Double.POSITIVE_INFINITY).longValue()).isEqualTo(Long.MAX_VALUE);
        assertThat(Value.of(Double.NEGATIVE_INFINITY).longValue()).isEqualTo(Long.MIN_VALUE);
        assertThat(Value.of(1e30).longValue()).isEqualTo(Long.MAX_VALUE);
        assertThat(Value.of(-1e30).longValue()).isEqualTo(Long.MIN_VALUE);
    }

    @Test
    void indexingMissingElementsReturnsNull() {
        final Value doc = Json.parse("{\"k1\":\"v1\", \"k2\":42, \"k3\":[\"a\",123,true,false,null]}");

        assertThat(doc.get("k1").stringValue()).isEqualTo("v1");
        assertThat(doc.get("k3").get(1).longValue()).isEqualTo(123L);
        assertThat(doc.get("k3").size()).isEqualTo(5);

        assertThat(doc.get("nope").isNull()).isTrue();
        assertThat(doc.get("k3").get(99).isNull()).isTrue();
        assertThat(doc.get("k3").get(-1).isNull()).isTrue();
        assertThat(doc.get(0).isNull()).isTrue();
        assertThat(doc.get("k1").get("x").isNull()).isTrue();
        assertThat(doc.get("nope").get("deeper").get(3).isNull()).isTrue();
    }

    @Test
    void findDistinguishesAbsentFromExplicitNull() {
        final Value doc = Json.parse("{\"present\": null}");

        assertThat(doc.get("present")).isEqualTo(doc.get("absent"));
        assertThat(doc.find("present")).hasValueSatisfying(v -> assertThat(v.isNull()).isTrue());
        assertThat(doc.find("absent")).isEmpty();

        final Value arr = Json.parse("[null]");
        assertThat(arr.find(0)).isPresent();
        assertThat(arr.find(1)).isEmpty();
    }

    @Test
    void objectItemsAreKeySorted() {
        final var members = new LinkedHashMap<String, Value>();
        members.put("zeta", Value.of(1));
        members.put("alpha", Value.of(2));
        members.put("mid", Value.of(3));

        final Value obj = Value.object(members);

        assertThat(obj.objectItems().keySet()).containsExactly("alpha", "mid", "zeta");
        assertThat(obj.toText()).isEqualTo("{\"alpha\": 2, \"mid\": 3, \"zeta\": 1}");
    }

    @Test
    void viewsAreUnmodifiable() {
        final Value arr = Value.array(Value.of(1));
        final Value obj = Value.object(Map.of("a", Value.of(1)));

        assertThatThrownBy(() -> arr.arrayItems().add(Value.of(2)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> obj.objectItems().put("b", Value.of(2)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void bulkConstructionFromDifferentCollectionsIsEqual() {
        final List<Long> list = new LinkedList<>(List.of(1L, 2L, 3L));
        final Set<Long> set = new TreeSet<>(Set.of(3L, 1L, 2L));

        final Value fromList = Value.array(list, n -> Value.of(n.longValue()));
        final Value fromSet = Value.array(set, n -> Value.of(n.longValue()));

        assertThat(fromList).isEqualTo(fromSet);
        assertThat(fromList.toText()).isEqualTo("[1, 2, 3]");

        final Map<String, String> m1 = Map.of("k1", "v1", "k2", "v2");
        final Map<String, String> m2 = new LinkedHashMap<>();
        m2.put("k2", "v2");
        m2.put("k1", "v1");
        assertThat(Value.object(m1, Value::of)).isEqualTo(Value.object(m2, Value::of));
    }

    @Test
    void convertibleTypesBuildValues() {
        final List<Point> points = List.of(new Point(1, 2), new Point(10, 20), new Point(100, 200));

        final Value json = Value.array(points);

        assertThat(json.toText())
                .isEqualTo("[{\"x\": 1, \"y\": 2}, {\"x\": 10, \"y\": 20}, {\"x\": 100, \"y\": 200}]");
        assertThat(Value.of(new Point(3, 4)).get("y").longValue()).isEqualTo(4L);
    }

    @Test
    void literalTreeEqualsParsedDocument() {
        final Value literal = Value.object(Map.of(
                "k1", Value.of("v1"),
                "k2", Value.of(42.0),
                "k3", Value.array(Value.of("a"), Value.of(123.0), Value.of(true), Value.of(false), Value.ofNull())));

        final Value parsed = Json.parse("{\"k1\":\"v1\", \"k2\":42, \"k3\":[\"a\",123,true,false,null]}");

        assertThat(literal).isEqualTo(parsed);
        assertThat(literal.hashCode()).isEqualTo(parsed.hashCode());
    }

    @Test
    void copyIsDeep() {
        final Value original = Json.parse("{\"list\": [1, 2], \"name\": \"x\"}");

        final Value copy = original.copy();
        copy.get("list").append(Value.of(3));

        assertThat(original.get("list").size()).isEqualTo(2);
        assertThat(copy.get("list").size()).isEqualTo(3);
        assertThat(copy).isNotEqualTo(original);
    }

    @Test
    void moveTransfersOwnershipAndLeavesNull() {
        final Value source = Json.parse("[1, [2, 3]]");

        final Value target = source.move();

        assertThat(source.isNull()).isTrue();
        assertThat(target.toText()).isEqualTo("[1, [2, 3]]");
    }

    @Test
    void containersCopyTheirInputs() {
        final Value element = Value.array(Value.of(1));
        final Value holder = Value.array(element);

        element.append(Value.of(2));

        assertThat(holder.toText()).isEqualTo("[[1]]");
    }

    @Test
    void nullArgumentsAreRejected() {
        assertThatThrownBy(() -> Value.of((String) null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Value.object().get((String) null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Value.array((Iterable<JsonConvertible>) null))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Value.of((JsonConvertible) () -> null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("toValue() returned null");
    }

    @Test
    void toStringIsTheCanonicalText() {
        final Value v = Json.parse("{\"b\":[true,null],\"a\":\"x\"}");
        assertThat(v.toString()).isEqualTo("{\"a\": \"x\", \"b\": [true, null]}");
        assertThat(v.toText(new StringBuilder("prefix:")).toString())
                .isEqualTo("prefix:{\"a\": \"x\", \"b\": [true, null]}");
    }
}
