package json.tiny;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParseMultipleTest extends TinyJsonTestBase {

    @Test
    void whitespaceSeparatedScalars() {
        final MultiParseResult result = Json.parseMultiple("1 2 3");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.errorMessage()).isEmpty();
        assertThat(result.values()).containsExactly(Value.of(1), Value.of(2), Value.of(3));
    }

    @Test
    void adjacentContainersNeedNoSeparator() {
        final MultiParseResult result = Json.parseMultiple("{}{\"a\": 1}[true]\"s\"");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.values()).extracting(Value::toText)
                .containsExactly("{}", "{\"a\": 1}", "[true]", "\"s\"");
    }

    @Test
    void leadingAndTrailingWhitespaceIsIgnored() {
        final MultiParseResult result = Json.parseMultiple("\n  [1]\t\r\n null  \n");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.values()).hasSize(2);
        assertThat(result.values().get(1).isNull()).isTrue();
    }

    @Test
    void emptyInputYieldsNoValues() {
        assertThat(Json.parseMultiple("").values()).isEmpty();
        assertThat(Json.parseMultiple("").isSuccess()).isTrue();
        assertThat(Json.parseMultiple(" \n\t ").values()).isEmpty();
        assertThat(Json.parseMultiple(" \n\t ").findError()).isEmpty();
    }

    @Test
    void failureKeepsEarlierValuesAndAppendsNull() {
        final MultiParseResult result = Json.parseMultiple("[1] {\"a\": 2} [3,");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error().kind()).isEqualTo(ParseError.Kind.UNEXPECTED_END);
        assertThat(result.values()).hasSize(3);
        assertThat(result.values().get(0).toText()).isEqualTo("[1]");
        assertThat(result.values().get(1).get("a").longValue()).isEqualTo(2L);
        assertThat(result.values().get(2).isNull()).isTrue();
    }

    @Test
    void failureOnFirstValueYieldsOnlyNull() {
        final MultiParseResult result = Json.parseMultiple("@");

        assertThat(result.findError()).hasValueSatisfying(
                e -> assertThat(e.kind()).isEqualTo(ParseError.Kind.UNEXPECTED_TOKEN));
        assertThat(result.values()).containsExactly(Value.ofNull());
    }

    @Test
    void valuesAreUnmodifiable() {
        final MultiParseResult result = Json.parseMultiple("1");

        assertThatThrownBy(() -> result.values().add(Value.of(2)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void decodesUtf8Bytes() {
        final MultiParseResult result = Json.parseMultiple("\"a\" \"b\"".getBytes(StandardCharsets.UTF_8));

        assertThat(result.values()).extracting(Value::stringValue).containsExactly("a", "b");
    }
}
