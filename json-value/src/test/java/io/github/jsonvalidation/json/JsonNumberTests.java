package io.github.jsonvalidation.json;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JsonNumberTests {

    @Test
    void highPrecisionNumberIsLosslessViaToString() {
        var text = "3.141592653589793238462643383279";
        var n = (JsonNumber) Json.parse(text);

        assertThat(n.toString()).isEqualTo(text);
        assertThat(n.toBigDecimal()).isEqualByComparingTo(new BigDecimal(text));
        assertThat(new BigDecimal(Double.toString(n.toDouble()))).isNotEqualByComparingTo(n.toBigDecimal());
    }

    @Test
    void integralLiteralsStayIntegral() {
        assertThat(((JsonNumber) Json.parse("42")).toNumber()).isEqualTo(42L);
        assertThat(((JsonNumber) Json.parse("-9223372036854775809")).toNumber())
                .isEqualTo(new BigInteger("-9223372036854775809"));
        assertThat(((JsonNumber) Json.parse("2.50")).toNumber()).isEqualTo(2.5);
    }

    @Test
    void convertingNonIntegralNumberToLongThrows() {
        var n = (JsonNumber) Json.parse("5.5");
        assertThatThrownBy(n::toLong).isInstanceOf(JsonAssertionException.class);
        assertThat(((JsonNumber) Json.parse("5.0")).toLong()).isEqualTo(5L);
        assertThat(((JsonNumber) Json.parse("1e2")).toLong()).isEqualTo(100L);
    }

    @Test
    void convertingOutOfRangeNumberToDoubleThrows() {
        var n = (JsonNumber) Json.parse("1e309");
        assertThatThrownBy(n::toDouble).isInstanceOf(JsonAssertionException.class);
        assertThat(n.toNumber()).isEqualTo(new BigDecimal("1e309"));
    }

    @Test
    void equalityFollowsTheLiteral() {
        assertThat(Json.parse("1e3")).isEqualTo(Json.parse("1E3"));
        assertThat(Json.parse("1")).isNotEqualTo(Json.parse("1.0"));
        assertThat(Json.parse("1e3").hashCode()).isEqualTo(Json.parse("1E3").hashCode());
    }

    @Test
    void factoriesValidateTheirInput() {
        assertThat(JsonNumber.of("12.5").toString()).isEqualTo("12.5");
        assertThatThrownBy(() -> JsonNumber.of("12.")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonNumber.of("\"12\"")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonNumber.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}
