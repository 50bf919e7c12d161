package com.ciro.remi.expr;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("JsValues")
class JsValuesTest {

    @Nested
    @DisplayName("formatNumber")
    class FormatNumber {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "5, 5",
            "2.5, 2.5",
            "-3, -3",
            "0.000001, 0.000001",
            "1e-7, 1e-7",
            "1.5e-7, 1.5e-7",
            "1e21, 1e+21",
            "123456789012345680000, 123456789012345680000"
        })
        void printsLikeJavaScript(double input, String expected) {
            assertThat(JsValues.formatNumber(input)).isEqualTo(expected);
        }

        @Test
        void specialValues() {
            assertThat(JsValues.formatNumber(Double.NaN)).isEqualTo("NaN");
            assertThat(JsValues.formatNumber(Double.POSITIVE_INFINITY)).isEqualTo("Infinity");
            assertThat(JsValues.formatNumber(Double.NEGATIVE_INFINITY)).isEqualTo("-Infinity");
            assertThat(JsValues.formatNumber(-0.0)).isEqualTo("0");
        }

        @Test
        void floatingPointNoiseIsKept() {
            assertThat(JsValues.formatNumber(0.1 + 0.2)).isEqualTo("0.30000000000000004");
        }
    }

    @Nested
    @DisplayName("truthiness")
    class Truthiness {

        @Test
        void falsyValues() {
            assertThat(JsValues.isTruthy(JsValues.undefined())).isFalse();
            assertThat(JsValues.isTruthy(NullNode.getInstance())).isFalse();
            assertThat(JsValues.isTruthy(JsValues.bool(false))).isFalse();
            assertThat(JsValues.isTruthy(JsValues.number(0))).isFalse();
            assertThat(JsValues.isTruthy(JsValues.number(Double.NaN))).isFalse();
            assertThat(JsValues.isTruthy(JsValues.string(""))).isFalse();
        }

        @Test
        void truthyValues() {
            assertThat(JsValues.isTruthy(JsValues.string("0"))).isTrue();
            assertThat(JsValues.isTruthy(JsValues.number(-1))).isTrue();
            assertThat(JsValues.isTruthy(JsonNodeFactory.instance.arrayNode())).isTrue();
            assertThat(JsValues.isTruthy(JsonNodeFactory.instance.objectNode())).isTrue();
        }
    }

    @Test
    @DisplayName("arrays join with commas and drop nullish elements")
    void arrayToString() {
        JsonNode arr = JsonNodeFactory.instance.arrayNode()
                .add(1.0)
                .add(NullNode.getInstance())
                .add("a");
        assertThat(JsValues.toDisplayString(arr)).isEqualTo("1,,a");
    }

    @Test
    void objectToString() {
        assertThat(JsValues.toDisplayString(JsonNodeFactory.instance.objectNode().put("a", 1)))
                .isEqualTo("[object Object]");
    }

    @Test
    void toNumberCoercion() {
        assertThat(JsValues.toNumber(JsValues.string(" 42 "))).isEqualTo(42.0);
        assertThat(JsValues.toNumber(JsValues.string(""))).isEqualTo(0.0);
        assertThat(JsValues.toNumber(JsValues.string("0x1F"))).isEqualTo(31.0);
        assertThat(JsValues.toNumber(JsValues.string("1d"))).isNaN();
        assertThat(JsValues.toNumber(JsValues.bool(true))).isEqualTo(1.0);
        assertThat(JsValues.toNumber(NullNode.getInstance())).isEqualTo(0.0);
        assertThat(JsValues.toNumber(JsValues.undefined())).isNaN();
    }

    @Test
    @DisplayName("== coerces, === does not")
    void equality() {
        assertThat(JsValues.looseEquals(JsValues.string("1"), JsValues.number(1))).isTrue();
        assertThat(JsValues.strictEquals(JsValues.string("1"), JsValues.number(1))).isFalse();
        assertThat(JsValues.looseEquals(NullNode.getInstance(), JsValues.undefined())).isTrue();
        assertThat(JsValues.strictEquals(NullNode.getInstance(), JsValues.undefined())).isFalse();
        assertThat(JsValues.looseEquals(NullNode.getInstance(), JsValues.number(0))).isFalse();
        assertThat(JsValues.looseEquals(JsValues.string(""), JsValues.number(0))).isTrue();
        assertThat(JsValues.looseEquals(JsValues.bool(true), JsValues.number(1))).isTrue();
        assertThat(JsValues.strictEquals(JsValues.number(Double.NaN), JsValues.number(Double.NaN))).isFalse();
    }

    @Test
    void typeOf() {
        assertThat(JsValues.typeOf(JsValues.undefined())).isEqualTo("undefined");
        assertThat(JsValues.typeOf(NullNode.getInstance())).isEqualTo("object");
        assertThat(JsValues.typeOf(JsValues.number(1))).isEqualTo("number");
        assertThat(JsValues.typeOf(JsValues.string("s"))).isEqualTo("string");
        assertThat(JsValues.typeOf(JsValues.bool(true))).isEqualTo("boolean");
    }
}
