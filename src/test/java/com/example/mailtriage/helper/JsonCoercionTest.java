package com.example.mailtriage.helper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonCoercionTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String value) throws Exception {
        return objectMapper.readTree(value);
    }

    @Test
    @DisplayName("Text: scalars render, containers and nulls are absent")
    void testText() throws Exception {
        assertThat(JsonCoercion.text(json("\"abc\""))).isEqualTo("abc");
        assertThat(JsonCoercion.text(json("12"))).isEqualTo("12");
        assertThat(JsonCoercion.text(json("true"))).isEqualTo("true");
        assertThat(JsonCoercion.text(json("{\"a\":1}"))).isNull();
        assertThat(JsonCoercion.text(NullNode.getInstance())).isNull();
        assertThat(JsonCoercion.trimmedOrNull(json("\"   \""))).isNull();
        assertThat(JsonCoercion.trimmed(MissingNode.getInstance())).isEmpty();
    }

    @Test
    @DisplayName("Numbers: numeric strings parse, NaN and garbage are absent")
    void testNumber() throws Exception {
        assertThat(JsonCoercion.number(json("0.75"))).isEqualTo(0.75);
        assertThat(JsonCoercion.number(json("\" 2.5 \""))).isEqualTo(2.5);
        assertThat(JsonCoercion.number(json("\"NaN\""))).isNull();
        assertThat(JsonCoercion.number(json("\"Infinity\""))).isNull();
        assertThat(JsonCoercion.number(json("\"high\""))).isNull();
        assertThat(JsonCoercion.number(json("[1]"))).isNull();
        assertThat(JsonCoercion.integer(json("2.6"))).isEqualTo(3);
        assertThat(JsonCoercion.integer(json("1e12"))).isNull();
    }

    @Test
    @DisplayName("Booleans accept true/yes/1 and non-zero numbers")
    void testBool() throws Exception {
        assertThat(JsonCoercion.bool(json("true"))).isTrue();
        assertThat(JsonCoercion.bool(json("\"Yes\""))).isTrue();
        assertThat(JsonCoercion.bool(json("1"))).isTrue();
        assertThat(JsonCoercion.bool(json("0"))).isFalse();
        assertThat(JsonCoercion.bool(json("\"no\""))).isFalse();
        assertThat(JsonCoercion.bool(MissingNode.getInstance())).isFalse();
    }

    @Test
    @DisplayName("Lists: a lone value counts as one element, blanks are dropped")
    void testLists() throws Exception {
        assertThat(JsonCoercion.stringList(json("[\" a \", \"\", null, 3, {\"x\":1}]"))).containsExactly("a", "3");
        assertThat(JsonCoercion.stringList(json("\"single\""))).containsExactly("single");
        assertThat(JsonCoercion.elements(json("{\"k\":1}"))).hasSize(1);
        assertThat(JsonCoercion.elements(json("\"text\""))).isEmpty();
        assertThat(JsonCoercion.elements(json("[1, 2]"))).hasSize(2);
    }
}
