package me.christianrobert.bsontranspiler.transformer.evaluator;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsValuesTest {

    @Test
    void toNumberConversions() {
        assertEquals(1.0, JsValues.toNumber(true));
        assertEquals(0.0, JsValues.toNumber(null));
        assertTrue(Double.isNaN(JsValues.toNumber(Undefined.INSTANCE)));
        assertEquals(0.0, JsValues.toNumber("  "));
        assertEquals(255.0, JsValues.toNumber("0xff"));
        assertEquals(8.0, JsValues.toNumber("0o10"));
        assertEquals(5.0, JsValues.toNumber("0b101"));
        assertEquals(-1.5, JsValues.toNumber(" -1.5 "));
        assertEquals(Double.NEGATIVE_INFINITY, JsValues.toNumber("-Infinity"));
        assertEquals(42.0, JsValues.toNumber(new LongValue(42)));
    }

    @Test
    void toNumberRejectsJavaOnlySyntax() {
        assertTrue(Double.isNaN(JsValues.toNumber("NaN1")));
        assertTrue(Double.isNaN(JsValues.toNumber("1d")));
        assertTrue(Double.isNaN(JsValues.toNumber("0x1p3")));
        assertTrue(Double.isNaN(JsValues.toNumber("abc")));
    }

    @Test
    void toInt32WrapsAround() {
        assertEquals(1, JsValues.toInt32(4294967297.0));
        assertEquals(Integer.MIN_VALUE, JsValues.toInt32(2147483648.0));
        assertEquals(-1, JsValues.toInt32(-1.9));
        assertEquals(0, JsValues.toInt32(Double.NaN));
        assertEquals(0, JsValues.toInt32(Double.POSITIVE_INFINITY));
    }

    @Test
    void formatNumberLikeTheShell() {
        assertEquals("5", JsValues.formatNumber(5.0));
        assertEquals("100", JsValues.formatNumber(100.0));
        assertEquals("0.1", JsValues.formatNumber(0.1));
        assertEquals("-2.5", JsValues.formatNumber(-2.5));
        assertEquals("0", JsValues.formatNumber(-0.0));
        assertEquals("1e+21", JsValues.formatNumber(1e21));
        assertEquals("1e-7", JsValues.formatNumber(1e-7));
        assertEquals("NaN", JsValues.formatNumber(Double.NaN));
        assertEquals("-Infinity", JsValues.formatNumber(Double.NEGATIVE_INFINITY));
    }

    @Test
    void displayStrings() {
        assertEquals("null", JsValues.toDisplayString(null));
        assertEquals("undefined", JsValues.toDisplayString(Undefined.INSTANCE));
        assertEquals("1,,a", JsValues.toDisplayString(Arrays.asList(1.0, null, "a")));
        assertEquals("[object Object]", JsValues.toDisplayString(Map.of()));
        assertEquals("true", JsValues.toDisplayString(true));
    }

    @Test
    void typeNames() {
        assertEquals("null", JsValues.typeName(null));
        assertEquals("undefined", JsValues.typeName(Undefined.INSTANCE));
        assertEquals("string", JsValues.typeName("a"));
        assertEquals("number", JsValues.typeName(1.0));
        assertEquals("object", JsValues.typeName(Map.of()));
    }
}
