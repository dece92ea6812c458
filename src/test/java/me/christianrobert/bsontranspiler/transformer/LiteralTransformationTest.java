package me.christianrobert.bsontranspiler.transformer;

import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.parser.AntlrParser;
import me.christianrobert.bsontranspiler.transformer.parser.ParseResult;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for scalar literal translation.
 *
 * <p>Strings are re-quoted with single quotes, booleans capitalised, null and undefined become
 * {@code None} and octal literals get Python's {@code 0o} prefix. Other numbers pass through.
 */
class LiteralTransformationTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    private Translation translate(String source) {
        ParseResult parseResult = parser.parseExpression(source);
        assertFalse(parseResult.hasErrors(), "Parse should succeed: " + parseResult.getErrorMessage());
        return new PythonCodeBuilder().visit(parseResult.getTree());
    }

    // ========== STRINGS ==========

    @Test
    void doubleQuotedStringBecomesSingleQuoted() {
        Translation result = translate("\"abc\"");

        assertEquals("'abc'", result.getText());
        assertEquals(SemanticType.STRING, result.getType());
    }

    @Test
    void singleQuotedStringIsKept() {
        assertEquals("'abc'", translate("'abc'").getText());
    }

    @Test
    void embeddedSingleQuoteIsEscaped() {
        // Given: a double-quoted string containing a single quote
        String source = "\"it's\"";

        // When
        Translation result = translate(source);

        // Then: the quote is escaped for the single-quoted Python literal
        assertEquals("'it\\'s'", result.getText());
    }

    @Test
    void existingEscapesArePreserved() {
        assertEquals("'a\\nb'", translate("\"a\\nb\"").getText());
        assertEquals("'it\\'s'", translate("'it\\'s'").getText());
    }

    @Test
    void emptyString() {
        assertEquals("''", translate("\"\"").getText());
    }

    // ========== BOOLEANS, NULL, UNDEFINED ==========

    @Test
    void booleansAreCapitalised() {
        assertEquals("True", translate("true").getText());
        assertEquals("False", translate("false").getText());
        assertEquals(SemanticType.BOOLEAN, translate("true").getType());
    }

    @Test
    void nullBecomesNone() {
        Translation result = translate("null");

        assertEquals("None", result.getText());
        assertEquals(SemanticType.NULL, result.getType());
    }

    @Test
    void undefinedBecomesNone() {
        Translation result = translate("undefined");

        assertEquals("None", result.getText());
        assertEquals(SemanticType.UNDEFINED, result.getType());
    }

    // ========== NUMBERS ==========

    @Test
    void integerPassesThrough() {
        Translation result = translate("42");

        assertEquals("42", result.getText());
        assertEquals(SemanticType.INTEGER, result.getType());
    }

    @Test
    void decimalPassesThrough() {
        Translation result = translate("3.14");

        assertEquals("3.14", result.getText());
        assertEquals(SemanticType.DECIMAL, result.getType());
    }

    @Test
    void exponentIsDecimal() {
        Translation result = translate("1e5");

        assertEquals("1e5", result.getText());
        assertEquals(SemanticType.DECIMAL, result.getType());
    }

    @Test
    void hexPassesThrough() {
        Translation result = translate("0x1F");

        assertEquals("0x1F", result.getText());
        assertEquals(SemanticType.INTEGER, result.getType());
    }

    @Test
    void legacyOctalGetsPythonPrefix() {
        Translation result = translate("010");

        assertEquals("0o10", result.getText());
        assertEquals(SemanticType.OCTAL, result.getType());
    }

    @Test
    void modernOctalPrefixesAreNormalised() {
        assertEquals("0o10", translate("0o10").getText());
        assertEquals("0o10", translate("0O10").getText());
    }

    @Test
    void doubleZeroOctalPrefixIsStripped() {
        assertEquals("0o7", translate("007").getText());
    }

    @Test
    void doubleZeroKeepsADigit() {
        Translation result = translate("00");

        assertEquals("0o0", result.getText());
        assertEquals(SemanticType.OCTAL, result.getType());
    }

    // ========== UNARY SIGNS ==========

    @Test
    void negativeIntegerKeepsType() {
        Translation result = translate("-5");

        assertEquals("-5", result.getText());
        assertEquals(SemanticType.INTEGER, result.getType());
    }

    @Test
    void positiveDecimalKeepsType() {
        Translation result = translate("+2.5");

        assertEquals("+2.5", result.getText());
        assertEquals(SemanticType.DECIMAL, result.getType());
    }

    @Test
    void negatedStringIsUntyped() {
        Translation result = translate("-\"a\"");

        assertEquals("-'a'", result.getText());
        assertEquals(SemanticType.UNKNOWN, result.getType());
    }
}
