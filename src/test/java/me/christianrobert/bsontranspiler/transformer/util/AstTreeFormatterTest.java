package me.christianrobert.bsontranspiler.transformer.util;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptLexer;
import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AstTreeFormatter - verifies AST tree formatting for debugging.
 */
class AstTreeFormatterTest {

    private ECMAScriptParser.ExpressionContext parse(String source) {
        ECMAScriptLexer lexer = new ECMAScriptLexer(CharStreams.fromString(source));
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        ECMAScriptParser parser = new ECMAScriptParser(tokens);
        return parser.expression();
    }

    @Test
    void formatFilterDocument() {
        ECMAScriptParser.ExpressionContext tree = parse("{a: Long(1)}");

        String formatted = AstTreeFormatter.format(tree, ECMAScriptParser.VOCABULARY);

        assertTrue(formatted.startsWith("Expression"), formatted);
        assertTrue(formatted.contains("\n  ObjectLiteralExpression"), "Children should be indented");
        assertTrue(formatted.contains("BSONLongConstructor"), "Should contain labelled alternative name");
        assertTrue(formatted.contains("\"a\" (Identifier)"), "Should name token types");
        assertTrue(formatted.contains("\"<EOF>\" (EOF)"), "Should show EOF");
    }

    @Test
    void formatWithoutVocabularyOmitsTokenNames() {
        String formatted = AstTreeFormatter.format(parse("1"));

        assertTrue(formatted.contains("IntegerLiteral [1]"), formatted);
        assertTrue(formatted.contains("\"1\"\n"), formatted);
        assertFalse(formatted.contains("(IntegerValue)"));
    }

    @Test
    void longTextIsTruncated() {
        String longString = "\"" + "x".repeat(80) + "\"";

        String formatted = AstTreeFormatter.format(parse(longString));

        assertTrue(formatted.contains("x".repeat(49) + "..."), formatted);
    }

    @Test
    void nullTree() {
        assertEquals("(null tree)", AstTreeFormatter.format(null));
    }
}
