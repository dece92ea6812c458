package me.christianrobert.bsontranspiler.transformer.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuoteHelperTest {

    @Test
    void singleQuoteStripsExistingQuotes() {
        assertEquals("'abc'", QuoteHelper.singleQuote("\"abc\""));
        assertEquals("'abc'", QuoteHelper.singleQuote("'abc'"));
        assertEquals("'abc'", QuoteHelper.singleQuote("abc"));
    }

    @Test
    void singleQuoteEscapesBareQuotesOnly() {
        assertEquals("'it\\'s'", QuoteHelper.singleQuote("\"it's\""));
        assertEquals("'it\\'s'", QuoteHelper.singleQuote("'it\\'s'"));
        assertEquals("'say \\\"hi\\\"'", QuoteHelper.singleQuote("\"say \\\"hi\\\"\""));
    }

    @Test
    void doubleQuote() {
        assertEquals("\"a\\\"b\"", QuoteHelper.doubleQuote("'a\"b'"));
        assertEquals("\"abc\"", QuoteHelper.doubleQuote("abc"));
    }

    @Test
    void doubleQuoteVerbatimKeepsSurroundingQuotes() {
        assertEquals("\"'a'\"", QuoteHelper.doubleQuoteVerbatim("'a'"));
        assertEquals("\"\\\"a\\\"\"", QuoteHelper.doubleQuoteVerbatim("\"a\""));
    }

    @Test
    void removeQuotesOnlyForMatchingPair() {
        assertEquals("a", QuoteHelper.removeQuotes("'a'"));
        assertEquals("'a\"", QuoteHelper.removeQuotes("'a\""));
        assertEquals("'", QuoteHelper.removeQuotes("'"));
        assertNull(QuoteHelper.removeQuotes(null));
    }

    @Test
    void pythonLiteralEscapesEverything() {
        assertEquals("'a\\'b\\\\c\\n'", QuoteHelper.pythonLiteral("a'b\\c\n"));
        assertEquals("'\\x01\\t'", QuoteHelper.pythonLiteral("\u0001\t"));
        assertEquals("''", QuoteHelper.pythonLiteral(""));
    }
}
