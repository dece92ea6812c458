package me.christianrobert.bsontranspiler.transformer;

import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.TransformationContext;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.evaluator.SandboxedConstantEvaluator;
import me.christianrobert.bsontranspiler.transformer.parser.AntlrParser;
import me.christianrobert.bsontranspiler.transformer.parser.ParseResult;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Date and Date.now translation.
 *
 * <p>The evaluator runs on a fixed clock so "now" is deterministic.
 */
class DateTransformationTest {

    private static final String UTC = ", tzinfo=datetime.timezone.utc)";

    private AntlrParser parser;
    private PythonCodeBuilder builder;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
        Clock clock = Clock.fixed(Instant.parse("2020-05-17T08:30:00Z"), ZoneOffset.UTC);
        builder = new PythonCodeBuilder(new TransformationContext(
                new SandboxedConstantEvaluator(
                        SandboxedConstantEvaluator.DEFAULT_MAX_OPERATIONS,
                        SandboxedConstantEvaluator.DEFAULT_MAX_DEPTH,
                        clock)));
    }

    private Translation translate(String source) {
        ParseResult parseResult = parser.parseExpression(source);
        assertFalse(parseResult.hasErrors(), "Parse should succeed: " + parseResult.getErrorMessage());
        return builder.visit(parseResult.getTree());
    }

    @Test
    void dateWithoutArgumentsIsToday() {
        Translation result = translate("Date()");

        assertEquals("datetime.datetime.utcnow().date()", result.getText());
        assertEquals(SemanticType.DATE, result.getType());
    }

    @Test
    void dateNowIsCurrentDateTime() {
        Translation result = translate("Date.now()");

        assertEquals("datetime.datetime.utcnow()", result.getText());
        assertEquals(SemanticType.DATE, result.getType());
    }

    @Test
    void dateFromNowUsesClock() {
        assertEquals("datetime.datetime(2020, 5, 17, 8, 30, 0" + UTC, translate("new Date(Date.now())").getText());
    }

    @Test
    void dateFromIsoString() {
        assertEquals("datetime.datetime(2019, 1, 15, 10, 20, 30" + UTC,
                translate("new Date(\"2019-01-15T10:20:30Z\")").getText());
    }

    @Test
    void dateFromIsoStringWithOffset() {
        assertEquals("datetime.datetime(2019, 1, 15, 8, 0, 0" + UTC,
                translate("new Date(\"2019-01-15T10:00:00+02:00\")").getText());
    }

    @Test
    void dateOnlyStringIsMidnightUtc() {
        assertEquals("datetime.datetime(2019, 1, 15, 0, 0, 0" + UTC, translate("Date(\"2019-01-15\")").getText());
    }

    @Test
    void dateFromRfc1123String() {
        assertEquals("datetime.datetime(2008, 6, 3, 11, 5, 30" + UTC,
                translate("Date(\"Tue, 3 Jun 2008 11:05:30 GMT\")").getText());
    }

    @Test
    void dateFromEpochMillis() {
        assertEquals("datetime.datetime(1970, 1, 1, 0, 0, 0" + UTC, translate("Date(0)").getText());
    }

    @Test
    void dateFromComponents() {
        // Given: zero-based month as in the shell
        String source = "new Date(2019, 0, 15, 10, 20, 30)";

        // When
        Translation result = translate(source);

        // Then
        assertEquals("datetime.datetime(2019, 1, 15, 10, 20, 30" + UTC, result.getText());
    }

    @Test
    void twoDigitYearMeansTwentiethCentury() {
        assertEquals("datetime.datetime(1999, 12, 31, 0, 0, 0" + UTC, translate("Date(99, 11, 31)").getText());
    }

    @Test
    void monthOverflowRollsIntoNextYear() {
        assertEquals("datetime.datetime(2020, 1, 1, 0, 0, 0" + UTC, translate("Date(2019, 12, 1)").getText());
    }

    @Test
    void invalidDateStringIsRejected() {
        Translation result = translate("Date(\"not a date\")");

        assertEquals(ErrorKind.EVALUATION, result.getErrorKind());
        assertEquals("Error: Invalid Date", result.render());
    }

    @Test
    void yearBeyondDateRangeIsInvalid() {
        Translation result = translate("new Date(4294969315, 0, 1)");

        assertEquals(ErrorKind.EVALUATION, result.getErrorKind());
        assertEquals("Error: Invalid Date", result.render());
    }
}
