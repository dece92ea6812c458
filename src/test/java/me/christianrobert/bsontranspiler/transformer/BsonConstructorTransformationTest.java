package me.christianrobert.bsontranspiler.transformer;

import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.parser.AntlrParser;
import me.christianrobert.bsontranspiler.transformer.parser.ParseResult;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the BSON constructors that translate argument by argument:
 * Code, Timestamp, Symbol, MinKey/MaxKey and DBRef.
 */
class BsonConstructorTransformationTest {

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

    // ========== CODE ==========

    @Test
    void codeWithoutScope() {
        Translation result = translate("Code(\"fn\")");

        assertEquals("Code('fn')", result.getText());
        assertEquals(SemanticType.CODE, result.getType());
    }

    @Test
    void codeWithScope() {
        assertEquals("Code('fn', {'x': 1})", translate("Code(\"fn\", {x: 1})").getText());
    }

    @Test
    void codeRejectsNonObjectScope() {
        Translation result = translate("Code(\"fn\", \"notAnObject\")");

        assertEquals(ErrorKind.TYPE, result.getErrorKind());
        assertEquals("Error: Code requires scope to be an object", result.render());
    }

    // ========== TIMESTAMP ==========

    @Test
    void timestampWithIntegers() {
        Translation result = translate("Timestamp(1, 2)");

        assertEquals("Timestamp(1, 2)", result.getText());
        assertEquals(SemanticType.TIMESTAMP, result.getType());
    }

    @Test
    void timestampRejectsNonIntegerFirstArgument() {
        assertEquals("Error: Timestamp first argument requires integer arguments", translate("Timestamp(\"a\", 2)").render());
    }

    @Test
    void timestampRejectsNonIntegerSecondArgument() {
        assertEquals("Error: Timestamp second argument requires integer arguments", translate("Timestamp(1, 2.5)").render());
    }

    // ========== SYMBOL ==========

    @Test
    void symbolBecomesDecodedBytes() {
        Translation result = translate("Symbol(\"abc\")");

        assertEquals("bytes('abc', 'utf-8').decode('utf-8')", result.getText());
        assertEquals(SemanticType.SYMBOL, result.getType());
    }

    @Test
    void symbolRejectsNumber() {
        assertEquals("Error: Symbol requires a string argument", translate("Symbol(1)").render());
    }

    // ========== MINKEY / MAXKEY ==========

    @Test
    void minAndMaxKey() {
        assertEquals("MinKey()", translate("MinKey()").getText());
        assertEquals("MaxKey()", translate("MaxKey()").getText());
        assertEquals(SemanticType.MIN_KEY, translate("MinKey()").getType());
        assertEquals(SemanticType.MAX_KEY, translate("MaxKey()").getType());
    }

    // ========== DBREF ==========

    @Test
    void dbRefWithObjectId() {
        // Given: namespace and an ObjectId
        String source = "DBRef(\"coll\", ObjectId(\"5ab901c29ee65f5c8550c5b9\"))";

        // When
        Translation result = translate(source);

        // Then
        assertEquals("DBRef('coll', ObjectId('5ab901c29ee65f5c8550c5b9'))", result.getText());
        assertEquals(SemanticType.DBREF, result.getType());
    }

    @Test
    void dbRefWithObjectAndDatabase() {
        assertEquals("DBRef('coll', {'x': 1}, 'db')", translate("DBRef(\"coll\", {x: 1}, \"db\")").getText());
    }

    @Test
    void dbRefRejectsScalarOid() {
        assertEquals("Error: DBRef requires object OID", translate("DBRef(\"coll\", 1)").render());
    }

    @Test
    void dbRefRejectsNonStringNamespace() {
        assertEquals("Error: DBRef first argument requires string namespace", translate("DBRef(1, {})").render());
    }

    @Test
    void dbRefRejectsNonStringDatabase() {
        assertEquals("Error: DBRef requires string collection", translate("DBRef(\"coll\", {}, 5)").render());
    }
}
