package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptBaseVisitor;
import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser.*;
import me.christianrobert.bsontranspiler.transformer.builder.bson.VisitBinaryConstructor;
import me.christianrobert.bsontranspiler.transformer.builder.bson.VisitCodeConstructor;
import me.christianrobert.bsontranspiler.transformer.builder.bson.VisitDBRefConstructor;
import me.christianrobert.bsontranspiler.transformer.builder.bson.VisitDateConstructor;
import me.christianrobert.bsontranspiler.transformer.builder.bson.VisitKeyConstructor;
import me.christianrobert.bsontranspiler.transformer.builder.bson.VisitLongConstructor;
import me.christianrobert.bsontranspiler.transformer.builder.bson.VisitNumericConstructor;
import me.christianrobert.bsontranspiler.transformer.builder.bson.VisitObjectIdConstructor;
import me.christianrobert.bsontranspiler.transformer.builder.bson.VisitSymbolConstructor;
import me.christianrobert.bsontranspiler.transformer.builder.bson.VisitTimestampConstructor;
import me.christianrobert.bsontranspiler.transformer.builder.regex.VisitBsonRegExpConstructor;
import me.christianrobert.bsontranspiler.transformer.builder.regex.VisitRegularExpression;
import me.christianrobert.bsontranspiler.transformer.context.TransformationContext;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.evaluator.EvaluationException;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.RuleNode;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Translates a parsed shell expression into Python 3 source.
 *
 * <p>Every visit returns a {@link Translation} carrying the Python text and the inferred
 * {@link SemanticType}, or a failure. Rules live in static {@code VisitXxx} helpers; node kinds
 * without a rule go through the {@link ChildrenTranslator}.</p>
 *
 * <p>Create one builder per translation. No logging is desired here, failures are returned
 * as values and reported by the calling service.</p>
 */
public class PythonCodeBuilder extends ECMAScriptBaseVisitor<Translation> {

    private final TransformationContext context;
    private final ChildrenTranslator childrenTranslator;

    /**
     * Creates a builder with a fresh {@link TransformationContext} (default evaluator limits).
     */
    public PythonCodeBuilder() {
        this(new TransformationContext());
    }

    public PythonCodeBuilder(TransformationContext context) {
        this(context, new ChildrenTranslator());
    }

    public PythonCodeBuilder(TransformationContext context, ChildrenTranslator childrenTranslator) {
        this.context = context;
        this.childrenTranslator = childrenTranslator;
    }

    public TransformationContext getContext() {
        return context;
    }

    /**
     * Translates a tree and renders the result: Python source, or {@code Error: <message>}.
     */
    public String translate(ParseTree tree) {
        return visit(tree).render();
    }

    /**
     * Folds a constant sub-expression with the context's evaluator.
     *
     * @throws EvaluationException if the expression cannot be folded
     */
    public Object fold(ParserRuleContext ctx) {
        return context.getConstantEvaluator().evaluate(ctx);
    }

    // ========== DEFAULT HANDLING ==========

    @Override
    public Translation visitChildren(RuleNode node) {
        return childrenTranslator.translate(node, this);
    }

    @Override
    public Translation visitTerminal(TerminalNode node) {
        if (node.getSymbol().getType() == Token.EOF) {
            return Translation.untyped("");
        }
        return Translation.untyped(node.getText());
    }

    @Override
    public Translation visitErrorNode(ErrorNode node) {
        return Translation.untyped(node.getText());
    }

    @Override
    public Translation visitExpression(ECMAScriptParser.ExpressionContext ctx) {
        return visit(ctx.singleExpression());
    }

    // ========== LITERALS ==========

    @Override
    public Translation visitStringLiteral(StringLiteralContext ctx) {
        return VisitStringLiteral.v(ctx, this);
    }

    @Override
    public Translation visitBooleanLiteral(BooleanLiteralContext ctx) {
        return VisitBooleanLiteral.v(ctx, this);
    }

    @Override
    public Translation visitNullLiteral(NullLiteralContext ctx) {
        return Translation.success("None", SemanticType.NULL);
    }

    @Override
    public Translation visitUndefinedLiteral(UndefinedLiteralContext ctx) {
        return Translation.success("None", SemanticType.UNDEFINED);
    }

    @Override
    public Translation visitElision(ElisionContext ctx) {
        return Translation.success("None", SemanticType.NULL);
    }

    @Override
    public Translation visitIntegerLiteral(IntegerLiteralContext ctx) {
        return Translation.success(ctx.getText(), SemanticType.INTEGER);
    }

    // Python accepts the 0x prefix as is
    @Override
    public Translation visitHexIntegerLiteral(HexIntegerLiteralContext ctx) {
        return Translation.success(ctx.getText(), SemanticType.INTEGER);
    }

    @Override
    public Translation visitDecimalLiteral(DecimalLiteralContext ctx) {
        return Translation.success(ctx.getText(), SemanticType.DECIMAL);
    }

    @Override
    public Translation visitOctalIntegerLiteral(OctalIntegerLiteralContext ctx) {
        return VisitOctalIntegerLiteral.v(ctx, this);
    }

    @Override
    public Translation visitRegularExpressionLiteral(RegularExpressionLiteralContext ctx) {
        return VisitRegularExpression.v(ctx, this);
    }

    // ========== OBJECTS AND ARRAYS ==========

    @Override
    public Translation visitObjectLiteral(ObjectLiteralContext ctx) {
        return VisitObjectLiteral.v(ctx, this);
    }

    @Override
    public Translation visitArrayLiteral(ArrayLiteralContext ctx) {
        return VisitArrayLiteral.v(ctx, this);
    }

    @Override
    public Translation visitElementList(ElementListContext ctx) {
        return VisitArrayLiteral.v(ctx, this);
    }

    @Override
    public Translation visitArgumentList(ArgumentListContext ctx) {
        return VisitArgumentList.v(ctx, this);
    }

    // ========== EXPRESSIONS ==========

    @Override
    public Translation visitNewExpression(NewExpressionContext ctx) {
        return VisitNewExpression.v(ctx, this);
    }

    @Override
    public Translation visitParenthesizedExpression(ParenthesizedExpressionContext ctx) {
        return VisitParenthesizedExpression.v(ctx, this);
    }

    @Override
    public Translation visitUnaryMinusExpression(UnaryMinusExpressionContext ctx) {
        return VisitUnaryExpression.v(ctx, this);
    }

    @Override
    public Translation visitUnaryPlusExpression(UnaryPlusExpressionContext ctx) {
        return VisitUnaryExpression.v(ctx, this);
    }

    @Override
    public Translation visitObjectCreateConstructorExpression(ObjectCreateConstructorExpressionContext ctx) {
        return VisitObjectCreate.v(ctx, this);
    }

    // ========== BSON CONSTRUCTORS ==========

    @Override
    public Translation visitBSONCodeConstructor(BSONCodeConstructorContext ctx) {
        return VisitCodeConstructor.v(ctx, this);
    }

    @Override
    public Translation visitBSONObjectIdConstructor(BSONObjectIdConstructorContext ctx) {
        return VisitObjectIdConstructor.v(ctx, this);
    }

    @Override
    public Translation visitBSONBinaryConstructor(BSONBinaryConstructorContext ctx) {
        return VisitBinaryConstructor.v(ctx, this);
    }

    @Override
    public Translation visitBSONDoubleConstructor(BSONDoubleConstructorContext ctx) {
        return VisitNumericConstructor.v(ctx, this);
    }

    @Override
    public Translation visitNumberConstructorExpression(NumberConstructorExpressionContext ctx) {
        return VisitNumericConstructor.v(ctx, this);
    }

    @Override
    public Translation visitBSONLongConstructor(BSONLongConstructorContext ctx) {
        return VisitLongConstructor.v(ctx, this);
    }

    @Override
    public Translation visitDateConstructorExpression(DateConstructorExpressionContext ctx) {
        return VisitDateConstructor.v(ctx, this);
    }

    @Override
    public Translation visitDateNowConstructorExpression(DateNowConstructorExpressionContext ctx) {
        return VisitDateConstructor.v(ctx, this);
    }

    @Override
    public Translation visitBSONMinKeyConstructor(BSONMinKeyConstructorContext ctx) {
        return VisitKeyConstructor.v(ctx, this);
    }

    @Override
    public Translation visitBSONMaxKeyConstructor(BSONMaxKeyConstructorContext ctx) {
        return VisitKeyConstructor.v(ctx, this);
    }

    @Override
    public Translation visitBSONSymbolConstructor(BSONSymbolConstructorContext ctx) {
        return VisitSymbolConstructor.v(ctx, this);
    }

    @Override
    public Translation visitBSONTimestampConstructor(BSONTimestampConstructorContext ctx) {
        return VisitTimestampConstructor.v(ctx, this);
    }

    @Override
    public Translation visitBSONDBRefConstructor(BSONDBRefConstructorContext ctx) {
        return VisitDBRefConstructor.v(ctx, this);
    }

    // ========== REGULAR EXPRESSIONS ==========

    @Override
    public Translation visitRegExpConstructorExpression(RegExpConstructorExpressionContext ctx) {
        return VisitRegularExpression.v(ctx, this);
    }

    @Override
    public Translation visitBSONRegExpConstructor(BSONRegExpConstructorContext ctx) {
        return VisitBsonRegExpConstructor.v(ctx, this);
    }
}
