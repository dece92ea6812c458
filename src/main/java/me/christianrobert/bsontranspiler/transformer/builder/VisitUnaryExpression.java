package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;

/**
 * Unary sign. Numeric operand types carry over, so {@code Timestamp(-1, 2)} still sees an integer.
 */
public class VisitUnaryExpression {
  public static Translation v(ECMAScriptParser.UnaryMinusExpressionContext ctx, PythonCodeBuilder b) {
    return signed("-", b.visit(ctx.singleExpression()));
  }

  public static Translation v(ECMAScriptParser.UnaryPlusExpressionContext ctx, PythonCodeBuilder b) {
    return signed("+", b.visit(ctx.singleExpression()));
  }

  private static Translation signed(String operator, Translation operand) {
    if (operand.isFailure()) {
      return operand;
    }
    SemanticType type = operand.getType().isOneOf(SemanticType.INTEGER, SemanticType.DECIMAL, SemanticType.OCTAL)
        ? operand.getType()
        : SemanticType.UNKNOWN;
    return Translation.success(operator + operand.getText(), type);
  }
}
