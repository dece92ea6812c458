package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.context.Translation;

public class VisitParenthesizedExpression {
  public static Translation v(ECMAScriptParser.ParenthesizedExpressionContext ctx, PythonCodeBuilder b) {
    Translation inner = b.visit(ctx.singleExpression());
    if (inner.isFailure()) {
      return inner;
    }
    return Translation.success("(" + inner.getText() + ")", inner.getType());
  }
}
