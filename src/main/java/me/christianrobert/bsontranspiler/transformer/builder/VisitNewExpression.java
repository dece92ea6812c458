package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.context.Translation;

/**
 * Python has no {@code new}: {@code new ObjectId()} translates like {@code ObjectId()}
 * and keeps the wrapped expression's type.
 */
public class VisitNewExpression {
  public static Translation v(ECMAScriptParser.NewExpressionContext ctx, PythonCodeBuilder b) {
    Translation wrapped = b.visit(ctx.singleExpression());
    if (wrapped.isFailure() || ctx.arguments() == null) {
      return wrapped;
    }

    Translation args = b.visit(ctx.arguments());
    if (args.isFailure()) {
      return args;
    }
    return Translation.success(wrapped.getText() + args.getText(), wrapped.getType());
  }
}
