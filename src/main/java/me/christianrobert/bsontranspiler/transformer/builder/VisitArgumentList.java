package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.context.Translation;

import java.util.StringJoiner;

/**
 * Arguments of generic calls, joined with {@code ", "}.
 */
public class VisitArgumentList {
  public static Translation v(ECMAScriptParser.ArgumentListContext ctx, PythonCodeBuilder b) {
    StringJoiner args = new StringJoiner(", ");
    for (ECMAScriptParser.SingleExpressionContext arg : ctx.singleExpression()) {
      Translation translated = b.visit(arg);
      if (translated.isFailure()) {
        return translated;
      }
      args.add(translated.getText());
    }
    return Translation.untyped(args.toString());
  }
}
