package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import me.christianrobert.bsontranspiler.transformer.util.QuoteHelper;

/**
 * String literals are re-quoted with single quotes: {@code "abc"} and {@code 'abc'} both become {@code 'abc'}.
 */
public class VisitStringLiteral {
  public static Translation v(ECMAScriptParser.StringLiteralContext ctx, PythonCodeBuilder b) {
    return Translation.success(QuoteHelper.singleQuote(ctx.getText()), SemanticType.STRING);
  }
}
