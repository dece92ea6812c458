package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;

/**
 * {@code true} / {@code false} become {@code True} / {@code False}.
 */
public class VisitBooleanLiteral {
  public static Translation v(ECMAScriptParser.BooleanLiteralContext ctx, PythonCodeBuilder b) {
    String text = ctx.getText();
    return Translation.success(Character.toUpperCase(text.charAt(0)) + text.substring(1), SemanticType.BOOLEAN);
  }
}
