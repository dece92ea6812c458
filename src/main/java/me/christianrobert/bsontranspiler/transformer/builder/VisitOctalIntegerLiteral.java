package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;

/**
 * Octal literals get Python's {@code 0o} prefix.
 *
 * <p>{@code 010}, {@code 0o10} and {@code 0O10} all become {@code 0o10}. A second leading zero
 * ({@code 0010}) is dropped together with the first. {@code 00} becomes {@code 0o0}.</p>
 */
public class VisitOctalIntegerLiteral {
  public static Translation v(ECMAScriptParser.OctalIntegerLiteralContext ctx, PythonCodeBuilder b) {
    String text = ctx.getText();
    int offset = 0;

    if (text.length() > 1 && text.charAt(0) == '0'
        && (text.charAt(1) == '0' || text.charAt(1) == 'o' || text.charAt(1) == 'O')) {
      offset = 2;
    } else if (text.charAt(0) == '0') {
      offset = 1;
    }

    String digits = text.substring(offset);
    if (digits.isEmpty()) {
      digits = "0";
    }
    return Translation.success("0o" + digits, SemanticType.OCTAL);
  }
}
