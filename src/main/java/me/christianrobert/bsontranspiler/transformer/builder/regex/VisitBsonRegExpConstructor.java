package me.christianrobert.bsontranspiler.transformer.builder.regex;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.builder.bson.ConstructorArguments;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import me.christianrobert.bsontranspiler.transformer.util.QuoteHelper;

import java.util.List;
import java.util.Set;

/**
 * {@code BSONRegExp(pattern[, flags])} becomes {@code RegExp('pattern'[, 'flags'])}.
 *
 * <p>Both arguments must be strings. Flags are limited to {@code i, m, x, s, l, u}; any other
 * characters are reported together in encounter order.</p>
 */
public class VisitBsonRegExpConstructor {

  private static final Set<Character> BSON_FLAGS = Set.of('i', 'm', 'x', 's', 'l', 'u');

  public static Translation v(ECMAScriptParser.BSONRegExpConstructorContext ctx, PythonCodeBuilder b) {
    if (!ConstructorArguments.hasArity(ctx.arguments(), 1, 2)) {
      return Translation.failure(ErrorKind.ARITY, "BSONRegExp requires one or two arguments");
    }

    List<ECMAScriptParser.SingleExpressionContext> args = ConstructorArguments.of(ctx.arguments());

    Translation pattern = b.visit(args.get(0));
    if (pattern.isFailure()) {
      return pattern;
    }
    if (pattern.getType() != SemanticType.STRING) {
      return Translation.failure(ErrorKind.TYPE, "BSONRegExp requires pattern to be a string");
    }

    if (args.size() == 1) {
      return Translation.success("RegExp(" + pattern.getText() + ")", SemanticType.BSON_REGEX);
    }

    Translation flags = b.visit(args.get(1));
    if (flags.isFailure()) {
      return flags;
    }
    if (flags.getType() != SemanticType.STRING) {
      return Translation.failure(ErrorKind.TYPE, "BSONRegExp requires flags to be a string");
    }

    String flagText = QuoteHelper.removeQuotes(flags.getText());
    StringBuilder unsupported = new StringBuilder();
    for (char flag : flagText.toCharArray()) {
      if (!BSON_FLAGS.contains(flag)) {
        unsupported.append(flag);
      }
    }
    if (unsupported.length() > 0) {
      return Translation.failure(ErrorKind.VALUE,
          "the regular expression contains unsuppoted '" + unsupported + "' flag");
    }

    return Translation.success("RegExp(" + pattern.getText() + ", " + QuoteHelper.singleQuote(flagText) + ")",
        SemanticType.BSON_REGEX);
  }
}
