package me.christianrobert.bsontranspiler.transformer.builder.bson;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import me.christianrobert.bsontranspiler.transformer.util.QuoteHelper;

import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code Double(x)} becomes {@code float(x)} and {@code Number(x)} becomes {@code int(x)}.
 *
 * <p>The argument must be a string, integer or decimal whose unquoted text starts with an
 * integer (optional whitespace and sign, then a digit). Quotes are dropped: {@code Double("1.5")}
 * becomes {@code float(1.5)}.</p>
 */
public class VisitNumericConstructor {

  private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*[+-]?\\d");

  public static Translation v(ECMAScriptParser.BSONDoubleConstructorContext ctx, PythonCodeBuilder b) {
    return convert("Double", "float", ctx.arguments(), b);
  }

  public static Translation v(ECMAScriptParser.NumberConstructorExpressionContext ctx, PythonCodeBuilder b) {
    return convert("Number", "int", ctx.arguments(), b);
  }

  private static Translation convert(String name, String function, ECMAScriptParser.ArgumentsContext arguments, PythonCodeBuilder b) {
    if (!ConstructorArguments.hasArity(arguments, 1)) {
      return Translation.failure(ErrorKind.ARITY, name + " requires one argument");
    }

    List<ECMAScriptParser.SingleExpressionContext> args = ConstructorArguments.of(arguments);
    Translation arg = b.visit(args.get(0));
    if (arg.isFailure()) {
      return arg;
    }

    if (!arg.getType().isNumeric() && arg.getType() != SemanticType.STRING) {
      return Translation.failure(ErrorKind.TYPE, name + " requires a number or a string argument");
    }

    String number = QuoteHelper.removeQuotes(arg.getText());
    if (!LEADING_INTEGER.matcher(number).find()) {
      return Translation.failure(ErrorKind.VALUE, name + " requires a number or a string argument");
    }

    SemanticType type = function.equals("float") ? SemanticType.DECIMAL : SemanticType.INTEGER;
    return Translation.success(function + "(" + number + ")", type);
  }
}
