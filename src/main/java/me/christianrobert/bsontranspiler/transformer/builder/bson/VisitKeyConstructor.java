package me.christianrobert.bsontranspiler.transformer.builder.bson;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;

/**
 * {@code MinKey()} and {@code MaxKey()} take no arguments and translate unchanged.
 */
public class VisitKeyConstructor {
  public static Translation v(ECMAScriptParser.BSONMinKeyConstructorContext ctx, PythonCodeBuilder b) {
    return key("MinKey", SemanticType.MIN_KEY, ctx.arguments());
  }

  public static Translation v(ECMAScriptParser.BSONMaxKeyConstructorContext ctx, PythonCodeBuilder b) {
    return key("MaxKey", SemanticType.MAX_KEY, ctx.arguments());
  }

  private static Translation key(String name, SemanticType type, ECMAScriptParser.ArgumentsContext arguments) {
    if (!ConstructorArguments.isEmpty(arguments)) {
      return Translation.failure(ErrorKind.ARITY, name + " requires no arguments");
    }
    return Translation.success(name + "()", type);
  }
}
