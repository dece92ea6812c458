package me.christianrobert.bsontranspiler.transformer.builder.bson;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;

/**
 * {@code Symbol("abc")} becomes {@code bytes('abc', 'utf-8').decode('utf-8')}.
 */
public class VisitSymbolConstructor {
  public static Translation v(ECMAScriptParser.BSONSymbolConstructorContext ctx, PythonCodeBuilder b) {
    if (!ConstructorArguments.hasArity(ctx.arguments(), 1)) {
      return Translation.failure(ErrorKind.ARITY, "Symbol requires one argument");
    }

    Translation symbol = b.visit(ConstructorArguments.of(ctx.arguments()).get(0));
    if (symbol.isFailure()) {
      return symbol;
    }
    if (symbol.getType() != SemanticType.STRING) {
      return Translation.failure(ErrorKind.TYPE, "Symbol requires a string argument");
    }

    return Translation.success("bytes(" + symbol.getText() + ", 'utf-8').decode('utf-8')", SemanticType.SYMBOL);
  }
}
