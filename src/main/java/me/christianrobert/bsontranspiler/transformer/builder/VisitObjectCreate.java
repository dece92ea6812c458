package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.bson.ConstructorArguments;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;

import java.util.List;

/**
 * {@code Object.create(obj)} returns the object literal unchanged.
 */
public class VisitObjectCreate {
  public static Translation v(ECMAScriptParser.ObjectCreateConstructorExpressionContext ctx, PythonCodeBuilder b) {
    List<ECMAScriptParser.SingleExpressionContext> args = ConstructorArguments.of(ctx.arguments());
    if (args.size() != 1) {
      return Translation.failure(ErrorKind.ARITY, "Object.create() requires one argument");
    }

    Translation object = b.visit(args.get(0));
    if (object.isFailure()) {
      return object;
    }
    if (object.getType() != SemanticType.OBJECT) {
      return Translation.failure(ErrorKind.TYPE, "Object.create() requires an object argument");
    }
    return object;
  }
}
