package me.christianrobert.bsontranspiler.transformer.builder.bson;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;

import java.util.List;

/**
 * {@code Timestamp(low, high)} with two integer arguments translates unchanged.
 */
public class VisitTimestampConstructor {
  public static Translation v(ECMAScriptParser.BSONTimestampConstructorContext ctx, PythonCodeBuilder b) {
    if (!ConstructorArguments.hasArity(ctx.arguments(), 2)) {
      return Translation.failure(ErrorKind.ARITY, "Timestamp requires two arguments");
    }

    List<ECMAScriptParser.SingleExpressionContext> args = ConstructorArguments.of(ctx.arguments());

    Translation low = b.visit(args.get(0));
    if (low.isFailure()) {
      return low;
    }
    if (low.getType() != SemanticType.INTEGER) {
      return Translation.failure(ErrorKind.TYPE, "Timestamp first argument requires integer arguments");
    }

    Translation high = b.visit(args.get(1));
    if (high.isFailure()) {
      return high;
    }
    if (high.getType() != SemanticType.INTEGER) {
      return Translation.failure(ErrorKind.TYPE, "Timestamp second argument requires integer arguments");
    }

    return Translation.success("Timestamp(" + low.getText() + ", " + high.getText() + ")", SemanticType.TIMESTAMP);
  }
}
