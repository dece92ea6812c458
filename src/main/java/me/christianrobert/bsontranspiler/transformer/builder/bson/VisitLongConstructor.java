package me.christianrobert.bsontranspiler.transformer.builder.bson;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.evaluator.EvaluationException;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;

/**
 * {@code Long(low[, high])} is folded from its two 32-bit halves: {@code Long(1, 1)} becomes {@code Int64(4294967297)}.
 */
public class VisitLongConstructor {
  public static Translation v(ECMAScriptParser.BSONLongConstructorContext ctx, PythonCodeBuilder b) {
    if (!ConstructorArguments.hasArity(ctx.arguments(), 1, 2)) {
      return Translation.failure(ErrorKind.ARITY, "Long requires one or two argument");
    }

    String value;
    try {
      value = b.fold(ctx).toString();
    } catch (EvaluationException e) {
      return Translation.failure(ErrorKind.EVALUATION, e.getMessage());
    }

    return Translation.success("Int64(" + value + ")", SemanticType.LONG);
  }
}
