package me.christianrobert.bsontranspiler.transformer.builder.bson;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.evaluator.EvaluationException;
import me.christianrobert.bsontranspiler.transformer.evaluator.ObjectIdValue;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import me.christianrobert.bsontranspiler.transformer.util.QuoteHelper;

/**
 * {@code ObjectId()} stays as is; {@code ObjectId(x)} is folded to its canonical hex form,
 * e.g. {@code ObjectId("5ab901c29ee65f5c8550c5b9")} becomes {@code ObjectId('5ab901c29ee65f5c8550c5b9')}.
 */
public class VisitObjectIdConstructor {
  public static Translation v(ECMAScriptParser.BSONObjectIdConstructorContext ctx, PythonCodeBuilder b) {
    if (ConstructorArguments.isEmpty(ctx.arguments())) {
      return Translation.success("ObjectId()", SemanticType.OBJECT_ID);
    }

    if (!ConstructorArguments.hasArity(ctx.arguments(), 1)) {
      return Translation.failure(ErrorKind.ARITY, "ObjectId requires zero or one argument");
    }

    String hex;
    try {
      Object value = b.fold(ctx);
      if (!(value instanceof ObjectIdValue)) {
        return Translation.failure(ErrorKind.EVALUATION, ObjectIdValue.INVALID_ARGUMENT);
      }
      hex = ((ObjectIdValue) value).toHexString();
    } catch (EvaluationException e) {
      return Translation.failure(ErrorKind.EVALUATION, e.getMessage());
    }

    return Translation.success("ObjectId(" + QuoteHelper.singleQuote(hex) + ")", SemanticType.OBJECT_ID);
  }
}
