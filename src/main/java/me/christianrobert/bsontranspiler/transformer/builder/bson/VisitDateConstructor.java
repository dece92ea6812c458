package me.christianrobert.bsontranspiler.transformer.builder.bson;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.evaluator.DateValue;
import me.christianrobert.bsontranspiler.transformer.evaluator.EvaluationException;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;

import java.time.ZonedDateTime;

/**
 * Date constructors.
 *
 * <ul>
 *   <li>{@code Date()} becomes {@code datetime.datetime.utcnow().date()}</li>
 *   <li>{@code Date.now()} becomes {@code datetime.datetime.utcnow()}</li>
 *   <li>{@code Date(args...)} is folded and emitted as UTC fields:
 *       {@code datetime.datetime(2019, 1, 1, 0, 0, 0, tzinfo=datetime.timezone.utc)}</li>
 * </ul>
 */
public class VisitDateConstructor {
  public static Translation v(ECMAScriptParser.DateConstructorExpressionContext ctx, PythonCodeBuilder b) {
    if (ConstructorArguments.isEmpty(ctx.arguments())) {
      return Translation.success("datetime.datetime.utcnow().date()", SemanticType.DATE);
    }

    ZonedDateTime date;
    try {
      date = ((DateValue) b.fold(ctx)).toUtc();
    } catch (EvaluationException e) {
      return Translation.failure(ErrorKind.EVALUATION, e.getMessage());
    }

    String fields = date.getYear() + ", "
        + date.getMonthValue() + ", "
        + date.getDayOfMonth() + ", "
        + date.getHour() + ", "
        + date.getMinute() + ", "
        + date.getSecond();
    return Translation.success("datetime.datetime(" + fields + ", tzinfo=datetime.timezone.utc)", SemanticType.DATE);
  }

  public static Translation v(ECMAScriptParser.DateNowConstructorExpressionContext ctx, PythonCodeBuilder b) {
    return Translation.success("datetime.datetime.utcnow()", SemanticType.DATE);
  }
}
