package me.christianrobert.bsontranspiler.transformer.builder.bson;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.evaluator.BinaryValue;
import me.christianrobert.bsontranspiler.transformer.evaluator.EvaluationException;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import me.christianrobert.bsontranspiler.transformer.util.QuoteHelper;

import java.util.Map;

/**
 * {@code Binary(data[, subtype])} becomes {@code Binary(bytes('<data>', 'utf-8')[, bson.binary.<SUBTYPE>])}.
 * Data and subtype are folded, so computed arguments such as {@code Binary("a" + "b", 2 + 2)} work.
 */
public class VisitBinaryConstructor {

  static final Map<Integer, String> SUBTYPES = Map.of(
      0, "bson.binary.BINARY_SUBTYPE",
      1, "bson.binary.FUNCTION_SUBTYPE",
      2, "bson.binary.OLD_BINARY_SUBTYPE",
      3, "bson.binary.OLD_UUID_SUBTYPE",
      4, "bson.binary.UUID_SUBTYPE",
      5, "bson.binary.MD5_SUBTYPE",
      6, "bson.binary.CSHARP_LEGACY",
      128, "bson.binary.USER_DEFINED_SUBTYPE"
  );

  public static Translation v(ECMAScriptParser.BSONBinaryConstructorContext ctx, PythonCodeBuilder b) {
    if (!ConstructorArguments.hasArity(ctx.arguments(), 1, 2)) {
      return Translation.failure(ErrorKind.ARITY, "Binary requires one or two argument");
    }

    BinaryValue binary;
    try {
      binary = (BinaryValue) b.fold(ctx);
    } catch (EvaluationException e) {
      return Translation.failure(ErrorKind.EVALUATION, e.getMessage());
    }

    String bytes = "bytes(" + QuoteHelper.pythonLiteral(binary.getData()) + ", 'utf-8')";

    if (ConstructorArguments.of(ctx.arguments()).size() == 1) {
      return Translation.success("Binary(" + bytes + ")", SemanticType.BINARY);
    }

    String subtype = SUBTYPES.get(binary.getSubtype());
    if (subtype == null) {
      return Translation.failure(ErrorKind.VALUE, "Binary subtype " + binary.getSubtype() + " is not supported");
    }
    return Translation.success("Binary(" + bytes + ", " + subtype + ")", SemanticType.BINARY);
  }
}
