package me.christianrobert.bsontranspiler.transformer.builder.bson;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import me.christianrobert.bsontranspiler.transformer.util.QuoteHelper;

import java.util.List;

/**
 * {@code Code(code[, scope])} becomes {@code Code('<code>'[, <scope>])}.
 *
 * <p>The code argument is emitted from its source text, not translated. The optional scope must be an object literal.</p>
 */
public class VisitCodeConstructor {
  public static Translation v(ECMAScriptParser.BSONCodeConstructorContext ctx, PythonCodeBuilder b) {
    if (!ConstructorArguments.hasArity(ctx.arguments(), 1, 2)) {
      return Translation.failure(ErrorKind.ARITY, "Code requires one or two arguments");
    }

    List<ECMAScriptParser.SingleExpressionContext> args = ConstructorArguments.of(ctx.arguments());
    String code = QuoteHelper.singleQuote(args.get(0).getText());

    if (args.size() == 2) {
      Translation scope = b.visit(args.get(1));
      if (scope.isFailure()) {
        return scope;
      }
      if (scope.getType() != SemanticType.OBJECT) {
        return Translation.failure(ErrorKind.TYPE, "Code requires scope to be an object");
      }
      return Translation.success("Code(" + code + ", " + scope.getText() + ")", SemanticType.CODE);
    }

    return Translation.success("Code(" + code + ")", SemanticType.CODE);
  }
}
