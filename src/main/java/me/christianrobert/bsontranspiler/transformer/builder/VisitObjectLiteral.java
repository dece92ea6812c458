package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import me.christianrobert.bsontranspiler.transformer.util.QuoteHelper;

import java.util.StringJoiner;

/**
 * Object literals become Python dicts.
 *
 * <p>Keys are always single-quoted, whatever their source form ({@code x}, {@code "x"}, {@code 'x'}),
 * and pairs are joined with {@code ", "}: {@code {x: 1, "y": 'a'}} becomes {@code {'x': 1, 'y': 'a'}}.</p>
 */
public class VisitObjectLiteral {
  public static Translation v(ECMAScriptParser.ObjectLiteralContext ctx, PythonCodeBuilder b) {
    StringJoiner pairs = new StringJoiner(", ", "{", "}");

    if (ctx.propertyNameAndValueList() != null) {
      for (ECMAScriptParser.PropertyAssignmentContext assignment : ctx.propertyNameAndValueList().propertyAssignment()) {
        Translation key = b.visit(assignment.propertyName());
        if (key.isFailure()) {
          return key;
        }
        Translation value = b.visit(assignment.singleExpression());
        if (value.isFailure()) {
          return value;
        }
        pairs.add(QuoteHelper.singleQuote(key.getText()) + ": " + value.getText());
      }
    }

    return Translation.success(pairs.toString(), SemanticType.OBJECT);
  }
}
