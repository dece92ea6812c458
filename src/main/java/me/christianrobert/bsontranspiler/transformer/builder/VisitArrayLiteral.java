package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.StringJoiner;

/**
 * Array literals become Python lists.
 *
 * <p>Elements are joined with {@code ", "}; each hole ({@code [1,,2]}) becomes {@code None}.
 * Separator commas are skipped, so a trailing comma leaves no element behind.</p>
 */
public class VisitArrayLiteral {
  public static Translation v(ECMAScriptParser.ArrayLiteralContext ctx, PythonCodeBuilder b) {
    if (ctx.elementList() == null) {
      return Translation.success("[]", SemanticType.ARRAY);
    }

    Translation elements = b.visit(ctx.elementList());
    if (elements.isFailure()) {
      return elements;
    }
    return Translation.success("[" + elements.getText() + "]", SemanticType.ARRAY);
  }

  public static Translation v(ECMAScriptParser.ElementListContext ctx, PythonCodeBuilder b) {
    StringJoiner elements = new StringJoiner(", ");

    for (ParseTree child : ctx.children) {
      if (child instanceof TerminalNode) {
        continue;
      }
      Translation element = b.visit(child);
      if (element.isFailure()) {
        return element;
      }
      elements.add(element.getText());
    }

    return Translation.untyped(elements.toString());
  }
}
