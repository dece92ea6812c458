package me.christianrobert.bsontranspiler.transformer.builder.bson;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;

import java.util.Collections;
import java.util.List;

/**
 * Access to a constructor's argument expressions.
 * Arity is the number of expressions, so {@code Code(a, b)} has two arguments.
 */
public final class ConstructorArguments {

  private ConstructorArguments() {
  }

  /**
   * Argument expressions, empty for {@code ()}.
   */
  public static List<ECMAScriptParser.SingleExpressionContext> of(ECMAScriptParser.ArgumentsContext ctx) {
    if (ctx == null || ctx.argumentList() == null) {
      return Collections.emptyList();
    }
    return ctx.argumentList().singleExpression();
  }

  /**
   * True for an empty argument list, e.g. {@code ObjectId()}.
   */
  public static boolean isEmpty(ECMAScriptParser.ArgumentsContext ctx) {
    return ctx == null || ctx.argumentList() == null;
  }

  public static boolean hasArity(ECMAScriptParser.ArgumentsContext ctx, int... accepted) {
    int arity = of(ctx).size();
    for (int count : accepted) {
      if (arity == count) {
        return true;
      }
    }
    return false;
  }
}
