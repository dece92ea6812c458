package me.christianrobert.bsontranspiler.transformer.evaluator;

import org.antlr.v4.runtime.ParserRuleContext;

/**
 * Strategy interface for folding a constant sub-expression to its runtime value.
 * <p>
 * Constructor rules use it when the canonical value cannot be derived from syntax alone,
 * e.g. the hex string of {@code ObjectId(1234)} or the UTC fields of {@code Date("2019-01-01")}.
 * <p>
 * Values are represented as:
 * <ul>
 *   <li>{@link String}, {@link Double}, {@link Boolean}, {@code null}, {@link Undefined}</li>
 *   <li>{@link java.util.List} for arrays, {@link java.util.Map} (insertion ordered) for objects</li>
 *   <li>{@link ObjectIdValue}, {@link BinaryValue}, {@link LongValue}, {@link DateValue}, {@link RegexValue}</li>
 * </ul>
 *
 * @see SandboxedConstantEvaluator
 */
public interface ConstantEvaluator {

    /**
     * Evaluates the given expression node.
     *
     * @param ctx The expression sub-tree to fold
     * @return The runtime value of the expression
     * @throws EvaluationException if the expression is not a foldable constant or evaluation fails
     */
    Object evaluate(ParserRuleContext ctx);
}
