package me.christianrobert.bsontranspiler.transformer.context;

import me.christianrobert.bsontranspiler.transformer.evaluator.ConstantEvaluator;
import me.christianrobert.bsontranspiler.transformer.evaluator.SandboxedConstantEvaluator;

/**
 * Per-translation context handed to {@code PythonCodeBuilder}.
 *
 * <p>Each translation creates a fresh context, so nothing is shared between requests.</p>
 */
public class TransformationContext {

    private final ConstantEvaluator constantEvaluator;

    /**
     * Creates a context with a {@link SandboxedConstantEvaluator} using default limits.
     */
    public TransformationContext() {
        this(new SandboxedConstantEvaluator());
    }

    public TransformationContext(ConstantEvaluator constantEvaluator) {
        if (constantEvaluator == null) {
            throw new IllegalArgumentException("Constant evaluator cannot be null");
        }
        this.constantEvaluator = constantEvaluator;
    }

    /**
     * Evaluator used by constructor rules for constant folding.
     */
    public ConstantEvaluator getConstantEvaluator() {
        return constantEvaluator;
    }
}
