package me.christianrobert.bsontranspiler.transformer.evaluator;

/**
 * Raised when a constant expression cannot be folded.
 * The message is shown to the user verbatim (prefixed with {@code Error: }).
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
