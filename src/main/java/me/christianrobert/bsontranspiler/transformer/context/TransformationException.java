package me.christianrobert.bsontranspiler.transformer.context;

/**
 * Exception thrown by the transpiler front end (input validation, parsing).
 * Captures the source expression and the stage that failed.
 *
 * <p>Rule-level problems inside the code builder are never thrown; they are
 * reported as failed {@link Translation}s.</p>
 */
public class TransformationException extends RuntimeException {

    private final String source;
    private final String context;

    public TransformationException(String message) {
        super(message);
        this.source = null;
        this.context = null;
    }

    public TransformationException(String message, String source, String context) {
        super(message);
        this.source = source;
        this.context = context;
    }

    public TransformationException(String message, String source, String context, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.context = context;
    }

    public String getSource() {
        return source;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including the source expression and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (source != null) {
            sb.append("\nSource: ").append(source);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
