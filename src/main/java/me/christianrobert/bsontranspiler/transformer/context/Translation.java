package me.christianrobert.bsontranspiler.transformer.context;

import me.christianrobert.bsontranspiler.transformer.type.SemanticType;

import java.util.Objects;

/**
 * Result of translating one parse tree node.
 *
 * <p>Either a success carrying the Python text and the inferred {@link SemanticType},
 * or a failure carrying an {@link ErrorKind} and a message. Parent rules check
 * {@link #isFailure()} before embedding a child's text and propagate the failure instead.</p>
 *
 * <p>{@link #render()} produces the string handed to callers: the text, or
 * {@code "Error: " + message}.</p>
 */
public final class Translation {

    public static final String ERROR_PREFIX = "Error: ";

    private final String text;
    private final SemanticType type;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private Translation(String text, SemanticType type, ErrorKind errorKind, String errorMessage) {
        this.text = text;
        this.type = type;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static Translation success(String text, SemanticType type) {
        return new Translation(Objects.requireNonNull(text, "text"), Objects.requireNonNull(type, "type"), null, null);
    }

    /**
     * Creates a successful translation whose type is not known ({@link SemanticType#UNKNOWN}).
     */
    public static Translation untyped(String text) {
        return success(text, SemanticType.UNKNOWN);
    }

    public static Translation failure(ErrorKind kind, String message) {
        return new Translation(null, SemanticType.UNKNOWN, Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(message, "message"));
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    /**
     * Gets the translated Python text.
     *
     * @throws IllegalStateException if this is a failure
     */
    public String getText() {
        if (isFailure()) {
            throw new IllegalStateException("Failed translation has no text: " + errorMessage);
        }
        return text;
    }

    /**
     * Gets the inferred type. Failures report {@link SemanticType#UNKNOWN}.
     */
    public SemanticType getType() {
        return type;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Renders the translation for callers: the text, or the message prefixed with {@value #ERROR_PREFIX}.
     */
    public String render() {
        return isSuccess() ? text : ERROR_PREFIX + errorMessage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Translation)) {
            return false;
        }
        Translation that = (Translation) o;
        return Objects.equals(text, that.text)
                && type == that.type
                && errorKind == that.errorKind
                && Objects.equals(errorMessage, that.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, type, errorKind, errorMessage);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "Translation{text='" + text + "', type=" + type + "}";
        }
        return "Translation{error=" + errorKind + ", message='" + errorMessage + "'}";
    }
}
