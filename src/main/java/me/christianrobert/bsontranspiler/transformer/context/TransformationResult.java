package me.christianrobert.bsontranspiler.transformer.context;

/**
 * Result of a transpilation request.
 * Contains either the Python code or an error message.
 * Optionally includes the AST tree representation for debugging.
 *
 * <p>Serialized as JSON by the REST layer, hence the plain getters.</p>
 */
public class TransformationResult {

    private final boolean success;
    private final String pythonCode;
    private final String errorMessage;
    private final String sourceExpression;
    private final String astTree;  // null unless requested

    private TransformationResult(boolean success, String pythonCode, String errorMessage, String sourceExpression, String astTree) {
        this.success = success;
        this.pythonCode = pythonCode;
        this.errorMessage = errorMessage;
        this.sourceExpression = sourceExpression;
        this.astTree = astTree;
    }

    public static TransformationResult success(String sourceExpression, String pythonCode) {
        return new TransformationResult(true, pythonCode, null, sourceExpression, null);
    }

    public static TransformationResult successWithAst(String sourceExpression, String pythonCode, String astTree) {
        return new TransformationResult(true, pythonCode, null, sourceExpression, astTree);
    }

    public static TransformationResult failure(String sourceExpression, String errorMessage) {
        return new TransformationResult(false, null, errorMessage, sourceExpression, null);
    }

    public static TransformationResult failureWithAst(String sourceExpression, String errorMessage, String astTree) {
        return new TransformationResult(false, null, errorMessage, sourceExpression, astTree);
    }

    /**
     * Creates a failed result from a front-end exception.
     */
    public static TransformationResult failure(String sourceExpression, TransformationException exception) {
        return new TransformationResult(false, null, exception.getDetailedMessage(), sourceExpression, null);
    }

    /**
     * Creates a result from a rule-level translation.
     * A failed translation becomes a failed result whose message is the rendered {@code Error: ...} text.
     */
    public static TransformationResult of(String sourceExpression, Translation translation, String astTree) {
        if (translation.isSuccess()) {
            return new TransformationResult(true, translation.getText(), null, sourceExpression, astTree);
        }
        return new TransformationResult(false, null, translation.render(), sourceExpression, astTree);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getPythonCode() {
        return pythonCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getSourceExpression() {
        return sourceExpression;
    }

    public String getAstTree() {
        return astTree;
    }

    public boolean hasAstTree() {
        return astTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "TransformationResult{success=true, pythonCode='" + pythonCode + "'" +
                   (astTree != null ? ", hasAstTree=true" : "") + "}";
        } else {
            return "TransformationResult{success=false, error='" + errorMessage + "'" +
                   (astTree != null ? ", hasAstTree=true" : "") + "}";
        }
    }
}
