package me.christianrobert.bsontranspiler.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.config.service.ConfigService;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.TransformationContext;
import me.christianrobert.bsontranspiler.transformer.context.TransformationException;
import me.christianrobert.bsontranspiler.transformer.context.TransformationResult;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.evaluator.SandboxedConstantEvaluator;
import me.christianrobert.bsontranspiler.transformer.parser.AntlrParser;
import me.christianrobert.bsontranspiler.transformer.parser.ParseResult;
import me.christianrobert.bsontranspiler.transformer.util.AstTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for translating Mongo shell expressions into Python 3.
 *
 * <p>Architecture:
 * <pre>
 * Shell expression → ANTLR Parse → PythonCodeBuilder → Python source
 *                        ↓                ↓
 *                ECMAScriptParser   SandboxedConstantEvaluator (constant folding)
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * TransformationResult result = service.transpile("{x: NumberLong(5)}");
 * if (result.isSuccess()) {
 *     String python = result.getPythonCode();   // {'x': Int64(5)}
 * } else {
 *     // result.getErrorMessage()
 * }
 * </pre>
 */
@ApplicationScoped
public class TranspilationService {

    private static final Logger log = LoggerFactory.getLogger(TranspilationService.class);

    @Inject
    AntlrParser parser;

    @Inject
    ConfigService configService;

    /**
     * Translates a shell expression, including the AST when {@code transpiler.include-ast} is set.
     *
     * @param source Shell expression
     * @return TransformationResult containing either Python code or error details
     */
    public TransformationResult transpile(String source) {
        Boolean includeAst = configService.getConfigValueAsBoolean(ConfigService.TRANSPILER_INCLUDE_AST);
        return transpile(source, Boolean.TRUE.equals(includeAst));
    }

    /**
     * Translates a shell expression with optional AST tree output.
     *
     * @param source Shell expression
     * @param includeAst Whether to include the AST tree in the result (for debugging)
     * @return TransformationResult containing Python code and optionally the AST tree
     */
    public TransformationResult transpile(String source, boolean includeAst) {
        if (source == null || source.trim().isEmpty()) {
            return TransformationResult.failure(source, "Expression cannot be null or empty");
        }

        log.trace("Shell expression: {}", source);

        try {
            // STEP 1: Parse
            log.debug("Step 1: Parsing shell expression");
            int maxNestingDepth = configService.getConfigValueAsInt(
                    ConfigService.TRANSPILER_MAX_NESTING_DEPTH, AntlrParser.DEFAULT_MAX_NESTING_DEPTH);
            ParseResult parseResult = parser.parseExpression(source, maxNestingDepth);

            String astTree = null;
            if (includeAst && parseResult.getTree() != null) {
                log.debug("Generating AST tree representation");
                astTree = AstTreeFormatter.format(parseResult.getTree(), ECMAScriptParser.VOCABULARY);
            }

            if (parseResult.hasErrors()) {
                String errorMsg = "Parse errors: " + parseResult.getErrorMessage();
                log.warn("Parse failed: {}", errorMsg);
                if (astTree != null) {
                    return TransformationResult.failureWithAst(source, errorMsg, astTree);
                }
                return TransformationResult.failure(source, errorMsg);
            }

            // STEP 2: Per-request context with the configured evaluator limits
            int maxOperations = configService.getConfigValueAsInt(
                    ConfigService.EVALUATOR_MAX_OPERATIONS, SandboxedConstantEvaluator.DEFAULT_MAX_OPERATIONS);
            int maxDepth = configService.getConfigValueAsInt(
                    ConfigService.EVALUATOR_MAX_DEPTH, SandboxedConstantEvaluator.DEFAULT_MAX_DEPTH);
            log.debug("Step 2: Creating transformation context (maxOperations={}, maxDepth={})", maxOperations, maxDepth);
            TransformationContext context =
                    new TransformationContext(new SandboxedConstantEvaluator(maxOperations, maxDepth));

            // STEP 3: Translate
            log.debug("Step 3: Translating to Python");
            PythonCodeBuilder builder = new PythonCodeBuilder(context);
            Translation translation = builder.visit(parseResult.getTree());

            if (translation.isSuccess()) {
                log.info("Successfully translated expression");
                log.debug("Python code: {}", translation.getText());
            } else {
                log.info("Translation rejected: {}", translation.getErrorMessage());
            }
            return TransformationResult.of(source, translation, astTree);

        } catch (TransformationException e) {
            log.error("Transformation failed: {}", e.getDetailedMessage(), e);
            return TransformationResult.failure(source, e);

        } catch (StackOverflowError e) {
            // Nesting below the bracket limit can still be too deep, e.g. long chains of unary operators
            log.warn("Expression too deeply nested to translate ({} characters)", source.length());
            return TransformationResult.failure(source, "Expression is nested too deeply");

        } catch (Exception e) {
            log.error("Unexpected error during transformation", e);
            return TransformationResult.failure(source, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Translates and renders in one step: the Python source, or {@code Error: <message>}.
     */
    public String translate(String source) {
        TransformationResult result = transpile(source, false);
        if (result.isSuccess()) {
            return result.getPythonCode();
        }
        String message = result.getErrorMessage();
        return message.startsWith(Translation.ERROR_PREFIX) ? message : Translation.ERROR_PREFIX + message;
    }
}
