package me.christianrobert.bsontranspiler.transformer.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.bsontranspiler.antlr.ECMAScriptLexer;
import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.context.TransformationException;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Thin wrapper around the ANTLR ECMAScriptParser.
 * Handles lexer/parser instantiation and error collection.
 *
 * Uses two-stage parsing:
 * 1. Try SLL(*) mode first (fast, low memory)
 * 2. Fall back to LL(*) mode with full error reporting if SLL fails
 *
 * Inputs nested deeper than the configured bracket depth are rejected before the parser runs.
 *
 * This is the only class that directly instantiates ANTLR parsers.
 */
@Dependent
public class AntlrParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrParser.class);

    /** Default bracket nesting allowed before the recursive descent parser is started. */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    /**
     * Deepest bracket nesting ({@code ( [ {}) in the token stream.
     * Counted on the flat token list.
     */
    static int nestingDepth(CommonTokenStream tokens) {
        int depth = 0;
        int max = 0;
        for (Token token : tokens.getTokens()) {
            switch (token.getType()) {
                case ECMAScriptLexer.OpenBracket:
                case ECMAScriptLexer.OpenParen:
                case ECMAScriptLexer.OpenBrace:
                    depth++;
                    max = Math.max(max, depth);
                    break;
                case ECMAScriptLexer.CloseBracket:
                case ECMAScriptLexer.CloseParen:
                case ECMAScriptLexer.CloseBrace:
                    depth = Math.max(0, depth - 1);
                    break;
                default:
                    break;
            }
        }
        return max;
    }

    /**
     * Two-stage parsing strategy: Try SLL(*) first, fall back to LL(*) if needed.
     *
     * @param source Source text to parse
     * @param parseFunction Function that invokes the parser rule (e.g. parser::expression)
     * @param description Description for logging
     * @return ParseResult containing parse tree and errors
     */
    private <T extends ParserRuleContext> ParseResult parseTwoStage(
            String source,
            Function<ECMAScriptParser, T> parseFunction,
            String description,
            int maxNestingDepth) {

        List<String> errors = new ArrayList<>();
        BaseErrorListener collector = new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg,
                                    RecognitionException e) {
                String error = String.format("Line %d:%d - %s", line, charPositionInLine, msg);
                errors.add(error);
                log.warn("Parse error: {}", error);
            }
        };

        CharStream input = CharStreams.fromString(source);
        ECMAScriptLexer lexer = new ECMAScriptLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(collector);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();

        int depth = nestingDepth(tokens);
        if (depth > maxNestingDepth) {
            log.warn("Rejected {} nested {} levels deep (limit {})", description, depth, maxNestingDepth);
            errors.add("Expression nesting exceeds the limit of " + maxNestingDepth + " levels");
            return new ParseResult(null, errors, source);
        }

        T tree;
        ECMAScriptParser parser = new ECMAScriptParser(tokens);

        // Stage 1: SLL(*) with bail-out on the first problem
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

        try {
            log.trace("Attempting SLL(*) parse for {}", description);
            tree = parseFunction.apply(parser);
            log.trace("SLL(*) parse succeeded for {}", description);

        } catch (Exception sllException) {
            log.trace("SLL(*) parse failed for {}, falling back to LL(*)", description);

            // Stage 2: LL(*) with full error recovery and reporting
            tokens.seek(0);
            parser.reset();
            parser.removeErrorListeners();
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            parser.addErrorListener(collector);

            tree = parseFunction.apply(parser);
            log.debug("LL(*) parse completed for {}", description);
        }

        return new ParseResult(tree, errors, source);
    }

    /**
     * Parses a single shell expression, e.g. {@code {_id: ObjectId("5ab901c29ee65f5c8550c5b9")}}.
     * The whole input must be consumed.
     *
     * @param source Shell expression
     * @return ParseResult containing the parse tree and any errors
     * @throws TransformationException if the source is blank or the parser fails unexpectedly
     */
    public ParseResult parseExpression(String source) {
        return parseExpression(source, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Parses a single shell expression, rejecting it with a parse error when brackets nest
     * deeper than {@code maxNestingDepth}.
     */
    public ParseResult parseExpression(String source, int maxNestingDepth) {
        if (source == null || source.trim().isEmpty()) {
            throw new TransformationException("Expression cannot be null or empty");
        }

        log.debug("Parsing expression: {}", source.substring(0, Math.min(100, source.length())));

        try {
            return parseTwoStage(source, ECMAScriptParser::expression, "expression", maxNestingDepth);
        } catch (Exception e) {
            log.error("Failed to parse expression", e);
            throw new TransformationException("Failed to parse expression: " + e.getMessage(), source, "ANTLR parsing", e);
        }
    }
}
