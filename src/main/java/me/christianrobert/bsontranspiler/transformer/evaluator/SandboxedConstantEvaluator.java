package me.christianrobert.bsontranspiler.transformer.evaluator;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptBaseVisitor;
import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.RuleNode;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic evaluator for constant shell expressions.
 *
 * <p>Walks the parse tree directly, so it never executes source text and has no access to
 * I/O or host state. Supported: literals, arrays, objects, unary sign, arithmetic, member access
 * on constants and the folding constructors ({@code ObjectId}, {@code Binary}, {@code Long},
 * {@code Date}, {@code Date.now}, {@code Number}, {@code Double}, {@code RegExp},
 * {@code Object.create}). Anything else raises an {@link EvaluationException}.</p>
 *
 * <p>Each call to {@link #evaluate(ParserRuleContext)} is bounded by an operation budget and a
 * nesting depth. Instances are not thread safe; create one per translation.</p>
 */
public class SandboxedConstantEvaluator extends ECMAScriptBaseVisitor<Object> implements ConstantEvaluator {

    public static final int DEFAULT_MAX_OPERATIONS = 10_000;
    public static final int DEFAULT_MAX_DEPTH = 200;

    private static final String REGEX_FLAG_ORDER = "dgimsuvy";

    private final int maxOperations;
    private final int maxDepth;
    private final Clock clock;

    private int operations;
    private int depth;

    public SandboxedConstantEvaluator() {
        this(DEFAULT_MAX_OPERATIONS, DEFAULT_MAX_DEPTH, Clock.systemUTC());
    }

    public SandboxedConstantEvaluator(int maxOperations, int maxDepth) {
        this(maxOperations, maxDepth, Clock.systemUTC());
    }

    /**
     * @param maxOperations Maximum number of nodes visited per evaluation
     * @param maxDepth Maximum nesting depth per evaluation
     * @param clock Source of the current time for {@code Date.now()} and {@code new Date()}
     */
    public SandboxedConstantEvaluator(int maxOperations, int maxDepth, Clock clock) {
        this.maxOperations = maxOperations;
        this.maxDepth = maxDepth;
        this.clock = clock;
    }

    @Override
    public Object evaluate(ParserRuleContext ctx) {
        operations = 0;
        depth = 0;
        try {
            return visit(ctx);
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new EvaluationException(message, e);
        }
    }

    @Override
    public Object visit(ParseTree tree) {
        if (++operations > maxOperations) {
            throw new EvaluationException("Constant expression exceeds the limit of " + maxOperations + " operations");
        }
        if (depth >= maxDepth) {
            throw new EvaluationException("Constant expression exceeds the maximum nesting depth of " + maxDepth);
        }
        depth++;
        try {
            return tree.accept(this);
        } finally {
            depth--;
        }
    }

    // Single-child wrappers (literal, singleExpression alternatives) pass their child's value through
    @Override
    public Object visitChildren(RuleNode node) {
        if (node.getChildCount() == 1) {
            return visit(node.getChild(0));
        }
        throw unsupported(node.getText());
    }

    @Override
    public Object visitTerminal(TerminalNode node) {
        throw unsupported(node.getText());
    }

    @Override
    public Object visitExpression(ECMAScriptParser.ExpressionContext ctx) {
        return visit(ctx.singleExpression());
    }

    // ========== LITERALS ==========

    @Override
    public Object visitNullLiteral(ECMAScriptParser.NullLiteralContext ctx) {
        return null;
    }

    @Override
    public Object visitUndefinedLiteral(ECMAScriptParser.UndefinedLiteralContext ctx) {
        return Undefined.INSTANCE;
    }

    @Override
    public Object visitBooleanLiteral(ECMAScriptParser.BooleanLiteralContext ctx) {
        return Boolean.valueOf(ctx.getText());
    }

    @Override
    public Object visitStringLiteral(ECMAScriptParser.StringLiteralContext ctx) {
        return unescape(ctx.getText());
    }

    @Override
    public Object visitIntegerLiteral(ECMAScriptParser.IntegerLiteralContext ctx) {
        return Double.parseDouble(ctx.getText());
    }

    @Override
    public Object visitDecimalLiteral(ECMAScriptParser.DecimalLiteralContext ctx) {
        return Double.parseDouble(ctx.getText());
    }

    @Override
    public Object visitHexIntegerLiteral(ECMAScriptParser.HexIntegerLiteralContext ctx) {
        return new BigInteger(ctx.getText().substring(2), 16).doubleValue();
    }

    @Override
    public Object visitOctalIntegerLiteral(ECMAScriptParser.OctalIntegerLiteralContext ctx) {
        String text = ctx.getText();
        String digits = text.length() > 1 && (text.charAt(1) == 'o' || text.charAt(1) == 'O')
                ? text.substring(2)
                : text.substring(1);
        return new BigInteger(digits, 8).doubleValue();
    }

    @Override
    public Object visitRegularExpressionLiteral(ECMAScriptParser.RegularExpressionLiteralContext ctx) {
        String text = ctx.getText();
        int close = text.lastIndexOf('/');
        String source = text.substring(1, close);
        String flags = text.substring(close + 1);
        return new RegexValue(source, canonicalFlags(flags, "Invalid regular expression flags"));
    }

    @Override
    public Object visitArrayLiteral(ECMAScriptParser.ArrayLiteralContext ctx) {
        if (ctx.elementList() == null) {
            return new ArrayList<>();
        }
        return visit(ctx.elementList());
    }

    /**
     * Commas separate slots; an empty slot is a hole (undefined) and a single trailing comma is ignored.
     */
    @Override
    public Object visitElementList(ECMAScriptParser.ElementListContext ctx) {
        List<Object> elements = new ArrayList<>();
        boolean slotFilled = false;
        for (ParseTree child : ctx.children) {
            if (child instanceof ECMAScriptParser.SingleExpressionContext) {
                elements.add(visit(child));
                slotFilled = true;
            } else {
                if (!slotFilled) {
                    elements.add(Undefined.INSTANCE);
                }
                slotFilled = false;
            }
        }
        return elements;
    }

    @Override
    public Object visitObjectLiteral(ECMAScriptParser.ObjectLiteralContext ctx) {
        Map<String, Object> object = new LinkedHashMap<>();
        if (ctx.propertyNameAndValueList() != null) {
            for (ECMAScriptParser.PropertyAssignmentContext assignment : ctx.propertyNameAndValueList().propertyAssignment()) {
                object.put(propertyKey(assignment.propertyName()), visit(assignment.singleExpression()));
            }
        }
        return object;
    }

    private String propertyKey(ECMAScriptParser.PropertyNameContext ctx) {
        if (ctx.StringValue() != null) {
            return unescape(ctx.StringValue().getText());
        }
        if (ctx.numericLiteral() != null) {
            return JsValues.formatNumber((Double) visit(ctx.numericLiteral()));
        }
        return ctx.getText();
    }

    // ========== OPERATORS ==========

    @Override
    public Object visitParenthesizedExpression(ECMAScriptParser.ParenthesizedExpressionContext ctx) {
        return visit(ctx.singleExpression());
    }

    @Override
    public Object visitUnaryPlusExpression(ECMAScriptParser.UnaryPlusExpressionContext ctx) {
        return JsValues.toNumber(visit(ctx.singleExpression()));
    }

    @Override
    public Object visitUnaryMinusExpression(ECMAScriptParser.UnaryMinusExpressionContext ctx) {
        return -JsValues.toNumber(visit(ctx.singleExpression()));
    }

    @Override
    public Object visitAdditiveExpression(ECMAScriptParser.AdditiveExpressionContext ctx) {
        Object left = visit(ctx.singleExpression(0));
        Object right = visit(ctx.singleExpression(1));
        if (ctx.getChild(1).getText().equals("-")) {
            return JsValues.toNumber(left) - JsValues.toNumber(right);
        }
        left = toPrimitive(left);
        right = toPrimitive(right);
        if (left instanceof String || right instanceof String) {
            return JsValues.toDisplayString(left) + JsValues.toDisplayString(right);
        }
        return JsValues.toNumber(left) + JsValues.toNumber(right);
    }

    @Override
    public Object visitMultiplicativeExpression(ECMAScriptParser.MultiplicativeExpressionContext ctx) {
        double left = JsValues.toNumber(visit(ctx.singleExpression(0)));
        double right = JsValues.toNumber(visit(ctx.singleExpression(1)));
        switch (ctx.getChild(1).getText()) {
            case "*":
                return left * right;
            case "/":
                return left / right;
            default:
                return left % right;
        }
    }

    @Override
    public Object visitIdentifierExpression(ECMAScriptParser.IdentifierExpressionContext ctx) {
        String name = ctx.getText();
        switch (name) {
            case "Infinity":
                return Double.POSITIVE_INFINITY;
            case "NaN":
                return Double.NaN;
            default:
                throw new EvaluationException(name + " is not defined");
        }
    }

    @Override
    public Object visitMemberDotExpression(ECMAScriptParser.MemberDotExpressionContext ctx) {
        return property(visit(ctx.singleExpression()), ctx.identifierName().getText());
    }

    @Override
    public Object visitMemberIndexExpression(ECMAScriptParser.MemberIndexExpressionContext ctx) {
        Object target = visit(ctx.singleExpression(0));
        Object key = visit(ctx.singleExpression(1));
        return property(target, key instanceof Double ? JsValues.formatNumber((Double) key) : JsValues.toDisplayString(key));
    }

    @Override
    public Object visitArgumentsExpression(ECMAScriptParser.ArgumentsExpressionContext ctx) {
        // Resolve the callee first so undefined names are reported as such
        visit(ctx.singleExpression());
        throw unsupported(ctx.singleExpression().getText() + "()");
    }

    @Override
    public Object visitNewExpression(ECMAScriptParser.NewExpressionContext ctx) {
        if (ctx.arguments() != null) {
            throw unsupported(ctx.getText());
        }
        return visit(ctx.singleExpression());
    }

    // ========== FOLDING CONSTRUCTORS ==========

    @Override
    public Object visitBSONObjectIdConstructor(ECMAScriptParser.BSONObjectIdConstructorContext ctx) {
        List<Object> args = arguments(ctx.arguments());
        if (args.isEmpty()) {
            throw unsupported("ObjectId() without arguments");
        }
        Object id = args.get(0);
        if (id instanceof ObjectIdValue) {
            return id;
        }
        if (id instanceof Double) {
            double seconds = (Double) id;
            if (Double.isNaN(seconds) || seconds < 0 || seconds > ObjectIdValue.MAX_TIME) {
                throw new EvaluationException("ObjectId time " + JsValues.toDisplayString(id)
                        + " is outside the 32-bit timestamp range");
            }
            return ObjectIdValue.fromTime((long) seconds);
        }
        if (id instanceof String) {
            return ObjectIdValue.fromString((String) id);
        }
        throw new EvaluationException(ObjectIdValue.INVALID_ARGUMENT);
    }

    @Override
    public Object visitBSONBinaryConstructor(ECMAScriptParser.BSONBinaryConstructorContext ctx) {
        List<Object> args = arguments(ctx.arguments());
        if (args.isEmpty() || !(args.get(0) instanceof String)) {
            throw new EvaluationException("Binary requires a string argument");
        }
        int subtype = BinaryValue.DEFAULT_SUBTYPE;
        if (args.size() > 1 && args.get(1) != null && args.get(1) != Undefined.INSTANCE) {
            double number = JsValues.toNumber(args.get(1));
            if (Double.isNaN(number) || number != Math.rint(number) || Math.abs(number) > Integer.MAX_VALUE) {
                throw new EvaluationException("Binary subtype " + JsValues.toDisplayString(args.get(1)) + " is not supported");
            }
            subtype = (int) number;
        }
        return new BinaryValue((String) args.get(0), subtype);
    }

    @Override
    public Object visitBSONLongConstructor(ECMAScriptParser.BSONLongConstructorContext ctx) {
        List<Object> args = arguments(ctx.arguments());
        int low = args.isEmpty() ? 0 : JsValues.toInt32(JsValues.toNumber(args.get(0)));
        int high = args.size() < 2 ? 0 : JsValues.toInt32(JsValues.toNumber(args.get(1)));
        return LongValue.fromBits(low, high);
    }

    @Override
    public Object visitBSONDoubleConstructor(ECMAScriptParser.BSONDoubleConstructorContext ctx) {
        List<Object> args = arguments(ctx.arguments());
        return args.isEmpty() ? Double.NaN : JsValues.toNumber(args.get(0));
    }

    @Override
    public Object visitNumberConstructorExpression(ECMAScriptParser.NumberConstructorExpressionContext ctx) {
        List<Object> args = arguments(ctx.arguments());
        return args.isEmpty() ? 0.0 : JsValues.toNumber(args.get(0));
    }

    @Override
    public Object visitDateConstructorExpression(ECMAScriptParser.DateConstructorExpressionContext ctx) {
        List<Object> args = arguments(ctx.arguments());
        if (args.isEmpty()) {
            return new DateValue(clock.millis());
        }
        if (args.size() == 1) {
            Object value = args.get(0);
            if (value instanceof DateValue) {
                return value;
            }
            if (value instanceof String) {
                return new DateValue(JsDates.parse((String) value));
            }
            return new DateValue(JsDates.fromEpochMillis(JsValues.toNumber(value)));
        }
        List<Double> components = new ArrayList<>();
        for (Object arg : args) {
            components.add(JsValues.toNumber(arg));
        }
        return new DateValue(JsDates.fromComponents(components));
    }

    @Override
    public Object visitDateNowConstructorExpression(ECMAScriptParser.DateNowConstructorExpressionContext ctx) {
        return (double) clock.millis();
    }

    @Override
    public Object visitRegExpConstructorExpression(ECMAScriptParser.RegExpConstructorExpressionContext ctx) {
        List<Object> args = arguments(ctx.arguments());
        Object pattern = args.isEmpty() ? Undefined.INSTANCE : args.get(0);
        Object flags = args.size() < 2 ? Undefined.INSTANCE : args.get(1);

        String source;
        String flagText;
        if (pattern instanceof RegexValue) {
            source = ((RegexValue) pattern).getSource();
            flagText = flags == Undefined.INSTANCE ? ((RegexValue) pattern).getFlags() : JsValues.toDisplayString(flags);
        } else {
            source = pattern == Undefined.INSTANCE ? "" : escapeRegexSource(JsValues.toDisplayString(pattern));
            flagText = flags == Undefined.INSTANCE ? "" : JsValues.toDisplayString(flags);
        }
        if (source.isEmpty()) {
            source = "(?:)";
        }
        return new RegexValue(source, canonicalFlags(flagText, "Invalid flags supplied to RegExp constructor '" + flagText + "'"));
    }

    @Override
    public Object visitObjectCreateConstructorExpression(ECMAScriptParser.ObjectCreateConstructorExpressionContext ctx) {
        List<Object> args = arguments(ctx.arguments());
        Object prototype = args.isEmpty() ? Undefined.INSTANCE : args.get(0);
        if (prototype == null) {
            return new LinkedHashMap<String, Object>();
        }
        if (!(prototype instanceof Map)) {
            throw new EvaluationException("Object prototype may only be an Object or null: " + JsValues.toDisplayString(prototype));
        }
        return new LinkedHashMap<>((Map<?, ?>) prototype);
    }

    @Override
    public Object visitBSONCodeConstructor(ECMAScriptParser.BSONCodeConstructorContext ctx) {
        throw unsupported("Code");
    }

    @Override
    public Object visitBSONDBRefConstructor(ECMAScriptParser.BSONDBRefConstructorContext ctx) {
        throw unsupported("DBRef");
    }

    @Override
    public Object visitBSONMinKeyConstructor(ECMAScriptParser.BSONMinKeyConstructorContext ctx) {
        throw unsupported("MinKey");
    }

    @Override
    public Object visitBSONMaxKeyConstructor(ECMAScriptParser.BSONMaxKeyConstructorContext ctx) {
        throw unsupported("MaxKey");
    }

    @Override
    public Object visitBSONRegExpConstructor(ECMAScriptParser.BSONRegExpConstructorContext ctx) {
        throw unsupported("BSONRegExp");
    }

    @Override
    public Object visitBSONSymbolConstructor(ECMAScriptParser.BSONSymbolConstructorContext ctx) {
        throw unsupported("Symbol");
    }

    @Override
    public Object visitBSONTimestampConstructor(ECMAScriptParser.BSONTimestampConstructorContext ctx) {
        throw unsupported("Timestamp");
    }

    // ========== HELPERS ==========

    private List<Object> arguments(ECMAScriptParser.ArgumentsContext ctx) {
        if (ctx == null || ctx.argumentList() == null) {
            return Collections.emptyList();
        }
        List<Object> values = new ArrayList<>();
        for (ECMAScriptParser.SingleExpressionContext arg : ctx.argumentList().singleExpression()) {
            values.add(visit(arg));
        }
        return values;
    }

    private Object property(Object target, String name) {
        if (target == null || target == Undefined.INSTANCE) {
            throw new EvaluationException("Cannot read properties of " + JsValues.typeName(target) + " (reading '" + name + "')");
        }
        if (target instanceof String) {
            String s = (String) target;
            if (name.equals("length")) {
                return (double) s.length();
            }
            int index = arrayIndex(name);
            return index >= 0 && index < s.length() ? String.valueOf(s.charAt(index)) : Undefined.INSTANCE;
        }
        if (target instanceof List) {
            List<?> list = (List<?>) target;
            if (name.equals("length")) {
                return (double) list.size();
            }
            int index = arrayIndex(name);
            return index >= 0 && index < list.size() ? list.get(index) : Undefined.INSTANCE;
        }
        if (target instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) target;
            return map.containsKey(name) ? map.get(name) : Undefined.INSTANCE;
        }
        return Undefined.INSTANCE;
    }

    private static int arrayIndex(String name) {
        if (!name.matches("0|[1-9]\\d{0,8}")) {
            return -1;
        }
        return Integer.parseInt(name);
    }

    private static Object toPrimitive(Object value) {
        if (value instanceof List || value instanceof Map || value instanceof DateValue
                || value instanceof ObjectIdValue || value instanceof BinaryValue || value instanceof RegexValue) {
            return JsValues.toDisplayString(value);
        }
        if (value instanceof LongValue) {
            return (double) ((LongValue) value).getValue();
        }
        return value;
    }

    /**
     * Validates flags and returns them in canonical order.
     */
    private static String canonicalFlags(String flags, String errorMessage) {
        StringBuilder canonical = new StringBuilder();
        for (char flag : REGEX_FLAG_ORDER.toCharArray()) {
            int first = flags.indexOf(flag);
            if (first >= 0) {
                if (flags.indexOf(flag, first + 1) >= 0) {
                    throw new EvaluationException(errorMessage);
                }
                canonical.append(flag);
            }
        }
        if (canonical.length() != flags.length()) {
            throw new EvaluationException(errorMessage);
        }
        return canonical.toString();
    }

    /**
     * Source text of a pattern given as a string: bare slashes and line terminators are escaped.
     */
    private static String escapeRegexSource(String pattern) {
        StringBuilder sb = new StringBuilder();
        boolean inClass = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < pattern.length()) {
                sb.append(c).append(pattern.charAt(++i));
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            }
            if (c == '/' && !inClass) {
                sb.append("\\/");
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\u2028') {
                sb.append("\\u2028");
            } else if (c == '\u2029') {
                sb.append("\\u2029");
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Value of a quoted string literal: strips the quotes and resolves escape sequences.
     */
    static String unescape(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n': sb.append('\n'); break;
                case 't': sb.append('\t'); break;
                case 'r': sb.append('\r'); break;
                case 'b': sb.append('\b'); break;
                case 'f': sb.append('\f'); break;
                case 'v': sb.append('\u000B'); break;
                case '0': sb.append('\0'); break;
                case 'x':
                    if (isHex(body, i + 1, 2)) {
                        sb.append((char) Integer.parseInt(body.substring(i + 1, i + 3), 16));
                        i += 2;
                    } else {
                        sb.append(next);
                    }
                    break;
                case 'u':
                    if (i + 1 < body.length() && body.charAt(i + 1) == '{') {
                        int close = body.indexOf('}', i + 2);
                        if (close > i + 2 && isHex(body, i + 2, close - i - 2)) {
                            sb.appendCodePoint(Integer.parseInt(body.substring(i + 2, close), 16));
                            i = close;
                            break;
                        }
                    } else if (isHex(body, i + 1, 4)) {
                        sb.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
                        i += 4;
                        break;
                    }
                    sb.append(next);
                    break;
                default:
                    sb.append(next);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(String s, int start, int length) {
        if (start + length > s.length()) {
            return false;
        }
        for (int i = start; i < start + length; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static EvaluationException unsupported(String what) {
        return new EvaluationException(what + " is not supported in constant expressions");
    }
}
