package me.christianrobert.bsontranspiler.transformer.evaluator;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Conversions between evaluator values, following the shell's number and string coercion rules.
 */
public final class JsValues {

    private JsValues() {
    }

    /**
     * Numeric value of a constant (the shell's {@code Number(x)}).
     */
    public static double toNumber(Object value) {
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (value == null) {
            return 0;
        }
        if (value == Undefined.INSTANCE) {
            return Double.NaN;
        }
        if (value instanceof String) {
            return parseNumber((String) value);
        }
        if (value instanceof LongValue) {
            return ((LongValue) value).getValue();
        }
        if (value instanceof DateValue) {
            return ((DateValue) value).getEpochMillis();
        }
        return parseNumber(toDisplayString(value));
    }

    /**
     * Truncates a number to a signed 32-bit integer with wrap-around. NaN and infinities become 0.
     */
    public static int toInt32(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return 0;
        }
        double truncated = number < 0 ? Math.ceil(number) : Math.floor(number);
        double wrapped = truncated % 4294967296.0;
        return (int) (long) wrapped;
    }

    /**
     * String value of a constant (the shell's {@code String(x)}).
     */
    public static String toDisplayString(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Double) {
            return formatNumber((Double) value);
        }
        if (value == null) {
            return "null";
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(element -> element == null || element == Undefined.INSTANCE ? "" : toDisplayString(element))
                    .collect(Collectors.joining(","));
        }
        if (value instanceof Map) {
            return "[object Object]";
        }
        return value.toString();
    }

    /**
     * Formats a number the way the shell prints it: integral values without a fraction, exponents in lower case.
     */
    public static String formatNumber(double number) {
        if (Double.isNaN(number)) {
            return "NaN";
        }
        if (Double.isInfinite(number)) {
            return number > 0 ? "Infinity" : "-Infinity";
        }
        if (number == 0) {
            return "0";
        }
        double abs = Math.abs(number);
        if (abs >= 1e-6 && abs < 1e21) {
            return new BigDecimal(Double.toString(number)).stripTrailingZeros().toPlainString();
        }
        String javaFormat = Double.toString(number);
        int e = javaFormat.indexOf('E');
        String mantissa = javaFormat.substring(0, e);
        String exponent = javaFormat.substring(e + 1);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        return mantissa + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
    }

    /**
     * Name of the value's kind, used in error messages.
     */
    public static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value == Undefined.INSTANCE) {
            return "undefined";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Double) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return "object";
    }

    private static double parseNumber(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        if (trimmed.length() > 2 && trimmed.charAt(0) == '0') {
            char radix = Character.toLowerCase(trimmed.charAt(1));
            int base = radix == 'x' ? 16 : radix == 'o' ? 8 : radix == 'b' ? 2 : 0;
            if (base != 0) {
                try {
                    return new BigInteger(trimmed.substring(2), base).doubleValue();
                } catch (NumberFormatException e) {
                    return Double.NaN;
                }
            }
        }
        switch (trimmed) {
            case "Infinity":
            case "+Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        // Double.parseDouble also accepts "NaN", hex floats and a trailing d/f, none of which are numbers here
        if (!trimmed.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?")) {
            return Double.NaN;
        }
        return Double.parseDouble(trimmed);
    }
}
