package me.christianrobert.bsontranspiler.transformer.builder.regex;

import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.evaluator.EvaluationException;
import me.christianrobert.bsontranspiler.transformer.evaluator.RegexValue;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;
import me.christianrobert.bsontranspiler.transformer.util.QuoteHelper;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.Map;
import java.util.regex.Matcher;

/**
 * Native regular expressions ({@code /abc/i} and {@code RegExp("abc", "i")}) become
 * {@code re.compile(r"abc(?i)")}.
 *
 * <p>Source and flags are folded first. Flags are mapped to Python inline flags
 * ({@code i→i, m→m, u→a, g→s}, {@code y} and unknown flags dropped), sorted, and appended
 * as {@code (?flags)} when any remain.</p>
 */
public class VisitRegularExpression {

  private static final Map<Character, String> PYTHON_FLAGS = Map.of(
      'i', "i",  // re.IGNORECASE
      'm', "m",  // re.MULTILINE
      'u', "a",  // re.ASCII
      'y', "",   // sticky, no counterpart
      'g', "s"   // re.DOTALL
  );

  public static Translation v(ParserRuleContext ctx, PythonCodeBuilder b) {
    RegexValue regex;
    try {
      regex = (RegexValue) b.fold(ctx);
    } catch (EvaluationException e) {
      return Translation.failure(ErrorKind.EVALUATION, e.getMessage());
    }

    // Only the first backslash not followed by '/' is doubled
    String escaped = regex.getSource().replaceFirst("\\\\(?!/)", Matcher.quoteReplacement("\\\\"));

    String flags = pythonFlags(regex.getFlags());
    if (!flags.isEmpty()) {
      escaped = escaped + "(?" + flags + ")";
    }

    return Translation.success("re.compile(r" + QuoteHelper.doubleQuoteVerbatim(escaped) + ")", SemanticType.REGEX);
  }

  static String pythonFlags(String flags) {
    return flags.chars()
        .mapToObj(c -> PYTHON_FLAGS.getOrDefault((char) c, ""))
        .filter(mapped -> !mapped.isEmpty())
        .sorted()
        .reduce("", String::concat);
  }
}
