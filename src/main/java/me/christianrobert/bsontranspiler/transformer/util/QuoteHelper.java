package me.christianrobert.bsontranspiler.transformer.util;

/**
 * Quoting helpers for emitting Python string literals.
 *
 * <p>Input may already be quoted (a translated string literal) or bare (a computed value such as a hex id).
 * Surrounding quotes are stripped first, then unescaped occurrences of the target quote are escaped.
 * Existing escape sequences are kept as they are.</p>
 */
public class QuoteHelper {

  /**
   * {@code "abc"}, {@code 'abc'} and {@code abc} all become {@code 'abc'}.
   */
  public static String singleQuote(String value) {
    return quote(value, '\'');
  }

  /**
   * Same as {@link #singleQuote(String)} with double quotes.
   */
  public static String doubleQuote(String value) {
    return quote(value, '"');
  }

  /**
   * Double-quotes text that is never itself quoted (a regex source), so surrounding quote
   * characters are kept as part of the value.
   */
  public static String doubleQuoteVerbatim(String value) {
    return escape(value, '"');
  }

  /**
   * Strips one pair of matching surrounding quotes, if present.
   */
  public static String removeQuotes(String value) {
    if (value != null && value.length() >= 2) {
      char first = value.charAt(0);
      char last = value.charAt(value.length() - 1);
      if ((first == '\'' || first == '"') && first == last) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }

  /**
   * Single-quoted Python literal for a computed (unescaped) value.
   * Unlike {@link #singleQuote(String)} nothing is stripped and every backslash is escaped.
   */
  public static String pythonLiteral(String raw) {
    StringBuilder sb = new StringBuilder(raw.length() + 2);
    sb.append('\'');
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '\'' -> sb.append("\\'");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('\'');
    return sb.toString();
  }

  private static String quote(String value, char quote) {
    return escape(removeQuotes(value), quote);
  }

  private static String escape(String body, char quote) {
    StringBuilder sb = new StringBuilder(body.length() + 2);
    sb.append(quote);
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == '\\' && i + 1 < body.length()) {
        sb.append(c).append(body.charAt(++i));
      } else if (c == quote) {
        sb.append('\\').append(c);
      } else {
        sb.append(c);
      }
    }
    sb.append(quote);
    return sb.toString();
  }
}
