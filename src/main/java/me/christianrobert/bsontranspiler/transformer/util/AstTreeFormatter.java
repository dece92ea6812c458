package me.christianrobert.bsontranspiler.transformer.util;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Formats ANTLR parse trees into human-readable, indented text representation.
 *
 * <p>Useful for debugging how a shell expression is parsed by the grammar.</p>
 *
 * <p>Example output for {@code ObjectId("5a...")} with a vocabulary:</p>
 * <pre>
 * Expression
 *   BSONObjectIdConstructor
 *     "ObjectId" (BsonObjectId)
 *     Arguments
 *       "(" (OpenParen)
 *       ArgumentList
 *         LiteralExpression ["5a..."]
 *           ...
 *       ")" (CloseParen)
 *   "&lt;EOF&gt;" (EOF)
 * </pre>
 */
public class AstTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a parse tree into human-readable text.
   *
   * @param tree Root of the parse tree
   * @return Formatted string representation
   */
  public static String format(ParseTree tree) {
    return format(tree, null);
  }

  /**
   * Formats a parse tree, naming terminal token types from the given vocabulary.
   *
   * @param tree Root of the parse tree
   * @param vocabulary Parser vocabulary (e.g. {@code ECMAScriptParser.VOCABULARY}), may be null
   * @return Formatted string representation
   */
  public static String format(ParseTree tree, Vocabulary vocabulary) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb, vocabulary);
    return sb.toString();
  }

  private static void formatNode(ParseTree tree, int depth, StringBuilder sb, Vocabulary vocabulary) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }

    if (tree instanceof TerminalNode) {
      TerminalNode terminal = (TerminalNode) tree;
      sb.append("\"").append(escapeAndTruncate(terminal.getText())).append("\"");

      String tokenName = getTokenName(terminal, vocabulary);
      if (!tokenName.isEmpty()) {
        sb.append(" (").append(tokenName).append(")");
      }
      sb.append("\n");

    } else if (tree instanceof ParserRuleContext) {
      ParserRuleContext ctx = (ParserRuleContext) tree;
      sb.append(getRuleName(ctx));

      // Text snippet for small nodes
      if (ctx.getChildCount() <= 2) {
        String text = ctx.getText();
        if (text.length() <= 30) {
          sb.append(" [").append(escapeAndTruncate(text)).append("]");
        }
      }
      sb.append("\n");

      for (int i = 0; i < ctx.getChildCount(); i++) {
        formatNode(ctx.getChild(i), depth + 1, sb, vocabulary);
      }

    } else {
      sb.append("(unknown: ").append(tree.getClass().getSimpleName()).append(")\n");
    }
  }

  /**
   * Rule name from the context class, e.g. {@code BSONCodeConstructorContext} becomes {@code BSONCodeConstructor}.
   */
  private static String getRuleName(ParserRuleContext ctx) {
    String className = ctx.getClass().getSimpleName();
    if (className.endsWith("Context")) {
      className = className.substring(0, className.length() - "Context".length());
    }
    return className;
  }

  private static String getTokenName(TerminalNode terminal, Vocabulary vocabulary) {
    int type = terminal.getSymbol().getType();
    if (type == Token.EOF) {
      return "EOF";
    }
    if (vocabulary == null) {
      return "";
    }
    String name = vocabulary.getSymbolicName(type);
    return name != null ? name : "";
  }

  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }

    return text;
  }
}
