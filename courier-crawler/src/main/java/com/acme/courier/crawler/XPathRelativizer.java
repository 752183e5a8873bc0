package com.acme.courier.crawler;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rewrites an XPath expression so that it can be evaluated with each crawler node as the context
 * node while behaving as if the crawler were a fake parent of those nodes.
 *
 * <p>Every top-level union branch is rewritten on its own: {@code //div} becomes {@code
 * descendant-or-self::div}, a bare {@code div} becomes {@code self::div}, and branches that can
 * only select the fake root, its parent, siblings or attributes are replaced by an expression that
 * never matches. Union arity is kept, so {@code (a | /b)} still has two branches.
 */
public final class XPathRelativizer {

  /** Never matches: there is no element named "a" whose name is "b". */
  public static final String NON_MATCHING_EXPRESSION = "a[name() = \"b\"]";

  private static final String WHITESPACE = " \t\n\r\0\u000B";
  private static final String SCAN_STOPS = "\"'[]|";

  // the fake root has no parent, siblings or attributes (not even namespace ones)
  private static final Pattern NON_MATCHING_AXES =
      Pattern.compile(
          "^(ancestor|ancestor-or-self|attribute|following|following-sibling|namespace|parent"
              + "|preceding|preceding-sibling)::");

  private XPathRelativizer() {}

  public static RelativizedXPath relativize(String xpath) {
    int length = xpath.length();
    int start = skip(xpath, WHITESPACE, 0);
    if (start == length) {
      return new RelativizedXPath.Rewritten("");
    }

    List<String> expressions = new ArrayList<>();
    int openedBrackets = 0;

    for (int i = start; i <= length; i++) {
      i = scanTo(xpath, SCAN_STOPS, i);

      if (i < length) {
        char c = xpath.charAt(i);
        if (c == '"' || c == '\'') {
          int closing = xpath.indexOf(c, i + 1);
          if (closing < 0) {
            return new RelativizedXPath.Invalid(
                xpath, "Unterminated string literal starting at offset " + i);
          }
          i = closing;
          continue;
        }
        if (c == '[') {
          openedBrackets++;
          continue;
        }
        if (c == ']') {
          openedBrackets--;
          continue;
        }
      }
      if (openedBrackets != 0) {
        continue;
      }

      // a union wrapped in parentheses keeps its opening parentheses; only what follows is rewritten
      String parenthesis = "";
      if (start < length && xpath.charAt(start) == '(') {
        int end = skip(xpath, "(" + WHITESPACE, start + 1);
        parenthesis = xpath.substring(start, end);
        start = end;
      }
      String branch = stripTrailing(xpath.substring(start, Math.max(start, i)));
      expressions.add(parenthesis + rewriteBranch(branch));

      if (i == length) {
        return new RelativizedXPath.Rewritten(String.join(" | ", expressions));
      }

      i = skip(xpath, WHITESPACE, i + 1) - 1;
      start = i + 1;
    }

    return new RelativizedXPath.Invalid(xpath, "Unbalanced brackets");
  }

  /**
   * String form of {@link #relativize(String)}: the rewritten expression, or the input unchanged
   * when it cannot be rewritten.
   */
  public static String relativizeToString(String xpath) {
    return relativize(xpath).expression();
  }

  static String rewriteBranch(String expression) {
    if (expression.startsWith("self::*/")) {
      expression = "./" + expression.substring(8);
    }

    if (expression.isEmpty()) {
      return NON_MATCHING_EXPRESSION;
    }
    if (expression.startsWith("//")) {
      return "descendant-or-self::" + expression.substring(2);
    }
    if (expression.startsWith(".//")) {
      return "descendant-or-self::" + expression.substring(3);
    }
    if (expression.startsWith("./")) {
      return "self::" + expression.substring(2);
    }
    if (expression.startsWith("child::")) {
      return "self::" + expression.substring(7);
    }
    if (expression.charAt(0) == '/'
        || expression.charAt(0) == '.'
        || expression.startsWith("self::")) {
      return NON_MATCHING_EXPRESSION;
    }
    if (expression.startsWith("descendant::")) {
      return "descendant-or-self::" + expression.substring(12);
    }
    if (NON_MATCHING_AXES.matcher(expression).find()) {
      return NON_MATCHING_EXPRESSION;
    }
    if (expression.startsWith("descendant-or-self::")) {
      return expression;
    }
    return "self::" + expression;
  }

  /** Index of the first char at or after {@code from} that is not in {@code chars} */
  private static int skip(String s, String chars, int from) {
    int i = from;
    while (i < s.length() && chars.indexOf(s.charAt(i)) >= 0) {
      i++;
    }
    return i;
  }

  /** Index of the first char at or after {@code from} that is in {@code chars}, or the length */
  private static int scanTo(String s, String chars, int from) {
    int i = from;
    while (i < s.length() && chars.indexOf(s.charAt(i)) < 0) {
      i++;
    }
    return i;
  }

  private static String stripTrailing(String s) {
    int end = s.length();
    while (end > 0 && WHITESPACE.indexOf(s.charAt(end - 1)) >= 0) {
      end--;
    }
    return s.substring(0, end);
  }
}
