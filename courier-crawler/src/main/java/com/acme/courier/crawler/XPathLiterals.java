package com.acme.courier.crawler;

import java.util.ArrayList;
import java.util.List;

/** Quoting of arbitrary strings as XPath 1.0 string literals, which have no escape syntax. */
public final class XPathLiterals {
  private XPathLiterals() {}

  /**
   * {@code foo " bar} becomes {@code 'foo " bar'}, {@code foo ' bar} becomes {@code "foo ' bar"},
   * and a string holding both quote kinds becomes a {@code concat(...)} call.
   */
  public static String of(String s) {
    if (s.indexOf('\'') < 0) {
      return "'" + s + "'";
    }
    if (s.indexOf('"') < 0) {
      return "\"" + s + "\"";
    }

    List<String> parts = new ArrayList<>();
    String rest = s;
    int quote;
    while ((quote = rest.indexOf('\'')) >= 0) {
      parts.add("'" + rest.substring(0, quote) + "'");
      parts.add("\"'\"");
      rest = rest.substring(quote + 1);
    }
    parts.add("'" + rest + "'");
    return "concat(" + String.join(", ", parts) + ")";
  }
}
