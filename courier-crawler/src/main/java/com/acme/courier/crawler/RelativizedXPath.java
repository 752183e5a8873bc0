package com.acme.courier.crawler;

import java.util.Objects;

/**
 * Outcome of {@link XPathRelativizer#relativize(String)}: either the rewritten expression or the
 * untouched input together with the reason it could not be rewritten.
 */
public sealed interface RelativizedXPath {

  /** The expression to evaluate, or the original input when invalid */
  String expression();

  /** True when evaluating {@link #expression()} can produce nodes at all */
  boolean isMatchable();

  record Rewritten(String expression) implements RelativizedXPath {
    public Rewritten {
      Objects.requireNonNull(expression, "expression");
    }

    @Override
    public boolean isMatchable() {
      return !expression.isEmpty();
    }
  }

  record Invalid(String expression, String reason) implements RelativizedXPath {
    @Override
    public boolean isMatchable() {
      return false;
    }
  }
}
