package com.acme.courier.crawler;

/** The XPath engine rejected an expression, typically a syntax error or an unbound prefix. */
public class InvalidXPathException extends CrawlerException {
  public InvalidXPathException(String message, Throwable e) {
    super(message, e);
  }
}
