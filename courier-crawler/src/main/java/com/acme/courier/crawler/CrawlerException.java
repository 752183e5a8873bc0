package com.acme.courier.crawler;

public class CrawlerException extends RuntimeException {
  public CrawlerException(String message) {
    super(message);
  }

  public CrawlerException(String message, Throwable e) {
    super(message, e);
  }
}
