package com.acme.courier.core;

/** Base class for the unchecked exceptions raised by the message bus. */
public class CourierException extends RuntimeException {
  public CourierException(String message) {
    super(message);
  }

  public CourierException(String message, Throwable e) {
    super(message, e);
  }
}
