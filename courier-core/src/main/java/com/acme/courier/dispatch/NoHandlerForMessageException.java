package com.acme.courier.dispatch;

import com.acme.courier.core.CourierException;

public class NoHandlerForMessageException extends CourierException {
  public NoHandlerForMessageException(String message) {
    super(message);
  }
}
