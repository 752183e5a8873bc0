package com.acme.courier.handler;

import com.acme.courier.core.CourierException;

/** Raised while building handler bindings, never during resolution. */
public class InvalidHandlerBindingException extends CourierException {
  public InvalidHandlerBindingException(String message) {
    super(message);
  }

  public InvalidHandlerBindingException(String message, Throwable e) {
    super(message, e);
  }
}
