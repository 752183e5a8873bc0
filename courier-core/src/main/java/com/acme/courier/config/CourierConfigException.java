package com.acme.courier.config;

import com.acme.courier.core.CourierException;

public class CourierConfigException extends CourierException {
  public CourierConfigException(String message) {
    super(message);
  }

  public CourierConfigException(String message, Throwable e) {
    super(message, e);
  }
}
