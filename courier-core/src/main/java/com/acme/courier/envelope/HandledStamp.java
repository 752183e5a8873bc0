package com.acme.courier.envelope;

import java.util.Objects;

/** Records that the named handler processed the message, along with what it returned. */
public record HandledStamp(String handlerName, Object result) implements Stamp {
  public HandledStamp {
    Objects.requireNonNull(handlerName, "handlerName");
  }
}
