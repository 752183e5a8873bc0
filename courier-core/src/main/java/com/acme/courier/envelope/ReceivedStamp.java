package com.acme.courier.envelope;

import java.util.Objects;

/** Added by a transport consumer when a message crosses a transport boundary. */
public record ReceivedStamp(String transportName) implements Stamp {
  public ReceivedStamp {
    Objects.requireNonNull(transportName, "transportName");
  }
}
