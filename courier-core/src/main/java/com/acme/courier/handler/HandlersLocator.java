package com.acme.courier.handler;

import com.acme.courier.envelope.Envelope;
import java.util.stream.Stream;

/** Maps an envelope to the handlers that should process its message. */
public interface HandlersLocator {
  /**
   * @return the eligible handlers in dispatch order; a lazy stream that can be consumed once
   */
  Stream<HandlerDescriptor> getHandlers(Envelope envelope);
}
