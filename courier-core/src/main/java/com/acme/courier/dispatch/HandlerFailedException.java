package com.acme.courier.dispatch;

import com.acme.courier.core.CourierException;
import com.acme.courier.envelope.Envelope;
import java.util.List;

/**
 * Thrown after every resolved handler had its turn and at least one of them failed. The envelope
 * carries a {@link com.acme.courier.envelope.HandledStamp} for each handler that succeeded, so a
 * retry can skip them.
 */
public class HandlerFailedException extends CourierException {
  private final transient Envelope envelope;
  private final List<Throwable> nestedExceptions;

  public HandlerFailedException(Envelope envelope, List<Throwable> nestedExceptions) {
    super(buildMessage(envelope, nestedExceptions), nestedExceptions.get(0));
    this.envelope = envelope;
    this.nestedExceptions = List.copyOf(nestedExceptions);
  }

  public Envelope getEnvelope() {
    return envelope;
  }

  public List<Throwable> getNestedExceptions() {
    return nestedExceptions;
  }

  private static String buildMessage(Envelope envelope, List<Throwable> nested) {
    String first = nested.get(0).getMessage();
    return nested.size() == 1
        ? String.format("Handling \"%s\" failed: %s", envelope.messageClass().getName(), first)
        : String.format(
            "Handling \"%s\" failed: %d handlers failed. First one failed with message: %s",
            envelope.messageClass().getName(), nested.size(), first);
  }
}
