package com.acme.courier.envelope;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A message together with the stamps collected while it moves through the bus. Envelopes are
 * immutable: {@link #with(Stamp...)} returns a copy.
 */
public record Envelope(Object message, List<Stamp> stamps) {

  public Envelope {
    Objects.requireNonNull(message, "message");
    stamps = List.copyOf(stamps);
  }

  public static Envelope wrap(Object message, Stamp... stamps) {
    if (message instanceof Envelope envelope) {
      return envelope.with(stamps);
    }
    return new Envelope(message, Arrays.asList(stamps));
  }

  public Envelope with(Stamp... added) {
    if (added.length == 0) {
      return this;
    }
    List<Stamp> all = new ArrayList<>(stamps);
    all.addAll(Arrays.asList(added));
    return new Envelope(message, all);
  }

  /** Most recently added stamp of the given type */
  public <T extends Stamp> Optional<T> last(Class<T> type) {
    for (int i = stamps.size() - 1; i >= 0; i--) {
      Stamp stamp = stamps.get(i);
      if (type.isInstance(stamp)) {
        return Optional.of(type.cast(stamp));
      }
    }
    return Optional.empty();
  }

  public <T extends Stamp> List<T> all(Class<T> type) {
    return stamps.stream().filter(type::isInstance).map(type::cast).toList();
  }

  /**
   * Transport the message was last received from. Empty for messages dispatched locally.
   */
  public Optional<String> receivedFrom() {
    return last(ReceivedStamp.class).map(ReceivedStamp::transportName);
  }

  public Class<?> messageClass() {
    return message.getClass();
  }
}
