package com.acme.courier.handler;

import com.acme.courier.envelope.Envelope;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Resolves the handlers for a message by walking its type keys (see {@link MessageTypes}) over a
 * {@link HandlerBindings} snapshot. Each handler name is yielded at most once, at the position of
 * its first eligible binding.
 */
public class HandlerResolver implements HandlersLocator {
  private final HandlerBindings bindings;

  public HandlerResolver(HandlerBindings bindings) {
    this.bindings = bindings;
  }

  @Override
  public Stream<HandlerDescriptor> getHandlers(Envelope envelope) {
    return resolve(envelope, bindings);
  }

  public static Stream<HandlerDescriptor> resolve(Envelope envelope, HandlerBindings bindings) {
    // sequential only: the name filter is stateful
    Set<String> seen = new HashSet<>();
    return MessageTypes.of(envelope.messageClass()).stream()
        .flatMap(typeKey -> bindings.forType(typeKey).stream())
        .filter(descriptor -> shouldHandle(envelope, descriptor))
        .filter(descriptor -> seen.add(descriptor.getName()));
  }

  /**
   * A transport constraint only filters messages that were received from a transport; local
   * dispatch reaches every handler.
   */
  static boolean shouldHandle(Envelope envelope, HandlerDescriptor descriptor) {
    Optional<String> receivedFrom = envelope.receivedFrom();
    if (receivedFrom.isEmpty()) {
      return true;
    }
    return descriptor.getFromTransport().map(receivedFrom.get()::equals).orElse(true);
  }
}
