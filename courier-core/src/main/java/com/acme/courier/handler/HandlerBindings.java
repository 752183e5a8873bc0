package com.acme.courier.handler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable snapshot mapping type keys to the handlers bound under them. A type key is a class or
 * interface binary name, or {@link #WILDCARD} for handlers that receive every message.
 *
 * <p>Bare handlers are wrapped in descriptors when they are bound, so resolution only ever sees
 * {@link HandlerDescriptor}s.
 */
public final class HandlerBindings {
  public static final String WILDCARD = "*";

  private static final HandlerBindings EMPTY = new HandlerBindings(Map.of());

  private final Map<String, List<HandlerDescriptor>> byType;

  private HandlerBindings(Map<String, List<HandlerDescriptor>> byType) {
    this.byType = byType;
  }

  public static HandlerBindings empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Descriptors bound under the key, in registration order */
  public List<HandlerDescriptor> forType(String typeKey) {
    return byType.getOrDefault(typeKey, List.of());
  }

  public Set<String> typeKeys() {
    return byType.keySet();
  }

  public boolean isEmpty() {
    return byType.isEmpty();
  }

  public static final class Builder {
    private static final Logger log = LoggerFactory.getLogger(HandlerBindings.class);

    private final Map<String, List<HandlerDescriptor>> byType = new LinkedHashMap<>();

    private Builder() {}

    public <T> Builder bind(Class<T> messageType, MessageHandler<? super T> handler) {
      return bind(keyOf(messageType), HandlerDescriptor.of(handler));
    }

    public Builder bind(Class<?> messageType, HandlerDescriptor descriptor) {
      return bind(keyOf(messageType), descriptor);
    }

    public Builder bind(String typeKey, MessageHandler<?> handler) {
      return bind(typeKey, HandlerDescriptor.of(handler));
    }

    public Builder bind(String typeKey, HandlerDescriptor descriptor) {
      if (typeKey == null || typeKey.isBlank()) {
        throw new InvalidHandlerBindingException("Type key must not be blank");
      }
      if (descriptor == null) {
        throw new InvalidHandlerBindingException("Handler descriptor for " + typeKey + " is null");
      }
      log.info("Registering handler {} for message type: {}", descriptor.getName(), typeKey);
      byType.computeIfAbsent(typeKey, k -> new ArrayList<>()).add(descriptor);
      return this;
    }

    /** Bind a handler that receives every message */
    public Builder bindAny(MessageHandler<?> handler) {
      return bind(WILDCARD, HandlerDescriptor.of(handler));
    }

    public Builder bindAny(HandlerDescriptor descriptor) {
      return bind(WILDCARD, descriptor);
    }

    public HandlerBindings build() {
      Map<String, List<HandlerDescriptor>> snapshot = new LinkedHashMap<>();
      byType.forEach((key, descriptors) -> snapshot.put(key, List.copyOf(descriptors)));
      return new HandlerBindings(Collections.unmodifiableMap(snapshot));
    }

    private static String keyOf(Class<?> messageType) {
      if (messageType == null) {
        throw new InvalidHandlerBindingException("Message type must not be null");
      }
      return messageType.getName();
    }
  }
}
