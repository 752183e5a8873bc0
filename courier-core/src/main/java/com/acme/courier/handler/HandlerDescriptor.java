package com.acme.courier.handler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wraps a {@link MessageHandler} with the identity used for de-duplication and the options that
 * decide whether it runs for a given envelope.
 *
 * <p>Descriptors are compared by {@link #getName()} during resolution, never by object identity:
 * two descriptors sharing a name are the same handler as far as the bus is concerned.
 */
public final class HandlerDescriptor {
  public static final String FROM_TRANSPORT = "from_transport";

  private static final AtomicLong SEQUENCE = new AtomicLong();
  private static final Map<Object, Long> INSTANCE_IDS =
      Collections.synchronizedMap(new WeakHashMap<>());

  private final MessageHandler<Object> handler;
  private final String name;
  private final Map<String, String> options;

  private HandlerDescriptor(Builder builder) {
    this.handler = builder.handler;
    this.name = builder.name != null ? builder.name : deriveName(builder.handler);
    this.options = Map.copyOf(builder.options);
  }

  /** Descriptor for a bare handler, named after its class */
  public static HandlerDescriptor of(MessageHandler<?> handler) {
    return builder(handler).build();
  }

  public static Builder builder(MessageHandler<?> handler) {
    if (handler == null) {
      throw new InvalidHandlerBindingException("Handler must not be null");
    }
    return new Builder(handler);
  }

  public Object invoke(Object message) throws Exception {
    return handler.handle(message);
  }

  public MessageHandler<Object> getHandler() {
    return handler;
  }

  public String getName() {
    return name;
  }

  /** Transport a received message must come from for this handler to run */
  public Optional<String> getFromTransport() {
    return getOption(FROM_TRANSPORT);
  }

  public Optional<String> getOption(String key) {
    return Optional.ofNullable(options.get(key));
  }

  public Map<String, String> getOptions() {
    return options;
  }

  /**
   * Named handler classes map to {@code ClassName::handle}. Lambdas and anonymous classes get a
   * per-instance sequence number appended, since every instance of a lambda class shares the class
   * name.
   */
  static String deriveName(Object handler) {
    Class<?> type = handler.getClass();
    if (type.isSynthetic() || type.isHidden() || type.isAnonymousClass()) {
      long id = INSTANCE_IDS.computeIfAbsent(handler, h -> SEQUENCE.incrementAndGet());
      return type.getName() + "@" + id;
    }
    return type.getName() + "::handle";
  }

  @Override
  public String toString() {
    return "HandlerDescriptor{name=" + name + ", options=" + options + "}";
  }

  public static final class Builder {
    private final MessageHandler<Object> handler;
    private final Map<String, String> options = new LinkedHashMap<>();
    private String name;

    @SuppressWarnings("unchecked")
    private Builder(MessageHandler<?> handler) {
      this.handler = (MessageHandler<Object>) handler;
    }

    public Builder name(String name) {
      if (name == null || name.isBlank()) {
        throw new InvalidHandlerBindingException("Handler name must not be blank");
      }
      this.name = name;
      return this;
    }

    /** Restrict the handler to messages received from the given transport */
    public Builder fromTransport(String transportName) {
      return option(FROM_TRANSPORT, transportName);
    }

    public Builder option(String key, String value) {
      Objects.requireNonNull(key, "key");
      if (value == null) {
        options.remove(key);
      } else {
        options.put(key, value);
      }
      return this;
    }

    public HandlerDescriptor build() {
      return new HandlerDescriptor(this);
    }
  }
}
