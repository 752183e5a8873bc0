package com.acme.courier.config;

import com.acme.courier.core.CourierException;
import com.acme.courier.core.Jsons;
import com.acme.courier.dispatch.MessageDispatcher;
import com.acme.courier.handler.HandlerBindings;
import com.acme.courier.handler.HandlerDescriptor;
import com.acme.courier.handler.HandlerResolver;
import com.acme.courier.handler.InvalidHandlerBindingException;
import com.acme.courier.handler.MessageHandler;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads {@link CourierConfig} from JSON and turns it into handler bindings. Handler references in
 * the configuration are keys into a catalog of handler instances supplied by the caller.
 */
@Slf4j
public final class CourierConfigLoader {

  private CourierConfigLoader() {}

  public static CourierConfig load(String json) {
    try {
      return Jsons.fromJson(json, CourierConfig.class);
    } catch (CourierException e) {
      throw new CourierConfigException("Invalid courier configuration", e.getCause());
    }
  }

  public static CourierConfig load(InputStream in) {
    try {
      return Jsons.fromJson(in, CourierConfig.class);
    } catch (CourierException e) {
      throw new CourierConfigException("Invalid courier configuration", e.getCause());
    }
  }

  /** Load from a classpath resource */
  public static CourierConfig loadResource(String resource) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new CourierConfigException("Configuration resource not found: " + resource);
      }
      log.info("Loading courier configuration from {}", resource);
      return load(in);
    } catch (IOException e) {
      throw new CourierConfigException("Cannot read configuration resource: " + resource, e);
    }
  }

  /**
   * @throws InvalidHandlerBindingException if a binding references a handler missing from the
   *     catalog or has no handler reference at all
   */
  public static HandlerBindings toBindings(
      CourierConfig config, Map<String, ? extends MessageHandler<?>> catalog) {
    HandlerBindings.Builder builder = HandlerBindings.builder();

    for (Map.Entry<String, List<CourierConfig.HandlerBinding>> entry :
        config.getHandlers().entrySet()) {
      String typeKey = entry.getKey();
      for (CourierConfig.HandlerBinding binding : entry.getValue()) {
        builder.bind(typeKey, toDescriptor(typeKey, binding, catalog));
      }
    }
    return builder.build();
  }

  public static MessageDispatcher createDispatcher(
      CourierConfig config, Map<String, ? extends MessageHandler<?>> catalog) {
    HandlerResolver resolver = new HandlerResolver(toBindings(config, catalog));
    return new MessageDispatcher(resolver, config.isAllowNoHandlers());
  }

  private static HandlerDescriptor toDescriptor(
      String typeKey,
      CourierConfig.HandlerBinding binding,
      Map<String, ? extends MessageHandler<?>> catalog) {
    String reference = binding.getHandler();
    if (reference == null || reference.isBlank()) {
      throw new InvalidHandlerBindingException(
          "Binding for message type " + typeKey + " has no handler reference");
    }
    MessageHandler<?> handler = catalog.get(reference);
    if (handler == null) {
      String error =
          String.format(
              "Unknown handler \"%s\" bound to message type %s. Known handlers: %s",
              reference, typeKey, catalog.keySet());
      log.error(error);
      throw new InvalidHandlerBindingException(error);
    }

    HandlerDescriptor.Builder descriptor =
        HandlerDescriptor.builder(handler)
            .name(binding.getName() != null ? binding.getName() : reference);
    if (binding.getFromTransport() != null) {
      descriptor.fromTransport(binding.getFromTransport());
    }
    return descriptor.build();
  }
}
