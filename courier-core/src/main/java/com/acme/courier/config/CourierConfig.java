package com.acme.courier.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bus configuration: which handlers are bound to which message types, and whether a message
 * without handlers is an error. Pure POJO - populated from JSON by {@link CourierConfigLoader}.
 */
public class CourierConfig {

  private boolean allowNoHandlers = false;
  private Map<String, List<HandlerBinding>> handlers = new LinkedHashMap<>();

  public boolean isAllowNoHandlers() {
    return allowNoHandlers;
  }

  public void setAllowNoHandlers(boolean allowNoHandlers) {
    this.allowNoHandlers = allowNoHandlers;
  }

  /** Bindings per type key, both levels in declaration order */
  public Map<String, List<HandlerBinding>> getHandlers() {
    return handlers;
  }

  public void setHandlers(Map<String, List<HandlerBinding>> handlers) {
    this.handlers = handlers != null ? new LinkedHashMap<>(handlers) : new LinkedHashMap<>();
  }

  public CourierConfig bind(String typeKey, HandlerBinding binding) {
    handlers.computeIfAbsent(typeKey, k -> new ArrayList<>()).add(binding);
    return this;
  }

  public static class HandlerBinding {
    private String handler;
    private String name;
    private String fromTransport;

    public HandlerBinding() {}

    public HandlerBinding(String handler) {
      this.handler = handler;
    }

    /** Key of the handler in the catalog passed to the loader */
    public String getHandler() {
      return handler;
    }

    public void setHandler(String handler) {
      this.handler = handler;
    }

    /** Descriptor name; defaults to the catalog key */
    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getFromTransport() {
      return fromTransport;
    }

    public void setFromTransport(String fromTransport) {
      this.fromTransport = fromTransport;
    }
  }
}
