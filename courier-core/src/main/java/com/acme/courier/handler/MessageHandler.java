package com.acme.courier.handler;

/**
 * A handler for messages of type {@code T}. The returned value, possibly {@code null}, is recorded
 * on the envelope as the handler's result.
 */
@FunctionalInterface
public interface MessageHandler<T> {
  Object handle(T message) throws Exception;
}
