package com.acme.courier.dispatch;

import com.acme.courier.envelope.Envelope;
import com.acme.courier.envelope.HandledStamp;
import com.acme.courier.handler.HandlerDescriptor;
import com.acme.courier.handler.HandlersLocator;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Invokes every handler the locator resolves for a message and stamps the envelope with each
 * result. A failing handler does not stop the others; failures are reported together once all
 * handlers ran.
 */
@Slf4j
@RequiredArgsConstructor
public class MessageDispatcher {
  private final HandlersLocator handlersLocator;
  private final boolean allowNoHandlers;

  public MessageDispatcher(HandlersLocator handlersLocator) {
    this(handlersLocator, false);
  }

  public Envelope dispatch(Object message) {
    return dispatch(Envelope.wrap(message));
  }

  /**
   * @throws NoHandlerForMessageException if nothing handles the message and that is not allowed
   * @throws HandlerFailedException if at least one handler threw
   */
  public Envelope dispatch(Envelope envelope) {
    String messageType = envelope.messageClass().getName();
    log.info("Dispatching message: {}", messageType);

    Envelope current = envelope;
    List<Throwable> failures = new ArrayList<>();
    boolean handlerFound = false;

    Iterator<HandlerDescriptor> handlers = handlersLocator.getHandlers(envelope).iterator();
    while (handlers.hasNext()) {
      HandlerDescriptor descriptor = handlers.next();
      handlerFound = true;

      if (alreadyHandled(current, descriptor)) {
        log.debug("Skipping handler {} - already handled {}", descriptor.getName(), messageType);
        continue;
      }

      try {
        Object result = descriptor.invoke(current.message());
        current = current.with(new HandledStamp(descriptor.getName(), result));
        log.debug("Message {} handled by {}", messageType, descriptor.getName());
      } catch (Exception e) {
        log.error("Error handling message: {} handler={}", messageType, descriptor.getName(), e);
        failures.add(e);
      }
    }

    if (!handlerFound && !allowNoHandlers) {
      String error = "No handler for message: " + messageType;
      log.error(error);
      throw new NoHandlerForMessageException(error);
    }
    if (!failures.isEmpty()) {
      throw new HandlerFailedException(current, failures);
    }
    return current;
  }

  private static boolean alreadyHandled(Envelope envelope, HandlerDescriptor descriptor) {
    return envelope.all(HandledStamp.class).stream()
        .anyMatch(stamp -> stamp.handlerName().equals(descriptor.getName()));
  }
}
