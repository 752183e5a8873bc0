package com.acme.courier.handler;

/** Message hierarchy shared by the handler and dispatch tests */
public final class TestMessages {
  private TestMessages() {}

  public interface Auditable {}

  public interface Notification extends Auditable {}

  public interface Priority {}

  public static class BaseEvent {}

  public static class OrderEvent extends BaseEvent implements Notification {}

  public static class OrderPlaced extends OrderEvent implements Auditable, Priority {
    private final String orderId;

    public OrderPlaced(String orderId) {
      this.orderId = orderId;
    }

    public String getOrderId() {
      return orderId;
    }
  }

  public record PingMessage(String text) {}

  /** A named handler class, so its descriptor name is stable across instances */
  public static class RecordingHandler implements MessageHandler<Object> {
    @Override
    public Object handle(Object message) {
      return "recorded:" + message.getClass().getSimpleName();
    }
  }
}
