package com.acme.courier.handler;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the type keys probed for a message class: the class itself, its superclasses, every
 * interface it implements, then the wildcard.
 *
 * <p>Superclasses run from the direct parent upwards and stop before {@code Object}. Interfaces
 * are visited class by class in the same order, each class's interfaces in declaration order and
 * each interface followed depth-first by the interfaces it extends. A key appearing twice keeps
 * its first position.
 */
public final class MessageTypes {
  private static final ClassValue<List<String>> CACHE =
      new ClassValue<>() {
        @Override
        protected List<String> computeValue(Class<?> type) {
          return compute(type);
        }
      };

  private MessageTypes() {}

  public static List<String> of(Class<?> messageClass) {
    return CACHE.get(messageClass);
  }

  private static List<String> compute(Class<?> messageClass) {
    Set<String> keys = new LinkedHashSet<>();
    List<Class<?>> hierarchy = new ArrayList<>();

    for (Class<?> c = messageClass; c != null && c != Object.class; c = c.getSuperclass()) {
      keys.add(c.getName());
      hierarchy.add(c);
    }
    for (Class<?> c : hierarchy) {
      for (Class<?> iface : c.getInterfaces()) {
        addInterface(iface, keys);
      }
    }
    keys.add(HandlerBindings.WILDCARD);
    return List.copyOf(keys);
  }

  private static void addInterface(Class<?> iface, Set<String> keys) {
    if (!keys.add(iface.getName())) {
      return;
    }
    for (Class<?> parent : iface.getInterfaces()) {
      addInterface(parent, keys);
    }
  }
}
