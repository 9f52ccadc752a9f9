package com.booking.banana;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps classes to the {@link SlicerFactory} used to send their instances.
 * <p>
 * A factory registered for the exact class of an object wins; otherwise the first registration
 * whose class is a supertype of the object's class is used, in registration order.
 */
public class SlicerRegistry {
  private final Map<Class<?>, SlicerFactory> factories = new LinkedHashMap<>();

  /** An empty registry: only primitive values and {@code null} can be sent. */
  public SlicerRegistry() {
  }

  public SlicerRegistry(SlicerRegistry other) {
    factories.putAll(other.factories);
  }

  /** A registry with the built-in kinds: lists, tuples, dicts, sets and booleans. */
  public static SlicerRegistry defaults() {
    return new SlicerRegistry()
        .register(Boolean.class, object -> new BooleanSlicer((Boolean) object))
        .register(Object[].class, object -> new TupleSlicer((Object[]) object))
        .register(List.class, object -> new ListSlicer((List<?>) object))
        .register(Set.class, object -> new SetSlicer((Set<?>) object))
        .register(Map.class, object -> new DictSlicer((Map<?, ?>) object));
  }

  /** Register {@code factory} for {@code type}, replacing any previous registration. */
  public SlicerRegistry register(Class<?> type, SlicerFactory factory) {
    factories.put(type, factory);
    return this;
  }

  /**
   * Find the factory for {@code object}.
   *
   * @return the factory, or {@code null} if nothing is registered for its class
   */
  public SlicerFactory factoryFor(Object object) {
    Class<?> type = object.getClass();
    SlicerFactory factory = factories.get(type);
    if (factory != null) {
      return factory;
    }
    for (Map.Entry<Class<?>, SlicerFactory> entry : factories.entrySet()) {
      if (entry.getKey().isAssignableFrom(type)) {
        return entry.getValue();
      }
    }
    return null;
  }
}
