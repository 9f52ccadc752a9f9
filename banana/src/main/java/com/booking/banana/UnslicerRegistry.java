package com.booking.banana;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps the first index token of an open type to the {@link UnslicerFactory} for it.
 */
public class UnslicerRegistry {
  private final Map<String, UnslicerFactory> factories = new HashMap<>();

  /** An empty registry: only primitive values can be received. */
  public UnslicerRegistry() {
  }

  public UnslicerRegistry(UnslicerRegistry other) {
    factories.putAll(other.factories);
  }

  /** A registry with the built-in kinds. */
  public static UnslicerRegistry defaults() {
    return new UnslicerRegistry()
        .register(ListUnslicer.OPENTYPE, opentype -> new ListUnslicer())
        .register(TupleUnslicer.OPENTYPE, opentype -> new TupleUnslicer())
        .register(DictUnslicer.OPENTYPE, opentype -> new DictUnslicer())
        .register(SetUnslicer.OPENTYPE, opentype -> new SetUnslicer())
        .register(BooleanUnslicer.OPENTYPE, opentype -> new BooleanUnslicer())
        .register(NoneUnslicer.OPENTYPE, opentype -> new NoneUnslicer())
        .register(BaseConstraint.REFERENCE, opentype -> new ReferenceUnslicer());
  }

  public UnslicerRegistry register(String name, UnslicerFactory factory) {
    factories.put(name, factory);
    return this;
  }

  /** The factory for {@code name}, or {@code null}. */
  public UnslicerFactory factoryFor(String name) {
    return factories.get(name);
  }
}
