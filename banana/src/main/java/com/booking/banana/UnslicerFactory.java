package com.booking.banana;

import java.util.List;

/**
 * Creates the {@link Unslicer} for an open type registered in an {@link UnslicerRegistry}.
 */
@FunctionalInterface
public interface UnslicerFactory {
  /**
   * @param opentype index tokens received so far, the first one is the registered name
   * @return the unslicer, or {@code null} if more index tokens are needed
   * @throws Violation if the open type is refused
   */
  Unslicer createUnslicer(List<Object> opentype) throws Violation;
}
