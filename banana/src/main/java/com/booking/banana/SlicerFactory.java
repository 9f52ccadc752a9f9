package com.booking.banana;

/**
 * Creates the {@link Slicer} for an object of a registered class.
 */
@FunctionalInterface
public interface SlicerFactory {
  /**
   * @throws Violation if this particular object must not be sent
   */
  Slicer createSlicer(Object object) throws Violation;
}
