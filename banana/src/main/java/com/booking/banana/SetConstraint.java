package com.booking.banana;

/**
 * Accepts a {@code ("set",)} structure of at most {@code maxLength} elements, each accepted by
 * {@code element}.
 */
public class SetConstraint extends ListConstraint {
  public SetConstraint(Constraint element) {
    super(element);
  }

  public SetConstraint(Constraint element, int maxLength) {
    super(element, maxLength);
  }

  @Override
  protected String opentypeName() {
    return SetUnslicer.OPENTYPE;
  }

  @Override
  public String toString() {
    return "Set(" + element() + ", maxLength=" + maxLength() + ")";
  }
}
