package com.booking.banana;

import java.util.List;

/**
 * Accepts a {@code ("list",)} structure of at most {@code maxLength} elements, each accepted by
 * {@code element}.
 */
public class ListConstraint extends BaseConstraint {
  public static final int DEFAULT_MAX_LENGTH = 30;

  private final Constraint element;
  private final int maxLength;

  public ListConstraint(Constraint element) {
    this(element, DEFAULT_MAX_LENGTH);
  }

  /** @param maxLength maximum number of elements, {@code 0} for no limit */
  public ListConstraint(Constraint element, int maxLength) {
    this.element = element;
    this.maxLength = maxLength;
  }

  public Constraint element() {
    return element;
  }

  public int maxLength() {
    return maxLength;
  }

  @Override
  protected void checkValidToken(BananaToken type, long size) throws Violation {
    expectToken(type, BananaToken.OPEN);
  }

  @Override
  protected void checkOwnOpentype(List<Object> opentype) throws Violation {
    expectOpentype(opentype, opentypeName());
  }

  protected String opentypeName() {
    return ListUnslicer.OPENTYPE;
  }

  @Override
  public String toString() {
    return "List(" + element + ", maxLength=" + maxLength + ")";
  }
}
