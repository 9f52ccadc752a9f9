package com.booking.banana;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Accepts a {@code ("tuple",)} structure with exactly one element per constraint, in order.
 */
public class TupleConstraint extends BaseConstraint {
  private final List<Constraint> elements;

  public TupleConstraint(Constraint... elements) {
    this.elements = Collections.unmodifiableList(Arrays.asList(elements.clone()));
  }

  public List<Constraint> elements() {
    return elements;
  }

  @Override
  protected void checkValidToken(BananaToken type, long size) throws Violation {
    expectToken(type, BananaToken.OPEN);
  }

  @Override
  protected void checkOwnOpentype(List<Object> opentype) throws Violation {
    expectOpentype(opentype, TupleUnslicer.OPENTYPE);
  }

  @Override
  public String toString() {
    return "Tuple" + elements;
  }
}
