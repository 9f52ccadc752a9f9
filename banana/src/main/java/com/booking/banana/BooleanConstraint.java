package com.booking.banana;

import java.util.List;

/**
 * Accepts a {@code ("boolean",)} structure.
 */
public class BooleanConstraint extends BaseConstraint {
  public static final BooleanConstraint INSTANCE = new BooleanConstraint();

  @Override
  protected void checkValidToken(BananaToken type, long size) throws Violation {
    expectToken(type, BananaToken.OPEN);
  }

  @Override
  protected void checkOwnOpentype(List<Object> opentype) throws Violation {
    expectOpentype(opentype, BooleanUnslicer.OPENTYPE);
  }

  @Override
  public String toString() {
    return "Boolean";
  }
}
