package com.booking.banana;

import java.util.List;

/**
 * Accepts a {@code ("none",)} structure, the encoding of {@code null}.
 */
public class NoneConstraint extends BaseConstraint {
  public static final NoneConstraint INSTANCE = new NoneConstraint();

  @Override
  protected void checkValidToken(BananaToken type, long size) throws Violation {
    expectToken(type, BananaToken.OPEN);
  }

  @Override
  protected void checkOwnOpentype(List<Object> opentype) throws Violation {
    expectOpentype(opentype, NoneUnslicer.OPENTYPE);
  }

  @Override
  public String toString() {
    return "None";
  }
}
