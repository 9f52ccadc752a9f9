package com.booking.banana;

/**
 * Receives {@code ("boolean",)} followed by {@code INT} 0 or 1.
 */
public class BooleanUnslicer extends BaseUnslicer {
  public static final String OPENTYPE = "boolean";

  private Boolean value;

  @Override
  public void checkToken(BananaToken type, long size) throws Violation {
    if (value != null) {
      throw new Violation("Boolean takes a single value");
    }
    if (type != BananaToken.INT || size > 1) {
      throw new Violation("Boolean expects INT 0 or 1, got " + type + " " + size);
    }
  }

  @Override
  public void receiveChild(Object child) throws Violation {
    propagateFailure(child);
    value = ((Long) child) != 0;
  }

  @Override
  public Object receiveClose() throws Violation {
    if (value == null) {
      throw new Violation("Boolean closed without a value");
    }
    return value;
  }
}
