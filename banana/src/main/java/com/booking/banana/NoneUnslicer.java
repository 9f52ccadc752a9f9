package com.booking.banana;

/**
 * Receives the empty {@code ("none",)} structure as {@code null}.
 */
public class NoneUnslicer extends BaseUnslicer {
  public static final String OPENTYPE = "none";

  @Override
  public void checkToken(BananaToken type, long size) throws Violation {
    throw new Violation("None has no body, got " + type);
  }

  @Override
  public void receiveChild(Object child) throws Violation {
    propagateFailure(child);
    throw new Violation("None has no body");
  }

  @Override
  public Object receiveClose() {
    return null;
  }
}
