package com.booking.banana;

/**
 * Accepts {@code STRING} tokens up to {@code maxLength} bytes, and {@code VOCAB} tokens.
 */
public class StringConstraint extends BaseConstraint {
  private final int maxLength;

  public StringConstraint() {
    this(BananaHeader.SIZE_LIMIT);
  }

  /** @param maxLength maximum length in UTF-8 bytes, {@code 0} for no limit */
  public StringConstraint(int maxLength) {
    this.maxLength = maxLength;
  }

  public int maxLength() {
    return maxLength;
  }

  @Override
  protected void checkValidToken(BananaToken type, long size) throws Violation {
    if (type == BananaToken.VOCAB) {
      return;
    }
    expectToken(type, BananaToken.STRING);
    checkLength(type, size, maxLength);
  }

  @Override
  public String toString() {
    return "String(maxLength=" + maxLength + ")";
  }
}
