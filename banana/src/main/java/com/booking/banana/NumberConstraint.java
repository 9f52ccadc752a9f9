package com.booking.banana;

/**
 * Accepts integers, like {@link IntegerConstraint}, and {@code FLOAT} tokens.
 */
public class NumberConstraint extends IntegerConstraint {
  public NumberConstraint() {
    super();
  }

  public NumberConstraint(int maxBytes) {
    super(maxBytes);
  }

  @Override
  protected void checkValidToken(BananaToken type, long size) throws Violation {
    if (type == BananaToken.FLOAT) {
      return;
    }
    super.checkValidToken(type, size);
  }

  @Override
  public String toString() {
    return "Number(maxBytes=" + maxBytes() + ")";
  }
}
