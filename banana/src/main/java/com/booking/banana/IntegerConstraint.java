package com.booking.banana;

/**
 * Accepts {@code INT} and {@code NEG} tokens, and {@code LONGINT}/{@code LONGNEG} tokens when
 * {@code maxBytes} allows it.
 */
public class IntegerConstraint extends BaseConstraint {
  private final int maxBytes;

  public IntegerConstraint() {
    this(-1);
  }

  /**
   * @param maxBytes maximum body length of {@code LONGINT}/{@code LONGNEG} tokens; {@code -1} refuses
   *     them, {@code 0} accepts them with no limit
   */
  public IntegerConstraint(int maxBytes) {
    this.maxBytes = maxBytes;
  }

  public int maxBytes() {
    return maxBytes;
  }

  @Override
  protected void checkValidToken(BananaToken type, long size) throws Violation {
    switch (type) {
      case INT:
      case NEG:
        return;
      case LONGINT:
      case LONGNEG:
        if (maxBytes < 0) {
          throw new Violation(this + " does not accept " + type + " tokens");
        }
        checkLength(type, size, maxBytes);
        return;
      default:
        throw new Violation(this + " expects an integer, got " + type);
    }
  }

  @Override
  public String toString() {
    return "Integer(maxBytes=" + maxBytes + ")";
  }
}
