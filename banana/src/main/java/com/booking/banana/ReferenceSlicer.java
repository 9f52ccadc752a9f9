package com.booking.banana;

import java.util.Arrays;

/**
 * Sends an object that was already sent as {@code ("reference",)} followed by the structure id it
 * was sent under.
 */
public class ReferenceSlicer extends BaseSlicer {
  private final int openId;

  public ReferenceSlicer(int openId) {
    this.openId = openId;
  }

  public int openId() {
    return openId;
  }

  @Override
  public SliceSequence slice(boolean streamable, BananaEncoder encoder) {
    return SliceSequence.of(Arrays.asList(BaseConstraint.REFERENCE, openId));
  }
}
