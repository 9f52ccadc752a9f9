package com.booking.banana;

import java.util.Arrays;

/**
 * Sends a {@link Boolean} as {@code ("boolean",)} and {@code INT} 0 or 1.
 */
public class BooleanSlicer extends BaseSlicer {
  private final boolean value;

  public BooleanSlicer(boolean value) {
    this.value = value;
  }

  @Override
  public SliceSequence slice(boolean streamable, BananaEncoder encoder) {
    return SliceSequence.of(Arrays.asList(BooleanUnslicer.OPENTYPE, value ? 1 : 0));
  }
}
