package com.booking.banana;

import java.util.Collections;

/**
 * Sends {@code null} as an empty {@code ("none",)} structure.
 */
public class NoneSlicer extends BaseSlicer {
  @Override
  public SliceSequence slice(boolean streamable, BananaEncoder encoder) {
    return SliceSequence.of(Collections.singletonList(NoneUnslicer.OPENTYPE));
  }
}
