package com.booking.banana;

import java.util.Collections;
import java.util.Set;

/**
 * Sends a {@link Set} as {@code ("set",)} followed by its elements, in iteration order.
 */
public class SetSlicer extends BaseSlicer {
  private final Set<?> set;

  public SetSlicer(Set<?> set) {
    this.set = set;
  }

  @Override
  public boolean trackReferences() {
    return true;
  }

  @Override
  public SliceSequence slice(boolean streamable, BananaEncoder encoder) {
    return SliceSequence.of(Collections.singletonList(SetUnslicer.OPENTYPE), set.iterator());
  }

  @Override
  public String describe() {
    return "<set>";
  }
}
