package com.booking.banana;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Sends an {@code Object[]} as {@code ("tuple",)} followed by its elements.
 */
public class TupleSlicer extends BaseSlicer {
  private static final List<String> OPENTYPE = Collections.singletonList(TupleUnslicer.OPENTYPE);

  private final Object[] elements;
  private int index = -1;

  public TupleSlicer(Object[] elements) {
    this.elements = elements;
  }

  @Override
  public boolean trackReferences() {
    return true;
  }

  @Override
  public boolean streamable() {
    return true;
  }

  @Override
  public SliceSequence slice(boolean streamable, BananaEncoder encoder) {
    List<Object> body = Arrays.asList(elements);
    return new SliceSequence() {
      private boolean opentypeSent;

      @Override
      public boolean hasNext() {
        return !opentypeSent || index + 1 < body.size();
      }

      @Override
      public Object next() {
        if (!opentypeSent) {
          opentypeSent = true;
          return OPENTYPE.get(0);
        }
        return body.get(++index);
      }
    };
  }

  @Override
  public String describe() {
    return "[" + index + "]";
  }
}
