package com.booking.banana;

import java.util.Iterator;
import java.util.Map;

/**
 * Sends a {@link Map} as {@code ("dict",)} followed by alternating keys and values.
 */
public class DictSlicer extends BaseSlicer {
  private final Map<?, ?> map;
  private Map.Entry<?, ?> current;

  public DictSlicer(Map<?, ?> map) {
    this.map = map;
  }

  @Override
  public boolean trackReferences() {
    return true;
  }

  @Override
  public SliceSequence slice(boolean streamable, BananaEncoder encoder) {
    Iterator<? extends Map.Entry<?, ?>> entries = map.entrySet().iterator();
    return new SliceSequence() {
      private boolean opentypeSent;
      private boolean keySent;

      @Override
      public boolean hasNext() {
        return !opentypeSent || keySent || entries.hasNext();
      }

      @Override
      public Object next() {
        if (!opentypeSent) {
          opentypeSent = true;
          return DictUnslicer.OPENTYPE;
        }
        if (keySent) {
          keySent = false;
          return current.getValue();
        }
        current = entries.next();
        keySent = true;
        return current.getKey();
      }
    };
  }

  @Override
  public String describe() {
    return current == null ? "{}" : "{" + current.getKey() + "}";
  }
}
