package com.booking.banana;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Sends a {@link List} as {@code ("list",)} followed by its elements, in order.
 * <p>
 * Elements may be {@link java.util.concurrent.CompletionStage}s when streaming is allowed.
 */
public class ListSlicer extends BaseSlicer {
  private static final List<String> OPENTYPE = Collections.singletonList(ListUnslicer.OPENTYPE);

  private final List<?> list;
  private int index = -1;

  public ListSlicer(List<?> list) {
    this.list = list;
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
    Iterator<?> elements = list.iterator();
    return SliceSequence.of(OPENTYPE, new Iterator<Object>() {
      @Override
      public boolean hasNext() {
        return elements.hasNext();
      }

      @Override
      public Object next() {
        index++;
        return elements.next();
      }
    });
  }

  @Override
  public String describe() {
    return "[" + index + "]";
  }
}
