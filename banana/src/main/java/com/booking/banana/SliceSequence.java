package com.booking.banana;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Lazy, pull-based sequence of items produced by a {@link Slicer}: first the index tokens of its
 * open type, then its body.
 * <p>
 * Each item is handled by {@link BananaEncoder} according to its type:
 * <ul>
 *   <li>{@code Byte}, {@code Short}, {@code Integer}, {@code Long}, {@code BigInteger},
 *   {@code Float}, {@code Double} and {@code String} are sent as a single value token</li>
 *   <li>a {@link java.util.concurrent.CompletionStage} suspends production until it completes, its
 *   value is then handled as the next item; only allowed if the slicer and all its ancestors are
 *   streamable</li>
 *   <li>anything else is handed to {@link Slicer#slicerForObject(Object)} and sliced as a child</li>
 * </ul>
 */
public interface SliceSequence {
  boolean hasNext();

  /**
   * Produce the next item.
   *
   * @throws Violation to stop slicing: the encoder emits {@code ABORT} in place of the rest of the
   *     body
   */
  Object next() throws Violation;

  /** A sequence over {@code opentype} followed by {@code body}. */
  static SliceSequence of(List<?> opentype, Iterator<?> body) {
    Iterator<?> index = opentype.iterator();
    return new SliceSequence() {
      @Override
      public boolean hasNext() {
        return index.hasNext() || body.hasNext();
      }

      @Override
      public Object next() {
        return index.hasNext() ? index.next() : body.next();
      }
    };
  }

  /** A sequence of index tokens only, for structures without body. */
  static SliceSequence of(List<?> opentype) {
    return of(opentype, Collections.emptyIterator());
  }
}
