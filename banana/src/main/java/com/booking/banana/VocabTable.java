package com.booking.banana;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pre-agreed table of short strings that can be sent as a {@code VOCAB} token carrying their index.
 * <p>
 * Both sides of a connection must be configured with the same table; how they agree on it is not
 * the business of this library.
 */
public final class VocabTable {
  public static final VocabTable EMPTY = new VocabTable(Collections.<String>emptyList());

  private final String[] strings;
  private final Map<String, Integer> indexes;

  private VocabTable(List<String> strings) {
    this.strings = strings.toArray(new String[0]);
    this.indexes = new HashMap<>();
    for (int i = 0; i < this.strings.length; ++i) {
      if (this.strings[i] == null) {
        throw new IllegalArgumentException("Null vocabulary entry at index " + i);
      }
      if (indexes.put(this.strings[i], i) != null) {
        throw new IllegalArgumentException("Duplicate vocabulary entry '" + this.strings[i] + "'");
      }
    }
  }

  /** Create a table where each string is identified by its position. */
  public static VocabTable of(String... strings) {
    return new VocabTable(Arrays.asList(strings));
  }

  public static VocabTable of(List<String> strings) {
    return new VocabTable(strings);
  }

  /** Index of {@code string}, or {@code -1} if it is not in the table. */
  public int indexOf(String string) {
    Integer index = indexes.get(string);
    return index == null ? -1 : index;
  }

  /** String at {@code index}, or {@code null} if the index is out of range. */
  public String get(long index) {
    if (index < 0 || index >= strings.length) {
      return null;
    }
    return strings[(int) index];
  }

  public int size() {
    return strings.length;
  }
}
