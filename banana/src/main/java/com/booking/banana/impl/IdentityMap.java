package com.booking.banana.impl;

import java.util.Arrays;

/**
 * Open-addressing map from object identity to structure id.
 * <p>
 * Keys are compared with {@code ==}, never with {@code equals()}: two equal but distinct lists
 * are two different structures on the wire.
 */
public class IdentityMap {
  public static final int NOT_FOUND = -1;

  private static final Object NO_KEY = new Object();
  private Object[] keys;
  private int[] values;
  private int size, maxLoad, modulus;

  public IdentityMap() {
    init(32);
  }

  private void init(int capacity) {
    keys = new Object[capacity];
    values = new int[capacity];
    Arrays.fill(keys, NO_KEY);
    modulus = capacity - 1;
    maxLoad = (int) (capacity * 0.80);
    size = 0;
  }

  public void clear() {
    Arrays.fill(keys, NO_KEY);
    Arrays.fill(values, 0);
    size = 0;
  }

  public int size() {
    return size;
  }

  public final int get(Object key) {
    int slot = findSlot(key);

    return keys[slot] == NO_KEY ? NOT_FOUND : values[slot];
  }

  /**
   * Associate {@code key} with {@code value}.
   *
   * @return the previous value, or {@link #NOT_FOUND}
   */
  public final int put(Object key, int value) {
    int slot = findSlot(key);

    if (keys[slot] == key) {
      int previous = values[slot];
      values[slot] = value;
      return previous;
    }

    if (size == maxLoad) {
      rehash();
      slot = findSlot(key);
    }
    keys[slot] = key;
    values[slot] = value;
    size++;
    return NOT_FOUND;
  }

  private void rehash() {
    Object[] oldKeys = keys;
    int[] oldValues = values;

    init(keys.length * 2);

    for (int i = 0, max = oldKeys.length; i < max; ++i) {
      if (oldKeys[i] != NO_KEY) {
        put(oldKeys[i], oldValues[i]);
      }
    }
  }

  private int findSlot(Object key) {
    int slot = System.identityHashCode(key) & modulus;
    while (keys[slot] != NO_KEY && keys[slot] != key) {
      slot = (slot + 1) & modulus;
    }
    return slot;
  }
}
