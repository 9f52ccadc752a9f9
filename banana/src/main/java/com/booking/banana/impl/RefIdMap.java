package com.booking.banana.impl;

import java.util.Arrays;

/**
 * Open-addressing map from structure id to the object (or placeholder) received under that id.
 */
public class RefIdMap {
  public static final Object NOT_FOUND = new Object();

  private static final int NO_KEY = -1;
  private int[] keys;
  private Object[] values;
  private int size, maxLoad, modulus;

  public RefIdMap() {
    init(32);
  }

  private void init(int capacity) {
    keys = new int[capacity];
    values = new Object[capacity];
    Arrays.fill(keys, NO_KEY);
    modulus = capacity - 1;
    maxLoad = (int) (capacity * 0.80);
    size = 0;
  }

  public void clear() {
    Arrays.fill(keys, NO_KEY);
    Arrays.fill(values, null);
    size = 0;
  }

  public int size() {
    return size;
  }

  public final Object get(int key) {
    int slot = findSlot(key);

    return keys[slot] == NO_KEY ? NOT_FOUND : values[slot];
  }

  public final void put(int key, Object value) {
    if (key < 0) {
      throw new IllegalArgumentException("Negative structure id " + key);
    }
    int slot = findSlot(key);

    if (keys[slot] == key) {
      values[slot] = value;
      return;
    }

    if (size == maxLoad) {
      rehash();
      slot = findSlot(key);
    }
    keys[slot] = key;
    values[slot] = value;
    size++;
  }

  private void rehash() {
    int[] oldKeys = keys;
    Object[] oldValues = values;

    init(keys.length * 2);

    for (int i = 0, max = oldKeys.length; i < max; ++i) {
      if (oldKeys[i] != NO_KEY) {
        put(oldKeys[i], oldValues[i]);
      }
    }
  }

  private int findSlot(int key) {
    int slot = hash32Shift(key) & modulus;
    while (keys[slot] != NO_KEY && keys[slot] != key) {
      slot = (slot + 1) & modulus;
    }
    return slot;
  }

  // http://burtleburtle.net/bob/hash/integer.html
  // structure ids are dense, mix them before masking
  private int hash32Shift(int key) {
    key = ~key + (key << 15);
    key = key ^ (key >>> 12);
    key = key + (key << 2);
    key = key ^ (key >>> 4);
    key = key * 2057;
    key = key ^ (key >>> 16);
    return key;
  }
}
