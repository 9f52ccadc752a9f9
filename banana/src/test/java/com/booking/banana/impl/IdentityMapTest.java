package com.booking.banana.impl;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class IdentityMapTest {
  @Test
  public void comparesByIdentity() {
    IdentityMap map = new IdentityMap();
    String first = new String("same");
    String second = new String("same");

    map.put(first, 1);

    assertThat(map.get(first), equalTo(1));
    assertThat(map.get(second), equalTo(IdentityMap.NOT_FOUND));
  }

  @Test
  public void putReturnsPrevious() {
    IdentityMap map = new IdentityMap();
    Object key = new Object();

    assertThat(map.put(key, 3), equalTo(IdentityMap.NOT_FOUND));
    assertThat(map.put(key, 4), equalTo(3));
    assertThat(map.get(key), equalTo(4));
    assertThat(map.size(), equalTo(1));
  }

  @Test
  public void growsPastInitialCapacity() {
    IdentityMap map = new IdentityMap();
    List<Object> keys = new ArrayList<>();
    for (int i = 0; i < 1000; ++i) {
      Object key = new Object();
      keys.add(key);
      map.put(key, i);
    }

    assertThat(map.size(), equalTo(1000));
    for (int i = 0; i < 1000; ++i) {
      assertThat(map.get(keys.get(i)), equalTo(i));
    }
  }

  @Test
  public void clear() {
    IdentityMap map = new IdentityMap();
    Object key = new Object();
    map.put(key, 0);

    map.clear();

    assertThat(map.size(), equalTo(0));
    assertThat(map.get(key), equalTo(IdentityMap.NOT_FOUND));
  }
}
