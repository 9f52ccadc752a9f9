package com.booking.banana.impl;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class RefIdMapTest {
  @Rule
  public ExpectedException exceptionRule = ExpectedException.none();

  @Test
  public void putAndGet() {
    RefIdMap map = new RefIdMap();
    Object value = new Object();

    map.put(0, value);
    map.put(7, null);

    assertThat(map.get(0), sameInstance(value));
    assertThat(map.get(7), equalTo(null));
    assertThat(map.get(1), sameInstance(RefIdMap.NOT_FOUND));
    assertThat(map.size(), equalTo(2));
  }

  @Test
  public void replace() {
    RefIdMap map = new RefIdMap();

    map.put(5, "first");
    map.put(5, "second");

    assertThat(map.get(5), equalTo("second"));
    assertThat(map.size(), equalTo(1));
  }

  @Test
  public void growsPastInitialCapacity() {
    RefIdMap map = new RefIdMap();
    for (int i = 0; i < 1000; ++i) {
      map.put(i, i);
    }

    assertThat(map.size(), equalTo(1000));
    for (int i = 0; i < 1000; ++i) {
      assertThat(map.get(i), equalTo(i));
    }
  }

  @Test
  public void negativeKey() {
    exceptionRule.expect(IllegalArgumentException.class);
    exceptionRule.expectMessage("Negative structure id -1");

    new RefIdMap().put(-1, "x");
  }
}
