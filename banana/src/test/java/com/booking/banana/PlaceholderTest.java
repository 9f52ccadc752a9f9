package com.booking.banana;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;

import java.util.ArrayList;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class PlaceholderTest {
  @Rule
  public ExpectedException exceptionRule = ExpectedException.none();

  @Test
  public void callbacksRunOnResolve() {
    Placeholder placeholder = new Placeholder();
    List<Object> seen = new ArrayList<>();
    placeholder.whenResolved(seen::add, seen::add);
    placeholder.whenResolved(value -> seen.add("second " + value), seen::add);

    assertThat(seen.isEmpty(), equalTo(true));
    placeholder.resolve("value");

    assertThat(seen, contains((Object) "value", "second value"));
    assertThat(placeholder.value(), equalTo((Object) "value"));
  }

  @Test
  public void callbacksRunImmediatelyOnceResolved() {
    UnbananaFailure failure = new UnbananaFailure(new Violation("nope"), "<root>");
    Placeholder placeholder = Placeholder.failed(failure);
    List<Object> seen = new ArrayList<>();

    placeholder.whenResolved(seen::add, seen::add);

    assertThat(placeholder.isFailed(), equalTo(true));
    assertThat(seen.size(), equalTo(1));
    assertThat(seen.get(0), sameInstance((Object) failure));
  }

  @Test
  public void resolvedOnce() {
    Placeholder placeholder = new Placeholder();
    placeholder.resolve(1);

    exceptionRule.expect(IllegalStateException.class);
    exceptionRule.expectMessage("Placeholder already resolved");

    placeholder.fail(new UnbananaFailure(new Violation("late"), "<root>"));
  }

  @Test
  public void noValueWhilePending() {
    exceptionRule.expect(IllegalStateException.class);

    new Placeholder().value();
  }
}
