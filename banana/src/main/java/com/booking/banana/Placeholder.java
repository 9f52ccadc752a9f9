package com.booking.banana;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * An object that is not available yet.
 * <p>
 * Unslicers that can only build their object when the structure closes (tuples, for example)
 * register a placeholder under their structure id; references to that id, and parents receiving
 * the unfinished object, get the placeholder and register callbacks on it. The placeholder is
 * resolved exactly once, either with the object or with a failure.
 * <p>
 * Callbacks run synchronously, on the thread that resolves the placeholder.
 */
public final class Placeholder {
  private boolean resolved;
  private Object value;
  private UnbananaFailure failure;
  private List<Consumer<Object>> callbacks = new ArrayList<>();
  private List<Consumer<UnbananaFailure>> errbacks = new ArrayList<>();

  /** {@code true} once {@link #resolve(Object)} or {@link #fail(UnbananaFailure)} was called. */
  public boolean isResolved() {
    return resolved;
  }

  /** {@code true} if the placeholder was resolved with a failure. */
  public boolean isFailed() {
    return resolved && failure != null;
  }

  /**
   * The resolved object.
   *
   * @throws IllegalStateException if the placeholder is pending or failed
   */
  public Object value() {
    if (!resolved || failure != null) {
      throw new IllegalStateException("Placeholder has no value");
    }
    return value;
  }

  /** The failure, or {@code null} if the placeholder is pending or succeeded. */
  public UnbananaFailure failure() {
    return failure;
  }

  /**
   * Run {@code onValue} with the object, or {@code onFailure} with the failure, once the placeholder
   * is resolved. Runs immediately if it already is.
   */
  public void whenResolved(Consumer<Object> onValue, Consumer<UnbananaFailure> onFailure) {
    if (resolved) {
      if (failure == null) {
        onValue.accept(value);
      } else {
        onFailure.accept(failure);
      }
      return;
    }
    callbacks.add(onValue);
    errbacks.add(onFailure);
  }

  public void resolve(Object value) {
    if (value instanceof Placeholder) {
      throw new IllegalArgumentException("A placeholder can't be resolved with another placeholder");
    }
    markResolved();
    this.value = value;

    List<Consumer<Object>> pending = callbacks;
    clearCallbacks();
    for (Consumer<Object> callback : pending) {
      callback.accept(value);
    }
  }

  public void fail(UnbananaFailure failure) {
    markResolved();
    this.failure = failure;

    List<Consumer<UnbananaFailure>> pending = errbacks;
    clearCallbacks();
    for (Consumer<UnbananaFailure> errback : pending) {
      errback.accept(failure);
    }
  }

  /** Create a placeholder that is already failed. */
  public static Placeholder failed(UnbananaFailure failure) {
    Placeholder placeholder = new Placeholder();
    placeholder.fail(failure);
    return placeholder;
  }

  private void markResolved() {
    if (resolved) {
      throw new IllegalStateException("Placeholder already resolved");
    }
    resolved = true;
  }

  private void clearCallbacks() {
    callbacks = null;
    errbacks = null;
  }

  @Override
  public String toString() {
    if (!resolved) {
      return "Placeholder(pending)";
    }
    return failure == null ? "Placeholder(" + value + ")" : "Placeholder(" + failure + ")";
  }
}
