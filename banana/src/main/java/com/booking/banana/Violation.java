package com.booking.banana;

/**
 * A schema or policy violation.
 * <p>
 * On the receiving side the current {@link Unslicer} is abandoned, all its remaining tokens are
 * dropped and its parent gets an {@link UnbananaFailure} through {@link Unslicer#receiveChild(Object)}.
 * On the sending side slicing of the current object stops and an {@code ABORT} token is emitted.
 * <p>
 * A parent that wants to propagate a failure it received from a child should throw
 * {@code new Violation(failure)}, which makes the decoder reuse the original failure instead of
 * wrapping it once per level.
 */
@SuppressWarnings("serial")
public class Violation extends BananaException {
  private final UnbananaFailure failure;

  public Violation(String msg) {
    super(msg);
    this.failure = null;
  }

  public Violation(UnbananaFailure failure) {
    super(failure.getMessage());
    this.failure = failure;
    setLocation(failure.where());
  }

  /** The failure being propagated, or {@code null} if this violation is new. */
  public UnbananaFailure failure() {
    return failure;
  }

  @Override
  public String toString() {
    if (where() != null) {
      return "Violation (at " + where() + "): " + getMessage();
    }
    return "Violation: " + getMessage();
  }
}
