package com.booking.banana;

/**
 * A recoverable failure, handed to a parent {@link Unslicer} in place of the object a child could
 * not produce. The containing sub-tree is discarded, the connection survives.
 */
public final class UnbananaFailure {
  private final Violation violation;
  private final String where;

  public UnbananaFailure(Violation violation, String where) {
    this.violation = violation;
    this.where = where;
  }

  /** The violation that caused the failure. */
  public Violation violation() {
    return violation;
  }

  /** Object-graph path where the violation happened. */
  public String where() {
    return where;
  }

  public String getMessage() {
    return violation.getMessage();
  }

  @Override
  public String toString() {
    return "[UnbananaFailure in " + where + ": " + violation.getMessage() + "]";
  }
}
