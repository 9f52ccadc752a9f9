package com.booking.banana;

/**
 * Base class for failures raised while slicing or unslicing.
 * <p>
 * {@code where} records the position in the object graph at which the failure was noticed. The
 * first location assigned is kept: enclosing levels that see the failure on its way out do not
 * overwrite it.
 */
@SuppressWarnings("serial")
public abstract class BananaException extends Exception {
  private String where;

  protected BananaException(String msg) {
    super(msg);
  }

  protected BananaException(String msg, Throwable cause) {
    super(msg, cause);
  }

  /** Set the location, unless one was already set. */
  public void setLocation(String where) {
    if (this.where == null) {
      this.where = where;
    }
  }

  /** Object-graph path where the failure happened, {@code null} if unknown. */
  public String where() {
    return where;
  }
}
