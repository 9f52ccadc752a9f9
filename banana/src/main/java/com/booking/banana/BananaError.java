package com.booking.banana;

/**
 * A fundamental protocol violation: the two sides disagree on the wire format or the engine lost
 * track of the stream. The connection must be dropped and no further tokens are processed.
 */
@SuppressWarnings("serial")
public class BananaError extends BananaException {
  public BananaError(String msg) {
    super(msg);
  }

  public BananaError(String msg, Throwable cause) {
    super(msg, cause);
  }

  @Override
  public String toString() {
    if (where() != null) {
      return "BananaError (in " + where() + "): " + getMessage();
    }
    return "BananaError: " + getMessage();
  }
}
