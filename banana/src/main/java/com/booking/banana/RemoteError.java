package com.booking.banana;

/**
 * The peer sent an {@code ERROR} token: it hit a fatal condition and drops the connection.
 */
@SuppressWarnings("serial")
public class RemoteError extends BananaError {
  private final String remoteMessage;

  public RemoteError(String remoteMessage) {
    super("Remote error: " + remoteMessage);
    this.remoteMessage = remoteMessage;
  }

  /** Diagnostic sent by the peer. */
  public String remoteMessage() {
    return remoteMessage;
  }
}
