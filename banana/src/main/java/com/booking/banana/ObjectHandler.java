package com.booking.banana;

/**
 * Receives the top-level objects decoded by {@link BananaDecoder}, in the order they were sent.
 * <p>
 * An object whose decoding is deferred (a tuple waiting for a reference, for example) is delivered
 * once it is complete, which may be after later objects.
 */
public interface ObjectHandler {
  void receivedObject(Object object);

  /** A top-level object was refused or aborted; the connection is still usable. */
  void receivedFailure(UnbananaFailure failure);
}
