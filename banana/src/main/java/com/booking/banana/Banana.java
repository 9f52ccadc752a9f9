package com.booking.banana;

import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Both directions of a Banana connection: a {@link BananaEncoder} writing to the transport and a
 * {@link BananaDecoder} reading from it.
 * <p>
 * When the received stream turns out to be corrupt, the peer is told why with an {@code ERROR}
 * token and both directions are torn down. A fatal error while sending tears down the receiving
 * side as well.
 */
public class Banana {
  private final BananaEncoder encoder;
  private final BananaDecoder decoder;

  public Banana(OutputStream out, ObjectHandler handler) {
    this(out, handler, new EncoderOptions(), new DecoderOptions());
  }

  public Banana(OutputStream out, ObjectHandler handler, EncoderOptions encoderOptions, DecoderOptions decoderOptions) {
    this.encoder = new BananaEncoder(out, encoderOptions);
    this.decoder = new BananaDecoder(handler, decoderOptions);
    encoder.whenDropped(decoder::connectionLost);
  }

  /** See {@link BananaEncoder#send(Object)}. */
  public CompletableFuture<Void> send(Object object) {
    return encoder.send(object);
  }

  /**
   * Process data received from the transport.
   *
   * @throws BananaError after tearing down the connection
   * @throws IllegalStateException if the connection was already dropped
   */
  public void dataReceived(byte[] data, int offset, int length) throws BananaError {
    try {
      decoder.dataReceived(data, offset, length);
    } catch (BananaError e) {
      if (e instanceof RemoteError) {
        encoder.connectionLost(e);
      } else {
        encoder.dropConnection(e);
      }
      throw e;
    }
  }

  public void dataReceived(byte[] data) throws BananaError {
    dataReceived(data, 0, data.length);
  }

  /** The transport lost the connection. */
  public void connectionLost(Throwable cause) {
    encoder.connectionLost(cause);
    decoder.connectionLost(cause);
  }

  public boolean isDropped() {
    return encoder.isDropped() || decoder.isDropped();
  }

  public BananaEncoder encoder() {
    return encoder;
  }

  public BananaDecoder decoder() {
    return decoder;
  }
}
