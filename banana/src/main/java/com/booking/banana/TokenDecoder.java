package com.booking.banana;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A low-level, incremental token reader for Banana.
 * <p>
 * Data arrives in chunks of any size through {@link #feed(byte[], int, int)}. {@link #nextToken()}
 * returns a token as soon as its header and type byte are complete, before any body byte is
 * buffered, so that the caller can validate the declared size first. The caller must then either
 * {@link #readBody()} (buffering the body, possibly over several chunks) or {@link #skipBody()}
 * (dropping the body bytes as they arrive, without buffering them).
 * <p>
 * The decoder only validates the wire format: header length and type byte. Nesting and structure
 * ids are checked by {@link BananaDecoder}.
 * <p>
 * Example:
 * <pre>
 * {@code
 *   decoder.feed(bytes, 0, bytes.length);
 *
 *   BananaToken token;
 *   while ((token = decoder.nextToken()) != BananaToken.NONE) {
 *     if (!decoder.readBody()) {
 *       break; // wait for more data
 *     }
 *     if (token == BananaToken.INT) {
 *       System.out.println("Int value " + decoder.longValue());
 *     }
 *   }
 * }
 * </pre>
 */
public class TokenDecoder {
  private static final int STATE_HEADER = 0;
  private static final int STATE_BODY = 1;
  private static final int STATE_SKIP = 2;

  private byte[] data = new byte[1024];
  private int position, end;
  private int state = STATE_HEADER;
  private long skipRemaining;

  private BananaToken currentToken = BananaToken.NONE;
  private long header;
  private long longValue;
  private double doubleValue;
  private String stringValue;
  private BigInteger bigintValue;

  /** Append received data. */
  public void feed(byte[] chunk, int offset, int length) {
    if (state == STATE_SKIP) {
      int skipped = (int) Math.min(skipRemaining, length);
      skipRemaining -= skipped;
      offset += skipped;
      length -= skipped;
      if (skipRemaining == 0) {
        state = STATE_HEADER;
      }
    }
    if (length == 0) {
      return;
    }

    if (position > 0) {
      System.arraycopy(data, position, data, 0, end - position);
      end -= position;
      position = 0;
    }
    if (end + length > data.length) {
      data = Arrays.copyOf(data, Math.max((end + length) * 3 / 2, data.length));
    }
    System.arraycopy(chunk, offset, data, end, length);
    end += length;
  }

  public void feed(byte[] chunk) {
    feed(chunk, 0, chunk.length);
  }

  /** Number of received bytes not consumed yet. */
  public int available() {
    return end - position;
  }

  /**
   * Parse the header and type byte of the next token.
   * <p>
   * Body bytes are not consumed: call {@link #readBody()} or {@link #skipBody()} next.
   *
   * @return the token, or {@link BananaToken#NONE} if more data is needed (including when the body
   *     of a skipped token has not been completely received yet)
   * @throws BananaError if the header is too long or the type byte is not part of the vocabulary
   */
  public BananaToken nextToken() throws BananaError {
    if (state == STATE_SKIP) {
      skipAvailable();
      if (state == STATE_SKIP) {
        return (currentToken = BananaToken.NONE);
      }
    }
    if (state == STATE_BODY) {
      throw new IllegalStateException("Body of the " + currentToken + " token was neither read nor skipped");
    }

    int typePosition = position;
    while (typePosition < end && (data[typePosition] & 0x80) == 0) {
      if (typePosition - position >= BananaHeader.MAX_HEADER_LENGTH) {
        throw new BananaError("Token prefix is limited to " + BananaHeader.MAX_HEADER_LENGTH + " bytes");
      }
      typePosition++;
    }
    if (typePosition == end) {
      return (currentToken = BananaToken.NONE);
    }

    byte typeByte = data[typePosition];
    BananaToken token = BananaToken.fromTypeByte(typeByte);
    if (token == null) {
      throw new BananaError(String.format("Invalid type byte 0x%02x", typeByte & 0xff));
    }

    long value = 0;
    for (int i = typePosition - 1; i >= position; --i) {
      value = (value << 7) | data[i];
    }
    position = typePosition + 1;

    header = value;
    currentToken = token;
    stringValue = null;
    bigintValue = null;
    switch (token) {
      case INT:
        longValue = value;
        break;
      case NEG:
        longValue = -value;
        break;
      default:
        longValue = value;
        break;
    }
    if (bodyLength() > 0 || token.isLong()) {
      state = STATE_BODY;
    }

    return token;
  }

  /**
   * Consume the body of the current token, once it has been received completely.
   *
   * @return {@code true} when the body was consumed (always for tokens without body), {@code false}
   *     if more data is needed; call again after the next {@link #feed(byte[], int, int)}
   */
  public boolean readBody() {
    if (state != STATE_BODY) {
      return true;
    }
    long length = bodyLength();
    if (end - position < length) {
      return false;
    }

    int bodyStart = position;
    position += (int) length;
    state = STATE_HEADER;

    switch (currentToken) {
      case STRING:
      case ERROR:
        stringValue = new String(data, bodyStart, (int) length, StandardCharsets.UTF_8);
        break;
      case LONGINT:
      case LONGNEG:
        BigInteger magnitude = new BigInteger(1, Arrays.copyOfRange(data, bodyStart, position));
        bigintValue = currentToken == BananaToken.LONGNEG ? magnitude.negate() : magnitude;
        break;
      case FLOAT:
        long doubleBits = 0;
        for (int i = bodyStart; i < position; ++i) {
          doubleBits = (doubleBits << 8) | (data[i] & 0xff);
        }
        doubleValue = Double.longBitsToDouble(doubleBits);
        break;
      default:
        throw new IllegalStateException("Token " + currentToken + " has no body");
    }

    return true;
  }

  /**
   * Drop the body of the current token. Bytes already received are discarded, the rest is
   * discarded as it is fed, without ever being buffered.
   */
  public void skipBody() {
    if (state != STATE_BODY) {
      return;
    }
    skipRemaining = bodyLength();
    state = STATE_SKIP;
    skipAvailable();
  }

  private void skipAvailable() {
    int skipped = (int) Math.min(skipRemaining, end - position);
    position += skipped;
    skipRemaining -= skipped;
    if (skipRemaining == 0) {
      state = STATE_HEADER;
    }
  }

  /** After a call to {@link #nextToken}, return the current token. */
  public BananaToken currentToken() {
    return currentToken;
  }

  /** Raw header of the current token: value, length or structure id depending on the token. */
  public long header() {
    return header;
  }

  /** Number of body bytes following the type byte of the current token. */
  public long bodyLength() {
    if (currentToken == BananaToken.FLOAT) {
      return BananaHeader.FLOAT_BODY_LENGTH;
    }
    return currentToken.isLong() ? header : 0;
  }

  /**
   * Current integer value.
   * <p>
   * Defined for {@link BananaToken#INT} and {@link BananaToken#NEG}; for {@link BananaToken#VOCAB},
   * {@link BananaToken#OPEN}, {@link BananaToken#CLOSE} and {@link BananaToken#ABORT} it is the header.
   */
  public long longValue() {
    return longValue;
  }

  /**
   * Current {@code double} value.
   * <p>
   * Defined for {@link BananaToken#FLOAT} after {@link #readBody()}.
   */
  public double doubleValue() {
    return doubleValue;
  }

  /**
   * Current string value.
   * <p>
   * Defined for {@link BananaToken#STRING} and {@link BananaToken#ERROR} after {@link #readBody()}.
   */
  public String stringValue() {
    return stringValue;
  }

  /**
   * Current big integer value.
   * <p>
   * Defined for {@link BananaToken#LONGINT} and {@link BananaToken#LONGNEG} after {@link #readBody()}.
   */
  public BigInteger bigintValue() {
    return bigintValue;
  }

  /** Discard all internal state. */
  public void reset() {
    position = end = 0;
    state = STATE_HEADER;
    skipRemaining = 0;
    currentToken = BananaToken.NONE;
    stringValue = null;
    bigintValue = null;
  }
}
