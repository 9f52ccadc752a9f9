package com.booking.banana;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A low-level token writer for Banana.
 * <p>
 * It only knows how each token is laid out on the wire: it does not check nesting, it does not
 * assign structure ids and it does not track references, that is the job of {@link BananaEncoder}.
 * <p>
 * Example:
 * <pre>
 * {@code
 *   encoder.appendOpen(0);
 *   encoder.appendString("list");
 *   encoder.appendInt(1);
 *   encoder.appendString("two");
 *   encoder.appendClose(0);
 *
 *   byte[] data = encoder.getData();
 * }
 * </pre>
 */
public class TokenEncoder {
  private static final BigInteger MAX_HEADER_VALUE = BigInteger.valueOf(Long.MAX_VALUE);

  private final CharsetEncoder utf8Encoder = StandardCharsets.UTF_8.newEncoder()
      .onMalformedInput(CodingErrorAction.REPORT)
      .onUnmappableCharacter(CodingErrorAction.REPORT);
  private byte[] bytes = new byte[1024];
  private int size = 0;

  /** Number of bytes written since the last {@link #reset()}. */
  public int size() {
    return size;
  }

  /** Get a copy of the encoded tokens. */
  public byte[] getData() {
    return Arrays.copyOf(bytes, size);
  }

  /** Write the encoded tokens to {@code out}. The buffer is not reset. */
  public void writeTo(OutputStream out) throws IOException {
    out.write(bytes, 0, size);
  }

  /** Discard the encoded tokens. */
  public void reset() {
    size = 0;
  }

  /**
   * Append an integer value.
   * <p>
   * Uses {@code INT} or {@code NEG}, and {@code LONGNEG} for {@link Long#MIN_VALUE}.
   */
  public void appendInt(long value) {
    if (value >= 0) {
      appendToken(value, BananaHeader.BANANA_INT);
    } else if (value != Long.MIN_VALUE) {
      appendToken(-value, BananaHeader.BANANA_NEG);
    } else {
      appendBigInteger(BigInteger.valueOf(value));
    }
  }

  /**
   * Append an integer value of any size.
   * <p>
   * Values that fit in a header use {@code INT}/{@code NEG}, the others {@code LONGINT}/{@code LONGNEG}
   * with the big-endian magnitude as body.
   */
  public void appendBigInteger(BigInteger value) {
    BigInteger magnitude = value.abs();
    if (magnitude.compareTo(MAX_HEADER_VALUE) <= 0) {
      appendToken(magnitude.longValue(), value.signum() < 0 ? BananaHeader.BANANA_NEG : BananaHeader.BANANA_INT);
      return;
    }

    byte[] body = magnitude.toByteArray();
    int offset = body[0] == 0 ? 1 : 0;
    appendLongToken(
        value.signum() < 0 ? BananaHeader.BANANA_LONGNEG : BananaHeader.BANANA_LONGINT,
        body, offset, body.length - offset);
  }

  /**
   * Append a {@code FLOAT} token.
   */
  public void appendFloat(double value) {
    ensureAvailable(BananaHeader.FLOAT_BODY_LENGTH + 2);
    appendByteUnsafe((byte) 0);
    appendByteUnsafe(BananaHeader.BANANA_FLOAT);
    long doubleBits = Double.doubleToLongBits(value);
    for (int shift = 56; shift >= 0; shift -= 8) {
      appendByteUnsafe((byte) (doubleBits >>> shift));
    }
  }

  /**
   * Append a {@code STRING} token with the UTF-8 encoding of {@code string}.
   *
   * @throws Violation if the string is not valid UTF-16 (e.g. lone surrogates); nothing is written
   */
  public void appendString(CharSequence string) throws Violation {
    int maxLength = string.length() * 3;
    int bodyStart = size + BananaHeader.MAX_HEADER_LENGTH + 1;
    ensureAvailable(maxLength + BananaHeader.MAX_HEADER_LENGTH + 1);

    utf8Encoder.reset();
    ByteBuffer out = ByteBuffer.wrap(bytes, bodyStart, bytes.length - bodyStart);
    CoderResult result = utf8Encoder.encode(CharBuffer.wrap(string), out, true);
    if (!result.isError()) {
      result = utf8Encoder.flush(out);
    }
    if (result.isError()) {
      throw new Violation("Can't encode string as UTF-8: " + result);
    }
    int length = out.position() - bodyStart;

    // the body was encoded after room for the longest header, move it next to the real one
    int headerEnd = encodeHeader(length, bytes, size);
    bytes[headerEnd++] = BananaHeader.BANANA_STRING;
    System.arraycopy(bytes, bodyStart, bytes, headerEnd, length);
    size = headerEnd + length;
  }

  /**
   * Append a {@code STRING} token.
   * <p>
   * The passed-in value is assumed to be valid UTF-8, no check is performed.
   */
  public void appendUTF8(byte[] utf8, int offset, int length) {
    appendLongToken(BananaHeader.BANANA_STRING, utf8, offset, length);
  }

  /** Append a {@code VOCAB} token for the string at {@code index} in the {@link VocabTable}. */
  public void appendVocab(int index) {
    appendToken(index, BananaHeader.BANANA_VOCAB);
  }

  /** Append an {@code OPEN} token for structure {@code openId}. */
  public void appendOpen(int openId) {
    appendToken(openId, BananaHeader.BANANA_OPEN);
  }

  /** Append a {@code CLOSE} token for structure {@code openId}. */
  public void appendClose(int openId) {
    appendToken(openId, BananaHeader.BANANA_CLOSE);
  }

  /** Append an {@code ABORT} token for structure {@code openId}. */
  public void appendAbort(int openId) {
    appendToken(openId, BananaHeader.BANANA_ABORT);
  }

  /**
   * Append an {@code ERROR} token.
   * <p>
   * Messages longer than {@link BananaHeader#SIZE_LIMIT} bytes are truncated.
   */
  public void appendError(String message) {
    byte[] utf8 = message.getBytes(StandardCharsets.UTF_8);
    appendLongToken(BananaHeader.BANANA_ERROR, utf8, 0, Math.min(utf8.length, BananaHeader.SIZE_LIMIT));
  }

  private void appendToken(long header, byte typeByte) {
    ensureAvailable(BananaHeader.MAX_HEADER_LENGTH + 1);
    size = encodeHeader(header, bytes, size);
    appendByteUnsafe(typeByte);
  }

  private void appendLongToken(byte typeByte, byte[] body, int offset, int length) {
    ensureAvailable(BananaHeader.MAX_HEADER_LENGTH + 1 + length);
    size = encodeHeader(length, bytes, size);
    appendByteUnsafe(typeByte);
    System.arraycopy(body, offset, bytes, size, length);
    size += length;
  }

  // base-128, least significant digit first, no continuation bit: the type byte ends the header
  private static int encodeHeader(long n, byte[] buffer, int pos) {
    if (n < 0) {
      throw new IllegalArgumentException("Negative header value " + n);
    }
    do {
      buffer[pos++] = (byte) (n & 127);
      n >>>= 7;
    } while (n > 0);

    return pos;
  }

  private void ensureAvailable(int required) {
    long total = (long) required + size;

    if (total > bytes.length) {
      bytes = Arrays.copyOf(bytes, (int) (total * 3 / 2));
    }
  }

  private void appendByteUnsafe(byte data) {
    bytes[size++] = data;
  }
}
