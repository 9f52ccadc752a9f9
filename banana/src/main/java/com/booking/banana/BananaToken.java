package com.booking.banana;

/**
 * Enumeration for Banana token types, used by {@link com.booking.banana.TokenDecoder} and by
 * {@link Constraint#checkToken(BananaToken, long)}.
 */
public enum BananaToken {
  /** Returned when there is no complete token yet. */
  NONE((byte) 0, false),

  /**
   * A non-negative integer, the header is the value.
   */
  INT(BananaHeader.BANANA_INT, false),

  /**
   * An UTF-8 string, the header is the body length in bytes.
   */
  STRING(BananaHeader.BANANA_STRING, true),

  /**
   * A negative integer, the header is the absolute value.
   */
  NEG(BananaHeader.BANANA_NEG, false),

  /**
   * A 64-bit IEEE-754 floating point number.
   */
  FLOAT(BananaHeader.BANANA_FLOAT, false),

  /**
   * A positive integer too large for {@code INT}.
   */
  LONGINT(BananaHeader.BANANA_LONGINT, true),

  /**
   * A negative integer too large for {@code NEG}.
   */
  LONGNEG(BananaHeader.BANANA_LONGNEG, true),

  /**
   * A string replaced by its index in the pre-agreed {@link VocabTable}.
   */
  VOCAB(BananaHeader.BANANA_VOCAB, false),

  /**
   * Start of a structure. The header is the structure id, the index tokens follow.
   */
  OPEN(BananaHeader.BANANA_OPEN, false),

  /**
   * End of the structure whose id is in the header.
   */
  CLOSE(BananaHeader.BANANA_CLOSE, false),

  /**
   * The sender gave up on the structure whose id is in the header; a {@code CLOSE} follows.
   */
  ABORT(BananaHeader.BANANA_ABORT, false),

  /**
   * Diagnostic sent right before the peer drops the connection.
   */
  ERROR(BananaHeader.BANANA_ERROR, true);

  private static final BananaToken[] BY_TYPE_BYTE = new BananaToken[128];

  static {
    for (BananaToken token : values()) {
      if (token != NONE) {
        BY_TYPE_BYTE[token.typeByte & 0x7f] = token;
      }
    }
  }

  private final byte typeByte;
  private final boolean longToken;

  BananaToken(byte typeByte, boolean longToken) {
    this.typeByte = typeByte;
    this.longToken = longToken;
  }

  /** The byte following the header on the wire. */
  public byte typeByte() {
    return typeByte;
  }

  /**
   * {@code true} if the header is the length of a body of variable size.
   * <p>
   * The size of long tokens must be validated before the body is buffered.
   */
  public boolean isLong() {
    return longToken;
  }

  /** {@code true} for {@code OPEN}, {@code CLOSE} and {@code ABORT}. */
  public boolean isStructural() {
    return this == OPEN || this == CLOSE || this == ABORT;
  }

  /**
   * Map a type byte to its token.
   *
   * @return the token, or {@code null} if the byte is outside the vocabulary
   */
  public static BananaToken fromTypeByte(byte typeByte) {
    if ((typeByte & 0x80) == 0) {
      return null;
    }
    return BY_TYPE_BYTE[typeByte & 0x7f];
  }
}
