package com.booking.banana;

/**
 * Wire constants for the Banana token stream.
 * <p>
 * Every token is a header (base-128 digits, least significant first, each digit below {@code 0x80})
 * followed by one of the type bytes below (high bit set).
 */
public interface BananaHeader {
  // 0x80 was the old LIST tag, it is no longer part of the vocabulary
  static final byte BANANA_INT     = (byte) 0x81; /* <VALUE> - non-negative integer up to 2^63-1 */
  static final byte BANANA_STRING  = (byte) 0x82; /* <LENGTH> <UTF8> - string */
  static final byte BANANA_NEG     = (byte) 0x83; /* <-VALUE> - negative integer down to -(2^63-1) */
  static final byte BANANA_FLOAT   = (byte) 0x84; /* <0> <IEEE-DOUBLE, big-endian> */
  static final byte BANANA_LONGINT = (byte) 0x85; /* <LENGTH> <MAGNITUDE, big-endian> - large positive integer */
  static final byte BANANA_LONGNEG = (byte) 0x86; /* <LENGTH> <MAGNITUDE, big-endian> - large negative integer */
  static final byte BANANA_VOCAB   = (byte) 0x87; /* <INDEX> - string from the pre-agreed vocabulary table */
  static final byte BANANA_OPEN    = (byte) 0x88; /* <STRUCTURE-ID> - start of a structure, followed by index tokens */
  static final byte BANANA_CLOSE   = (byte) 0x89; /* <STRUCTURE-ID> - end of a structure */
  static final byte BANANA_ABORT   = (byte) 0x8A; /* <STRUCTURE-ID> - the structure is abandoned, CLOSE follows */
  static final byte BANANA_ERROR   = (byte) 0x8D; /* <LENGTH> <UTF8> - fatal error, the connection is dropped */

  /** Default limit on the body length of long tokens (STRING, LONGINT, LONGNEG, ERROR). */
  static final int SIZE_LIMIT = 1000;

  /** A header has at most this many base-128 digits, 63 bits. */
  static final int MAX_HEADER_LENGTH = 9;

  static final int FLOAT_BODY_LENGTH = 8;
}
