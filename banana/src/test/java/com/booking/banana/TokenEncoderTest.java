package com.booking.banana;

import static com.booking.banana.TestUtils.byteArray;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.fail;

import java.math.BigInteger;
import java.util.Arrays;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class TokenEncoderTest {
  @Rule
  public ExpectedException exceptionRule = ExpectedException.none();

  @Test
  public void encodeInt() {
    assertThat(ints(0), equalTo(byteArray(0x00, 0x81)));
    assertThat(ints(127), equalTo(byteArray(0x7f, 0x81)));
    // first value needing two digits
    assertThat(ints(128), equalTo(byteArray(0x00, 0x01, 0x81)));
    assertThat(ints(300), equalTo(byteArray(0x2c, 0x02, 0x81)));
    assertThat(ints(-5), equalTo(byteArray(0x05, 0x83)));
    assertThat(ints(Long.MAX_VALUE), equalTo(byteArray(0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x81)));
    assertThat(ints(-Long.MAX_VALUE), equalTo(byteArray(0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x83)));
  }

  @Test
  public void encodeMinLong() {
    // 2^63 has no NEG representation
    assertThat(ints(Long.MIN_VALUE), equalTo(byteArray(0x08, 0x86, 0x80, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00)));
  }

  @Test
  public void encodeBigInteger() {
    TokenEncoder encoder = new TokenEncoder();

    encoder.appendBigInteger(BigInteger.valueOf(42));
    encoder.appendBigInteger(BigInteger.ONE.shiftLeft(64));
    encoder.appendBigInteger(BigInteger.ONE.shiftLeft(64).negate());

    assertThat(encoder.getData(), equalTo(byteArray(
        0x2a, 0x81,
        0x09, 0x85, 0x01, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00,
        0x09, 0x86, 0x01, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00)));
  }

  @Test
  public void encodeFloat() {
    TokenEncoder encoder = new TokenEncoder();

    encoder.appendFloat(1.5);

    assertThat(encoder.getData(), equalTo(byteArray(0x00, 0x84, 0x3f, 0xf8, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00)));
  }

  @Test
  public void encodeString() throws Violation {
    TokenEncoder encoder = new TokenEncoder();

    encoder.appendString("abc");
    encoder.appendString("");
    encoder.appendString("é");

    assertThat(encoder.getData(), equalTo(byteArray(
        0x03, 0x82, 'a', 'b', 'c',
        0x00, 0x82,
        0x02, 0x82, 0xc3, 0xa9)));
  }

  @Test
  public void encodeLongString() throws Violation {
    char[] chars = new char[200];
    Arrays.fill(chars, 'x');
    TokenEncoder encoder = new TokenEncoder();

    encoder.appendString(new String(chars));

    byte[] data = encoder.getData();
    assertThat(data.length, equalTo(203));
    assertThat(Arrays.copyOf(data, 3), equalTo(byteArray(0x48, 0x01, 0x82)));
    assertThat(data[202], equalTo((byte) 'x'));
  }

  @Test
  public void encodeStructureTokens() {
    TokenEncoder encoder = new TokenEncoder();

    encoder.appendOpen(0);
    encoder.appendVocab(3);
    encoder.appendAbort(2);
    encoder.appendClose(130);

    assertThat(encoder.getData(), equalTo(byteArray(
        0x00, 0x88,
        0x03, 0x87,
        0x02, 0x8a,
        0x02, 0x01, 0x89)));
  }

  @Test
  public void truncateError() {
    char[] chars = new char[2000];
    Arrays.fill(chars, 'e');
    TokenEncoder encoder = new TokenEncoder();

    encoder.appendError(new String(chars));

    byte[] data = encoder.getData();
    assertThat(data.length, equalTo(1003));
    assertThat(Arrays.copyOf(data, 3), equalTo(byteArray(0x68, 0x07, 0x8d)));
  }

  @Test
  public void loneSurrogateWritesNothing() {
    TokenEncoder encoder = new TokenEncoder();
    encoder.appendInt(1);

    try {
      encoder.appendString("a\ud800b");
      fail("Expected a Violation");
    } catch (Violation v) {
      assertThat(encoder.getData(), equalTo(byteArray(0x01, 0x81)));
    }
  }

  @Test
  public void loneSurrogate() throws Violation {
    exceptionRule.expect(Violation.class);
    exceptionRule.expectMessage("Can't encode string as UTF-8");

    new TokenEncoder().appendString("\udc00");
  }

  private static byte[] ints(long value) {
    TokenEncoder encoder = new TokenEncoder();
    encoder.appendInt(value);
    return encoder.getData();
  }
}
