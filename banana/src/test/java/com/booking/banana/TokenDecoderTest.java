package com.booking.banana;

import static com.booking.banana.TestUtils.byteArray;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import java.math.BigInteger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class TokenDecoderTest {
  @Rule
  public ExpectedException exceptionRule = ExpectedException.none();

  @Test
  public void headerSplitAcrossChunks() throws BananaError {
    TokenDecoder decoder = new TokenDecoder();

    decoder.feed(byteArray(0x2c));
    assertThat(decoder.nextToken(), equalTo(BananaToken.NONE));

    decoder.feed(byteArray(0x02, 0x81));
    assertThat(decoder.nextToken(), equalTo(BananaToken.INT));
    assertThat(decoder.readBody(), equalTo(true));
    assertThat(decoder.longValue(), equalTo(300L));
    assertThat(decoder.nextToken(), equalTo(BananaToken.NONE));
  }

  @Test
  public void integers() throws BananaError {
    TokenDecoder decoder = new TokenDecoder();
    decoder.feed(byteArray(
        0x05, 0x83,
        0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x7f, 0x81,
        0x08, 0x86, 0x80, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00,
        0x02, 0x85, 0x01, 0x00));

    assertThat(decoder.nextToken(), equalTo(BananaToken.NEG));
    assertThat(decoder.longValue(), equalTo(-5L));

    assertThat(decoder.nextToken(), equalTo(BananaToken.INT));
    assertThat(decoder.longValue(), equalTo(Long.MAX_VALUE));

    assertThat(decoder.nextToken(), equalTo(BananaToken.LONGNEG));
    assertThat(decoder.bodyLength(), equalTo(8L));
    assertThat(decoder.readBody(), equalTo(true));
    assertThat(decoder.bigintValue(), equalTo(BigInteger.valueOf(Long.MIN_VALUE)));

    assertThat(decoder.nextToken(), equalTo(BananaToken.LONGINT));
    assertThat(decoder.readBody(), equalTo(true));
    assertThat(decoder.bigintValue(), equalTo(BigInteger.valueOf(256)));
  }

  @Test
  public void floatBody() throws BananaError {
    TokenDecoder decoder = new TokenDecoder();

    decoder.feed(byteArray(0x00, 0x84, 0x3f, 0xf8, 0x00));
    assertThat(decoder.nextToken(), equalTo(BananaToken.FLOAT));
    assertThat(decoder.readBody(), equalTo(false));

    decoder.feed(byteArray(0x00, 0x00, 0x00, 0x00, 0x00));
    assertThat(decoder.readBody(), equalTo(true));
    assertThat(decoder.doubleValue(), equalTo(1.5));
  }

  @Test
  public void stringBodySplitAcrossChunks() throws BananaError {
    TokenDecoder decoder = new TokenDecoder();

    decoder.feed(byteArray(0x03, 0x82, 'a'));
    assertThat(decoder.nextToken(), equalTo(BananaToken.STRING));
    assertThat(decoder.header(), equalTo(3L));
    assertThat(decoder.readBody(), equalTo(false));

    decoder.feed(byteArray('b'));
    assertThat(decoder.readBody(), equalTo(false));

    decoder.feed(byteArray('c', 0x01, 0x87));
    assertThat(decoder.readBody(), equalTo(true));
    assertThat(decoder.stringValue(), equalTo("abc"));

    assertThat(decoder.nextToken(), equalTo(BananaToken.VOCAB));
    assertThat(decoder.longValue(), equalTo(1L));
  }

  @Test
  public void skipBodyAcrossChunks() throws BananaError {
    TokenDecoder decoder = new TokenDecoder();

    decoder.feed(byteArray(0x05, 0x82, 'a', 'b'));
    assertThat(decoder.nextToken(), equalTo(BananaToken.STRING));
    decoder.skipBody();
    assertThat(decoder.available(), equalTo(0));
    assertThat(decoder.nextToken(), equalTo(BananaToken.NONE));

    // the rest of the body is dropped as it arrives
    decoder.feed(byteArray('c', 'd'));
    assertThat(decoder.available(), equalTo(0));
    assertThat(decoder.nextToken(), equalTo(BananaToken.NONE));

    decoder.feed(byteArray('e', 0x07, 0x81));
    assertThat(decoder.nextToken(), equalTo(BananaToken.INT));
    assertThat(decoder.longValue(), equalTo(7L));
  }

  @Test
  public void structureTokens() throws BananaError {
    TokenDecoder decoder = new TokenDecoder();
    decoder.feed(byteArray(0x00, 0x88, 0x01, 0x8a, 0x02, 0x01, 0x89));

    assertThat(decoder.nextToken(), equalTo(BananaToken.OPEN));
    assertThat(decoder.header(), equalTo(0L));
    assertThat(decoder.nextToken(), equalTo(BananaToken.ABORT));
    assertThat(decoder.header(), equalTo(1L));
    assertThat(decoder.nextToken(), equalTo(BananaToken.CLOSE));
    assertThat(decoder.header(), equalTo(130L));
  }

  @Test
  public void bodyMustBeConsumed() throws BananaError {
    TokenDecoder decoder = new TokenDecoder();
    decoder.feed(byteArray(0x01, 0x82, 'a', 0x00, 0x81));
    decoder.nextToken();

    exceptionRule.expect(IllegalStateException.class);
    exceptionRule.expectMessage("Body of the STRING token was neither read nor skipped");

    decoder.nextToken();
  }

  @Test
  public void reset() throws BananaError {
    TokenDecoder decoder = new TokenDecoder();
    decoder.feed(byteArray(0x03, 0x82, 'a'));
    decoder.nextToken();

    decoder.reset();
    decoder.feed(byteArray(0x04, 0x81));

    assertThat(decoder.nextToken(), equalTo(BananaToken.INT));
    assertThat(decoder.longValue(), equalTo(4L));
  }
}
