package com.booking.banana;

import static com.booking.banana.TestUtils.byteArray;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class TokenDecoderErrorsTest {
  @Rule
  public ExpectedException exceptionRule = ExpectedException.none();

  @Test
  public void headerTooLong() throws BananaError {
    exceptionRule.expect(BananaError.class);
    exceptionRule.expectMessage("Token prefix is limited to 9 bytes");

    TokenDecoder decoder = new TokenDecoder();
    decoder.feed(byteArray(0x01, 0x01, 0x01, 0x01, 0x01, 0x01, 0x01, 0x01, 0x01, 0x01, 0x81));
    decoder.nextToken();
  }

  @Test
  public void headerTooLongBeforeTypeByte() throws BananaError {
    exceptionRule.expect(BananaError.class);
    exceptionRule.expectMessage("Token prefix is limited to 9 bytes");

    // noticed without waiting for the type byte
    TokenDecoder decoder = new TokenDecoder();
    decoder.feed(byteArray(0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00));
    decoder.nextToken();
  }

  @Test
  public void oldListTag() throws BananaError {
    exceptionRule.expect(BananaError.class);
    exceptionRule.expectMessage("Invalid type byte 0x80");

    TokenDecoder decoder = new TokenDecoder();
    decoder.feed(byteArray(0x00, 0x80));
    decoder.nextToken();
  }

  @Test
  public void unknownTypeByte() throws BananaError {
    exceptionRule.expect(BananaError.class);
    exceptionRule.expectMessage("Invalid type byte 0x8b");

    TokenDecoder decoder = new TokenDecoder();
    decoder.feed(byteArray(0x8b));
    decoder.nextToken();
  }

  @Test
  public void highTypeByte() throws BananaError {
    exceptionRule.expect(BananaError.class);
    exceptionRule.expectMessage("Invalid type byte 0xff");

    TokenDecoder decoder = new TokenDecoder();
    decoder.feed(byteArray(0x05, 0xff));
    decoder.nextToken();
  }
}
