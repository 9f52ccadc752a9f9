package com.booking.banana;

import static com.booking.banana.TestUtils.byteArray;
import static com.booking.banana.TestUtils.concat;
import static com.booking.banana.TestUtils.encode;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class FatalDesyncTest {
  private static final byte[] OPEN_LIST = byteArray(0x04, 0x82, 'l', 'i', 's', 't');

  @Rule
  public ExpectedException exceptionRule = ExpectedException.none();

  @Test
  public void invalidTypeByte() {
    assertFatal(byteArray(0x00, 0x80), "Invalid type byte 0x80");
  }

  @Test
  public void openWithWrongId() {
    assertFatal(byteArray(0x05, 0x88), "Lost sync: got OPEN 5, expected 0");
  }

  @Test
  public void closeWithoutOpen() {
    assertFatal(byteArray(0x00, 0x89), "CLOSE 0 without a matching OPEN");
  }

  @Test
  public void abortWithoutOpen() {
    assertFatal(byteArray(0x02, 0x81, 0x00, 0x8a), "ABORT 0 without a matching OPEN");
  }

  @Test
  public void closeWithWrongId() {
    assertFatal(concat(byteArray(0x00, 0x88), OPEN_LIST, byteArray(0x03, 0x89)), "Lost sync: got CLOSE 3, expected 0");
  }

  @Test
  public void closeWithWrongIdWhileDiscarding() {
    // the unknown open type is discarded, its CLOSE must still match
    byte[] data = byteArray(0x00, 0x88, 0x01, 0x82, 'x', 0x01, 0x89);

    assertFatal(data, "Lost sync: got CLOSE 1, expected 0");
  }

  @Test
  public void tokenLargerThanHardCap() {
    // STRING of 2 MiB
    assertFatal(byteArray(0x00, 0x00, 0x00, 0x01, 0x82), "STRING token of 2097152 bytes exceeds the limit of 1048576");
  }

  @Test
  public void hardCapAppliesInsideDiscardedStructures() {
    byte[] data = concat(
        byteArray(0x00, 0x88, 0x01, 0x82, 'x'),
        byteArray(0x00, 0x00, 0x00, 0x01, 0x85));

    assertFatal(data, "LONGINT token of 2097152 bytes exceeds the limit of 1048576");
  }

  @Test
  public void remoteError() {
    BananaError error = assertFatal(byteArray(0x05, 0x8d, 'b', 'o', 'o', 'm', '!'), "Remote error: boom!");

    assertThat(error, instanceOf(RemoteError.class));
    assertThat(((RemoteError) error).remoteMessage(), equalTo("boom!"));
  }

  @Test
  public void oversizedRemoteErrorIsNotRead() {
    // 2000 bytes announced, none sent
    BananaError error = assertFatal(byteArray(0x50, 0x0f, 0x8d), "Remote error: (2000 bytes, not read)");

    assertThat(error, instanceOf(RemoteError.class));
  }

  @Test
  public void objectsBeforeTheErrorAreDelivered() throws BananaError {
    TestUtils.Collector collector = new TestUtils.Collector();
    BananaDecoder decoder = new BananaDecoder(collector);
    byte[] data = concat(encode(Arrays.asList("ok")), byteArray(0x7f, 0x8f));

    try {
      decoder.dataReceived(data);
      fail("Expected a BananaError");
    } catch (BananaError e) {
      assertThat(e.getMessage(), equalTo("Invalid type byte 0x8f"));
    }
    assertThat(collector.objects, equalTo(Arrays.<Object>asList(Arrays.asList("ok"))));
  }

  @Test
  public void noDataAfterTeardown() throws BananaError {
    BananaDecoder decoder = new BananaDecoder(new TestUtils.Collector());
    try {
      decoder.dataReceived(byteArray(0x00, 0x80));
    } catch (BananaError e) {
      assertThat(decoder.isDropped(), equalTo(true));
    }

    exceptionRule.expect(IllegalStateException.class);
    exceptionRule.expectMessage("Can't receive, the connection was dropped");

    decoder.dataReceived(byteArray(0x01, 0x81));
  }

  @Test
  public void teardownFailsWaitingPlaceholders() throws BananaError {
    // two tuples waiting for each other can only be failed
    Object[] first = new Object[1];
    Object[] second = {first};
    first[0] = second;
    TestUtils.Collector collector = new TestUtils.Collector();
    BananaDecoder decoder = new BananaDecoder(collector);

    decoder.dataReceived(encode(first));
    assertThat(collector.objects.size(), equalTo(0));
    assertThat(collector.failures.size(), equalTo(0));

    decoder.connectionLost(new IllegalStateException("transport closed"));

    assertThat(collector.singleFailure().getMessage(), equalTo("Connection dropped: Connection lost"));
    assertThat(decoder.isDropped(), equalTo(true));
  }

  @Test
  public void teardownFailsOpenStructures() throws BananaError {
    Object[] tuple = {"a"};
    TestUtils.Collector collector = new TestUtils.Collector();
    BananaDecoder decoder = new BananaDecoder(collector);
    byte[] data = encode(Arrays.asList(tuple, tuple));
    // everything but the final CLOSE
    decoder.dataReceived(Arrays.copyOf(data, data.length - 2));

    decoder.connectionLost(new IllegalStateException("transport closed"));

    assertThat(collector.objects.size(), equalTo(0));
    assertThat(decoder.isDropped(), equalTo(true));
  }

  private static BananaError assertFatal(byte[] data, String message) {
    TestUtils.Collector collector = new TestUtils.Collector();
    BananaDecoder decoder = new BananaDecoder(collector);
    try {
      decoder.dataReceived(data);
      fail("Expected a BananaError");
      return null;
    } catch (BananaError e) {
      assertThat(e.getMessage(), equalTo(message));
      assertThat(decoder.isDropped(), equalTo(true));
      return e;
    }
  }

  @Test
  public void teardownFillsWaitingSlotsWithFailure() throws BananaError {
    Object[] first = new Object[1];
    Object[] second = {first};
    first[0] = second;
    TestUtils.Collector collector = new TestUtils.Collector();
    BananaDecoder decoder = new BananaDecoder(collector);

    decoder.dataReceived(encode(Arrays.asList(first, "tail")));
    List<?> list = (List<?>) collector.single();
    assertThat(list.get(0), nullValue());

    decoder.connectionLost(new IllegalStateException("transport closed"));

    assertThat(list.get(0), instanceOf(UnbananaFailure.class));
    assertThat(((UnbananaFailure) list.get(0)).getMessage(), equalTo("Connection dropped: Connection lost"));
    assertThat(list.get(1), equalTo((Object) "tail"));
  }

  @Test
  public void errorWhileDecodingDropsConnection() throws BananaError {
    UnslicerRegistry registry = UnslicerRegistry.defaults().register("deep", opentype -> {
      throw new StackOverflowError();
    });
    BananaDecoder decoder = new BananaDecoder(new TestUtils.Collector(), new DecoderOptions().unslicerRegistry(registry));

    try {
      decoder.dataReceived(byteArray(0x00, 0x88, 0x04, 0x82, 'd', 'e', 'e', 'p'));
      fail("Expected a StackOverflowError");
    } catch (StackOverflowError e) {
      assertThat(decoder.isDropped(), equalTo(true));
    }
  }
}
