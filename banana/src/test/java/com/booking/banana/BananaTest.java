package com.booking.banana;

import static com.booking.banana.TestUtils.byteArray;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.Test;

public class BananaTest {
  @Test
  public void conversation() throws BananaError {
    ByteArrayOutputStream toBob = new ByteArrayOutputStream();
    ByteArrayOutputStream toAlice = new ByteArrayOutputStream();
    TestUtils.Collector aliceReceived = new TestUtils.Collector();
    TestUtils.Collector bobReceived = new TestUtils.Collector();
    Banana alice = new Banana(toBob, aliceReceived);
    Banana bob = new Banana(toAlice, bobReceived);
    Map<Object, Object> question = new LinkedHashMap<>();
    question.put("op", "add");
    question.put("args", new Object[] {2, 3});

    alice.send(question);
    bob.dataReceived(toBob.toByteArray());
    @SuppressWarnings("unchecked")
    Map<Object, Object> received = (Map<Object, Object>) bobReceived.single();
    Object[] args = (Object[]) received.get("args");
    bob.send(Arrays.asList("sum", (Long) args[0] + (Long) args[1]));
    alice.dataReceived(toAlice.toByteArray());

    assertThat(aliceReceived.single(), equalTo((Object) Arrays.asList("sum", 5L)));
    assertThat(alice.isDropped() || bob.isDropped(), equalTo(false));
  }

  @Test
  public void corruptInputIsReportedToPeer() throws BananaError {
    ByteArrayOutputStream toBob = new ByteArrayOutputStream();
    ByteArrayOutputStream toAlice = new ByteArrayOutputStream();
    TestUtils.Collector aliceReceived = new TestUtils.Collector();
    Banana alice = new Banana(toBob, aliceReceived);
    Banana bob = new Banana(toAlice, new TestUtils.Collector());
    CompletableFuture<Void> pending = alice.send("hello");

    try {
      bob.dataReceived(byteArray(0x00, 0x80));
      fail("Expected a BananaError");
    } catch (BananaError e) {
      assertThat(e.getMessage(), equalTo("Invalid type byte 0x80"));
    }
    assertThat(bob.isDropped(), equalTo(true));
    assertThat(bob.encoder().isDropped(), equalTo(true));
    assertThat(toAlice.toByteArray(), equalTo(byteArray(
        0x16, 0x8d, 'I', 'n', 'v', 'a', 'l', 'i', 'd', ' ', 't', 'y', 'p', 'e', ' ',
        'b', 'y', 't', 'e', ' ', '0', 'x', '8', '0')));

    int sentByAlice = toBob.size();
    try {
      alice.dataReceived(toAlice.toByteArray());
      fail("Expected a RemoteError");
    } catch (BananaError e) {
      assertThat(e, instanceOf(RemoteError.class));
      assertThat(((RemoteError) e).remoteMessage(), equalTo("Invalid type byte 0x80"));
    }
    assertThat(alice.isDropped(), equalTo(true));
    // a peer that sent ERROR is not answered with one
    assertThat(toBob.size(), equalTo(sentByAlice));
    assertThat(pending.isDone() && !pending.isCompletedExceptionally(), equalTo(true));
  }

  @Test
  public void connectionLostTearsDownBothDirections() throws BananaError {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    TestUtils.Collector received = new TestUtils.Collector();
    Banana banana = new Banana(out, received);
    // half of a tuple
    banana.dataReceived(byteArray(0x00, 0x88, 0x05, 0x82, 't', 'u', 'p', 'l', 'e', 0x01, 0x81));

    banana.connectionLost(new IllegalStateException("reset by peer"));

    assertThat(banana.encoder().isDropped(), equalTo(true));
    assertThat(banana.decoder().isDropped(), equalTo(true));
    assertThat(out.size(), equalTo(0));
    assertThat(received.objects.size(), equalTo(0));
  }

  @Test
  public void sendingFailureStopsReceiving() throws BananaError {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    TestUtils.Collector received = new TestUtils.Collector();
    Banana banana = new Banana(out, received);
    // half of a tuple, still open when the connection drops
    banana.dataReceived(byteArray(0x00, 0x88, 0x05, 0x82, 't', 'u', 'p', 'l', 'e', 0x01, 0x81));

    // streaming is not allowed, so waiting for the element is fatal
    banana.send(Arrays.asList(new CompletableFuture<Object>()));

    assertThat(banana.encoder().isDropped(), equalTo(true));
    assertThat(banana.decoder().isDropped(), equalTo(true));
    try {
      banana.dataReceived(TestUtils.encode(Arrays.asList(1, 2)));
      fail("Expected an IllegalStateException");
    } catch (IllegalStateException e) {
      assertThat(e.getMessage(), equalTo("Can't receive, the connection was dropped"));
    }
    assertThat(received.objects.size(), equalTo(0));
  }
}
