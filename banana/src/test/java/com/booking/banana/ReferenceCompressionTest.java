package com.booking.banana;

import static com.booking.banana.TestUtils.byteArray;
import static com.booking.banana.TestUtils.concat;
import static com.booking.banana.TestUtils.decode;
import static com.booking.banana.TestUtils.encode;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class ReferenceCompressionTest {
  private static final byte[] OPEN_LIST = byteArray(0x04, 0x82, 'l', 'i', 's', 't');
  private static final byte[] OPEN_REFERENCE = byteArray(0x09, 0x82, 'r', 'e', 'f', 'e', 'r', 'e', 'n', 'c', 'e');
  private static final byte[] OPEN_BOOLEAN = byteArray(0x07, 0x82, 'b', 'o', 'o', 'l', 'e', 'a', 'n');

  @Test
  public void sharedListSentOnce() {
    List<Object> shared = new ArrayList<>(Arrays.asList(1L));
    List<Object> outer = Arrays.asList(shared, shared);

    assertThat(encode(outer), equalTo(concat(
        byteArray(0x00, 0x88), OPEN_LIST,
        byteArray(0x01, 0x88), OPEN_LIST, byteArray(0x01, 0x81, 0x01, 0x89),
        byteArray(0x02, 0x88), OPEN_REFERENCE, byteArray(0x01, 0x81, 0x02, 0x89),
        byteArray(0x00, 0x89))));
  }

  @Test
  public void sharedListDecodesToOneObject() throws BananaError {
    List<Object> shared = new ArrayList<>(Arrays.asList(1L));
    Object[] tuple = {"t"};
    List<Object> outer = Arrays.asList(shared, tuple, shared, tuple);

    List<?> decoded = (List<?>) decode(encode(outer)).single();

    assertThat(decoded.get(0), sameInstance(decoded.get(2)));
    assertThat(decoded.get(1), sameInstance(decoded.get(3)));
    assertThat(decoded.get(0), equalTo((Object) shared));
  }

  @Test
  public void equalButDistinctObjectsAreNotShared() throws BananaError {
    List<Object> outer = Arrays.asList(new ArrayList<>(Arrays.asList(1L)), new ArrayList<>(Arrays.asList(1L)));

    List<?> decoded = (List<?>) decode(encode(outer)).single();

    assertThat(decoded.get(0), equalTo(decoded.get(1)));
    assertThat(decoded.get(0), not(sameInstance(decoded.get(1))));
  }

  @Test
  public void referencesSpanObjectsOfOneConnection() throws BananaError {
    List<Object> shared = new ArrayList<>(Arrays.asList("x"));
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    BananaEncoder encoder = new BananaEncoder(out);

    encoder.send(shared);
    encoder.send(Arrays.asList(shared));

    TestUtils.Collector collector = decode(out.toByteArray());
    assertThat(collector.objects.size(), equalTo(2));
    assertThat(((List<?>) collector.objects.get(1)).get(0), sameInstance(collector.objects.get(0)));
    assertThat(encoder.openCount(), equalTo(3));
  }

  @Test
  public void referenceToFailedStructure() throws BananaError {
    // a boolean carrying 5, then a reference to it
    byte[] data = concat(
        byteArray(0x00, 0x88), OPEN_BOOLEAN, byteArray(0x05, 0x81, 0x00, 0x89),
        byteArray(0x01, 0x88), OPEN_REFERENCE, byteArray(0x00, 0x81, 0x01, 0x89),
        byteArray(0x02, 0x81));

    TestUtils.Collector collector = decode(data);

    assertThat(collector.failures.size(), equalTo(2));
    assertThat(collector.failures.get(0).getMessage(), equalTo("Boolean expects INT 0 or 1, got INT 5"));
    assertThat(collector.failures.get(1), sameInstance(collector.failures.get(0)));
    assertThat(collector.objects, equalTo(Arrays.<Object>asList(2L)));
  }

  @Test
  public void referenceToUnopenedId() {
    byte[] data = concat(byteArray(0x00, 0x88), OPEN_REFERENCE, byteArray(0x05, 0x81, 0x00, 0x89));

    try {
      decode(data);
      fail("Expected a BananaError");
    } catch (BananaError e) {
      assertThat(e.getMessage(), equalTo("Reference to structure id 5, which was never opened"));
    }
  }

  @Test
  public void referenceToUntrackedStructure() {
    byte[] data = concat(
        byteArray(0x00, 0x88), OPEN_BOOLEAN, byteArray(0x01, 0x81, 0x00, 0x89),
        byteArray(0x01, 0x88), OPEN_REFERENCE, byteArray(0x00, 0x81, 0x01, 0x89));

    try {
      decode(data);
      fail("Expected a BananaError");
    } catch (BananaError e) {
      assertThat(e.getMessage(), equalTo("Reference to structure id 0, which is not referenceable"));
    }
  }

  @Test
  public void stringsAreNotTracked() {
    String text = "same";

    byte[] data = encode(Arrays.asList(text, text));

    assertThat(data, equalTo(concat(
        byteArray(0x00, 0x88), OPEN_LIST,
        byteArray(0x04, 0x82, 's', 'a', 'm', 'e', 0x04, 0x82, 's', 'a', 'm', 'e'),
        byteArray(0x00, 0x89))));
  }
}
