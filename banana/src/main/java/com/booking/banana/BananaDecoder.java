package com.booking.banana;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The unslicer stack: rebuilds objects from Banana tokens and hands them to an
 * {@link ObjectHandler}.
 * <p>
 * Data can be fed in chunks of any size. Every token is checked by the {@link Unslicer} on top of
 * the stack (and so by its {@link Constraint}) before its body is buffered.
 * <p>
 * A {@link Violation} abandons the structure being received: its remaining tokens are dropped, its
 * structure id and the ids of everything nested in it are recorded as failed, and the parent gets
 * an {@link UnbananaFailure}. Nesting is tracked independently from the unslicers, so the stream
 * stays in sync whatever was abandoned.
 * <p>
 * A {@link BananaError} is fatal: every open structure is finished, every pending
 * {@link Placeholder} fails, and the error is thrown from {@link #dataReceived(byte[], int, int)}.
 * <p>
 * Instances are not thread-safe.
 */
public class BananaDecoder {
  private static final Logger log = LoggerFactory.getLogger(BananaDecoder.class);

  private final DecoderOptions options;
  private final TokenDecoder tokens = new TokenDecoder();
  private final ReceivedReferences references = new ReceivedReferences();
  private final RootUnslicer root;
  private final List<Frame> stack = new ArrayList<>();

  // ids of discarded structures whose CLOSE is still expected, innermost first
  private final ArrayDeque<Integer> discarding = new ArrayDeque<>();
  private UnbananaFailure discardFailure;

  private boolean inOpen;
  private int pendingId;
  private List<Object> opentype;
  private boolean bodyPending;
  private boolean dropped;

  public BananaDecoder(ObjectHandler handler) {
    this(handler, new DecoderOptions());
  }

  public BananaDecoder(ObjectHandler handler, DecoderOptions options) {
    this.options = options;
    this.root = new RootUnslicer(options, references, handler);
    stack.add(new Frame(root, -1));
  }

  public void dataReceived(byte[] data) throws BananaError {
    dataReceived(data, 0, data.length);
  }

  /**
   * Process received data. Complete top-level objects are delivered to the {@link ObjectHandler}
   * before this method returns.
   *
   * @throws BananaError if the stream is corrupt or the peer reported an error; the connection
   *     must be dropped
   * @throws IllegalStateException if the connection was already dropped
   */
  public void dataReceived(byte[] data, int offset, int length) throws BananaError {
    if (dropped) {
      throw new IllegalStateException("Can't receive, the connection was dropped");
    }
    tokens.feed(data, offset, length);
    boolean processed = false;
    try {
      process();
      processed = true;
    } catch (BananaError e) {
      e.setLocation(where());
      teardown(e, true);
      throw e;
    } catch (RuntimeException e) {
      BananaError error = new BananaError("Unslicer failed", e);
      error.setLocation(where());
      teardown(error, true);
      throw error;
    } finally {
      // an Error thrown while decoding leaves the stacks inconsistent
      if (!processed && !dropped) {
        teardown(new BananaError("Decoding failed"), true);
      }
    }
  }

  /** The transport lost the connection: fail everything still being received. */
  public void connectionLost(Throwable cause) {
    if (!dropped) {
      log.debug("Connection lost", cause);
      teardown(new BananaError("Connection lost", cause), false);
    }
  }

  public boolean isDropped() {
    return dropped;
  }

  /** Number of structures opened by the peer so far. */
  public int openCount() {
    return references.nextOpenId();
  }

  private void process() throws BananaError {
    while (true) {
      if (bodyPending) {
        if (!tokens.readBody()) {
          return;
        }
        bodyPending = false;
        handleValue(tokens.currentToken());
        continue;
      }
      BananaToken token = tokens.nextToken();
      if (token == BananaToken.NONE) {
        return;
      }
      handleToken(token);
    }
  }

  private void handleToken(BananaToken token) throws BananaError {
    long header = tokens.header();
    if (token.isLong() && header > options.maxTokenSize()) {
      throw new BananaError(token + " token of " + header + " bytes exceeds the limit of " + options.maxTokenSize());
    }
    switch (token) {
      case OPEN:
        handleOpen(header);
        break;
      case CLOSE:
        handleClose(header);
        break;
      case ABORT:
        handleAbort(header);
        break;
      case ERROR:
        if (header > options.maxErrorLength()) {
          throw new RemoteError("(" + header + " bytes, not read)");
        }
        readValue();
        break;
      default:
        handleValueToken(token, header);
        break;
    }
  }

  private void handleValueToken(BananaToken token, long header) throws BananaError {
    if (!discarding.isEmpty()) {
      tokens.skipBody();
      return;
    }
    Frame frame = top();
    try {
      if (inOpen) {
        frame.unslicer.openerCheckToken(token, header, opentype);
      } else {
        frame.unslicer.checkToken(token, header);
      }
    } catch (Violation v) {
      tokens.skipBody();
      if (inOpen) {
        failOpening(v, false);
      } else {
        abandon(failureFor(v, frame.unslicer), false);
      }
      return;
    }
    readValue();
  }

  private void readValue() throws BananaError {
    if (tokens.readBody()) {
      handleValue(tokens.currentToken());
    } else {
      bodyPending = true;
    }
  }

  private void handleValue(BananaToken token) throws BananaError {
    Object value;
    switch (token) {
      case INT:
      case NEG:
        value = tokens.longValue();
        break;
      case LONGINT:
      case LONGNEG:
        value = tokens.bigintValue();
        break;
      case FLOAT:
        value = tokens.doubleValue();
        break;
      case STRING:
        value = tokens.stringValue();
        break;
      case VOCAB:
        value = options.vocabulary().get(tokens.header());
        if (value == null) {
          throw new BananaError("Unknown vocabulary index " + tokens.header());
        }
        break;
      case ERROR:
        throw new RemoteError(tokens.stringValue());
      default:
        throw new IllegalStateException("Token " + token + " carries no value");
    }

    if (inOpen) {
      opentype.add(value);
      open();
      return;
    }
    Frame frame = top();
    try {
      frame.unslicer.receiveChild(value);
    } catch (Violation v) {
      abandon(failureFor(v, frame.unslicer), false);
    }
  }

  private void handleOpen(long id) throws BananaError {
    if (id != references.nextOpenId()) {
      throw lostSync(BananaToken.OPEN, id, references.nextOpenId());
    }
    int openId = references.reserve();
    if (!discarding.isEmpty()) {
      references.abandon(openId, discardFailure);
      discarding.push(openId);
      return;
    }
    if (inOpen) {
      failOpening(new Violation("Open type " + opentype + " interrupted by a structure"), false);
      references.abandon(openId, discardFailure);
      discarding.push(openId);
      return;
    }

    Frame frame = top();
    try {
      if (options.maxRecursionDepth() > 0 && stack.size() > options.maxRecursionDepth()) {
        throw new Violation("Structures nested deeper than " + options.maxRecursionDepth() + " levels");
      }
      frame.unslicer.checkToken(BananaToken.OPEN, id);
    } catch (Violation v) {
      UnbananaFailure failure = failureFor(v, frame.unslicer);
      references.abandon(openId, failure);
      discarding.push(openId);
      discardFailure = failure;
      abandon(failure, false);
      return;
    }

    inOpen = true;
    pendingId = openId;
    opentype = new ArrayList<>();
  }

  private void open() throws BananaError {
    Frame parent = top();
    Unslicer child;
    try {
      child = parent.unslicer.doOpen(opentype);
    } catch (Violation v) {
      failOpening(v, false);
      return;
    }
    if (child == null) {
      return;
    }

    inOpen = false;
    opentype = null;
    stack.add(new Frame(child, pendingId));
    try {
      child.start(pendingId);
    } catch (Violation v) {
      abandon(failureFor(v, child), false);
    }
  }

  private void handleClose(long id) throws BananaError {
    if (!discarding.isEmpty()) {
      int expected = discarding.pop();
      if (id != expected) {
        throw lostSync(BananaToken.CLOSE, id, expected);
      }
      return;
    }
    if (inOpen) {
      if (id != pendingId) {
        throw lostSync(BananaToken.CLOSE, id, pendingId);
      }
      failOpening(new Violation("Structure closed before its open type was complete"), true);
      return;
    }

    Frame frame = top();
    if (frame.unslicer == root) {
      throw new BananaError("CLOSE " + id + " without a matching OPEN");
    }
    if (id != frame.openId) {
      throw lostSync(BananaToken.CLOSE, id, frame.openId);
    }
    Object object;
    try {
      object = frame.unslicer.receiveClose();
    } catch (Violation v) {
      abandon(failureFor(v, frame.unslicer), true);
      return;
    }
    stack.remove(stack.size() - 1);
    frame.unslicer.finish();

    Frame parent = top();
    try {
      parent.unslicer.receiveChild(object);
    } catch (Violation v) {
      abandon(failureFor(v, parent.unslicer), false);
    }
  }

  private void handleAbort(long id) throws BananaError {
    if (!discarding.isEmpty()) {
      if (id != discarding.peek()) {
        throw lostSync(BananaToken.ABORT, id, discarding.peek());
      }
      return;
    }
    Violation violation = new Violation("Structure " + id + " aborted by the sender");
    if (inOpen) {
      if (id != pendingId) {
        throw lostSync(BananaToken.ABORT, id, pendingId);
      }
      failOpening(violation, false);
      return;
    }

    Frame frame = top();
    if (frame.unslicer == root) {
      throw new BananaError("ABORT " + id + " without a matching OPEN");
    }
    if (id != frame.openId) {
      throw lostSync(BananaToken.ABORT, id, frame.openId);
    }
    abandon(failureFor(violation, frame.unslicer), false);
  }

  /**
   * Abandon the structure on top of the stack, and its ancestors for as long as they refuse the
   * failure.
   *
   * @param closeConsumed {@code true} if the CLOSE of the top structure was already processed
   */
  private void abandon(UnbananaFailure failure, boolean closeConsumed) throws BananaError {
    Frame frame = top();
    while (frame.unslicer != root) {
      log.debug("Abandoning structure {}: {}", frame.openId, failure);
      stack.remove(stack.size() - 1);
      if (!closeConsumed) {
        discarding.addLast(frame.openId);
        discardFailure = failure;
      }
      closeConsumed = false;
      frame.unslicer.finish();
      references.abandon(frame.openId, failure);

      frame = top();
      try {
        frame.unslicer.receiveChild(failure);
        return;
      } catch (Violation v) {
        failure = failureFor(v, frame.unslicer);
      }
    }
    root.receiveChild(failure);
  }

  /** The child being opened can't be created: discard it and notify the parent. */
  private void failOpening(Violation violation, boolean closeConsumed) throws BananaError {
    inOpen = false;
    opentype = null;
    Frame parent = top();
    UnbananaFailure failure = failureFor(violation, parent.unslicer);
    log.debug("Refusing structure {}: {}", pendingId, failure);
    references.abandon(pendingId, failure);
    if (!closeConsumed) {
      discarding.push(pendingId);
    }
    discardFailure = failure;

    try {
      parent.unslicer.receiveChild(failure);
    } catch (Violation v) {
      abandon(failureFor(v, parent.unslicer), false);
    }
  }

  private static UnbananaFailure failureFor(Violation violation, Unslicer unslicer) {
    if (violation.failure() != null) {
      return violation.failure();
    }
    violation.setLocation(unslicer.where());
    return new UnbananaFailure(violation, violation.where());
  }

  private static BananaError lostSync(BananaToken token, long id, long expected) {
    return new BananaError("Lost sync: got " + token + " " + id + ", expected " + expected);
  }

  private void teardown(BananaError error, boolean fatal) {
    dropped = true;
    if (fatal) {
      log.error("Dropping connection: {}", error.toString());
    }

    Violation violation = new Violation("Connection dropped: " + error.getMessage());
    violation.setLocation(where());
    UnbananaFailure failure = new UnbananaFailure(violation, violation.where());
    if (inOpen) {
      references.abandon(pendingId, failure);
      inOpen = false;
      opentype = null;
    }
    while (stack.size() > 1) {
      Frame frame = stack.remove(stack.size() - 1);
      frame.unslicer.finish();
      references.abandon(frame.openId, failure);
    }
    references.failPending(failure);
    discarding.clear();
    bodyPending = false;
    tokens.reset();
  }

  private Frame top() {
    return stack.get(stack.size() - 1);
  }

  private String where() {
    return top().unslicer.where();
  }

  private static final class Frame {
    final Unslicer unslicer;
    final int openId;

    Frame(Unslicer unslicer, int openId) {
      this.unslicer = unslicer;
      this.openId = openId;
    }
  }
}
