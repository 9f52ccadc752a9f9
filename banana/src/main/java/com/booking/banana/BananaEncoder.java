package com.booking.banana;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The slicer stack: turns objects into Banana tokens and writes them to an {@link OutputStream}.
 * <p>
 * Objects passed to {@link #send(Object)} are sent one after the other. For each of them the
 * encoder walks the graph with a stack of {@link Slicer}s, assigning a structure id to every
 * {@code OPEN} it emits and replacing objects already sent over this connection with references.
 * <p>
 * A {@link Violation} (a slicer refusing an object, for example) aborts the current structure: an
 * {@code ABORT} and a {@code CLOSE} are sent, the parent is notified and may abort in turn. A
 * {@link BananaError} drops the connection: an {@code ERROR} token is sent if possible and every
 * pending object fails.
 * <p>
 * Production stops while a streamable slicer waits for a {@link CompletionStage}, and resumes on
 * the thread completing it. All public methods are synchronized.
 */
public class BananaEncoder {
  private static final Logger log = LoggerFactory.getLogger(BananaEncoder.class);

  private final EncoderOptions options;
  private final OutputStream out;
  private final TokenEncoder tokens = new TokenEncoder();
  private final SentReferences references = new SentReferences();
  private final RootSlicer root;
  private final List<Frame> stack = new ArrayList<>();
  private final ArrayDeque<PendingObject> queue = new ArrayDeque<>();

  private PendingObject current;
  private boolean producing;
  private boolean paused;
  private boolean dropped;
  private boolean resumePending;
  private Frame resumeFrame;
  private Object resumeValue;
  private BananaError dropError;
  private final List<Consumer<BananaError>> dropListeners = new ArrayList<>();

  public BananaEncoder(OutputStream out) {
    this(out, new EncoderOptions());
  }

  public BananaEncoder(OutputStream out, EncoderOptions options) {
    this.options = options;
    this.out = out;
    this.root = new RootSlicer(references, options.slicerRegistry(), options.allowStreaming());
    stack.add(new Frame(root, -1, true, options.allowStreaming()));
  }

  /**
   * Queue an object for sending.
   *
   * @return completes when the last token of the object was written, fails with the
   *     {@link Violation} that aborted it or with the {@link BananaError} that dropped the connection
   * @throws IllegalStateException if the connection was dropped
   */
  public synchronized CompletableFuture<Void> send(Object object) {
    if (dropped) {
      throw new IllegalStateException("Can't send, the connection was dropped");
    }
    PendingObject pending = new PendingObject(object);
    queue.add(pending);
    produce();
    return pending.future;
  }

  /** The transport lost the connection: abandon every object being sent. */
  public synchronized void connectionLost(Throwable cause) {
    log.debug("Connection lost", cause);
    teardown(new BananaError("Connection lost", cause), false);
  }

  /** Drop the connection after telling the peer why with an {@code ERROR} token. */
  public synchronized void dropConnection(BananaError error) {
    teardown(error, true);
  }

  /**
   * Run {@code listener} with the error once the connection is dropped, or immediately if it
   * already was.
   */
  public synchronized void whenDropped(Consumer<BananaError> listener) {
    if (dropped) {
      listener.accept(dropError);
    } else {
      dropListeners.add(listener);
    }
  }

  public synchronized boolean isDropped() {
    return dropped;
  }

  /** Number of structures opened over this connection so far. */
  public synchronized int openCount() {
    return references.openCount();
  }

  private void produce() {
    if (producing || dropped) {
      return;
    }
    producing = true;
    try {
      while (!dropped) {
        if (resumePending) {
          Frame frame = resumeFrame;
          Object value = resumeValue;
          resumePending = false;
          resumeFrame = null;
          resumeValue = null;
          handleItem(frame, value);
          continue;
        }
        if (paused) {
          break;
        }
        Frame top = top();
        if (top.slicer == root) {
          current = queue.poll();
          if (current == null) {
            break;
          }
          handleItem(top, current.object);
          continue;
        }
        step(top);
      }
      flush();
    } catch (BananaError e) {
      teardown(e, true);
    } finally {
      producing = false;
    }
  }

  private void step(Frame frame) throws BananaError {
    Object item;
    try {
      if (!frame.items.hasNext()) {
        close(frame);
        return;
      }
      item = frame.items.next();
    } catch (Violation v) {
      abort(frame, v);
      return;
    } catch (RuntimeException e) {
      throw new BananaError("Slicer failed at " + where(), e);
    }
    handleItem(frame, item);
  }

  private void handleItem(Frame frame, Object item) throws BananaError {
    try {
      if (item instanceof CompletionStage) {
        suspend(frame, (CompletionStage<?>) item);
      } else if (sendValue(item)) {
        if (frame.slicer == root) {
          completeCurrent();
        }
      } else {
        push(frame, frame.slicer.slicerForObject(item), item);
      }
    } catch (Violation v) {
      abort(frame, v);
    } catch (RuntimeException e) {
      throw new BananaError("Slicer failed at " + where(), e);
    }
  }

  private boolean sendValue(Object item) throws Violation {
    if (item instanceof String) {
      String string = (String) item;
      int index = options.vocabulary().indexOf(string);
      if (index >= 0) {
        tokens.appendVocab(index);
      } else {
        tokens.appendString(string);
      }
    } else if (item instanceof Long || item instanceof Integer || item instanceof Short || item instanceof Byte) {
      tokens.appendInt(((Number) item).longValue());
    } else if (item instanceof BigInteger) {
      tokens.appendBigInteger((BigInteger) item);
    } else if (item instanceof Double || item instanceof Float) {
      tokens.appendFloat(((Number) item).doubleValue());
    } else {
      return false;
    }
    return true;
  }

  private void push(Frame parent, Slicer child, Object object) throws Violation, BananaError {
    if (options.maxRecursionDepth() > 0 && stack.size() > options.maxRecursionDepth()) {
      throw new Violation("Object nested deeper than " + options.maxRecursionDepth() + " levels");
    }
    child.attach(parent.slicer);
    int openId = -1;
    if (child.sendOpen()) {
      openId = references.nextOpenId();
      tokens.appendOpen(openId);
    }
    boolean chainAllows = parent.chainAllows && parent.slicer.streamable();
    Frame frame = new Frame(child, openId, chainAllows, chainAllows && child.streamable());
    stack.add(frame);

    try {
      // before any child is sliced, so children can refer back to this object
      if (child.trackReferences()) {
        if (openId < 0) {
          throw new BananaError("Slicer " + child.getClass().getName() + " tracks references but sends no OPEN");
        }
        child.registerReference(openId, object);
      }
      frame.items = child.slice(frame.canSuspend, this);
    } catch (Violation v) {
      abort(frame, v);
    }
  }

  private void close(Frame frame) {
    if (frame.slicer.sendOpen()) {
      tokens.appendClose(frame.openId);
    }
    stack.remove(stack.size() - 1);
    if (top().slicer == root) {
      completeCurrent();
    }
  }

  private void abort(Frame frame, Violation violation) throws BananaError {
    violation.setLocation(where());
    while (frame.slicer != root) {
      log.debug("Aborting structure {}: {}", frame.openId, violation);
      if (frame.slicer.sendOpen()) {
        tokens.appendAbort(frame.openId);
        tokens.appendClose(frame.openId);
      }
      stack.remove(stack.size() - 1);
      Frame parent = top();
      if (!frame.slicer.sendOpen()) {
        // nothing told the receiver, so the parent can't carry on
        frame = parent;
        continue;
      }
      try {
        parent.slicer.childAborted(violation);
        return;
      } catch (Violation v) {
        v.setLocation(where());
        violation = v;
        frame = parent;
      } catch (RuntimeException e) {
        throw new BananaError("Slicer failed at " + where(), e);
      }
    }
    failCurrent(violation);
  }

  private void suspend(Frame frame, CompletionStage<?> stage) throws BananaError {
    if (!frame.canSuspend) {
      throw new BananaError("Slicer " + frame.slicer.getClass().getName() + " tried to suspend at " + where()
          + ", but streaming is not allowed there");
    }
    paused = true;
    log.trace("Suspending at {}", where());
    stage.whenComplete((value, error) -> resume(frame, value, error));
  }

  private synchronized void resume(Frame frame, Object value, Throwable error) {
    if (dropped) {
      return;
    }
    paused = false;
    if (error != null) {
      teardown(new BananaError("Value awaited at " + where() + " failed", error), true);
      return;
    }
    log.trace("Resuming at {}", where());
    resumePending = true;
    resumeFrame = frame;
    resumeValue = value;
    produce();
  }

  private void completeCurrent() {
    if (current != null) {
      PendingObject done = current;
      current = null;
      done.future.complete(null);
    }
  }

  private void failCurrent(Violation violation) {
    log.debug("Could not send object: {}", violation.toString());
    if (current != null) {
      PendingObject failed = current;
      current = null;
      failed.future.completeExceptionally(violation);
    }
  }

  private void flush() {
    if (tokens.size() == 0 || dropped) {
      return;
    }
    try {
      tokens.writeTo(out);
      out.flush();
      tokens.reset();
    } catch (IOException e) {
      tokens.reset();
      log.debug("Write failed", e);
      teardown(new BananaError("Write failed", e), false);
    }
  }

  private void teardown(BananaError error, boolean sendError) {
    if (dropped) {
      return;
    }
    dropped = true;
    dropError = error;
    paused = false;
    resumePending = false;
    resumeFrame = null;
    resumeValue = null;

    if (sendError) {
      log.error("Dropping connection: {}", error.toString(), error);
      tokens.appendError(error.getMessage() == null ? "" : error.getMessage());
      try {
        tokens.writeTo(out);
        out.flush();
      } catch (IOException e) {
        log.debug("Could not send ERROR token", e);
      }
    }
    tokens.reset();
    stack.subList(1, stack.size()).clear();

    if (current != null) {
      current.future.completeExceptionally(error);
      current = null;
    }
    for (PendingObject pending : queue) {
      pending.future.completeExceptionally(error);
    }
    queue.clear();

    for (Consumer<BananaError> listener : dropListeners) {
      listener.accept(error);
    }
    dropListeners.clear();
  }

  private Frame top() {
    return stack.get(stack.size() - 1);
  }

  private String where() {
    StringBuilder path = new StringBuilder();
    for (Frame frame : stack) {
      if (path.length() > 0) {
        path.append('.');
      }
      path.append(frame.slicer.describe());
    }
    return path.toString();
  }

  private static final class Frame {
    final Slicer slicer;
    final int openId;
    // every ancestor is streamable
    final boolean chainAllows;
    final boolean canSuspend;
    SliceSequence items;

    Frame(Slicer slicer, int openId, boolean chainAllows, boolean canSuspend) {
      this.slicer = slicer;
      this.openId = openId;
      this.chainAllows = chainAllows;
      this.canSuspend = canSuspend;
    }
  }

  private static final class PendingObject {
    final Object object;
    final CompletableFuture<Void> future = new CompletableFuture<>();

    PendingObject(Object object) {
      this.object = object;
    }
  }
}
