package com.booking.banana;

import com.booking.banana.impl.RefIdMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Decode-side reference table: the object, or {@link Placeholder}, built for each structure id.
 * <p>
 * An id is reserved for every {@code OPEN} token received, including the ones inside discarded
 * sub-trees, so both sides keep counting in step.
 */
public class ReceivedReferences {
  private final RefIdMap tracked = new RefIdMap();
  private final Set<Placeholder> pending = Collections.newSetFromMap(new IdentityHashMap<>());
  private int openCount;

  /** Reserve the id of the {@code OPEN} token that just arrived. */
  public int reserve() {
    return openCount++;
  }

  /** The id the next {@code OPEN} token must carry. */
  public int nextOpenId() {
    return openCount;
  }

  /** Register the object (or placeholder) built under {@code openId}. */
  public void setObject(int openId, Object object) throws BananaError {
    if (openId < 0 || openId >= openCount) {
      throw new BananaError("Can't register object under structure id " + openId + ", it was never opened");
    }
    tracked.put(openId, object);
    if (object instanceof Placeholder && !((Placeholder) object).isResolved()) {
      Placeholder placeholder = (Placeholder) object;
      pending.add(placeholder);
      placeholder.whenResolved(value -> pending.remove(placeholder), failure -> pending.remove(placeholder));
    }
  }

  /**
   * Look up the target of a reference.
   *
   * @return the object, or a {@link Placeholder} that may still be pending or may have failed
   * @throws BananaError if the id was never opened, or was opened by a structure that is not
   *     referenceable
   */
  public Object getObject(int openId) throws BananaError {
    if (openId < 0 || openId >= openCount) {
      throw new BananaError("Reference to structure id " + openId + ", which was never opened");
    }
    Object object = tracked.get(openId);
    if (object == RefIdMap.NOT_FOUND) {
      throw new BananaError("Reference to structure id " + openId + ", which is not referenceable");
    }
    return object;
  }

  /**
   * Record that the structure opened as {@code openId} could not be built.
   * <p>
   * A pending placeholder registered under the id is failed; anything else registered there is
   * replaced by a failed placeholder so later references see the failure.
   */
  public void abandon(int openId, UnbananaFailure failure) {
    Object object = tracked.get(openId);
    if (object instanceof Placeholder) {
      Placeholder placeholder = (Placeholder) object;
      if (!placeholder.isResolved()) {
        placeholder.fail(failure);
      }
      return;
    }
    tracked.put(openId, Placeholder.failed(failure));
  }

  /**
   * Fail every registered placeholder that is still pending, including those of structures that
   * closed but wait for each other.
   */
  public void failPending(UnbananaFailure failure) {
    for (Placeholder placeholder : new ArrayList<>(pending)) {
      if (!placeholder.isResolved()) {
        placeholder.fail(failure);
      }
    }
    pending.clear();
  }

  /** Number of registered structures. */
  public int size() {
    return tracked.size();
  }
}
