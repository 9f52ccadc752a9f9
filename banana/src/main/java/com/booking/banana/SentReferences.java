package com.booking.banana;

import com.booking.banana.impl.IdentityMap;

/**
 * Encode-side reference table: which structure id each already-sent object was opened under.
 * <p>
 * Ids are assigned from the cumulative count of {@code OPEN} tokens sent over the connection; 0 is
 * the first structure ever opened.
 */
public class SentReferences {
  private final IdentityMap tracked = new IdentityMap();
  private int openCount;

  /** Assign the id for the next {@code OPEN} token. */
  public int nextOpenId() {
    return openCount++;
  }

  /** Number of structures opened so far. */
  public int openCount() {
    return openCount;
  }

  /**
   * Structure id under which {@code object} was sent.
   *
   * @return the id, or {@code -1} if the object was never registered
   */
  public int idFor(Object object) {
    return tracked.get(object);
  }

  /**
   * Remember that {@code object} was sent as structure {@code openId}.
   *
   * @throws BananaError if the id was never opened or the object is already registered: both
   *     mean the slicer stack lost track of what it sent
   */
  public void register(int openId, Object object) throws BananaError {
    if (openId < 0 || openId >= openCount) {
      throw new BananaError("Can't register object under structure id " + openId + ", only " + openCount + " were opened");
    }
    int previous = tracked.put(object, openId);
    if (previous != IdentityMap.NOT_FOUND) {
      tracked.put(object, previous);
      throw new BananaError("Object already registered as structure " + previous + ", can't register it again as " + openId);
    }
  }

  /** Number of registered objects. */
  public int size() {
    return tracked.size();
  }

  /** Forget all registered objects. Ids keep increasing. */
  public void clear() {
    tracked.clear();
  }
}
