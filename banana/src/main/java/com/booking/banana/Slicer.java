package com.booking.banana;

/**
 * Encode-side producer for one node of the object graph.
 * <p>
 * {@link BananaEncoder} keeps a stack of slicers. When a slicer is pushed, the encoder emits
 * {@code OPEN} (if {@link #sendOpen()}), registers the object for reference compression (if
 * {@link #trackReferences()}), then pulls items from {@link #slice(boolean, BananaEncoder)} until
 * the sequence ends and emits {@code CLOSE}.
 */
public interface Slicer {
  /** Called when the slicer is pushed on the stack, before any other method. */
  void attach(Slicer parent);

  /** {@code true} if the body is wrapped in {@code OPEN}/{@code CLOSE}; {@code false} only for the root. */
  boolean sendOpen();

  /** {@code true} if the object must be registered so later sightings are sent as references. */
  boolean trackReferences();

  /** {@code true} if the items of this slicer may suspend production. */
  boolean streamable();

  /**
   * Start producing the index and body items of this node.
   *
   * @param streamable {@code true} if this slicer may yield a
   *     {@link java.util.concurrent.CompletionStage}: it and all its ancestors are streamable
   * @throws Violation if the object can't be sliced, an {@code ABORT} token is sent
   */
  SliceSequence slice(boolean streamable, BananaEncoder encoder) throws Violation;

  /**
   * Register {@code object} as sent under {@code openId}. Usually delegated to the root.
   *
   * @throws BananaError never a {@link Violation}: a failure here means the reference tables can no
   *     longer be trusted
   */
  void registerReference(int openId, Object object) throws BananaError;

  /**
   * A child ended its token stream with {@code ABORT}.
   *
   * @throws Violation to abort this slicer as well
   */
  void childAborted(Violation violation) throws Violation;

  /**
   * Select the slicer for a child object. This is the taster: it is where policy refuses to send an
   * object, without looking any further into it.
   *
   * @throws Violation if the object must not be sent
   */
  Slicer slicerForObject(Object object) throws Violation;

  /** Position of the current child relative to this node, e.g. {@code [3]}. */
  String describe();
}
