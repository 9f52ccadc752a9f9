package com.booking.banana;

import java.util.List;

/**
 * Decode-side consumer for one structure.
 * <p>
 * {@link BananaDecoder} keeps a stack of unslicers. The lifecycle of each one is
 * {@code attach, setConstraint, start, (checkToken | openerCheckToken | doOpen | receiveChild)*,
 * receiveClose, finish}; {@link #finish()} is called on every unslicer popped from the stack, also
 * when it was abandoned.
 * <p>
 * A {@link Violation} thrown by any of these methods abandons the unslicer: the rest of its tokens
 * are dropped and its parent receives an {@link UnbananaFailure} instead of the object. A
 * {@link BananaError} drops the connection.
 */
public interface Unslicer {
  /** Called right after the unslicer is created by its parent's {@link #doOpen(List)}. */
  void attach(Unslicer parent);

  /**
   * Attach the constraint selected by the parent. Never called for unconstrained positions.
   *
   * @throws Violation if this unslicer can't honour the constraint
   */
  void setConstraint(Constraint constraint) throws Violation;

  /**
   * The {@code OPEN} token for this structure was processed. Register the object, or a
   * {@link Placeholder} for it, under {@code openId} if it may be the target of references.
   */
  void start(int openId) throws Violation, BananaError;

  /**
   * Validate a token about to be delivered to this unslicer, before its body is read. Called for
   * value tokens and for {@code OPEN}.
   *
   * @param size header of the token, see {@link Constraint#checkToken(BananaToken, long)}
   */
  void checkToken(BananaToken type, long size) throws Violation, BananaError;

  /**
   * Validate an index token of a child being opened, before the child exists. Usually delegated
   * to the root, which owns the open type policy.
   *
   * @param opentype index tokens received so far for the child
   */
  void openerCheckToken(BananaToken type, long size, List<Object> opentype) throws Violation, BananaError;

  /**
   * Create the unslicer for a child.
   *
   * @param opentype index tokens received so far
   * @return the new unslicer, with constraint attached, or {@code null} if more index tokens are
   *     needed to decide
   */
  Unslicer doOpen(List<Object> opentype) throws Violation;

  /**
   * Look up the unslicer factory for an open type. Usually delegated to the root.
   *
   * @return the new unslicer or {@code null} if more index tokens are needed
   */
  Unslicer open(List<Object> opentype) throws Violation;

  /**
   * Accept one child: a decoded value, a finished structure, a pending {@link Placeholder} or an
   * {@link UnbananaFailure}.
   *
   * @throws Violation to abandon this unslicer; to propagate a child failure, throw
   *     {@code new Violation(failure)}
   */
  void receiveChild(Object child) throws Violation, BananaError;

  /**
   * The {@code CLOSE} token for this structure arrived.
   *
   * @return the finished object, or a {@link Placeholder} that will be resolved with it
   */
  Object receiveClose() throws Violation, BananaError;

  /** The unslicer was popped from the stack, whether it completed or not. */
  void finish();

  /** Register the object built for structure {@code openId}. Usually delegated to the root. */
  void setObject(int openId, Object object) throws BananaError;

  /** Look up the object built for structure {@code openId}. Usually delegated to the root. */
  Object getObject(int openId) throws BananaError;

  /** Position of the current child relative to this structure, e.g. {@code [3]}. */
  String describe();

  /** Path from the root to the current child, joining {@link #describe()} of every level. */
  String where();
}
