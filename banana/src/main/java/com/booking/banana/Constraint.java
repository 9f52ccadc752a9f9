package com.booking.banana;

import java.util.List;

/**
 * Schema attached to one position of the structure tree.
 * <p>
 * A constraint validates every token before the receiving {@link Unslicer} accepts it (and before
 * the body of a long token is buffered), and validates the open type of a structure before the
 * {@link Unslicer} for it is created. Constraints are immutable and are shared by all the nodes
 * they validate.
 */
public interface Constraint {
  /**
   * Check if a token is acceptable at this position.
   *
   * @param type token type
   * @param size header of the token: the body length for long tokens, the value for {@code INT}
   *     and {@code NEG}, the structure id for {@code OPEN}
   * @throws Violation if the schema does not accept the token
   * @throws BananaError if the token is not something a constraint can be asked about
   */
  void checkToken(BananaToken type, long size) throws Violation, BananaError;

  /**
   * Check the index tokens received so far for a structure opened at this position.
   * <p>
   * Called with a growing prefix of the open type until the new {@link Unslicer} can be created.
   *
   * @throws Violation if no open type starting with {@code opentype} is acceptable
   */
  void checkOpentype(List<Object> opentype) throws Violation;

  /**
   * The constraint to attach to the {@link Unslicer} created for {@code opentype}.
   * <p>
   * Usually the constraint itself; alternatives pick the one matching the open type.
   */
  Constraint constraintFor(List<Object> opentype) throws Violation;
}
