package com.booking.banana;

import java.util.List;

/**
 * Common behaviour of the built-in constraints.
 * <p>
 * Every constraint that accepts structures also accepts a {@code ("reference",)} open type: the
 * referenced object was checked when it was first received and is not checked again.
 */
public abstract class BaseConstraint implements Constraint {
  public static final String REFERENCE = "reference";

  @Override
  public final void checkToken(BananaToken type, long size) throws Violation, BananaError {
    if (type == null || type == BananaToken.NONE || type == BananaToken.CLOSE
        || type == BananaToken.ABORT || type == BananaToken.ERROR) {
      throw new BananaError("Constraints can't check " + type + " tokens");
    }
    checkValidToken(type, size);
  }

  /** Check a token known to be a value token or {@code OPEN}. */
  protected abstract void checkValidToken(BananaToken type, long size) throws Violation;

  @Override
  public final void checkOpentype(List<Object> opentype) throws Violation {
    if (isReference(opentype)) {
      return;
    }
    checkOwnOpentype(opentype);
  }

  /** Check an open type other than a reference. Refuses all structures by default. */
  protected void checkOwnOpentype(List<Object> opentype) throws Violation {
    throw new Violation(this + " does not accept structures, got open type " + opentype);
  }

  @Override
  public Constraint constraintFor(List<Object> opentype) throws Violation {
    return this;
  }

  public static boolean isReference(List<Object> opentype) {
    return !opentype.isEmpty() && REFERENCE.equals(opentype.get(0));
  }

  /** Fail unless {@code opentype} is a prefix of {@code expected}. */
  protected void expectOpentype(List<Object> opentype, Object... expected) throws Violation {
    if (opentype.size() > expected.length) {
      throw new Violation(this + " expects an open type of " + expected.length + " index tokens, got " + opentype);
    }
    for (int i = 0; i < opentype.size(); ++i) {
      if (!expected[i].equals(opentype.get(i))) {
        throw new Violation(this + " does not accept open type " + opentype);
      }
    }
  }

  protected void expectToken(BananaToken type, BananaToken expected) throws Violation {
    if (type != expected) {
      throw new Violation(this + " expects " + expected + " tokens, got " + type);
    }
  }

  /** Fail if a long token declares more than {@code maxLength} bytes ({@code 0} means no limit). */
  protected void checkLength(BananaToken type, long size, long maxLength) throws Violation {
    if (maxLength > 0 && size > maxLength) {
      throw new Violation(type + " token too long, " + size + " > " + maxLength);
    }
  }
}
