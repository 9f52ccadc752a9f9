package com.booking.banana;

import java.util.List;

/**
 * Accepts a {@code ("dict",)} structure of at most {@code maxKeys} entries.
 */
public class DictConstraint extends BaseConstraint {
  public static final int DEFAULT_MAX_KEYS = 30;

  private final Constraint key;
  private final Constraint value;
  private final int maxKeys;

  public DictConstraint(Constraint key, Constraint value) {
    this(key, value, DEFAULT_MAX_KEYS);
  }

  /** @param maxKeys maximum number of entries, {@code 0} for no limit */
  public DictConstraint(Constraint key, Constraint value, int maxKeys) {
    this.key = key;
    this.value = value;
    this.maxKeys = maxKeys;
  }

  public Constraint key() {
    return key;
  }

  public Constraint value() {
    return value;
  }

  public int maxKeys() {
    return maxKeys;
  }

  @Override
  protected void checkValidToken(BananaToken type, long size) throws Violation {
    expectToken(type, BananaToken.OPEN);
  }

  @Override
  protected void checkOwnOpentype(List<Object> opentype) throws Violation {
    expectOpentype(opentype, DictUnslicer.OPENTYPE);
  }

  @Override
  public String toString() {
    return "Dict(" + key + ": " + value + ", maxKeys=" + maxKeys + ")";
  }
}
