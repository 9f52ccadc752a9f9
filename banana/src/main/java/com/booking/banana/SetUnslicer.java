package com.booking.banana;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Receives {@code ("set",)} as a {@link LinkedHashSet}. Elements must be complete objects, a
 * pending reference can't be hashed.
 */
public class SetUnslicer extends BaseUnslicer {
  public static final String OPENTYPE = "set";

  private final Set<Object> set = new LinkedHashSet<>();
  private Constraint element;
  private int maxLength;

  @Override
  public void setConstraint(Constraint constraint) throws Violation {
    super.setConstraint(constraint);
    if (constraint instanceof SetConstraint) {
      SetConstraint setConstraint = (SetConstraint) constraint;
      element = setConstraint.element();
      maxLength = setConstraint.maxLength();
    }
  }

  @Override
  public void start(int openId) throws Violation, BananaError {
    super.start(openId);
    setObject(openId, set);
  }

  @Override
  protected Constraint childConstraint() {
    return element instanceof AnyConstraint ? null : element;
  }

  @Override
  public void checkToken(BananaToken type, long size) throws Violation, BananaError {
    if (maxLength > 0 && set.size() >= maxLength) {
      throw new Violation("Set is limited to " + maxLength + " elements");
    }
    super.checkToken(type, size);
  }

  @Override
  public void receiveChild(Object child) throws Violation {
    propagateFailure(child);
    if (child instanceof Placeholder) {
      throw new Violation("Set elements can't be references to unfinished structures");
    }
    checkHashable(child, "Set elements");
    if (!set.add(child)) {
      throw new Violation("Duplicate set element " + child);
    }
  }

  @Override
  public Object receiveClose() {
    return set;
  }

  @Override
  public String describe() {
    return "<set>";
  }
}
