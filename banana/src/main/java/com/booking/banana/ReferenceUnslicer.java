package com.booking.banana;

/**
 * Receives {@code ("reference",)} followed by the {@code INT} structure id of an object received
 * earlier, or still being received.
 * <p>
 * The referenced object was checked when it was received, so constraints are ignored.
 */
public class ReferenceUnslicer extends BaseUnslicer {
  private Object target;
  private boolean haveTarget;

  @Override
  public void setConstraint(Constraint constraint) {
  }

  @Override
  public void checkToken(BananaToken type, long size) throws Violation {
    if (haveTarget) {
      throw new Violation("Reference takes a single structure id");
    }
    if (type != BananaToken.INT) {
      throw new Violation("Reference expects an INT structure id, got " + type);
    }
  }

  @Override
  public void receiveChild(Object child) throws Violation, BananaError {
    propagateFailure(child);
    long id = (Long) child;
    if (id > Integer.MAX_VALUE) {
      throw new BananaError("Reference to structure id " + id + ", which was never opened");
    }
    Object object = getObject((int) id);
    if (object instanceof Placeholder) {
      Placeholder placeholder = (Placeholder) object;
      if (placeholder.isFailed()) {
        throw new Violation(placeholder.failure());
      }
      if (placeholder.isResolved()) {
        object = placeholder.value();
      }
    }
    target = object;
    haveTarget = true;
  }

  @Override
  public Object receiveClose() throws Violation {
    if (!haveTarget) {
      throw new Violation("Reference closed without a structure id");
    }
    return target;
  }

  @Override
  public String describe() {
    return "<ref>";
  }
}
