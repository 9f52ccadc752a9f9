package com.booking.banana;

import java.util.ArrayList;
import java.util.List;

/**
 * Receives {@code ("tuple",)} as an {@code Object[]}.
 * <p>
 * The array can only be created once all elements are known, so a {@link Placeholder} is
 * registered under the structure id instead. It is resolved when the tuple closes, or later if
 * some elements are references to structures that are still open.
 */
public class TupleUnslicer extends BaseUnslicer {
  public static final String OPENTYPE = "tuple";

  private final List<Object> elements = new ArrayList<>();
  private final Placeholder placeholder = new Placeholder();
  private List<Constraint> constraints;
  private int pending;
  private boolean closed;

  @Override
  public void setConstraint(Constraint constraint) throws Violation {
    super.setConstraint(constraint);
    if (constraint instanceof TupleConstraint) {
      constraints = ((TupleConstraint) constraint).elements();
    }
  }

  @Override
  public void start(int openId) throws Violation, BananaError {
    super.start(openId);
    setObject(openId, placeholder);
  }

  @Override
  protected Constraint childConstraint() {
    if (constraints == null) {
      return null;
    }
    Constraint element = constraints.get(elements.size());
    return element instanceof AnyConstraint ? null : element;
  }

  @Override
  public void checkToken(BananaToken type, long size) throws Violation, BananaError {
    if (constraints != null && elements.size() >= constraints.size()) {
      throw new Violation("Tuple is limited to " + constraints.size() + " elements");
    }
    super.checkToken(type, size);
  }

  @Override
  public void receiveChild(Object child) throws Violation {
    propagateFailure(child);
    if (child == placeholder) {
      throw new Violation("Tuple can't contain itself");
    }
    if (child instanceof Placeholder) {
      int index = elements.size();
      elements.add(null);
      pending++;
      ((Placeholder) child).whenResolved(value -> elementResolved(index, value), this::elementFailed);
    } else {
      elements.add(child);
    }
  }

  @Override
  public Object receiveClose() throws Violation {
    if (constraints != null && elements.size() != constraints.size()) {
      throw new Violation("Tuple needs " + constraints.size() + " elements, got " + elements.size());
    }
    closed = true;
    if (pending == 0) {
      Object[] tuple = elements.toArray();
      placeholder.resolve(tuple);
      return tuple;
    }
    return placeholder;
  }

  private void elementResolved(int index, Object value) {
    elements.set(index, value);
    pending--;
    if (closed && pending == 0 && !placeholder.isResolved()) {
      placeholder.resolve(elements.toArray());
    }
  }

  private void elementFailed(UnbananaFailure failure) {
    if (!placeholder.isResolved()) {
      placeholder.fail(failure);
    }
  }

  @Override
  public String describe() {
    return "[" + elements.size() + "]";
  }
}
