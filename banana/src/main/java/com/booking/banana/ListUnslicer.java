package com.booking.banana;

import java.util.ArrayList;
import java.util.List;

/**
 * Receives {@code ("list",)} as an {@link ArrayList}. Registered under its structure id as soon as
 * it starts, so elements can refer back to it.
 * <p>
 * An element that is still pending is {@code null} until it resolves. If it fails, the slot holds
 * the {@link UnbananaFailure} instead, even when the list was already delivered.
 */
public class ListUnslicer extends BaseUnslicer {
  public static final String OPENTYPE = "list";

  private final List<Object> list = new ArrayList<>();
  private Constraint element;
  private int maxLength;

  @Override
  public void setConstraint(Constraint constraint) throws Violation {
    super.setConstraint(constraint);
    if (constraint instanceof ListConstraint) {
      ListConstraint listConstraint = (ListConstraint) constraint;
      element = listConstraint.element();
      maxLength = listConstraint.maxLength();
    }
  }

  @Override
  public void start(int openId) throws Violation, BananaError {
    super.start(openId);
    setObject(openId, list);
  }

  @Override
  protected Constraint childConstraint() {
    return element instanceof AnyConstraint ? null : element;
  }

  @Override
  public void checkToken(BananaToken type, long size) throws Violation, BananaError {
    if (maxLength > 0 && list.size() >= maxLength) {
      throw new Violation("List is limited to " + maxLength + " elements");
    }
    super.checkToken(type, size);
  }

  @Override
  public void receiveChild(Object child) throws Violation {
    propagateFailure(child);
    if (child instanceof Placeholder) {
      int index = list.size();
      list.add(null);
      fillWhenResolved((Placeholder) child, value -> list.set(index, value));
    } else {
      list.add(child);
    }
  }

  @Override
  public Object receiveClose() {
    return list;
  }

  @Override
  public String describe() {
    return "[" + list.size() + "]";
  }
}
