package com.booking.banana;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link Unslicer} behaviour: open type policy, factories and the reference table are
 * reached through the parent, tokens are checked against {@link #childConstraint()}.
 */
public abstract class BaseUnslicer implements Unslicer {
  private static final Logger log = LoggerFactory.getLogger(BaseUnslicer.class);

  private Unslicer parent;
  private Constraint constraint;
  protected int openId = -1;

  @Override
  public void attach(Unslicer parent) {
    this.parent = parent;
  }

  public Unslicer parent() {
    return parent;
  }

  @Override
  public void setConstraint(Constraint constraint) throws Violation {
    this.constraint = constraint instanceof AnyConstraint ? null : constraint;
  }

  /** The constraint of this structure, {@code null} if unconstrained. */
  public Constraint constraint() {
    return constraint;
  }

  @Override
  public void start(int openId) throws Violation, BananaError {
    this.openId = openId;
  }

  /** Constraint for the next child, {@code null} if unconstrained. */
  protected Constraint childConstraint() {
    return null;
  }

  @Override
  public void checkToken(BananaToken type, long size) throws Violation, BananaError {
    Constraint child = childConstraint();
    if (child != null) {
      child.checkToken(type, size);
    }
  }

  @Override
  public void openerCheckToken(BananaToken type, long size, List<Object> opentype) throws Violation, BananaError {
    parent.openerCheckToken(type, size, opentype);
  }

  @Override
  public Unslicer doOpen(List<Object> opentype) throws Violation {
    Constraint child = childConstraint();
    if (child != null) {
      child.checkOpentype(opentype);
    }
    Unslicer unslicer = open(opentype);
    if (unslicer != null) {
      unslicer.attach(this);
      if (child != null) {
        unslicer.setConstraint(child.constraintFor(opentype));
      }
    }
    return unslicer;
  }

  @Override
  public Unslicer open(List<Object> opentype) throws Violation {
    return parent.open(opentype);
  }

  /**
   * Run {@code fill} with the value of {@code placeholder} once it resolves. If it fails, the
   * structure it stands for was abandoned and {@code fill} gets its {@link UnbananaFailure}.
   */
  protected void fillWhenResolved(Placeholder placeholder, Consumer<Object> fill) {
    String slot = where();
    placeholder.whenResolved(fill, failure -> {
      log.debug("Filling {} with {}", slot, failure);
      fill.accept(failure);
    });
  }

  /**
   * Refuse lists, dicts and sets where {@code child} is about to be hashed: the peer can make them
   * contain themselves, or fill them after they were hashed.
   */
  protected static void checkHashable(Object child, String role) throws Violation {
    if (child instanceof List || child instanceof Map || child instanceof Set) {
      throw new Violation(role + " can't be containers, got " + child.getClass().getSimpleName());
    }
  }

  /** Throw if {@code child} is a failure, so it propagates to the parent. */
  protected static void propagateFailure(Object child) throws Violation {
    if (child instanceof UnbananaFailure) {
      throw new Violation((UnbananaFailure) child);
    }
  }

  @Override
  public void finish() {
  }

  @Override
  public void setObject(int openId, Object object) throws BananaError {
    parent.setObject(openId, object);
  }

  @Override
  public Object getObject(int openId) throws BananaError {
    return parent.getObject(openId);
  }

  @Override
  public String describe() {
    return "?";
  }

  @Override
  public String where() {
    return parent.where() + "." + describe();
  }
}
