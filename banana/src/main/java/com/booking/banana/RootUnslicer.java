package com.booking.banana;

import java.util.List;

/**
 * Bottom of the unslicer stack. Owns the open type policy, the unslicer registry and the
 * reference table, and hands top-level objects to the {@link ObjectHandler}.
 */
public class RootUnslicer implements Unslicer {
  private final DecoderOptions options;
  private final ReceivedReferences references;
  private final ObjectHandler handler;
  private final Constraint topConstraint;

  public RootUnslicer(DecoderOptions options, ReceivedReferences references, ObjectHandler handler) {
    this.options = options;
    this.references = references;
    this.handler = handler;
    this.topConstraint = options.topConstraint() instanceof AnyConstraint ? null : options.topConstraint();
  }

  @Override
  public void attach(Unslicer parent) {
    throw new IllegalStateException("RootUnslicer can't have a parent");
  }

  @Override
  public void setConstraint(Constraint constraint) {
    throw new IllegalStateException("RootUnslicer takes its constraint from DecoderOptions");
  }

  @Override
  public void start(int openId) {
    throw new IllegalStateException("RootUnslicer is never opened");
  }

  @Override
  public void checkToken(BananaToken type, long size) throws Violation, BananaError {
    if (topConstraint != null) {
      topConstraint.checkToken(type, size);
    }
  }

  @Override
  public void openerCheckToken(BananaToken type, long size, List<Object> opentype) throws Violation {
    if (type != BananaToken.STRING && type != BananaToken.VOCAB) {
      throw new Violation("Index tokens must be strings, got " + type);
    }
    if (type == BananaToken.STRING && size > options.maxIndexLength()) {
      throw new Violation("Index token too long, " + size + " > " + options.maxIndexLength());
    }
    if (opentype.size() >= options.maxOpentypeLength()) {
      throw new Violation("Open type " + opentype + " is too long");
    }
  }

  @Override
  public Unslicer doOpen(List<Object> opentype) throws Violation {
    if (topConstraint != null) {
      topConstraint.checkOpentype(opentype);
    }
    Unslicer unslicer = open(opentype);
    if (unslicer != null) {
      unslicer.attach(this);
      if (topConstraint != null) {
        unslicer.setConstraint(topConstraint.constraintFor(opentype));
      }
    }
    return unslicer;
  }

  @Override
  public Unslicer open(List<Object> opentype) throws Violation {
    Object name = opentype.get(0);
    UnslicerFactory factory = options.unslicerRegistry().factoryFor((String) name);
    if (factory == null) {
      throw new Violation("Unknown open type " + opentype);
    }
    return factory.createUnslicer(opentype);
  }

  @Override
  public void receiveChild(Object child) {
    if (child instanceof UnbananaFailure) {
      handler.receivedFailure((UnbananaFailure) child);
    } else if (child instanceof Placeholder) {
      ((Placeholder) child).whenResolved(handler::receivedObject, handler::receivedFailure);
    } else {
      handler.receivedObject(child);
    }
  }

  @Override
  public Object receiveClose() throws BananaError {
    throw new BananaError("CLOSE without OPEN");
  }

  @Override
  public void finish() {
  }

  @Override
  public void setObject(int openId, Object object) throws BananaError {
    references.setObject(openId, object);
  }

  @Override
  public Object getObject(int openId) throws BananaError {
    return references.getObject(openId);
  }

  @Override
  public String describe() {
    return "<root>";
  }

  @Override
  public String where() {
    return describe();
  }
}
