package com.booking.banana;

/**
 * Bottom of the slicer stack. Owns the reference table and the taster used by every slicer that
 * delegates to its parent.
 */
public class RootSlicer implements Slicer {
  private final SentReferences references;
  private final SlicerRegistry registry;
  private final boolean streamable;

  public RootSlicer(SentReferences references, SlicerRegistry registry, boolean streamable) {
    this.references = references;
    this.registry = registry;
    this.streamable = streamable;
  }

  @Override
  public void attach(Slicer parent) {
    throw new IllegalStateException("RootSlicer can't have a parent");
  }

  @Override
  public boolean sendOpen() {
    return false;
  }

  @Override
  public boolean trackReferences() {
    return false;
  }

  @Override
  public boolean streamable() {
    return streamable;
  }

  /** Top-level objects are fed by {@link BananaEncoder#send(Object)}, not by the root itself. */
  @Override
  public SliceSequence slice(boolean streamable, BananaEncoder encoder) {
    throw new UnsupportedOperationException("RootSlicer is not sliced");
  }

  @Override
  public void registerReference(int openId, Object object) throws BananaError {
    references.register(openId, object);
  }

  @Override
  public void childAborted(Violation violation) throws Violation {
    throw violation;
  }

  @Override
  public Slicer slicerForObject(Object object) throws Violation {
    if (object == null) {
      return new NoneSlicer();
    }
    int openId = references.idFor(object);
    if (openId >= 0) {
      return new ReferenceSlicer(openId);
    }
    SlicerFactory factory = registry.factoryFor(object);
    if (factory == null) {
      throw new Violation("Can't send objects of " + object.getClass().getName());
    }
    return factory.createSlicer(object);
  }

  @Override
  public String describe() {
    return "<root>";
  }
}
