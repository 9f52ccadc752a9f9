package com.booking.banana;

/**
 * Default {@link Slicer} behaviour: wrapped in {@code OPEN}/{@code CLOSE}, not tracked, not
 * streamable, reference registration and tasting delegated to the parent, aborted children abort
 * this slicer too.
 */
public abstract class BaseSlicer implements Slicer {
  private Slicer parent;

  @Override
  public void attach(Slicer parent) {
    this.parent = parent;
  }

  public Slicer parent() {
    return parent;
  }

  @Override
  public boolean sendOpen() {
    return true;
  }

  @Override
  public boolean trackReferences() {
    return false;
  }

  @Override
  public boolean streamable() {
    return false;
  }

  @Override
  public void registerReference(int openId, Object object) throws BananaError {
    parent.registerReference(openId, object);
  }

  @Override
  public void childAborted(Violation violation) throws Violation {
    throw violation;
  }

  @Override
  public Slicer slicerForObject(Object object) throws Violation {
    return parent.slicerForObject(object);
  }

  @Override
  public String describe() {
    return "?";
  }
}
