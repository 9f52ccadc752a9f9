package com.booking.banana;

import java.util.List;

/**
 * Accepts any legal token and any open type.
 * <p>
 * An {@link Unslicer} with this constraint behaves as unconstrained: nothing bounds the memory it
 * may consume besides {@link DecoderOptions#maxTokenSize()}.
 */
public final class AnyConstraint extends BaseConstraint {
  public static final AnyConstraint INSTANCE = new AnyConstraint();

  private AnyConstraint() {
  }

  @Override
  protected void checkValidToken(BananaToken type, long size) {
  }

  @Override
  protected void checkOwnOpentype(List<Object> opentype) {
  }

  @Override
  public String toString() {
    return "Any";
  }
}
