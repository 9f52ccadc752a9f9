package com.booking.banana;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Accepts what any of its alternatives accepts.
 * <p>
 * For a structure, the first alternative accepting the complete open type becomes the constraint
 * of the new {@link Unslicer}.
 */
public class ChoiceConstraint extends BaseConstraint {
  private final List<Constraint> alternatives;

  public ChoiceConstraint(Constraint... alternatives) {
    if (alternatives.length == 0) {
      throw new IllegalArgumentException("ChoiceConstraint needs at least one alternative");
    }
    this.alternatives = Collections.unmodifiableList(Arrays.asList(alternatives.clone()));
  }

  public List<Constraint> alternatives() {
    return alternatives;
  }

  @Override
  protected void checkValidToken(BananaToken type, long size) throws Violation {
    List<String> refusals = new ArrayList<>();
    for (Constraint alternative : alternatives) {
      try {
        alternative.checkToken(type, size);
        return;
      } catch (Violation | BananaError e) {
        refusals.add(e.getMessage());
      }
    }
    throw new Violation(type + " token does not match any alternative: " + refusals);
  }

  @Override
  protected void checkOwnOpentype(List<Object> opentype) throws Violation {
    List<String> refusals = new ArrayList<>();
    if (firstAccepting(opentype, refusals) == null) {
      throw new Violation("Open type " + opentype + " does not match any alternative: " + refusals);
    }
  }

  @Override
  public Constraint constraintFor(List<Object> opentype) throws Violation {
    if (isReference(opentype)) {
      return this;
    }
    List<String> refusals = new ArrayList<>();
    Constraint alternative = firstAccepting(opentype, refusals);
    if (alternative == null) {
      throw new Violation("Open type " + opentype + " does not match any alternative: " + refusals);
    }
    return alternative.constraintFor(opentype);
  }

  private Constraint firstAccepting(List<Object> opentype, List<String> refusals) {
    for (Constraint alternative : alternatives) {
      try {
        alternative.checkToken(BananaToken.OPEN, 0);
        alternative.checkOpentype(opentype);
        return alternative;
      } catch (Violation | BananaError e) {
        refusals.add(e.getMessage());
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "Choice" + alternatives;
  }
}
