package com.booking.banana.jackson;

import com.booking.banana.AnyConstraint;
import com.booking.banana.BananaToken;
import com.booking.banana.BaseConstraint;
import com.booking.banana.Constraint;
import com.booking.banana.Violation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accepts an {@code ("instance", className)} structure for exactly one bean class.
 * <p>
 * When property constraints are given, only those properties may be received and each value is
 * checked by its constraint; otherwise any property of the class is accepted, unconstrained.
 */
public class InstanceConstraint extends BaseConstraint {
  public static final int DEFAULT_MAX_PROPERTIES = 30;

  private final Class<?> type;
  private final Map<String, Constraint> properties;
  private final int maxProperties;

  public InstanceConstraint(Class<?> type) {
    this(type, Collections.<String, Constraint>emptyMap(), DEFAULT_MAX_PROPERTIES);
  }

  public InstanceConstraint(Class<?> type, Map<String, Constraint> properties) {
    this(type, properties, DEFAULT_MAX_PROPERTIES);
  }

  /** @param maxProperties maximum number of properties, {@code 0} for no limit */
  public InstanceConstraint(Class<?> type, Map<String, Constraint> properties, int maxProperties) {
    this.type = type;
    this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    this.maxProperties = maxProperties;
  }

  public Class<?> type() {
    return type;
  }

  public int maxProperties() {
    return maxProperties;
  }

  /**
   * Constraint for the value of {@code property}.
   *
   * @throws Violation if property constraints were given and {@code property} is not one of them
   */
  public Constraint propertyConstraint(String property) throws Violation {
    if (properties.isEmpty()) {
      return AnyConstraint.INSTANCE;
    }
    Constraint constraint = properties.get(property);
    if (constraint == null) {
      throw new Violation("Property " + property + " of " + type.getName() + " is not allowed");
    }
    return constraint;
  }

  @Override
  protected void checkValidToken(BananaToken token, long size) throws Violation {
    expectToken(token, BananaToken.OPEN);
  }

  @Override
  protected void checkOwnOpentype(List<Object> opentype) throws Violation {
    expectOpentype(opentype, BeanUnslicerFactory.OPENTYPE, type.getName());
  }

  @Override
  public String toString() {
    return "Instance(" + type.getName() + ")";
  }
}
