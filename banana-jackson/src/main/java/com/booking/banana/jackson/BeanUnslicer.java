package com.booking.banana.jackson;

import com.booking.banana.AnyConstraint;
import com.booking.banana.BananaError;
import com.booking.banana.BananaToken;
import com.booking.banana.BaseUnslicer;
import com.booking.banana.Constraint;
import com.booking.banana.Placeholder;
import com.booking.banana.StringConstraint;
import com.booking.banana.Violation;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.util.ClassUtil;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives a bean from alternating property names and values.
 * <p>
 * The bean is created when the structure starts, so properties can refer back to it. Values whose
 * class does not match the declared property type are converted with
 * {@link ObjectMapper#convertValue(Object, JavaType)}.
 */
public class BeanUnslicer extends BaseUnslicer {
  private static final Logger log = LoggerFactory.getLogger(BeanUnslicer.class);

  private static final StringConstraint PROPERTY_NAME = new StringConstraint();

  private final Object bean;
  private final Map<String, BeanPropertyDefinition> properties;
  private final ObjectMapper mapper;
  private final Set<String> received = new HashSet<>();
  private InstanceConstraint instanceConstraint;
  private BeanPropertyDefinition property;
  private Constraint valueConstraint;

  public BeanUnslicer(Object bean, Map<String, BeanPropertyDefinition> properties, ObjectMapper mapper) {
    this.bean = bean;
    this.properties = properties;
    this.mapper = mapper;
  }

  @Override
  public void setConstraint(Constraint constraint) throws Violation {
    super.setConstraint(constraint);
    if (constraint instanceof InstanceConstraint) {
      instanceConstraint = (InstanceConstraint) constraint;
    }
  }

  @Override
  public void start(int openId) throws Violation, BananaError {
    super.start(openId);
    setObject(openId, bean);
  }

  @Override
  protected Constraint childConstraint() {
    if (property == null) {
      return PROPERTY_NAME;
    }
    return valueConstraint instanceof AnyConstraint ? null : valueConstraint;
  }

  @Override
  public void checkToken(BananaToken type, long size) throws Violation, BananaError {
    if (property == null && instanceConstraint != null && instanceConstraint.maxProperties() > 0
        && received.size() >= instanceConstraint.maxProperties()) {
      throw new Violation(bean.getClass().getName() + " is limited to " + instanceConstraint.maxProperties() + " properties");
    }
    super.checkToken(type, size);
  }

  @Override
  public void receiveChild(Object child) throws Violation {
    propagateFailure(child);
    if (property == null) {
      receiveName((String) child);
      return;
    }

    BeanPropertyDefinition target = property;
    property = null;
    valueConstraint = null;
    if (child instanceof Placeholder) {
      if (!target.getPrimaryType().getRawClass().isAssignableFrom(Object[].class)) {
        throw new Violation("Property " + target.getName() + " can't hold a tuple that is still being received");
      }
      // a property can't hold the failure: if the tuple is abandoned the property keeps its default
      ((Placeholder) child).whenResolved(value -> mutator(target).setValue(bean, value),
          failure -> log.debug("Leaving property {} unset: {}", target.getName(), failure));
      return;
    }
    assign(target, child);
  }

  private void receiveName(String name) throws Violation {
    BeanPropertyDefinition definition = properties.get(name);
    if (definition == null) {
      throw new Violation("Unknown property " + name + " of " + bean.getClass().getName());
    }
    if (!received.add(name)) {
      throw new Violation("Duplicate property " + name);
    }
    valueConstraint = instanceConstraint == null ? null : instanceConstraint.propertyConstraint(name);
    property = definition;
  }

  private void assign(BeanPropertyDefinition target, Object value) throws Violation {
    JavaType type = target.getPrimaryType();
    Object converted = value;
    if (value == null) {
      if (type.isPrimitive()) {
        throw new Violation("Property " + target.getName() + " can't be null");
      }
    } else {
      Class<?> raw = type.isPrimitive() ? ClassUtil.wrapperType(type.getRawClass()) : type.getRawClass();
      if (!raw.isInstance(value)) {
        try {
          converted = mapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
          throw new Violation("Can't convert property " + target.getName() + " to " + type + ": " + e.getMessage());
        }
      }
    }

    try {
      mutator(target).setValue(bean, converted);
    } catch (IllegalArgumentException | UnsupportedOperationException e) {
      throw new Violation("Can't set property " + target.getName() + ": " + e.getMessage());
    }
  }

  private static AnnotatedMember mutator(BeanPropertyDefinition definition) {
    return definition.hasSetter() ? definition.getSetter() : definition.getField();
  }

  @Override
  public Object receiveClose() throws Violation {
    if (property != null) {
      throw new Violation("Instance closed after property " + property.getName() + " without a value");
    }
    return bean;
  }

  @Override
  public String describe() {
    return property == null ? "<" + bean.getClass().getSimpleName() + ">" : property.getName();
  }
}
