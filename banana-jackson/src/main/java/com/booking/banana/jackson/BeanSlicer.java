package com.booking.banana.jackson;

import com.booking.banana.BananaEncoder;
import com.booking.banana.BaseSlicer;
import com.booking.banana.SliceSequence;
import com.booking.banana.Violation;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import java.util.Iterator;
import java.util.Map;

/**
 * Sends a bean as {@code ("instance", className)} followed by alternating property names and
 * values. Values go through the taster like any other child, so nested beans, collections and
 * shared references are handled by the slicer stack.
 */
public class BeanSlicer extends BaseSlicer {
  private final Object bean;
  private final Map<String, AnnotatedMember> properties;
  private String currentProperty;

  public BeanSlicer(Object bean, Map<String, AnnotatedMember> properties) {
    this.bean = bean;
    this.properties = properties;
  }

  @Override
  public boolean trackReferences() {
    return true;
  }

  @Override
  public SliceSequence slice(boolean streamable, BananaEncoder encoder) {
    Iterator<Map.Entry<String, AnnotatedMember>> entries = properties.entrySet().iterator();
    return new SliceSequence() {
      private int opentypeSent;
      private AnnotatedMember pendingValue;

      @Override
      public boolean hasNext() {
        return opentypeSent < 2 || pendingValue != null || entries.hasNext();
      }

      @Override
      public Object next() throws Violation {
        switch (opentypeSent) {
          case 0:
            opentypeSent++;
            return BeanUnslicerFactory.OPENTYPE;
          case 1:
            opentypeSent++;
            return bean.getClass().getName();
          default:
            break;
        }
        if (pendingValue != null) {
          AnnotatedMember accessor = pendingValue;
          pendingValue = null;
          try {
            return accessor.getValue(bean);
          } catch (IllegalArgumentException | UnsupportedOperationException e) {
            throw new Violation("Can't read property " + currentProperty + ": " + e.getMessage());
          }
        }
        Map.Entry<String, AnnotatedMember> entry = entries.next();
        currentProperty = entry.getKey();
        pendingValue = entry.getValue();
        return currentProperty;
      }
    };
  }

  @Override
  public String describe() {
    return currentProperty == null ? "<" + bean.getClass().getSimpleName() + ">" : currentProperty;
  }
}
