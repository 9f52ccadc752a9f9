package com.booking.banana.jackson;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caches the Jackson bean introspection results used by {@link BeanSlicer} and {@link BeanUnslicer}.
 */
class BeanProperties {
  private final ObjectMapper mapper;
  private final Map<Class<?>, Map<String, AnnotatedMember>> readable = new ConcurrentHashMap<>();
  private final Map<Class<?>, Map<String, BeanPropertyDefinition>> writable = new ConcurrentHashMap<>();

  BeanProperties(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  ObjectMapper mapper() {
    return mapper;
  }

  /** Getters (or fields) of {@code type}, by property name, in Jackson's property order. */
  Map<String, AnnotatedMember> readable(Class<?> type) {
    return readable.computeIfAbsent(type, this::introspectReadable);
  }

  /** Setters (or fields) of {@code type}, by property name. */
  Map<String, BeanPropertyDefinition> writable(Class<?> type) {
    return writable.computeIfAbsent(type, this::introspectWritable);
  }

  /**
   * Create an instance with the default constructor.
   *
   * @throws IllegalArgumentException if {@code type} has no default constructor
   */
  Object instantiate(Class<?> type) {
    BeanDescription description = mapper.getDeserializationConfig().introspect(mapper.constructType(type));
    Object bean = description.instantiateBean(true);
    if (bean == null) {
      throw new IllegalArgumentException("Class " + type.getName() + " has no default constructor");
    }
    return bean;
  }

  private Map<String, AnnotatedMember> introspectReadable(Class<?> type) {
    BeanDescription description = mapper.getSerializationConfig().introspect(mapper.constructType(type));
    Map<String, AnnotatedMember> properties = new LinkedHashMap<>();
    for (BeanPropertyDefinition property : description.findProperties()) {
      AnnotatedMember accessor = property.getAccessor();
      if (accessor != null) {
        accessor.fixAccess(true);
        properties.put(property.getName(), accessor);
      }
    }
    return Collections.unmodifiableMap(properties);
  }

  private Map<String, BeanPropertyDefinition> introspectWritable(Class<?> type) {
    BeanDescription description = mapper.getDeserializationConfig().introspect(mapper.constructType(type));
    Map<String, BeanPropertyDefinition> properties = new LinkedHashMap<>();
    for (BeanPropertyDefinition property : description.findProperties()) {
      AnnotatedMember mutator = property.hasSetter() ? property.getSetter() : property.getField();
      if (mutator != null) {
        mutator.fixAccess(true);
        properties.put(property.getName(), property);
      }
    }
    return Collections.unmodifiableMap(properties);
  }
}
