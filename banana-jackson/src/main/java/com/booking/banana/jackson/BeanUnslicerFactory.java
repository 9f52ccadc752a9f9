package com.booking.banana.jackson;

import com.booking.banana.Unslicer;
import com.booking.banana.UnslicerFactory;
import com.booking.banana.Violation;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UnslicerFactory} for {@code ("instance", className)} structures.
 * <p>
 * Only the classes passed to the constructor can be instantiated; any other class name is refused
 * before anything is created.
 */
public class BeanUnslicerFactory implements UnslicerFactory {
  public static final String OPENTYPE = "instance";

  private static final Logger log = LoggerFactory.getLogger(BeanUnslicerFactory.class);

  private final BeanProperties properties;
  private final Map<String, Class<?>> allowed = new HashMap<>();

  public BeanUnslicerFactory(ObjectMapper mapper, Class<?>... allowedClasses) {
    this.properties = new BeanProperties(mapper);
    for (Class<?> type : allowedClasses) {
      // fails early for classes that can't be received
      properties.instantiate(type);
      allowed.put(type.getName(), type);
    }
  }

  @Override
  public Unslicer createUnslicer(List<Object> opentype) throws Violation {
    if (opentype.size() < 2) {
      return null;
    }
    Object className = opentype.get(1);
    Class<?> type = allowed.get(className);
    if (type == null) {
      log.debug("Refusing instance of {}", className);
      throw new Violation("Class " + className + " is not allowed");
    }
    return new BeanUnslicer(properties.instantiate(type), properties.writable(type), properties.mapper());
  }
}
