package com.booking.banana.jackson;

import com.booking.banana.Slicer;
import com.booking.banana.SlicerFactory;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link SlicerFactory} for beans, using the readable properties Jackson finds on their class.
 * <p>
 * Register it in a {@link com.booking.banana.SlicerRegistry} for every bean class that may be
 * sent; objects of other classes are refused by the taster as usual.
 */
public class BeanSlicerFactory implements SlicerFactory {
  private final BeanProperties properties;

  public BeanSlicerFactory(ObjectMapper mapper) {
    this.properties = new BeanProperties(mapper);
  }

  @Override
  public Slicer createSlicer(Object object) {
    return new BeanSlicer(object, properties.readable(object.getClass()));
  }
}
