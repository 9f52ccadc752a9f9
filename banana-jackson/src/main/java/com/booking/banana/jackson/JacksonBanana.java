package com.booking.banana.jackson;

import com.booking.banana.DecoderOptions;
import com.booking.banana.EncoderOptions;
import com.booking.banana.SlicerRegistry;
import com.booking.banana.UnslicerRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Wires bean support into Banana options.
 * <p>
 * Example:
 * <pre>
 * {@code
 *   ObjectMapper mapper = new ObjectMapper();
 *   Banana banana = new Banana(out, handler,
 *       JacksonBanana.encoderOptions(mapper, Person.class),
 *       JacksonBanana.decoderOptions(mapper, Person.class));
 * }
 * </pre>
 */
public final class JacksonBanana {
  private JacksonBanana() {
  }

  /** Add a {@link BeanSlicerFactory} for {@code beanClasses} to {@code registry}. */
  public static SlicerRegistry registerBeans(SlicerRegistry registry, ObjectMapper mapper, Class<?>... beanClasses) {
    BeanSlicerFactory factory = new BeanSlicerFactory(mapper);
    for (Class<?> type : beanClasses) {
      registry.register(type, factory);
    }
    return registry;
  }

  /** Register a {@link BeanUnslicerFactory} allowing {@code beanClasses} in {@code registry}. */
  public static UnslicerRegistry registerBeans(UnslicerRegistry registry, ObjectMapper mapper, Class<?>... beanClasses) {
    return registry.register(BeanUnslicerFactory.OPENTYPE, new BeanUnslicerFactory(mapper, beanClasses));
  }

  /** Default encoder options, plus the bean classes. */
  public static EncoderOptions encoderOptions(ObjectMapper mapper, Class<?>... beanClasses) {
    return new EncoderOptions().slicerRegistry(registerBeans(SlicerRegistry.defaults(), mapper, beanClasses));
  }

  /** Default decoder options, plus the bean classes. */
  public static DecoderOptions decoderOptions(ObjectMapper mapper, Class<?>... beanClasses) {
    return new DecoderOptions().unslicerRegistry(registerBeans(UnslicerRegistry.defaults(), mapper, beanClasses));
  }
}
