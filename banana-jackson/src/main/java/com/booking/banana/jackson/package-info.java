/**
 * Bean support for Banana, based on Jackson databind introspection.
 * <p>
 * {@link com.booking.banana.jackson.JacksonBanana} registers
 * {@link com.booking.banana.jackson.BeanSlicerFactory} and
 * {@link com.booking.banana.jackson.BeanUnslicerFactory} for a set of bean classes;
 * {@link com.booking.banana.jackson.InstanceConstraint} restricts what can be received.
 */
package com.booking.banana.jackson;
