/**
 * Banana: incremental, token-based serialization of object graphs between untrusted peers.
 * <p>
 * {@link com.booking.banana.BananaEncoder} walks an object graph with a stack of
 * {@link com.booking.banana.Slicer}s and writes tokens; {@link com.booking.banana.BananaDecoder}
 * rebuilds it with a stack of {@link com.booking.banana.Unslicer}s, checking every token against a
 * {@link com.booking.banana.Constraint} before its body is buffered.
 * {@link com.booking.banana.Banana} bundles both directions of a connection.
 * <p>
 * {@link com.booking.banana.TokenEncoder} and {@link com.booking.banana.TokenDecoder} offer a
 * low-level interface to the wire format, mostly useful for tests and tools.
 */
package com.booking.banana;
