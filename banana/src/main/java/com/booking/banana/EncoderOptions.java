package com.booking.banana;

public class EncoderOptions {
  private boolean allowStreaming = false;
  private int maxRecursionDepth = 10_000;
  private VocabTable vocabulary = VocabTable.EMPTY;
  private SlicerRegistry slicerRegistry = SlicerRegistry.defaults();

  /**
   * If set (default: false), slicers that declare themselves streamable may suspend production by
   * yielding a {@link java.util.concurrent.CompletionStage}; the rest of the object is sent once it
   * completes. When not set, a suspension is a fatal error.
   *
   * @return whether top-level objects may be streamed
   */
  public boolean allowStreaming() {
    return allowStreaming;
  }

  /**
   * {@link BananaEncoder} refuses to send objects nested deeper than this (default: 10000). Objects
   * over the limit are aborted with a {@link Violation}. Zero disables the check.
   *
   * @return maximum nesting depth
   */
  public int maxRecursionDepth() {
    return maxRecursionDepth;
  }

  /**
   * Strings found in this table are sent as {@code VOCAB} tokens. Must match the table of the
   * receiving side (default: empty).
   *
   * @return vocabulary table
   */
  public VocabTable vocabulary() {
    return vocabulary;
  }

  /**
   * Slicers for non-primitive objects (default: {@link SlicerRegistry#defaults()}).
   *
   * @return slicer registry
   */
  public SlicerRegistry slicerRegistry() {
    return slicerRegistry;
  }

  public EncoderOptions allowStreaming(boolean allowStreaming) {
    this.allowStreaming = allowStreaming;

    return this;
  }

  public EncoderOptions maxRecursionDepth(int maxRecursionDepth) {
    this.maxRecursionDepth = maxRecursionDepth;

    return this;
  }

  public EncoderOptions vocabulary(VocabTable vocabulary) {
    if (vocabulary == null) {
      throw new IllegalArgumentException("Vocabulary can't be null, use VocabTable.EMPTY");
    }
    this.vocabulary = vocabulary;

    return this;
  }

  public EncoderOptions slicerRegistry(SlicerRegistry slicerRegistry) {
    this.slicerRegistry = slicerRegistry;

    return this;
  }
}
