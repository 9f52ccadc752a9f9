package com.booking.banana;

public class DecoderOptions {
  private int maxRecursionDepth = 10_000;
  private int maxIndexLength = 200;
  private int maxOpentypeLength = 3;
  // Hard cap on any long token. Defaults to 1MB
  private long maxTokenSize = 1024 * 1024;
  private int maxErrorLength = BananaHeader.SIZE_LIMIT;

  private VocabTable vocabulary = VocabTable.EMPTY;
  private UnslicerRegistry unslicerRegistry = UnslicerRegistry.defaults();
  private Constraint topConstraint = AnyConstraint.INSTANCE;

  /**
   * {@link BananaDecoder} refuses structures nested deeper than this (default: 10000). The
   * offending structure is discarded with a {@link Violation}. Zero disables the check.
   *
   * @return maximum nesting depth
   */
  public int maxRecursionDepth() {
    return maxRecursionDepth;
  }

  /**
   * Maximum length in bytes of a {@code STRING} index token (default: 200).
   *
   * @return maximum index token length
   */
  public int maxIndexLength() {
    return maxIndexLength;
  }

  /**
   * Maximum number of index tokens in an open type (default: 3).
   *
   * @return maximum open type length
   */
  public int maxOpentypeLength() {
    return maxOpentypeLength;
  }

  /**
   * Long tokens declaring a larger body are a fatal {@link BananaError}, whatever the
   * constraints say (default: 1MB). This bounds memory in unconstrained positions.
   *
   * @return maximum body length of any token
   */
  public long maxTokenSize() {
    return maxTokenSize;
  }

  /**
   * Maximum length of the diagnostic in an {@code ERROR} token (default:
   * {@link BananaHeader#SIZE_LIMIT}). Longer ones are not buffered.
   *
   * @return maximum error message length
   */
  public int maxErrorLength() {
    return maxErrorLength;
  }

  public VocabTable vocabulary() {
    return vocabulary;
  }

  public UnslicerRegistry unslicerRegistry() {
    return unslicerRegistry;
  }

  /**
   * Constraint applied to top-level objects (default: {@link AnyConstraint}, nothing is checked).
   *
   * @return top-level constraint
   */
  public Constraint topConstraint() {
    return topConstraint;
  }

  public DecoderOptions maxRecursionDepth(int maxRecursionDepth) {
    this.maxRecursionDepth = maxRecursionDepth;

    return this;
  }

  public DecoderOptions maxIndexLength(int maxIndexLength) {
    this.maxIndexLength = maxIndexLength;

    return this;
  }

  public DecoderOptions maxOpentypeLength(int maxOpentypeLength) {
    if (maxOpentypeLength < 1) {
      throw new IllegalArgumentException("Open types have at least one index token");
    }
    this.maxOpentypeLength = maxOpentypeLength;

    return this;
  }

  public DecoderOptions maxTokenSize(long maxTokenSize) {
    if (maxTokenSize < 0 || maxTokenSize > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Invalid maximum token size " + maxTokenSize);
    }
    this.maxTokenSize = maxTokenSize;

    return this;
  }

  public DecoderOptions maxErrorLength(int maxErrorLength) {
    this.maxErrorLength = maxErrorLength;

    return this;
  }

  public DecoderOptions vocabulary(VocabTable vocabulary) {
    if (vocabulary == null) {
      throw new IllegalArgumentException("Vocabulary can't be null, use VocabTable.EMPTY");
    }
    this.vocabulary = vocabulary;

    return this;
  }

  public DecoderOptions unslicerRegistry(UnslicerRegistry unslicerRegistry) {
    this.unslicerRegistry = unslicerRegistry;

    return this;
  }

  public DecoderOptions topConstraint(Constraint topConstraint) {
    this.topConstraint = topConstraint == null ? AnyConstraint.INSTANCE : topConstraint;

    return this;
  }
}
