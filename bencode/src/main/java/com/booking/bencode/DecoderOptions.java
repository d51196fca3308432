package com.booking.bencode;

public class DecoderOptions {
  private int maxRecursionDepth = 1_000;
  private int maxNumListEntries = 0;
  private int maxNumDictionaryEntries = 0;
  private int maxStringLength = 0;
  private boolean allowUnsortedKeys = false;

  /**
   * {@link Decoder} is recursive. If you pass it a document that is deeply nested, it will eventually exhaust
   * the Java stack. Therefore, there is a limit on the number of nested lists and dictionaries that is
   * accepted. It defaults to 1000. You may choose to override this value with the
   * {@link DecoderOptions#maxRecursionDepth(int)} option.
   * <p>
   * Beware that setting it too high can cause a {@code StackOverflowError}, which the decoder reports as
   * {@link DecodeError#NESTING_TOO_DEEP}; {@link TokenDecoder} does not recurse and only applies the limit.
   *
   * @return maximum nesting depth
   */
  public int maxRecursionDepth() {
    return maxRecursionDepth;
  }

  /**
   * If set to a non-zero value (default: 0), then the decoder will refuse to deserialize any list with more
   * than that number of entries.
   *
   * @return maximum number of list entries
   */
  public int maxNumListEntries() {
    return maxNumListEntries;
  }

  /**
   * If set to a non-zero value (default: 0), then the decoder will refuse to deserialize any dictionary with
   * more than that number of entries.
   *
   * @return maximum number of dictionary entries
   */
  public int maxNumDictionaryEntries() {
    return maxNumDictionaryEntries;
  }

  /**
   * If set to a non-zero value (default: 0), then the decoder will refuse to deserialize any string longer
   * than that number of bytes.
   *
   * @return maximum supported string length
   */
  public int maxStringLength() {
    return maxStringLength;
  }

  /**
   * If set, dictionary keys are accepted in any order. Duplicate keys are still refused.
   * <p>
   * Decoded dictionaries are re-sorted when encoded again, so documents accepted this way do not round trip
   * byte for byte.
   *
   * @return {@code true} if unsorted keys are accepted, {@code false} otherwise
   */
  public boolean allowUnsortedKeys() {
    return allowUnsortedKeys;
  }

  public DecoderOptions maxRecursionDepth(int maxRecursionDepth) {
    if (maxRecursionDepth < 0) {
      throw new IllegalArgumentException("Negative recursion depth " + maxRecursionDepth);
    }
    this.maxRecursionDepth = maxRecursionDepth;

    return this;
  }

  public DecoderOptions maxNumListEntries(int maxNumListEntries) {
    if (maxNumListEntries < 0) {
      throw new IllegalArgumentException("Negative list entry limit " + maxNumListEntries);
    }
    this.maxNumListEntries = maxNumListEntries;

    return this;
  }

  public DecoderOptions maxNumDictionaryEntries(int maxNumDictionaryEntries) {
    if (maxNumDictionaryEntries < 0) {
      throw new IllegalArgumentException("Negative dictionary entry limit " + maxNumDictionaryEntries);
    }
    this.maxNumDictionaryEntries = maxNumDictionaryEntries;

    return this;
  }

  public DecoderOptions maxStringLength(int maxStringLength) {
    if (maxStringLength < 0) {
      throw new IllegalArgumentException("Negative string length limit " + maxStringLength);
    }
    this.maxStringLength = maxStringLength;

    return this;
  }

  public DecoderOptions allowUnsortedKeys(boolean allowUnsortedKeys) {
    this.allowUnsortedKeys = allowUnsortedKeys;

    return this;
  }
}
