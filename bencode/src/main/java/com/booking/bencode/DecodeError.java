package com.booking.bencode;

/**
 * The ways a bencode document can fail to decode.
 */
public enum DecodeError {
  /** The input ended in the middle of a value (including empty input). */
  UNEXPECTED_EOF,

  /** A string length prefix is malformed, zero-padded or too large. */
  INVALID_LENGTH,

  /** An integer has no digits, a disallowed leading zero, is {@code -0} or contains a non-digit. */
  INVALID_INTEGER,

  /** The byte at the start of a value does not start any value. */
  INVALID_TYPE_PREFIX,

  /** The input ended after one or more complete elements of a list or dictionary, without the closing {@code e}. */
  UNTERMINATED_CONTAINER,

  /** A dictionary key position holds something other than a string. */
  NON_STRING_DICT_KEY,

  /** A dictionary key is not strictly greater than the previous key. */
  UNSORTED_OR_DUPLICATE_KEY,

  /** There are bytes left after the top-level value. */
  TRAILING_DATA,

  /** Lists and dictionaries are nested deeper than {@link DecoderOptions#maxRecursionDepth()}. */
  NESTING_TOO_DEEP,

  /** A string, list or dictionary is larger than the limit configured in {@link DecoderOptions}. */
  LIMIT_EXCEEDED;
}
