package com.booking.bencode;

/**
 * Enumeration for bencode token types, used by {@link com.booking.bencode.TokenDecoder}.
 */
public enum BencodeToken {
  /** Returned when there is no token. */
  NONE,

  /**
   * An integer value, of arbitrary size.
   * <p>
   * Use {@link TokenDecoder#isLong()} to check whether it fits in a {@code long}.
   */
  INTEGER,

  /**
   * A byte string, either a value or a dictionary key.
   */
  STRING,

  /** A list value. */
  LIST_START,

  /** Returned after the last element of a list. */
  LIST_END,

  /** A dictionary value. Keys and values alternate until {@link #DICTIONARY_END}. */
  DICTIONARY_START,

  /** Returned after the last value of a dictionary. */
  DICTIONARY_END,

  /** Returned after the top-level value, once the whole document has been consumed. */
  END;
}
