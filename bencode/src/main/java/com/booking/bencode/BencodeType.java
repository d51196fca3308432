package com.booking.bencode;

/**
 * The four kinds of {@link BencodeValue}.
 */
public enum BencodeType {
  /** An opaque byte string. */
  STRING,

  /** An arbitrary-precision integer. */
  INTEGER,

  /** An ordered sequence of values. */
  LIST,

  /** A mapping from byte string keys to values. */
  DICTIONARY;
}
