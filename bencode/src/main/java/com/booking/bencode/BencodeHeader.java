package com.booking.bencode;

/**
 * Marker bytes of the bencode grammar.
 */
public interface BencodeHeader {
  static final byte BENCODE_INTEGER = 'i';
  static final byte BENCODE_LIST = 'l';
  static final byte BENCODE_DICTIONARY = 'd';
  static final byte BENCODE_END = 'e';
  static final byte BENCODE_LENGTH_SEPARATOR = ':';
  static final byte BENCODE_MINUS = '-';
}
