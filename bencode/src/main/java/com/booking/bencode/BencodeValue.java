package com.booking.bencode;

/**
 * A node of a bencode value tree.
 * <p>
 * The set of subclasses is closed: {@link BencodeString}, {@link BencodeInteger}, {@link BencodeList} and
 * {@link BencodeDictionary}. All of them are immutable, and each container exclusively owns its children.
 */
public abstract class BencodeValue {
  BencodeValue() {
  }

  /** The kind of this value. */
  public abstract BencodeType type();

  public BencodeString asString() {
    throw wrongType(BencodeType.STRING);
  }

  public BencodeInteger asInteger() {
    throw wrongType(BencodeType.INTEGER);
  }

  public BencodeList asList() {
    throw wrongType(BencodeType.LIST);
  }

  public BencodeDictionary asDictionary() {
    throw wrongType(BencodeType.DICTIONARY);
  }

  private IllegalStateException wrongType(BencodeType expected) {
    return new IllegalStateException("Expected a " + expected + " value, got " + type());
  }
}
