package com.booking.bencode;

/**
 * Thrown when a bencode document is not well-formed.
 */
@SuppressWarnings("serial")
public class BencodeException extends Exception {
  private final DecodeError error;
  private final int offset;

  public BencodeException(DecodeError error, int offset, String msg) {
    super(msg + " at offset " + offset);
    this.error = error;
    this.offset = offset;
  }

  /** The kind of failure. */
  public DecodeError getError() {
    return error;
  }

  /** Offset in the document of the byte where decoding failed. */
  public int getOffset() {
    return offset;
  }
}
