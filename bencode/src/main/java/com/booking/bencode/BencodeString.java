package com.booking.bencode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A bencode byte string.
 * <p>
 * The content is an arbitrary sequence of bytes. Ordering is unsigned lexicographic on the bytes, which is the
 * order of keys in a canonical dictionary.
 */
public final class BencodeString extends BencodeValue implements Comparable<BencodeString> {
  private static final BencodeString EMPTY = new BencodeString(new byte[0]);

  private final byte[] bytes;
  private int hashcode;

  private BencodeString(byte[] bytes) {
    this.bytes = bytes;
  }

  /** Copies {@code bytes}. */
  public static BencodeString of(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    return bytes.length == 0 ? EMPTY : new BencodeString(bytes.clone());
  }

  /** Copies the {@code [offset, offset + length)} range of {@code bytes}. */
  public static BencodeString of(byte[] bytes, int offset, int length) {
    Objects.requireNonNull(bytes, "bytes");
    return length == 0 ? EMPTY : new BencodeString(Arrays.copyOfRange(bytes, offset, offset + length));
  }

  /** The UTF-8 encoding of {@code string}. */
  public static BencodeString of(CharSequence string) {
    Objects.requireNonNull(string, "string");
    return of(string.toString().getBytes(StandardCharsets.UTF_8));
  }

  // takes ownership, used by the decoder which already holds a private copy
  static BencodeString wrap(byte[] bytes) {
    return bytes.length == 0 ? EMPTY : new BencodeString(bytes);
  }

  @Override
  public BencodeType type() {
    return BencodeType.STRING;
  }

  @Override
  public BencodeString asString() {
    return this;
  }

  /** Number of bytes in the string. */
  public int length() {
    return bytes.length;
  }

  /** A copy of the content. */
  public byte[] getBytes() {
    return bytes.clone();
  }

  byte[] bytesReference() {
    return bytes;
  }

  /** The content decoded as UTF-8; malformed sequences are replaced. */
  public String stringValue() {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  @Override
  public int compareTo(BencodeString other) {
    return Arrays.compareUnsigned(bytes, other.bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BencodeString)) {
      return false;
    }
    return Arrays.equals(bytes, ((BencodeString) o).bytes);
  }

  @Override
  public int hashCode() {
    int h = hashcode;
    if (h == 0) {
      h = hashcode = Arrays.hashCode(bytes);
    }
    return h;
  }

  /**
   * Printable ASCII content is shown as-is between double quotes, anything else is escaped as {@code \xNN}.
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(bytes.length + 2);
    sb.append('"');
    for (byte b : bytes) {
      int c = b & 0xff;
      if (c >= 0x20 && c < 0x7f && c != '"' && c != '\\') {
        sb.append((char) c);
      } else {
        sb.append(String.format("\\x%02x", c));
      }
    }
    return sb.append('"').toString();
  }
}
