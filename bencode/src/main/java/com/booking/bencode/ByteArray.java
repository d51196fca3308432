package com.booking.bencode;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * A slice of a byte array, used to pass documents without copying.
 */
public class ByteArray {
  public byte[] array;
  public int start;
  public int length;

  public ByteArray(byte[] array) {
    this(array, 0, array.length);
  }

  public ByteArray(byte[] array, int length) {
    this(array, 0, length);
  }

  public ByteArray(byte[] array, int start, int length) {
    if (start < 0 || length < 0 || start + length > array.length) {
      throw new IndexOutOfBoundsException(
          "Slice [" + start + ", " + (start + length) + ") out of bounds for length " + array.length);
    }
    this.array = array;
    this.start = start;
    this.length = length;
  }

  /** The bytes between the buffer position and its limit; the buffer must be array-backed. */
  public ByteArray(ByteBuffer buffer) {
    this(buffer.array(), buffer.arrayOffset() + buffer.position(), buffer.remaining());
  }

  /** Grows the backing array so that it can hold {@code size} bytes after {@code start}. */
  public void ensure(int size) {
    if (start + size > array.length) {
      array = Arrays.copyOf(array, (start + size) * 3 / 2);
    }
  }

  /** A copy of the slice. */
  public byte[] toByteArray() {
    return Arrays.copyOfRange(array, start, start + length);
  }
}
