package com.booking.bencode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Serializes {@link BencodeValue} trees to canonical bencode.
 * <p>
 * Dictionary entries are always written in ascending unsigned byte order of their keys, whatever the order
 * they were inserted in, so equal trees produce identical bytes. Encoding never fails: the tree is walked
 * with an explicit stack, so its depth is only bounded by memory.
 * <p>
 * Instances reuse their output buffer and must not be shared between threads; the static
 * {@link Bencode#encode(BencodeValue)} creates a fresh encoder for each call.
 */
public class Encoder implements BencodeHeader {
  // pushed after the children of a list or dictionary
  private static final Object END_MARKER = new Object();

  private byte[] bytes = new byte[1024];
  private int size = 0;

  /**
   * Encode {@code value} as a complete document, replacing any previously written data.
   *
   * @return this encoder, to chain {@link #getData()}
   */
  public Encoder write(BencodeValue value) {
    if (value == null) {
      throw new NullPointerException("value");
    }
    size = 0;

    Deque<Object> pending = new ArrayDeque<>();
    pending.push(value);
    while (!pending.isEmpty()) {
      Object next = pending.pop();

      if (next == END_MARKER) {
        appendByte(BENCODE_END);
      } else if (next instanceof BencodeString) {
        appendString((BencodeString) next);
      } else if (next instanceof BencodeInteger) {
        appendInteger((BencodeInteger) next);
      } else if (next instanceof BencodeList) {
        List<BencodeValue> values = ((BencodeList) next).values();

        appendByte(BENCODE_LIST);
        pending.push(END_MARKER);
        for (int i = values.size() - 1; i >= 0; --i) {
          pending.push(values.get(i));
        }
      } else {
        List<Map.Entry<BencodeString, BencodeValue>> entries = ((BencodeDictionary) next).sortedEntries();

        appendByte(BENCODE_DICTIONARY);
        pending.push(END_MARKER);
        for (int i = entries.size() - 1; i >= 0; --i) {
          pending.push(entries.get(i).getValue());
          pending.push(entries.get(i).getKey());
        }
      }
    }

    return this;
  }

  /** Encode {@code value} and return a copy of the encoded document. */
  public byte[] encode(BencodeValue value) {
    return write(value).getData();
  }

  /**
   * Get a reference to the encoded document.
   * <p>
   * The contents of the buffer will become invalid after the next call to {@link #write(BencodeValue)}.
   */
  public ByteArray getDataReference() {
    return new ByteArray(bytes, size);
  }

  /** Get a copy of the encoded document. */
  public byte[] getData() {
    return Arrays.copyOf(bytes, size);
  }

  private void appendString(BencodeString string) {
    byte[] content = string.bytesReference();

    appendAscii(Integer.toString(content.length));
    appendByte(BENCODE_LENGTH_SEPARATOR);
    appendBytes(content, 0, content.length);
  }

  private void appendInteger(BencodeInteger integer) {
    appendByte(BENCODE_INTEGER);
    if (integer.isLong()) {
      appendAscii(Long.toString(integer.longValue()));
    } else {
      appendAscii(integer.bigIntegerValue().toString());
    }
    appendByte(BENCODE_END);
  }

  private void appendAscii(String digits) {
    byte[] ascii = digits.getBytes(StandardCharsets.US_ASCII);
    appendBytes(ascii, 0, ascii.length);
  }

  private void ensureAvailable(int required) {
    long total = (long) required + size;

    if (total > bytes.length) {
      bytes = Arrays.copyOf(bytes, (int) Math.min(Integer.MAX_VALUE - 8, total * 3 / 2));
    }
  }

  private void appendBytes(byte[] data, int offset, int length) {
    ensureAvailable(length);
    System.arraycopy(data, offset, bytes, size, length);
    size += length;
  }

  private void appendByte(byte data) {
    ensureAvailable(1);
    bytes[size++] = data;
  }
}
