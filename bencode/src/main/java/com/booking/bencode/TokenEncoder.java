package com.booking.bencode;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A low-level stream encoder for bencode.
 * <p>
 * Values are appended in document order; dictionary entries can be appended in any order and are moved into
 * ascending unsigned byte order of their keys when the dictionary is closed, so the output is always
 * canonical. Call order mistakes (a non-string key, a key without value, mismatched start/end calls, a
 * second top-level value or a duplicate key) throw {@link IllegalStateException}.
 * <p>
 * Example:
 * <pre>
 * {@code
 *   encoder.startDictionary();
 *   encoder.appendString("spam");
 *   encoder.appendString("eggs");
 *   encoder.appendString("cow");
 *   encoder.appendString("moo");
 *   encoder.endDictionary();
 *
 *   byte[] data = encoder.getData(); // d3:cow3:moo4:spam4:eggse
 * }
 * </pre>
 */
public class TokenEncoder implements BencodeHeader {
  private static class Context {
    private final Context outer;
    private final int type;
    private final int position;
    // list elements, or dictionary keys + values
    private int count;
    // per dictionary entry: start of the key length, start and end of the key bytes
    private int[] entries;

    Context(Context outer, int type, int position) {
      this.outer = outer;
      this.type = type;
      this.position = position;
    }

    void addEntry(int entryStart) {
      int index = count / 2 * 3;
      if (entries == null) {
        entries = new int[24];
      } else if (index + 3 > entries.length) {
        entries = Arrays.copyOf(entries, entries.length * 2);
      }
      entries[index] = entryStart;
    }

    void setKey(int keyStart, int keyEnd) {
      int index = count / 2 * 3;
      entries[index + 1] = keyStart;
      entries[index + 2] = keyEnd;
    }
  }

  private static final int CONTEXT_ROOT = 0;
  private static final int CONTEXT_LIST = 1;
  private static final int CONTEXT_DICTIONARY = 2;

  private final CharsetEncoder utf8Encoder = StandardCharsets.UTF_8.newEncoder();
  private Context currentContext;
  private byte[] bytes = new byte[1024];
  private int size = 0;

  /** Create an new {@code TokenEncoder}. */
  public TokenEncoder() {
    start();
  }

  /** {@code true} after the root element has been completely written. */
  public boolean isComplete() {
    return currentContext.type == CONTEXT_ROOT && currentContext.count == 1;
  }

  /** Number of lists and dictionaries started and not yet ended. */
  public int depth() {
    int depth = 0;
    for (Context context = currentContext; context.type != CONTEXT_ROOT; context = context.outer) {
      depth++;
    }
    return depth;
  }

  /** Reset internal state as it was right after construction. */
  public void reset() {
    size = 0;
    start();
  }

  /**
   * Get a reference to the encoded document.
   * <p>
   * The contents of the buffer will become invalid after calling any of the mutator methods.
   */
  public ByteArray getDataReference() {
    return new ByteArray(bytes, size);
  }

  /**
   * Get a copy of the encoded document.
   *
   * @throws IllegalStateException if the top-level value has not been completely written
   */
  public byte[] getData() {
    if (!isComplete()) {
      throw new IllegalStateException("Document is not complete");
    }
    return Arrays.copyOf(bytes, size);
  }

  private void start() {
    currentContext = new Context(null, CONTEXT_ROOT, 0);
  }

  /**
   * Append an integer value.
   *
   * @param l Value to be appended.
   */
  public void appendLong(long l) {
    startValue(false);
    appendByte(BENCODE_INTEGER);
    appendAscii(Long.toString(l));
    appendByte(BENCODE_END);
    currentContext.count++;
  }

  /**
   * Append an integer value of any magnitude.
   *
   * @param value Value to be appended.
   */
  public void appendBigInteger(BigInteger value) {
    if (value == null) {
      throw new NullPointerException("value");
    }
    startValue(false);
    appendByte(BENCODE_INTEGER);
    appendAscii(value.toString());
    appendByte(BENCODE_END);
    currentContext.count++;
  }

  /**
   * Append a byte string.
   *
   * @param string Value to be appended.
   */
  public void appendString(byte[] string) {
    appendString(string, 0, string.length);
  }

  /**
   * Append a byte string.
   *
   * @param string Value to be appended.
   * @param offset Index of the first byte to append.
   * @param length Number of bytes to append.
   */
  public void appendString(byte[] string, int offset, int length) {
    if (offset < 0 || length < 0 || offset > string.length - length) {
      throw new ArrayIndexOutOfBoundsException("Slice [" + offset + ", " + offset + "+" + length + ") out of bounds");
    }
    boolean isKey = startValue(true);
    appendAscii(Integer.toString(length));
    appendByte(BENCODE_LENGTH_SEPARATOR);
    int stringStart = size;
    appendBytes(string, offset, length);
    if (isKey) {
      currentContext.setKey(stringStart, size);
    }
    currentContext.count++;
  }

  /**
   * Append a string encoded as UTF-8.
   *
   * @param string the value to be appended
   * @throws IllegalArgumentException if the string contains unpaired surrogates
   */
  public void appendString(CharSequence string) {
    appendCharBuffer(CharBuffer.wrap(string));
  }

  /**
   * Append a string encoded as UTF-8.
   *
   * @param string Value to be appended.
   * @param offset Index of the first character to append.
   * @param length Number of characters to append.
   * @throws IllegalArgumentException if the string contains unpaired surrogates
   */
  public void appendString(char[] string, int offset, int length) {
    appendCharBuffer(CharBuffer.wrap(string, offset, length));
  }

  private void appendCharBuffer(CharBuffer string) {
    ByteBuffer utf8;
    try {
      utf8Encoder.reset();
      utf8 = utf8Encoder.encode(string);
    } catch (CharacterCodingException e) {
      throw new IllegalArgumentException("String is not representable as UTF-8", e);
    }
    appendString(utf8.array(), utf8.arrayOffset() + utf8.position(), utf8.remaining());
  }

  /** Start writing a list. */
  public void startList() {
    startValue(false);
    currentContext.count++;
    currentContext = new Context(currentContext, CONTEXT_LIST, size);
    appendByte(BENCODE_LIST);
  }

  /** Complete writing a list. */
  public void endList() {
    if (currentContext.type != CONTEXT_LIST) {
      throw new IllegalStateException("Mismatched begin/end calls");
    }
    appendByte(BENCODE_END);
    currentContext = currentContext.outer;
  }

  /**
   * Start writing a dictionary.
   * <p>
   * Keys and values are appended alternately; keys must be strings.
   */
  public void startDictionary() {
    startValue(false);
    currentContext.count++;
    currentContext = new Context(currentContext, CONTEXT_DICTIONARY, size);
    appendByte(BENCODE_DICTIONARY);
  }

  /** Complete writing a dictionary, sorting its entries by key. */
  public void endDictionary() {
    Context context = currentContext;
    if (context.type != CONTEXT_DICTIONARY) {
      throw new IllegalStateException("Mismatched begin/end calls");
    }
    if ((context.count & 0x1) != 0) {
      throw new IllegalStateException("Odd value count in dictionary");
    }
    sortEntries(context);
    appendByte(BENCODE_END);
    currentContext = context.outer;
  }

  // returns true when the value is a dictionary key
  private boolean startValue(boolean isString) {
    Context context = currentContext;
    if (context.type == CONTEXT_ROOT && context.count != 0) {
      throw new IllegalStateException("Top-level value already written");
    }
    if (context.type == CONTEXT_DICTIONARY && (context.count & 0x1) == 0) {
      if (!isString) {
        throw new IllegalStateException("Dictionary keys must be strings");
      }
      context.addEntry(size);
      return true;
    }
    return false;
  }

  private void sortEntries(Context context) {
    final int numEntries = context.count / 2;
    if (numEntries == 0) {
      return;
    }
    final int[] entries = context.entries;

    Integer[] order = new Integer[numEntries];
    for (int i = 0; i < numEntries; ++i) {
      order[i] = i;
    }
    Arrays.sort(order, (a, b) -> Arrays.compareUnsigned(
        bytes, entries[a * 3 + 1], entries[a * 3 + 2],
        bytes, entries[b * 3 + 1], entries[b * 3 + 2]));

    boolean sorted = true;
    for (int i = 0; i < numEntries; ++i) {
      if (i > 0) {
        int previous = order[i - 1] * 3, current = order[i] * 3;
        if (Arrays.equals(bytes, entries[previous + 1], entries[previous + 2],
            bytes, entries[current + 1], entries[current + 2])) {
          throw new IllegalStateException("Duplicate dictionary key "
              + BencodeString.of(bytes, entries[current + 1], entries[current + 2] - entries[current + 1]));
        }
      }
      sorted &= order[i] == i;
    }
    if (sorted) {
      return;
    }

    int entriesStart = entries[0];
    byte[] reordered = new byte[size - entriesStart];
    int at = 0;
    for (int i = 0; i < numEntries; ++i) {
      int index = order[i];
      int entryStart = entries[index * 3];
      int entryEnd = index + 1 < numEntries ? entries[(index + 1) * 3] : size;
      System.arraycopy(bytes, entryStart, reordered, at, entryEnd - entryStart);
      at += entryEnd - entryStart;
    }
    System.arraycopy(reordered, 0, bytes, entriesStart, reordered.length);
  }

  private void appendAscii(String digits) {
    int length = digits.length();
    ensureAvailable(length);
    for (int i = 0; i < length; ++i) {
      bytes[size++] = (byte) digits.charAt(i);
    }
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
