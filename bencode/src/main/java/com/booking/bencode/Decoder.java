package com.booking.bencode;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent bencode decoder producing {@link BencodeValue} trees.
 * <p>
 * Only well-formed documents are accepted: the whole input must be a single value, integers and lengths
 * must be minimal, and dictionary keys must be in strictly ascending order (unless
 * {@link DecoderOptions#allowUnsortedKeys()} is set). The first error aborts decoding; no partial tree is
 * ever returned.
 * <p>
 * Instances keep the state of the document being decoded and must not be shared between threads; the
 * static {@link Bencode#decode(byte[])} creates a fresh decoder for each call.
 */
public class Decoder implements BencodeHeader {
  private static final Logger LOGGER = LoggerFactory.getLogger(Decoder.class);

  private static final DecoderOptions DEFAULT_OPTIONS = new DecoderOptions();

  // 18 decimal digits always fit in a long
  private static final int MAX_LONG_DIGITS = 18;

  private final int maxRecursionDepth;
  private final int maxNumListEntries;
  private final int maxNumDictionaryEntries;
  private final int maxStringLength;
  private final boolean allowUnsortedKeys;

  private byte[] data;
  private int start, position, end;

  private int recursionDepth = 0;

  /** Create a new Decoder with default options. */
  public Decoder() {
    this(DEFAULT_OPTIONS);
  }

  /** Create a new Decoder with the specified options. */
  public Decoder(DecoderOptions options) {
    maxRecursionDepth = options.maxRecursionDepth();
    maxNumListEntries = options.maxNumListEntries();
    maxNumDictionaryEntries = options.maxNumDictionaryEntries();
    maxStringLength = options.maxStringLength();
    allowUnsortedKeys = options.allowUnsortedKeys();
  }

  /**
   * Set the data to be decoded.
   * <p>
   * The caller must not modify the data while it is owned by the decoder.
   */
  public void setData(ByteArray blob) {
    data = blob.array;
    start = blob.start;
    end = blob.start + blob.length;
    position = start;
  }

  /**
   * Set the data to be decoded.
   * <p>
   * The caller must not modify the data while it is owned by the decoder.
   */
  public void setData(byte[] blob) {
    setData(new ByteArray(blob));
  }

  /** Convenience for {@link #setData(byte[])} followed by {@link #decode()}. */
  public BencodeValue decode(byte[] blob) throws BencodeException {
    setData(blob);
    return decode();
  }

  /**
   * Decode the whole document and return its value.
   *
   * @throws BencodeException if the document is not well-formed
   */
  public BencodeValue decode() throws BencodeException {
    if (data == null) {
      throw new IllegalStateException("No data set");
    }

    position = start;
    recursionDepth = 0;

    BencodeValue out;
    try {
      out = readSingleValue();
    } catch (StackOverflowError e) {
      throw fail(DecodeError.NESTING_TOO_DEEP, position,
          "StackOverflowError: Reached recursion limit during deserialization");
    }

    if (position != end) {
      throw fail(DecodeError.TRAILING_DATA, position,
          (end - position) + " bytes of trailing data after the top-level value");
    }

    return out;
  }

  private BencodeValue readSingleValue() throws BencodeException {
    checkNoEOD();

    byte tag = data[position];

    if (isDigit(tag)) {
      return BencodeString.wrap(readString());
    }
    switch (tag) {
      case BENCODE_INTEGER:
        return readInteger();
      case BENCODE_LIST:
        return readList();
      case BENCODE_DICTIONARY:
        return readDictionary();
      default:
        throw fail(DecodeError.INVALID_TYPE_PREFIX, position,
            String.format("Invalid type prefix 0x%02x", tag & 0xff));
    }
  }

  private byte[] readString() throws BencodeException {
    int lengthOffset = position;
    int length = readLength();

    if (maxStringLength != 0 && length > maxStringLength) {
      throw fail(DecodeError.LIMIT_EXCEEDED, lengthOffset,
          "Got input string with " + length + " bytes, but the configured maximum is just " + maxStringLength);
    }
    if (end - position < length) {
      throw fail(DecodeError.UNEXPECTED_EOF, end,
          "String of length " + length + " exceeds the remaining " + (end - position) + " bytes");
    }

    byte[] out = Arrays.copyOfRange(data, position, position + length);
    position += length;

    return out;
  }

  // <digits>':', without leading zeros
  private int readLength() throws BencodeException {
    int lengthStart = position;
    long length = 0;

    while (true) {
      checkNoEOD();

      byte b = data[position];
      if (b == BENCODE_LENGTH_SEPARATOR && position > lengthStart) {
        break;
      }
      if (!isDigit(b)) {
        throw fail(DecodeError.INVALID_LENGTH, position,
            String.format("Invalid byte 0x%02x in string length", b & 0xff));
      }
      if (position > lengthStart && length == 0) {
        throw fail(DecodeError.INVALID_LENGTH, lengthStart, "Leading zero in string length");
      }
      length = length * 10 + (b - '0');
      if (length > Integer.MAX_VALUE) {
        throw fail(DecodeError.INVALID_LENGTH, lengthStart, "String length too large");
      }
      position++;
    }
    position++; // skip ':'

    return (int) length;
  }

  private BencodeInteger readInteger() throws BencodeException {
    position++; // skip 'i'
    checkNoEOD();

    boolean negative = data[position] == BENCODE_MINUS;
    if (negative) {
      position++;
    }

    int digitsStart = position;
    while (true) {
      checkNoEOD();

      byte b = data[position];
      if (b == BENCODE_END) {
        break;
      }
      if (!isDigit(b)) {
        throw fail(DecodeError.INVALID_INTEGER, position,
            String.format("Invalid byte 0x%02x in integer", b & 0xff));
      }
      position++;
    }

    int digits = position - digitsStart;
    if (digits == 0) {
      throw fail(DecodeError.INVALID_INTEGER, digitsStart, "Integer without digits");
    }
    if (data[digitsStart] == '0') {
      if (digits > 1) {
        throw fail(DecodeError.INVALID_INTEGER, digitsStart, "Leading zero in integer");
      }
      if (negative) {
        throw fail(DecodeError.INVALID_INTEGER, digitsStart, "Negative zero");
      }
    }
    position++; // skip 'e'

    if (digits <= MAX_LONG_DIGITS) {
      long value = 0;
      for (int i = digitsStart; i < digitsStart + digits; ++i) {
        value = value * 10 + (data[i] - '0');
      }
      return BencodeInteger.of(negative ? -value : value);
    }

    int textStart = negative ? digitsStart - 1 : digitsStart;
    String text = new String(data, textStart, digitsStart + digits - textStart, StandardCharsets.US_ASCII);
    return BencodeInteger.of(new BigInteger(text));
  }

  private BencodeList readList() throws BencodeException {
    int listStart = position;
    depthIncrement(listStart);
    position++; // skip 'l'

    List<BencodeValue> out = new ArrayList<>();
    while (true) {
      checkContainerNoEOD("list", listStart, out.size());

      if (data[position] == BENCODE_END) {
        position++;
        break;
      }
      if (maxNumListEntries != 0 && out.size() >= maxNumListEntries) {
        throw fail(DecodeError.LIMIT_EXCEEDED, listStart,
            "Got input list with more than " + maxNumListEntries + " entries, but the configured maximum is just "
                + maxNumListEntries);
      }
      out.add(readSingleValue());
    }

    depthDecrement();

    return BencodeList.wrap(out);
  }

  private BencodeDictionary readDictionary() throws BencodeException {
    int dictionaryStart = position;
    depthIncrement(dictionaryStart);
    position++; // skip 'd'

    Map<BencodeString, BencodeValue> out = new LinkedHashMap<>();
    Set<BencodeString> seen = allowUnsortedKeys ? new HashSet<BencodeString>() : null;
    BencodeString previousKey = null;
    while (true) {
      checkContainerNoEOD("dictionary", dictionaryStart, out.size());

      byte tag = data[position];
      if (tag == BENCODE_END) {
        position++;
        break;
      }
      if (!isDigit(tag)) {
        throw fail(DecodeError.NON_STRING_DICT_KEY, position,
            String.format("Dictionary key starts with 0x%02x instead of a string length", tag & 0xff));
      }
      if (maxNumDictionaryEntries != 0 && out.size() >= maxNumDictionaryEntries) {
        throw fail(DecodeError.LIMIT_EXCEEDED, dictionaryStart,
            "Got input dictionary with more than " + maxNumDictionaryEntries
                + " entries, but the configured maximum is just " + maxNumDictionaryEntries);
      }

      int keyOffset = position;
      BencodeString key = BencodeString.wrap(readString());
      if (seen != null) {
        if (!seen.add(key)) {
          throw fail(DecodeError.UNSORTED_OR_DUPLICATE_KEY, keyOffset, "Duplicate dictionary key " + key);
        }
      } else if (previousKey != null && key.compareTo(previousKey) <= 0) {
        throw fail(DecodeError.UNSORTED_OR_DUPLICATE_KEY, keyOffset,
            "Dictionary key " + key + " does not sort after " + previousKey);
      }
      previousKey = key;

      out.put(key, readSingleValue());
    }

    depthDecrement();

    return BencodeDictionary.wrap(out);
  }

  private void checkNoEOD() throws BencodeException {
    if (position >= end) {
      throw fail(DecodeError.UNEXPECTED_EOF, position, "Unexpected end of data");
    }
  }

  private void checkContainerNoEOD(String kind, int containerStart, int count) throws BencodeException {
    if (position >= end) {
      if (count == 0) {
        throw fail(DecodeError.UNEXPECTED_EOF, position, "Unexpected end of data");
      }
      throw fail(DecodeError.UNTERMINATED_CONTAINER, position,
          "Missing end of " + kind + " started at offset " + (containerStart - start));
    }
  }

  private void depthIncrement(int containerStart) throws BencodeException {
    ++recursionDepth;

    if (recursionDepth > maxRecursionDepth) {
      throw fail(DecodeError.NESTING_TOO_DEEP, containerStart,
          "Reached recursion limit (" + maxRecursionDepth + ") during deserialization");
    }
  }

  private void depthDecrement() {
    recursionDepth--;
  }

  private BencodeException fail(DecodeError error, int at, String msg) {
    BencodeException e = new BencodeException(error, at - start, msg);
    LOGGER.debug("Rejected bencode document: {} ({})", e.getMessage(), error);
    return e;
  }

  static boolean isDigit(byte b) {
    return b >= '0' && b <= '9';
  }
}
