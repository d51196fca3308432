package com.booking.bencode;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A low-level stream decoder for bencode.
 * <p>
 * It provides a token stream, with accessors to retrieve token data (e.g. the integer value associated with an
 * {@code INTEGER} token). Nesting is tracked with an explicit stack, not with recursion.
 * <p>
 * The decoder accepts exactly the documents {@link Decoder} accepts and fails with the same
 * {@link DecodeError} kinds, including {@link DecodeError#TRAILING_DATA} when {@link BencodeToken#END} would
 * be returned with unconsumed input.
 * <p>
 * Example:
 * <pre>
 * {@code
 *   decoder.setData(bytes);
 *
 *   BencodeToken token;
 *   while ((token = decoder.nextToken()) != BencodeToken.END) {
 *     if (token == BencodeToken.INTEGER) {
 *       System.out.println("Integer value " + decoder.bigIntegerValue() + " at offset " + decoder.tokenOffset());
 *     }
 *   }
 * }
 * </pre>
 */
public class TokenDecoder implements BencodeHeader {
  private static class Context {
    private final Context outer;
    private final int type;
    private final int startPosition;
    // list elements, or dictionary keys + values
    private int count;
    private int previousKeyStart = -1, previousKeyEnd;
    private Set<BencodeString> seenKeys;

    Context(Context outer, int type, int startPosition) {
      this.outer = outer;
      this.type = type;
      this.startPosition = startPosition;
    }
  }

  private static final Logger LOGGER = LoggerFactory.getLogger(TokenDecoder.class);

  private static final DecoderOptions DEFAULT_OPTIONS = new DecoderOptions();

  private static final int CONTEXT_ROOT = 0;
  private static final int CONTEXT_LIST = 1;
  private static final int CONTEXT_DICTIONARY = 2;

  private static final int MAX_LONG_DIGITS = 18;

  private final int maxRecursionDepth;
  private final int maxNumListEntries;
  private final int maxNumDictionaryEntries;
  private final int maxStringLength;
  private final boolean allowUnsortedKeys;

  private byte[] data;
  private int start, position, end;

  private Context currentContext;
  private int depth;
  private BencodeToken currentToken = BencodeToken.NONE;
  private int tokenOffset;
  private long longValue;
  private BigInteger bigIntegerValue;
  private int binarySliceStart, binarySliceEnd;
  private boolean isDictionaryKey;

  /** Create a new {@code TokenDecoder} with default options. */
  public TokenDecoder() {
    this(DEFAULT_OPTIONS);
  }

  /** Create a new {@code TokenDecoder} with the specified options. */
  public TokenDecoder(DecoderOptions options) {
    maxRecursionDepth = options.maxRecursionDepth();
    maxNumListEntries = options.maxNumListEntries();
    maxNumDictionaryEntries = options.maxNumDictionaryEntries();
    maxStringLength = options.maxStringLength();
    allowUnsortedKeys = options.allowUnsortedKeys();
  }

  /**
   * Set the data to be decoded.
   * <p>
   * After calling this method, blob is owned by the decoder until the next call to {@code setData} or
   * {@link #reset()}.
   *
   * @param blob bencode data.
   */
  public void setData(ByteArray blob) {
    reset();
    data = blob.array;
    start = position = blob.start;
    end = blob.start + blob.length;
    currentContext = new Context(null, CONTEXT_ROOT, start);
  }

  /**
   * Set the data to be decoded.
   * <p>
   * After calling this method, blob is owned by the decoder until the next call to {@code setData} or
   * {@link #reset()}.
   *
   * @param blob bencode data.
   */
  public void setData(byte[] blob) {
    setData(new ByteArray(blob));
  }

  /** Discard all internal state. */
  public void reset() {
    currentToken = BencodeToken.NONE;
    currentContext = null;
    data = null;
    depth = 0;
    isDictionaryKey = false;
  }

  /**
   * Iterate over the document returning the next token.
   * <p>
   * Depending on the token returned, accessors can be used to retrieve additional information about the token.
   * After {@link BencodeToken#END} has been returned, further calls keep returning it.
   *
   * @return The next token
   * @throws BencodeException if the document is not well-formed
   */
  public BencodeToken nextToken() throws BencodeException {
    if (data == null) {
      throw new IllegalStateException("No data set");
    }
    if (currentToken == BencodeToken.END) {
      return currentToken;
    }

    Context context = currentContext;
    isDictionaryKey = false;

    if (context.type == CONTEXT_ROOT) {
      if (context.count == 1) {
        if (position != end) {
          throw fail(DecodeError.TRAILING_DATA, position,
              (end - position) + " bytes of trailing data after the top-level value");
        }
        tokenOffset = position - start;
        return (currentToken = BencodeToken.END);
      }
      return readValue();
    }

    boolean keyPosition = context.type == CONTEXT_DICTIONARY && (context.count & 1) == 0;
    if (position >= end) {
      if (context.count == 0 || !keyPosition && context.type == CONTEXT_DICTIONARY) {
        throw fail(DecodeError.UNEXPECTED_EOF, position, "Unexpected end of data");
      }
      throw fail(DecodeError.UNTERMINATED_CONTAINER, position,
          "Missing end of " + (context.type == CONTEXT_LIST ? "list" : "dictionary") + " started at offset "
              + (context.startPosition - start));
    }

    byte tag = data[position];
    if (tag == BENCODE_END && (context.type == CONTEXT_LIST || keyPosition)) {
      tokenOffset = position - start;
      position++;
      currentContext = context.outer;
      currentContext.count++;
      depth--;
      return (currentToken = context.type == CONTEXT_LIST ? BencodeToken.LIST_END : BencodeToken.DICTIONARY_END);
    }
    if (keyPosition) {
      return readKey(context);
    }
    if (context.type == CONTEXT_LIST && maxNumListEntries != 0 && context.count >= maxNumListEntries) {
      throw fail(DecodeError.LIMIT_EXCEEDED, context.startPosition,
          "Got input list with more than " + maxNumListEntries + " entries, but the configured maximum is just "
              + maxNumListEntries);
    }
    return readValue();
  }

  /** After a call to {@link #nextToken}, return the current token. */
  public BencodeToken currentToken() {
    return currentToken;
  }

  /**
   * Number of lists and dictionaries enclosing the current position.
   * <p>
   * After {@link BencodeToken#LIST_START} or {@link BencodeToken#DICTIONARY_START} it includes the container
   * just opened; after {@link BencodeToken#LIST_END} or {@link BencodeToken#DICTIONARY_END} it no longer
   * includes the container just closed.
   */
  public int depth() {
    return depth;
  }

  /** {@code true} if the current token is a dictionary key, {@code false} otherwise. */
  public boolean isDictionaryKey() {
    return isDictionaryKey;
  }

  /**
   * The document offset of the last token returned by {@link TokenDecoder#nextToken()}.
   */
  public int tokenOffset() {
    return tokenOffset;
  }

  /**
   * Decoder position in the document: the offset of the first byte not consumed yet.
   */
  public int currentOffset() {
    return position - start;
  }

  /**
   * {@code true} if the current integer fits in a {@code long}.
   * <p>
   * Defined for {@link BencodeToken#INTEGER}.
   */
  public boolean isLong() {
    return bigIntegerValue == null;
  }

  /**
   * Current integer value as a {@code long}.
   * <p>
   * Defined for {@link BencodeToken#INTEGER}.
   *
   * @throws ArithmeticException if the value does not fit in a {@code long}
   */
  public long longValue() {
    if (bigIntegerValue != null) {
      throw new ArithmeticException("Integer " + bigIntegerValue + " out of long range");
    }
    return longValue;
  }

  /**
   * Current integer value as a {@link java.math.BigInteger}.
   * <p>
   * Defined for {@link BencodeToken#INTEGER}.
   */
  public BigInteger bigIntegerValue() {
    return bigIntegerValue != null ? bigIntegerValue : BigInteger.valueOf(longValue);
  }

  /**
   * All string values are slices of this array.
   * <p>
   * Defined for {@link BencodeToken#STRING}.
   */
  public byte[] decoderBuffer() {
    return data;
  }

  /**
   * Start offset of the current string in {@link TokenDecoder#decoderBuffer()}.
   * <p>
   * Defined for {@link BencodeToken#STRING}.
   */
  public int binarySliceStart() {
    return binarySliceStart;
  }

  /**
   * End offset of the current string in {@link TokenDecoder#decoderBuffer()}.
   * <p>
   * Defined for {@link BencodeToken#STRING}.
   */
  public int binarySliceEnd() {
    return binarySliceEnd;
  }

  /**
   * Length of the current string.
   * <p>
   * Defined for {@link BencodeToken#STRING}.
   */
  public int binarySliceLength() {
    return binarySliceEnd - binarySliceStart;
  }

  /** A copy of the current string. */
  public byte[] bytesValue() {
    return Arrays.copyOfRange(data, binarySliceStart, binarySliceEnd);
  }

  /** The current string decoded as UTF-8. */
  public String stringValue() {
    return new String(data, binarySliceStart, binarySliceEnd - binarySliceStart, StandardCharsets.UTF_8);
  }

  private BencodeToken readValue() throws BencodeException {
    checkNoEOD();

    byte tag = data[position];
    tokenOffset = position - start;

    if (Decoder.isDigit(tag)) {
      readString();
      currentContext.count++;
      return (currentToken = BencodeToken.STRING);
    }
    switch (tag) {
      case BENCODE_INTEGER:
        readInteger();
        currentContext.count++;
        return (currentToken = BencodeToken.INTEGER);
      case BENCODE_LIST:
        depthIncrement();
        currentContext = new Context(currentContext, CONTEXT_LIST, position);
        position++;
        return (currentToken = BencodeToken.LIST_START);
      case BENCODE_DICTIONARY:
        depthIncrement();
        currentContext = new Context(currentContext, CONTEXT_DICTIONARY, position);
        if (allowUnsortedKeys) {
          currentContext.seenKeys = new HashSet<>();
        }
        position++;
        return (currentToken = BencodeToken.DICTIONARY_START);
      default:
        throw fail(DecodeError.INVALID_TYPE_PREFIX, position,
            String.format("Invalid type prefix 0x%02x", tag & 0xff));
    }
  }

  private BencodeToken readKey(Context context) throws BencodeException {
    byte tag = data[position];
    if (!Decoder.isDigit(tag)) {
      throw fail(DecodeError.NON_STRING_DICT_KEY, position,
          String.format("Dictionary key starts with 0x%02x instead of a string length", tag & 0xff));
    }
    if (maxNumDictionaryEntries != 0 && context.count / 2 >= maxNumDictionaryEntries) {
      throw fail(DecodeError.LIMIT_EXCEEDED, context.startPosition,
          "Got input dictionary with more than " + maxNumDictionaryEntries
              + " entries, but the configured maximum is just " + maxNumDictionaryEntries);
    }

    int keyOffset = position;
    tokenOffset = keyOffset - start;
    readString();

    if (context.seenKeys != null) {
      BencodeString key = BencodeString.of(data, binarySliceStart, binarySliceEnd - binarySliceStart);
      if (!context.seenKeys.add(key)) {
        throw fail(DecodeError.UNSORTED_OR_DUPLICATE_KEY, keyOffset, "Duplicate dictionary key " + key);
      }
    } else if (context.previousKeyStart >= 0
        && Arrays.compareUnsigned(data, binarySliceStart, binarySliceEnd,
            data, context.previousKeyStart, context.previousKeyEnd) <= 0) {
      throw fail(DecodeError.UNSORTED_OR_DUPLICATE_KEY, keyOffset,
          "Dictionary key " + BencodeString.of(data, binarySliceStart, binarySliceEnd - binarySliceStart)
              + " does not sort after "
              + BencodeString.of(data, context.previousKeyStart, context.previousKeyEnd - context.previousKeyStart));
    }
    context.previousKeyStart = binarySliceStart;
    context.previousKeyEnd = binarySliceEnd;
    context.count++;

    isDictionaryKey = true;
    return (currentToken = BencodeToken.STRING);
  }

  private void readString() throws BencodeException {
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

    binarySliceStart = position;
    binarySliceEnd = position + length;
    position += length;
  }

  private int readLength() throws BencodeException {
    int lengthStart = position;
    long length = 0;

    while (true) {
      checkNoEOD();

      byte b = data[position];
      if (b == BENCODE_LENGTH_SEPARATOR && position > lengthStart) {
        break;
      }
      if (!Decoder.isDigit(b)) {
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

  private void readInteger() throws BencodeException {
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
      if (!Decoder.isDigit(b)) {
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
      longValue = negative ? -value : value;
      bigIntegerValue = null;
      return;
    }

    int textStart = negative ? digitsStart - 1 : digitsStart;
    BigInteger value = new BigInteger(
        new String(data, textStart, digitsStart + digits - textStart, StandardCharsets.US_ASCII));
    if (value.bitLength() < 64) {
      longValue = value.longValue();
      bigIntegerValue = null;
    } else {
      longValue = 0;
      bigIntegerValue = value;
    }
  }

  private void checkNoEOD() throws BencodeException {
    if (position >= end) {
      throw fail(DecodeError.UNEXPECTED_EOF, position, "Unexpected end of data");
    }
  }

  private void depthIncrement() throws BencodeException {
    ++depth;

    if (depth > maxRecursionDepth) {
      throw fail(DecodeError.NESTING_TOO_DEEP, position,
          "Reached recursion limit (" + maxRecursionDepth + ") during deserialization");
    }
  }

  private BencodeException fail(DecodeError error, int at, String msg) {
    BencodeException e = new BencodeException(error, at - start, msg);
    LOGGER.debug("Rejected bencode document: {} ({})", e.getMessage(), error);
    return e;
  }
}
