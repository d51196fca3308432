package com.booking.bencode.jackson;

import com.booking.bencode.BencodeException;
import com.booking.bencode.BencodeToken;
import com.booking.bencode.ByteArray;
import com.booking.bencode.DecoderOptions;
import com.booking.bencode.TokenDecoder;
import com.fasterxml.jackson.core.Base64Variant;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonStreamContext;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.core.base.ParserMinimalBase;
import com.fasterxml.jackson.core.io.ContentReference;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 *  A {@link com.fasterxml.jackson.core.JsonParser} implementation for bencode.
 *  <p>
 *  Byte strings are reported as {@link JsonToken#VALUE_STRING} (text is decoded as UTF-8, raw bytes are available
 *  through {@link #getBinaryValue(Base64Variant)}), integers as {@link JsonToken#VALUE_NUMBER_INT}, lists as arrays
 *  and dictionaries as objects whose field names are the keys decoded as UTF-8.
 *  <p>
 *  Malformed input is reported as a {@link JsonParseException} whose cause is the {@link BencodeException}.
 */
public class BencodeParser extends ParserMinimalBase {
  private static final ByteArray EMPTY_ARRAY = new ByteArray(new byte[0]);

  private final TokenDecoder tokenDecoder;
  private ObjectCodec objectCodec;
  private BencodeReaderContext parsingContext;
  private BencodeToken bencodeToken = BencodeToken.NONE;

  BencodeParser(DecoderOptions decoderOptions, byte[] data, int offset, int len, ObjectCodec objectCodec) {
    this.objectCodec = objectCodec;
    this.parsingContext = new BencodeReaderContext();
    this.tokenDecoder = new TokenDecoder(decoderOptions);
    this.tokenDecoder.setData(new ByteArray(data, offset, len));
  }

  @Override
  public JsonToken nextToken() throws IOException {
    try {
      bencodeToken = tokenDecoder.nextToken();

      switch (bencodeToken) {
        case INTEGER:
          nextArrayIndex();
          return (_currToken = JsonToken.VALUE_NUMBER_INT);
        case STRING:
          if (tokenDecoder.isDictionaryKey()) {
            parsingContext.nextIndex();
            parsingContext.setCurrentName(tokenDecoder);
            return (_currToken = JsonToken.FIELD_NAME);
          } else {
            nextArrayIndex();
            return (_currToken = JsonToken.VALUE_STRING);
          }
        case LIST_START:
          nextArrayIndex();
          parsingContext = new BencodeReaderContext(parsingContext, JsonStreamContext.TYPE_ARRAY);
          return (_currToken = JsonToken.START_ARRAY);
        case LIST_END:
          parsingContext = parsingContext.getParent();
          return (_currToken = JsonToken.END_ARRAY);
        case DICTIONARY_START:
          nextArrayIndex();
          parsingContext = new BencodeReaderContext(parsingContext, JsonStreamContext.TYPE_OBJECT);
          return (_currToken = JsonToken.START_OBJECT);
        case DICTIONARY_END:
          parsingContext = parsingContext.getParent();
          return (_currToken = JsonToken.END_OBJECT);
        case END:
          return (_currToken = null);
        default:
          throw _formatError("Unsupported bencode token %s", bencodeToken);
      }
    } catch (BencodeException e) {
      throw new JsonParseException(this, "Bencode format error: " + e.getMessage(), e);
    }
  }

  @Override
  protected void _handleEOF() throws JsonParseException {
    if (!parsingContext.inRoot()) {
      String marker = parsingContext.inArray() ? "Array" : "Object";
      _reportInvalidEOF(": expected close marker for " + marker, null);
    }
  }

  @Override
  public String getCurrentName() {
    BencodeReaderContext ctxt = parsingContext;
    if (_currToken == JsonToken.START_OBJECT || _currToken == JsonToken.START_ARRAY) {
      ctxt = ctxt.getParent();
    }
    return ctxt.getCurrentName();
  }

  @Override
  public ObjectCodec getCodec() {
    return objectCodec;
  }

  @Override
  public void setCodec(ObjectCodec objectCodec) {
    this.objectCodec = objectCodec;
  }

  @Override
  public Version version() {
    return BencodeFactory.VERSION;
  }

  @Override
  public void close() {
    tokenDecoder.setData(EMPTY_ARRAY);
    parsingContext = null;
  }

  @Override
  public boolean isClosed() {
    return parsingContext == null;
  }

  @Override
  public JsonStreamContext getParsingContext() {
    return parsingContext;
  }

  @Override
  public JsonLocation getTokenLocation() {
    int offset = tokenDecoder.tokenOffset();

    return new JsonLocation(ContentReference.unknown(), offset, -1, -1, -1);
  }

  @Override
  public JsonLocation getCurrentLocation() {
    int offset = tokenDecoder.currentOffset();

    return new JsonLocation(ContentReference.unknown(), offset, -1, -1, -1);
  }

  @Override
  public void overrideCurrentName(String name) {
    BencodeReaderContext ctxt = parsingContext;
    if (_currToken == JsonToken.START_OBJECT || _currToken == JsonToken.START_ARRAY) {
      ctxt = ctxt.getParent();
    }
    ctxt.setCurrentName(name);
  }

  @Override
  public String getText() throws IOException {
    switch (bencodeToken) {
      case STRING:
        return tokenDecoder.stringValue();
      case INTEGER:
        return tokenDecoder.isLong()
            ? String.valueOf(tokenDecoder.longValue())
            : tokenDecoder.bigIntegerValue().toString();
      case LIST_START:
        return "[";
      case LIST_END:
        return "]";
      case DICTIONARY_START:
        return "{";
      case DICTIONARY_END:
        return "}";
      case NONE:
      case END:
        return null;
      default:
        throw _formatError("Unable to coerce bencode token %s to a string", bencodeToken);
    }
  }

  @Override
  public char[] getTextCharacters() throws IOException {
    throw _constructError("getTextCharacters called even if hasTextCharacters returned false");
  }

  @Override
  public boolean hasTextCharacters() {
    return false;
  }

  @Override
  public int getTextLength() throws IOException {
    throw _constructError("getTextLength called even if hasTextCharacters returned false");
  }

  @Override
  public int getTextOffset() throws IOException {
    throw _constructError("getTextOffset called even if hasTextCharacters returned false");
  }

  /** Integers are {@link Integer}, {@link Long} or {@link BigInteger}, whichever is the smallest that fits. */
  @Override
  public Number getNumberValue() throws IOException {
    checkInteger();
    if (!tokenDecoder.isLong()) {
      return tokenDecoder.bigIntegerValue();
    }
    long value = tokenDecoder.longValue();
    if (value == (int) value) {
      return (int) value;
    }
    return value;
  }

  @Override
  public NumberType getNumberType() throws IOException {
    checkInteger();
    if (!tokenDecoder.isLong()) {
      return NumberType.BIG_INTEGER;
    }
    long value = tokenDecoder.longValue();
    return value == (int) value ? NumberType.INT : NumberType.LONG;
  }

  @Override
  public int getIntValue() throws IOException {
    checkInteger();
    if (!tokenDecoder.isLong() || tokenDecoder.longValue() != (int) tokenDecoder.longValue()) {
      throw _formatError("Numeric value (%s) out of range of int", getText());
    }
    return (int) tokenDecoder.longValue();
  }

  @Override
  public long getLongValue() throws IOException {
    checkInteger();
    if (!tokenDecoder.isLong()) {
      throw _formatError("Numeric value (%s) out of range of long", getText());
    }
    return tokenDecoder.longValue();
  }

  @Override
  public BigInteger getBigIntegerValue() throws IOException {
    checkInteger();
    return tokenDecoder.bigIntegerValue();
  }

  @Override
  public float getFloatValue() throws IOException {
    checkInteger();
    return tokenDecoder.bigIntegerValue().floatValue();
  }

  @Override
  public double getDoubleValue() throws IOException {
    checkInteger();
    return tokenDecoder.bigIntegerValue().doubleValue();
  }

  @Override
  public BigDecimal getDecimalValue() throws IOException {
    checkInteger();
    return new BigDecimal(tokenDecoder.bigIntegerValue());
  }

  /** Bencode has no embedded objects: always {@code null}. */
  @Override
  public Object getEmbeddedObject() {
    return null;
  }

  /** The raw bytes of the current string; no Base64 decoding is performed. */
  @Override
  public byte[] getBinaryValue(Base64Variant base64Variant) throws IOException {
    if (bencodeToken != BencodeToken.STRING) {
      throw _formatError("Unable to coerce bencode token %s to a byte array", bencodeToken);
    }
    return tokenDecoder.bytesValue();
  }

  private void nextArrayIndex() {
    if (parsingContext.inArray()) {
      parsingContext.nextIndex();
    }
  }

  private void checkInteger() throws JsonParseException {
    if (bencodeToken != BencodeToken.INTEGER) {
      throw _formatError("Unable to coerce bencode token %s to a number", bencodeToken);
    }
  }

  private JsonParseException _formatError(String format, Object arg) {
    return _constructError(String.format(format, arg));
  }
}
