package com.booking.bencode.jackson;

import com.booking.bencode.ByteArray;
import com.booking.bencode.TokenEncoder;
import com.fasterxml.jackson.core.Base64Variant;
import com.fasterxml.jackson.core.JsonGenerationException;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.core.base.GeneratorBase;
import com.fasterxml.jackson.core.json.JsonWriteContext;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A {@link com.fasterxml.jackson.core.JsonGenerator} implementation for bencode.
 * <p>
 * It does not support writing raw values, except for {@link BencodeGenerator#writeRawUTF8String(byte[], int, int)}.
 * <p>
 * Bencode only has byte strings, integers, lists and dictionaries, so:
 * <ul>
 *   <li>{@code boolean} values are written as the integers {@code 1} and {@code 0};</li>
 *   <li>{@code float}, {@code double} and {@link java.math.BigDecimal} values are written as strings;</li>
 *   <li>binary values are written as raw byte strings;</li>
 *   <li>{@code null} can not be written.</li>
 * </ul>
 * Objects are written as dictionaries whose entries are sorted by key when the object is closed, so the output
 * is canonical bencode regardless of property order. The document is written to the output stream once the
 * top-level value is complete.
 */
public class BencodeGenerator extends GeneratorBase {
  private final TokenEncoder tokenEncoder;
  private final OutputStream outputStream;

  BencodeGenerator(int features, ObjectCodec codec, OutputStream out) {
    super(features, codec, JsonWriteContext.createRootContext(null));
    this.tokenEncoder = new TokenEncoder();
    this.outputStream = out;
  }

  @Override
  public Version version() {
    return BencodeFactory.VERSION;
  }

  @Override
  public void close() throws IOException {
    if (isClosed()) {
      return;
    }
    super.close();
    flush();
    outputStream.close();
  }

  @Override
  public boolean canWriteBinaryNatively() {
    return true;
  }

  @Override
  public void writeStartArray() throws IOException {
    try {
      tokenEncoder.startList();
    } catch (IllegalStateException e) {
      throw _constructError("Invalid bencode structure", e);
    }
  }

  @Override
  public void writeEndArray() throws IOException {
    try {
      tokenEncoder.endList();
    } catch (IllegalStateException e) {
      throw _constructError("Invalid bencode structure", e);
    }
    maybeFinishDocument();
  }

  @Override
  public void writeStartObject() throws IOException {
    try {
      tokenEncoder.startDictionary();
    } catch (IllegalStateException e) {
      throw _constructError("Invalid bencode structure", e);
    }
  }

  @Override
  public void writeEndObject() throws IOException {
    try {
      tokenEncoder.endDictionary();
    } catch (IllegalStateException e) {
      throw _constructError("Invalid bencode structure", e);
    }
    maybeFinishDocument();
  }

  @Override
  public void writeFieldName(String s) throws IOException {
    appendString(s);
  }

  @Override
  public void writeString(String s) throws IOException {
    appendString(s);
    maybeFinishDocument();
  }

  @Override
  public void writeString(char[] chars, int offset, int length) throws IOException {
    try {
      tokenEncoder.appendString(chars, offset, length);
    } catch (IllegalStateException | IllegalArgumentException e) {
      throw _constructError("Invalid bencode string", e);
    }
    maybeFinishDocument();
  }

  @Override
  public void writeRawUTF8String(byte[] bytes, int offset, int length) throws IOException {
    appendBytes(bytes, offset, length);
  }

  @Override
  public void writeUTF8String(byte[] bytes, int offset, int length) throws IOException {
    appendBytes(bytes, offset, length);
  }

  @Override
  public void writeRaw(String s) {
    _reportUnsupportedOperation();
  }

  @Override
  public void writeRaw(String s, int i, int i1) {
    _reportUnsupportedOperation();
  }

  @Override
  public void writeRaw(char[] chars, int i, int i1) {
    _reportUnsupportedOperation();
  }

  @Override
  public void writeRaw(char c) {
    _reportUnsupportedOperation();
  }

  @Override
  public void writeBinary(Base64Variant base64Variant, byte[] bytes, int offset, int length)
      throws IOException {
    appendBytes(bytes, offset, length);
  }

  @Override
  public void writeNumber(int i) throws IOException {
    appendLong(i);
  }

  @Override
  public void writeNumber(long l) throws IOException {
    appendLong(l);
  }

  @Override
  public void writeNumber(BigInteger bigInteger) throws IOException {
    if (bigInteger == null) {
      writeNull();
      return;
    }
    try {
      tokenEncoder.appendBigInteger(bigInteger);
    } catch (IllegalStateException e) {
      throw _constructError("Invalid bencode structure", e);
    }
    maybeFinishDocument();
  }

  @Override
  public void writeNumber(double v) throws IOException {
    writeString(String.valueOf(v));
  }

  @Override
  public void writeNumber(float v) throws IOException {
    writeString(String.valueOf(v));
  }

  @Override
  public void writeNumber(BigDecimal bigDecimal) throws IOException {
    if (bigDecimal == null) {
      writeNull();
      return;
    }
    writeString(bigDecimal.toString());
  }

  /** Writes the encoded number as a string. */
  @Override
  public void writeNumber(String s) throws IOException {
    writeString(s);
  }

  @Override
  public void writeBoolean(boolean b) throws IOException {
    appendLong(b ? 1 : 0);
  }

  /** Always fails: bencode has no representation for {@code null}. */
  @Override
  public void writeNull() throws IOException {
    throw new JsonGenerationException("Bencode can not represent null values", this);
  }

  @Override
  public void flush() throws IOException {
    outputStream.flush();
  }

  @Override
  protected void _releaseBuffers() {
    // no intermediate buffers are used
  }

  @Override
  protected void _verifyValueWrite(String typeMsg) {
    // only called for raw values, which are not supported
  }

  private void appendString(String s) throws IOException {
    try {
      tokenEncoder.appendString(s);
    } catch (IllegalStateException | IllegalArgumentException e) {
      throw _constructError("Invalid bencode string", e);
    }
  }

  private void appendBytes(byte[] bytes, int offset, int length) throws IOException {
    try {
      tokenEncoder.appendString(bytes, offset, length);
    } catch (IllegalStateException e) {
      throw _constructError("Invalid bencode structure", e);
    }
    maybeFinishDocument();
  }

  private void appendLong(long l) throws IOException {
    try {
      tokenEncoder.appendLong(l);
    } catch (IllegalStateException e) {
      throw _constructError("Invalid bencode structure", e);
    }
    maybeFinishDocument();
  }

  private JsonGenerationException _constructError(String msg, Throwable t) {
    return new JsonGenerationException(msg + ": " + t.getMessage(), t, this);
  }

  private void maybeFinishDocument() throws IOException {
    if (tokenEncoder.isComplete()) {
      ByteArray data = tokenEncoder.getDataReference();
      outputStream.write(data.array, data.start, data.length);
      tokenEncoder.reset();
    }
  }
}
