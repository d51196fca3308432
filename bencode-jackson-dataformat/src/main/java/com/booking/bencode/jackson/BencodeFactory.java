package com.booking.bencode.jackson;

import com.booking.bencode.ByteArray;
import com.booking.bencode.DecoderOptions;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.core.io.IOContext;
import com.fasterxml.jackson.core.util.VersionUtil;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;

/**
 * Creates {@link BencodeParser} and {@link BencodeGenerator} instances.
 * <p>
 * Bencode is a binary format, so only {@code byte[]}, {@link InputStream} and {@link OutputStream} are accepted;
 * {@link Reader} and {@link Writer} based factory methods throw {@link UnsupportedOperationException}.
 * <p>
 * A document has no length header, and its end is only known once the last container closes: streams are read
 * to EOF into memory before parsing starts. {@link DecoderOptions} limits apply to every parser created here.
 */
public class BencodeFactory extends JsonFactory {
  public static final String FORMAT_NAME = "bencode";

  static final Version VERSION = VersionUtil.parseVersion(
      "1.0.0-SNAPSHOT", "com.booking", "bencode-jackson-dataformat");

  private final DecoderOptions decoderOptions;

  public BencodeFactory() {
    this((DecoderOptions) null);
  }

  /**
   * @param decoderOptions limits and key-order policy for created parsers, {@code null} for the defaults
   */
  public BencodeFactory(DecoderOptions decoderOptions) {
    this.decoderOptions = decoderOptions != null ? decoderOptions : new DecoderOptions();
  }

  private BencodeFactory(BencodeFactory src) {
    super(src, null);
    this.decoderOptions = src.decoderOptions;
  }

  @Override
  public Version version() {
    return VERSION;
  }

  @Override
  public String getFormatName() {
    return FORMAT_NAME;
  }

  @Override
  public BencodeFactory copy() {
    return new BencodeFactory(this);
  }

  @Override
  public boolean canHandleBinaryNatively() {
    return true;
  }

  @Override
  protected JsonParser _createParser(InputStream in, IOContext ctxt) throws IOException {
    ByteArray bytes = slurpStream(in, ctxt);

    return _createParser(bytes.array, 0, bytes.length, ctxt);
  }

  /** Fails with an exception. */
  @Override
  protected JsonParser _createParser(Reader r, IOContext ctxt) {
    return _nonByteSource();
  }

  /** Fails with an exception. */
  @Override
  protected JsonParser _createParser(char[] data, int offset, int len, IOContext ctxt,
      boolean recyclable) {
    return _nonByteSource();
  }

  @Override
  protected JsonParser _createParser(byte[] data, int offset, int len, IOContext ctxt) {
    return new BencodeParser(decoderOptions, data, offset, len, this._objectCodec);
  }

  /** Fails with an exception. */
  @Override
  protected JsonGenerator _createGenerator(Writer out, IOContext ctxt) {
    return _nonByteTarget();
  }

  @Override
  protected JsonGenerator _createUTF8Generator(OutputStream out, IOContext ctxt) {
    return new BencodeGenerator(_generatorFeatures, _objectCodec, out);
  }

  private <T> T _nonByteSource() {
    throw new UnsupportedOperationException("Can not create parser for non-byte-based source");
  }

  private <T> T _nonByteTarget() {
    throw new UnsupportedOperationException("Can not create generator for non-byte-based target");
  }

  private ByteArray slurpStream(InputStream is, IOContext ctxt) throws IOException {
    byte[] buffer = null;
    try {
      buffer = ctxt.allocReadIOBuffer(1024);
      ByteArray result = new ByteArray(new byte[Math.max(buffer.length, 2048)], 0);

      int read;
      while ((read = is.read(buffer)) != -1) {
        result.ensure(result.length + read);
        System.arraycopy(buffer, 0, result.array, result.length, read);
        result.length += read;
      }

      return result;
    } finally {
      ctxt.releaseReadIOBuffer(buffer);
    }
  }
}
