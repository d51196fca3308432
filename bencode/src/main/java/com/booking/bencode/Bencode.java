package com.booking.bencode;

/**
 * Static entry points for one-off conversions.
 * <p>
 * Every call uses its own {@link Decoder} or {@link Encoder}, so these methods can be called concurrently from
 * any number of threads.
 */
public final class Bencode {
  private Bencode() {
  }

  /**
   * Decode a complete document with default {@link DecoderOptions}.
   *
   * @throws BencodeException if {@code bytes} is not a single well-formed value
   */
  public static BencodeValue decode(byte[] bytes) throws BencodeException {
    return new Decoder().decode(bytes);
  }

  /** Decode a complete document with the given options. */
  public static BencodeValue decode(byte[] bytes, DecoderOptions options) throws BencodeException {
    return new Decoder(options).decode(bytes);
  }

  /** Encode {@code value} in canonical form. */
  public static byte[] encode(BencodeValue value) {
    return new Encoder().encode(value);
  }
}
