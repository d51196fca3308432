package com.booking.bencode.jackson;

import com.booking.bencode.DecoderOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * {@link ObjectMapper} preconfigured for bencode documents.
 * <p>
 * Bencode has no boolean, floating point or null values, and its strings are raw bytes. This mapper registers
 * {@link BencodeBooleanDeserializer}, so that the {@code i0e}/{@code i1e} flags found in torrent files and
 * tracker responses bind to {@code boolean} properties, and {@link BencodeBytesDeserializer}, so that
 * {@code byte[]} properties receive the string bytes as-is instead of a Base64 decoding of them.
 * <p>
 * Null properties and null map values are left out of the output, since {@link BencodeGenerator} can not
 * write them.
 */
public class BencodeObjectMapper extends ObjectMapper {
  public BencodeObjectMapper() {
    super(new BencodeFactory());
    registerBencodeModule();
  }

  /**
   * @param decoderOptions passed to the underlying {@link BencodeFactory}, {@code null} for the defaults
   */
  public BencodeObjectMapper(DecoderOptions decoderOptions) {
    super(new BencodeFactory(decoderOptions));
    registerBencodeModule();
  }

  protected BencodeObjectMapper(BencodeObjectMapper src) {
    super(src);
  }

  @Override
  public Version version() {
    return BencodeFactory.VERSION;
  }

  @Override
  public BencodeObjectMapper copy() {
    _checkInvalidCopy(BencodeObjectMapper.class);
    return new BencodeObjectMapper(this);
  }

  private void registerBencodeModule() {
    SimpleModule m = new SimpleModule("BencodeCoercionModule", BencodeFactory.VERSION);
    m.addDeserializer(Boolean.TYPE, new BencodeBooleanDeserializer());
    m.addDeserializer(Boolean.class, new BencodeBooleanDeserializer());
    m.addDeserializer(byte[].class, new BencodeBytesDeserializer());
    registerModule(m);

    setDefaultPropertyInclusion(JsonInclude.Value.construct(JsonInclude.Include.NON_NULL, JsonInclude.Include.NON_NULL));
  }
}
