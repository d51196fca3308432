/**
 * Encoder/Decoder for <a href="https://www.bittorrent.org/beps/bep_0003.html#bencoding">bencode</a>.
 * <p>
 * See {@code com.booking.bencode.jackson.BencodeObjectMapper} for a higher-level interface binding POJOs.
 * <p>
 * The main entry points are {@link com.booking.bencode.Bencode}, {@link com.booking.bencode.Encoder} and
 * {@link com.booking.bencode.Decoder}, which convert between byte arrays and trees of
 * {@link com.booking.bencode.BencodeValue}. Decoding accepts only well-formed input (minimal integers,
 * strictly ascending dictionary keys, no trailing data) and encoding always produces canonical output.
 * <p>
 * {@link com.booking.bencode.TokenEncoder} and {@link com.booking.bencode.TokenDecoder} offer a low-level
 * interface that can be used to build custom encoders/decoders without materializing a value tree.
 */
package com.booking.bencode;
