/**
 * Jackson dataformat adapter for bencode.
 * <p>
 * The most useful class is {@link com.booking.bencode.jackson.BencodeObjectMapper}, which is a convenience
 * subclass of {@link com.fasterxml.jackson.databind.ObjectMapper}.
 * <p>
 * {@link com.booking.bencode.jackson.BencodeParser} and {@link com.booking.bencode.jackson.BencodeGenerator} are
 * lower-level adapters for the Jackson API, with a streaming interface, and can be constructed through
 * {@link com.booking.bencode.jackson.BencodeFactory}.
 */
package com.booking.bencode.jackson;
