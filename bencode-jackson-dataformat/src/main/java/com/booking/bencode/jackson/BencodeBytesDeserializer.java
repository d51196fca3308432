package com.booking.bencode.jackson;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Custom deserializer for {@code byte[]} values.
 * <p>
 * Bencode strings are returned as-is, without Base64 decoding; integers are converted to their decimal
 * representation.
 * <p>
 * Lists and dictionaries are an error.
 */
public class BencodeBytesDeserializer extends JsonDeserializer<byte[]> {
  @Override
  public byte[] deserialize(JsonParser jsonParser, DeserializationContext deserializationContext)
      throws IOException, JsonProcessingException {
    switch (jsonParser.currentToken()) {
      case VALUE_STRING:
        return jsonParser.getBinaryValue();
      case VALUE_NUMBER_INT:
        return jsonParser.getText().getBytes(StandardCharsets.US_ASCII);
      default:
        throw new JsonParseException(jsonParser, "Unsupported token " + jsonParser.currentToken());
    }
  }
}
