package com.booking.bencode.jackson;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import java.io.IOException;
import java.math.BigInteger;

/**
 * Binds bencode integers and strings to {@code boolean}.
 * <p>
 * Flags are conventionally encoded as {@code i0e} and {@code i1e}: any non-zero integer is {@code true}. Strings
 * are {@code false} when empty or {@code "0"}. A missing value is {@code false}; lists and dictionaries fail.
 */
public class BencodeBooleanDeserializer extends JsonDeserializer<Boolean> {
  @Override
  public Boolean deserialize(JsonParser jsonParser, DeserializationContext deserializationContext)
      throws IOException, JsonProcessingException {
    switch (jsonParser.currentToken()) {
      case VALUE_TRUE:
        return Boolean.TRUE;
      case VALUE_FALSE:
        return Boolean.FALSE;
      case VALUE_NUMBER_INT:
        BigInteger intValue = jsonParser.getBigIntegerValue();

        return Boolean.valueOf(intValue.signum() != 0);
      case VALUE_STRING:
        String stringValue = jsonParser.getText();

        return Boolean.valueOf(!(stringValue.isEmpty() || stringValue.equals("0")));
      default:
        throw new JsonParseException(jsonParser, "Unsupported token " + jsonParser.currentToken());
    }
  }

  @Override
  public Boolean getNullValue(DeserializationContext ctxt) throws JsonMappingException {
    return Boolean.FALSE;
  }
}
