package com.booking.bencode.jackson;

import com.booking.bencode.TokenDecoder;
import com.fasterxml.jackson.core.JsonStreamContext;
import java.nio.charset.StandardCharsets;

class BencodeReaderContext extends JsonStreamContext {
  private final BencodeReaderContext parent;
  private Object currentValue;
  private String currentName;
  private byte[] buffer;
  private int nameStart, nameLength;
  private boolean hasName;

  BencodeReaderContext() {
    this.parent = null;
  }

  BencodeReaderContext(BencodeReaderContext parent, int type) {
    super(type, -1);
    this.parent = parent;
  }

  void nextIndex() {
    _index++;
  }

  // decoded to a String on first access
  void setCurrentName(TokenDecoder decoder) {
    currentName = null;
    hasName = true;
    buffer = decoder.decoderBuffer();
    nameStart = decoder.binarySliceStart();
    nameLength = decoder.binarySliceLength();
  }

  @Override
  public BencodeReaderContext getParent() {
    return parent;
  }

  @Override
  public String getCurrentName() {
    if (currentName == null && buffer != null) {
      currentName = new String(buffer, nameStart, nameLength, StandardCharsets.UTF_8);
    }
    return currentName;
  }

  void setCurrentName(String currentName) {
    this.currentName = currentName;
    this.buffer = null;
    hasName = true;
  }

  @Override
  public boolean hasCurrentName() {
    return hasName;
  }

  @Override
  public Object getCurrentValue() {
    return currentValue;
  }

  @Override
  public void setCurrentValue(Object value) {
    currentValue = value;
  }
}
