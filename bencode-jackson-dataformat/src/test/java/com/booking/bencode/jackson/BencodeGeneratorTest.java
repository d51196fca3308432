package com.booking.bencode.jackson;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import com.fasterxml.jackson.core.JsonGenerationException;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.junit.Test;

public class BencodeGeneratorTest {
  private static final BencodeFactory FACTORY = new BencodeFactory();

  private final ByteArrayOutputStream bos = new ByteArrayOutputStream();
  private final JsonGenerator generator = newGenerator(bos);

  @Test
  public void writeObjectSanity() throws IOException {
    generator.writeStartObject();
    generator.writeEndObject();

    assertEquals("de", output());
  }

  @Test
  public void writeArraySanity() throws IOException {
    generator.writeStartArray();
    generator.writeEndArray();

    assertEquals("le", output());
  }

  @Test
  public void writeString() throws IOException {
    generator.writeStartObject();
    generator.writeFieldName("field");
    generator.writeString("value");
    generator.writeEndObject();

    assertEquals("d5:field5:valuee", output());
  }

  @Test
  public void writeUtf8() throws IOException {
    generator.writeString("각");

    assertArrayEquals(new byte[] { '3', ':', (byte) 0xea, (byte) 0xb0, (byte) 0x81 }, bos.toByteArray());
  }

  @Test
  public void writeCharArray() throws IOException {
    generator.writeString("a spam b".toCharArray(), 2, 4);

    assertEquals("4:spam", output());
  }

  @Test
  public void writeBinary() throws IOException {
    byte[] bytes = new byte[] { (byte) 0xff, 0x00, 0x41 };
    generator.writeBinary(bytes);

    assertArrayEquals(new byte[] { '3', ':', (byte) 0xff, 0x00, 0x41 }, bos.toByteArray());
  }

  @Test
  public void writeNumbers() throws IOException {
    generator.writeStartArray();
    generator.writeNumber(7);
    generator.writeNumber(-8L);
    generator.writeNumber(new BigInteger("123456789012345678901234567890"));
    generator.writeNumber(1.5d);
    generator.writeNumber(2.25f);
    generator.writeNumber(new BigDecimal("3.125"));
    generator.writeNumber("42");
    generator.writeEndArray();

    assertEquals("li7ei-8ei123456789012345678901234567890e3:1.54:2.255:3.1252:42e", output());
  }

  @Test
  public void writeBoolean() throws IOException {
    generator.writeStartArray();
    generator.writeBoolean(true);
    generator.writeBoolean(false);
    generator.writeEndArray();

    assertEquals("li1ei0ee", output());
  }

  @Test
  public void keysAreSorted() throws IOException {
    generator.writeStartObject();
    generator.writeFieldName("spam");
    generator.writeString("eggs");
    generator.writeFieldName("cow");
    generator.writeStartObject();
    generator.writeFieldName("z");
    generator.writeNumber(1);
    generator.writeFieldName("a");
    generator.writeNumber(2);
    generator.writeEndObject();
    generator.writeEndObject();

    assertEquals("d3:cowd1:ai2e1:zi1ee4:spam4:eggse", output());
  }

  @Test
  public void outputWrittenWhenComplete() throws IOException {
    generator.writeStartArray();
    generator.writeNumber(1);
    assertEquals(0, bos.size());

    generator.writeEndArray();
    assertEquals("li1ee", new String(bos.toByteArray(), StandardCharsets.ISO_8859_1));
  }

  @Test
  public void sequenceOfRootValues() throws IOException {
    generator.writeNumber(1);
    generator.writeString("a");

    assertEquals("i1e1:a", output());
  }

  @Test
  public void writeNull() throws IOException {
    generator.writeStartArray();
    try {
      generator.writeNull();
      fail("Expected generation error");
    } catch (JsonGenerationException e) {
      assertThat(e.getMessage(), containsString("can not represent null"));
    }
  }

  @Test
  public void duplicateField() throws IOException {
    generator.writeStartObject();
    generator.writeFieldName("a");
    generator.writeNumber(1);
    generator.writeFieldName("a");
    generator.writeNumber(2);
    try {
      generator.writeEndObject();
      fail("Expected generation error");
    } catch (JsonGenerationException e) {
      assertThat(e.getMessage(), containsString("Duplicate dictionary key"));
    }
  }

  @Test(expected = JsonGenerationException.class)
  public void mismatchedEnd() throws IOException {
    generator.writeStartObject();
    generator.writeEndArray();
  }

  @Test(expected = UnsupportedOperationException.class)
  public void writeRaw() throws IOException {
    generator.writeRaw("i1e");
  }

  @Test(expected = UnsupportedOperationException.class)
  public void writerTarget() throws IOException {
    FACTORY.createGenerator(new StringWriter());
  }

  private String output() throws IOException {
    generator.close();

    return new String(bos.toByteArray(), StandardCharsets.ISO_8859_1);
  }

  private static JsonGenerator newGenerator(OutputStream os) {
    try {
      return FACTORY.createGenerator(os);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
