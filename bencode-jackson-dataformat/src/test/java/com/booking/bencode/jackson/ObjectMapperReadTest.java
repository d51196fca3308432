package com.booking.bencode.jackson;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.booking.bencode.Bencode;
import com.booking.bencode.BencodeDictionary;
import com.booking.bencode.BencodeException;
import com.booking.bencode.BencodeInteger;
import com.booking.bencode.BencodeList;
import com.booking.bencode.BencodeString;
import com.booking.bencode.DecodeError;
import com.booking.bencode.DecoderOptions;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class ObjectMapperReadTest {
  private static final TypeReference<Map<String, Object>> MAP_STRING_OBJECT =
    new TypeReference<Map<String, Object>>() {};

  private static class ScalarFields {
    public String stringField;
    public long longField;
    public int intField;
    public double doubleField;
    public boolean booleanField;
    public byte[] bytesField;
    public BigInteger bigIntegerField;
    public BigDecimal bigDecimalField;
  }

  private static class ArrayFields {
    public List<String> stringList;
    public String[] stringArray;
    public List<ScalarFields> scalarFieldsList;
  }

  private static class ObjectFields {
    public ScalarFields scalarFields;
  }

  private static class BooleanFields {
    public boolean fromZero;
    public boolean fromOne;
    public boolean fromEmpty;
    public boolean fromStringZero;
    public boolean fromString;
    public Boolean boxed;
  }

  private static class TorrentFile {
    public String announce;
    @JsonProperty("created by")
    public String createdBy;
    public Info info;
  }

  private static class Info {
    public long length;
    public String name;
    @JsonProperty("piece length")
    public int pieceLength;
    public byte[] pieces;
  }

  private final ObjectMapper mapper = new BencodeObjectMapper();

  @Test
  public void scalarFields() throws IOException {
    BencodeDictionary dictionary = BencodeDictionary.builder()
        .put("stringField", "abc")
        .put("longField", 7)
        .put("intField", -3)
        .put("doubleField", "5.375")
        .put("booleanField", 1)
        .put("bytesField", BencodeString.of(new byte[] { (byte) 0xff, 0x00 }))
        .put("bigIntegerField", BencodeInteger.of(new BigInteger("123456789012345678901234567890")))
        .put("bigDecimalField", "123.25")
        .build();

    ScalarFields scalarFields = mapper.readValue(Bencode.encode(dictionary), ScalarFields.class);

    assertEquals("abc", scalarFields.stringField);
    assertEquals(7, scalarFields.longField);
    assertEquals(-3, scalarFields.intField);
    assertEquals(5.375, scalarFields.doubleField, 0.0);
    assertTrue(scalarFields.booleanField);
    assertArrayEquals(new byte[] { (byte) 0xff, 0x00 }, scalarFields.bytesField);
    assertEquals(new BigInteger("123456789012345678901234567890"), scalarFields.bigIntegerField);
    assertEquals(new BigDecimal("123.25"), scalarFields.bigDecimalField);
  }

  @Test
  public void arrayFields() throws IOException {
    ArrayFields arrayFields = mapper.readValue(
        bytes("d16:scalarFieldsListld9:longFieldi1eed9:longFieldi2eee"
            + "11:stringArrayl1:ce10:stringListl1:a1:bee"),
        ArrayFields.class);

    assertEquals(Arrays.asList("a", "b"), arrayFields.stringList);
    assertArrayEquals(new String[] { "c" }, arrayFields.stringArray);
    assertEquals(2, arrayFields.scalarFieldsList.size());
    assertEquals(1, arrayFields.scalarFieldsList.get(0).longField);
    assertEquals(2, arrayFields.scalarFieldsList.get(1).longField);
  }

  @Test
  public void objectFields() throws IOException {
    ObjectFields objectFields = mapper.readValue(
        bytes("d12:scalarFieldsd11:stringField3:xyzee"), ObjectFields.class);

    assertEquals("xyz", objectFields.scalarFields.stringField);
  }

  @Test
  public void booleanCoercion() throws IOException {
    BooleanFields booleanFields = mapper.readValue(
        bytes("d5:boxedi0e9:fromEmpty0:7:fromOnei1e10:fromString3:yes14:fromStringZero1:08:fromZeroi0ee"),
        BooleanFields.class);

    assertFalse(booleanFields.fromZero);
    assertTrue(booleanFields.fromOne);
    assertFalse(booleanFields.fromEmpty);
    assertFalse(booleanFields.fromStringZero);
    assertTrue(booleanFields.fromString);
    assertEquals(Boolean.FALSE, booleanFields.boxed);
  }

  @Test
  public void integerAsBytes() throws IOException {
    ScalarFields scalarFields = mapper.readValue(bytes("d10:bytesFieldi42ee"), ScalarFields.class);

    assertArrayEquals("42".getBytes(StandardCharsets.US_ASCII), scalarFields.bytesField);
  }

  @Test
  public void untypedMap() throws IOException {
    Map<String, Object> map = mapper.readValue(bytes("d1:ai1e1:bli5000000000ei-1ee1:cd1:d1:eee"), MAP_STRING_OBJECT);

    assertEquals(1, map.get("a"));
    assertEquals(Arrays.asList(5000000000L, -1), map.get("b"));
    assertThat(map.get("c"), instanceOf(Map.class));
    assertEquals("e", ((Map<?, ?>) map.get("c")).get("d"));
  }

  @Test
  public void torrentMetainfo() throws IOException {
    BencodeDictionary dictionary = BencodeDictionary.builder()
        .put("announce", "http://tracker.example.com/announce")
        .put("created by", "mktorrent")
        .put("info", BencodeDictionary.builder()
            .put("length", 1048576)
            .put("name", "file.iso")
            .put("piece length", 262144)
            .put("pieces", BencodeString.of(new byte[80]))
            .build())
        .build();

    TorrentFile torrent = mapper.readValue(Bencode.encode(dictionary), TorrentFile.class);

    assertEquals("http://tracker.example.com/announce", torrent.announce);
    assertEquals("mktorrent", torrent.createdBy);
    assertEquals(1048576, torrent.info.length);
    assertEquals("file.iso", torrent.info.name);
    assertEquals(262144, torrent.info.pieceLength);
    assertEquals(80, torrent.info.pieces.length);
  }

  @Test
  public void listRoot() throws IOException {
    List<Object> list = mapper.readValue(
        Bencode.encode(BencodeList.of(BencodeString.of("x"), BencodeInteger.of(2))),
        new TypeReference<List<Object>>() {});

    assertEquals(Arrays.asList("x", 2), list);
  }

  @Test
  public void malformedDocument() throws IOException {
    try {
      mapper.readValue(bytes("d1:bi1e1:ai2ee"), MAP_STRING_OBJECT);
      fail("Expected format error");
    } catch (JsonParseException e) {
      BencodeException cause = (BencodeException) e.getCause();
      assertEquals(DecodeError.UNSORTED_OR_DUPLICATE_KEY, cause.getError());
      assertEquals(7, cause.getOffset());
    }
  }

  @Test
  public void lenientMapper() throws IOException {
    ObjectMapper lenient = new BencodeObjectMapper(new DecoderOptions().allowUnsortedKeys(true));

    Map<String, Object> map = lenient.readValue(bytes("d1:bi1e1:ai2ee"), MAP_STRING_OBJECT);

    assertEquals(2, map.size());
    assertEquals(2, map.get("a"));
  }

  @Test
  public void copy() throws IOException {
    ObjectMapper copy = ((BencodeObjectMapper) mapper).copy();

    BooleanFields booleanFields = copy.readValue(bytes("d7:fromOnei1ee"), BooleanFields.class);
    assertTrue(booleanFields.fromOne);
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.ISO_8859_1);
  }
}
