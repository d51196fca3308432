package com.booking.bencode;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;

public class EncoderTest {
  private final Encoder encoder = new Encoder();

  @Test
  public void integers() {
    assertEncoded("i42e", BencodeInteger.of(42));
    assertEncoded("i-42e", BencodeInteger.of(-42));
    assertEncoded("i0e", BencodeInteger.of(0));
    assertEncoded("i-9223372036854775808e", BencodeInteger.of(Long.MIN_VALUE));
    assertEncoded("i123456789012345678901234567890e",
        BencodeInteger.of(new BigInteger("123456789012345678901234567890")));
  }

  @Test
  public void strings() {
    assertEncoded("4:spam", BencodeString.of("spam"));
    assertEncoded("0:", BencodeString.of(new byte[0]));
    assertArrayEquals(TestUtils.byteArray('2', ':', 0xff, 0x00),
        encoder.encode(BencodeString.of(TestUtils.byteArray(0xff, 0x00))));
  }

  @Test
  public void utf8Strings() {
    assertArrayEquals(TestUtils.byteArray('5', ':', 'c', 'a', 'f', 0xc3, 0xa9),
        encoder.encode(BencodeString.of("café")));
  }

  @Test
  public void lists() {
    assertEncoded("le", BencodeList.of());
    assertEncoded("l4:spami42ee", BencodeList.of(BencodeString.of("spam"), BencodeInteger.of(42)));
    assertEncoded("llelleee", BencodeList.of(BencodeList.of(), BencodeList.of(BencodeList.of())));
  }

  @Test
  public void canonicalDictionary() {
    BencodeDictionary dictionary = BencodeDictionary.builder()
        .put("spam", "eggs")
        .put("cow", "moo")
        .build();

    assertEncoded("d3:cow3:moo4:spam4:eggse", dictionary);
  }

  @Test
  public void insertionOrderDoesNotMatter() {
    Map<BencodeString, BencodeValue> forward = new LinkedHashMap<>();
    forward.put(BencodeString.of("a"), BencodeInteger.of(1));
    forward.put(BencodeString.of("b"), BencodeInteger.of(2));
    forward.put(BencodeString.of("c"), BencodeInteger.of(3));

    Map<BencodeString, BencodeValue> backward = new LinkedHashMap<>();
    backward.put(BencodeString.of("c"), BencodeInteger.of(3));
    backward.put(BencodeString.of("b"), BencodeInteger.of(2));
    backward.put(BencodeString.of("a"), BencodeInteger.of(1));

    assertArrayEquals(encoder.encode(BencodeDictionary.of(forward)), encoder.encode(BencodeDictionary.of(backward)));
    assertEncoded("d1:ai1e1:bi2e1:ci3ee", BencodeDictionary.of(backward));
  }

  @Test
  public void unsignedKeyOrder() {
    BencodeDictionary dictionary = BencodeDictionary.builder()
        .put(BencodeString.of(TestUtils.byteArray(0x80)), BencodeInteger.of(2))
        .put(BencodeString.of(TestUtils.byteArray(0x7f)), BencodeInteger.of(1))
        .build();

    assertArrayEquals(TestUtils.byteArray('d', '1', ':', 0x7f, 'i', '1', 'e', '1', ':', 0x80, 'i', '2', 'e', 'e'),
        encoder.encode(dictionary));
  }

  @Test
  public void prefixKeysSortFirst() {
    BencodeDictionary dictionary = BencodeDictionary.builder()
        .put("ab", 2)
        .put("a", 1)
        .put("", 0)
        .build();

    assertEncoded("d0:i0e1:ai1e2:abi2ee", dictionary);
  }

  @Test
  public void nestedDictionaries() {
    BencodeDictionary dictionary = BencodeDictionary.builder()
        .put("z", BencodeList.of(BencodeDictionary.builder().put("y", 1).put("x", 2).build()))
        .put("a", BencodeDictionary.empty())
        .build();

    assertEncoded("d1:ade1:zld1:xi2e1:yi1eeee", dictionary);
  }

  @Test
  public void encoderIsReusable() {
    assertEncoded("i1e", BencodeInteger.of(1));
    assertEncoded("4:spam", BencodeString.of("spam"));

    byte[] first = encoder.write(BencodeString.of("long enough to be visible")).getData();
    ByteArray second = encoder.write(BencodeInteger.of(7)).getDataReference();

    assertEquals("25:long enough to be visible", TestUtils.string(first));
    assertEquals("i7e", new String(second.array, second.start, second.length));
  }

  @Test
  public void largeStrings() {
    byte[] content = new byte[100000];
    for (int i = 0; i < content.length; ++i) {
      content[i] = (byte) i;
    }
    byte[] encoded = encoder.encode(BencodeString.of(content));

    assertEquals("100000:", TestUtils.string(encoded).substring(0, 7));
    assertEquals(content.length + 7, encoded.length);
  }

  @Test(expected = NullPointerException.class)
  public void nullValue() {
    encoder.encode(null);
  }

  @Test
  public void facade() {
    assertEquals("d3:fooi1ee", TestUtils.string(Bencode.encode(BencodeDictionary.builder().put("foo", 1).build())));
  }

  private void assertEncoded(String expected, BencodeValue value) {
    assertEquals(expected, TestUtils.string(encoder.encode(value)));
  }
}
