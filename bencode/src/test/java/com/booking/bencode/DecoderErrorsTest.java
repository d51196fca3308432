package com.booking.bencode;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class DecoderErrorsTest {
  private final String document;
  private final DecodeError error;
  private final int offset;

  @Parameters(name = "{0}")
  public static Collection<Object[]> data() {
    return MalformedCorpus.documents();
  }

  public DecoderErrorsTest(String document, DecodeError error, int offset) {
    this.document = document;
    this.error = error;
    this.offset = offset;
  }

  @Test
  public void rejected() {
    try {
      BencodeValue value = new Decoder().decode(TestUtils.bytes(document));
      fail("Decoded '" + document + "' as " + value);
    } catch (BencodeException e) {
      assertThat(e.getError(), is(error));
      assertThat(e.getOffset(), is(offset));
      assertThat(e.getMessage(), containsString("at offset " + offset));
    }
  }

  @Test
  public void rejectedAtSliceOffset() {
    byte[] body = TestUtils.bytes(document);
    byte[] padded = new byte[body.length + 6];
    System.arraycopy(body, 0, padded, 3, body.length);

    Decoder decoder = new Decoder();
    decoder.setData(new ByteArray(padded, 3, body.length));
    try {
      decoder.decode();
      fail("Decoded '" + document + "'");
    } catch (BencodeException e) {
      assertThat(e.getError(), is(error));
      assertThat(e.getOffset(), is(offset));
    }
  }

  @Test
  public void rejectedByFacade() {
    try {
      Bencode.decode(TestUtils.bytes(document));
      fail("Decoded '" + document + "'");
    } catch (BencodeException e) {
      assertThat(e.getError(), is(error));
    }
  }
}
