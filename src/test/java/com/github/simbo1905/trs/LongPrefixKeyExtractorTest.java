package com.github.simbo1905.trs;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class LongPrefixKeyExtractorTest {

  private final OplogKeyExtractor extractor = LongPrefixKeyExtractor.INSTANCE;

  @Test
  public void testReadsBigEndianPrefix() throws Exception {
    final var payload = new byte[] {0, 0, 0, 0, 0, 0, 1, 2, 'x'};
    assertThat(extractor.extractKey(payload), is(RecordId.of(258)));
    assertThat(
        extractor.extractKey(LongPrefixKeyExtractor.encode(Long.MAX_VALUE, new byte[0])),
        is(RecordId.MAX));
  }

  @Test
  public void testRejectsShortOrNonPositive() {
    assertThrows(MalformedRecordException.class, () -> extractor.extractKey(new byte[7]));
    assertThrows(MalformedRecordException.class, () -> extractor.extractKey(new byte[8]));
    assertThrows(
        MalformedRecordException.class,
        () -> extractor.extractKey(LongPrefixKeyExtractor.encode(-1, new byte[] {1})));
  }
}
