package com.github.simbo1905.trs;

import java.nio.ByteBuffer;

/// Oplog entries that start with their timestamp as a big-endian 64-bit value.
public final class LongPrefixKeyExtractor implements OplogKeyExtractor {

  public static final LongPrefixKeyExtractor INSTANCE = new LongPrefixKeyExtractor();

  private LongPrefixKeyExtractor() {
  }

  @Override
  public RecordId extractKey(byte[] payload) throws MalformedRecordException {
    if (payload == null || payload.length < Long.BYTES) {
      throw new MalformedRecordException(
          String.format("oplog entry of %d bytes is too short to carry a timestamp",
              payload == null ? 0 : payload.length));
    }
    final var key = RecordId.of(ByteBuffer.wrap(payload, 0, Long.BYTES).getLong());
    if (!key.isNormal()) {
      throw new MalformedRecordException("oplog entry timestamp must be positive, got " + key);
    }
    return key;
  }

  /// Builds a payload whose first eight bytes are the timestamp.
  public static byte[] encode(long timestamp, byte[] body) {
    return ByteBuffer.allocate(Long.BYTES + body.length).putLong(timestamp).put(body).array();
  }
}
