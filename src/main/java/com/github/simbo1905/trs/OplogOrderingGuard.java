package com.github.simbo1905.trs;

import java.util.Optional;

/// Enforces strictly increasing keys on an oplog store and locates scan start points for
/// tailing readers.
final class OplogOrderingGuard {

  private final StoreData data;
  private final OplogKeyExtractor extractor;

  OplogOrderingGuard(StoreData data, OplogKeyExtractor extractor) {
    this.data = data;
    this.extractor = extractor;
  }

  /// Extracts the key of a new entry and checks it against the newest entry in the log. Must be
  /// called with the store lock held so the check and the insert that follows are one step.
  RecordId extractAndCheck(byte[] payload) throws MalformedRecordException, OutOfOrderException {
    InvariantViolation.invariant(
        data.lock.isHeldByCurrentThread(), "oplog key check without the store lock");
    final var key = extractor.extractKey(payload);
    if (key == null || !key.isNormal()) {
      throw new MalformedRecordException("oplog key extractor returned an invalid key " + key);
    }
    if (!data.records.isEmpty()) {
      final var last = data.records.lastKey();
      if (key.compareTo(last) <= 0) {
        throw new OutOfOrderException(key, last);
      }
    }
    return key;
  }

  Optional<RecordId> startPosition(RecordId startingPosition) {
    if (!data.isOplog) {
      return Optional.empty();
    }
    try (var ignored = data.lock.lock()) {
      final var floor = data.records.floorKey(startingPosition);
      return Optional.of(floor == null ? RecordId.NULL : floor);
    }
  }
}
