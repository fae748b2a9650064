package com.github.simbo1905.trs;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Keeps a capped store within its size and document limits by deleting the oldest records.
/// Every method expects the store lock to be held by the caller.
final class CappedEvictor {

  private static final Logger logger = Logger.getLogger(CappedEvictor.class.getName());

  private final RecordStoreOptions options;
  private final StoreData data;
  /// Back-reference used to delete through the store so each eviction registers its own change.
  private final InMemoryRecordStore store;

  CappedEvictor(RecordStoreOptions options, StoreData data, InMemoryRecordStore store) {
    this.options = options;
    this.data = data;
    this.store = store;
  }

  /// Rejects a batch up front if any record could never fit. Nothing is evicted to make room for a
  /// record that is too large on its own.
  void checkFits(List<byte[]> batch) throws CapacityExceededException {
    if (!options.isCapped()) {
      return;
    }
    for (byte[] bytes : batch) {
      if (bytes.length > options.getCappedMaxSize()) {
        throw new CapacityExceededException(
            String.format(
                "object to insert of %d bytes exceeds cappedMaxSize %d of %s",
                bytes.length, options.getCappedMaxSize(), options.getNamespace()));
      }
    }
  }

  boolean needsDelete() {
    if (!options.isCapped()) {
      return false;
    }
    if (data.dataSize > options.getCappedMaxSize()) {
      return true;
    }
    return options.hasCappedMaxDocs() && data.records.size() > options.getCappedMaxDocs();
  }

  /// Deletes oldest records until the store is within its limits.
  ///
  /// @throws EvictionVetoedException if the callback refuses a delete; records already evicted by
  /// this call stay deleted until the caller rolls back
  void deleteAsNeeded(TransactionContext txn) throws EvictionVetoedException {
    ensureLocked();
    while (needsDelete()) {
      InvariantViolation.invariant(
          !data.records.isEmpty(), "capped store %s over its limits with no records",
          options.getNamespace());
      final var oldest = data.records.firstEntry();
      final var id = oldest.getKey();
      offerToCallback(txn, id, oldest.getValue());
      logger.log(
          Level.FINE,
          () -> String.format(
              "evicting %s of %d bytes from %s, size:%d count:%d", id, oldest.getValue().size(),
              options.getNamespace(), data.dataSize, data.records.size()));
      store.deleteLocked(txn, id);
    }
  }

  /// Deletes every record after `end` (and `end` itself when inclusive).
  void truncateAfter(TransactionContext txn, RecordId end, boolean inclusive)
      throws EvictionVetoedException {
    ensureLocked();
    final var doomed = new ArrayList<>(data.records.tailMap(end, inclusive).entrySet());
    logger.log(
        Level.FINE,
        () -> String.format(
            "cappedTruncateAfter %s inclusive:%s removing %d records from %s", end, inclusive,
            doomed.size(), options.getNamespace()));
    for (var entry : doomed) {
      offerToCallback(txn, entry.getKey(), entry.getValue());
      store.deleteLocked(txn, entry.getKey());
    }
  }

  private void ensureLocked() {
    InvariantViolation.invariant(
        data.lock.isHeldByCurrentThread(), "capped delete on %s without the store lock",
        options.getNamespace());
  }

  private void offerToCallback(TransactionContext txn, RecordId id, RecordData record)
      throws EvictionVetoedException {
    final var callback = options.getCappedCallback();
    if (callback == null) {
      return;
    }
    try {
      callback.aboutToDeleteCapped(txn, id, record);
    } catch (EvictionVetoedException e) {
      logger.log(
          Level.WARNING,
          () -> String.format(
              "delete of %s from %s vetoed: %s", id, options.getNamespace(), e.getMessage()));
      throw e;
    }
  }
}
