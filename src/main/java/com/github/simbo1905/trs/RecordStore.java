package com.github.simbo1905.trs;

import java.util.List;
import java.util.Optional;

/// The record storage contract of one collection: a map from [RecordId] to byte payloads that
/// takes part in a [TransactionContext]. Each backend supplies its own implementation, chosen by
/// its [RecordStoreEngine] when the store is opened.
///
/// Every mutating call registers [Change]s with the caller's transaction. A call that fails with
/// a [RecordStoreException] leaves the transaction exactly as it was before the call.
public interface RecordStore {

  /// Name of the backend, e.g. `inMemory`.
  String name();

  String namespace();

  boolean isCapped();

  boolean isOplog();

  /// Inserts the batch in order and returns the ids assigned. All or nothing.
  ///
  /// @throws CapacityExceededException if the store is capped and a record is larger than its
  /// maximum size
  /// @throws OutOfOrderException if the store is an oplog and a key does not sort after the last
  /// key in the log
  /// @throws MalformedRecordException if the store is an oplog and a key cannot be extracted
  /// @throws EvictionVetoedException if a capped delete triggered by the insert was vetoed
  List<RecordId> insertRecords(TransactionContext txn, List<byte[]> batch)
      throws RecordStoreException;

  /// Single record form of [#insertRecords(TransactionContext, List)].
  RecordId insertRecord(TransactionContext txn, byte[] data) throws RecordStoreException;

  /// Replaces the payload of an existing record. A capped store may not change a record's length.
  ///
  /// @throws EvictionVetoedException if a capped delete triggered by the update was vetoed
  /// @throws InvariantViolation if the record does not exist or a capped record changes length
  void updateRecord(TransactionContext txn, RecordId id, byte[] data) throws RecordStoreException;

  boolean updateWithDamagesSupported();

  /// Applies byte range copies from `damageSource` onto the record. The new payload is built on a
  /// private copy and installed in one step.
  ///
  /// @return the new payload
  /// @throws IllegalArgumentException if a damage falls outside the source or the record
  RecordData updateWithDamages(
      TransactionContext txn, RecordId id, byte[] damageSource, List<DamageEvent> damages)
      throws RecordStoreException;

  /// @throws InvariantViolation if the record does not exist
  void deleteRecord(TransactionContext txn, RecordId id);

  /// Returns the payload of a record that must exist. Use [#findRecord(RecordId)] when it may
  /// not.
  ///
  /// @throws InvariantViolation if the record does not exist
  RecordData dataFor(RecordId id);

  Optional<RecordData> findRecord(RecordId id);

  /// Removes every record in constant time. Rolling back puts the old contents back.
  void truncate(TransactionContext txn);

  /// Deletes every record after `end`, and `end` itself when inclusive, newest last. Each delete
  /// is offered to the capped callback first.
  ///
  /// @throws EvictionVetoedException if the callback refuses a delete
  void cappedTruncateAfter(TransactionContext txn, RecordId end, boolean inclusive)
      throws EvictionVetoedException;

  long numRecords();

  /// Sum of the payload sizes of the records present.
  long dataSize();

  /// Bytes used to store the records.
  long storageSize();

  /// @param forward ascending id order if true, descending otherwise
  SeekableRecordCursor getCursor(boolean forward);

  /// Finds where a tailing reader should start scanning an oplog.
  ///
  /// @return empty if this is not an oplog store; [RecordId#NULL] if the log is empty or the
  /// position precedes every entry; otherwise the greatest stored id not after the position
  Optional<RecordId> oplogStartPosition(RecordId startingPosition);

  RecordStoreStats stats();
}
