package com.github.simbo1905.trs;

import static com.github.simbo1905.trs.InvariantViolation.invariant;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Record store that keeps every record on the heap in an ordered map. It is the reference
/// backend of the [RecordStore] contract.
///
/// Mutations take the store lock for the duration of one call only. Each one registers a [Change]
/// with the caller's transaction before returning, and a call that fails with a
/// [RecordStoreException] rolls back the changes it registered while it still holds the lock, so
/// other threads never see a partly applied call.
public class InMemoryRecordStore implements RecordStore {

  private static final Logger logger = Logger.getLogger(InMemoryRecordStore.class.getName());

  public static final String NAME = "inMemory";

  /// <ul>
  ///   <li><b>OPEN</b> - operational</li>
  ///   <li><b>DROPPED</b> - the namespace was dropped from its engine</li>
  /// </ul>
  enum StoreState {
    OPEN,
    DROPPED
  }

  private final RecordStoreOptions options;
  private final StoreData data;
  private final CappedEvictor evictor;
  private final OplogOrderingGuard oplogGuard;

  InMemoryRecordStore(RecordStoreOptions options, StoreData data) {
    invariant(
        options.isOplog() == data.isOplog, "store %s opened with oplog=%s over data with oplog=%s",
        options.getNamespace(), options.isOplog(), data.isOplog);
    this.options = options;
    this.data = data;
    this.evictor = new CappedEvictor(options, data, this);
    this.oplogGuard = new OplogOrderingGuard(data, options.getKeyExtractor());
    logger.log(Level.FINE, () -> String.format("opened %s", options));
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String namespace() {
    return options.getNamespace();
  }

  @Override
  public boolean isCapped() {
    return options.isCapped();
  }

  @Override
  public boolean isOplog() {
    return options.isOplog();
  }

  StoreState state() {
    return data.isDropped() ? StoreState.DROPPED : StoreState.OPEN;
  }

  @Override
  public List<RecordId> insertRecords(TransactionContext txn, List<byte[]> batch)
      throws RecordStoreException {
    ensureOpen();
    evictor.checkFits(batch);
    final var ids = new ArrayList<RecordId>(batch.size());
    try (var ignored = data.lock.lock()) {
      final var savepoint = txn.savepoint();
      try {
        for (byte[] bytes : batch) {
          ids.add(insertLocked(txn, bytes));
        }
      } catch (RecordStoreException e) {
        logger.log(
            Level.WARNING,
            () -> String.format(
                "insert of %d records into %s failed after %d: %s", batch.size(), namespace(),
                ids.size(), e.getMessage()));
        txn.rollbackTo(savepoint);
        throw e;
      }
    }
    return ids;
  }

  @Override
  public RecordId insertRecord(TransactionContext txn, byte[] bytes) throws RecordStoreException {
    return insertRecords(txn, List.of(bytes)).get(0);
  }

  private RecordId insertLocked(TransactionContext txn, byte[] bytes) throws RecordStoreException {
    final var record = RecordData.copyOf(bytes);
    final var id = data.isOplog ? oplogGuard.extractAndCheck(bytes) : allocateId();
    logger.log(
        Level.FINE,
        () -> String.format("insertRecord %s len:%d into %s", id, record.size(), namespace()));
    data.dataSize += record.size();
    data.records.put(id, record);
    txn.registerChange(new InsertChange(data, id));
    evictor.deleteAsNeeded(txn);
    return id;
  }

  private RecordId allocateId() {
    final var id = RecordId.of(data.nextId++);
    invariant(id.isNormal(), "record id allocator of %s exhausted at %s", namespace(), id);
    return id;
  }

  @Override
  public void updateRecord(TransactionContext txn, RecordId id, byte[] bytes)
      throws RecordStoreException {
    ensureOpen();
    final var record = RecordData.copyOf(bytes);
    try (var ignored = data.lock.lock()) {
      final var old = recordFor(id);
      // capped records cannot change size; callers above the storage layer check this
      invariant(
          !isCapped() || record.size() == old.size(),
          "update of %s in capped store %s changes length from %d to %d", id, namespace(),
          old.size(), record.size());
      logger.log(
          Level.FINE,
          () -> String.format(
              "updateRecord %s len:%d->%d in %s", id, old.size(), record.size(), namespace()));
      replaceLocked(txn, id, old, record);
    }
  }

  @Override
  public boolean updateWithDamagesSupported() {
    return true;
  }

  @Override
  public RecordData updateWithDamages(
      TransactionContext txn, RecordId id, byte[] damageSource, List<DamageEvent> damages)
      throws RecordStoreException {
    ensureOpen();
    try (var ignored = data.lock.lock()) {
      final var old = recordFor(id);
      final var patched = new byte[old.size()];
      old.copyTo(0, patched, 0, old.size());
      for (DamageEvent damage : damages) {
        checkDamage(damage, damageSource.length, patched.length);
        System.arraycopy(
            damageSource, damage.sourceOffset(), patched, damage.targetOffset(), damage.size());
      }
      final var record = RecordData.wrap(patched);
      logger.log(
          Level.FINE,
          () -> String.format(
              "updateWithDamages %s damages:%d in %s", id, damages.size(), namespace()));
      replaceLocked(txn, id, old, record);
      return record;
    }
  }

  private static void checkDamage(DamageEvent damage, int sourceLength, int recordLength) {
    if ((long) damage.sourceOffset() + damage.size() > sourceLength
        || (long) damage.targetOffset() + damage.size() > recordLength) {
      throw new IllegalArgumentException(
          String.format(
              "%s out of range for source of %d bytes and record of %d bytes", damage,
              sourceLength, recordLength));
    }
  }

  private void replaceLocked(TransactionContext txn, RecordId id, RecordData old,
      RecordData record) throws EvictionVetoedException {
    final var savepoint = txn.savepoint();
    txn.registerChange(new RemoveChange(data, id, old, true));
    data.dataSize += record.size() - old.size();
    data.records.put(id, record);
    try {
      evictor.deleteAsNeeded(txn);
    } catch (EvictionVetoedException e) {
      txn.rollbackTo(savepoint);
      throw e;
    }
  }

  @Override
  public void deleteRecord(TransactionContext txn, RecordId id) {
    ensureOpen();
    try (var ignored = data.lock.lock()) {
      logger.log(Level.FINE, () -> String.format("deleteRecord %s from %s", id, namespace()));
      deleteLocked(txn, id);
    }
  }

  /// Deletes a record that must exist. The caller holds the store lock.
  void deleteLocked(TransactionContext txn, RecordId id) {
    final var old = recordFor(id);
    txn.registerChange(new RemoveChange(data, id, old, false));
    data.dataSize -= old.size();
    data.records.remove(id);
  }

  @Override
  public RecordData dataFor(RecordId id) {
    ensureOpen();
    try (var ignored = data.lock.lock()) {
      return recordFor(id);
    }
  }

  private RecordData recordFor(RecordId id) {
    final var record = data.records.get(id);
    if (record == null) {
      throw InvariantViolation.raise("cannot find record for %s:%s", namespace(), id);
    }
    return record;
  }

  @Override
  public Optional<RecordData> findRecord(RecordId id) {
    ensureOpen();
    try (var ignored = data.lock.lock()) {
      return Optional.ofNullable(data.records.get(id));
    }
  }

  @Override
  public void truncate(TransactionContext txn) {
    ensureOpen();
    try (var ignored = data.lock.lock()) {
      logger.log(
          Level.FINE,
          () -> String.format(
              "truncate %s dropping %d records of %d bytes", namespace(), data.records.size(),
              data.dataSize));
      final var change = new TruncateChange(data);
      txn.registerChange(change);
      change.swap();
    }
  }

  @Override
  public void cappedTruncateAfter(TransactionContext txn, RecordId end, boolean inclusive)
      throws EvictionVetoedException {
    ensureOpen();
    try (var ignored = data.lock.lock()) {
      final var savepoint = txn.savepoint();
      try {
        evictor.truncateAfter(txn, end, inclusive);
      } catch (EvictionVetoedException e) {
        txn.rollbackTo(savepoint);
        throw e;
      }
    }
  }

  @Override
  public long numRecords() {
    ensureOpen();
    try (var ignored = data.lock.lock()) {
      return data.records.size();
    }
  }

  @Override
  public long dataSize() {
    ensureOpen();
    try (var ignored = data.lock.lock()) {
      return data.dataSize;
    }
  }

  /// Same as [#dataSize()]: records on the heap carry no storage overhead that is accounted for.
  @Override
  public long storageSize() {
    return dataSize();
  }

  @Override
  public SeekableRecordCursor getCursor(boolean forward) {
    ensureOpen();
    return new InMemoryRecordCursor(data, forward, isCapped());
  }

  @Override
  public Optional<RecordId> oplogStartPosition(RecordId startingPosition) {
    ensureOpen();
    return oplogGuard.startPosition(startingPosition);
  }

  @Override
  public RecordStoreStats stats() {
    ensureOpen();
    try (var ignored = data.lock.lock()) {
      return new RecordStoreStats(
          namespace(), isCapped(), options.getCappedMaxDocs(), options.getCappedMaxSize(),
          data.records.size(), data.dataSize);
    }
  }

  private void ensureOpen() {
    final var state = state();
    if (state != StoreState.OPEN) {
      throw new IllegalStateException(
          "Store " + namespace() + " is in state " + state + ", expected OPEN");
    }
  }

  @Override
  public String toString() {
    return "InMemoryRecordStore[" + namespace() + "]";
  }

  /// Undoes an insert by removing the record again.
  static final class InsertChange implements Change {
    private final StoreData data;
    private final RecordId id;

    InsertChange(StoreData data, RecordId id) {
      this.data = data;
      this.id = id;
    }

    @Override
    public void commit() {
    }

    @Override
    public void rollback() {
      try (var ignored = data.lock.lock()) {
        final var record = data.records.remove(id);
        invariant(record != null, "rollback of insert cannot find %s", id);
        data.dataSize -= record.size();
      }
    }

    @Override
    public String toString() {
      return "InsertChange[" + id + "]";
    }
  }

  /// Undoes a delete or an update by putting the prior record back.
  static final class RemoveChange implements Change {
    private final StoreData data;
    private final RecordId id;
    private final RecordData prior;
    private final boolean update;

    RemoveChange(StoreData data, RecordId id, RecordData prior, boolean update) {
      this.data = data;
      this.id = id;
      this.prior = prior;
      this.update = update;
    }

    @Override
    public void commit() {
    }

    @Override
    public void rollback() {
      try (var ignored = data.lock.lock()) {
        final var current = data.records.get(id);
        invariant(
            (current != null) == update, "rollback of %s of %s found the record %s",
            update ? "update" : "delete", id, current == null ? "absent" : "present");
        if (current != null) {
          data.dataSize -= current.size();
        }
        data.dataSize += prior.size();
        data.records.put(id, prior);
      }
    }

    @Override
    public String toString() {
      return (update ? "UpdateChange[" : "RemoveChange[") + id + "]";
    }
  }

  /// Swaps the whole record map out and back. The discarded map stays reachable from here until
  /// the transaction is resolved.
  static final class TruncateChange implements Change {
    private final StoreData data;
    private TreeMap<RecordId, RecordData> records = new TreeMap<>();
    private long dataSize;

    TruncateChange(StoreData data) {
      this.data = data;
    }

    void swap() {
      try (var ignored = data.lock.lock()) {
        final var swappedRecords = data.records;
        final var swappedSize = data.dataSize;
        data.records = records;
        data.dataSize = dataSize;
        records = swappedRecords;
        dataSize = swappedSize;
      }
    }

    @Override
    public void commit() {
      records = null;
    }

    @Override
    public void rollback() {
      try (var ignored = data.lock.lock()) {
        invariant(
            data.records.isEmpty(), "rollback of truncate found %d records present",
            data.records.size());
        swap();
      }
    }

    @Override
    public String toString() {
      return "TruncateChange[" + (records == null ? 0 : records.size()) + "]";
    }
  }
}
