package com.github.simbo1905.trs;

/// Notified before a capped store deletes its oldest record, for example so that index entries
/// pointing at the record can be removed in the same transaction.
@FunctionalInterface
public interface CappedCallback {

  /// Called with the store lock held, before the record is removed.
  ///
  /// @throws EvictionVetoedException to refuse the delete, which aborts the whole store operation
  /// that triggered it
  void aboutToDeleteCapped(TransactionContext txn, RecordId id, RecordData data)
      throws EvictionVetoedException;
}
