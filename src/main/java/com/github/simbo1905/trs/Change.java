package com.github.simbo1905.trs;

/// An undo unit registered with a [TransactionContext] at the moment a store is mutated. Exactly
/// one of the two methods is called, exactly once, when the transaction ends.
public interface Change {

  /// The transaction committed. Release anything kept for undo.
  void commit();

  /// The transaction aborted. Put back the state captured at registration. Must not fail; a
  /// handler that finds state it cannot restore throws [InvariantViolation].
  void rollback();
}
