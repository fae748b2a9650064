package com.github.simbo1905.trs;

import java.util.Set;

/// A storage backend and the registry of the stores it holds. Whoever opens stores is handed an
/// engine explicitly; there is no process-wide registry.
public interface RecordStoreEngine {

  String name();

  /// Opens the store for the namespace in the options, creating it if it does not exist. Opening
  /// a namespace that exists returns a new handle over the same records.
  ///
  /// @throws IllegalArgumentException if the options conflict with the existing store
  RecordStore openRecordStore(RecordStoreOptions options);

  /// Drops the store. Handles already open on it fail from then on.
  ///
  /// @return false if there was no such store
  boolean dropRecordStore(String namespace);

  /// Moves the records of a store to a new namespace. Handles opened under the old name keep
  /// working on the same records.
  ///
  /// @throws IllegalArgumentException if `from` does not exist or `to` already does
  void renameRecordStore(String from, String to);

  Set<String> namespaces();
}
