package com.github.simbo1905.trs;

import java.util.TreeMap;

/// The mutable state behind a named store: the record map, the byte total and the id allocator.
/// It is owned by the engine's registry and shared by reference with every store handle opened on
/// the namespace, so it outlives any single handle. All fields except the flags are guarded by
/// [#lock].
final class StoreData {

  final GuardedReentrantLock lock;

  final boolean isOplog;

  TreeMap<RecordId, RecordData> records = new TreeMap<>();

  long dataSize;

  long nextId = RecordId.MIN.repr();

  private volatile boolean dropped;

  StoreData(boolean isOplog, boolean fairLock) {
    this.isOplog = isOplog;
    this.lock = new GuardedReentrantLock(fairLock);
  }

  boolean isDropped() {
    return dropped;
  }

  void markDropped() {
    dropped = true;
  }
}
