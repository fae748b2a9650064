package com.github.simbo1905.trs;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;

/// Cursor over an [InMemoryRecordStore]. The position is the key last returned rather than a live
/// iterator, so each step looks the neighbour up again under a short hold of the store lock and a
/// writer is never blocked for the length of a scan. A reverse cursor runs the same logic over the
/// descending view of the record map, which turns every "at or after" lookup into "at or before".
final class InMemoryRecordCursor implements SeekableRecordCursor {

  private final StoreData data;
  private final boolean forward;
  private final boolean isCapped;

  private boolean needFirstSeek = true;
  /// Key of the current record. Null once the cursor is at the end.
  private RecordId position;
  /// Set when restore() landed somewhere other than the saved key; next() then returns the record
  /// it landed on instead of moving past it.
  private boolean lastMoveWasRestore;
  /// Where restore() goes. The null id means the end.
  private RecordId savedId = RecordId.NULL;
  /// Set by saveUnpositioned() so restore() ends the scan even on a cursor that never moved.
  private boolean savedUnpositioned;
  private boolean closed;

  InMemoryRecordCursor(StoreData data, boolean forward, boolean isCapped) {
    this.data = data;
    this.forward = forward;
    this.isCapped = isCapped;
  }

  private NavigableMap<RecordId, RecordData> records() {
    return forward ? data.records : data.records.descendingMap();
  }

  @Override
  public Optional<RecordEntry> next() {
    ensureOpen();
    try (var ignored = data.lock.lock()) {
      final Map.Entry<RecordId, RecordData> entry;
      if (needFirstSeek) {
        needFirstSeek = false;
        entry = records().firstEntry();
      } else if (position == null) {
        entry = null;
      } else if (lastMoveWasRestore) {
        entry = records().ceilingEntry(position);
      } else {
        entry = records().higherEntry(position);
      }
      lastMoveWasRestore = false;
      if (entry == null) {
        position = null;
        return Optional.empty();
      }
      position = entry.getKey();
      return Optional.of(new RecordEntry(entry.getKey(), entry.getValue()));
    }
  }

  @Override
  public Optional<RecordEntry> seekExact(RecordId id) {
    ensureOpen();
    try (var ignored = data.lock.lock()) {
      needFirstSeek = false;
      lastMoveWasRestore = false;
      final var record = data.records.get(id);
      if (record == null) {
        position = null;
        return Optional.empty();
      }
      position = id;
      return Optional.of(new RecordEntry(id, record));
    }
  }

  @Override
  public void save() {
    ensureOpen();
    if (!needFirstSeek && !lastMoveWasRestore) {
      savedId = position == null ? RecordId.NULL : position;
      savedUnpositioned = false;
    }
  }

  @Override
  public void saveUnpositioned() {
    ensureOpen();
    savedId = RecordId.NULL;
    savedUnpositioned = true;
  }

  @Override
  public boolean restore() {
    ensureOpen();
    if (needFirstSeek && !savedUnpositioned) {
      // nothing was saved, the first next() still binds to the start
      return true;
    }
    if (savedId.isNull()) {
      needFirstSeek = false;
      lastMoveWasRestore = false;
      position = null;
      return true;
    }
    try (var ignored = data.lock.lock()) {
      final var landed = records().ceilingKey(savedId);
      position = landed;
      lastMoveWasRestore = landed == null || !landed.equals(savedId);
    }
    // capped cursors die when their record was evicted rather than skip ahead
    return !(isCapped && lastMoveWasRestore);
  }

  @Override
  public void close() {
    closed = true;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Cursor is closed");
    }
    if (data.isDropped()) {
      throw new IllegalStateException("Cursor store was dropped");
    }
  }

  @Override
  public String toString() {
    return String.format(
        "InMemoryRecordCursor[forward=%s, position=%s, saved=%s]", forward, position, savedId);
  }
}
