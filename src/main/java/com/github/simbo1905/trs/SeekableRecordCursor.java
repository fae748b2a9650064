package com.github.simbo1905.trs;

import java.util.Optional;

/// A directional iterator over a store's records that can be parked and resumed while other
/// threads mutate the store.
///
/// The cursor is positioned on the record it returned last. [#save()] remembers that key and
/// [#restore()] relocates to it, or to its nearest surviving neighbour in cursor direction if it
/// was removed in the meantime. Nothing holds the store lock between calls.
public interface SeekableRecordCursor extends AutoCloseable {

  /// Returns the next record in cursor direction and moves onto it. The first call binds the
  /// cursor to the current contents of the store. Once the end is reached every call returns
  /// empty until the cursor is repositioned.
  Optional<RecordEntry> next();

  /// Moves onto the given record. If it does not exist the cursor is left at the end.
  Optional<RecordEntry> seekExact(RecordId id);

  /// Remembers the current position for [#restore()].
  void save();

  /// Forgets the position: the next [#restore()] leaves the cursor at the end.
  void saveUnpositioned();

  /// Relocates to the saved position.
  ///
  /// @return false if the store is capped and the saved record is gone, meaning records the
  /// caller has not seen may have been evicted; true otherwise
  boolean restore();

  @Override
  void close();
}
