package com.github.simbo1905.trs;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;

/// Fresh engine per test plus helpers to write committed records.
public abstract class RecordStoreTestSupport extends JulLoggingConfig {

  protected RecordStoreEngine engine;

  @Before
  public void createEngine() {
    engine = new InMemoryRecordStoreEngine();
  }

  protected RecordStore uncapped(String namespace) {
    return new RecordStoreBuilder().namespace(namespace).open(engine);
  }

  static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  static String string(RecordData data) {
    return new String(data.data(), StandardCharsets.UTF_8);
  }

  static String string(RecordEntry entry) {
    return string(entry.data());
  }

  /// Inserts each value in its own committed transaction.
  static List<RecordId> insertCommitted(RecordStore store, String... values)
      throws RecordStoreException {
    final var ids = new ArrayList<RecordId>();
    for (String value : values) {
      try (var txn = new TransactionContext()) {
        ids.add(store.insertRecord(txn, bytes(value)));
        txn.commit();
      }
    }
    return ids;
  }

  /// Drains a cursor and returns the ids seen.
  static List<Long> drain(SeekableRecordCursor cursor) {
    final var seen = new ArrayList<Long>();
    for (var entry = cursor.next(); entry.isPresent(); entry = cursor.next()) {
      seen.add(entry.get().id().repr());
    }
    return seen;
  }
}
