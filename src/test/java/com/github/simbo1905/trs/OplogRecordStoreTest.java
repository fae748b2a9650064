package com.github.simbo1905.trs;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import org.junit.Before;
import org.junit.Test;

/// Key ordering and start position lookup of oplog stores.
public class OplogRecordStoreTest extends RecordStoreTestSupport {

  private RecordStore oplog;

  @Before
  public void openOplog() {
    oplog = new RecordStoreBuilder().namespace("local.oplog.rs").open(engine);
  }

  private static byte[] entry(long ts) {
    return LongPrefixKeyExtractor.encode(ts, bytes("op@" + ts));
  }

  private RecordId append(long ts) throws RecordStoreException {
    try (var txn = new TransactionContext()) {
      final var id = oplog.insertRecord(txn, entry(ts));
      txn.commit();
      return id;
    }
  }

  @Test
  public void testNamespaceMakesTheStoreAnOplog() {
    assertTrue(oplog.isOplog());
    assertFalse(uncapped("local.other").isOplog());
  }

  @Test
  public void testKeysComeFromThePayload() throws Exception {
    assertEquals(RecordId.of(1234), append(1234));
    assertEquals("op@1234", new String(oplog.dataFor(RecordId.of(1234)).data(), 8, 7));
  }

  @Test
  public void testOutOfOrderInsertIsRejected() throws Exception {
    append(5);
    append(10);
    final var e = assertThrows(OutOfOrderException.class, () -> append(7));
    assertThat(e.getAttempted(), is(RecordId.of(7)));
    assertThat(e.getLast(), is(RecordId.of(10)));
    assertThrows(OutOfOrderException.class, () -> append(10));
    assertThat(loggedAt(Level.WARNING), hasItem(containsString("attempted out-of-order")));

    try (var cursor = oplog.getCursor(false)) {
      assertEquals(10L, cursor.next().orElseThrow().id().repr());
    }
    assertEquals(2, oplog.numRecords());
  }

  @Test
  public void testBatchIsAllOrNothing() throws Exception {
    append(5);
    try (var txn = new TransactionContext()) {
      assertThrows(
          OutOfOrderException.class,
          () -> oplog.insertRecords(txn, List.of(entry(6), entry(8), entry(7))));
      assertThat(txn.pendingChanges(), is(0));
      txn.commit();
    }
    assertEquals(1, oplog.numRecords());
    assertEquals(RecordId.of(6), append(6));
  }

  @Test
  public void testMalformedPayloadIsRejected() throws Exception {
    try (var txn = new TransactionContext()) {
      assertThrows(MalformedRecordException.class, () -> oplog.insertRecord(txn, bytes("short")));
      assertThrows(
          MalformedRecordException.class,
          () -> oplog.insertRecord(txn, LongPrefixKeyExtractor.encode(0, bytes("zero"))));
    }
    assertEquals(0, oplog.numRecords());
  }

  @Test
  public void testCustomExtractor() throws Exception {
    final var store = new RecordStoreBuilder()
        .namespace("local.replay")
        .oplog(true)
        .keyExtractor(payload -> RecordId.of(payload.length))
        .open(engine);
    try (var txn = new TransactionContext()) {
      assertThat(
          store.insertRecords(txn, List.of(bytes("a"), bytes("bbb"))),
          contains(RecordId.of(1), RecordId.of(3)));
      assertThrows(OutOfOrderException.class, () -> store.insertRecord(txn, bytes("cc")));
      txn.commit();
    }
    assertEquals(2, store.numRecords());
  }

  @Test
  public void testStartPosition() throws Exception {
    assertThat(oplog.oplogStartPosition(RecordId.of(10)), is(Optional.of(RecordId.NULL)));
    append(10);
    append(20);
    append(30);
    assertThat(oplog.oplogStartPosition(RecordId.of(5)), is(Optional.of(RecordId.NULL)));
    assertThat(oplog.oplogStartPosition(RecordId.of(10)), is(Optional.of(RecordId.of(10))));
    assertThat(oplog.oplogStartPosition(RecordId.of(25)), is(Optional.of(RecordId.of(20))));
    assertThat(oplog.oplogStartPosition(RecordId.MAX), is(Optional.of(RecordId.of(30))));
  }

  @Test
  public void testTailingReaderResumesFromStartPosition() throws Exception {
    for (long ts = 100; ts <= 500; ts += 100) {
      append(ts);
    }
    final var start = oplog.oplogStartPosition(RecordId.of(250)).orElseThrow();
    try (var cursor = oplog.getCursor(true)) {
      assertTrue(cursor.seekExact(start).isPresent());
      assertThat(drain(cursor), contains(300L, 400L, 500L));
    }
  }

  @Test
  public void testCappedOplogEvictsOldestEntries() throws Exception {
    final var store = new RecordStoreBuilder()
        .namespace("local.oplog.capped")
        .capped(3 * entry(1).length)
        .open(engine);
    for (long ts = 1; ts <= 5; ts++) {
      try (var txn = new TransactionContext()) {
        store.insertRecord(txn, entry(ts));
        txn.commit();
      }
    }
    try (var cursor = store.getCursor(true)) {
      assertThat(drain(cursor), contains(3L, 4L, 5L));
    }
    assertThat(store.oplogStartPosition(RecordId.of(1)), is(Optional.of(RecordId.NULL)));
  }

  @Test
  public void testConcurrentWritersNeverStoreKeysOutOfOrder() throws Exception {
    final int threads = 4;
    final int perThread = 200;
    final var clock = new AtomicLong();
    final var accepted = new ConcurrentLinkedQueue<Long>();
    final var start = new CountDownLatch(1);
    final ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<Integer>> results = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        results.add(pool.submit(() -> {
          start.await();
          int rejected = 0;
          for (int i = 0; i < perThread; i++) {
            final long ts = clock.incrementAndGet();
            try (var txn = new TransactionContext()) {
              oplog.insertRecord(txn, entry(ts));
              txn.commit();
              accepted.add(ts);
            } catch (OutOfOrderException e) {
              rejected++;
            }
          }
          return rejected;
        }));
      }
      start.countDown();
      int rejected = 0;
      for (Future<Integer> result : results) {
        rejected += result.get(30, TimeUnit.SECONDS);
      }
      assertEquals(threads * perThread, accepted.size() + rejected);
    } finally {
      pool.shutdownNow();
    }

    assertEquals(accepted.size(), oplog.numRecords());
    try (var cursor = oplog.getCursor(true)) {
      final var ids = drain(cursor);
      for (int i = 1; i < ids.size(); i++) {
        assertTrue(ids.get(i - 1) < ids.get(i));
      }
    }
  }

  @Test
  public void testKeyCheckRequiresStoreLock() throws Exception {
    final var data = new StoreData(true, true);
    final var guard = new OplogOrderingGuard(data, LongPrefixKeyExtractor.INSTANCE);
    assertThrows(InvariantViolation.class, () -> guard.extractAndCheck(entry(1)));
    try (var ignored = data.lock.lock()) {
      assertThat(guard.extractAndCheck(entry(1)), is(RecordId.of(1)));
    }
  }
}
