package com.github.simbo1905.trs;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

/// Tests the change resolution protocol of the transaction context.
public class TransactionContextTest extends JulLoggingConfig {

  private final List<String> resolved = new ArrayList<>();

  private Change recording(String name) {
    return new Change() {
      @Override
      public void commit() {
        resolved.add("commit " + name);
      }

      @Override
      public void rollback() {
        resolved.add("rollback " + name);
      }
    };
  }

  @Test
  public void testCommitResolvesInRegistrationOrder() {
    try (var txn = new TransactionContext()) {
      txn.registerChange(recording("a"));
      txn.registerChange(recording("b"));
      txn.registerChange(recording("c"));
      txn.commit();
      assertThat(txn.getState(), is(TransactionContext.State.COMMITTED));
    }
    assertThat(resolved, contains("commit a", "commit b", "commit c"));
  }

  @Test
  public void testAbortRollsBackInReverseOrder() {
    final var txn = new TransactionContext();
    txn.registerChange(recording("a"));
    txn.registerChange(recording("b"));
    txn.registerChange(recording("c"));
    txn.abort();
    assertThat(txn.getState(), is(TransactionContext.State.ABORTED));
    assertThat(resolved, contains("rollback c", "rollback b", "rollback a"));
  }

  @Test
  public void testCloseWithoutCommitAborts() {
    try (var txn = new TransactionContext()) {
      txn.registerChange(recording("a"));
    }
    assertThat(resolved, contains("rollback a"));
  }

  @Test
  public void testEachChangeIsResolvedOnce() {
    final var txn = new TransactionContext();
    txn.registerChange(recording("a"));
    txn.commit();
    txn.close();
    assertThrows(IllegalStateException.class, txn::abort);
    assertThrows(IllegalStateException.class, txn::commit);
    assertThat(resolved, contains("commit a"));
  }

  @Test
  public void testRegisteringOnResolvedContextFails() {
    final var txn = new TransactionContext();
    txn.abort();
    assertThrows(IllegalStateException.class, () -> txn.registerChange(recording("late")));
    assertThat(resolved, is(empty()));
  }

  @Test
  public void testRollbackToSavepointUndoesOnlyLaterChanges() {
    try (var txn = new TransactionContext()) {
      txn.registerChange(recording("a"));
      final var savepoint = txn.savepoint();
      txn.registerChange(recording("b"));
      txn.registerChange(recording("c"));
      txn.rollbackTo(savepoint);
      assertThat(txn.pendingChanges(), is(1));
      assertThat(txn.getState(), is(TransactionContext.State.ACTIVE));
      txn.commit();
    }
    assertThat(resolved, contains("rollback c", "rollback b", "commit a"));
  }

  @Test
  public void testFailingRollbackIsAnInvariantViolation() {
    final var txn = new TransactionContext();
    txn.registerChange(new Change() {
      @Override
      public void commit() {
      }

      @Override
      public void rollback() {
        throw new IllegalStateException("state already gone");
      }
    });
    final var violation = assertThrows(InvariantViolation.class, txn::abort);
    assertThat(violation.getCause(), instanceOf(IllegalStateException.class));
    assertThat(txn.getState(), is(TransactionContext.State.ABORTED));
  }

  @Test
  public void testSavepointOutOfRangeIsRejected() {
    try (var txn = new TransactionContext()) {
      txn.registerChange(recording("a"));
      assertThrows(IllegalArgumentException.class, () -> txn.rollbackTo(2));
      assertThrows(IllegalArgumentException.class, () -> txn.rollbackTo(-1));
    }
  }
}
