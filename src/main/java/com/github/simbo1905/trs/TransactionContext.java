package com.github.simbo1905.trs;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/// A unit of work against one or more record stores. Stores register a [Change] for every
/// mutation; [#commit()] resolves them in registration order and [#abort()] rolls them back in
/// reverse registration order. Either way every change is resolved exactly once.
///
/// A context is confined to one thread. Closing a context that was not committed aborts it, so
/// the usual shape is:
/// <pre>
/// try (var txn = new TransactionContext()) {
///   store.insertRecord(txn, bytes);
///   txn.commit();
/// }
/// </pre>
public class TransactionContext implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(TransactionContext.class.getName());

  private static final AtomicLong ids = new AtomicLong();

  /// Lifecycle of a context.
  /// <ul>
  ///   <li><b>ACTIVE</b> - accepting changes</li>
  ///   <li><b>COMMITTED</b> - every change was committed</li>
  ///   <li><b>ABORTED</b> - every change was rolled back</li>
  /// </ul>
  public enum State {
    ACTIVE,
    COMMITTED,
    ABORTED
  }

  private final long id = ids.incrementAndGet();

  private final List<Change> changes = new ArrayList<>();

  private State state = State.ACTIVE;

  public long getId() {
    return id;
  }

  public State getState() {
    return state;
  }

  /// Number of changes registered and not yet resolved.
  public int pendingChanges() {
    return changes.size();
  }

  /// Adds a change to be resolved when this context ends.
  ///
  /// @throws IllegalStateException if the context has already been resolved
  public void registerChange(Change change) {
    ensureActive();
    if (change == null) {
      throw new IllegalArgumentException("Change cannot be null");
    }
    changes.add(change);
  }

  /// Marks the current end of the change list so a failing store call can undo only what it
  /// registered itself.
  public int savepoint() {
    ensureActive();
    return changes.size();
  }

  /// Rolls back, newest first, every change registered after the savepoint and forgets them. The
  /// context stays active.
  public void rollbackTo(int savepoint) {
    ensureActive();
    if (savepoint < 0 || savepoint > changes.size()) {
      throw new IllegalArgumentException(
          String.format("Savepoint %d outside [0, %d]", savepoint, changes.size()));
    }
    final var undone = changes.size() - savepoint;
    logger.log(
        Level.FINER, () -> String.format("txn %d rolling back %d changes to savepoint %d", id,
            undone, savepoint));
    while (changes.size() > savepoint) {
      rollbackChange(changes.remove(changes.size() - 1));
    }
  }

  /// Commits every registered change in registration order.
  public void commit() {
    ensureActive();
    logger.log(Level.FINER, () -> String.format("txn %d committing %d changes", id, changes.size()));
    // resolved even if a commit handler throws so that nothing is resolved twice
    state = State.COMMITTED;
    final var resolving = new ArrayList<>(changes);
    changes.clear();
    for (Change change : resolving) {
      change.commit();
    }
  }

  /// Rolls back every registered change in reverse registration order.
  public void abort() {
    ensureActive();
    logger.log(Level.FINER, () -> String.format("txn %d aborting %d changes", id, changes.size()));
    try {
      rollbackTo(0);
    } finally {
      state = State.ABORTED;
    }
  }

  /// Aborts unless already committed or aborted.
  @Override
  public void close() {
    if (state == State.ACTIVE) {
      abort();
    }
  }

  private void rollbackChange(Change change) {
    try {
      change.rollback();
    } catch (InvariantViolation e) {
      throw e;
    } catch (RuntimeException e) {
      throw new InvariantViolation(
          String.format("txn %d rollback of %s failed", id, change), e);
    }
  }

  private void ensureActive() {
    if (state != State.ACTIVE) {
      throw new IllegalStateException("Transaction " + id + " is " + state + ", expected ACTIVE");
    }
  }

  @Override
  public String toString() {
    return String.format("TransactionContext[id=%d, state=%s, pending=%d]", id, state,
        changes.size());
  }
}
