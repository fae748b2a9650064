package com.github.simbo1905.trs;

import java.util.concurrent.locks.ReentrantLock;

/// A guarded wrapper around ReentrantLock that returns AutoCloseable guards,
/// making it impossible to forget to unlock. Usage:
/// <pre>
/// try (var ignored = guardedLock.lock()) {
///   // touch the record map here
/// }
/// </pre>
public final class GuardedReentrantLock {
  private final ReentrantLock lock;

  public GuardedReentrantLock(boolean fair) {
    this.lock = new ReentrantLock(fair);
  }

  public Guard lock() {
    return new Guard(lock);
  }

  /// Whether the calling thread holds the lock.
  public boolean isHeldByCurrentThread() {
    return lock.isHeldByCurrentThread();
  }

  /// Releases the lock when closed.
  public static final class Guard implements AutoCloseable {
    private final ReentrantLock lock;

    Guard(ReentrantLock lock) {
      this.lock = lock;
      lock.lock();
    }

    @Override
    public void close() {
      lock.unlock();
    }
  }
}
