package com.github.simbo1905.trs;

import java.util.logging.Level;
import java.util.logging.Logger;

/// A broken internal invariant. Continuing after one of these risks silent corruption so it is an
/// [Error]: the enclosing transaction, and normally the process, must be torn down.
public final class InvariantViolation extends Error {

  private static final Logger logger = Logger.getLogger(InvariantViolation.class.getName());

  public InvariantViolation(String message) {
    super(message);
  }

  public InvariantViolation(String message, Throwable cause) {
    super(message, cause);
  }

  /// Logs and returns a violation for the caller to throw.
  static InvariantViolation raise(String format, Object... args) {
    final var message = String.format(format, args);
    logger.log(Level.SEVERE, message);
    return new InvariantViolation(message);
  }

  /// Throws unless the condition holds.
  static void invariant(boolean condition, String format, Object... args) {
    if (!condition) {
      throw raise(format, args);
    }
  }
}
