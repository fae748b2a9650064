package com.github.simbo1905.trs;

/// Thrown by a [CappedCallback] that refuses to let a capped record be deleted. The store
/// operation that triggered the delete is undone in its entirety.
public class EvictionVetoedException extends RecordStoreException {

  public EvictionVetoedException(String message) {
    super(message);
  }
}
