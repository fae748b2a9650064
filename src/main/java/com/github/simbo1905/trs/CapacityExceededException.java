package com.github.simbo1905.trs;

/// A record is larger than the configured maximum size of a capped store.
public class CapacityExceededException extends RecordStoreException {

  public CapacityExceededException(String message) {
    super(message);
  }
}
