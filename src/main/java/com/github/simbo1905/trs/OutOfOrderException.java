package com.github.simbo1905.trs;

/// An oplog insert whose key is not strictly greater than the last key in the log.
public class OutOfOrderException extends RecordStoreException {

  private final RecordId attempted;
  private final RecordId last;

  public OutOfOrderException(RecordId attempted, RecordId last) {
    super(
        String.format(
            "attempted out-of-order oplog insert of %s (oplog last insert was %s)",
            attempted, last));
    this.attempted = attempted;
    this.last = last;
  }

  public RecordId getAttempted() {
    return attempted;
  }

  public RecordId getLast() {
    return last;
  }
}
