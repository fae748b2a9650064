package com.github.simbo1905.trs;

/// Base of the recoverable failures a record store reports. When one of these escapes a store
/// call the transaction is left exactly as if the call had never been made.
public abstract class RecordStoreException extends Exception {

  protected RecordStoreException(String message) {
    super(message);
  }
}
