package com.github.simbo1905.trs;

/// An oplog payload from which no ordering key could be extracted.
public class MalformedRecordException extends RecordStoreException {

  public MalformedRecordException(String message) {
    super(message);
  }
}
