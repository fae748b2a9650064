package com.github.simbo1905.trs;

/// Reads the ordering key of an oplog entry from its raw payload.
@FunctionalInterface
public interface OplogKeyExtractor {

  RecordId extractKey(byte[] payload) throws MalformedRecordException;
}
