package com.github.simbo1905.trs;

/// A record as seen by a cursor: its id and a snapshot of its payload.
public record RecordEntry(RecordId id, RecordData data) {
}
