package com.github.simbo1905.trs;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/// Statistics and configuration of a record store at a point in time.
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class RecordStoreStats {
  private final String namespace;
  private final boolean capped;
  /// -1 when the store has no document limit
  private final long cappedMaxDocs;
  /// -1 when the store is not capped
  private final long cappedMaxSize;
  private final long numRecords;
  private final long dataSize;

  /// Fraction of the capped size limit in use, or 0 for an uncapped store.
  public double getCappedFillRatio() {
    if (!capped) {
      return 0.0;
    }
    return (double) dataSize / cappedMaxSize;
  }

  @Override
  public String toString() {
    if (capped) {
      return String.format(
          "RecordStoreStats[ns=%s, capped=true, max=%d, maxSize=%d, count=%d, size=%d]",
          namespace, cappedMaxDocs, cappedMaxSize, numRecords, dataSize);
    }
    return String.format(
        "RecordStoreStats[ns=%s, capped=false, count=%d, size=%d]", namespace, numRecords,
        dataSize);
  }
}
