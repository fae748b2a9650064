package com.github.simbo1905.trs;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/// Validated configuration of one store. Created by [RecordStoreBuilder#options()].
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public final class RecordStoreOptions {
  private final String namespace;
  private final boolean capped;
  private final long cappedMaxSize;
  private final long cappedMaxDocs;
  private final boolean oplog;
  @ToString.Exclude private final OplogKeyExtractor keyExtractor;
  @ToString.Exclude private final CappedCallback cappedCallback;
  private final boolean fairLock;

  /// Whether a document limit applies in addition to the size limit.
  public boolean hasCappedMaxDocs() {
    return cappedMaxDocs != -1;
  }
}
