package com.github.simbo1905.trs;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Builder for opening record stores through an engine with a fluent API.
///
/// Example usage:
/// <pre>
/// RecordStore store = new RecordStoreBuilder()
///     .namespace("test.events")
///     .capped(16 * 1024 * 1024)
///     .cappedMaxDocs(10_000)
///     .cappedCallback(indexes::aboutToDeleteCapped)
///     .open(engine);
/// </pre>
public class RecordStoreBuilder {

  private static final Logger logger = Logger.getLogger(RecordStoreBuilder.class.getName());

  /// Namespaces under this prefix are oplogs unless [#oplog(boolean)] says otherwise.
  public static final String OPLOG_NAMESPACE_PREFIX = "local.oplog.";

  /// Suffix of the system property or environment variable that sets the default lock fairness.
  public static final String FAIR_LOCK_PROPERTY = "FAIR_LOCK";

  private String namespace;
  private boolean capped = false;
  private long cappedMaxSize = -1;
  private long cappedMaxDocs = -1;
  /// null means infer from the namespace
  private Boolean oplog;
  private OplogKeyExtractor keyExtractor;
  private CappedCallback cappedCallback;
  private boolean fairLock = getFairLockOrDefault();

  static boolean getFairLockOrDefault() {
    final String key = String.format("%s.%s", RecordStoreBuilder.class.getName(), FAIR_LOCK_PROPERTY);
    String fair = System.getenv(key) == null ? Boolean.FALSE.toString() : System.getenv(key);
    fair = System.getProperty(key, fair);
    return Boolean.parseBoolean(fair);
  }

  /// Sets the namespace of the store, e.g. `db.collection`. Required.
  ///
  /// @param namespace the namespace
  /// @return this builder for chaining
  public RecordStoreBuilder namespace(String namespace) {
    this.namespace = namespace;
    return this;
  }

  /// Makes the store capped at the given total payload size. The oldest records are deleted to
  /// stay within it.
  ///
  /// @param maxSize the maximum total size in bytes, must be positive
  /// @return this builder for chaining
  public RecordStoreBuilder capped(long maxSize) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("cappedMaxSize must be positive, got " + maxSize);
    }
    this.capped = true;
    this.cappedMaxSize = maxSize;
    return this;
  }

  /// Additionally limits a capped store to a number of records.
  ///
  /// @param maxDocs the maximum record count, must be positive, or -1 for no limit
  /// @return this builder for chaining
  public RecordStoreBuilder cappedMaxDocs(long maxDocs) {
    if (maxDocs != -1 && maxDocs <= 0) {
      throw new IllegalArgumentException("cappedMaxDocs must be positive or -1, got " + maxDocs);
    }
    this.cappedMaxDocs = maxDocs;
    return this;
  }

  /// Forces the store to be, or not be, an oplog regardless of its namespace.
  ///
  /// @return this builder for chaining
  public RecordStoreBuilder oplog(boolean oplog) {
    this.oplog = oplog;
    return this;
  }

  /// Sets how oplog keys are read from payloads. Defaults to [LongPrefixKeyExtractor].
  ///
  /// @return this builder for chaining
  public RecordStoreBuilder keyExtractor(OplogKeyExtractor keyExtractor) {
    this.keyExtractor = keyExtractor;
    return this;
  }

  /// Sets the hook told about each capped delete before it happens.
  ///
  /// @return this builder for chaining
  public RecordStoreBuilder cappedCallback(CappedCallback cappedCallback) {
    this.cappedCallback = cappedCallback;
    return this;
  }

  /// Whether the store lock hands itself to the longest waiting thread. Only honoured when the
  /// store is created, not when an existing one is reopened.
  ///
  /// @return this builder for chaining
  public RecordStoreBuilder fairLock(boolean fairLock) {
    this.fairLock = fairLock;
    return this;
  }

  /// Validates the settings.
  ///
  /// @throws IllegalArgumentException if the settings are inconsistent
  public RecordStoreOptions options() {
    if (namespace == null || namespace.isEmpty()) {
      throw new IllegalArgumentException("namespace is required");
    }
    if (!capped && cappedMaxDocs != -1) {
      throw new IllegalArgumentException(
          "cappedMaxDocs " + cappedMaxDocs + " set on uncapped store " + namespace);
    }
    final boolean isOplog = oplog != null ? oplog : namespace.startsWith(OPLOG_NAMESPACE_PREFIX);
    if (!isOplog && keyExtractor != null) {
      throw new IllegalArgumentException(
          "keyExtractor only applies to oplog stores, " + namespace + " is not one");
    }
    final var extractor =
        isOplog && keyExtractor == null ? LongPrefixKeyExtractor.INSTANCE : keyExtractor;
    final var options =
        new RecordStoreOptions(
            namespace, capped, cappedMaxSize, cappedMaxDocs, isOplog, extractor, cappedCallback,
            fairLock);
    logger.log(Level.FINEST, () -> String.format("built %s", options));
    return options;
  }

  /// Opens the store on the given engine.
  public RecordStore open(RecordStoreEngine engine) {
    return engine.openRecordStore(options());
  }
}
