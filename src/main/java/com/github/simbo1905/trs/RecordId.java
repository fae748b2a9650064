package com.github.simbo1905.trs;

/// Ordered key identifying one record within a single store.
///
/// The value `0` is the null id. It is never allocated to a record and doubles as the
/// "beginning of log" sentinel returned by [RecordStore#oplogStartPosition(RecordId)].
///
/// @param repr the raw 64-bit key
public record RecordId(long repr) implements Comparable<RecordId> {

  /// The null id.
  public static final RecordId NULL = new RecordId(0L);

  /// Smallest id a record can carry.
  public static final RecordId MIN = new RecordId(1L);

  /// Largest id a record can carry.
  public static final RecordId MAX = new RecordId(Long.MAX_VALUE);

  public static RecordId of(long repr) {
    return new RecordId(repr);
  }

  public boolean isNull() {
    return repr == 0L;
  }

  /// Whether this id may be used as the key of a stored record.
  public boolean isNormal() {
    return repr > 0L;
  }

  @Override
  public int compareTo(RecordId other) {
    return Long.compare(repr, other.repr);
  }

  @Override
  public String toString() {
    return "RecordId(" + repr + ")";
  }
}
