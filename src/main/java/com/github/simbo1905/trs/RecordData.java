package com.github.simbo1905.trs;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// Immutable record payload. The bytes are copied on the way in and on the way out so that
/// nothing a caller does to an array can change what the store holds.
public final class RecordData {

  private final byte[] bytes;

  private RecordData(byte[] bytes) {
    this.bytes = bytes;
  }

  /// Copies the given payload.
  ///
  /// @throws IllegalArgumentException if bytes is null
  public static RecordData copyOf(byte[] bytes) {
    if (bytes == null) {
      throw new IllegalArgumentException("Record bytes cannot be null");
    }
    return new RecordData(bytes.clone());
  }

  /// Takes ownership of an array the caller will not touch again.
  static RecordData wrap(byte[] bytes) {
    return new RecordData(bytes);
  }

  /// @return a copy of the payload
  public byte[] data() {
    return bytes.clone();
  }

  public int size() {
    return bytes.length;
  }

  /// Copies `length` payload bytes starting at `offset` into `target`.
  void copyTo(int offset, byte[] target, int targetOffset, int length) {
    System.arraycopy(bytes, offset, target, targetOffset, length);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    return Arrays.equals(bytes, ((RecordData) obj).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return String.format("RecordData[size=%d, utf8=%s]", bytes.length,
        new String(bytes, StandardCharsets.UTF_8));
  }
}
