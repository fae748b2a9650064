package com.github.simbo1905.trs;

/// One byte range copy applied by [RecordStore#updateWithDamages]: `size` bytes are copied from
/// `sourceOffset` in the damage source to `targetOffset` in the record.
public record DamageEvent(int sourceOffset, int targetOffset, int size) {

  public DamageEvent {
    if (sourceOffset < 0 || targetOffset < 0 || size < 0) {
      throw new IllegalArgumentException(
          String.format(
              "Damage offsets and size must not be negative, got source=%d target=%d size=%d",
              sourceOffset, targetOffset, size));
    }
  }
}
