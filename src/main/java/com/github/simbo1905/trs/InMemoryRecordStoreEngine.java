package com.github.simbo1905.trs;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Synchronized;

/// Engine whose stores live on the heap. The registry maps each namespace to its [StoreData] so
/// that a store can be reopened, for example after a rename or a repair, without losing records.
public class InMemoryRecordStoreEngine implements RecordStoreEngine {

  private static final Logger logger = Logger.getLogger(InMemoryRecordStoreEngine.class.getName());

  private final Map<String, StoreData> registry = new HashMap<>();

  @Override
  public String name() {
    return InMemoryRecordStore.NAME;
  }

  @Override
  @Synchronized
  public RecordStore openRecordStore(RecordStoreOptions options) {
    final var namespace = options.getNamespace();
    var data = registry.get(namespace);
    if (data == null) {
      logger.log(Level.FINE, () -> String.format("creating store %s", namespace));
      data = new StoreData(options.isOplog(), options.isFairLock());
      registry.put(namespace, data);
    } else if (data.isOplog != options.isOplog()) {
      throw new IllegalArgumentException(
          String.format(
              "Store %s exists with oplog=%s, cannot open with oplog=%s", namespace, data.isOplog,
              options.isOplog()));
    }
    return new InMemoryRecordStore(options, data);
  }

  @Override
  @Synchronized
  public boolean dropRecordStore(String namespace) {
    final var data = registry.remove(namespace);
    if (data == null) {
      return false;
    }
    logger.log(Level.FINE, () -> String.format("dropped store %s", namespace));
    data.markDropped();
    return true;
  }

  @Override
  @Synchronized
  public void renameRecordStore(String from, String to) {
    if (registry.containsKey(to)) {
      throw new IllegalArgumentException("Store already exists: " + to);
    }
    final var data = registry.remove(from);
    if (data == null) {
      throw new IllegalArgumentException("Store not found: " + from);
    }
    registry.put(to, data);
    logger.log(Level.FINE, () -> String.format("renamed store %s to %s", from, to));
  }

  @Override
  @Synchronized
  public Set<String> namespaces() {
    return new TreeSet<>(registry.keySet());
  }
}
