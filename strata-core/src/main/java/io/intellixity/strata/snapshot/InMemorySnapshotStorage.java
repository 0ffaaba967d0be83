package io.intellixity.strata.snapshot;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySnapshotStorage implements SnapshotStorage {
  private final Map<String, SchemaSnapshot> byKey = new ConcurrentHashMap<>();

  @Override
  public Optional<SchemaSnapshot> load(String key) {
    return Optional.ofNullable(byKey.get(Objects.requireNonNull(key, "key")));
  }

  @Override
  public void save(String key, SchemaSnapshot snapshot) {
    byKey.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(snapshot, "snapshot"));
  }
}
