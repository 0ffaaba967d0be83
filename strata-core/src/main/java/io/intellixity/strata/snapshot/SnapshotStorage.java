package io.intellixity.strata.snapshot;

import java.util.Optional;

/** Persists the last-applied schema snapshot between runs. */
public interface SnapshotStorage {
  Optional<SchemaSnapshot> load(String key);

  void save(String key, SchemaSnapshot snapshot);
}
