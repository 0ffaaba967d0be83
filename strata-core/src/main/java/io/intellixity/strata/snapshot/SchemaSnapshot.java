package io.intellixity.strata.snapshot;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time schema description: tables and enums, independent of any live database.
 * Never mutated; diffing always compares two instances.
 */
@JsonSerialize(using = SnapshotJsonSerializer.class)
@JsonDeserialize(using = SnapshotJsonDeserializer.class)
public record SchemaSnapshot(int version, Map<String, TableSnapshot> tables, Map<String, List<String>> enums) {
  public static final int CURRENT_VERSION = 1;

  private static final SchemaSnapshot EMPTY = new SchemaSnapshot(CURRENT_VERSION, Map.of(), Map.of());

  public SchemaSnapshot {
    tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables == null ? Map.of() : tables));
    Map<String, List<String>> e = new LinkedHashMap<>();
    if (enums != null) enums.forEach((k, v) -> e.put(k, List.copyOf(v)));
    enums = Collections.unmodifiableMap(e);
  }

  public static SchemaSnapshot empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return tables.isEmpty() && enums.isEmpty();
  }
}
