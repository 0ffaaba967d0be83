package io.intellixity.strata.snapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Columns keep insertion order; it drives column order in generated DDL. */
public record TableSnapshot(Map<String, ColumnSnapshot> columns,
                            List<IndexSnapshot> indexes,
                            List<ForeignKeySnapshot> foreignKeys) {
  public TableSnapshot {
    columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns == null ? Map.of() : columns));
    indexes = indexes == null ? List.of() : List.copyOf(indexes);
    foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
  }

  public static TableSnapshot of(Map<String, ColumnSnapshot> columns) {
    return new TableSnapshot(columns, List.of(), List.of());
  }
}
