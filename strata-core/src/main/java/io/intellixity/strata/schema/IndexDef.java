package io.intellixity.strata.schema;

import java.util.List;

public record IndexDef(List<String> columns, String name, boolean unique) {
  public IndexDef {
    if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("Index requires at least one column");
    columns = List.copyOf(columns);
  }

  public static IndexDef on(String... columns) {
    return new IndexDef(List.of(columns), null, false);
  }
}
