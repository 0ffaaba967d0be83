package io.intellixity.strata.snapshot;

import java.util.List;

/** Ordered column tuple; {@code name} is only known for introspected indexes. */
public record IndexSnapshot(List<String> columns, String name, boolean unique) {
  public IndexSnapshot {
    columns = columns == null ? List.of() : List.copyOf(columns);
  }

  public static IndexSnapshot of(List<String> columns) {
    return new IndexSnapshot(columns, null, false);
  }

  /** Identity used by the diff engine: the column tuple joined by commas. */
  public String key() {
    return String.join(",", columns);
  }
}
