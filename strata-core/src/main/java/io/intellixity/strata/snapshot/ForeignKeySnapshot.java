package io.intellixity.strata.snapshot;

import java.util.Objects;

public record ForeignKeySnapshot(String column, String targetTable, String targetColumn) {
  public ForeignKeySnapshot {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(targetTable, "targetTable");
    Objects.requireNonNull(targetColumn, "targetColumn");
  }
}
