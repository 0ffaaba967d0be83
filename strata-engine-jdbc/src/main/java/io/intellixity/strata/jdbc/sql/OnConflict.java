package io.intellixity.strata.jdbc.sql;

import java.util.*;

/**
 * Conflict handling for INSERT.
 *
 * @param columns      declared conflict target columns
 * @param doNothing    ignore conflicting rows
 * @param updateColumns columns overwritten from the proposed row ({@code EXCLUDED})
 * @param updateValues explicit values to set on conflict; win over {@code updateColumns}
 */
public record OnConflict(List<String> columns, boolean doNothing, List<String> updateColumns, Map<String, Object> updateValues) {
  public OnConflict {
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    if (columns.isEmpty()) throw new IllegalArgumentException("ON CONFLICT requires at least one target column");
    updateColumns = updateColumns == null ? List.of() : List.copyOf(updateColumns);
    updateValues = updateValues == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(updateValues));
  }

  public static OnConflict doNothing(List<String> columns) {
    return new OnConflict(columns, true, List.of(), Map.of());
  }

  public static OnConflict updateFromExcluded(List<String> columns, List<String> updateColumns) {
    return new OnConflict(columns, false, updateColumns, Map.of());
  }

  public static OnConflict updateWith(List<String> columns, Map<String, Object> values) {
    return new OnConflict(columns, false, List.of(), values);
  }
}
