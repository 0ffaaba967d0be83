package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.casing.CasingOverrides;

import java.util.*;

/**
 * Structured INSERT.
 *
 * @param rows        rows keyed by declared column; the first row fixes the column list
 * @param returning   declared columns to return, {@code ["*"]} for all, empty for none
 * @param nowColumns  declared columns where the {@code "now"} sentinel renders as the dialect's timestamp
 */
public record InsertQuery(
    String table,
    List<Map<String, Object>> rows,
    OnConflict onConflict,
    List<String> returning,
    Set<String> nowColumns,
    CasingOverrides casing
) {
  public InsertQuery {
    Objects.requireNonNull(table, "table");
    rows = rows == null ? List.of() : List.copyOf(rows);
    returning = returning == null ? List.of() : List.copyOf(returning);
    nowColumns = nowColumns == null ? Set.of() : Set.copyOf(nowColumns);
    casing = casing == null ? CasingOverrides.none() : casing;
  }

  public static InsertQuery of(String table, Map<String, Object> row) {
    return new InsertQuery(table, List.of(row), null, List.of(), Set.of(), null);
  }

  public InsertQuery onConflict(OnConflict c) {
    return new InsertQuery(table, rows, c, returning, nowColumns, casing);
  }

  public InsertQuery returning(List<String> cols) {
    return new InsertQuery(table, rows, onConflict, cols, nowColumns, casing);
  }

  public InsertQuery returningAll() {
    return returning(List.of("*"));
  }

  public InsertQuery nowColumns(Set<String> cols) {
    return new InsertQuery(table, rows, onConflict, returning, cols, casing);
  }

  public InsertQuery casing(CasingOverrides c) {
    return new InsertQuery(table, rows, onConflict, returning, nowColumns, c);
  }
}
