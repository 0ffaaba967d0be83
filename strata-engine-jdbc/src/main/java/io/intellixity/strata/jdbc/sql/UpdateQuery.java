package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.casing.CasingOverrides;
import io.intellixity.strata.query.WhereFilter;

import java.util.*;

/** Structured UPDATE; {@code data} is keyed by declared column. */
public record UpdateQuery(
    String table,
    Map<String, Object> data,
    WhereFilter where,
    List<String> returning,
    Set<String> nowColumns,
    CasingOverrides casing
) {
  public UpdateQuery {
    Objects.requireNonNull(table, "table");
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    returning = returning == null ? List.of() : List.copyOf(returning);
    nowColumns = nowColumns == null ? Set.of() : Set.copyOf(nowColumns);
    casing = casing == null ? CasingOverrides.none() : casing;
  }

  public static UpdateQuery of(String table, Map<String, Object> data, WhereFilter where) {
    return new UpdateQuery(table, data, where, List.of(), Set.of(), null);
  }

  public UpdateQuery returning(List<String> cols) {
    return new UpdateQuery(table, data, where, cols, nowColumns, casing);
  }

  public UpdateQuery returningAll() {
    return returning(List.of("*"));
  }

  public UpdateQuery nowColumns(Set<String> cols) {
    return new UpdateQuery(table, data, where, returning, cols, casing);
  }

  public UpdateQuery casing(CasingOverrides c) {
    return new UpdateQuery(table, data, where, returning, nowColumns, c);
  }
}
