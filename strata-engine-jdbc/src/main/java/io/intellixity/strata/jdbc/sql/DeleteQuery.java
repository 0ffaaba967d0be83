package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.casing.CasingOverrides;
import io.intellixity.strata.query.WhereFilter;

import java.util.List;
import java.util.Objects;

public record DeleteQuery(String table, WhereFilter where, List<String> returning, CasingOverrides casing) {
  public DeleteQuery {
    Objects.requireNonNull(table, "table");
    returning = returning == null ? List.of() : List.copyOf(returning);
    casing = casing == null ? CasingOverrides.none() : casing;
  }

  public static DeleteQuery of(String table, WhereFilter where) {
    return new DeleteQuery(table, where, List.of(), null);
  }

  public DeleteQuery returning(List<String> cols) {
    return new DeleteQuery(table, where, cols, casing);
  }

  public DeleteQuery returningAll() {
    return returning(List.of("*"));
  }

  public DeleteQuery casing(CasingOverrides c) {
    return new DeleteQuery(table, where, returning, c);
  }
}
