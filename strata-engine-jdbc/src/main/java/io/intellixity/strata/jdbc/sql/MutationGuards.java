package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.error.QueryException;
import io.intellixity.strata.query.WhereFilter;

/** Checks run before any SQL is built for multi-row mutations. */
public final class MutationGuards {
  private MutationGuards() {}

  public static void requireWhere(String operation, WhereFilter where) {
    if (WhereFilter.isEmpty(where)) {
      throw new QueryException(operation + " requires a non-empty where clause. "
          + "Passing an empty where object would affect all rows.");
    }
  }
}
