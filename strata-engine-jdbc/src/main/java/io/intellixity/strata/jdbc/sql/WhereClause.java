package io.intellixity.strata.jdbc.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** WHERE fragment without the keyword; empty sql means "no predicate". */
public record WhereClause(String sql, List<Object> params) {
  public WhereClause {
    sql = sql == null ? "" : sql;
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public boolean isEmpty() {
    return sql.isEmpty();
  }
}
