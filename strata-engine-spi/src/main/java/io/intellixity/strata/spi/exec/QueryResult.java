package io.intellixity.strata.spi.exec;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Rows keyed by column label in select order, plus the affected-row count
 * (the number of returned rows for plain queries).
 */
public record QueryResult(List<Map<String, Object>> rows, long rowCount) {
  private static final QueryResult EMPTY = new QueryResult(List.of(), 0);

  public QueryResult {
    rows = rows == null ? List.of() : Collections.unmodifiableList(rows);
  }

  public static QueryResult empty() {
    return EMPTY;
  }

  public static QueryResult of(List<Map<String, Object>> rows) {
    return new QueryResult(rows, rows == null ? 0 : rows.size());
  }
}
