package io.intellixity.strata.jdbc.client;

import io.intellixity.strata.jdbc.sql.AggregateFields;
import io.intellixity.strata.query.WhereFilter;

import java.util.List;
import java.util.Map;

public record GroupByArgs(
    List<String> by,
    WhereFilter where,
    AggregateFields fields,
    Map<String, String> orderBy,
    Integer limit,
    Integer offset
) {
  public static GroupByArgs of(List<String> by, AggregateFields fields) {
    return new GroupByArgs(by, null, fields, null, null, null);
  }
}
