package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.casing.CasingOverrides;
import io.intellixity.strata.query.WhereFilter;

import java.util.*;

/**
 * Structured GROUP BY.
 *
 * @param orderBy raw key to direction; keys are group columns, {@code _count}, or a requested
 *                aggregation alias such as {@code _avg_age}. Directions are validated at build time.
 */
public record GroupByQuery(
    String table,
    List<String> by,
    WhereFilter where,
    AggregateFields fields,
    Map<String, String> orderBy,
    Integer limit,
    Integer offset,
    CasingOverrides casing
) {
  public GroupByQuery {
    Objects.requireNonNull(table, "table");
    by = List.copyOf(Objects.requireNonNull(by, "by"));
    if (by.isEmpty()) throw new IllegalArgumentException("groupBy requires at least one column");
    fields = fields == null ? new AggregateFields(false, null, null, null, null, null) : fields;
    orderBy = orderBy == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(orderBy));
    casing = casing == null ? CasingOverrides.none() : casing;
  }
}
