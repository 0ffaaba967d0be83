package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.casing.CasingOverrides;
import io.intellixity.strata.query.SortField;
import io.intellixity.strata.query.WhereFilter;

import java.util.*;

/**
 * Structured SELECT.
 *
 * @param table   storage table name
 * @param columns declared column names; empty selects {@code *}
 * @param cursor  keyset cursor, declared column to last-seen value (insertion order kept)
 * @param take    page size for cursor paging; wins over {@code limit}
 * @param withCount append a window total as {@code totalCount}
 */
public record SelectQuery(
    String table,
    List<String> columns,
    WhereFilter where,
    List<SortField> orderBy,
    Integer limit,
    Integer offset,
    Map<String, Object> cursor,
    Integer take,
    boolean withCount,
    CasingOverrides casing
) {
  public SelectQuery {
    Objects.requireNonNull(table, "table");
    columns = columns == null ? List.of() : List.copyOf(columns);
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    cursor = cursor == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(cursor));
    casing = casing == null ? CasingOverrides.none() : casing;
  }

  public static Builder from(String table) {
    return new Builder(table);
  }

  public static final class Builder {
    private final String table;
    private List<String> columns = List.of();
    private WhereFilter where;
    private List<SortField> orderBy = List.of();
    private Integer limit;
    private Integer offset;
    private Map<String, Object> cursor;
    private Integer take;
    private boolean withCount;
    private CasingOverrides casing;

    private Builder(String table) {
      this.table = table;
    }

    public Builder columns(String... columns) { this.columns = List.of(columns); return this; }
    public Builder columns(List<String> columns) { this.columns = columns; return this; }
    public Builder where(WhereFilter where) { this.where = where; return this; }
    public Builder orderBy(SortField... orderBy) { this.orderBy = List.of(orderBy); return this; }
    public Builder orderBy(List<SortField> orderBy) { this.orderBy = orderBy; return this; }
    public Builder limit(Integer limit) { this.limit = limit; return this; }
    public Builder offset(Integer offset) { this.offset = offset; return this; }
    public Builder cursor(Map<String, Object> cursor) { this.cursor = cursor; return this; }
    public Builder take(Integer take) { this.take = take; return this; }
    public Builder withCount(boolean withCount) { this.withCount = withCount; return this; }
    public Builder casing(CasingOverrides casing) { this.casing = casing; return this; }

    public SelectQuery build() {
      return new SelectQuery(table, columns, where, orderBy, limit, offset, cursor, take, withCount, casing);
    }
  }
}
