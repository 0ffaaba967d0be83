package io.intellixity.strata.jdbc.client;

import io.intellixity.strata.query.Filters;
import io.intellixity.strata.query.IncludeSpec;
import io.intellixity.strata.query.SortField;
import io.intellixity.strata.query.WhereFilter;

import java.util.*;

/** Read options shared by get/list/listAndCount. */
public record FindArgs(
    WhereFilter where,
    List<String> select,
    List<SortField> orderBy,
    Integer limit,
    Integer offset,
    Map<String, Object> cursor,
    Integer take,
    IncludeSpec include
) {
  public static final FindArgs ALL = builder().build();

  public FindArgs {
    where = where == null ? Filters.none() : where;
    select = select == null ? List.of() : List.copyOf(select);
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    cursor = cursor == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(cursor));
    include = include == null ? IncludeSpec.none() : include;
  }

  public static FindArgs where(WhereFilter where) {
    return builder().where(where).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private WhereFilter where;
    private List<String> select;
    private List<SortField> orderBy;
    private Integer limit;
    private Integer offset;
    private Map<String, Object> cursor;
    private Integer take;
    private IncludeSpec include;

    public Builder where(WhereFilter where) { this.where = where; return this; }
    public Builder select(String... select) { this.select = List.of(select); return this; }
    public Builder select(List<String> select) { this.select = select; return this; }
    public Builder orderBy(SortField... orderBy) { this.orderBy = List.of(orderBy); return this; }
    public Builder limit(int limit) { this.limit = limit; return this; }
    public Builder offset(int offset) { this.offset = offset; return this; }
    public Builder cursor(Map<String, Object> cursor) { this.cursor = cursor; return this; }
    public Builder take(int take) { this.take = take; return this; }
    public Builder include(IncludeSpec include) { this.include = include; return this; }

    public FindArgs build() {
      return new FindArgs(where, select, orderBy, limit, offset, cursor, take, include);
    }
  }
}
