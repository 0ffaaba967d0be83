package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.error.QueryException;
import io.intellixity.strata.query.SortField;
import io.intellixity.strata.query.SortField.Direction;
import io.intellixity.strata.spi.sql.SqlDialect;
import io.intellixity.strata.spi.sql.SqlStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders {@link SelectQuery}.
 * <p>
 * Placeholder order is WHERE, cursor, LIMIT, OFFSET. A cursor compares past the last-seen key
 * in the direction of the ordering; without an explicit {@code orderBy} the cursor columns are
 * used ascending so keyset pages are stable.
 */
public final class SelectBuilder {
  private SelectBuilder() {}

  public static SqlStatement build(SelectQuery q, SqlDialect dialect) {
    RenderCtx ctx = new RenderCtx(dialect, q.casing(), 0);
    StringBuilder sql = new StringBuilder("SELECT ");
    sql.append(projection(q.columns(), ctx));
    if (q.withCount()) sql.append(", COUNT(*) OVER() AS ").append(ctx.q("totalCount"));
    sql.append(" FROM ").append(ctx.q(q.table()));

    List<String> predicates = new ArrayList<>(2);
    WhereClause where = WhereBuilder.build(q.where(), ctx.nextIndex(), dialect, q.casing());
    if (!where.isEmpty()) {
      predicates.add(where.sql());
      ctx.addAll(where.params());
    }
    if (!q.cursor().isEmpty()) predicates.add(cursorPredicate(q, ctx));
    if (!predicates.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", predicates));

    String order = orderBy(q, ctx);
    if (!order.isEmpty()) sql.append(" ORDER BY ").append(order);

    Integer limit = q.take() != null ? q.take() : q.limit();
    if (limit != null) sql.append(" LIMIT ").append(ctx.add(limit));
    if (q.offset() != null) sql.append(" OFFSET ").append(ctx.add(q.offset()));
    return new SqlStatement(sql.toString(), ctx.params());
  }

  static String projection(List<String> columns, RenderCtx ctx) {
    if (columns.isEmpty()) return "*";
    List<String> items = new ArrayList<>(columns.size());
    for (String c : columns) items.add(ctx.selectItem(c));
    return String.join(", ", items);
  }

  private static String cursorPredicate(SelectQuery q, RenderCtx ctx) {
    Map<String, Object> cursor = q.cursor();
    List<String> keys = new ArrayList<>(cursor.keySet());
    Direction dir = directionOf(keys.get(0), q.orderBy());
    if (keys.size() > 1) {
      for (String k : keys.subList(1, keys.size())) {
        if (directionOf(k, q.orderBy()) != dir) {
          throw new QueryException("Multi-column cursor requires the same sort direction on every cursor column: " + keys);
        }
      }
    }
    String cmp = dir == Direction.DESC ? " < " : " > ";
    if (keys.size() == 1) {
      String k = keys.get(0);
      return ctx.col(k) + cmp + ctx.add(cursor.get(k));
    }
    List<String> cols = new ArrayList<>(keys.size());
    List<String> ps = new ArrayList<>(keys.size());
    for (String k : keys) {
      cols.add(ctx.col(k));
      ps.add(ctx.add(cursor.get(k)));
    }
    return "(" + String.join(", ", cols) + ")" + cmp + "(" + String.join(", ", ps) + ")";
  }

  private static Direction directionOf(String column, List<SortField> orderBy) {
    for (SortField s : orderBy) if (s.column().equals(column)) return s.direction();
    return Direction.ASC;
  }

  private static String orderBy(SelectQuery q, RenderCtx ctx) {
    List<String> items = new ArrayList<>();
    if (!q.orderBy().isEmpty()) {
      for (SortField s : q.orderBy()) items.add(ctx.col(s.column()) + " " + s.direction().name());
    } else {
      for (String k : q.cursor().keySet()) items.add(ctx.col(k) + " ASC");
    }
    return String.join(", ", items);
  }
}
