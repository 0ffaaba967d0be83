package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.error.QueryException;
import io.intellixity.strata.schema.ColumnDef;
import io.intellixity.strata.spi.sql.SqlDialect;
import io.intellixity.strata.spi.sql.SqlStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class InsertBuilder {
  private InsertBuilder() {}

  public static SqlStatement build(InsertQuery q, SqlDialect dialect) {
    if (q.rows().isEmpty()) throw new QueryException("INSERT requires at least one row");
    RenderCtx ctx = new RenderCtx(dialect, q.casing(), 0);
    List<String> columns = new ArrayList<>(q.rows().get(0).keySet());
    if (columns.isEmpty()) throw new QueryException("INSERT requires at least one column");

    List<String> quoted = new ArrayList<>(columns.size());
    for (String c : columns) quoted.add(ctx.col(c));

    List<String> tuples = new ArrayList<>(q.rows().size());
    for (Map<String, Object> row : q.rows()) {
      List<String> values = new ArrayList<>(columns.size());
      for (String c : columns) values.add(value(c, row.get(c), q.nowColumns(), ctx));
      tuples.add("(" + String.join(", ", values) + ")");
    }

    StringBuilder sql = new StringBuilder("INSERT INTO ").append(ctx.q(q.table()))
        .append(" (").append(String.join(", ", quoted)).append(") VALUES ")
        .append(String.join(", ", tuples));
    if (q.onConflict() != null) sql.append(onConflict(q.onConflict(), q.nowColumns(), ctx));
    sql.append(ctx.returning(q.returning()));
    return new SqlStatement(sql.toString(), ctx.params());
  }

  private static String onConflict(OnConflict c, Set<String> nowColumns, RenderCtx ctx) {
    List<String> target = new ArrayList<>(c.columns().size());
    for (String col : c.columns()) target.add(ctx.col(col));
    String head = " ON CONFLICT (" + String.join(", ", target) + ")";
    if (c.doNothing()) return head + " DO NOTHING";

    List<String> sets = new ArrayList<>();
    if (!c.updateValues().isEmpty()) {
      for (var e : c.updateValues().entrySet()) {
        sets.add(ctx.col(e.getKey()) + " = " + value(e.getKey(), e.getValue(), nowColumns, ctx));
      }
    } else {
      for (String col : c.updateColumns()) sets.add(ctx.col(col) + " = EXCLUDED." + ctx.col(col));
    }
    if (sets.isEmpty()) return head + " DO NOTHING";
    return head + " DO UPDATE SET " + String.join(", ", sets);
  }

  /** Placeholder for {@code v}, or the dialect timestamp when a now-column carries the sentinel. */
  static String value(String column, Object v, Set<String> nowColumns, RenderCtx ctx) {
    if (ColumnDef.NOW.equals(v) && nowColumns.contains(column)) return ctx.dialect().now();
    return ctx.add(v);
  }
}
