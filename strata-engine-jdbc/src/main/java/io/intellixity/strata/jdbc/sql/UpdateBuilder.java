package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.error.QueryException;
import io.intellixity.strata.spi.sql.SqlDialect;
import io.intellixity.strata.spi.sql.SqlStatement;

import java.util.ArrayList;
import java.util.List;

/** SET placeholders come first; the WHERE fragment continues the numbering. */
public final class UpdateBuilder {
  private UpdateBuilder() {}

  public static SqlStatement build(UpdateQuery q, SqlDialect dialect) {
    if (q.data().isEmpty()) throw new QueryException("UPDATE requires at least one column to set");
    RenderCtx ctx = new RenderCtx(dialect, q.casing(), 0);
    List<String> sets = new ArrayList<>(q.data().size());
    for (var e : q.data().entrySet()) {
      sets.add(ctx.col(e.getKey()) + " = " + InsertBuilder.value(e.getKey(), e.getValue(), q.nowColumns(), ctx));
    }
    StringBuilder sql = new StringBuilder("UPDATE ").append(ctx.q(q.table()))
        .append(" SET ").append(String.join(", ", sets));
    WhereClause where = WhereBuilder.build(q.where(), ctx.nextIndex(), dialect, q.casing());
    if (!where.isEmpty()) {
      sql.append(" WHERE ").append(where.sql());
      ctx.addAll(where.params());
    }
    sql.append(ctx.returning(q.returning()));
    return new SqlStatement(sql.toString(), ctx.params());
  }
}
