package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.spi.sql.SqlDialect;
import io.intellixity.strata.spi.sql.SqlStatement;

public final class DeleteBuilder {
  private DeleteBuilder() {}

  public static SqlStatement build(DeleteQuery q, SqlDialect dialect) {
    RenderCtx ctx = new RenderCtx(dialect, q.casing(), 0);
    StringBuilder sql = new StringBuilder("DELETE FROM ").append(ctx.q(q.table()));
    WhereClause where = WhereBuilder.build(q.where(), 0, dialect, q.casing());
    if (!where.isEmpty()) {
      sql.append(" WHERE ").append(where.sql());
      ctx.addAll(where.params());
    }
    sql.append(ctx.returning(q.returning()));
    return new SqlStatement(sql.toString(), ctx.params());
  }
}
