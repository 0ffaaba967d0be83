package io.intellixity.strata.jdbc;

import io.intellixity.strata.jdbc.dialect.AbstractSqlDialect;

/** Base-dialect defaults only: {@code $n} placeholders, no arrays, no path extraction. */
public final class FakeDialect extends AbstractSqlDialect {
  public static final FakeDialect INSTANCE = new FakeDialect();

  @Override public String id() { return "fake"; }

  @Override public String autoIncrementPrimaryKey() { return "serial PRIMARY KEY"; }
}
