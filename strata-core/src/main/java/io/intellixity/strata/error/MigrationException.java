package io.intellixity.strata.error;

/** History-table, apply or list-applied failure. Carries the attempted SQL. */
public final class MigrationException extends DbException {
  private final String sql;

  public MigrationException(String message, String sql, Throwable cause) {
    super(message, cause);
    this.sql = sql;
  }

  public String sql() { return sql; }

  @Override
  public String code() { return "MIGRATION_ERROR"; }
}
