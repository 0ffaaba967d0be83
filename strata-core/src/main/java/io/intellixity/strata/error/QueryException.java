package io.intellixity.strata.error;

/**
 * Generic statement failure, and every guard rejection raised while building a statement.
 */
public final class QueryException extends DbException {
  private final String sql;
  private final String vendorCode;

  public QueryException(String message) {
    this(message, null, null, null);
  }

  public QueryException(String message, String sql, String vendorCode, Throwable cause) {
    super(message, cause);
    this.sql = sql;
    this.vendorCode = vendorCode;
  }

  /** The statement text when the failure came from the backend; null for guard rejections. */
  public String sql() { return sql; }
  public String vendorCode() { return vendorCode; }

  @Override
  public String code() { return "QUERY_ERROR"; }
}
