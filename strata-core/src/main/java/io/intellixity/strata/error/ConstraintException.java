package io.intellixity.strata.error;

import java.util.Objects;

/** Unique / foreign-key / not-null / check violation reported by the backend. */
public final class ConstraintException extends DbException {
  public enum Kind { UNIQUE, FOREIGN_KEY, NOT_NULL, CHECK }

  private final Kind kind;
  private final String table;
  private final String column;
  private final String constraint;
  private final String vendorCode;

  public ConstraintException(Kind kind, String message, String table, String column,
                             String constraint, String vendorCode, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.table = table;
    this.column = column;
    this.constraint = constraint;
    this.vendorCode = vendorCode;
  }

  public Kind kind() { return kind; }
  /** Table name when the backend reported it; otherwise null. */
  public String table() { return table; }
  /** Column name when the backend reported it; otherwise null. */
  public String column() { return column; }
  public String constraint() { return constraint; }
  public String vendorCode() { return vendorCode; }

  @Override
  public String code() { return "CONSTRAINT_ERROR"; }
}
