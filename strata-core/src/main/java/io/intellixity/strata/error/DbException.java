package io.intellixity.strata.error;

/**
 * Root of the structured database error taxonomy.
 * <p>
 * Backend failures are classified into one of the subclasses exactly once, at the execution boundary.
 * Guard rejections (empty WHERE on a multi-row mutation, invalid ORDER BY, unsupported dialect feature)
 * are raised as {@link QueryException} before any statement reaches the backend.
 */
public abstract class DbException extends RuntimeException {
  protected DbException(String message) {
    super(message);
  }

  protected DbException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Stable machine-readable code, e.g. {@code CONSTRAINT_ERROR}. */
  public abstract String code();
}
