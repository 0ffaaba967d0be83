package io.intellixity.strata.error;

/** Zero rows matched a single-row "or throw" operation. */
public final class NotFoundException extends DbException {
  private final String table;

  public NotFoundException(String table) {
    super("Record not found in table " + table);
    this.table = table;
  }

  public String table() { return table; }

  @Override
  public String code() { return "NOT_FOUND"; }
}
