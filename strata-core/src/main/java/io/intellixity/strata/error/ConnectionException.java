package io.intellixity.strata.error;

/** Transport or authentication failure reaching the backend. */
public final class ConnectionException extends DbException {
  private final String vendorCode;

  public ConnectionException(String message, String vendorCode, Throwable cause) {
    super(message, cause);
    this.vendorCode = vendorCode;
  }

  public String vendorCode() { return vendorCode; }

  @Override
  public String code() { return "CONNECTION_ERROR"; }
}
