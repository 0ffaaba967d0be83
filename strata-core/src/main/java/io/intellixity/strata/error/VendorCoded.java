package io.intellixity.strata.error;

/**
 * Implemented by exceptions raised from a non-JDBC execution boundary that still carry a backend
 * error code (SQLSTATE or the embedded engine's result code), so they can be classified.
 */
public interface VendorCoded {
  String vendorCode();
}
