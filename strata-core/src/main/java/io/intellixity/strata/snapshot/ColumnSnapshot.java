package io.intellixity.strata.snapshot;

import java.util.Objects;

/**
 * Canonical column shape. {@code defaultValue} is a dialect-agnostic SQL expression, or null for none.
 */
public record ColumnSnapshot(String type,
                             boolean nullable,
                             boolean primary,
                             boolean unique,
                             String defaultValue,
                             boolean sensitive,
                             boolean hidden) {
  public ColumnSnapshot {
    Objects.requireNonNull(type, "type");
  }

  public static ColumnSnapshot of(String type, boolean nullable, boolean primary, boolean unique) {
    return new ColumnSnapshot(type, nullable, primary, unique, null, false, false);
  }

  public ColumnSnapshot withDefault(String expr) {
    return new ColumnSnapshot(type, nullable, primary, unique, expr, sensitive, hidden);
  }
}
