package io.intellixity.strata.spi.sql;

import io.intellixity.strata.query.Operator;

import java.util.List;

/**
 * Backend capability profile injected into every statement builder and into the DDL generator.
 * <p>
 * Capability checks are explicit: a method for a feature the backend lacks throws
 * {@link io.intellixity.strata.error.QueryException} with a descriptive message instead of
 * emitting SQL the backend would reject.
 */
public interface SqlDialect {
  String id();

  /** Placeholder for the 1-based parameter {@code index}. */
  String param(int index);

  /** Current-timestamp expression used in DML for the "now" sentinel. */
  String now();

  /** Current-timestamp expression usable as a column DEFAULT in DDL. */
  String currentTimestampDefault();

  /** Double-quoted identifier with embedded quotes doubled. */
  default String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  /** Backend column type for a canonical snapshot type. */
  String mapColumnType(String canonicalType);

  /** Column clause for an auto-incrementing integer primary key, e.g. {@code serial PRIMARY KEY}. */
  String autoIncrementPrimaryKey();

  /** SQL operator token for an array operator. */
  String arrayOperator(Operator operator);

  /**
   * Path extraction into a semi-structured column: intermediate segments keep structure,
   * the last one extracts text. Segment quote characters are doubled.
   */
  String jsonPath(String quotedColumn, List<String> segments);

  /** Suffix appended after a LIKE parameter so backslash escapes are honoured; empty when implicit. */
  String likeEscapeClause();

  /** Whether ALTER COLUMN TYPE / SET NOT NULL / SET DEFAULT exist. */
  boolean supportsAlterColumn();

  /** Whether enums compile to a named backend type (otherwise a CHECK-constrained text column). */
  boolean supportsNativeEnums();
}
