package io.intellixity.strata.jdbc.sqlite;

import io.intellixity.strata.error.QueryException;
import io.intellixity.strata.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.strata.query.Operator;

import java.util.List;
import java.util.Locale;

/**
 * Embedded, file-based dialect.
 *
 * Positional {@code ?} placeholders, text timestamps, affinity-based column types and no
 * ALTER COLUMN. Array operators and JSON path filters are rejected at build time.
 */
public final class SqliteDialect extends AbstractSqlDialect {
  public static final SqliteDialect INSTANCE = new SqliteDialect();

  @Override public String id() { return "sqlite"; }

  @Override
  public String param(int index) {
    if (index < 1) throw new IllegalArgumentException("Parameter index is 1-based: " + index);
    return "?";
  }

  @Override
  public String now() {
    return "datetime('now')";
  }

  @Override
  public String currentTimestampDefault() {
    return "(datetime('now'))";
  }

  @Override
  public String autoIncrementPrimaryKey() {
    return "INTEGER PRIMARY KEY AUTOINCREMENT";
  }

  /** Canonical types collapse onto the TEXT / INTEGER / REAL / BLOB affinities. */
  @Override
  public String mapColumnType(String canonicalType) {
    String t = canonicalType.toLowerCase(Locale.ROOT).trim();
    if (t.equals("uuid") || t.equals("text") || t.startsWith("varchar") || t.startsWith("character")
        || t.startsWith("char") || t.equals("json") || t.equals("jsonb")
        || t.startsWith("timestamp") || t.equals("timestamptz") || t.equals("date") || t.startsWith("time")) {
      return "TEXT";
    }
    if (t.equals("integer") || t.equals("int") || t.equals("int4") || t.equals("int8") || t.equals("bigint")
        || t.equals("smallint") || t.equals("serial") || t.equals("bigserial")
        || t.equals("boolean") || t.equals("bool")) {
      return "INTEGER";
    }
    if (t.equals("real") || t.equals("float") || t.startsWith("double") || t.startsWith("numeric")
        || t.startsWith("decimal") || t.equals("float4") || t.equals("float8")) {
      return "REAL";
    }
    if (t.equals("bytea") || t.equals("blob")) return "BLOB";
    return canonicalType;
  }

  @Override
  public String arrayOperator(Operator operator) {
    throw new QueryException("Array operators (arrayContains, arrayContainedBy, arrayOverlaps) are not supported on SQLite");
  }

  @Override
  public String jsonPath(String quotedColumn, List<String> segments) {
    throw new QueryException("JSONB path operators (->>, ->) are not supported on SQLite");
  }

  @Override
  public String likeEscapeClause() {
    return " ESCAPE '\\'";
  }

  @Override
  public boolean supportsAlterColumn() {
    return false;
  }
}
