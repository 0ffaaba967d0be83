package io.intellixity.strata.jdbc.dialect;

import io.intellixity.strata.error.QueryException;
import io.intellixity.strata.query.Operator;
import io.intellixity.strata.spi.sql.SqlDialect;

import java.util.List;

/**
 * JDBC-generic dialect base.
 *
 * Defaults follow the full-featured backend's token set ({@code $n} placeholders, {@code NOW()},
 * pass-through types). Capability hooks (arrays, path extraction) default to throwing;
 * dialects with the feature override them.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  @Override
  public String param(int index) {
    if (index < 1) throw new IllegalArgumentException("Parameter index is 1-based: " + index);
    return "$" + index;
  }

  @Override
  public String now() {
    return "NOW()";
  }

  @Override
  public String currentTimestampDefault() {
    return "now()";
  }

  @Override
  public String mapColumnType(String canonicalType) {
    return canonicalType;
  }

  /** Default throws; dialects with native arrays override. */
  @Override
  public String arrayOperator(Operator operator) {
    throw new QueryException("Array operator " + operator.key() + " not supported by dialect: " + id());
  }

  /** Default throws; dialects with semi-structured path extraction override. */
  @Override
  public String jsonPath(String quotedColumn, List<String> segments) {
    throw new QueryException("JSON path filters not supported by dialect: " + id());
  }

  @Override
  public String likeEscapeClause() {
    return "";
  }

  @Override
  public boolean supportsAlterColumn() {
    return true;
  }

  @Override
  public boolean supportsNativeEnums() {
    return false;
  }

  /** Single-quoted SQL literal with embedded quotes doubled. */
  protected static String literal(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + id() + "]";
  }
}
