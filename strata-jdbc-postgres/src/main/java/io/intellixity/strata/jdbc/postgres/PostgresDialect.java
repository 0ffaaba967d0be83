package io.intellixity.strata.jdbc.postgres;

import io.intellixity.strata.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.strata.query.Operator;

import java.util.List;

/**
 * Postgres dialect.
 *
 * Keeps only Postgres-specific overrides; the generic token set lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public static final PostgresDialect INSTANCE = new PostgresDialect();

  @Override public String id() { return "postgres"; }

  @Override
  public String autoIncrementPrimaryKey() {
    return "serial PRIMARY KEY";
  }

  @Override
  public String arrayOperator(Operator operator) {
    return switch (operator) {
      case ARRAY_CONTAINS -> "@>";
      case ARRAY_CONTAINED_BY -> "<@";
      case ARRAY_OVERLAPS -> "&&";
      default -> throw new IllegalArgumentException("Not an array operator: " + operator);
    };
  }

  /** {@code "meta"->'a'->>'b'}: intermediate segments keep jsonb, the last one extracts text. */
  @Override
  public String jsonPath(String quotedColumn, List<String> segments) {
    if (segments.isEmpty()) return quotedColumn;
    StringBuilder sb = new StringBuilder(quotedColumn);
    for (int i = 0; i < segments.size(); i++) {
      sb.append(i == segments.size() - 1 ? "->>" : "->").append(literal(segments.get(i)));
    }
    return sb.toString();
  }

  @Override
  public boolean supportsNativeEnums() {
    return true;
  }
}
