package io.intellixity.strata.spi.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Statement text plus its ordered parameters. Parameters may contain nulls. */
public record SqlStatement(String sql, List<Object> params) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static SqlStatement of(String sql) {
    return new SqlStatement(sql, List.of());
  }
}
