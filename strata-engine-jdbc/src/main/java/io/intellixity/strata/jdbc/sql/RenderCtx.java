package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.casing.Casing;
import io.intellixity.strata.casing.CasingOverrides;
import io.intellixity.strata.spi.sql.SqlDialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-statement render state: collects parameters and hands out placeholders numbered from
 * {@code offset + 1}, so fragments compose without renumbering.
 */
final class RenderCtx {
  private final SqlDialect dialect;
  private final CasingOverrides casing;
  private final int offset;
  private final List<Object> params = new ArrayList<>();

  RenderCtx(SqlDialect dialect, CasingOverrides casing, int offset) {
    this.dialect = dialect;
    this.casing = casing == null ? CasingOverrides.none() : casing;
    this.offset = offset;
  }

  String add(Object value) {
    params.add(value);
    return dialect.param(offset + params.size());
  }

  void addAll(List<Object> values) {
    params.addAll(values);
  }

  List<Object> params() {
    return Collections.unmodifiableList(params);
  }

  int nextIndex() {
    return offset + params.size();
  }

  SqlDialect dialect() {
    return dialect;
  }

  String q(String ident) {
    return dialect.quoteIdent(ident);
  }

  /** Quoted storage name for a declared column. */
  String col(String declared) {
    return q(Casing.camelToSnake(declared, casing));
  }

  /** Projection item: {@code "snake" AS "declared"} when the names differ. */
  String selectItem(String declared) {
    String snake = Casing.camelToSnake(declared, casing);
    if (snake.equals(declared)) return q(declared);
    return q(snake) + " AS " + q(declared);
  }

  String returning(List<String> returning) {
    if (returning == null || returning.isEmpty()) return "";
    if (returning.size() == 1 && "*".equals(returning.get(0))) return " RETURNING *";
    List<String> items = new ArrayList<>(returning.size());
    for (String r : returning) items.add(selectItem(r));
    return " RETURNING " + String.join(", ", items);
  }
}
