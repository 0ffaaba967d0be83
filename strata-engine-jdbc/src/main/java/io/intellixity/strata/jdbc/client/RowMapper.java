package io.intellixity.strata.jdbc.client;

import io.intellixity.strata.casing.Casing;
import io.intellixity.strata.casing.CasingOverrides;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Storage-cased result rows to declared-cased, mutable, insertion-ordered maps. */
public final class RowMapper {
  private final CasingOverrides casing;

  public RowMapper(CasingOverrides casing) {
    this.casing = casing == null ? CasingOverrides.none() : casing;
  }

  public Map<String, Object> map(Map<String, Object> row) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : row.entrySet()) out.put(Casing.snakeToCamel(e.getKey(), casing), e.getValue());
    return out;
  }

  public List<Map<String, Object>> mapAll(List<Map<String, Object>> rows) {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) out.add(map(r));
    return out;
  }
}
