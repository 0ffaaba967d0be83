package io.intellixity.strata.query;

import java.util.HashMap;
import java.util.Map;

/**
 * Leaf comparison operators. Declaration order is the compile order when several operators
 * are given for the same column.
 */
public enum Operator {
  EQ("eq"),
  NE("ne"),
  GT("gt"),
  GTE("gte"),
  LT("lt"),
  LTE("lte"),
  CONTAINS("contains"),
  STARTS_WITH("startsWith"),
  ENDS_WITH("endsWith"),
  IN("in"),
  NOT_IN("notIn"),
  IS_NULL("isNull"),

  // Dialect-gated: backends without native arrays reject these.
  ARRAY_CONTAINS("arrayContains"),
  ARRAY_CONTAINED_BY("arrayContainedBy"),
  ARRAY_OVERLAPS("arrayOverlaps");

  private static final Map<String, Operator> BY_KEY = new HashMap<>();
  static {
    for (Operator o : values()) BY_KEY.put(o.key, o);
  }

  private final String key;

  Operator(String key) {
    this.key = key;
  }

  /** Key used in the map form of a filter, e.g. {@code startsWith}. */
  public String key() { return key; }

  public boolean isArray() {
    return this == ARRAY_CONTAINS || this == ARRAY_CONTAINED_BY || this == ARRAY_OVERLAPS;
  }

  public boolean isPattern() {
    return this == CONTAINS || this == STARTS_WITH || this == ENDS_WITH;
  }

  /** @return the operator for {@code key}, or null when it is not an operator key */
  public static Operator fromKey(String key) {
    return BY_KEY.get(key);
  }
}
