package io.intellixity.strata.query;

import io.intellixity.strata.query.WhereFilter.*;

import java.util.*;

/** Factory methods for {@link WhereFilter} trees. */
public final class Filters {
  private Filters() {}

  private static final And NONE = new And(List.of());

  /** Matches everything; renders no WHERE clause. */
  public static And none() { return NONE; }

  public static Comparison eq(String column, Object value) { return new Comparison(column, Operator.EQ, value); }
  public static Comparison ne(String column, Object value) { return new Comparison(column, Operator.NE, value); }
  public static Comparison gt(String column, Object value) { return new Comparison(column, Operator.GT, value); }
  public static Comparison gte(String column, Object value) { return new Comparison(column, Operator.GTE, value); }
  public static Comparison lt(String column, Object value) { return new Comparison(column, Operator.LT, value); }
  public static Comparison lte(String column, Object value) { return new Comparison(column, Operator.LTE, value); }

  public static Comparison contains(String column, String text) { return new Comparison(column, Operator.CONTAINS, text); }
  public static Comparison startsWith(String column, String text) { return new Comparison(column, Operator.STARTS_WITH, text); }
  public static Comparison endsWith(String column, String text) { return new Comparison(column, Operator.ENDS_WITH, text); }

  public static Comparison in(String column, Collection<?> values) {
    return new Comparison(column, Operator.IN, Collections.unmodifiableList(new ArrayList<>(values)));
  }

  public static Comparison notIn(String column, Collection<?> values) {
    return new Comparison(column, Operator.NOT_IN, Collections.unmodifiableList(new ArrayList<>(values)));
  }

  public static Comparison isNull(String column) { return new Comparison(column, Operator.IS_NULL, true); }
  public static Comparison isNotNull(String column) { return new Comparison(column, Operator.IS_NULL, false); }

  public static Comparison arrayContains(String column, Collection<?> values) {
    return new Comparison(column, Operator.ARRAY_CONTAINS, List.copyOf(values));
  }

  public static Comparison arrayContainedBy(String column, Collection<?> values) {
    return new Comparison(column, Operator.ARRAY_CONTAINED_BY, List.copyOf(values));
  }

  public static Comparison arrayOverlaps(String column, Collection<?> values) {
    return new Comparison(column, Operator.ARRAY_OVERLAPS, List.copyOf(values));
  }

  public static And and(WhereFilter... children) { return new And(List.of(children)); }
  public static And and(List<WhereFilter> children) { return new And(children); }
  public static Or or(WhereFilter... children) { return new Or(List.of(children)); }
  public static Or or(List<WhereFilter> children) { return new Or(children); }
  public static Not not(WhereFilter child) { return new Not(child); }

  /**
   * Parse the map form of a filter: column keys map to a scalar (equality shorthand) or to an operator
   * object ({@code {gte: 18, lt: 65}}); {@code OR}/{@code AND} map to lists of nested filter maps and
   * {@code NOT} to one nested filter map.
   * <p>
   * A value map counts as an operator object only when it is non-empty and every key is an operator key;
   * any other value is compared for equality.
   */
  @SuppressWarnings("unchecked")
  public static And fromMap(Map<String, ?> filter) {
    if (filter == null || filter.isEmpty()) return NONE;
    List<WhereFilter> out = new ArrayList<>();
    Object or = null;
    Object and = null;
    Object not = null;
    boolean hasOr = false;
    boolean hasAnd = false;
    boolean hasNot = false;

    for (var e : filter.entrySet()) {
      String key = e.getKey();
      Object value = e.getValue();
      switch (key) {
        case "OR" -> { or = value; hasOr = true; }
        case "AND" -> { and = value; hasAnd = true; }
        case "NOT" -> { not = value; hasNot = true; }
        default -> {
          if (isOperatorObject(value)) {
            Map<String, ?> ops = (Map<String, ?>) value;
            for (Operator op : Operator.values()) {
              if (ops.containsKey(op.key())) out.add(comparison(key, op, ops.get(op.key())));
            }
          } else {
            out.add(new Comparison(key, Operator.EQ, value));
          }
        }
      }
    }

    // combinators follow the column leaves, OR before AND before NOT
    if (hasOr) out.add(new Or(nested(or, "OR")));
    if (hasAnd) out.add(new And(nested(and, "AND")));
    if (hasNot) {
      if (!(not instanceof Map<?, ?> nm)) throw new IllegalArgumentException("NOT expects a filter object");
      out.add(new Not(fromMap((Map<String, ?>) nm)));
    }
    return new And(out);
  }

  @SuppressWarnings("unchecked")
  private static List<WhereFilter> nested(Object raw, String key) {
    if (!(raw instanceof List<?> list)) throw new IllegalArgumentException(key + " expects a list of filter objects");
    List<WhereFilter> out = new ArrayList<>(list.size());
    for (Object o : list) {
      if (!(o instanceof Map<?, ?> m)) throw new IllegalArgumentException(key + " expects a list of filter objects");
      out.add(fromMap((Map<String, ?>) m));
    }
    return out;
  }

  private static Comparison comparison(String column, Operator op, Object value) {
    if ((op == Operator.IN || op == Operator.NOT_IN || op.isArray()) && value instanceof Object[] arr) {
      value = Arrays.asList(arr);
    }
    return new Comparison(column, op, value);
  }

  private static boolean isOperatorObject(Object value) {
    if (!(value instanceof Map<?, ?> m) || m.isEmpty()) return false;
    for (Object k : m.keySet()) {
      if (!(k instanceof String s) || Operator.fromKey(s) == null) return false;
    }
    return true;
  }
}
