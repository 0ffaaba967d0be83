package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.casing.CasingOverrides;
import io.intellixity.strata.query.Operator;
import io.intellixity.strata.query.WhereFilter;
import io.intellixity.strata.query.WhereFilter.*;
import io.intellixity.strata.spi.sql.SqlDialect;

import java.util.*;

/**
 * Compiles a {@link WhereFilter} into a parameterized predicate.
 *
 * Rules:
 * <ul>
 * <li>every value is bound; identifiers are quoted after casing conversion
 * <li>{@code in []} is FALSE, {@code notIn []} is TRUE, empty OR is FALSE, empty AND is TRUE,
 *   at any nesting depth
 * <li>pattern operators escape backslash, then {@code %}, then {@code _} before adding wildcards
 * <li>OR branches with several clauses are parenthesized; NOT wraps the conjunction of its clauses
 * <li>{@code col->a->b} renders through {@link SqlDialect#jsonPath}
 * </ul>
 */
public final class WhereBuilder {
  private WhereBuilder() {}

  public static WhereClause build(WhereFilter filter, SqlDialect dialect) {
    return build(filter, 0, dialect, CasingOverrides.none());
  }

  /**
   * @param paramOffset number of parameters already bound ahead of this fragment;
   *                    the first placeholder is {@code paramOffset + 1}
   */
  public static WhereClause build(WhereFilter filter, int paramOffset, SqlDialect dialect, CasingOverrides casing) {
    Objects.requireNonNull(dialect, "dialect");
    if (WhereFilter.isEmpty(filter)) return new WhereClause("", List.of());
    RenderCtx ctx = new RenderCtx(dialect, casing, paramOffset);
    List<String> clauses = clauses(filter, ctx);
    return new WhereClause(String.join(" AND ", clauses), ctx.params());
  }

  private static List<String> clauses(WhereFilter f, RenderCtx ctx) {
    if (f instanceof Comparison c) return List.of(comparison(c, ctx));
    if (f instanceof And a) {
      if (a.children().isEmpty()) return List.of("TRUE");
      List<String> out = new ArrayList<>();
      for (WhereFilter child : a.children()) out.addAll(clauses(child, ctx));
      return out;
    }
    if (f instanceof Or o) {
      if (o.children().isEmpty()) return List.of("FALSE");
      List<String> branches = new ArrayList<>(o.children().size());
      for (WhereFilter child : o.children()) {
        List<String> sub = clauses(child, ctx);
        String joined = String.join(" AND ", sub);
        branches.add(sub.size() > 1 ? "(" + joined + ")" : joined);
      }
      return List.of("(" + String.join(" OR ", branches) + ")");
    }
    if (f instanceof Not n) {
      return List.of("NOT (" + String.join(" AND ", clauses(n.child(), ctx)) + ")");
    }
    throw new IllegalArgumentException("Unknown filter node: " + f);
  }

  private static String comparison(Comparison c, RenderCtx ctx) {
    String ref = columnRef(c.column(), ctx);
    Object v = c.value();
    Operator op = c.operator();
    return switch (op) {
      case EQ -> ref + " = " + ctx.add(v);
      case NE -> ref + " != " + ctx.add(v);
      case GT -> ref + " > " + ctx.add(v);
      case GTE -> ref + " >= " + ctx.add(v);
      case LT -> ref + " < " + ctx.add(v);
      case LTE -> ref + " <= " + ctx.add(v);
      case CONTAINS -> like(ref, "%" + escapeLike(v.toString()) + "%", ctx);
      case STARTS_WITH -> like(ref, escapeLike(v.toString()) + "%", ctx);
      case ENDS_WITH -> like(ref, "%" + escapeLike(v.toString()), ctx);
      case IN -> inList(ref, (Collection<?>) v, false, ctx);
      case NOT_IN -> inList(ref, (Collection<?>) v, true, ctx);
      case IS_NULL -> ref + (Boolean.TRUE.equals(v) ? " IS NULL" : " IS NOT NULL");
      case ARRAY_CONTAINS, ARRAY_CONTAINED_BY, ARRAY_OVERLAPS ->
          ref + " " + ctx.dialect().arrayOperator(op) + " " + ctx.add(v);
    };
  }

  private static String like(String ref, String pattern, RenderCtx ctx) {
    return ref + " LIKE " + ctx.add(pattern) + ctx.dialect().likeEscapeClause();
  }

  private static String inList(String ref, Collection<?> values, boolean negate, RenderCtx ctx) {
    if (values.isEmpty()) return negate ? "TRUE" : "FALSE";
    List<String> ps = new ArrayList<>(values.size());
    for (Object o : values) ps.add(ctx.add(o));
    return ref + (negate ? " NOT IN (" : " IN (") + String.join(", ", ps) + ")";
  }

  /** Backslash first so the escapes added for {@code %} and {@code _} are not escaped again. */
  public static String escapeLike(String s) {
    return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  static String columnRef(String key, RenderCtx ctx) {
    int arrow = key.indexOf("->");
    if (arrow < 0) return ctx.col(key);
    String[] parts = key.split("->", -1);
    String base = ctx.col(parts[0]);
    List<String> segments = Arrays.asList(parts).subList(1, parts.length);
    return ctx.dialect().jsonPath(base, segments);
  }
}
