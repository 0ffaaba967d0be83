package io.intellixity.strata.jdbc.sql;

import io.intellixity.strata.casing.Casing;
import io.intellixity.strata.casing.CasingOverrides;
import io.intellixity.strata.error.QueryException;
import io.intellixity.strata.query.SortField.Direction;
import io.intellixity.strata.query.WhereFilter;
import io.intellixity.strata.spi.sql.SqlDialect;
import io.intellixity.strata.spi.sql.SqlStatement;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * COUNT / aggregate / GROUP BY rendering plus reshaping of the flat result row.
 * <p>
 * Aggregation aliases: {@code _count}, {@code _count_<col>}, {@code _avg_<col>}, {@code _sum_<col>},
 * {@code _min_<col>}, {@code _max_<col>} with {@code <col>} in storage casing.
 */
public final class AggregateBuilder {
  private static final String[] FUNCTIONS = {"avg", "sum", "min", "max"};

  private AggregateBuilder() {}

  public static SqlStatement count(String table, WhereFilter where, SqlDialect dialect, CasingOverrides casing) {
    RenderCtx ctx = new RenderCtx(dialect, casing, 0);
    StringBuilder sql = new StringBuilder("SELECT COUNT(*) AS ").append(ctx.q("count"))
        .append(" FROM ").append(ctx.q(table));
    appendWhere(sql, where, ctx, casing);
    return new SqlStatement(sql.toString(), ctx.params());
  }

  /** @throws QueryException when no aggregation is requested */
  public static SqlStatement aggregate(String table, WhereFilter where, AggregateFields fields,
                                       SqlDialect dialect, CasingOverrides casing) {
    if (fields.isEmpty()) throw new QueryException("aggregate requires at least one aggregation field");
    RenderCtx ctx = new RenderCtx(dialect, casing, 0);
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(String.join(", ", aggregationItems(fields, ctx, casing)))
        .append(" FROM ").append(ctx.q(table));
    appendWhere(sql, where, ctx, casing);
    return new SqlStatement(sql.toString(), ctx.params());
  }

  public static SqlStatement groupBy(GroupByQuery q, SqlDialect dialect) {
    CasingOverrides casing = q.casing();
    RenderCtx ctx = new RenderCtx(dialect, casing, 0);
    List<String> items = new ArrayList<>();
    List<String> groupCols = new ArrayList<>(q.by().size());
    for (String col : q.by()) {
      items.add(ctx.selectItem(col));
      groupCols.add(ctx.col(col));
    }
    items.addAll(aggregationItems(q.fields(), ctx, casing));

    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", items))
        .append(" FROM ").append(ctx.q(q.table()));
    appendWhere(sql, q.where(), ctx, casing);
    sql.append(" GROUP BY ").append(String.join(", ", groupCols));

    if (!q.orderBy().isEmpty()) {
      Set<String> aliases = aliases(q.fields(), casing);
      List<String> order = new ArrayList<>(q.orderBy().size());
      for (var e : q.orderBy().entrySet()) {
        String key = e.getKey();
        String dir = Direction.parse(e.getValue()).name();
        if (key.equals("_count")) {
          order.add("COUNT(*) " + dir);
        } else if (key.startsWith("_")) {
          if (!aliases.contains(key)) {
            throw new QueryException("Invalid orderBy column \"" + key
                + "\". Underscore-prefixed columns must match a requested aggregation alias.");
          }
          order.add(ctx.q(key) + " " + dir);
        } else {
          order.add(ctx.col(key) + " " + dir);
        }
      }
      sql.append(" ORDER BY ").append(String.join(", ", order));
    }
    if (q.limit() != null) sql.append(" LIMIT ").append(ctx.add(q.limit()));
    if (q.offset() != null) sql.append(" OFFSET ").append(ctx.add(q.offset()));
    return new SqlStatement(sql.toString(), ctx.params());
  }

  /**
   * Nest a flat aggregate row: {@code {_count: n | {col: n}, _avg: {col: x}, ...}}.
   * Counts default to 0; other aggregates stay null on an empty input.
   */
  public static Map<String, Object> shape(Map<String, Object> row, AggregateFields fields, CasingOverrides casing) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (fields.countAll()) {
      out.put("_count", toLong(row.get("_count")));
    } else if (!fields.count().isEmpty()) {
      Map<String, Object> counts = new LinkedHashMap<>();
      for (String col : fields.count()) counts.put(col, toLong(row.get("_count_" + snake(col, casing))));
      out.put("_count", counts);
    }
    for (String fn : FUNCTIONS) {
      List<String> cols = columnsFor(fn, fields);
      if (cols.isEmpty()) continue;
      Map<String, Object> values = new LinkedHashMap<>();
      for (String col : cols) values.put(col, toNumber(fn, row.get("_" + fn + "_" + snake(col, casing))));
      out.put("_" + fn, values);
    }
    return out;
  }

  /** {@link #shape} plus the group columns, read under their declared or storage name. */
  public static Map<String, Object> shapeGroup(Map<String, Object> row, GroupByQuery q) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (String col : q.by()) {
      Object v = row.containsKey(col) ? row.get(col) : row.get(snake(col, q.casing()));
      out.put(col, v);
    }
    out.putAll(shape(row, q.fields(), q.casing()));
    return out;
  }

  public static long toLong(Object v) {
    if (v == null) return 0L;
    if (v instanceof Number n) return n.longValue();
    return Long.parseLong(v.toString().trim());
  }

  /** AVG is always a double; SUM, MIN and MAX stay {@code Long} when the backend value is integral. */
  private static Object toNumber(String fn, Object v) {
    if (v == null) return null;
    boolean avg = "avg".equals(fn);
    if (v instanceof Number n) return avg || !isIntegral(n) ? n.doubleValue() : n.longValue();
    String text = v.toString().trim();
    try {
      return avg ? Double.parseDouble(text) : Long.parseLong(text);
    } catch (NumberFormatException notLong) {
      try {
        return Double.parseDouble(text);
      } catch (NumberFormatException e) {
        // MIN/MAX over non-numeric columns (text, timestamps)
        return v;
      }
    }
  }

  private static boolean isIntegral(Number n) {
    if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
        || n instanceof BigInteger) {
      return true;
    }
    return n instanceof BigDecimal d && d.stripTrailingZeros().scale() <= 0;
  }

  private static List<String> aggregationItems(AggregateFields f, RenderCtx ctx, CasingOverrides casing) {
    List<String> items = new ArrayList<>();
    if (f.countAll()) {
      items.add("COUNT(*) AS " + ctx.q("_count"));
    } else {
      for (String col : f.count()) {
        String s = snake(col, casing);
        items.add("COUNT(" + ctx.q(s) + ") AS " + ctx.q("_count_" + s));
      }
    }
    for (String fn : FUNCTIONS) {
      for (String col : columnsFor(fn, f)) {
        String s = snake(col, casing);
        items.add(fn.toUpperCase(Locale.ROOT) + "(" + ctx.q(s) + ") AS " + ctx.q("_" + fn + "_" + s));
      }
    }
    return items;
  }

  private static Set<String> aliases(AggregateFields f, CasingOverrides casing) {
    Set<String> out = new HashSet<>();
    out.add("_count");
    for (String col : f.count()) out.add("_count_" + snake(col, casing));
    for (String fn : FUNCTIONS) {
      for (String col : columnsFor(fn, f)) out.add("_" + fn + "_" + snake(col, casing));
    }
    return out;
  }

  private static List<String> columnsFor(String fn, AggregateFields f) {
    return switch (fn) {
      case "avg" -> f.avg();
      case "sum" -> f.sum();
      case "min" -> f.min();
      case "max" -> f.max();
      default -> throw new IllegalArgumentException(fn);
    };
  }

  private static void appendWhere(StringBuilder sql, WhereFilter where, RenderCtx ctx, CasingOverrides casing) {
    WhereClause w = WhereBuilder.build(where, ctx.nextIndex(), ctx.dialect(), casing);
    if (w.isEmpty()) return;
    sql.append(" WHERE ").append(w.sql());
    ctx.addAll(w.params());
  }

  private static String snake(String col, CasingOverrides casing) {
    return Casing.camelToSnake(col, casing);
  }
}
