package io.intellixity.strata.jdbc.postgres;

import io.intellixity.strata.snapshot.*;
import io.intellixity.strata.spi.exec.QueryFn;
import io.intellixity.strata.spi.exec.QueryResult;
import io.intellixity.strata.spi.introspect.SchemaIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Catalog introspection for the {@code public} schema: tables, columns in ordinal order, primary keys,
 * single-column unique constraints, foreign keys, plain (non-unique, non-primary) indexes and enum types.
 */
public final class PostgresIntrospector implements SchemaIntrospector {
  private static final Logger log = LoggerFactory.getLogger(PostgresIntrospector.class);

  static final String TABLES_SQL =
      "SELECT table_name FROM information_schema.tables "
          + "WHERE table_schema = 'public' AND table_type = 'BASE TABLE' ORDER BY table_name";

  static final String PRIMARY_KEYS_SQL =
      "SELECT kcu.table_name, kcu.column_name "
          + "FROM information_schema.table_constraints tc "
          + "JOIN information_schema.key_column_usage kcu "
          + "ON tc.constraint_name = kcu.constraint_name AND tc.table_schema = kcu.table_schema "
          + "WHERE tc.constraint_type = 'PRIMARY KEY' AND tc.table_schema = 'public'";

  static final String UNIQUES_SQL =
      "SELECT tc.table_name, kcu.column_name, tc.constraint_name "
          + "FROM information_schema.table_constraints tc "
          + "JOIN information_schema.key_column_usage kcu "
          + "ON tc.constraint_name = kcu.constraint_name AND tc.table_schema = kcu.table_schema "
          + "WHERE tc.constraint_type = 'UNIQUE' AND tc.table_schema = 'public'";

  static final String COLUMNS_SQL =
      "SELECT column_name, data_type, udt_name, is_nullable, column_default "
          + "FROM information_schema.columns "
          + "WHERE table_name = $1 AND table_schema = 'public' ORDER BY ordinal_position";

  static final String FOREIGN_KEYS_SQL =
      "SELECT kcu.column_name, ccu.table_name AS target_table, ccu.column_name AS target_column "
          + "FROM information_schema.table_constraints tc "
          + "JOIN information_schema.key_column_usage kcu "
          + "ON tc.constraint_name = kcu.constraint_name AND tc.table_schema = kcu.table_schema "
          + "JOIN information_schema.constraint_column_usage ccu "
          + "ON tc.constraint_name = ccu.constraint_name AND tc.table_schema = ccu.table_schema "
          + "WHERE tc.constraint_type = 'FOREIGN KEY' AND tc.table_name = $1 AND tc.table_schema = 'public'";

  static final String INDEXES_SQL =
      "SELECT i.relname AS index_name, array_agg(a.attname ORDER BY k.n) AS columns, ix.indisunique AS is_unique "
          + "FROM pg_index ix "
          + "JOIN pg_class i ON i.oid = ix.indexrelid "
          + "JOIN pg_class t ON t.oid = ix.indrelid "
          + "JOIN pg_namespace ns ON ns.oid = t.relnamespace "
          + "JOIN LATERAL unnest(ix.indkey) WITH ORDINALITY AS k(attnum, n) ON true "
          + "JOIN pg_attribute a ON a.attrelid = t.oid AND a.attnum = k.attnum "
          + "WHERE t.relname = $1 AND ns.nspname = 'public' AND NOT ix.indisprimary AND NOT ix.indisunique "
          + "GROUP BY i.relname, ix.indisunique ORDER BY i.relname";

  static final String ENUMS_SQL =
      "SELECT t.typname AS enum_name, e.enumlabel AS enum_value "
          + "FROM pg_type t "
          + "JOIN pg_enum e ON t.oid = e.enumtypid "
          + "JOIN pg_catalog.pg_namespace n ON n.oid = t.typnamespace "
          + "WHERE n.nspname = 'public' ORDER BY t.typname, e.enumsortorder";

  @Override
  public String dialectId() {
    return "postgres";
  }

  @Override
  public SchemaSnapshot introspect(QueryFn fn) {
    Map<String, Set<String>> pks = byTable(fn.query(PRIMARY_KEYS_SQL, List.of()));
    Map<String, Set<String>> uniques = singleColumnUniques(fn.query(UNIQUES_SQL, List.of()));

    Map<String, TableSnapshot> tables = new LinkedHashMap<>();
    for (Map<String, Object> t : fn.query(TABLES_SQL, List.of()).rows()) {
      String table = str(t.get("table_name"));
      if (HISTORY_TABLE.equals(table)) continue;
      Set<String> pkCols = pks.getOrDefault(table, Set.of());
      Set<String> uniqueCols = uniques.getOrDefault(table, Set.of());

      Map<String, ColumnSnapshot> columns = new LinkedHashMap<>();
      for (Map<String, Object> c : fn.query(COLUMNS_SQL, List.of(table)).rows()) {
        String name = str(c.get("column_name"));
        ColumnSnapshot col = ColumnSnapshot.of(columnType(c), "YES".equals(str(c.get("is_nullable"))),
            pkCols.contains(name), uniqueCols.contains(name));
        Object def = c.get("column_default");
        columns.put(name, def == null ? col : col.withDefault(String.valueOf(def)));
      }

      List<ForeignKeySnapshot> fks = new ArrayList<>();
      for (Map<String, Object> f : fn.query(FOREIGN_KEYS_SQL, List.of(table)).rows()) {
        fks.add(new ForeignKeySnapshot(str(f.get("column_name")), str(f.get("target_table")), str(f.get("target_column"))));
      }

      List<IndexSnapshot> indexes = new ArrayList<>();
      for (Map<String, Object> i : fn.query(INDEXES_SQL, List.of(table)).rows()) {
        indexes.add(new IndexSnapshot(stringList(i.get("columns")), str(i.get("index_name")),
            Boolean.TRUE.equals(i.get("is_unique"))));
      }
      tables.put(table, new TableSnapshot(columns, indexes, fks));
    }

    Map<String, List<String>> enums = new LinkedHashMap<>();
    for (Map<String, Object> e : fn.query(ENUMS_SQL, List.of()).rows()) {
      enums.computeIfAbsent(str(e.get("enum_name")), k -> new ArrayList<>()).add(str(e.get("enum_value")));
    }
    log.debug("strata.introspect dialect=postgres tables={} enums={}", tables.size(), enums.size());
    return new SchemaSnapshot(SchemaSnapshot.CURRENT_VERSION, tables, enums);
  }

  /** Enum columns report USER-DEFINED; the type name is in udt_name. */
  private static String columnType(Map<String, Object> c) {
    String dataType = str(c.get("data_type"));
    if ("USER-DEFINED".equals(dataType) && c.get("udt_name") != null) return str(c.get("udt_name"));
    return dataType;
  }

  private static Map<String, Set<String>> byTable(QueryResult r) {
    Map<String, Set<String>> out = new HashMap<>();
    for (Map<String, Object> row : r.rows()) {
      out.computeIfAbsent(str(row.get("table_name")), k -> new LinkedHashSet<>()).add(str(row.get("column_name")));
    }
    return out;
  }

  private static Map<String, Set<String>> singleColumnUniques(QueryResult r) {
    Map<String, String> tableOf = new HashMap<>();
    Map<String, List<String>> colsOf = new LinkedHashMap<>();
    for (Map<String, Object> row : r.rows()) {
      String constraint = str(row.get("constraint_name"));
      tableOf.put(constraint, str(row.get("table_name")));
      colsOf.computeIfAbsent(constraint, k -> new ArrayList<>()).add(str(row.get("column_name")));
    }
    Map<String, Set<String>> out = new HashMap<>();
    for (var e : colsOf.entrySet()) {
      if (e.getValue().size() == 1) {
        out.computeIfAbsent(tableOf.get(e.getKey()), k -> new LinkedHashSet<>()).add(e.getValue().get(0));
      }
    }
    return out;
  }

  private static List<String> stringList(Object v) {
    List<String> out = new ArrayList<>();
    if (v instanceof Collection<?> c) {
      for (Object o : c) out.add(String.valueOf(o));
    } else if (v instanceof Object[] arr) {
      for (Object o : arr) out.add(String.valueOf(o));
    } else if (v instanceof String s) {
      // text form of an array: {a,b}
      String inner = s.startsWith("{") && s.endsWith("}") ? s.substring(1, s.length() - 1) : s;
      for (String p : inner.split(",")) if (!p.isBlank()) out.add(p.trim());
    }
    return out;
  }

  private static String str(Object v) {
    return v == null ? null : v.toString();
  }
}
