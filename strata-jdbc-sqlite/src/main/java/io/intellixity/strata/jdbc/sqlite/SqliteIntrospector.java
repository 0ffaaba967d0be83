package io.intellixity.strata.jdbc.sqlite;

import io.intellixity.strata.snapshot.*;
import io.intellixity.strata.spi.exec.QueryFn;
import io.intellixity.strata.spi.introspect.SchemaIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Catalog introspection through {@code sqlite_master} and the table PRAGMAs.
 * Only explicitly created indexes (origin {@code c}) are reported; single-column UNIQUE constraints
 * (origin {@code u}) mark the column unique instead.
 */
public final class SqliteIntrospector implements SchemaIntrospector {
  private static final Logger log = LoggerFactory.getLogger(SqliteIntrospector.class);

  static final String TABLES_SQL =
      "SELECT name FROM sqlite_master WHERE type='table' AND name NOT LIKE 'sqlite_%' ORDER BY name";

  private static final Set<String> EXCLUDED = Set.of("sqlite_sequence", HISTORY_TABLE);

  @Override
  public String dialectId() {
    return "sqlite";
  }

  @Override
  public SchemaSnapshot introspect(QueryFn fn) {
    Map<String, TableSnapshot> tables = new LinkedHashMap<>();
    for (Map<String, Object> t : fn.query(TABLES_SQL, List.of()).rows()) {
      String table = String.valueOf(t.get("name"));
      if (EXCLUDED.contains(table)) continue;
      tables.put(table, table(fn, table));
    }
    log.debug("strata.introspect dialect=sqlite tables={}", tables.size());
    return new SchemaSnapshot(SchemaSnapshot.CURRENT_VERSION, tables, Map.of());
  }

  private TableSnapshot table(QueryFn fn, String table) {
    Map<String, ColumnSnapshot> columns = new LinkedHashMap<>();
    for (Map<String, Object> c : fn.query("PRAGMA table_info(" + quote(table) + ")", List.of()).rows()) {
      boolean pk = intOf(c.get("pk")) > 0;
      ColumnSnapshot col = ColumnSnapshot.of(normalizeType(String.valueOf(c.get("type"))),
          intOf(c.get("notnull")) == 0 && !pk, pk, false);
      Object def = c.get("dflt_value");
      columns.put(String.valueOf(c.get("name")), def == null ? col : col.withDefault(String.valueOf(def)));
    }

    List<IndexSnapshot> indexes = new ArrayList<>();
    for (Map<String, Object> idx : fn.query("PRAGMA index_list(" + quote(table) + ")", List.of()).rows()) {
      String name = String.valueOf(idx.get("name"));
      boolean unique = intOf(idx.get("unique")) == 1;
      String origin = String.valueOf(idx.get("origin"));
      List<String> cols = new ArrayList<>();
      for (Map<String, Object> info : fn.query("PRAGMA index_info(" + quote(name) + ")", List.of()).rows()) {
        cols.add(String.valueOf(info.get("name")));
      }
      if (unique && cols.size() == 1 && "u".equals(origin)) {
        ColumnSnapshot c = columns.get(cols.get(0));
        if (c != null) {
          columns.put(cols.get(0), new ColumnSnapshot(c.type(), c.nullable(), c.primary(), true,
              c.defaultValue(), c.sensitive(), c.hidden()));
        }
      }
      if ("c".equals(origin)) indexes.add(new IndexSnapshot(cols, name, unique));
    }

    List<ForeignKeySnapshot> fks = new ArrayList<>();
    for (Map<String, Object> f : fn.query("PRAGMA foreign_key_list(" + quote(table) + ")", List.of()).rows()) {
      fks.add(new ForeignKeySnapshot(String.valueOf(f.get("from")), String.valueOf(f.get("table")),
          String.valueOf(f.get("to"))));
    }
    return new TableSnapshot(columns, indexes, fks);
  }

  /** Affinity names back to canonical snapshot types. */
  static String normalizeType(String raw) {
    String upper = raw.toUpperCase(Locale.ROOT);
    return switch (upper) {
      case "TEXT" -> "text";
      case "INTEGER", "INT" -> "integer";
      case "REAL" -> "float";
      case "BLOB" -> "blob";
      default -> raw.toLowerCase(Locale.ROOT);
    };
  }

  private static String quote(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  private static int intOf(Object v) {
    if (v == null) return 0;
    if (v instanceof Number n) return n.intValue();
    return Integer.parseInt(v.toString());
  }
}
