package io.intellixity.strata.migration;

import io.intellixity.strata.casing.Casing;
import io.intellixity.strata.casing.CasingOverrides;
import io.intellixity.strata.diff.DiffChange;
import io.intellixity.strata.diff.DiffChange.*;
import io.intellixity.strata.diff.DiffResult;
import io.intellixity.strata.diff.SchemaDiffer;
import io.intellixity.strata.error.QueryException;
import io.intellixity.strata.snapshot.*;
import io.intellixity.strata.spi.sql.SqlDialect;

import java.util.*;

/**
 * Diff changes to DDL.
 * <p>
 * One statement per change, except {@code table_added} which also emits one CREATE INDEX per index.
 * Identifiers are quoted after storage casing; default and enum literals are inlined with quotes doubled.
 * Statements are emitted in change order, except that enum type creations run first and enum type
 * drops run last so that the tables using a type never outlive it. Referenced tables must already
 * precede their dependents.
 * <p>
 * Enum columns become a named type where the dialect has native enums and a CHECK-constrained text
 * column otherwise; enum type DDL is skipped on the latter.
 */
public final class MigrationSqlGenerator {
  static final String SEPARATOR = "\n\n";

  private final SqlDialect dialect;
  private final CasingOverrides casing;

  public MigrationSqlGenerator(SqlDialect dialect, CasingOverrides casing) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.casing = casing == null ? CasingOverrides.none() : casing;
  }

  public MigrationSqlGenerator(SqlDialect dialect) {
    this(dialect, CasingOverrides.none());
  }

  public SqlDialect dialect() {
    return dialect;
  }

  /**
   * @param ctx snapshot that holds the full definitions of added tables, columns and enums
   *            (the "after" snapshot for forward DDL)
   */
  public String generate(List<DiffChange> changes, SchemaSnapshot ctx) {
    return String.join(SEPARATOR, statements(changes, ctx));
  }

  public String generate(DiffResult diff, SchemaSnapshot ctx) {
    return generate(diff.changes(), ctx);
  }

  /**
   * DDL that undoes {@code changes}: every change inverted and replayed back to front.
   *
   * @param before snapshot prior to the forward changes; it defines what rollback recreates
   */
  public String generateRollback(List<DiffChange> changes, SchemaSnapshot before) {
    return generate(DiffResult.reverse(changes), before);
  }

  /** Bootstrap DDL: everything in {@code snapshot} as newly added. */
  public String generateFull(SchemaSnapshot snapshot) {
    return generate(new SchemaDiffer().diff(SchemaSnapshot.empty(), snapshot), snapshot);
  }

  public List<String> statements(List<DiffChange> changes, SchemaSnapshot ctx) {
    SchemaSnapshot c = ctx == null ? SchemaSnapshot.empty() : ctx;
    List<String> out = new ArrayList<>();
    for (DiffChange change : typeOrdered(changes)) {
      if (change instanceof TableAdded t) {
        tableAdded(t.table(), c, out);
      } else if (change instanceof TableRemoved t) {
        out.add("DROP TABLE " + table(t.table()) + ";");
      } else if (change instanceof ColumnAdded a) {
        ColumnSnapshot col = column(c, a.table(), a.column());
        if (col != null) {
          out.add("ALTER TABLE " + table(a.table()) + " ADD COLUMN " + columnDef(a.column(), col, c) + ";");
        }
      } else if (change instanceof ColumnRemoved r) {
        out.add("ALTER TABLE " + table(r.table()) + " DROP COLUMN " + col(r.column()) + ";");
      } else if (change instanceof ColumnAltered a) {
        columnAltered(a, c, out);
      } else if (change instanceof ColumnRenamed r) {
        out.add("ALTER TABLE " + table(r.table()) + " RENAME COLUMN " + col(r.oldColumn())
            + " TO " + col(r.newColumn()) + ";");
      } else if (change instanceof IndexAdded i) {
        out.add(createIndex(i.table(), i.columns(), isUniqueIndex(c, i.table(), i.columns())));
      } else if (change instanceof IndexRemoved i) {
        out.add("DROP INDEX " + q(indexName(i.table(), i.columns())) + ";");
      } else if (change instanceof EnumAdded e) {
        if (!dialect.supportsNativeEnums()) continue;
        List<String> values = enumValues(c, e.enumName());
        if (values == null || values.isEmpty()) continue;
        out.add("CREATE TYPE " + q(snake(e.enumName())) + " AS ENUM (" + literals(values) + ");");
      } else if (change instanceof EnumRemoved e) {
        if (!dialect.supportsNativeEnums()) continue;
        out.add("DROP TYPE " + q(snake(e.enumName())) + ";");
      } else if (change instanceof EnumAltered e) {
        if (!dialect.supportsNativeEnums()) continue;
        // values cannot be dropped from a native enum; removals are left in place
        for (String v : e.addedValues()) {
          out.add("ALTER TYPE " + q(snake(e.enumName())) + " ADD VALUE " + literal(v) + ";");
        }
      }
    }
    return out;
  }

  private static List<DiffChange> typeOrdered(List<DiffChange> changes) {
    List<DiffChange> first = new ArrayList<>();
    List<DiffChange> middle = new ArrayList<>();
    List<DiffChange> last = new ArrayList<>();
    for (DiffChange change : changes) {
      if (change instanceof EnumAdded) first.add(change);
      else if (change instanceof EnumRemoved) last.add(change);
      else middle.add(change);
    }
    first.addAll(middle);
    first.addAll(last);
    return first;
  }

  private void tableAdded(String tableName, SchemaSnapshot ctx, List<String> out) {
    TableSnapshot t = ctx.tables().get(tableName);
    if (t == null) return;
    List<String> lines = new ArrayList<>();
    List<String> pks = new ArrayList<>();
    for (var e : t.columns().entrySet()) {
      lines.add("  " + columnDef(e.getKey(), e.getValue(), ctx));
      if (e.getValue().primary()) pks.add(col(e.getKey()));
    }
    if (!pks.isEmpty()) lines.add("  PRIMARY KEY (" + String.join(", ", pks) + ")");
    for (ForeignKeySnapshot fk : t.foreignKeys()) {
      lines.add("  FOREIGN KEY (" + col(fk.column()) + ") REFERENCES " + table(fk.targetTable())
          + " (" + col(fk.targetColumn()) + ")");
    }
    out.add("CREATE TABLE " + table(tableName) + " (\n" + String.join(",\n", lines) + "\n);");
    for (IndexSnapshot idx : t.indexes()) out.add(createIndex(tableName, idx.columns(), idx.unique()));
  }

  private void columnAltered(ColumnAltered a, SchemaSnapshot ctx, List<String> out) {
    if (!dialect.supportsAlterColumn()) {
      throw new QueryException("ALTER COLUMN is not supported by dialect " + dialect.id()
          + "; column \"" + a.column() + "\" on table \"" + a.table() + "\" requires a table rebuild");
    }
    String prefix = "ALTER TABLE " + table(a.table()) + " ALTER COLUMN " + col(a.column());
    if (a.columnType() != null && a.columnType().to() != null) {
      out.add(prefix + " TYPE " + columnType(a.columnType().to(), ctx) + ";");
    }
    if (a.nullable() != null && a.nullable().to() != null) {
      out.add(prefix + (a.nullable().to() ? " DROP NOT NULL;" : " SET NOT NULL;"));
    }
    if (a.defaultValue() != null) {
      String to = a.defaultValue().to();
      out.add(to == null || to.isEmpty() ? prefix + " DROP DEFAULT;" : prefix + " SET DEFAULT " + defaultExpr(to) + ";");
    }
  }

  String columnDef(String name, ColumnSnapshot c, SchemaSnapshot ctx) {
    StringBuilder sb = new StringBuilder(col(name)).append(' ');
    List<String> enumValues = enumValues(ctx, c.type());
    boolean checkEnum = enumValues != null && !dialect.supportsNativeEnums();
    sb.append(columnType(c.type(), ctx));
    if (!c.nullable()) sb.append(" NOT NULL");
    if (c.unique()) sb.append(" UNIQUE");
    if (c.defaultValue() != null) sb.append(" DEFAULT ").append(defaultExpr(c.defaultValue()));
    if (checkEnum) sb.append(" CHECK(").append(col(name)).append(" IN (").append(literals(enumValues)).append("))");
    return sb.toString();
  }

  private String columnType(String type, SchemaSnapshot ctx) {
    if (enumValues(ctx, type) != null) {
      return dialect.supportsNativeEnums() ? q(snake(type)) : dialect.mapColumnType("text");
    }
    return dialect.mapColumnType(type);
  }

  private String defaultExpr(String expr) {
    if (SnapshotBuilder.NOW_EXPRESSION.equalsIgnoreCase(expr.trim())) return dialect.currentTimestampDefault();
    return expr;
  }

  private String createIndex(String tableName, List<String> columns, boolean unique) {
    List<String> cols = new ArrayList<>(columns.size());
    for (String c : columns) cols.add(col(c));
    return "CREATE " + (unique ? "UNIQUE " : "") + "INDEX " + q(indexName(tableName, columns))
        + " ON " + table(tableName) + " (" + String.join(", ", cols) + ");";
  }

  /** {@code idx_<table>_<col>_<col>}, all in storage casing. */
  String indexName(String tableName, List<String> columns) {
    StringBuilder sb = new StringBuilder("idx_").append(snake(tableName));
    for (String c : columns) sb.append('_').append(snake(c));
    return sb.toString();
  }

  private static boolean isUniqueIndex(SchemaSnapshot ctx, String tableName, List<String> columns) {
    TableSnapshot t = ctx.tables().get(tableName);
    if (t == null) return false;
    for (IndexSnapshot i : t.indexes()) {
      if (i.columns().equals(columns)) return i.unique();
    }
    return false;
  }

  /** Values of the enum named exactly {@code name} or by its storage form; null when not an enum. */
  private List<String> enumValues(SchemaSnapshot ctx, String name) {
    if (name == null) return null;
    List<String> v = ctx.enums().get(name);
    if (v == null) v = ctx.enums().get(snake(name));
    return v;
  }

  private static ColumnSnapshot column(SchemaSnapshot ctx, String tableName, String column) {
    TableSnapshot t = ctx.tables().get(tableName);
    return t == null ? null : t.columns().get(column);
  }

  private String table(String name) {
    return q(snake(name));
  }

  private String col(String name) {
    return q(snake(name));
  }

  private String snake(String name) {
    return Casing.camelToSnake(name, casing);
  }

  private String q(String ident) {
    return dialect.quoteIdent(ident);
  }

  private static String literals(List<String> values) {
    List<String> out = new ArrayList<>(values.size());
    for (String v : values) out.add(literal(v));
    return String.join(", ", out);
  }

  static String literal(String v) {
    return "'" + v.replace("'", "''") + "'";
  }
}
