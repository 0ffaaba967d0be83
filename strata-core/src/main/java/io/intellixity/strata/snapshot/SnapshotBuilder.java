package io.intellixity.strata.snapshot;

import io.intellixity.strata.schema.ColumnDef;
import io.intellixity.strata.schema.IndexDef;
import io.intellixity.strata.schema.TableDef;

import java.util.*;

/** Builds the canonical {@link SchemaSnapshot} from declared table definitions. */
public final class SnapshotBuilder {
  /** Dialect-agnostic current-timestamp default; generators translate it per dialect. */
  public static final String NOW_EXPRESSION = "now()";

  private SnapshotBuilder() {}

  public static SchemaSnapshot fromTables(Collection<TableDef> tables) {
    Map<String, TableSnapshot> out = new LinkedHashMap<>();
    Map<String, List<String>> enums = new LinkedHashMap<>();

    for (TableDef t : tables) {
      if (out.containsKey(t.name())) throw new IllegalArgumentException("Duplicate table: " + t.name());

      Map<String, ColumnSnapshot> cols = new LinkedHashMap<>();
      List<ForeignKeySnapshot> fks = new ArrayList<>();
      for (var e : t.columns().entrySet()) {
        String name = e.getKey();
        ColumnDef c = e.getValue();
        cols.put(name, new ColumnSnapshot(c.sqlType(), c.nullable(), c.primary(), c.unique(),
            defaultExpression(c), c.sensitive(), c.hidden()));

        if (c.references() != null) {
          fks.add(new ForeignKeySnapshot(name, c.references().table(), c.references().column()));
        }
        if (c.isEnum()) {
          List<String> prev = enums.putIfAbsent(c.enumName(), c.enumValues());
          if (prev != null && !prev.equals(c.enumValues())) {
            throw new IllegalArgumentException("Enum '" + c.enumName() + "' declared with different values: "
                + prev + " vs " + c.enumValues());
          }
        }
      }

      List<IndexSnapshot> idx = new ArrayList<>();
      for (IndexDef i : t.indexes()) idx.add(new IndexSnapshot(i.columns(), i.name(), i.unique()));

      out.put(t.name(), new TableSnapshot(cols, idx, fks));
    }
    return new SchemaSnapshot(SchemaSnapshot.CURRENT_VERSION, out, enums);
  }

  static String defaultExpression(ColumnDef c) {
    Object v = c.defaultValue();
    if (v == null) return null;
    if (c.defaultsToNow()) return NOW_EXPRESSION;
    if (v instanceof Boolean || v instanceof Number) return String.valueOf(v);
    return "'" + String.valueOf(v).replace("'", "''") + "'";
  }
}
