package io.intellixity.strata.diff;

import java.util.List;
import java.util.Objects;

/**
 * One atomic structural difference between two snapshots.
 * Every variant knows its own inverse; see {@link #reverse()}.
 */
public sealed interface DiffChange permits DiffChange.TableAdded, DiffChange.TableRemoved,
    DiffChange.ColumnAdded, DiffChange.ColumnRemoved, DiffChange.ColumnAltered, DiffChange.ColumnRenamed,
    DiffChange.IndexAdded, DiffChange.IndexRemoved,
    DiffChange.EnumAdded, DiffChange.EnumRemoved, DiffChange.EnumAltered {

  ChangeType type();

  /** The change that undoes this one. */
  DiffChange reverse();

  record TableAdded(String table) implements DiffChange {
    public TableAdded { Objects.requireNonNull(table, "table"); }
    @Override public ChangeType type() { return ChangeType.TABLE_ADDED; }
    @Override public DiffChange reverse() { return new TableRemoved(table); }
  }

  record TableRemoved(String table) implements DiffChange {
    public TableRemoved { Objects.requireNonNull(table, "table"); }
    @Override public ChangeType type() { return ChangeType.TABLE_REMOVED; }
    @Override public DiffChange reverse() { return new TableAdded(table); }
  }

  record ColumnAdded(String table, String column) implements DiffChange {
    public ColumnAdded {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(column, "column");
    }
    @Override public ChangeType type() { return ChangeType.COLUMN_ADDED; }
    @Override public DiffChange reverse() { return new ColumnRemoved(table, column); }
  }

  record ColumnRemoved(String table, String column) implements DiffChange {
    public ColumnRemoved {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(column, "column");
    }
    @Override public ChangeType type() { return ChangeType.COLUMN_REMOVED; }
    @Override public DiffChange reverse() { return new ColumnAdded(table, column); }
  }

  /** A before/after pair for one altered attribute; {@code to} may be null (e.g. a dropped default). */
  record FieldChange<T>(T from, T to) {
    public FieldChange<T> swap() { return new FieldChange<>(to, from); }
  }

  /** Only the changed attributes are non-null. */
  record ColumnAltered(String table, String column,
                       FieldChange<String> columnType,
                       FieldChange<Boolean> nullable,
                       FieldChange<String> defaultValue) implements DiffChange {
    public ColumnAltered {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(column, "column");
      if (columnType == null && nullable == null && defaultValue == null) {
        throw new IllegalArgumentException("column_altered without any changed attribute");
      }
    }
    @Override public ChangeType type() { return ChangeType.COLUMN_ALTERED; }
    @Override public DiffChange reverse() {
      return new ColumnAltered(table, column,
          columnType == null ? null : columnType.swap(),
          nullable == null ? null : nullable.swap(),
          defaultValue == null ? null : defaultValue.swap());
    }
  }

  record ColumnRenamed(String table, String oldColumn, String newColumn, double confidence) implements DiffChange {
    public ColumnRenamed {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(oldColumn, "oldColumn");
      Objects.requireNonNull(newColumn, "newColumn");
    }
    @Override public ChangeType type() { return ChangeType.COLUMN_RENAMED; }
    @Override public DiffChange reverse() { return new ColumnRenamed(table, newColumn, oldColumn, confidence); }
  }

  record IndexAdded(String table, List<String> columns) implements DiffChange {
    public IndexAdded {
      Objects.requireNonNull(table, "table");
      columns = List.copyOf(columns);
    }
    @Override public ChangeType type() { return ChangeType.INDEX_ADDED; }
    @Override public DiffChange reverse() { return new IndexRemoved(table, columns); }
  }

  record IndexRemoved(String table, List<String> columns) implements DiffChange {
    public IndexRemoved {
      Objects.requireNonNull(table, "table");
      columns = List.copyOf(columns);
    }
    @Override public ChangeType type() { return ChangeType.INDEX_REMOVED; }
    @Override public DiffChange reverse() { return new IndexAdded(table, columns); }
  }

  record EnumAdded(String enumName) implements DiffChange {
    public EnumAdded { Objects.requireNonNull(enumName, "enumName"); }
    @Override public ChangeType type() { return ChangeType.ENUM_ADDED; }
    @Override public DiffChange reverse() { return new EnumRemoved(enumName); }
  }

  record EnumRemoved(String enumName) implements DiffChange {
    public EnumRemoved { Objects.requireNonNull(enumName, "enumName"); }
    @Override public ChangeType type() { return ChangeType.ENUM_REMOVED; }
    @Override public DiffChange reverse() { return new EnumAdded(enumName); }
  }

  record EnumAltered(String enumName, List<String> addedValues, List<String> removedValues) implements DiffChange {
    public EnumAltered {
      Objects.requireNonNull(enumName, "enumName");
      addedValues = addedValues == null ? List.of() : List.copyOf(addedValues);
      removedValues = removedValues == null ? List.of() : List.copyOf(removedValues);
    }
    @Override public ChangeType type() { return ChangeType.ENUM_ALTERED; }
    @Override public DiffChange reverse() { return new EnumAltered(enumName, removedValues, addedValues); }
  }
}
