package io.intellixity.strata.schema;

import java.util.List;
import java.util.Objects;

/**
 * Declared column: storage type plus constraint and visibility flags.
 *
 * Immutable; the {@code asX}/{@code withX} methods return a copy.
 * A {@code defaultValue} of {@code "now"} on a timestamp column marks it as set to the current time on insert.
 */
public record ColumnDef(String sqlType,
                        boolean nullable,
                        boolean primary,
                        boolean unique,
                        Object defaultValue,
                        String enumName,
                        List<String> enumValues,
                        boolean readOnly,
                        boolean autoUpdate,
                        boolean sensitive,
                        boolean hidden,
                        Reference references) {

  public static final String NOW = "now";

  /** Foreign-key target declared on a column. */
  public record Reference(String table, String column) {
    public Reference {
      Objects.requireNonNull(table, "table");
      column = (column == null || column.isBlank()) ? "id" : column;
    }
  }

  public ColumnDef {
    Objects.requireNonNull(sqlType, "sqlType");
    enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
  }

  public static ColumnDef of(String sqlType) {
    return new ColumnDef(sqlType, false, false, false, null, null, List.of(), false, false, false, false, null);
  }

  public static ColumnDef uuid() { return of("uuid"); }
  public static ColumnDef text() { return of("text"); }
  public static ColumnDef integer() { return of("integer"); }
  public static ColumnDef bool() { return of("boolean"); }
  public static ColumnDef timestamp() { return of("timestamp with time zone"); }
  public static ColumnDef jsonb() { return of("jsonb"); }

  /** Enumerated column; its storage type is the enum's name. */
  public static ColumnDef enumOf(String enumName, List<String> values) {
    Objects.requireNonNull(enumName, "enumName");
    return new ColumnDef(enumName, false, false, false, null, enumName, values, false, false, false, false, null);
  }

  public ColumnDef asPrimary() {
    return new ColumnDef(sqlType, nullable, true, unique, defaultValue, enumName, enumValues,
        readOnly, autoUpdate, sensitive, hidden, references);
  }

  public ColumnDef asNullable() {
    return new ColumnDef(sqlType, true, primary, unique, defaultValue, enumName, enumValues,
        readOnly, autoUpdate, sensitive, hidden, references);
  }

  public ColumnDef asUnique() {
    return new ColumnDef(sqlType, nullable, primary, true, defaultValue, enumName, enumValues,
        readOnly, autoUpdate, sensitive, hidden, references);
  }

  public ColumnDef withDefault(Object value) {
    return new ColumnDef(sqlType, nullable, primary, unique, value, enumName, enumValues,
        readOnly, autoUpdate, sensitive, hidden, references);
  }

  public ColumnDef asReadOnly() {
    return new ColumnDef(sqlType, nullable, primary, unique, defaultValue, enumName, enumValues,
        true, autoUpdate, sensitive, hidden, references);
  }

  public ColumnDef asAutoUpdate() {
    return new ColumnDef(sqlType, nullable, primary, unique, defaultValue, enumName, enumValues,
        readOnly, true, sensitive, hidden, references);
  }

  public ColumnDef asSensitive() {
    return new ColumnDef(sqlType, nullable, primary, unique, defaultValue, enumName, enumValues,
        readOnly, autoUpdate, true, hidden, references);
  }

  public ColumnDef asHidden() {
    return new ColumnDef(sqlType, nullable, primary, unique, defaultValue, enumName, enumValues,
        readOnly, autoUpdate, sensitive, true, references);
  }

  public ColumnDef references(String table, String column) {
    return new ColumnDef(sqlType, nullable, primary, unique, defaultValue, enumName, enumValues,
        readOnly, autoUpdate, sensitive, hidden, new Reference(table, column));
  }

  public boolean isEnum() { return enumName != null; }

  public boolean isTimestamp() {
    String t = sqlType.toLowerCase(java.util.Locale.ROOT);
    return t.startsWith("timestamp") || t.equals("timestamptz") || t.equals("date") || t.equals("datetime");
  }

  /** Timestamp column whose default is the current time. */
  public boolean defaultsToNow() {
    return isTimestamp() && NOW.equals(defaultValue);
  }
}
