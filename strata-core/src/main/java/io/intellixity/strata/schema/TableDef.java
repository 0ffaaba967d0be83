package io.intellixity.strata.schema;

import java.util.*;

/**
 * Declared table: storage name, columns in declaration order and secondary indexes.
 * Column keys are declared (camelCase) names; storage names are derived through casing.
 */
public record TableDef(String name, Map<String, ColumnDef> columns, List<IndexDef> indexes) {
  public TableDef {
    Objects.requireNonNull(name, "name");
    columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns == null ? Map.of() : columns));
    indexes = indexes == null ? List.of() : List.copyOf(indexes);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public ColumnDef column(String declaredName) {
    return columns.get(declaredName);
  }

  /** First primary column in declaration order; {@code id} when none is declared. */
  public String primaryKey() {
    for (var e : columns.entrySet()) {
      if (e.getValue().primary()) return e.getKey();
    }
    return "id";
  }

  public Set<String> readOnlyColumns() {
    return collect(ColumnDef::readOnly);
  }

  public Set<String> autoUpdateColumns() {
    return collect(ColumnDef::autoUpdate);
  }

  /** Timestamp columns: a {@code "now"} value written to one renders as the current time. */
  public Set<String> nowColumns() {
    return collect(ColumnDef::isTimestamp);
  }

  /** Default projection: every column not marked hidden. */
  public List<String> visibleColumns() {
    List<String> out = new ArrayList<>();
    for (var e : columns.entrySet()) {
      if (!e.getValue().hidden()) out.add(e.getKey());
    }
    return out;
  }

  /**
   * Resolve an explicit field narrowing against this table.
   * Null or empty selects the visible columns; unknown names are rejected.
   */
  public List<String> resolveSelect(Collection<String> select) {
    if (select == null || select.isEmpty()) return visibleColumns();
    List<String> out = new ArrayList<>(select.size());
    for (String s : select) {
      if (!columns.containsKey(s)) {
        throw new IllegalArgumentException("Unknown column '" + s + "' for table " + name);
      }
      out.add(s);
    }
    return out;
  }

  private Set<String> collect(java.util.function.Predicate<ColumnDef> p) {
    Set<String> out = new LinkedHashSet<>();
    for (var e : columns.entrySet()) {
      if (p.test(e.getValue())) out.add(e.getKey());
    }
    return out;
  }

  public static final class Builder {
    private final String name;
    private final Map<String, ColumnDef> columns = new LinkedHashMap<>();
    private final List<IndexDef> indexes = new ArrayList<>();

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder column(String declaredName, ColumnDef def) {
      if (columns.putIfAbsent(Objects.requireNonNull(declaredName, "declaredName"),
          Objects.requireNonNull(def, "def")) != null) {
        throw new IllegalArgumentException("Duplicate column '" + declaredName + "' in table " + name);
      }
      return this;
    }

    public Builder index(IndexDef index) {
      indexes.add(Objects.requireNonNull(index, "index"));
      return this;
    }

    public TableDef build() {
      return new TableDef(name, columns, indexes);
    }
  }
}
