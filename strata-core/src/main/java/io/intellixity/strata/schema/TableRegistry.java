package io.intellixity.strata.schema;

import java.util.*;

/**
 * Read-only table + relation registry, built once and shared.
 * Used to resolve a target table's own relations when includes nest.
 */
public final class TableRegistry {
  public record Entry(TableDef table, Map<String, RelationDef> relations) {
    public Entry {
      Objects.requireNonNull(table, "table");
      relations = Collections.unmodifiableMap(new LinkedHashMap<>(relations == null ? Map.of() : relations));
    }
  }

  private final Map<String, Entry> entries;

  private TableRegistry(Map<String, Entry> entries) {
    this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  public static TableRegistry empty() {
    return new TableRegistry(Map.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  public Entry entry(String key) {
    return entries.get(key);
  }

  public Map<String, Entry> entries() {
    return entries;
  }

  /** Relations of the entry whose table has the same storage name as {@code table}, or empty. */
  public Map<String, RelationDef> relationsOf(TableDef table) {
    if (table == null) return Map.of();
    for (Entry e : entries.values()) {
      if (e.table().name().equals(table.name())) return e.relations();
    }
    return Map.of();
  }

  public List<TableDef> tables() {
    List<TableDef> out = new ArrayList<>(entries.size());
    for (Entry e : entries.values()) out.add(e.table());
    return out;
  }

  public static final class Builder {
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private Builder() {}

    public Builder table(String key, TableDef table) {
      return table(key, table, Map.of());
    }

    public Builder table(String key, TableDef table, Map<String, RelationDef> relations) {
      entries.put(Objects.requireNonNull(key, "key"), new Entry(table, relations));
      return this;
    }

    public TableRegistry build() {
      return new TableRegistry(entries);
    }
  }
}
