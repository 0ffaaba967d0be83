package io.intellixity.strata.jdbc.relation;

import io.intellixity.strata.casing.CasingOverrides;
import io.intellixity.strata.jdbc.client.RowMapper;
import io.intellixity.strata.jdbc.sql.SelectBuilder;
import io.intellixity.strata.jdbc.sql.SelectQuery;
import io.intellixity.strata.query.Filters;
import io.intellixity.strata.query.IncludeSpec;
import io.intellixity.strata.query.IncludeSpec.Include;
import io.intellixity.strata.schema.RelationDef;
import io.intellixity.strata.schema.TableDef;
import io.intellixity.strata.schema.TableRegistry;
import io.intellixity.strata.spi.exec.Executor;
import io.intellixity.strata.spi.sql.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Batched include loading: one query per relation per nesting level, independent of the number
 * of parent rows (two for join-table relations).
 * <p>
 * Rows are mutated in place. A ONE relation attaches the target row or null; a MANY relation
 * attaches a list, empty when nothing matches. Nesting stops below {@link #MAX_DEPTH}.
 */
public final class RelationLoader {
  private static final Logger log = LoggerFactory.getLogger(RelationLoader.class);

  public static final int MAX_DEPTH = 2;

  private final Executor executor;
  private final SqlDialect dialect;
  private final CasingOverrides casing;
  private final TableRegistry registry;
  private final RowMapper mapper;

  public RelationLoader(Executor executor, SqlDialect dialect, CasingOverrides casing, TableRegistry registry) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.casing = casing == null ? CasingOverrides.none() : casing;
    this.registry = registry == null ? TableRegistry.empty() : registry;
    this.mapper = new RowMapper(this.casing);
  }

  /**
   * @param owner     table the rows were read from
   * @param relations the owner's declared relations
   */
  public List<Map<String, Object>> load(List<Map<String, Object>> rows, TableDef owner,
                                        Map<String, RelationDef> relations, IncludeSpec include) {
    load(rows, owner, relations, include, 0);
    return rows;
  }

  private void load(List<Map<String, Object>> rows, TableDef owner, Map<String, RelationDef> relations,
                    IncludeSpec include, int depth) {
    if (rows.isEmpty() || include == null || include.isEmpty()) return;
    for (var e : include.relations().entrySet()) {
      RelationDef rel = relations.get(e.getKey());
      if (rel == null) {
        log.debug("strata.include skip unknown relation={} table={}", e.getKey(), owner.name());
        continue;
      }
      if (rel.kind() == RelationDef.Kind.ONE) {
        loadOne(rows, rel, e.getKey(), e.getValue(), depth);
      } else if (rel.isManyToMany()) {
        loadManyThrough(rows, owner, rel, e.getKey(), e.getValue(), depth);
      } else {
        loadMany(rows, owner, rel, e.getKey(), e.getValue(), depth);
      }
    }
  }

  private void loadOne(List<Map<String, Object>> rows, RelationDef rel, String name, Include inc, int depth) {
    String fk = rel.foreignKey();
    Set<Object> keys = distinct(rows, fk);
    if (keys.isEmpty()) {
      for (Map<String, Object> r : rows) r.put(name, null);
      return;
    }
    TableDef target = rel.targetTable();
    String pk = target.primaryKey();
    List<Map<String, Object>> found = fetch(target, inc, pk, keys);

    Map<Object, Map<String, Object>> byPk = new HashMap<>();
    for (Map<String, Object> t : found) byPk.put(t.get(pk), t);
    nested(found, target, inc, depth);
    for (Map<String, Object> r : rows) {
      Object k = r.get(fk);
      r.put(name, k == null ? null : byPk.get(k));
    }
  }

  private void loadMany(List<Map<String, Object>> rows, TableDef owner, RelationDef rel, String name,
                        Include inc, int depth) {
    String ownerPk = owner.primaryKey();
    Set<Object> keys = distinct(rows, ownerPk);
    if (keys.isEmpty()) {
      for (Map<String, Object> r : rows) r.put(name, new ArrayList<>());
      return;
    }
    TableDef target = rel.targetTable();
    String fk = rel.foreignKey();
    List<Map<String, Object>> found = fetch(target, inc, fk, keys);

    Map<Object, List<Map<String, Object>>> byParent = new HashMap<>();
    for (Map<String, Object> t : found) byParent.computeIfAbsent(t.get(fk), k -> new ArrayList<>()).add(t);
    nested(found, target, inc, depth);
    for (Map<String, Object> r : rows) {
      List<Map<String, Object>> children = byParent.get(r.get(ownerPk));
      r.put(name, children == null ? new ArrayList<>() : children);
    }
  }

  private void loadManyThrough(List<Map<String, Object>> rows, TableDef owner, RelationDef rel, String name,
                               Include inc, int depth) {
    String ownerPk = owner.primaryKey();
    Set<Object> keys = distinct(rows, ownerPk);
    if (keys.isEmpty()) {
      for (Map<String, Object> r : rows) r.put(name, new ArrayList<>());
      return;
    }
    RelationDef.Through through = rel.through();
    TableDef join = Objects.requireNonNull(through.table().get(), "join table resolved to null");
    SelectQuery jq = SelectQuery.from(join.name())
        .columns(through.thisKey(), through.thatKey())
        .where(Filters.in(through.thisKey(), keys))
        .casing(casing)
        .build();
    List<Map<String, Object>> links = mapper.mapAll(executor.execute(SelectBuilder.build(jq, dialect)).rows());

    Map<Object, List<Object>> targetIdsByParent = new HashMap<>();
    Set<Object> targetIds = new LinkedHashSet<>();
    for (Map<String, Object> l : links) {
      Object that = l.get(through.thatKey());
      if (that == null) continue;
      targetIdsByParent.computeIfAbsent(l.get(through.thisKey()), k -> new ArrayList<>()).add(that);
      targetIds.add(that);
    }
    if (targetIds.isEmpty()) {
      for (Map<String, Object> r : rows) r.put(name, new ArrayList<>());
      return;
    }

    TableDef target = rel.targetTable();
    String pk = target.primaryKey();
    List<Map<String, Object>> found = fetch(target, inc, pk, targetIds);
    Map<Object, Map<String, Object>> byPk = new HashMap<>();
    for (Map<String, Object> t : found) byPk.put(t.get(pk), t);
    nested(found, target, inc, depth);

    for (Map<String, Object> r : rows) {
      List<Map<String, Object>> attached = new ArrayList<>();
      for (Object id : targetIdsByParent.getOrDefault(r.get(ownerPk), List.of())) {
        Map<String, Object> t = byPk.get(id);
        if (t != null) attached.add(t);
      }
      r.put(name, attached);
    }
  }

  /**
   * Select the target rows whose {@code keyColumn} is in {@code keys}. The key column and the target's
   * primary key are always projected so grouping and nested includes keep working under a narrowed select.
   */
  private List<Map<String, Object>> fetch(TableDef target, Include inc, String keyColumn, Collection<Object> keys) {
    List<String> columns = new ArrayList<>(target.resolveSelect(inc.select()));
    if (!columns.contains(keyColumn)) columns.add(keyColumn);
    String pk = target.primaryKey();
    if (!columns.contains(pk)) columns.add(pk);
    SelectQuery q = SelectQuery.from(target.name())
        .columns(columns)
        .where(Filters.in(keyColumn, keys))
        .casing(casing)
        .build();
    List<Map<String, Object>> found = mapper.mapAll(executor.execute(SelectBuilder.build(q, dialect)).rows());
    log.debug("strata.include table={} keys={} rows={}", target.name(), keys.size(), found.size());
    return found;
  }

  private void nested(List<Map<String, Object>> children, TableDef target, Include inc, int depth) {
    if (!inc.hasNested() || depth >= MAX_DEPTH || children.isEmpty()) return;
    load(children, target, registry.relationsOf(target), inc.include(), depth + 1);
  }

  private static Set<Object> distinct(List<Map<String, Object>> rows, String column) {
    Set<Object> out = new LinkedHashSet<>();
    for (Map<String, Object> r : rows) {
      Object v = r.get(column);
      if (v != null) out.add(v);
    }
    return out;
  }
}
