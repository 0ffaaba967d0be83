package io.intellixity.strata.jdbc.client;

import io.intellixity.strata.casing.CasingOverrides;
import io.intellixity.strata.error.NotFoundException;
import io.intellixity.strata.error.QueryException;
import io.intellixity.strata.jdbc.relation.RelationLoader;
import io.intellixity.strata.jdbc.sql.*;
import io.intellixity.strata.query.IncludeSpec;
import io.intellixity.strata.query.WhereFilter;
import io.intellixity.strata.schema.ColumnDef;
import io.intellixity.strata.schema.TableDef;
import io.intellixity.strata.schema.TableRegistry;
import io.intellixity.strata.spi.exec.Executor;
import io.intellixity.strata.spi.exec.QueryFn;
import io.intellixity.strata.spi.exec.QueryResult;
import io.intellixity.strata.spi.sql.SqlDialect;

import java.util.*;

/**
 * CRUD surface for one declared table.
 * <p>
 * Writes drop read-only columns and stamp auto-update columns with the {@code "now"} sentinel;
 * reads project the table's visible columns unless narrowed, and return rows under declared names.
 * Multi-row update/delete refuse an empty filter before any SQL is built.
 */
public final class TableClient {
  private final TableDef table;
  private final Executor executor;
  private final SqlDialect dialect;
  private final CasingOverrides casing;
  private final TableRegistry registry;
  private final RowMapper mapper;
  private final RelationLoader relations;

  public TableClient(TableDef table, QueryFn fn, SqlDialect dialect, CasingOverrides casing, TableRegistry registry) {
    this.table = Objects.requireNonNull(table, "table");
    this.executor = new Executor(Objects.requireNonNull(fn, "fn"));
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.casing = casing == null ? CasingOverrides.none() : casing;
    this.registry = registry == null ? TableRegistry.empty() : registry;
    this.mapper = new RowMapper(this.casing);
    this.relations = new RelationLoader(executor, dialect, this.casing, this.registry);
  }

  public TableClient(TableDef table, QueryFn fn, SqlDialect dialect) {
    this(table, fn, dialect, CasingOverrides.none(), TableRegistry.empty());
  }

  public TableDef table() {
    return table;
  }

  // ---- reads ----

  public Optional<Map<String, Object>> get(FindArgs args) {
    SelectQuery q = select(args).limit(1).build();
    List<Map<String, Object>> rows = read(q, args.include());
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public Map<String, Object> getOrThrow(FindArgs args) {
    return get(args).orElseThrow(() -> new NotFoundException(table.name()));
  }

  public List<Map<String, Object>> list(FindArgs args) {
    SelectQuery q = select(args).limit(args.limit()).offset(args.offset())
        .cursor(args.cursor()).take(args.take()).build();
    return read(q, args.include());
  }

  /** One page plus the unpaged total, computed in the same statement with a window count. */
  public Page listAndCount(FindArgs args) {
    SelectQuery q = select(args).limit(args.limit()).offset(args.offset())
        .cursor(args.cursor()).take(args.take()).withCount(true).build();
    QueryResult res = executor.execute(SelectBuilder.build(q, dialect));
    long total = 0;
    List<Map<String, Object>> data = new ArrayList<>(res.rows().size());
    for (Map<String, Object> raw : res.rows()) {
      Map<String, Object> row = mapper.map(raw);
      Object t = row.remove("totalCount");
      if (t != null) total = AggregateBuilder.toLong(t);
      data.add(row);
    }
    loadIncludes(data, args.include());
    return new Page(data, total);
  }

  public long count(WhereFilter where) {
    QueryResult res = executor.execute(AggregateBuilder.count(table.name(), where, dialect, casing));
    if (res.rows().isEmpty()) return 0L;
    return AggregateBuilder.toLong(res.rows().get(0).get("count"));
  }

  /** @return the nested aggregate map, empty when nothing was requested */
  public Map<String, Object> aggregate(WhereFilter where, AggregateFields fields) {
    if (fields.isEmpty()) return Map.of();
    QueryResult res = executor.execute(AggregateBuilder.aggregate(table.name(), where, fields, dialect, casing));
    if (res.rows().isEmpty()) return Map.of();
    return AggregateBuilder.shape(res.rows().get(0), fields, casing);
  }

  public List<Map<String, Object>> groupBy(GroupByArgs args) {
    GroupByQuery q = new GroupByQuery(table.name(), args.by(), args.where(), args.fields(),
        args.orderBy(), args.limit(), args.offset(), casing);
    QueryResult res = executor.execute(AggregateBuilder.groupBy(q, dialect));
    List<Map<String, Object>> out = new ArrayList<>(res.rows().size());
    for (Map<String, Object> row : res.rows()) out.add(AggregateBuilder.shapeGroup(row, q));
    return out;
  }

  // ---- writes ----

  public Map<String, Object> create(Map<String, Object> data) {
    return create(data, List.of());
  }

  public Map<String, Object> create(Map<String, Object> data, List<String> select) {
    InsertQuery q = insert(List.of(writable(data))).returning(table.resolveSelect(select));
    return first(executor.execute(InsertBuilder.build(q, dialect)), "create");
  }

  /** @return number of inserted rows; an empty input issues no statement */
  public long createMany(List<Map<String, Object>> rows) {
    if (rows.isEmpty()) return 0L;
    QueryResult res = executor.execute(InsertBuilder.build(insert(writableAll(rows)), dialect));
    return res.rowCount();
  }

  public List<Map<String, Object>> createManyAndReturn(List<Map<String, Object>> rows, List<String> select) {
    if (rows.isEmpty()) return List.of();
    InsertQuery q = insert(writableAll(rows)).returning(table.resolveSelect(select));
    return mapper.mapAll(executor.execute(InsertBuilder.build(q, dialect)).rows());
  }

  /** @throws NotFoundException when no row matches */
  public Map<String, Object> update(WhereFilter where, Map<String, Object> data) {
    return update(where, data, List.of());
  }

  public Map<String, Object> update(WhereFilter where, Map<String, Object> data, List<String> select) {
    UpdateQuery q = updateQuery(where, data).returning(table.resolveSelect(select));
    QueryResult res = executor.execute(UpdateBuilder.build(q, dialect));
    if (res.rows().isEmpty()) throw new NotFoundException(table.name());
    return mapper.map(res.rows().get(0));
  }

  public long updateMany(WhereFilter where, Map<String, Object> data) {
    MutationGuards.requireWhere("updateMany", where);
    return executor.execute(UpdateBuilder.build(updateQuery(where, data), dialect)).rowCount();
  }

  /**
   * Insert {@code create}, or on a conflict over the {@code where} keys apply {@code update}.
   */
  public Map<String, Object> upsert(Map<String, Object> where, Map<String, Object> create,
                                    Map<String, Object> update, List<String> select) {
    if (where == null || where.isEmpty()) {
      throw new QueryException("upsert requires a non-empty where clause naming the conflict columns");
    }
    Map<String, Object> onUpdate = stampAutoUpdate(writable(update));
    InsertQuery q = insert(List.of(writable(create)))
        .onConflict(OnConflict.updateWith(new ArrayList<>(where.keySet()), onUpdate))
        .returning(table.resolveSelect(select));
    return first(executor.execute(InsertBuilder.build(q, dialect)), "upsert");
  }

  /** @throws NotFoundException when no row matches */
  public Map<String, Object> delete(WhereFilter where) {
    return delete(where, List.of());
  }

  public Map<String, Object> delete(WhereFilter where, List<String> select) {
    DeleteQuery q = new DeleteQuery(table.name(), where, table.resolveSelect(select), casing);
    QueryResult res = executor.execute(DeleteBuilder.build(q, dialect));
    if (res.rows().isEmpty()) throw new NotFoundException(table.name());
    return mapper.map(res.rows().get(0));
  }

  public long deleteMany(WhereFilter where) {
    MutationGuards.requireWhere("deleteMany", where);
    return executor.execute(DeleteBuilder.build(new DeleteQuery(table.name(), where, List.of(), casing), dialect))
        .rowCount();
  }

  // ---- internals ----

  private SelectQuery.Builder select(FindArgs args) {
    return SelectQuery.from(table.name())
        .columns(table.resolveSelect(args.select()))
        .where(args.where())
        .orderBy(args.orderBy())
        .casing(casing);
  }

  private List<Map<String, Object>> read(SelectQuery q, IncludeSpec include) {
    List<Map<String, Object>> rows = mapper.mapAll(executor.execute(SelectBuilder.build(q, dialect)).rows());
    loadIncludes(rows, include);
    return rows;
  }

  private void loadIncludes(List<Map<String, Object>> rows, IncludeSpec include) {
    if (include == null || include.isEmpty() || rows.isEmpty()) return;
    relations.load(rows, table, registry.relationsOf(table), include);
  }

  private Map<String, Object> first(QueryResult res, String operation) {
    if (res.rows().isEmpty()) {
      throw new QueryException(operation + " on " + table.name() + " returned no row");
    }
    return mapper.map(res.rows().get(0));
  }

  private InsertQuery insert(List<Map<String, Object>> rows) {
    return new InsertQuery(table.name(), rows, null, List.of(), nowColumns(), casing);
  }

  private UpdateQuery updateQuery(WhereFilter where, Map<String, Object> data) {
    return new UpdateQuery(table.name(), stampAutoUpdate(writable(data)), where, List.of(), nowColumns(), casing);
  }

  private Set<String> nowColumns() {
    Set<String> out = new LinkedHashSet<>(table.nowColumns());
    out.addAll(table.autoUpdateColumns());
    return out;
  }

  private Map<String, Object> writable(Map<String, Object> data) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (data == null) return out;
    Set<String> readOnly = table.readOnlyColumns();
    for (var e : data.entrySet()) {
      if (!readOnly.contains(e.getKey())) out.put(e.getKey(), e.getValue());
    }
    return out;
  }

  private List<Map<String, Object>> writableAll(List<Map<String, Object>> rows) {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) out.add(writable(r));
    return out;
  }

  private Map<String, Object> stampAutoUpdate(Map<String, Object> data) {
    for (String col : table.autoUpdateColumns()) data.put(col, ColumnDef.NOW);
    return data;
  }
}
