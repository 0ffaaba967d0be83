package io.intellixity.strata.migration;

import io.intellixity.strata.error.MigrationException;
import io.intellixity.strata.spi.exec.Executor;
import io.intellixity.strata.spi.exec.QueryFn;
import io.intellixity.strata.spi.exec.QueryResult;
import io.intellixity.strata.spi.introspect.SchemaIntrospector;
import io.intellixity.strata.spi.sql.SqlDialect;
import io.intellixity.strata.util.Checksums;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Applies migrations and keeps the history ledger.
 * <p>
 * {@link #apply} issues the migration body and then the history insert. It opens no transaction itself:
 * run it inside the caller's transaction (e.g. {@code JdbcQueryFn.inTransaction}) where the backend has one,
 * otherwise a failure between the two leaves the ledger behind the live schema.
 */
public final class MigrationRunner {
  private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

  private final SqlDialect dialect;
  private final String historyTable;

  public MigrationRunner(SqlDialect dialect) {
    this(dialect, SchemaIntrospector.HISTORY_TABLE);
  }

  public MigrationRunner(SqlDialect dialect, String historyTable) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.historyTable = Objects.requireNonNull(historyTable, "historyTable");
  }

  public SqlDialect dialect() {
    return dialect;
  }

  public String historyTable() {
    return historyTable;
  }

  String historyTableSql() {
    return "CREATE TABLE IF NOT EXISTS " + dialect.quoteIdent(historyTable) + " ("
        + dialect.quoteIdent("id") + " " + dialect.autoIncrementPrimaryKey() + ", "
        + dialect.quoteIdent("name") + " " + dialect.mapColumnType("text") + " NOT NULL UNIQUE, "
        + dialect.quoteIdent("checksum") + " " + dialect.mapColumnType("text") + " NOT NULL, "
        + dialect.quoteIdent("applied_at") + " " + dialect.mapColumnType("timestamp with time zone")
        + " NOT NULL DEFAULT " + dialect.currentTimestampDefault() + ")";
  }

  String recordSql() {
    return "INSERT INTO " + dialect.quoteIdent(historyTable) + " ("
        + dialect.quoteIdent("name") + ", " + dialect.quoteIdent("checksum") + ") VALUES ("
        + dialect.param(1) + ", " + dialect.param(2) + ")";
  }

  public void createHistoryTable(QueryFn db) {
    String sql = historyTableSql();
    try {
      new Executor(db).execute(sql, List.of());
    } catch (RuntimeException e) {
      throw new MigrationException("Failed to create migration history table", sql, e);
    }
  }

  public ApplyResult apply(QueryFn db, String sql, String name) {
    return apply(db, sql, name, false);
  }

  /**
   * Execute {@code sql} and record it under {@code name}. A dry run only computes the checksum
   * and the statement list.
   */
  public ApplyResult apply(QueryFn db, String sql, String name, boolean dryRun) {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(name, "name");
    String checksum = Checksums.sha256Hex(sql);
    String recordSql = recordSql();
    ApplyResult result = new ApplyResult(name, sql, checksum, dryRun, List.of(sql, recordSql));
    if (dryRun) {
      log.debug("strata.migration_dry_run name={} checksum={}", name, checksum);
      return result;
    }

    Executor exec = new Executor(db);
    try {
      for (String stmt : SqlScripts.split(sql)) exec.execute(stmt, List.of());
      exec.execute(recordSql, List.of(name, checksum));
    } catch (RuntimeException e) {
      throw new MigrationException("Failed to apply migration: " + name, sql, e);
    }
    log.info("strata.migration_applied name={} checksum={}", name, checksum);
    return result;
  }

  /** History rows in application order. */
  public List<AppliedMigration> getApplied(QueryFn db) {
    String sql = "SELECT " + dialect.quoteIdent("name") + ", " + dialect.quoteIdent("checksum") + ", "
        + dialect.quoteIdent("applied_at") + " FROM " + dialect.quoteIdent(historyTable)
        + " ORDER BY " + dialect.quoteIdent("id") + " ASC";
    QueryResult r;
    try {
      r = new Executor(db).execute(sql, List.of());
    } catch (RuntimeException e) {
      throw new MigrationException("Failed to retrieve applied migrations", sql, e);
    }
    List<AppliedMigration> out = new ArrayList<>(r.rows().size());
    for (Map<String, Object> row : r.rows()) {
      out.add(new AppliedMigration(String.valueOf(row.get("name")), String.valueOf(row.get("checksum")),
          AppliedMigration.toInstant(row.get("applied_at"))));
    }
    return out;
  }

  /** Files not yet applied, ascending by sequence. */
  public List<MigrationFile> getPending(List<MigrationFile> files, List<AppliedMigration> applied) {
    Set<String> done = names(applied);
    List<MigrationFile> out = new ArrayList<>();
    for (MigrationFile f : files) {
      if (!done.contains(f.name())) out.add(f);
    }
    out.sort(MigrationFiles.ORDER);
    return out;
  }

  /** Names of applied migrations whose file text no longer hashes to the recorded checksum. */
  public List<String> detectDrift(List<MigrationFile> files, List<AppliedMigration> applied) {
    Map<String, String> recorded = new HashMap<>();
    for (AppliedMigration a : applied) recorded.put(a.name(), a.checksum());
    List<String> out = new ArrayList<>();
    for (MigrationFile f : files) {
      String checksum = recorded.get(f.name());
      if (checksum != null && !checksum.equals(Checksums.sha256Hex(f.sql()))) out.add(f.name());
    }
    return out;
  }

  /** Pending files whose sequence precedes the highest applied sequence. */
  public List<String> detectOutOfOrder(List<MigrationFile> files, List<AppliedMigration> applied) {
    long latest = -1;
    for (AppliedMigration a : applied) {
      Optional<MigrationFiles.ParsedName> parsed = MigrationFiles.parseName(a.name());
      if (parsed.isPresent()) latest = Math.max(latest, parsed.get().sequence());
    }
    if (latest < 0) return List.of();
    List<String> out = new ArrayList<>();
    for (MigrationFile f : getPending(files, applied)) {
      if (f.sequence() < latest) out.add(f.name());
    }
    return out;
  }

  private static Set<String> names(List<AppliedMigration> applied) {
    Set<String> out = new HashSet<>();
    for (AppliedMigration a : applied) out.add(a.name());
    return out;
  }
}
