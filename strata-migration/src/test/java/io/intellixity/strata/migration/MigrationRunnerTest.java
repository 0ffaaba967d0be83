package io.intellixity.strata.migration;

import io.intellixity.strata.error.MigrationException;
import io.intellixity.strata.jdbc.postgres.PostgresDialect;
import io.intellixity.strata.jdbc.sqlite.SqliteDialect;
import io.intellixity.strata.spi.exec.QueryResult;
import io.intellixity.strata.util.Checksums;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class MigrationRunnerTest {
  private final MigrationRunner pg = new MigrationRunner(PostgresDialect.INSTANCE);
  private final MigrationRunner sqlite = new MigrationRunner(SqliteDialect.INSTANCE);

  @Test
  void historyTableDdlPerDialect() {
    assertEquals("CREATE TABLE IF NOT EXISTS \"_strata_migrations\" (\"id\" serial PRIMARY KEY, "
        + "\"name\" text NOT NULL UNIQUE, \"checksum\" text NOT NULL, "
        + "\"applied_at\" timestamp with time zone NOT NULL DEFAULT now())", pg.historyTableSql());
    assertEquals("CREATE TABLE IF NOT EXISTS \"_strata_migrations\" (\"id\" INTEGER PRIMARY KEY AUTOINCREMENT, "
        + "\"name\" TEXT NOT NULL UNIQUE, \"checksum\" TEXT NOT NULL, "
        + "\"applied_at\" TEXT NOT NULL DEFAULT (datetime('now')))", sqlite.historyTableSql());
  }

  @Test
  void recordStatementUsesDialectPlaceholders() {
    assertEquals("INSERT INTO \"_strata_migrations\" (\"name\", \"checksum\") VALUES ($1, $2)", pg.recordSql());
    assertEquals("INSERT INTO \"_strata_migrations\" (\"name\", \"checksum\") VALUES (?, ?)", sqlite.recordSql());
  }

  @Test
  void createHistoryTableIssuesOneStatement() {
    RecordingDb db = new RecordingDb();
    pg.createHistoryTable(db);
    assertEquals(List.of(pg.historyTableSql()), db.statements());
  }

  @Test
  void applyRunsEachStatementThenRecords() {
    RecordingDb db = new RecordingDb();
    String sql = "CREATE TABLE \"a\" (\"id\" integer);\n\nCREATE INDEX \"idx_a_id\" ON \"a\" (\"id\");";

    ApplyResult result = pg.apply(db, sql, "0001_init.sql");

    assertEquals(List.of(
        "CREATE TABLE \"a\" (\"id\" integer)",
        "CREATE INDEX \"idx_a_id\" ON \"a\" (\"id\")",
        pg.recordSql()), db.statements());
    String checksum = Checksums.sha256Hex(sql);
    assertEquals(List.of("0001_init.sql", checksum), db.calls().get(2).params());
    assertEquals(checksum, result.checksum());
    assertFalse(result.dryRun());
    assertEquals(List.of(sql, pg.recordSql()), result.statements());
  }

  @Test
  void dryRunTouchesNothing() {
    RecordingDb db = new RecordingDb();
    ApplyResult result = pg.apply(db, "DROP TABLE \"a\";", "0002_drop.sql", true);

    assertTrue(db.calls().isEmpty());
    assertTrue(result.dryRun());
    assertEquals(Checksums.sha256Hex("DROP TABLE \"a\";"), result.checksum());
  }

  @Test
  void failedStatementBecomesMigrationException() {
    RecordingDb db = new RecordingDb((sql, params) -> {
      if (sql.startsWith("ALTER")) throw new IllegalStateException("syntax error at or near \"ALTR\"");
      return QueryResult.empty();
    });
    String sql = "CREATE TABLE \"a\" (\"id\" integer);\nALTER TABLE \"a\" ADD COLUMN;";

    MigrationException ex = assertThrows(MigrationException.class, () -> pg.apply(db, sql, "0003_bad.sql"));

    assertEquals("Failed to apply migration: 0003_bad.sql", ex.getMessage());
    assertEquals(sql, ex.sql());
    assertEquals("MIGRATION_ERROR", ex.code());
    assertNotNull(ex.getCause());
    assertEquals(2, db.calls().size());
  }

  @Test
  void appliedRowsAreReadInOrder() {
    List<Map<String, Object>> rows = new ArrayList<>();
    rows.add(row("0001_init.sql", "abc", "2024-05-01 10:00:00"));
    rows.add(row("0002_users.sql", "def", "2024-05-02T08:30:00Z"));
    rows.add(row("0003_posts.sql", "ghi", null));
    RecordingDb db = new RecordingDb((sql, params) -> QueryResult.of(rows));

    List<AppliedMigration> applied = pg.getApplied(db);

    assertEquals("SELECT \"name\", \"checksum\", \"applied_at\" FROM \"_strata_migrations\" ORDER BY \"id\" ASC",
        db.statements().get(0));
    assertEquals(3, applied.size());
    assertEquals(new AppliedMigration("0001_init.sql", "abc", Instant.parse("2024-05-01T10:00:00Z")), applied.get(0));
    assertEquals(Instant.parse("2024-05-02T08:30:00Z"), applied.get(1).appliedAt());
    assertNull(applied.get(2).appliedAt());
  }

  @Test
  void listingFailureIsWrapped() {
    RecordingDb db = new RecordingDb((sql, params) -> {
      throw new IllegalStateException("relation \"_strata_migrations\" does not exist");
    });
    MigrationException ex = assertThrows(MigrationException.class, () -> pg.getApplied(db));
    assertEquals("Failed to retrieve applied migrations", ex.getMessage());
  }

  @Test
  void pendingExcludesAppliedAndSortsBySequence() {
    List<MigrationFile> files = List.of(
        MigrationFile.of("0003_posts.sql", "c"),
        MigrationFile.of("0001_init.sql", "a"),
        MigrationFile.of("0002_users.sql", "b"));
    List<AppliedMigration> applied = List.of(new AppliedMigration("0001_init.sql", Checksums.sha256Hex("a"), null));

    List<String> names = new ArrayList<>();
    for (MigrationFile f : pg.getPending(files, applied)) names.add(f.name());
    assertEquals(List.of("0002_users.sql", "0003_posts.sql"), names);
  }

  @Test
  void driftFlagsEditedAppliedFiles() {
    List<MigrationFile> files = List.of(
        MigrationFile.of("0001_init.sql", "CREATE TABLE a (id integer);"),
        MigrationFile.of("0002_users.sql", "CREATE TABLE users (id integer, email text);"),
        MigrationFile.of("0003_posts.sql", "CREATE TABLE posts (id integer);"));
    List<AppliedMigration> applied = List.of(
        new AppliedMigration("0001_init.sql", Checksums.sha256Hex("CREATE TABLE a (id integer);"), null),
        new AppliedMigration("0002_users.sql", Checksums.sha256Hex("CREATE TABLE users (id integer);"), null));

    assertEquals(List.of("0002_users.sql"), pg.detectDrift(files, applied));
  }

  @Test
  void outOfOrderFindsPendingFilesBehindTheLatestApplied() {
    List<MigrationFile> files = List.of(
        MigrationFile.of("0001_init.sql", "a"),
        MigrationFile.of("0002_add_age.sql", "b"),
        MigrationFile.of("0003_posts.sql", "c"),
        MigrationFile.of("0004_tags.sql", "d"));
    List<AppliedMigration> applied = List.of(
        new AppliedMigration("0001_init.sql", "x", null),
        new AppliedMigration("0003_posts.sql", "y", null));

    assertEquals(List.of("0002_add_age.sql"), pg.detectOutOfOrder(files, applied));
    assertEquals(List.of(), pg.detectOutOfOrder(files, List.of()));
  }

  @Test
  void customHistoryTableName() {
    MigrationRunner runner = new MigrationRunner(PostgresDialect.INSTANCE, "schema_history");
    assertEquals("INSERT INTO \"schema_history\" (\"name\", \"checksum\") VALUES ($1, $2)", runner.recordSql());
  }

  private static Map<String, Object> row(String name, String checksum, Object appliedAt) {
    Map<String, Object> r = new LinkedHashMap<>();
    r.put("name", name);
    r.put("checksum", checksum);
    r.put("applied_at", appliedAt);
    return r;
  }
}
