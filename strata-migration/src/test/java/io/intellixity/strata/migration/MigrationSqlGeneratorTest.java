package io.intellixity.strata.migration;

import io.intellixity.strata.diff.DiffChange;
import io.intellixity.strata.diff.DiffChange.*;
import io.intellixity.strata.error.QueryException;
import io.intellixity.strata.jdbc.postgres.PostgresDialect;
import io.intellixity.strata.jdbc.sqlite.SqliteDialect;
import io.intellixity.strata.snapshot.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class MigrationSqlGeneratorTest {
  private static final MigrationSqlGenerator PG = new MigrationSqlGenerator(PostgresDialect.INSTANCE);
  private static final MigrationSqlGenerator SQLITE = new MigrationSqlGenerator(SqliteDialect.INSTANCE);

  private static SchemaSnapshot schema() {
    Map<String, ColumnSnapshot> users = new LinkedHashMap<>();
    users.put("id", ColumnSnapshot.of("uuid", false, true, false));
    users.put("email", ColumnSnapshot.of("text", false, false, true));
    users.put("role", ColumnSnapshot.of("user_role", false, false, false).withDefault("'member'"));
    users.put("createdAt", ColumnSnapshot.of("timestamp with time zone", false, false, false).withDefault("now()"));

    Map<String, ColumnSnapshot> posts = new LinkedHashMap<>();
    posts.put("id", ColumnSnapshot.of("integer", false, true, false));
    posts.put("authorId", ColumnSnapshot.of("uuid", false, false, false));
    posts.put("title", ColumnSnapshot.of("text", true, false, false));

    Map<String, TableSnapshot> tables = new LinkedHashMap<>();
    tables.put("users", new TableSnapshot(users, List.of(IndexSnapshot.of(List.of("createdAt"))), List.of()));
    tables.put("posts", new TableSnapshot(posts,
        List.of(new IndexSnapshot(List.of("authorId", "title"), null, true)),
        List.of(new ForeignKeySnapshot("authorId", "users", "id"))));
    return new SchemaSnapshot(SchemaSnapshot.CURRENT_VERSION, tables, Map.of("user_role", List.of("member", "admin")));
  }

  @Test
  void fullSchemaOnPostgres() {
    List<String> expected = List.of(
        "CREATE TYPE \"user_role\" AS ENUM ('member', 'admin');",
        "CREATE TABLE \"users\" (\n"
            + "  \"id\" uuid NOT NULL,\n"
            + "  \"email\" text NOT NULL UNIQUE,\n"
            + "  \"role\" \"user_role\" NOT NULL DEFAULT 'member',\n"
            + "  \"created_at\" timestamp with time zone NOT NULL DEFAULT now(),\n"
            + "  PRIMARY KEY (\"id\")\n"
            + ");",
        "CREATE INDEX \"idx_users_created_at\" ON \"users\" (\"created_at\");",
        "CREATE TABLE \"posts\" (\n"
            + "  \"id\" integer NOT NULL,\n"
            + "  \"author_id\" uuid NOT NULL,\n"
            + "  \"title\" text,\n"
            + "  PRIMARY KEY (\"id\"),\n"
            + "  FOREIGN KEY (\"author_id\") REFERENCES \"users\" (\"id\")\n"
            + ");",
        "CREATE UNIQUE INDEX \"idx_posts_author_id_title\" ON \"posts\" (\"author_id\", \"title\");");

    assertEquals(String.join("\n\n", expected), PG.generateFull(schema()));
  }

  @Test
  void enumsBecomeCheckedTextOnSqlite() {
    String sql = SQLITE.generateFull(schema());

    assertFalse(sql.contains("CREATE TYPE"));
    assertTrue(sql.contains("  \"role\" TEXT NOT NULL DEFAULT 'member' CHECK(\"role\" IN ('member', 'admin')),\n"));
    assertTrue(sql.contains("  \"created_at\" TEXT NOT NULL DEFAULT (datetime('now')),\n"));
    assertTrue(sql.contains("  \"id\" INTEGER NOT NULL,\n"));
    assertTrue(sql.startsWith("CREATE TABLE \"users\" (\n"));
  }

  @Test
  void columnLevelChanges() {
    SchemaSnapshot ctx = schema();
    List<DiffChange> changes = List.of(
        new ColumnAdded("posts", "title"),
        new ColumnRemoved("posts", "legacyBody"),
        new ColumnRenamed("users", "fullName", "displayName", 1.0),
        new IndexAdded("users", List.of("createdAt")),
        new IndexRemoved("posts", List.of("slug")),
        new TableRemoved("auditLog"));

    assertEquals(List.of(
        "ALTER TABLE \"posts\" ADD COLUMN \"title\" text;",
        "ALTER TABLE \"posts\" DROP COLUMN \"legacy_body\";",
        "ALTER TABLE \"users\" RENAME COLUMN \"full_name\" TO \"display_name\";",
        "CREATE INDEX \"idx_users_created_at\" ON \"users\" (\"created_at\");",
        "DROP INDEX \"idx_posts_slug\";",
        "DROP TABLE \"audit_log\";"), PG.statements(changes, ctx));
  }

  @Test
  void alteredColumnOnPostgres() {
    ColumnAltered altered = new ColumnAltered("users", "email",
        new FieldChange<>("text", "varchar(320)"), new FieldChange<>(false, true), new FieldChange<>(null, "'n/a'"));
    ColumnAltered dropDefault = new ColumnAltered("users", "role", null, null, new FieldChange<>("'member'", null));

    assertEquals(List.of(
        "ALTER TABLE \"users\" ALTER COLUMN \"email\" TYPE varchar(320);",
        "ALTER TABLE \"users\" ALTER COLUMN \"email\" DROP NOT NULL;",
        "ALTER TABLE \"users\" ALTER COLUMN \"email\" SET DEFAULT 'n/a';",
        "ALTER TABLE \"users\" ALTER COLUMN \"role\" DROP DEFAULT;"),
        PG.statements(List.of(altered, dropDefault), schema()));
  }

  @Test
  void alteredColumnFailsFastOnSqlite() {
    ColumnAltered altered = new ColumnAltered("users", "email", null, new FieldChange<>(true, false), null);

    QueryException ex = assertThrows(QueryException.class, () -> SQLITE.generate(List.of(altered), schema()));
    assertTrue(ex.getMessage().contains("ALTER COLUMN is not supported by dialect sqlite"));
  }

  @Test
  void enumChangesOnPostgres() {
    List<DiffChange> changes = List.of(
        new EnumRemoved("legacyStatus"),
        new TableRemoved("legacy"),
        new EnumAltered("user_role", List.of("owner"), List.of("admin")));

    assertEquals(List.of(
        "DROP TABLE \"legacy\";",
        "ALTER TYPE \"user_role\" ADD VALUE 'owner';",
        "DROP TYPE \"legacy_status\";"), PG.statements(changes, schema()));
  }

  @Test
  void enumChangesAreSkippedWithoutNativeEnums() {
    List<DiffChange> changes = List.of(
        new EnumAdded("user_role"), new EnumRemoved("old"), new EnumAltered("user_role", List.of("owner"), null));
    assertEquals("", SQLITE.generate(changes, schema()));
  }

  @Test
  void literalsDoubleEmbeddedQuotes() {
    SchemaSnapshot ctx = new SchemaSnapshot(1, Map.of(), Map.of("mood", List.of("it's fine")));
    assertEquals("CREATE TYPE \"mood\" AS ENUM ('it''s fine');", PG.generate(List.of(new EnumAdded("mood")), ctx));
  }

  @Test
  void rollbackInvertsAndReplaysBackwards() {
    Map<String, ColumnSnapshot> before = new LinkedHashMap<>();
    before.put("id", ColumnSnapshot.of("integer", false, true, false));
    before.put("legacy", ColumnSnapshot.of("text", true, false, false));
    SchemaSnapshot beforeSchema = new SchemaSnapshot(1,
        Map.of("posts", TableSnapshot.of(before)), Map.of());

    List<DiffChange> forward = List.of(
        new ColumnRemoved("posts", "legacy"),
        new ColumnAdded("posts", "title"),
        new IndexAdded("posts", List.of("title")),
        new ColumnRenamed("posts", "body", "content", 0.9));

    assertEquals(String.join("\n\n",
        "ALTER TABLE \"posts\" RENAME COLUMN \"content\" TO \"body\";",
        "DROP INDEX \"idx_posts_title\";",
        "ALTER TABLE \"posts\" DROP COLUMN \"title\";",
        "ALTER TABLE \"posts\" ADD COLUMN \"legacy\" text;"), PG.generateRollback(forward, beforeSchema));
  }

  @Test
  void rollbackOfCreatedTableDropsIt() {
    assertEquals("DROP TABLE \"posts\";", PG.generateRollback(List.of(new TableAdded("posts")), SchemaSnapshot.empty()));
  }

  @Test
  void missingDefinitionsProduceNothing() {
    assertEquals("", PG.generate(List.of(new TableAdded("ghost"), new ColumnAdded("users", "ghost")), schema()));
  }
}
