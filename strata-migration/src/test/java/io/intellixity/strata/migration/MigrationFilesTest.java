package io.intellixity.strata.migration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MigrationFilesTest {
  @Test
  void parsesConventionalNames() {
    MigrationFiles.ParsedName p = MigrationFiles.parseName("0012_add_user_email.sql").orElseThrow();
    assertEquals(12, p.sequence());
    assertEquals("add_user_email", p.description());
    assertEquals("sql", p.extension());

    assertTrue(MigrationFiles.parseName("init.sql").isEmpty());
    assertTrue(MigrationFiles.parseName("0001.sql").isEmpty());
    assertTrue(MigrationFiles.parseName("abc_init.sql").isEmpty());
    assertTrue(MigrationFiles.parseName(null).isEmpty());
  }

  @Test
  void formatsPaddedSluggedNames() {
    assertEquals("0003_add_user_email.sql", MigrationFiles.formatName(3, "Add user email"));
    assertEquals("0042_drop_legacy_posts.sql", MigrationFiles.formatName(42, "  drop legacy--posts! "));
    assertEquals("12345_big.sql", MigrationFiles.formatName(12345, "big"));
    assertThrows(IllegalArgumentException.class, () -> MigrationFiles.formatName(1, "!!!"));
  }

  @Test
  void fileRejectsUnconventionalName() {
    assertThrows(IllegalArgumentException.class, () -> MigrationFile.of("init.sql", ""));
    assertEquals(7, MigrationFile.of("0007_x.sql", "").sequence());
  }

  @Test
  void loadsOnlyConventionalSqlFilesInOrder(@TempDir Path dir) throws IOException {
    Files.writeString(dir.resolve("0002_users.sql"), "CREATE TABLE users (id integer);");
    Files.writeString(dir.resolve("0001_init.sql"), "CREATE TABLE a (id integer);");
    Files.writeString(dir.resolve("0010_posts.sql"), "CREATE TABLE posts (id integer);");
    Files.writeString(dir.resolve("README.md"), "notes");
    Files.writeString(dir.resolve("seed.sql"), "INSERT INTO a VALUES (1);");
    Files.writeString(dir.resolve("_journal.json"), "{}");
    Files.createDirectory(dir.resolve("0003_dir.sql"));

    List<MigrationFile> files = MigrationFiles.load(dir);

    List<String> names = new ArrayList<>();
    for (MigrationFile f : files) names.add(f.name());
    assertEquals(List.of("0001_init.sql", "0002_users.sql", "0010_posts.sql"), names);
    assertEquals("CREATE TABLE a (id integer);", files.get(0).sql());
    assertEquals(10, files.get(2).sequence());
  }

  @Test
  void missingDirectoryLoadsNothing(@TempDir Path dir) {
    assertEquals(List.of(), MigrationFiles.load(dir.resolve("absent")));
  }
}
