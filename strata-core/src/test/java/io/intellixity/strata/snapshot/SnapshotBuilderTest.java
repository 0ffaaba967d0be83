package io.intellixity.strata.snapshot;

import io.intellixity.strata.schema.ColumnDef;
import io.intellixity.strata.schema.IndexDef;
import io.intellixity.strata.schema.TableDef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SnapshotBuilderTest {
  private static final List<String> ROLES = List.of("admin", "member");

  private static TableDef users() {
    return TableDef.builder("users")
        .column("id", ColumnDef.uuid().asPrimary())
        .column("email", ColumnDef.text().asUnique())
        .column("nickname", ColumnDef.text().asNullable().withDefault("it's me"))
        .column("active", ColumnDef.bool().withDefault(true))
        .column("role", ColumnDef.enumOf("user_role", ROLES))
        .column("createdAt", ColumnDef.timestamp().withDefault(ColumnDef.NOW))
        .index(IndexDef.on("email", "createdAt"))
        .build();
  }

  private static TableDef posts() {
    return TableDef.builder("posts")
        .column("id", ColumnDef.uuid().asPrimary())
        .column("authorId", ColumnDef.uuid().references("users", null))
        .column("status", ColumnDef.enumOf("user_role", ROLES))
        .build();
  }

  @Test
  void columnsCarryFlagsAndCanonicalDefaults() {
    SchemaSnapshot s = SnapshotBuilder.fromTables(List.of(users(), posts()));
    TableSnapshot t = s.tables().get("users");

    assertEquals(List.of("id", "email", "nickname", "active", "role", "createdAt"), List.copyOf(t.columns().keySet()));
    assertTrue(t.columns().get("id").primary());
    assertTrue(t.columns().get("email").unique());
    assertEquals("'it''s me'", t.columns().get("nickname").defaultValue());
    assertEquals("true", t.columns().get("active").defaultValue());
    assertEquals(SnapshotBuilder.NOW_EXPRESSION, t.columns().get("createdAt").defaultValue());
    assertEquals("user_role", t.columns().get("role").type());
    assertEquals(List.of(IndexSnapshot.of(List.of("email", "createdAt"))), t.indexes());
  }

  @Test
  void foreignKeysDefaultToTheTargetId() {
    SchemaSnapshot s = SnapshotBuilder.fromTables(List.of(users(), posts()));
    assertEquals(List.of(new ForeignKeySnapshot("authorId", "users", "id")), s.tables().get("posts").foreignKeys());
  }

  @Test
  void enumsAreCollectedOncePerName() {
    SchemaSnapshot s = SnapshotBuilder.fromTables(List.of(users(), posts()));
    assertEquals(java.util.Map.of("user_role", ROLES), s.enums());
  }

  @Test
  void conflictingEnumValuesAreRejected() {
    TableDef other = TableDef.builder("other")
        .column("role", ColumnDef.enumOf("user_role", List.of("owner")))
        .build();
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> SnapshotBuilder.fromTables(List.of(users(), other)));
    assertTrue(ex.getMessage().contains("user_role"));
  }

  @Test
  void duplicateTableNamesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> SnapshotBuilder.fromTables(List.of(users(), users())));
  }
}
