package io.intellixity.strata.jdbc.postgres;

import io.intellixity.strata.casing.CasingOverrides;
import io.intellixity.strata.jdbc.sql.InsertBuilder;
import io.intellixity.strata.jdbc.sql.InsertQuery;
import io.intellixity.strata.jdbc.sql.WhereBuilder;
import io.intellixity.strata.jdbc.sql.WhereClause;
import io.intellixity.strata.query.Filters;
import io.intellixity.strata.query.WhereFilter;
import io.intellixity.strata.schema.ColumnDef;
import io.intellixity.strata.spi.sql.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private static final PostgresDialect PG = PostgresDialect.INSTANCE;

  private static WhereClause where(WhereFilter f) {
    return WhereBuilder.build(f, 0, PG, CasingOverrides.none());
  }

  @Test
  void tokens() {
    assertEquals("postgres", PG.id());
    assertEquals("$3", PG.param(3));
    assertEquals("NOW()", PG.now());
    assertEquals("now()", PG.currentTimestampDefault());
    assertEquals("serial PRIMARY KEY", PG.autoIncrementPrimaryKey());
    assertEquals("timestamp with time zone", PG.mapColumnType("timestamp with time zone"));
    assertEquals("\"a\"\"b\"", PG.quoteIdent("a\"b"));
    assertEquals("", PG.likeEscapeClause());
    assertTrue(PG.supportsAlterColumn());
    assertTrue(PG.supportsNativeEnums());
  }

  @Test
  void arrayOperatorsBindTheWholeList() {
    WhereClause w = where(Filters.and(
        Filters.arrayContains("tags", List.of("a", "b")),
        Filters.arrayContainedBy("tags", List.of("a")),
        Filters.arrayOverlaps("tags", List.of("z"))));

    assertEquals("\"tags\" @> $1 AND \"tags\" <@ $2 AND \"tags\" && $3", w.sql());
    assertEquals(List.of(List.of("a", "b"), List.of("a"), List.of("z")), w.params());
  }

  @Test
  void jsonPathKeepsJsonUntilTheLastSegment() {
    WhereClause w = where(Filters.eq("metaData->address->city", "Oslo"));
    assertEquals("\"meta_data\"->'address'->>'city' = $1", w.sql());

    assertEquals("\"m\"->>'it''s'", PG.jsonPath("\"m\"", List.of("it's")));
  }

  @Test
  void likeHasNoEscapeClause() {
    assertEquals("\"name\" LIKE $1", where(Filters.startsWith("name", "A")).sql());
  }

  @Test
  void insertStampsWithNow() {
    SqlStatement s = InsertBuilder.build(InsertQuery.of("events", Map.of("at", ColumnDef.NOW))
        .nowColumns(Set.of("at")), PG);
    assertEquals("INSERT INTO \"events\" (\"at\") VALUES (NOW())", s.sql());
  }
}
