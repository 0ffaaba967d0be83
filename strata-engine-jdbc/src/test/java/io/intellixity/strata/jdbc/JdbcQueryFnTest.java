package io.intellixity.strata.jdbc;

import io.intellixity.strata.error.ConstraintException;
import io.intellixity.strata.spi.exec.Executor;
import io.intellixity.strata.spi.exec.QueryResult;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcQueryFnTest {
  private static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  @Test
  void selectRewritesPlaceholdersAndReadsLabelledRows() {
    FakeJdbc db = FakeJdbc.returningRows(List.of(row("id", 1, "email", "a@x"), row("id", 2, "email", "b@x")));

    QueryResult r = new JdbcQueryFn(db.dataSource())
        .query("SELECT \"id\", \"email\" FROM \"users\" WHERE \"id\" > $1", List.of(0));

    assertEquals(List.of(
        "prepare SELECT \"id\", \"email\" FROM \"users\" WHERE \"id\" > ?",
        "setObject 1=0",
        "close"), db.events());
    assertEquals(List.of(row("id", 1, "email", "a@x"), row("id", 2, "email", "b@x")), r.rows());
    assertEquals(2, r.rowCount());
  }

  @Test
  void statementsWithoutRowsReportTheUpdateCount() {
    FakeJdbc db = FakeJdbc.returningUpdateCount(3);

    QueryResult r = new JdbcQueryFn(db.dataSource()).query("DELETE FROM \"users\"", List.of());

    assertTrue(r.rows().isEmpty());
    assertEquals(3, r.rowCount());
  }

  @Test
  void driverFailureKeepsTheSqlStateForClassification() {
    FakeJdbc db = FakeJdbc.failingWith(new SQLException(
        "ERROR: duplicate key value violates unique constraint \"users_email_key\"\n"
            + "  Detail: Key (email)=(a@x) already exists.", "23505"));
    Executor exec = new Executor(new JdbcQueryFn(db.dataSource()));

    ConstraintException ex = assertThrows(ConstraintException.class,
        () -> exec.execute("INSERT INTO \"users\" (\"email\") VALUES ($1)", List.of("a@x")));

    assertEquals(ConstraintException.Kind.UNIQUE, ex.kind());
    assertEquals("23505", ex.vendorCode());
  }

  @Test
  void transactionCommitsAndRestoresAutoCommit() {
    FakeJdbc db = FakeJdbc.returningUpdateCount(1);

    long n = new JdbcQueryFn(db.dataSource()).inTransaction(tx -> {
      tx.query("UPDATE t SET a = $1", List.of(1));
      return tx.query("UPDATE t SET b = $1", List.of(2)).rowCount();
    });

    assertEquals(1L, n);
    assertEquals(List.of(
        "autoCommit false",
        "prepare UPDATE t SET a = ?", "setObject 1=1",
        "prepare UPDATE t SET b = ?", "setObject 1=2",
        "commit", "autoCommit true", "close"), db.events());
    assertTrue(db.autoCommit());
  }

  @Test
  void transactionRollsBackOnFailure() {
    FakeJdbc db = FakeJdbc.returningUpdateCount(1);
    JdbcQueryFn fn = new JdbcQueryFn(db.dataSource());

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> fn.inTransaction(tx -> {
      tx.query("UPDATE t SET a = $1", List.of(1));
      throw new IllegalStateException("boom");
    }));

    assertEquals("boom", ex.getMessage());
    assertTrue(db.events().contains("rollback"));
    assertFalse(db.events().contains("commit"));
    assertTrue(db.autoCommit());
  }

  @Test
  void autoCommitRestoreFailureDoesNotHideTheOriginalError() {
    SQLException reset = new SQLException("connection reset", "08006");
    FakeJdbc db = FakeJdbc.returningUpdateCount(1).failingToRestoreAutoCommit(reset);
    JdbcQueryFn fn = new JdbcQueryFn(db.dataSource());

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> fn.inTransaction(tx -> {
      throw new IllegalStateException("boom");
    }));

    assertEquals("boom", ex.getMessage());
    assertEquals(List.of(reset), List.of(ex.getSuppressed()));
    assertEquals(List.of("autoCommit false", "rollback", "close"), db.events());
  }

  @Test
  void operationIsTheLeadingKeyword() {
    assertEquals("SELECT", JdbcQueryFn.operation("  select 1"));
    assertEquals("SQL", JdbcQueryFn.operation("(SELECT 1)"));
  }
}
