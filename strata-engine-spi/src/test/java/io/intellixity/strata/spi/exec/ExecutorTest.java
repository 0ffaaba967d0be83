package io.intellixity.strata.spi.exec;

import io.intellixity.strata.error.*;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ExecutorTest {
  private static final class CodedFailure extends RuntimeException implements VendorCoded {
    private final String code;

    CodedFailure(String message, String code) {
      super(message);
      this.code = code;
    }

    @Override public String vendorCode() { return code; }
  }

  private static Executor failingWith(RuntimeException e) {
    return new Executor((sql, params) -> { throw e; });
  }

  @Test
  void passesStatementAndParamsThrough() {
    List<String> seen = new ArrayList<>();
    Executor exec = new Executor((sql, params) -> {
      seen.add(sql + " " + params);
      return QueryResult.of(List.of());
    });

    QueryResult r = exec.execute("SELECT 1", null);

    assertEquals(List.of("SELECT 1 []"), seen);
    assertEquals(0, r.rowCount());
  }

  @Test
  void nullResultBecomesEmpty() {
    assertSame(QueryResult.empty(), new Executor((sql, params) -> null).execute("SELECT 1", List.of()));
  }

  @Test
  void uniqueViolationFromSqlStateCarriesColumnAndConstraint() {
    SQLException cause = new SQLException(
        "ERROR: duplicate key value violates unique constraint \"users_email_key\"\n"
            + "  Detail: Key (email)=(a@b.c) already exists.", "23505");
    Executor exec = failingWith(new RuntimeException(cause));

    ConstraintException ex = assertThrows(ConstraintException.class, () -> exec.execute("INSERT ...", List.of()));

    assertEquals(ConstraintException.Kind.UNIQUE, ex.kind());
    assertEquals("email", ex.column());
    assertEquals("users_email_key", ex.constraint());
    assertEquals("23505", ex.vendorCode());
    assertEquals("CONSTRAINT_ERROR", ex.code());
  }

  @Test
  void foreignKeyViolationNamesTheTable() {
    SQLException cause = new SQLException(
        "insert or update on table \"posts\" violates foreign key constraint \"posts_author_id_fkey\"", "23503");

    DbException ex = Executor.classify(cause, "INSERT ...");

    ConstraintException c = assertInstanceOf(ConstraintException.class, ex);
    assertEquals(ConstraintException.Kind.FOREIGN_KEY, c.kind());
    assertEquals("posts", c.table());
  }

  @Test
  void embeddedBackendMessageIsParsed() {
    SQLException cause = new SQLException("[SQLITE_CONSTRAINT_UNIQUE] UNIQUE constraint failed: users.email", null, 19);

    ConstraintException c = assertInstanceOf(ConstraintException.class, Executor.classify(cause, null));

    assertEquals(ConstraintException.Kind.UNIQUE, c.kind());
    assertEquals("users", c.table());
    assertEquals("email", c.column());
    assertEquals("19", c.vendorCode());
  }

  @Test
  void vendorCodedErrorsFromOtherBoundariesAreClassified() {
    DbException ex = Executor.classify(new CodedFailure("null value in column \"name\"", "23502"), "INSERT ...");

    ConstraintException c = assertInstanceOf(ConstraintException.class, ex);
    assertEquals(ConstraintException.Kind.NOT_NULL, c.kind());
    assertEquals("name", c.column());
  }

  @Test
  void connectionFailuresAreRecognised() {
    assertInstanceOf(ConnectionException.class,
        Executor.classify(new SQLException("connection refused", "08001"), null));
    assertInstanceOf(ConnectionException.class,
        Executor.classify(new RuntimeException(new ConnectException("refused")), null));
  }

  @Test
  void anythingElseIsAQueryErrorWithTheSql() {
    QueryException ex = assertInstanceOf(QueryException.class,
        Executor.classify(new SQLException("syntax error at or near \"FORM\"", "42601"), "SELECT * FORM t"));

    assertEquals("SELECT * FORM t", ex.sql());
    assertEquals("42601", ex.vendorCode());
  }

  @Test
  void classifiedErrorsPassThroughUnchanged() {
    NotFoundException nf = new NotFoundException("users");
    Executor exec = failingWith(nf);

    assertSame(nf, assertThrows(NotFoundException.class, () -> exec.execute("SELECT 1", List.of())));
  }
}
