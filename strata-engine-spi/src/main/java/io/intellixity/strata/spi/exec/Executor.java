package io.intellixity.strata.spi.exec;

import io.intellixity.strata.error.*;
import io.intellixity.strata.spi.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wraps a {@link QueryFn} and classifies raised backend errors into the {@link DbException} taxonomy.
 * Classification happens here and nowhere else; already-classified exceptions pass through.
 */
public final class Executor {
  private static final Logger log = LoggerFactory.getLogger(Executor.class);

  // full-featured backend message forms
  private static final Pattern PG_KEY = Pattern.compile("Key \\(([^)]+)\\)=");
  private static final Pattern PG_COLUMN = Pattern.compile("column \"([^\"]+)\"");
  private static final Pattern PG_TABLE = Pattern.compile("(?:relation|on table) \"([^\"]+)\"");
  private static final Pattern PG_CONSTRAINT = Pattern.compile("constraint \"([^\"]+)\"");
  // embedded backend: "UNIQUE constraint failed: users.email"
  private static final Pattern SQLITE_CONSTRAINT =
      Pattern.compile("(UNIQUE|FOREIGN KEY|NOT NULL|CHECK) constraint failed(?::\\s*([A-Za-z0-9_\"]+)(?:\\.([A-Za-z0-9_\"]+))?)?");
  private static final int SQLITE_CONSTRAINT_CODE = 19;

  private final QueryFn fn;

  public Executor(QueryFn fn) {
    this.fn = Objects.requireNonNull(fn, "fn");
  }

  public QueryResult execute(SqlStatement stmt) {
    return execute(stmt.sql(), stmt.params());
  }

  public QueryResult execute(String sql, List<Object> params) {
    List<Object> p = params == null ? List.of() : params;
    try {
      QueryResult r = fn.query(sql, p);
      return r == null ? QueryResult.empty() : r;
    } catch (RuntimeException e) {
      DbException classified = classify(e, sql);
      if (classified != e && log.isDebugEnabled()) {
        log.debug("strata.exec_error code={} type={} bindCount={} sql={}",
            classified.code(), e.getClass().getSimpleName(), p.size(), sql);
      }
      throw classified;
    }
  }

  public QueryFn queryFn() {
    return fn;
  }

  /** Map any failure to its structured kind; {@link DbException}s are returned unchanged. */
  public static DbException classify(Throwable t, String sql) {
    if (t instanceof DbException db) return db;

    SQLException sqlEx = find(t, SQLException.class);
    String code = null;
    int vendorInt = 0;
    if (sqlEx != null) {
      code = sqlEx.getSQLState();
      vendorInt = sqlEx.getErrorCode();
    } else {
      VendorCoded vc = find(t, VendorCoded.class);
      if (vc != null) code = vc.vendorCode();
    }
    String message = messageOf(sqlEx != null ? sqlEx : t);

    if (code != null) {
      ConstraintException.Kind kind = switch (code) {
        case "23505" -> ConstraintException.Kind.UNIQUE;
        case "23503" -> ConstraintException.Kind.FOREIGN_KEY;
        case "23502" -> ConstraintException.Kind.NOT_NULL;
        case "23514" -> ConstraintException.Kind.CHECK;
        default -> null;
      };
      if (kind != null) {
        return new ConstraintException(kind, message, group(PG_TABLE, message), pgColumn(message),
            group(PG_CONSTRAINT, message), code, t);
      }
      if (code.startsWith("08") || code.startsWith("28")) {
        return new ConnectionException(message, code, t);
      }
    }

    Matcher m = message == null ? null : SQLITE_CONSTRAINT.matcher(message);
    if (m != null && m.find()) {
      ConstraintException.Kind kind = switch (m.group(1)) {
        case "UNIQUE" -> ConstraintException.Kind.UNIQUE;
        case "FOREIGN KEY" -> ConstraintException.Kind.FOREIGN_KEY;
        case "NOT NULL" -> ConstraintException.Kind.NOT_NULL;
        default -> ConstraintException.Kind.CHECK;
      };
      String table = null;
      String column = null;
      String constraint = null;
      if (kind == ConstraintException.Kind.CHECK) {
        constraint = m.group(2);
      } else if (m.group(3) != null) {
        table = m.group(2);
        column = m.group(3);
      }
      String vendor = code != null ? code : (vendorInt != 0 ? String.valueOf(vendorInt) : String.valueOf(SQLITE_CONSTRAINT_CODE));
      return new ConstraintException(kind, message, table, column, constraint, vendor, t);
    }

    if (find(t, SQLNonTransientConnectionException.class) != null
        || find(t, SQLTransientConnectionException.class) != null
        || find(t, ConnectException.class) != null) {
      return new ConnectionException(message, code, t);
    }

    return new QueryException(message == null ? "Query failed" : message, sql, code, t);
  }

  private static String pgColumn(String message) {
    String fromKey = group(PG_KEY, message);
    if (fromKey != null) return fromKey;
    return group(PG_COLUMN, message);
  }

  private static String group(Pattern p, String message) {
    if (message == null) return null;
    Matcher m = p.matcher(message);
    return m.find() ? m.group(1) : null;
  }

  private static String messageOf(Throwable t) {
    Throwable cur = t;
    while (cur != null) {
      if (cur.getMessage() != null) return cur.getMessage();
      cur = cur.getCause();
    }
    return null;
  }

  private static <T> T find(Throwable t, Class<T> type) {
    Throwable cur = t;
    int guard = 0;
    while (cur != null && guard++ < 32) {
      if (type.isInstance(cur)) return type.cast(cur);
      cur = cur.getCause();
    }
    return null;
  }
}
