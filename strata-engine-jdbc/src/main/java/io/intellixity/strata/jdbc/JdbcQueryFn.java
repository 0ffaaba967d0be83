package io.intellixity.strata.jdbc;

import io.intellixity.strata.jdbc.bind.ParameterBinder;
import io.intellixity.strata.spi.exec.QueryFn;
import io.intellixity.strata.spi.exec.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;
import java.util.function.Function;

/**
 * {@link QueryFn} over a {@link DataSource}.
 * <p>
 * Each call borrows a connection and returns it; {@link #inTransaction} pins one connection for the
 * duration of the work and commits or rolls back. {@link SQLException}s are rethrown wrapped so the
 * {@link io.intellixity.strata.spi.exec.Executor} can read SQLSTATE from the cause chain.
 */
public final class JdbcQueryFn implements QueryFn {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryFn.class);

  private final DataSource ds;
  private final ParameterBinder binder;

  public JdbcQueryFn(DataSource ds, ParameterBinder binder) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.binder = binder == null ? ParameterBinder.DEFAULT : binder;
  }

  public JdbcQueryFn(DataSource ds) {
    this(ds, ParameterBinder.DEFAULT);
  }

  @Override
  public QueryResult query(String sql, List<Object> params) {
    try (Connection c = ds.getConnection()) {
      return run(c, sql, params);
    } catch (SQLException e) {
      throw new JdbcQueryException(e);
    }
  }

  /**
   * Run {@code work} against a single connection in one transaction.
   * Any exception rolls back and propagates; rollback or auto-commit restore failures ride along as suppressed.
   */
  public <T> T inTransaction(Function<QueryFn, T> work) {
    Objects.requireNonNull(work, "work");
    try (Connection c = ds.getConnection()) {
      boolean auto = c.getAutoCommit();
      c.setAutoCommit(false);
      T out;
      try {
        out = work.apply((sql, params) -> {
          try {
            return run(c, sql, params);
          } catch (SQLException e) {
            throw new JdbcQueryException(e);
          }
        });
        c.commit();
      } catch (SQLException | RuntimeException | Error e) {
        try {
          c.rollback();
        } catch (SQLException re) {
          e.addSuppressed(re);
        }
        try {
          c.setAutoCommit(auto);
        } catch (SQLException ae) {
          e.addSuppressed(ae);
        }
        throw e;
      }
      c.setAutoCommit(auto);
      return out;
    } catch (SQLException e) {
      throw new JdbcQueryException(e);
    }
  }

  private QueryResult run(Connection c, String sql, List<Object> params) throws SQLException {
    JdbcSqlRewriter.Rewritten rw = JdbcSqlRewriter.rewrite(sql, params);
    String op = operation(rw.sql());
    long start = System.nanoTime();
    debugSql(op, rw);
    try (PreparedStatement ps = c.prepareStatement(rw.sql())) {
      int pos = 1;
      for (Object v : rw.params()) binder.bind(ps, pos++, v);
      boolean hasRows = ps.execute();
      QueryResult result;
      if (hasRows) {
        try (ResultSet rs = ps.getResultSet()) {
          result = QueryResult.of(readRows(rs));
        }
      } else {
        result = new QueryResult(List.of(), Math.max(ps.getUpdateCount(), 0));
      }
      debugDone(op, result, System.nanoTime() - start);
      return result;
    }
  }

  private List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 0; i < n; i++) labels[i] = md.getColumnLabel(i + 1);
    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(n * 2);
      for (int i = 0; i < n; i++) row.put(labels[i], binder.read(rs, i + 1));
      out.add(row);
    }
    return out;
  }

  static String operation(String sql) {
    String s = sql.stripLeading();
    int end = 0;
    while (end < s.length() && Character.isLetter(s.charAt(end))) end++;
    return end == 0 ? "SQL" : s.substring(0, end).toUpperCase(Locale.ROOT);
  }

  private static void debugSql(String op, JdbcSqlRewriter.Rewritten rw) {
    if (!log.isDebugEnabled()) return;
    log.debug("strata.jdbc op={} bindCount={} sql={}", op, rw.params().size(), rw.sql());

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : rw.params()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("strata.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private static void debugDone(String op, QueryResult r, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("strata.jdbc_done op={} durationMs={} rows={} rowCount={}",
        op, durationNanos / 1_000_000.0, r.rows().size(), r.rowCount());
  }

  /** Unchecked carrier for a driver {@link SQLException}; classified by the executor. */
  public static final class JdbcQueryException extends RuntimeException {
    JdbcQueryException(SQLException cause) {
      super(cause.getMessage(), cause);
    }
  }
}
