package io.intellixity.strata.jdbc.bind;

import java.sql.*;
import java.time.Instant;
import java.util.UUID;

/**
 * JDBC value binding and reading.
 *
 * Dialect binders extend this and override {@link #bindDialect} / {@link #readDialect};
 * dialect rules are evaluated before the base JDBC rules.
 */
public class ParameterBinder {
  public static final ParameterBinder DEFAULT = new ParameterBinder();

  public final void bind(PreparedStatement ps, int position, Object value) throws SQLException {
    if (value != null && bindDialect(ps, position, value)) return;
    if (value == null) {
      ps.setNull(position, Types.NULL);
    } else if (value instanceof Instant i) {
      ps.setTimestamp(position, Timestamp.from(i));
    } else if (value instanceof UUID u) {
      ps.setObject(position, u);
    } else if (value instanceof Enum<?> e) {
      ps.setString(position, e.name());
    } else {
      ps.setObject(position, value);
    }
  }

  public final Object read(ResultSet rs, int column) throws SQLException {
    Object v = rs.getObject(column);
    if (v == null) return null;
    Object d = readDialect(v);
    if (d != v) return d;
    if (v instanceof Timestamp ts) return ts.toInstant();
    if (v instanceof Array a) {
      try {
        Object[] items = (Object[]) a.getArray();
        return java.util.Arrays.asList(items);
      } finally {
        a.free();
      }
    }
    return v;
  }

  /** @return true when the value was bound */
  protected boolean bindDialect(PreparedStatement ps, int position, Object value) throws SQLException {
    return false;
  }

  /** @return a converted value, or {@code value} itself to fall through to the base rules */
  protected Object readDialect(Object value) throws SQLException {
    return value;
  }
}
