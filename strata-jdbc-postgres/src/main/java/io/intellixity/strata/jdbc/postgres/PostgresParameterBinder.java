package io.intellixity.strata.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.strata.jdbc.bind.ParameterBinder;
import org.postgresql.util.PGobject;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.*;

/**
 * Postgres binds: {@link List} as a native array, {@link Map} as {@code jsonb}.
 * On read, {@code json}/{@code jsonb} columns are decoded back into maps and lists.
 */
public final class PostgresParameterBinder extends ParameterBinder {
  private static final ObjectMapper JSON = new ObjectMapper();

  // explicit element mapping; anything else goes as text[]
  private static final Map<Class<?>, String> PG_ELEM_TYPES = Map.of(
      String.class, "text",
      Integer.class, "int4",
      Long.class, "int8",
      Double.class, "float8",
      Float.class, "float4",
      Boolean.class, "bool",
      UUID.class, "uuid",
      BigDecimal.class, "numeric"
  );

  @Override
  protected boolean bindDialect(PreparedStatement ps, int position, Object value) throws SQLException {
    if (value instanceof Map<?, ?> m) {
      ps.setObject(position, jsonb(m));
      return true;
    }
    if (value instanceof List<?> l) {
      Array arr = ps.getConnection().createArrayOf(elementType(l), l.toArray());
      ps.setArray(position, arr);
      return true;
    }
    return false;
  }

  @Override
  protected Object readDialect(Object value) throws SQLException {
    if (value instanceof PGobject pg && pg.getValue() != null
        && ("jsonb".equals(pg.getType()) || "json".equals(pg.getType()))) {
      try {
        return JSON.readValue(pg.getValue(), Object.class);
      } catch (JsonProcessingException e) {
        throw new SQLException("Invalid " + pg.getType() + " value from driver", e);
      }
    }
    return value;
  }

  static String elementType(List<?> values) {
    for (Object v : values) {
      if (v == null) continue;
      String t = PG_ELEM_TYPES.get(v.getClass());
      return t == null ? "text" : t;
    }
    return "text";
  }

  static PGobject jsonb(Object value) throws SQLException {
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    try {
      obj.setValue(JSON.writeValueAsString(value));
    } catch (JsonProcessingException e) {
      throw new SQLException("Value is not JSON-serializable: " + value.getClass().getName(), e);
    }
    return obj;
  }
}
