package io.intellixity.strata.query;

import io.intellixity.strata.error.QueryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public record SortField(String column, Direction direction) {
  public SortField {
    Objects.requireNonNull(column, "column");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction {
    ASC, DESC;

    /** Accepts {@code asc}/{@code desc} in any case; anything else is rejected. */
    public static Direction parse(String raw) {
      if (raw != null) {
        String d = raw.toLowerCase(Locale.ROOT);
        if (d.equals("asc")) return ASC;
        if (d.equals("desc")) return DESC;
      }
      throw new QueryException("Invalid orderBy direction \"" + raw + "\". Only 'asc' or 'desc' are allowed.");
    }
  }

  public static SortField asc(String column) { return new SortField(column, Direction.ASC); }
  public static SortField desc(String column) { return new SortField(column, Direction.DESC); }

  /** Parse {@code {column: "asc"|"desc"}} preserving entry order. */
  public static List<SortField> fromMap(Map<String, String> orderBy) {
    if (orderBy == null || orderBy.isEmpty()) return List.of();
    List<SortField> out = new ArrayList<>(orderBy.size());
    for (var e : orderBy.entrySet()) out.add(new SortField(e.getKey(), Direction.parse(e.getValue())));
    return out;
  }
}
