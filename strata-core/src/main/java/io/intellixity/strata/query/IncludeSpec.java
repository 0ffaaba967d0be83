package io.intellixity.strata.query;

import java.util.*;

/**
 * Relations to load alongside a read: relation name to either "everything" or a narrowed
 * selection with optional nested includes.
 */
public record IncludeSpec(Map<String, Include> relations) {
  private static final IncludeSpec NONE = new IncludeSpec(Map.of());

  /**
   * @param select target columns to load; empty loads the target's visible columns
   * @param include nested relations of the target, or null
   */
  public record Include(List<String> select, IncludeSpec include) {
    public static final Include ALL = new Include(List.of(), null);

    public Include {
      select = select == null ? List.of() : List.copyOf(select);
    }

    public boolean hasNested() {
      return include != null && !include.isEmpty();
    }
  }

  public IncludeSpec {
    relations = Collections.unmodifiableMap(new LinkedHashMap<>(relations == null ? Map.of() : relations));
  }

  public static IncludeSpec none() { return NONE; }

  public static IncludeSpec of(String... relationNames) {
    Map<String, Include> m = new LinkedHashMap<>();
    for (String r : relationNames) m.put(r, Include.ALL);
    return new IncludeSpec(m);
  }

  public IncludeSpec with(String relation, List<String> select, IncludeSpec nested) {
    Map<String, Include> m = new LinkedHashMap<>(relations);
    m.put(relation, new Include(select, nested));
    return new IncludeSpec(m);
  }

  public boolean isEmpty() { return relations.isEmpty(); }

  /**
   * Parse the map form: {@code {posts: true, author: {select: {name: true}, include: {...}}}}.
   * {@code false} entries are skipped; {@code select} may be a map of flags or a list of names.
   */
  @SuppressWarnings("unchecked")
  public static IncludeSpec fromMap(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) return NONE;
    Map<String, Include> m = new LinkedHashMap<>();
    for (var e : raw.entrySet()) {
      Object v = e.getValue();
      if (Boolean.TRUE.equals(v)) {
        m.put(e.getKey(), Include.ALL);
      } else if (v instanceof Map<?, ?> opts) {
        List<String> select = selectList(opts.get("select"));
        Object nested = opts.get("include");
        IncludeSpec n = nested instanceof Map<?, ?> nm ? fromMap((Map<String, ?>) nm) : null;
        m.put(e.getKey(), new Include(select, n));
      } else if (v != null && !Boolean.FALSE.equals(v)) {
        throw new IllegalArgumentException("Invalid include for '" + e.getKey() + "': " + v);
      }
    }
    return new IncludeSpec(m);
  }

  private static List<String> selectList(Object raw) {
    if (raw == null) return List.of();
    List<String> out = new ArrayList<>();
    if (raw instanceof Map<?, ?> sm) {
      for (var se : sm.entrySet()) if (Boolean.TRUE.equals(se.getValue())) out.add(String.valueOf(se.getKey()));
    } else if (raw instanceof Collection<?> c) {
      for (Object o : c) out.add(String.valueOf(o));
    } else {
      throw new IllegalArgumentException("select must be a map of flags or a list of column names");
    }
    return out;
  }
}
