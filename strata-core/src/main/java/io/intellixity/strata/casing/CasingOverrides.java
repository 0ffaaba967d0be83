package io.intellixity.strata.casing;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Explicit declared-name to storage-name pairs for identifiers the regular casing rule would mangle
 * (e.g. {@code oAuthId -> oauth_id}). The inverse direction is derived.
 */
public record CasingOverrides(Map<String, String> toStorage, Map<String, String> toDeclared) {
  private static final CasingOverrides NONE = new CasingOverrides(Map.of(), Map.of());

  public CasingOverrides {
    toStorage = Map.copyOf(toStorage == null ? Map.of() : toStorage);
    toDeclared = Map.copyOf(toDeclared == null ? Map.of() : toDeclared);
  }

  public static CasingOverrides none() { return NONE; }

  public static CasingOverrides of(Map<String, String> declaredToStorage) {
    Objects.requireNonNull(declaredToStorage, "declaredToStorage");
    Map<String, String> inverse = new LinkedHashMap<>();
    for (var e : declaredToStorage.entrySet()) inverse.put(e.getValue(), e.getKey());
    return new CasingOverrides(declaredToStorage, inverse);
  }

  public boolean isEmpty() { return toStorage.isEmpty(); }
}
