package io.intellixity.strata.casing;

/**
 * Converts between declared (camelCase) identifiers and storage (snake_case) identifiers.
 * <ul>
 *   <li>an upper-case letter following a lower-case letter or digit starts a new word</li>
 *   <li>inside an acronym run, the last capital starts a new word when a lower-case letter follows
 *   ({@code HTMLParser -> html_parser})</li>
 *   <li>names already in storage form pass through unchanged</li>
 * </ul>
 */
public final class Casing {
  private Casing() {}

  public static String camelToSnake(String name) {
    return camelToSnake(name, CasingOverrides.none());
  }

  public static String camelToSnake(String name, CasingOverrides overrides) {
    if (name == null || name.isEmpty()) return name;
    if (overrides != null) {
      String o = overrides.toStorage().get(name);
      if (o != null) return o;
    }

    StringBuilder out = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isUpperCase(c)) {
        if (i > 0 && out.length() > 0 && out.charAt(out.length() - 1) != '_') {
          char prev = name.charAt(i - 1);
          boolean afterWord = Character.isLowerCase(prev) || Character.isDigit(prev);
          boolean acronymEnd = Character.isUpperCase(prev)
              && i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
          if (afterWord || acronymEnd) out.append('_');
        }
        out.append(Character.toLowerCase(c));
      } else {
        out.append(c);
      }
    }
    return out.toString();
  }

  public static String snakeToCamel(String name) {
    return snakeToCamel(name, CasingOverrides.none());
  }

  public static String snakeToCamel(String name, CasingOverrides overrides) {
    if (name == null || name.isEmpty()) return name;
    if (overrides != null) {
      String o = overrides.toDeclared().get(name);
      if (o != null) return o;
    }
    if (name.indexOf('_') < 0) return name;

    StringBuilder out = new StringBuilder(name.length());
    int i = 0;
    // leading underscores are part of the name (e.g. aggregate aliases)
    while (i < name.length() && name.charAt(i) == '_') out.append(name.charAt(i++));

    boolean upperNext = false;
    for (; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c == '_') {
        upperNext = true;
        continue;
      }
      out.append(upperNext ? Character.toUpperCase(c) : c);
      upperNext = false;
    }
    return out.toString();
  }
}
