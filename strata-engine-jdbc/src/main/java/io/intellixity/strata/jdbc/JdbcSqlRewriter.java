package io.intellixity.strata.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites numbered placeholders ({@code $1}, {@code $2}) into JDBC {@code ?} binds and orders
 * the parameter list to match.
 * <ul>
 *   <li>a placeholder is {@code $} followed by one or more digits</li>
 *   <li>placeholders inside single-quoted literals, double-quoted identifiers, dollar-quoted bodies
 *   ({@code $$...$$}, {@code $tag$...$tag$}) and comments are ignored</li>
 *   <li>{@code ''} and {@code ""} escapes inside quotes are honoured</li>
 *   <li>SQL without numbered placeholders (already {@code ?}-style) passes through unchanged</li>
 * </ul>
 */
public final class JdbcSqlRewriter {
  private JdbcSqlRewriter() {}

  /** JDBC SQL plus parameters in bind order. */
  public record Rewritten(String sql, List<Object> params) {}

  public static Rewritten rewrite(String sql, List<Object> params) {
    List<Object> effective = params == null ? List.of() : params;
    if (sql == null) return new Rewritten("", List.of());

    StringBuilder out = new StringBuilder(sql.length());
    List<Integer> order = new ArrayList<>();
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) {
          // doubled quote stays inside the literal
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"') {
        quote = ch;
        out.append(ch);
        continue;
      }

      int skip = skipVerbatim(sql, i);
      if (skip > i) {
        out.append(sql, i, skip);
        i = skip - 1;
        continue;
      }

      if (ch == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && Character.isDigit(sql.charAt(end))) end++;
        int index = Integer.parseInt(sql.substring(i + 1, end));
        if (index < 1 || index > effective.size()) {
          throw new IllegalArgumentException("Placeholder $" + index + " has no parameter (count=" + effective.size() + ")");
        }
        order.add(index);
        out.append('?');
        i = end - 1;
        continue;
      }

      out.append(ch);
    }

    if (order.isEmpty()) return new Rewritten(sql, effective);
    List<Object> bound = new ArrayList<>(order.size());
    for (int idx : order) bound.add(effective.get(idx - 1));
    return new Rewritten(out.toString(), bound);
  }

  /**
   * End of the comment or dollar-quoted body starting at {@code i}, or {@code i} when none starts there.
   * Unterminated ones run to the end of the text.
   */
  static int skipVerbatim(String sql, int i) {
    int n = sql.length();
    char ch = sql.charAt(i);
    if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
      int end = sql.indexOf('\n', i);
      return end < 0 ? n : end;
    }
    if (ch == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
      int end = sql.indexOf("*/", i + 2);
      return end < 0 ? n : end + 2;
    }
    if (ch == '$') {
      String tag = dollarTag(sql, i);
      if (tag == null) return i;
      int end = sql.indexOf(tag, i + tag.length());
      return end < 0 ? n : end + tag.length();
    }
    return i;
  }

  /** {@code $$} or {@code $name$} opening at {@code i}; null for anything else, including {@code $1}. */
  private static String dollarTag(String sql, int i) {
    int j = i + 1;
    if (j < sql.length() && (Character.isLetter(sql.charAt(j)) || sql.charAt(j) == '_')) {
      while (j < sql.length() && (Character.isLetterOrDigit(sql.charAt(j)) || sql.charAt(j) == '_')) j++;
    }
    if (j < sql.length() && sql.charAt(j) == '$') return sql.substring(i, j + 1);
    return null;
  }
}
