package io.intellixity.strata.migration;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a migration body into statements on {@code ;} outside quoted text, dollar-quoted bodies
 * ({@code $$...$$}, {@code $tag$...$tag$}) and comments. Comments are dropped.
 */
public final class SqlScripts {
  private SqlScripts() {}

  public static List<String> split(String script) {
    List<String> out = new ArrayList<>();
    if (script == null) return out;
    StringBuilder cur = new StringBuilder();
    int n = script.length();
    int i = 0;
    while (i < n) {
      char c = script.charAt(i);
      if (c == '\'' || c == '"') {
        int end = closingQuote(script, i);
        cur.append(script, i, end);
        i = end;
      } else if (c == '$' && dollarTag(script, i) != null) {
        String tag = dollarTag(script, i);
        int end = script.indexOf(tag, i + tag.length());
        end = end < 0 ? n : end + tag.length();
        cur.append(script, i, end);
        i = end;
      } else if (c == '-' && i + 1 < n && script.charAt(i + 1) == '-') {
        int end = script.indexOf('\n', i);
        i = end < 0 ? n : end;
      } else if (c == '/' && i + 1 < n && script.charAt(i + 1) == '*') {
        int end = script.indexOf("*/", i + 2);
        i = end < 0 ? n : end + 2;
      } else if (c == ';') {
        flush(cur, out);
        i++;
      } else {
        cur.append(c);
        i++;
      }
    }
    flush(cur, out);
    return out;
  }

  /** Index just past the quote that closes the one at {@code start}; doubled quotes stay inside. */
  private static int closingQuote(String s, int start) {
    char q = s.charAt(start);
    int i = start + 1;
    while (i < s.length()) {
      if (s.charAt(i) == q) {
        if (i + 1 < s.length() && s.charAt(i + 1) == q) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return s.length();
  }

  /** {@code $$} or {@code $name$} opening at {@code i}; null otherwise, including for {@code $1}. */
  private static String dollarTag(String s, int i) {
    int j = i + 1;
    if (j < s.length() && (Character.isLetter(s.charAt(j)) || s.charAt(j) == '_')) {
      while (j < s.length() && (Character.isLetterOrDigit(s.charAt(j)) || s.charAt(j) == '_')) j++;
    }
    if (j < s.length() && s.charAt(j) == '$') return s.substring(i, j + 1);
    return null;
  }

  private static void flush(StringBuilder cur, List<String> out) {
    String stmt = cur.toString().trim();
    if (!stmt.isEmpty()) out.add(stmt);
    cur.setLength(0);
  }
}
