package io.intellixity.pgconnect.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rewrites PostgreSQL positional parameters ({@code $1, $2, ...}) into JDBC {@code ?} markers.
 *
 * Rules:
 * - {@code $} followed by digits is a parameter; each {@code ?} remembers its number, so the same
 *   number may appear more than once and in any order.
 * - Text inside single quotes, double-quoted identifiers and dollar-quoted bodies
 *   ({@code $$...$$}, {@code $tag$...$tag$}) is copied untouched.
 */
public final class PositionalParams {
  private PositionalParams() {}

  /** JDBC SQL plus, for each {@code ?} in order, the 1-based parameter number it stands for. */
  public record Compiled(String jdbcSql, List<Integer> paramNumbers) {
    public Compiled {
      paramNumbers = List.copyOf(paramNumbers);
    }

    /** Arguments in {@code ?} order. {@code args.get(n - 1)} binds {@code $n}. */
    public List<Object> order(List<?> args) {
      List<?> in = (args == null) ? List.of() : args;
      List<Object> out = new ArrayList<>(paramNumbers.size());
      for (int n : paramNumbers) {
        if (n < 1 || n > in.size()) {
          throw new IllegalArgumentException("Parameter $" + n + " has no argument (" + in.size() + " given)");
        }
        out.add(in.get(n - 1));
      }
      return Collections.unmodifiableList(out);
    }
  }

  public static Compiled compile(String sql) {
    if (sql == null) return new Compiled("", List.of());
    StringBuilder out = new StringBuilder(sql.length());
    List<Integer> numbers = new ArrayList<>();
    int i = 0;
    while (i < sql.length()) {
      char ch = sql.charAt(i);

      if (ch == '\'' || ch == '"') {
        int end = skipQuoted(sql, i, ch);
        out.append(sql, i, end);
        i = end;
        continue;
      }

      if (ch == '$') {
        int next = i + 1;
        if (next < sql.length() && isDigit(sql.charAt(next))) {
          int end = next;
          while (end < sql.length() && isDigit(sql.charAt(end))) end++;
          numbers.add(Integer.parseInt(sql.substring(next, end)));
          out.append('?');
          i = end;
          continue;
        }
        String tag = dollarTag(sql, i);
        if (tag != null) {
          int close = sql.indexOf(tag, i + tag.length());
          int end = (close < 0) ? sql.length() : close + tag.length();
          out.append(sql, i, end);
          i = end;
          continue;
        }
      }

      out.append(ch);
      i++;
    }
    return new Compiled(out.toString(), numbers);
  }

  /** Index just past the closing quote; doubled quotes are escapes. Unterminated runs to the end. */
  private static int skipQuoted(String sql, int start, char quote) {
    int i = start + 1;
    while (i < sql.length()) {
      if (sql.charAt(i) == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return sql.length();
  }

  /** {@code $$} or {@code $tag$} starting at {@code start}, or null. */
  private static String dollarTag(String sql, int start) {
    int i = start + 1;
    while (i < sql.length() && isTagPart(sql.charAt(i))) i++;
    if (i < sql.length() && sql.charAt(i) == '$') return sql.substring(start, i + 1);
    return null;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isTagPart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_' || isDigit(c);
  }
}
