package io.intellixity.pgconnect.sql;

import io.intellixity.pgconnect.row.ColumnValue;
import io.intellixity.pgconnect.row.Row;
import io.intellixity.pgconnect.row.RowValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders lookup and insert statements with PostgreSQL positional placeholders ({@code $1, $2, ...}).
 * <p>
 * Pure: no I/O, no state. Identifiers are emitted as given.
 * All validation happens before any SQL text is built.
 */
public final class QueryBuilder {
  /** Conflict clause that skips rows colliding with an existing constraint. */
  public static final String DO_NOTHING = "DO NOTHING";

  private QueryBuilder() {}

  /** Hands out placeholder numbers for one statement; numbers are never reused. */
  private static final class RenderCtx {
    private int n = 1;
    private final List<Object> args = new ArrayList<>();

    String add(Object value) {
      args.add(value);
      return "$" + (n++);
    }
  }

  /** {@code SELECT * FROM <table> WHERE <c1> = $1 AND <c2> = $2 ...}, one equality per column. */
  public static SqlStatement lookup(String table, Row row) {
    requireTable(table);
    if (row == null || row.isEmpty()) throw new RowValidationException("Empty data: lookup needs at least one column");

    RenderCtx ctx = new RenderCtx();
    List<String> where = new ArrayList<>(row.size());
    for (ColumnValue cv : row) {
      where.add(cv.column() + " = " + ctx.add(cv.value()));
    }
    String sql = "SELECT * FROM " + table + " WHERE " + String.join(" AND ", where);
    return new SqlStatement(sql, ctx.args);
  }

  /** {@link #lookup} limited to a single row. */
  public static SqlStatement lookupOne(String table, Row row) {
    return lookup(table, row).append(" LIMIT 1");
  }

  public static SqlStatement insert(String table, List<String> columns, List<? extends List<?>> tuples) {
    return insert(table, columns, tuples, null, null);
  }

  /**
   * Multi-row insert. Row {@code i} (1-based) of {@code N} columns uses placeholders
   * {@code ((i-1)*N+1) .. (i*N)}; args are the tuples concatenated in order.
   *
   * @param onConflict clause appended after {@code ON CONFLICT}, or null
   * @param returningColumn column appended after {@code RETURNING}, or null
   */
  public static SqlStatement insert(String table,
                                    List<String> columns,
                                    List<? extends List<?>> tuples,
                                    String onConflict,
                                    String returningColumn) {
    requireTable(table);
    if (columns == null || columns.isEmpty()) throw new RowValidationException("Insert has no columns");
    if (tuples == null || tuples.isEmpty()) throw new RowValidationException("Insert has no value tuples");
    for (String c : columns) {
      if (c == null || c.isBlank()) throw new RowValidationException("Insert column name must not be blank");
    }
    int width = columns.size();
    for (int i = 0; i < tuples.size(); i++) {
      List<?> t = tuples.get(i);
      int got = (t == null) ? 0 : t.size();
      if (got != width) {
        throw new RowValidationException(
            "Tuple " + (i + 1) + " has " + got + " values but " + width + " columns were given");
      }
    }

    RenderCtx ctx = new RenderCtx();
    List<String> groups = new ArrayList<>(tuples.size());
    for (List<?> t : tuples) {
      List<String> ph = new ArrayList<>(width);
      for (Object v : t) ph.add(ctx.add(v));
      groups.add("(" + String.join(", ", ph) + ")");
    }

    StringBuilder sql = new StringBuilder("INSERT INTO ")
        .append(table)
        .append(" (").append(String.join(", ", columns)).append(")")
        .append(" VALUES ").append(String.join(", ", groups));
    if (onConflict != null && !onConflict.isBlank()) sql.append(" ON CONFLICT ").append(onConflict.trim());
    if (returningColumn != null && !returningColumn.isBlank()) sql.append(" RETURNING ").append(returningColumn.trim());
    return new SqlStatement(sql.toString(), ctx.args);
  }

  /** Single-row insert of every column of {@code row}, in row order. */
  public static SqlStatement insertRow(String table, Row row, String onConflict, String returningColumn) {
    if (row == null || row.isEmpty()) throw new RowValidationException("Empty data: insert needs at least one column");
    return insert(table, row.columns(), List.of(row.values()), onConflict, returningColumn);
  }

  private static void requireTable(String table) {
    if (table == null || table.isBlank()) throw new RowValidationException("Table name must not be blank");
  }
}
