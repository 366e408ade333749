package io.intellixity.pgconnect.jdbc;

import io.intellixity.pgconnect.exec.ConnectionHandle;
import io.intellixity.pgconnect.exec.DatabaseException;
import io.intellixity.pgconnect.row.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link ConnectionHandle} over one JDBC {@link Connection}.\n
 *
 * Statements arrive with {@code $n} placeholders and are compiled by {@link PositionalParams}
 * before preparing. Not thread-safe; owned by a single session.\n
 */
public final class JdbcConnectionHandle implements ConnectionHandle {
  private static final Logger log = LoggerFactory.getLogger(JdbcConnectionHandle.class);

  private final Connection conn;
  private final String id;
  private final JdbcArgBinder binder;
  private boolean closed;

  public JdbcConnectionHandle(Connection conn, String id, JdbcArgBinder binder) {
    this.conn = Objects.requireNonNull(conn, "conn");
    this.id = Objects.requireNonNull(id, "id");
    this.binder = Objects.requireNonNull(binder, "binder");
  }

  public String id() { return id; }

  public boolean isClosed() { return closed; }

  @Override
  public Row fetchRow(String sql, List<?> args) {
    return execute("FETCH_ROW", sql, args, ps -> {
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? readRow(rs) : null;
      }
    });
  }

  /** First column of the first row, or null when the statement returned no rows or no result set. */
  @Override
  public Object fetchValue(String sql, List<?> args) {
    return execute("FETCH_VALUE", sql, args, ps -> {
      if (!ps.execute()) return null;
      try (ResultSet rs = ps.getResultSet()) {
        if (rs == null || !rs.next()) return null;
        return readValue(rs.getObject(1));
      }
    });
  }

  /**
   * Runs {@code work} in a transaction. When auto-commit is already off the caller owns the
   * transaction and {@code work} simply joins it.
   */
  @Override
  public <T> T inTransaction(Supplier<T> work) {
    requireOpen();
    boolean begin;
    try {
      begin = conn.getAutoCommit();
      if (begin) conn.setAutoCommit(false);
    } catch (SQLException e) {
      throw translate("BEGIN", e);
    }
    if (!begin) return work.get();

    log.debug("pgconnect.jdbc tx=begin handleId={}", id);
    T result;
    try {
      result = work.get();
      conn.commit();
    } catch (SQLException e) {
      DatabaseException failure = translate("COMMIT", e);
      rollbackAfter(failure);
      throw failure;
    } catch (RuntimeException | Error e) {
      rollbackAfter(e);
      throw e;
    }
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      throw translate("RESTORE_AUTOCOMMIT", e);
    }
    log.debug("pgconnect.jdbc tx=commit handleId={}", id);
    return result;
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    try {
      conn.close();
      log.debug("pgconnect.jdbc closed handleId={}", id);
    } catch (SQLException e) {
      throw translate("CLOSE", e);
    }
  }

  private void rollbackAfter(Throwable failure) {
    log.debug("pgconnect.jdbc tx=rollback handleId={} cause={}", id, failure.getClass().getSimpleName());
    try {
      conn.rollback();
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private <T> T execute(String op, String sql, List<?> args, StatementWork<T> work) {
    requireOpen();
    PositionalParams.Compiled compiled = PositionalParams.compile(sql);
    List<Object> ordered = compiled.order(args);
    long start = System.nanoTime();
    debugSql(op, compiled.jdbcSql(), ordered);
    try (PreparedStatement ps = conn.prepareStatement(compiled.jdbcSql())) {
      binder.bindAll(ps, ordered);
      T out = work.run(ps);
      debugDone(op, out, System.nanoTime() - start);
      return out;
    } catch (SQLException e) {
      throw translate(op, e);
    }
  }

  private static Row readRow(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    Row.Builder b = Row.builder();
    for (int i = 1; i <= md.getColumnCount(); i++) {
      b.put(md.getColumnLabel(i), readValue(rs.getObject(i)));
    }
    return b.build();
  }

  private static Object readValue(Object v) throws SQLException {
    if (v instanceof Array a) {
      Object arr = a.getArray();
      if (arr instanceof Object[] oa) return Arrays.asList(oa);
      return arr;
    }
    return v;
  }

  private void requireOpen() {
    if (closed) throw new IllegalStateException("Connection handle " + id + " is closed");
  }

  private DatabaseException translate(String op, SQLException e) {
    return new DatabaseException("pgconnect.jdbc " + op + " failed on " + id + ": " + e.getMessage(), e.getSQLState(), e);
  }

  private void debugSql(String op, String jdbcSql, List<Object> args) {
    if (!log.isDebugEnabled()) return;
    log.debug("pgconnect.jdbc op={} bindCount={} handleId={} sql={}", op, args.size(), id, jdbcSql);

    // TRACE: bind summary only, never raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : args) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("pgconnect.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String op, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("pgconnect.jdbc_done op={} handleId={} durationMs={} result={}",
        op, id, durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof CharSequence cs) return "len=" + cs.length();
    if (r instanceof Row row) return "columns=" + row.size();
    return r.getClass().getSimpleName();
  }

  @FunctionalInterface
  private interface StatementWork<T> {
    T run(PreparedStatement ps) throws SQLException;
  }
}
