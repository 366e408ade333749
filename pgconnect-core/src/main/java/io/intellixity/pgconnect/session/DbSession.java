package io.intellixity.pgconnect.session;

import io.intellixity.pgconnect.config.PgConnectProperties;
import io.intellixity.pgconnect.exec.ConnectionHandle;
import io.intellixity.pgconnect.exec.ConnectionTarget;
import io.intellixity.pgconnect.exec.DatabaseClient;
import io.intellixity.pgconnect.row.Row;
import io.intellixity.pgconnect.row.RowValidationException;
import io.intellixity.pgconnect.sql.QueryBuilder;
import io.intellixity.pgconnect.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * One connection-scoped database session.\n
 *
 * Lifecycle: {@link SessionState#NEW} → {@link #open()} → {@link SessionState#OPEN} →
 * {@link #close()} → {@link SessionState#CLOSED}. Use it either as a try-with-resources resource
 * ({@code try (DbSession s = new DbSession(client, target).open())}) or through
 * {@link #use(SessionWork)}, which also logs a failing body before releasing the connection.\n
 *
 * Not thread-safe: the underlying connection runs one statement at a time.\n
 */
public final class DbSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DbSession.class);

  public static final String DEFAULT_RETURN_COLUMN = "id";

  private final DatabaseClient client;
  private final ConnectionTarget target;
  private final String defaultReturnColumn;

  private SessionState state = SessionState.NEW;
  private ConnectionHandle handle;

  public DbSession(DatabaseClient client, ConnectionTarget target) {
    this(client, target, DEFAULT_RETURN_COLUMN);
  }

  public DbSession(DatabaseClient client, PgConnectProperties props) {
    this(client, Objects.requireNonNull(props, "props").target(), props.returnColumn());
  }

  public DbSession(DatabaseClient client, ConnectionTarget target, String defaultReturnColumn) {
    this.client = Objects.requireNonNull(client, "client");
    this.target = Objects.requireNonNull(target, "target");
    this.defaultReturnColumn = (defaultReturnColumn == null || defaultReturnColumn.isBlank())
        ? DEFAULT_RETURN_COLUMN
        : defaultReturnColumn;
  }

  /** Open a session on {@code target}, run {@code work}, and release the connection on every exit path. */
  public static <T> T run(DatabaseClient client, ConnectionTarget target, SessionWork<T> work) {
    return new DbSession(client, target).use(work);
  }

  public ConnectionTarget target() { return target; }
  public SessionState state() { return state; }
  public boolean isOpen() { return state == SessionState.OPEN; }

  /**
   * Acquire the connection. Valid only once, on a {@link SessionState#NEW} session.
   *
   * @return this session
   * @throws SessionStateException if the session was already opened or closed
   */
  public DbSession open() {
    if (state != SessionState.NEW) {
      throw new SessionStateException("Cannot open session in state " + state + "; sessions are single-use");
    }
    ConnectionHandle h = client.connect(target);
    if (h == null) throw new IllegalStateException("DatabaseClient returned no connection for " + target.describe());
    this.handle = h;
    this.state = SessionState.OPEN;
    log.info("pgconnect.session opened target={}", target.describe());
    return this;
  }

  /**
   * Scoped use: opens the session, runs {@code work}, closes the session.\n
   *
   * If {@code work} throws, the failure is logged with its type, message and the session context
   * before the connection is released, then rethrown unchanged. A failure while closing after a
   * failed body is attached to the body's exception as suppressed.\n
   */
  public <T> T use(SessionWork<T> work) {
    Objects.requireNonNull(work, "work");
    open();
    Throwable failure = null;
    try {
      return work.run(this);
    } catch (RuntimeException | Error e) {
      failure = e;
      logScopeFailure(e);
      throw e;
    } finally {
      closeAfter(failure);
    }
  }

  /** Release the connection. Idempotent; the session cannot be reopened afterwards. */
  @Override
  public void close() {
    if (state == SessionState.CLOSED) return;
    ConnectionHandle h = handle;
    handle = null;
    state = SessionState.CLOSED;
    if (h != null) {
      h.close();
      log.info("pgconnect.session closed target={}", target.describe());
    }
  }

  /** Find-or-create without a return column. */
  public Object conditionalCreate(String table, Row row) {
    return conditionalCreate(table, row, null);
  }

  /**
   * Look the row up by equality on all of its columns; insert it if absent.
   *
   * @return the value of {@code returnColumn} from the stored row (merged over {@code row}) or from
   *     the insert's RETURNING clause; null when {@code returnColumn} is null or absent
   */
  public Object conditionalCreate(String table, Row row, String returnColumn) {
    return findOrCreate(table, row, returnColumn).value();
  }

  /** Like {@link #conditionalCreate(String, Row, String)}, also exposing the merged row. */
  public CreateResult findOrCreate(String table, Row row, String returnColumn) {
    ConnectionHandle h = requireOpen("findOrCreate");
    SqlStatement lookup = QueryBuilder.lookupOne(table, row);
    Row found = h.fetchRow(lookup.sql(), lookup.args());
    if (found == null) {
      Object v = insertOne(table, row, returnColumn);
      Row created = (returnColumn == null || v == null) ? row : row.with(returnColumn, v);
      log.debug("pgconnect.find_or_create table={} result=inserted", table);
      return new CreateResult(v, created, true);
    }
    Row merged = row.mergedWith(found);
    log.debug("pgconnect.find_or_create table={} result=found", table);
    return new CreateResult(returnColumn == null ? null : merged.get(returnColumn), merged, false);
  }

  /** Insert every column of {@code row}, returning the session's default return column (normally {@code id}). */
  public Object insertOne(String table, Row row) {
    return insertOne(table, row, defaultReturnColumn);
  }

  /** Insert every column of {@code row}; {@code returnColumn} may be null for no RETURNING clause. */
  public Object insertOne(String table, Row row, String returnColumn) {
    ConnectionHandle h = requireOpen("insertOne");
    if (row == null || row.isEmpty()) throw new RowValidationException("Empty data: insertOne needs at least one column");
    return execute(h, QueryBuilder.insertRow(table, row, null, returnColumn), returnColumn);
  }

  public Object insert(String table, List<String> columns, List<? extends List<?>> tuples) {
    return insert(table, columns, tuples, null, null);
  }

  public Object insert(String table, List<String> columns, List<? extends List<?>> tuples, String returnColumn) {
    return insert(table, columns, tuples, returnColumn, null);
  }

  /**
   * Insert one or more tuples as a single statement inside its own transaction.
   *
   * @param returnColumn column for a RETURNING clause, or null
   * @param onConflict clause following {@code ON CONFLICT} (e.g. {@link QueryBuilder#DO_NOTHING}), or null
   * @return first column of the first returned row when {@code returnColumn} is set, else null
   */
  public Object insert(String table,
                       List<String> columns,
                       List<? extends List<?>> tuples,
                       String returnColumn,
                       String onConflict) {
    ConnectionHandle h = requireOpen("insert");
    return execute(h, QueryBuilder.insert(table, columns, tuples, onConflict, returnColumn), returnColumn);
  }

  private static Object execute(ConnectionHandle h, SqlStatement st, String returnColumn) {
    Object v = h.inTransaction(() -> h.fetchValue(st.sql(), st.args()));
    return (returnColumn == null || returnColumn.isBlank()) ? null : v;
  }

  private ConnectionHandle requireOpen(String op) {
    if (state != SessionState.OPEN || handle == null) {
      throw new SessionStateException("Cannot run " + op + ": session is " + state + " (target " + target.describe() + ")");
    }
    return handle;
  }

  private void logScopeFailure(Throwable t) {
    log.error("pgconnect.session scope failed type={} message={} target={} state={}",
        t.getClass().getName(), t.getMessage(), target.describe(), state, t);
  }

  private void closeAfter(Throwable primary) {
    try {
      close();
    } catch (RuntimeException closeFailure) {
      if (primary == null) throw closeFailure;
      primary.addSuppressed(closeFailure);
    }
  }
}
