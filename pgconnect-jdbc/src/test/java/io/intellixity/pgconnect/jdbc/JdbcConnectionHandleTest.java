package io.intellixity.pgconnect.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.pgconnect.exec.DatabaseException;
import io.intellixity.pgconnect.row.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
final class JdbcConnectionHandleTest {
  @Mock Connection conn;
  @Mock PreparedStatement ps;
  @Mock ResultSet rs;
  @Mock ResultSetMetaData md;

  private JdbcConnectionHandle handle;

  @BeforeEach
  void setUp() {
    handle = new JdbcConnectionHandle(conn, "jdbc-test", new JdbcArgBinder(new ObjectMapper()));
  }

  @Test
  void fetchRowReadsFirstRowByLabel() throws Exception {
    when(conn.prepareStatement("SELECT * FROM users WHERE email = ? LIMIT 1")).thenReturn(ps);
    when(ps.executeQuery()).thenReturn(rs);
    when(rs.next()).thenReturn(true);
    when(rs.getMetaData()).thenReturn(md);
    when(md.getColumnCount()).thenReturn(2);
    when(md.getColumnLabel(1)).thenReturn("id");
    when(md.getColumnLabel(2)).thenReturn("email");
    when(rs.getObject(1)).thenReturn(7L);
    when(rs.getObject(2)).thenReturn("a@x");

    Row row = handle.fetchRow("SELECT * FROM users WHERE email = $1 LIMIT 1", List.of("a@x"));

    assertEquals(Row.of("id", 7L, "email", "a@x"), row);
    verify(ps).setObject(1, "a@x");
    verify(rs).close();
    verify(ps).close();
  }

  @Test
  void fetchRowWithoutRowsIsNull() throws Exception {
    when(conn.prepareStatement(anyString())).thenReturn(ps);
    when(ps.executeQuery()).thenReturn(rs);
    when(rs.next()).thenReturn(false);

    assertNull(handle.fetchRow("SELECT * FROM users WHERE id = $1 LIMIT 1", List.of(1)));
  }

  @Test
  void fetchValueReadsFirstColumn() throws Exception {
    when(conn.prepareStatement("INSERT INTO users (email) VALUES (?) RETURNING id")).thenReturn(ps);
    when(ps.execute()).thenReturn(true);
    when(ps.getResultSet()).thenReturn(rs);
    when(rs.next()).thenReturn(true);
    when(rs.getObject(1)).thenReturn(42L);

    assertEquals(42L, handle.fetchValue("INSERT INTO users (email) VALUES ($1) RETURNING id", List.of("a@x")));
  }

  @Test
  void fetchValueWithoutResultSetIsNull() throws Exception {
    when(conn.prepareStatement(anyString())).thenReturn(ps);
    when(ps.execute()).thenReturn(false);

    assertNull(handle.fetchValue("INSERT INTO t (a) VALUES ($1) ON CONFLICT DO NOTHING", List.of(1)));
    verify(ps, never()).getResultSet();
  }

  @Test
  void argumentsFollowPlaceholderNumbers() throws Exception {
    when(conn.prepareStatement("SELECT * FROM t WHERE a = ? AND b = ?")).thenReturn(ps);
    when(ps.executeQuery()).thenReturn(rs);

    handle.fetchRow("SELECT * FROM t WHERE a = $2 AND b = $1", List.of("first", "second"));

    verify(ps).setObject(1, "second");
    verify(ps).setObject(2, "first");
  }

  @Test
  void sqlExceptionKeepsSqlState() throws Exception {
    SQLException cause = new SQLException("duplicate key value", "23505");
    when(conn.prepareStatement(anyString())).thenThrow(cause);

    DatabaseException e = assertThrows(DatabaseException.class,
        () -> handle.fetchValue("INSERT INTO t (id) VALUES ($1)", List.of(1)));
    assertEquals("23505", e.sqlState());
    assertSame(cause, e.getCause());
  }

  @Test
  void inTransactionCommitsAndRestoresAutoCommit() throws Exception {
    when(conn.getAutoCommit()).thenReturn(true);

    assertEquals("ok", handle.inTransaction(() -> "ok"));

    InOrder order = inOrder(conn);
    order.verify(conn).setAutoCommit(false);
    order.verify(conn).commit();
    order.verify(conn).setAutoCommit(true);
    verify(conn, never()).rollback();
  }

  @Test
  void inTransactionRollsBackAndRethrows() throws Exception {
    when(conn.getAutoCommit()).thenReturn(true);
    IllegalStateException boom = new IllegalStateException("boom");

    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> handle.inTransaction(() -> { throw boom; }));

    assertSame(boom, e);
    verify(conn).rollback();
    verify(conn).setAutoCommit(true);
    verify(conn, never()).commit();
  }

  @Test
  void failedCommitRollsBack() throws Exception {
    when(conn.getAutoCommit()).thenReturn(true);
    doThrow(new SQLException("serialization failure", "40001")).when(conn).commit();

    DatabaseException e = assertThrows(DatabaseException.class, () -> handle.inTransaction(() -> 1));

    assertEquals("40001", e.sqlState());
    verify(conn).rollback();
  }

  @Test
  void rollbackFailureIsSuppressed() throws Exception {
    when(conn.getAutoCommit()).thenReturn(true);
    doThrow(new SQLException("connection lost", "08006")).when(conn).rollback();

    RuntimeException e = assertThrows(RuntimeException.class,
        () -> handle.inTransaction(() -> { throw new RuntimeException("body"); }));

    assertEquals("body", e.getMessage());
    assertEquals(1, e.getSuppressed().length);
  }

  @Test
  void inTransactionJoinsOpenTransaction() throws Exception {
    when(conn.getAutoCommit()).thenReturn(false);

    assertEquals(3, handle.inTransaction(() -> 3));

    verify(conn, never()).setAutoCommit(anyBoolean());
    verify(conn, never()).commit();
  }

  @Test
  void closeIsIdempotentAndBlocksFurtherUse() throws Exception {
    handle.close();
    handle.close();

    verify(conn, times(1)).close();
    assertTrue(handle.isClosed());
    assertThrows(IllegalStateException.class, () -> handle.fetchRow("SELECT 1", List.of()));
  }

  @Test
  void closeFailureIsDatabaseError() throws Exception {
    doThrow(new SQLException("io")).when(conn).close();

    assertThrows(DatabaseException.class, handle::close);
    assertTrue(handle.isClosed());
  }
}
