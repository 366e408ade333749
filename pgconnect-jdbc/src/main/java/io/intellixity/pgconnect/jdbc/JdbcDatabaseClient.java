package io.intellixity.pgconnect.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.pgconnect.exec.ConnectionHandle;
import io.intellixity.pgconnect.exec.ConnectionTarget;
import io.intellixity.pgconnect.exec.DatabaseClient;
import io.intellixity.pgconnect.exec.DatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link DatabaseClient} backed by the PostgreSQL JDBC driver.
 *
 * By default every {@link #connect} opens a fresh connection through {@link DriverManager}.
 */
public final class JdbcDatabaseClient implements DatabaseClient {
  private static final Logger log = LoggerFactory.getLogger(JdbcDatabaseClient.class);

  private final ConnectionOpener opener;
  private final JdbcArgBinder binder;
  private final AtomicLong seq = new AtomicLong();

  public JdbcDatabaseClient() {
    this(t -> DriverManager.getConnection(t.url(), t.properties()));
  }

  public JdbcDatabaseClient(ConnectionOpener opener) {
    this(opener, new ObjectMapper());
  }

  public JdbcDatabaseClient(ConnectionOpener opener, ObjectMapper json) {
    this.opener = Objects.requireNonNull(opener, "opener");
    this.binder = new JdbcArgBinder(json);
  }

  /** Connections come from {@code ds}; the session target is only used for logging. */
  public static JdbcDatabaseClient fromDataSource(DataSource ds) {
    Objects.requireNonNull(ds, "ds");
    return new JdbcDatabaseClient(t -> ds.getConnection());
  }

  @Override
  public ConnectionHandle connect(ConnectionTarget target) {
    JdbcTarget jdbc = PostgresUris.toJdbc(target);
    Connection c;
    try {
      c = opener.open(jdbc);
    } catch (SQLException e) {
      throw new DatabaseException("Failed to connect to " + target.describe() + ": " + e.getMessage(), e.getSQLState(), e);
    }
    if (c == null) throw new DatabaseException("Connection opener returned null for " + target.describe(), null);
    String id = "jdbc-" + seq.incrementAndGet();
    log.debug("pgconnect.jdbc connected handleId={} url={}", id, ConnectionTarget.redact(jdbc.url()));
    return new JdbcConnectionHandle(c, id, binder);
  }
}
