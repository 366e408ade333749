package io.intellixity.pgconnect.exec;

/** Opens live connections; the only way a session reaches the database. */
@FunctionalInterface
public interface DatabaseClient {
  /**
   * Open one connection to {@code target}. The caller owns the returned handle and must close it.
   *
   * @throws DatabaseException if the connection cannot be established
   */
  ConnectionHandle connect(ConnectionTarget target);
}
