package io.intellixity.pgconnect.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/** Source of raw JDBC connections for {@link JdbcDatabaseClient}. */
@FunctionalInterface
public interface ConnectionOpener {
  Connection open(JdbcTarget target) throws SQLException;
}
