package io.intellixity.pgconnect.exec;

import io.intellixity.pgconnect.row.Row;

import java.util.List;
import java.util.function.Supplier;

/**
 * One live connection.\n
 *
 * SQL uses PostgreSQL positional placeholders ({@code $1, $2, ...}); {@code args.get(i)} binds
 * {@code $(i+1)}. Implementations are not safe for concurrent statements.\n
 * All failures surface as {@link DatabaseException}.\n
 */
public interface ConnectionHandle extends AutoCloseable {
  /** First result row, or null when the statement returned no rows. */
  Row fetchRow(String sql, List<?> args);

  /** First column of the first result row, or null when there is no row. */
  Object fetchValue(String sql, List<?> args);

  /** Run work in one transaction: commit on return, roll back when work throws. */
  <T> T inTransaction(Supplier<T> work);

  /** Release the connection. Calling it again is a no-op. */
  @Override
  void close();
}
