package io.intellixity.pgconnect.exec;

/**
 * Failure reported by the database or its driver (constraint violation, lost connection,
 * malformed SQL). Never retried.
 */
public final class DatabaseException extends RuntimeException {
  private final String sqlState;

  public DatabaseException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public DatabaseException(String message, String sqlState, Throwable cause) {
    super(message, cause);
    this.sqlState = sqlState;
  }

  /** Five-character SQLSTATE code when the driver reported one, else null. */
  public String sqlState() { return sqlState; }
}
