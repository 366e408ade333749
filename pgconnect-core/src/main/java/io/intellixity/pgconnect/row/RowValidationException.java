package io.intellixity.pgconnect.row;

/**
 * Raised when caller-supplied row data cannot produce a statement: empty rows, tuple arity that
 * does not match the column list, or a missing key column.
 * <p>
 * Always thrown before any database round-trip.
 */
public final class RowValidationException extends IllegalArgumentException {
  public RowValidationException(String message) {
    super(message);
  }
}
