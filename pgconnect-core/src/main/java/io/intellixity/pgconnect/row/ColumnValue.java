package io.intellixity.pgconnect.row;

import java.util.Objects;

/** One column of a {@link Row}. The value may be null. */
public record ColumnValue(String column, Object value) {
  public ColumnValue {
    Objects.requireNonNull(column, "column");
    if (column.isBlank()) throw new RowValidationException("Column name must not be blank");
  }
}
