package io.intellixity.pgconnect.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rendered SQL with {@code $n} placeholders and the arguments they bind, in placeholder order.
 * Arguments may be null.
 */
public record SqlStatement(String sql, List<Object> args) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    // List.copyOf rejects nulls, and SQL NULL is a legal argument.
    args = (args == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
  }

  /** Same binds, SQL with {@code suffix} appended. */
  public SqlStatement append(String suffix) {
    return new SqlStatement(sql + suffix, args);
  }
}
