package io.intellixity.pgconnect.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Binds plain Java values onto a {@link PreparedStatement}.\n
 *
 * Mapping:\n
 * - null: {@code setNull(Types.NULL)}, letting the server infer the column type\n
 * - {@link Instant}: {@link OffsetDateTime} at UTC (timestamptz)\n
 * - {@link Map} / {@link Collection}: jsonb {@link PGobject} written with Jackson\n
 * - enums: {@code name()}\n
 * - everything else: {@code setObject}\n
 */
public final class JdbcArgBinder {
  private final ObjectMapper json;

  public JdbcArgBinder(ObjectMapper json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /** Binds {@code args.get(i)} to position {@code i + 1}. */
  public void bindAll(PreparedStatement ps, List<?> args) throws SQLException {
    for (int i = 0; i < args.size(); i++) {
      bind(ps, i + 1, args.get(i));
    }
  }

  public void bind(PreparedStatement ps, int pos, Object v) throws SQLException {
    if (v == null) {
      ps.setNull(pos, Types.NULL);
      return;
    }
    if (v instanceof Instant i) {
      ps.setObject(pos, OffsetDateTime.ofInstant(i, ZoneOffset.UTC));
      return;
    }
    if (v instanceof Map<?, ?> || v instanceof Collection<?>) {
      PGobject obj = new PGobject();
      obj.setType("jsonb");
      obj.setValue(toJson(v));
      ps.setObject(pos, obj);
      return;
    }
    if (v instanceof Enum<?> e) {
      ps.setString(pos, e.name());
      return;
    }
    ps.setObject(pos, v);
  }

  private String toJson(Object v) {
    try {
      return json.writeValueAsString(v);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode " + v.getClass().getName() + " as jsonb", e);
    }
  }
}
