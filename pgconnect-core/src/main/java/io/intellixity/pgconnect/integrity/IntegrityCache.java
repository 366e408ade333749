package io.intellixity.pgconnect.integrity;

import io.intellixity.pgconnect.row.Row;
import io.intellixity.pgconnect.row.RowValidationException;
import io.intellixity.pgconnect.session.DbSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Remembers, per table, the key values already confirmed to exist so repeated
 * {@link #create(DbSession, String, Row, String)} calls skip the database.\n
 *
 * Local and non-durable: it only saves round-trips and guarantees nothing across processes.
 * Create one per unit of work (e.g. one import job). Not thread-safe.\n
 */
public final class IntegrityCache {
  private static final Logger log = LoggerFactory.getLogger(IntegrityCache.class);

  public static final String DEFAULT_KEY_FIELD = "id";

  private final Map<String, Set<Object>> store = new HashMap<>();

  public boolean create(DbSession session, String table, Row row) {
    return create(session, table, row, DEFAULT_KEY_FIELD);
  }

  /**
   * Ensure a row keyed by {@code row.get(keyField)} exists in {@code table}.\n
   *
   * The key is recorded before the database is consulted, so a second call with the same key never
   * reaches the database, even if the first one failed.\n
   *
   * @return true if the database was consulted, false if the key was already recorded
   * @throws RowValidationException if {@code row} has no {@code keyField} column
   */
  public boolean create(DbSession session, String table, Row row, String keyField) {
    Objects.requireNonNull(session, "session");
    Objects.requireNonNull(table, "table");
    if (row == null || keyField == null || !row.contains(keyField)) {
      throw new RowValidationException("Missing " + keyField + " field in data");
    }
    Object key = row.get(keyField);
    Set<Object> keys = store.computeIfAbsent(table, t -> new HashSet<>());
    if (!keys.add(key)) {
      log.debug("pgconnect.integrity skip table={} key={}", table, key);
      return false;
    }
    session.conditionalCreate(table, row);
    return true;
  }

  public boolean contains(String table, Object key) {
    Set<Object> keys = store.get(table);
    return keys != null && keys.contains(key);
  }

  /** Number of keys recorded for {@code table}. */
  public int size(String table) {
    Set<Object> keys = store.get(table);
    return keys == null ? 0 : keys.size();
  }
}
