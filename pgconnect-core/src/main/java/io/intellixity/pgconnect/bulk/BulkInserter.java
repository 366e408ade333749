package io.intellixity.pgconnect.bulk;

import io.intellixity.pgconnect.config.PgConnectProperties;
import io.intellixity.pgconnect.row.RowValidationException;
import io.intellixity.pgconnect.session.DbSession;
import io.intellixity.pgconnect.sql.QueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Buffers value tuples for one table and writes them as a single multi-row
 * {@code INSERT ... ON CONFLICT DO NOTHING} once the buffer reaches the batch size.\n
 *
 * Trailing rows are only written by an explicit {@link #flush()}; nothing is flushed on disposal.
 * Not thread-safe: use one inserter per producer.\n
 */
public final class BulkInserter {
  private static final Logger log = LoggerFactory.getLogger(BulkInserter.class);

  public static final int DEFAULT_BATCH_SIZE = PgConnectProperties.DEFAULT_BATCH_SIZE;

  private final DbSession session;
  private final String table;
  private final List<String> columns;
  private final int batchSize;
  private List<List<Object>> buffer = new ArrayList<>();
  private long flushCount;

  public BulkInserter(DbSession session, String table, List<String> columns) {
    this(session, table, columns, DEFAULT_BATCH_SIZE);
  }

  /** Batch size taken from {@link PgConnectProperties#batchSize()}. */
  public BulkInserter(DbSession session, String table, List<String> columns, PgConnectProperties props) {
    this(session, table, columns, Objects.requireNonNull(props, "props").batchSize());
  }

  public BulkInserter(DbSession session, String table, List<String> columns, int batchSize) {
    this.session = Objects.requireNonNull(session, "session");
    if (table == null || table.isBlank()) throw new RowValidationException("Table name must not be blank");
    if (columns == null || columns.isEmpty()) throw new RowValidationException("BulkInserter needs at least one column");
    if (batchSize <= 0) throw new RowValidationException("batchSize must be > 0");
    this.table = table;
    this.columns = List.copyOf(columns);
    this.batchSize = batchSize;
  }

  /**
   * Buffer one tuple given as column values. A single {@code List} argument is one column value
   * (e.g. a jsonb array), not a tuple; use {@link #addTuple(List)} for a tuple held in a list.
   */
  public void add(Object... tuple) {
    addTuple(tuple == null ? null : Arrays.asList(tuple));
  }

  /** Buffer one tuple; flushes before returning when the buffer is full. */
  public void addTuple(List<?> tuple) {
    int got = (tuple == null) ? 0 : tuple.size();
    if (got != columns.size()) {
      throw new RowValidationException("Tuple has " + got + " values but " + columns.size() + " columns were given");
    }
    buffer.add(new ArrayList<>(tuple));
    if (buffer.size() >= batchSize) flush();
  }

  /** Write all buffered tuples as one statement. No-op when empty; on failure the buffer is kept. */
  public void flush() {
    if (buffer.isEmpty()) return;
    List<List<Object>> batch = buffer;
    session.insert(table, columns, batch, null, QueryBuilder.DO_NOTHING);
    buffer = new ArrayList<>();
    flushCount++;
    log.debug("pgconnect.bulk flushed table={} rows={} flushes={}", table, batch.size(), flushCount);
  }

  /** Tuples buffered and not yet written. */
  public int pending() { return buffer.size(); }

  public int batchSize() { return batchSize; }

  /** Number of insert statements issued so far. */
  public long flushCount() { return flushCount; }
}
