package io.intellixity.pgconnect.bulk;

import io.intellixity.pgconnect.config.PgConnectProperties;
import io.intellixity.pgconnect.exec.ConnectionTarget;
import io.intellixity.pgconnect.exec.DatabaseException;
import io.intellixity.pgconnect.exec.FakeDatabase;
import io.intellixity.pgconnect.row.Row;
import io.intellixity.pgconnect.row.RowValidationException;
import io.intellixity.pgconnect.session.DbSession;
import io.intellixity.pgconnect.session.SessionStateException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class BulkInserterTest {
  private FakeDatabase db;
  private DbSession session;

  @BeforeEach
  void setUp() {
    db = new FakeDatabase();
    session = new DbSession(db, ConnectionTarget.of("postgresql://localhost/app")).open();
  }

  @AfterEach
  void tearDown() {
    session.close();
  }

  @Test
  void flushesAutomaticallyAtBatchSizeAndExplicitlyForTheRest() {
    BulkInserter bulk = new BulkInserter(session, "people", List.of("name", "age"), 3);

    bulk.add("Nano", 33);
    bulk.add("Ana", 41);
    assertEquals(0, db.inserts());
    bulk.add("Leo", 7);

    assertEquals(1, db.inserts());
    assertEquals(1, bulk.flushCount());
    assertEquals(0, bulk.pending());
    assertEquals(
        "INSERT INTO people (name, age) VALUES ($1, $2), ($3, $4), ($5, $6) ON CONFLICT DO NOTHING",
        db.statements().get(0));

    bulk.add("Mia", 5);
    bulk.add("Tom", 9);
    assertEquals(2, bulk.pending());
    assertEquals(1, db.inserts());

    bulk.flush();

    assertEquals(0, bulk.pending());
    assertEquals(2, db.inserts());
    assertEquals("INSERT INTO people (name, age) VALUES ($1, $2), ($3, $4) ON CONFLICT DO NOTHING",
        db.statements().get(1));
    assertEquals(5, db.rows("people").size());
  }

  @Test
  void flushOnEmptyBufferIsNoOp() {
    BulkInserter bulk = new BulkInserter(session, "people", List.of("name"));
    bulk.flush();
    assertEquals(0, db.roundTrips());
    assertEquals(BulkInserter.DEFAULT_BATCH_SIZE, bulk.batchSize());
  }

  @Test
  void conflictingRowsAreSkipped() {
    db.seed("people", Row.of("id", 1, "name", "Nano"));
    BulkInserter bulk = new BulkInserter(session, "people", List.of("id", "name"), 10);
    bulk.add(1, "Nano");
    bulk.add(2, "Ana");
    bulk.flush();
    assertEquals(2, db.rows("people").size());
  }

  @Test
  void bufferIsKeptWhenFlushFails() {
    BulkInserter bulk = new BulkInserter(session, "people", List.of("name"), 10);
    bulk.add("Nano");
    bulk.add("Ana");
    db.failOnInsert(new DatabaseException("connection lost", "08006", null));

    assertThrows(DatabaseException.class, bulk::flush);
    assertEquals(2, bulk.pending());
    assertEquals(0, bulk.flushCount());
  }

  @Test
  void acceptsListTuples() {
    BulkInserter bulk = new BulkInserter(session, "people", List.of("name", "age"), 2);
    bulk.addTuple(List.of("Nano", 33));
    bulk.addTuple(java.util.Arrays.asList("Ana", null));
    assertEquals(1, db.inserts());
    assertNull(db.rows("people").get(1).get("age"));
  }

  @Test
  void singleListArgumentIsOneColumnValue() {
    BulkInserter bulk = new BulkInserter(session, "docs", List.of("tags"), 10);
    bulk.add(List.of("a", "b"));
    assertEquals(1, bulk.pending());
    bulk.flush();
    assertEquals(List.of("a", "b"), db.rows("docs").get(0).get("tags"));
  }

  @Test
  void rejectsTupleOfWrongArity() {
    BulkInserter bulk = new BulkInserter(session, "people", List.of("name", "age"), 2);
    assertThrows(RowValidationException.class, () -> bulk.add("Nano"));
    assertEquals(0, bulk.pending());
  }

  @Test
  void rejectsNonPositiveBatchSize() {
    assertThrows(RowValidationException.class, () -> new BulkInserter(session, "people", List.of("name"), 0));
  }

  @Test
  void batchSizeFromProperties() {
    Properties p = new Properties();
    p.setProperty(PgConnectProperties.BATCH_SIZE, "2");
    BulkInserter bulk = new BulkInserter(session, "people", List.of("name"), PgConnectProperties.of(p));
    bulk.add("a");
    bulk.add("b");
    assertEquals(1, db.inserts());
  }

  @Test
  void flushAfterSessionClosedIsUsageError() {
    BulkInserter bulk = new BulkInserter(session, "people", List.of("name"), 10);
    bulk.add("Nano");
    session.close();
    assertThrows(SessionStateException.class, bulk::flush);
    assertEquals(1, bulk.pending());
  }
}
