package dbexec.jdbc;

import dbexec.Batch;
import dbexec.BatchResults;
import dbexec.CopyFromSource;
import dbexec.ExecContext;
import dbexec.Identifier;
import dbexec.NoRowsException;
import dbexec.jdbc.tx.JdbcTransaction;
import dbexec.jdbc.tx.JdbcTransactionManager;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class PostgresExecutorIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("dbexec_test");

  private static ExecutorManager manager;
  private static JdbcTransactionManager txManager;
  private final ExecContext ctx = ExecContext.background();

  @BeforeAll
  static void initSchema() throws SQLException {
    SimpleDataSource dataSource =
        new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    manager = new ExecutorManager(dataSource);
    txManager = new JdbcTransactionManager(manager.pool());
    manager.getPoolExecutor().exec(ExecContext.background(),
        "CREATE TABLE accounts (id BIGINT PRIMARY KEY, owner TEXT NOT NULL, balance BIGINT NOT NULL)");
  }

  @BeforeEach
  void truncate() throws SQLException {
    manager.getPoolExecutor().exec(ctx, "TRUNCATE TABLE accounts");
  }

  @Test
  void commandTagsMatchServerFormat() throws SQLException {
    assertEquals("INSERT 0 2", manager.getExecutor(ctx).exec(ctx,
        "INSERT INTO accounts VALUES (1, 'a', 10), (2, 'b', 20)").toString());
    assertEquals("UPDATE 1", manager.getExecutor(ctx).exec(ctx,
        "UPDATE accounts SET balance = balance + ? WHERE id = ?", 5L, 1L).toString());
  }

  @Test
  void transferInTransaction() throws SQLException {
    manager.getExecutor(ctx).exec(ctx, "INSERT INTO accounts VALUES (1, 'a', 100), (2, 'b', 0)");

    try (JdbcTransaction tx = txManager.begin()) {
      ExecContext txCtx = manager.injectTransaction(ctx, tx);
      manager.getExecutor(txCtx).exec(txCtx, "UPDATE accounts SET balance = balance - ? WHERE id = ?", 40L, 1L);
      manager.getExecutor(txCtx).exec(txCtx, "UPDATE accounts SET balance = balance + ? WHERE id = ?", 40L, 2L);
      tx.commit();
    }

    List<Long> balances = manager.getExecutor(ctx).query(ctx, "SELECT balance FROM accounts ORDER BY id")
        .collect(rs -> rs.getLong(1));
    assertEquals(List.of(60L, 40L), balances);
  }

  @Test
  void batchFailureRollsBackEarlierStatements() throws SQLException {
    Batch batch = new Batch();
    batch.queue("INSERT INTO accounts VALUES (1, 'a', 1)");
    batch.queue("INSERT INTO accounts VALUES (1, 'dup', 1)");

    BatchResults results = manager.getPoolExecutor().sendBatch(ctx, batch);
    SQLException ex = assertThrows(SQLException.class, results::close);
    assertEquals("23505", ex.getSQLState());

    assertEquals(0L, manager.getExecutor(ctx).queryRow(ctx, "SELECT COUNT(*) FROM accounts").scalar(Long.class));
  }

  @Test
  void copyFromLoadsRows() throws SQLException {
    long copied = manager.getPoolExecutor().copyFrom(ctx, Identifier.of("public", "accounts"),
        List.of("id", "owner", "balance"), CopyFromSource.slice(2_500, i -> new Object[] {(long) i, "o" + i, 0L}));

    assertEquals(2_500, copied);
    assertEquals(2_500L, manager.getExecutor(ctx).queryRow(ctx, "SELECT COUNT(*) FROM accounts").scalar(Long.class));
  }

  @Test
  void missingRowReportsNoRows() {
    assertThrows(NoRowsException.class, () -> manager.getExecutor(ctx)
        .queryRow(ctx, "SELECT owner FROM accounts WHERE id = ?", 99L).scalar(String.class));
  }

  @Test
  void contextTimeoutCancelsStatement() {
    ExecContext limited = ctx.withTimeout(Duration.ofSeconds(1));
    SQLException ex = assertThrows(SQLException.class,
        () -> manager.getExecutor(limited).exec(limited, "SELECT pg_sleep(5)"));
    assertEquals("57014", ex.getSQLState());
  }
}
