package dbexec.jdbc;

import dbexec.BatchExecutor;
import dbexec.ExecContext;
import dbexec.Executor;
import dbexec.ExecutorConfig;
import dbexec.ExecutorKind;
import dbexec.ExecutorNotFoundException;
import dbexec.Transaction;
import dbexec.jdbc.tx.JdbcTransaction;
import dbexec.jdbc.tx.JdbcTransactionManager;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorManagerTest {
  private CountingConnectionProvider pool;
  private RecordingMetrics metrics;
  private ExecutorManager manager;
  private JdbcTransaction tx;

  @BeforeEach
  void setUp() throws SQLException {
    pool = new CountingConnectionProvider();
    metrics = new RecordingMetrics();
    manager = new ExecutorManager(pool, new ExecutorConfig().setMetrics(metrics));
    tx = new JdbcTransactionManager(pool).begin();
  }

  @AfterEach
  void tearDown() throws SQLException {
    tx.close();
  }

  @Test
  void emptyContextResolvesToPool() {
    Executor executor = manager.getExecutor(ExecContext.background());

    PoolExecutor poolExecutor = assertInstanceOf(PoolExecutor.class, executor);
    assertSame(pool, poolExecutor.pool());
    assertEquals(manager.getPoolExecutor(), executor);
    assertEquals(List.of(ExecutorKind.POOL), metrics.resolved);
  }

  @Test
  void transactionInContextIsResolved() {
    ExecContext ctx = manager.injectTransaction(ExecContext.background(), tx);

    assertSame(tx, manager.getExecutor(ctx));
    assertEquals(List.of(ExecutorKind.TRANSACTION), metrics.resolved);
  }

  @Test
  void batchTakesPriorityOverTransaction() {
    BatchExecutor batch = manager.newBatch();
    ExecContext txThenBatch = manager.injectBatch(manager.injectTransaction(ExecContext.background(), tx), batch);
    ExecContext batchThenTx = manager.injectTransaction(manager.injectBatch(ExecContext.background(), batch), tx);

    assertSame(batch, manager.getExecutor(txThenBatch));
    assertSame(batch, manager.getExecutor(batchThenTx));
    assertEquals(List.of(ExecutorKind.BATCH, ExecutorKind.BATCH), metrics.resolved);
  }

  @Test
  void injectionDoesNotChangeParent() {
    ExecContext root = ExecContext.background();
    ExecContext child = manager.injectBatch(manager.injectTransaction(root, tx), manager.newBatch());

    assertTrue(manager.extractTransaction(root).isEmpty());
    assertTrue(manager.extractBatch(root).isEmpty());
    assertTrue(manager.extractTransaction(child).isPresent());
    assertInstanceOf(PoolExecutor.class, manager.getExecutor(root));
  }

  @Test
  void nestedScopesResolveIndependently() {
    ExecContext c0 = ExecContext.background();
    ExecContext c1 = manager.injectTransaction(c0, tx);
    BatchExecutor b1 = manager.newBatch();
    ExecContext c2 = manager.injectBatch(c1, b1);

    assertInstanceOf(PoolExecutor.class, manager.getExecutor(c0));
    assertSame(tx, manager.getExecutor(c1));
    assertSame(b1, manager.getExecutor(c2));
    assertSame(tx, manager.getExecutor(c1));
  }

  @Test
  void extractReturnsInjectedInstance() {
    BatchExecutor batch = manager.newBatch();
    ExecContext ctx = manager.injectBatch(manager.injectTransaction(ExecContext.background(), tx), batch);

    assertEquals(Optional.of(tx), manager.extractTransaction(ctx));
    assertEquals(Optional.of(batch), manager.extractBatch(ctx));
  }

  @Test
  void innerTransactionShadowsOuter() throws SQLException {
    try (JdbcTransaction inner = new JdbcTransactionManager(pool).begin()) {
      ExecContext outerCtx = manager.injectTransaction(ExecContext.background(), tx);
      ExecContext innerCtx = manager.injectTransaction(outerCtx, inner);

      assertSame(inner, manager.getExecutor(innerCtx));
      assertSame(tx, manager.getExecutor(outerCtx));
    }
  }

  @Test
  void newBatchIsEmptyAndNotVisible() {
    BatchExecutor first = manager.newBatch();
    BatchExecutor second = manager.newBatch();

    assertEquals(0, first.size());
    assertNotSame(first, second);
    assertNotSame(first.batch(), second.batch());
    assertInstanceOf(PoolExecutor.class, manager.getExecutor(ExecContext.background()));

    first.exec(ExecContext.background(), "DELETE FROM t");
    assertEquals(1, first.size());
    assertEquals(0, second.size());
    assertEquals(0, second.batch().size());
  }

  @Test
  void unrelatedKeysResolveToPool() {
    ExecContext ctx = ExecContext.background()
        .with(ExecContext.Key.of("tenant", String.class), "acme")
        .with(ExecContext.Key.of("dbexec.transaction", Transaction.class), tx)
        .with(ExecContext.Key.of("dbexec.batch", BatchExecutor.class), manager.newBatch());

    assertTrue(manager.extractTransaction(ctx).isEmpty());
    assertTrue(manager.extractBatch(ctx).isEmpty());
    assertInstanceOf(PoolExecutor.class, manager.getExecutor(ctx));
    assertEquals(List.of(ExecutorKind.POOL), metrics.resolved);
  }

  @Test
  void managersShareContextSlots() {
    ExecutorManager other = new ExecutorManager(new CountingConnectionProvider());
    ExecContext ctx = manager.injectTransaction(ExecContext.background(), tx);

    assertSame(tx, other.getExecutor(ctx));
  }

  @Test
  void transactionAccessorReturnsNullWhenAbsent() throws SQLException {
    assertNull(manager.getTransactionExecutor(ExecContext.background()));
  }

  @Test
  void transactionAccessorThrowsWhenPresent() {
    ExecContext ctx = manager.injectTransaction(ExecContext.background(), tx);

    ExecutorNotFoundException ex = assertThrows(ExecutorNotFoundException.class,
        () -> manager.getTransactionExecutor(ctx));
    assertEquals("no transaction found in context", ex.getMessage());
    assertSame(tx, ex.getExecutor());
  }

  @Test
  void batchAccessorReturnsNullWhenAbsent() throws SQLException {
    ExecContext ctx = manager.injectTransaction(ExecContext.background(), tx);
    assertNull(manager.getBatchExecutor(ctx));
  }

  @Test
  void batchAccessorThrowsWhenPresent() {
    BatchExecutor batch = manager.newBatch();
    ExecContext ctx = manager.injectBatch(ExecContext.background(), batch);

    ExecutorNotFoundException ex = assertThrows(ExecutorNotFoundException.class,
        () -> manager.getBatchExecutor(ctx));
    assertEquals("no batch found in context", ex.getMessage());
    assertSame(batch, ex.getExecutor());
  }

  @Test
  void poolExecutorIgnoresContext() {
    ExecContext ctx = manager.injectBatch(manager.injectTransaction(ExecContext.background(), tx),
        manager.newBatch());

    assertInstanceOf(PoolExecutor.class, manager.getPoolExecutor());
    assertNotSame(manager.getExecutor(ctx), manager.getPoolExecutor());
    assertTrue(metrics.resolved.stream().noneMatch(kind -> kind == ExecutorKind.POOL));
  }

  @Test
  void nullArgumentsRejected() {
    assertThrows(NullPointerException.class, () -> new ExecutorManager((javax.sql.DataSource) null));
    assertThrows(NullPointerException.class, () -> manager.injectTransaction(null, tx));
    assertThrows(NullPointerException.class,
        () -> manager.injectTransaction(ExecContext.background(), (Transaction) null));
    assertThrows(NullPointerException.class, () -> manager.getExecutor(null));
  }

  @Test
  void repositoryCodeFollowsTheContext() throws SQLException {
    pool.execute("CREATE TABLE audit (msg VARCHAR(64))");
    ExecContext root = ExecContext.background();

    record(root, "pool");
    assertEquals(1, pool.count("audit"));

    ExecContext txCtx = manager.injectTransaction(root, tx);
    record(txCtx, "in tx");
    assertEquals(1, pool.count("audit"));
    tx.commit();
    assertEquals(2, pool.count("audit"));

    BatchExecutor batch = manager.newBatch();
    ExecContext batchCtx = manager.injectBatch(root, batch);
    record(batchCtx, "batched");
    assertEquals(2, pool.count("audit"));
    manager.getPoolExecutor().sendBatch(root, batch.batch()).close();
    assertEquals(3, pool.count("audit"));
  }

  private void record(ExecContext ctx, String message) throws SQLException {
    manager.getExecutor(ctx).exec(ctx, "INSERT INTO audit (msg) VALUES (?)", message);
  }
}
