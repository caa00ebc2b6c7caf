package dbexec.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dbexec.BatchExecutor;
import dbexec.ExecContext;
import dbexec.jdbc.tx.JdbcTransaction;
import dbexec.jdbc.tx.JdbcTransactionManager;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HikariExecutorIntegrationTest {
  private HikariDataSource hikariDs;
  private ExecutorManager manager;
  private JdbcTransactionManager txManager;

  @BeforeEach
  void setup() throws SQLException {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("dbexec-test-pool");
    hikariDs = new HikariDataSource(config);

    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(hikariDs);
    manager = new ExecutorManager(provider);
    txManager = new JdbcTransactionManager(provider);

    ExecContext ctx = ExecContext.background();
    manager.getPoolExecutor().exec(ctx, "CREATE TABLE orders (id INT PRIMARY KEY, worker INT, total INT)");
  }

  @AfterEach
  void teardown() {
    if (hikariDs != null) {
      hikariDs.close();
    }
  }

  @Test
  void concurrentRequestsKeepTheirOwnExecutors() throws Exception {
    int workers = 8;
    int perWorker = 25;
    ExecutorService pool = Executors.newFixedThreadPool(workers);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int w = 0; w < workers; w++) {
        int worker = w;
        futures.add(pool.submit(() -> {
          runRequest(worker, perWorker);
          return null;
        }));
      }
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    ExecContext ctx = ExecContext.background();
    long committed = manager.getExecutor(ctx).queryRow(ctx, "SELECT COUNT(*) FROM orders").scalar(Long.class);
    // odd workers roll back
    assertEquals(workers / 2 * perWorker * 2, committed);
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  private void runRequest(int worker, int perWorker) throws SQLException {
    ExecContext root = ExecContext.background();
    try (JdbcTransaction tx = txManager.begin()) {
      ExecContext txCtx = manager.injectTransaction(root, tx);
      for (int i = 0; i < perWorker; i++) {
        saveOrder(txCtx, worker * 10_000 + i, worker);
      }
      if (worker % 2 == 0) {
        tx.commit();
      }
    }

    BatchExecutor batch = manager.newBatch();
    ExecContext batchCtx = manager.injectBatch(root, batch);
    for (int i = 0; i < perWorker; i++) {
      saveOrder(batchCtx, worker * 10_000 + 5_000 + i, worker);
    }
    if (worker % 2 == 0) {
      manager.getPoolExecutor().sendBatch(root, batch.batch()).close();
    }
  }

  private void saveOrder(ExecContext ctx, int id, int worker) throws SQLException {
    manager.getExecutor(ctx).exec(ctx, "INSERT INTO orders (id, worker, total) VALUES (?, ?, ?)", id, worker, 10);
  }
}
