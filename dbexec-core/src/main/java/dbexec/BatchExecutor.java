package dbexec;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.List;
import java.util.Objects;

/**
 * {@link Executor} that queues statements into a {@link Batch} instead of running them.
 *
 * <p>When a batch executor is present in the context, repositories write into the batch
 * transparently; the code that injected it sends the batch once all work is queued:
 * <pre>{@code
 * BatchExecutor batch = manager.newBatch();
 * ExecContext ctx = manager.injectBatch(parent, batch);
 * orders.save(ctx, order);          // queued
 * audit.record(ctx, "order saved"); // queued
 * try (BatchResults results = manager.getPoolExecutor().sendBatch(parent, batch.batch())) {
 *     // read results or just close
 * }
 * }</pre>
 *
 * <p>Only {@code exec} and {@code copyFrom} have a queued meaning. Rows cannot exist before
 * the batch is sent, so {@code query} and {@code queryRow} fail; register an
 * {@link QueuedStatement#onQuery} callback on {@link #batch()} instead.
 */
public final class BatchExecutor implements Executor {
  private final Batch batch;

  public BatchExecutor() {
    this(new Batch());
  }

  public BatchExecutor(Batch batch) {
    this.batch = Objects.requireNonNull(batch, "batch");
  }

  /**
   * The queue this executor appends to.
   */
  public Batch batch() {
    return batch;
  }

  public int size() {
    return batch.size();
  }

  /**
   * Queues the statement and returns {@link CommandTag#QUEUED}.
   */
  @Override
  public CommandTag exec(ExecContext ctx, String sql, Object... args) {
    batch.queue(sql, args);
    return CommandTag.QUEUED;
  }

  @Override
  public Rows query(ExecContext ctx, String sql, Object... args) throws SQLException {
    throw rowsNotAvailable();
  }

  @Override
  public Row queryRow(ExecContext ctx, String sql, Object... args) {
    return Row.failed(rowsNotAvailable());
  }

  /**
   * Appends the statements of {@code other} to this batch. The returned results cannot be
   * read because nothing has been sent yet; closing them does nothing.
   */
  @Override
  public BatchResults sendBatch(ExecContext ctx, Batch other) {
    batch.appendAll(other);
    return new PendingResults();
  }

  /**
   * Queues one {@code INSERT} per source row.
   *
   * @return number of rows queued
   */
  @Override
  public long copyFrom(ExecContext ctx, Identifier table, List<String> columns, CopyFromSource source)
      throws SQLException {
    Objects.requireNonNull(source, "source");
    String sql = CopyStatements.insert(table, columns);
    long queued = 0;
    while (source.next()) {
      batch.queue(sql, CopyStatements.checkArity(source.values(), columns.size()));
      queued++;
    }
    return queued;
  }

  @Override
  public String toString() {
    return "BatchExecutor[size=" + batch.size() + "]";
  }

  private static SQLException rowsNotAvailable() {
    return new SQLFeatureNotSupportedException("rows are not available until the batch is sent");
  }

  private static final class PendingResults implements BatchResults {
    @Override
    public CommandTag exec() throws SQLException {
      throw notSent();
    }

    @Override
    public Rows query() throws SQLException {
      throw notSent();
    }

    @Override
    public Row queryRow() {
      return Row.failed(notSent());
    }

    @Override
    public void close() {
    }

    private static SQLException notSent() {
      return new SQLException("statements were appended to a pending batch and have not been sent");
    }
  }
}
