package dbexec;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A statement waiting in a {@link Batch}, optionally with a callback that receives its
 * outcome when the batch results are drained by {@link BatchResults#close()}.
 *
 * <p>At most one callback is kept; registering another replaces it.
 */
public final class QueuedStatement {
  private final String sql;
  private final Object[] args;
  private Callback callback;

  QueuedStatement(String sql, Object[] args) {
    this.sql = Objects.requireNonNull(sql, "sql");
    this.args = args == null ? new Object[0] : args.clone();
  }

  public String sql() {
    return sql;
  }

  public List<Object> args() {
    return Collections.unmodifiableList(Arrays.asList(args));
  }

  /**
   * Copy of the arguments, for binding.
   */
  public Object[] argsArray() {
    return args.clone();
  }

  /**
   * Receives the command tag of this statement.
   */
  public QueuedStatement onExec(ExecCallback callback) {
    Objects.requireNonNull(callback, "callback");
    this.callback = results -> callback.accept(results.exec());
    return this;
  }

  /**
   * Receives the rows of this statement; they are closed after the callback returns.
   */
  public QueuedStatement onQuery(RowsCallback callback) {
    Objects.requireNonNull(callback, "callback");
    this.callback = results -> {
      try (Rows rows = results.query()) {
        callback.accept(rows);
      }
    };
    return this;
  }

  /**
   * Receives the single row of this statement.
   */
  public QueuedStatement onQueryRow(RowCallback callback) {
    Objects.requireNonNull(callback, "callback");
    this.callback = results -> callback.accept(results.queryRow());
    return this;
  }

  /**
   * Consumes this statement's outcome from {@code results}: through the registered callback
   * if there is one, otherwise as a plain {@link BatchResults#exec()}.
   */
  public void consume(BatchResults results) throws SQLException {
    if (callback == null) {
      results.exec();
    } else {
      callback.accept(results);
    }
  }

  @Override
  public String toString() {
    return "QueuedStatement[" + sql + "]";
  }

  private interface Callback {
    void accept(BatchResults results) throws SQLException;
  }

  @FunctionalInterface
  public interface ExecCallback {
    void accept(CommandTag tag) throws SQLException;
  }

  @FunctionalInterface
  public interface RowsCallback {
    void accept(Rows rows) throws SQLException;
  }

  @FunctionalInterface
  public interface RowCallback {
    void accept(Row row) throws SQLException;
  }
}
