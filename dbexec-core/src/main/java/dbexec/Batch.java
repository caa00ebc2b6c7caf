package dbexec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only queue of statements to be sent together with {@link Executor#sendBatch}.
 *
 * <p>Not thread-safe; a batch belongs to a single request.
 */
public final class Batch {
  private final List<QueuedStatement> statements = new ArrayList<>();

  /**
   * Appends a statement. The arguments are copied.
   *
   * @return the queued statement, for registering a result callback
   */
  public QueuedStatement queue(String sql, Object... args) {
    QueuedStatement statement = new QueuedStatement(sql, args);
    statements.add(statement);
    return statement;
  }

  /**
   * Appends every statement of {@code other}, in order. Appending a batch to itself is a
   * no-op.
   */
  public void appendAll(Batch other) {
    Objects.requireNonNull(other, "other");
    if (other != this) {
      statements.addAll(other.statements);
    }
  }

  public int size() {
    return statements.size();
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  /**
   * Read-only view of the queued statements.
   */
  public List<QueuedStatement> statements() {
    return Collections.unmodifiableList(statements);
  }

  @Override
  public String toString() {
    return "Batch[size=" + statements.size() + "]";
  }
}
