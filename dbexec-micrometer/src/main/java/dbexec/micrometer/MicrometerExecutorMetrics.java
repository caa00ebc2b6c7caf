package dbexec.micrometer;

import dbexec.ExecutorKind;
import dbexec.Operation;
import dbexec.spi.ExecutorMetrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link ExecutorMetrics}.
 *
 * <p>All meters are registered up front so {@link #close()} can remove them again.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dbexec.resolve} (tag {@code kind}): executors handed out by the resolver</li>
 *   <li>{@code dbexec.copy.rows} (tag {@code kind}): rows loaded by {@code copyFrom}</li>
 *   <li>{@code dbexec.batch.statements} (tag {@code kind}): statements submitted in batches</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code dbexec.statement} (tags {@code kind}, {@code operation}, {@code outcome}):
 *       statement execution time</li>
 * </ul>
 *
 * @see ExecutorMetrics
 */
public final class MicrometerExecutorMetrics implements ExecutorMetrics, AutoCloseable {

  private final MeterRegistry registry;
  private final Map<ExecutorKind, Counter> resolved = new EnumMap<>(ExecutorKind.class);
  private final Map<ExecutorKind, Counter> rowsCopied = new EnumMap<>(ExecutorKind.class);
  private final Map<ExecutorKind, Counter> batchStatements = new EnumMap<>(ExecutorKind.class);
  private final Map<ExecutorKind, Map<Operation, Timer>> succeeded = new EnumMap<>(ExecutorKind.class);
  private final Map<ExecutorKind, Map<Operation, Timer>> failed = new EnumMap<>(ExecutorKind.class);
  private final List<Meter> meters = new ArrayList<>();
  private volatile boolean closed;

  /**
   * Creates metrics with the default name prefix {@code "dbexec"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerExecutorMetrics(MeterRegistry registry) {
    this(registry, "dbexec");
  }

  /**
   * Creates metrics with a custom name prefix, for applications with several pools.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.db"})
   */
  public MicrometerExecutorMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    for (ExecutorKind kind : ExecutorKind.values()) {
      resolved.put(kind, track(Counter.builder(namePrefix + ".resolve")
          .description("Executors resolved for a context")
          .tag("kind", kind.tagValue())
          .register(registry)));
      rowsCopied.put(kind, track(Counter.builder(namePrefix + ".copy.rows")
          .description("Rows loaded by copyFrom")
          .tag("kind", kind.tagValue())
          .register(registry)));
      batchStatements.put(kind, track(Counter.builder(namePrefix + ".batch.statements")
          .description("Statements submitted through sendBatch")
          .tag("kind", kind.tagValue())
          .register(registry)));
      succeeded.put(kind, timers(namePrefix, kind, "success"));
      failed.put(kind, timers(namePrefix, kind, "failure"));
    }
  }

  @Override
  public void incrementResolved(ExecutorKind kind) {
    if (closed) return;
    resolved.get(kind).increment();
  }

  @Override
  public void recordStatement(ExecutorKind kind, Operation operation, long durationNanos, boolean failed) {
    if (closed) return;
    Map<ExecutorKind, Map<Operation, Timer>> timers = failed ? this.failed : this.succeeded;
    timers.get(kind).get(operation).record(Math.max(0, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void incrementRowsCopied(ExecutorKind kind, long rows) {
    if (closed) return;
    rowsCopied.get(kind).increment(rows);
  }

  @Override
  public void incrementBatchStatements(ExecutorKind kind, int statements) {
    if (closed) return;
    batchStatements.get(kind).increment(statements);
  }

  /**
   * Removes all meters registered by this instance from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private Map<Operation, Timer> timers(String namePrefix, ExecutorKind kind, String outcome) {
    Map<Operation, Timer> timers = new EnumMap<>(Operation.class);
    for (Operation operation : Operation.values()) {
      timers.put(operation, track(Timer.builder(namePrefix + ".statement")
          .description("Statement execution time")
          .tag("kind", kind.tagValue())
          .tag("operation", operation.tagValue())
          .tag("outcome", outcome)
          .register(registry)));
    }
    return timers;
  }

  private <M extends Meter> M track(M meter) {
    meters.add(meter);
    return meter;
  }
}
