package dbexec;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, request-scoped carrier of values that deeply nested code can discover without
 * threading them through every signature.
 *
 * <p>Each {@link #with(Key, Object)} returns a new context that shadows the parent for that
 * key only; the parent and its other children are never affected. Lookups walk from the
 * nearest scope outwards, so the most recently injected value wins.
 *
 * <pre>{@code
 * ExecContext root = ExecContext.background();
 * ExecContext scoped = root.with(TENANT, "acme").withTimeout(Duration.ofSeconds(5));
 * scoped.get(TENANT);  // Optional[acme]
 * root.get(TENANT);    // Optional.empty
 * }</pre>
 *
 * <p>Instances are safe to share between threads.
 */
public final class ExecContext {
  private static final ExecContext BACKGROUND = new ExecContext(null, null, null);
  private static final Key<Duration> TIMEOUT = Key.of("timeout", Duration.class);

  private final ExecContext parent;
  private final Key<?> key;
  private final Object value;

  private ExecContext(ExecContext parent, Key<?> key, Object value) {
    this.parent = parent;
    this.key = key;
    this.value = value;
  }

  /**
   * Returns the empty root context.
   */
  public static ExecContext background() {
    return BACKGROUND;
  }

  /**
   * Returns a child context carrying {@code value} under {@code key}.
   *
   * @throws NullPointerException if key or value is null
   */
  public <T> ExecContext with(Key<T> key, T value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    return new ExecContext(this, key, value);
  }

  /**
   * Looks up the value nearest to this scope.
   *
   * <p>A value stored under the key that is not an instance of the key's type is reported
   * as absent.
   */
  public <T> Optional<T> get(Key<T> key) {
    Objects.requireNonNull(key, "key");
    for (ExecContext ctx = this; ctx != null; ctx = ctx.parent) {
      if (ctx.key == key) {
        return key.type.isInstance(ctx.value)
            ? Optional.of(key.type.cast(ctx.value))
            : Optional.empty();
      }
    }
    return Optional.empty();
  }

  /**
   * Returns a child context with a statement timeout. Executors apply it as the JDBC
   * query timeout (rounded up to whole seconds).
   *
   * @throws IllegalArgumentException if the timeout is zero or negative
   */
  public ExecContext withTimeout(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive: " + timeout);
    }
    return with(TIMEOUT, timeout);
  }

  public Optional<Duration> timeout() {
    return get(TIMEOUT);
  }

  @Override
  public String toString() {
    if (this == BACKGROUND) {
      return "ExecContext.background";
    }
    return parent + ".with(" + key + ")";
  }

  /**
   * Typed slot identifier. Keys compare by identity, so a key kept private to its owner
   * cannot collide with any other value in the context.
   */
  public static final class Key<T> {
    private final String name;
    private final Class<T> type;

    private Key(String name, Class<T> type) {
      this.name = Objects.requireNonNull(name, "name");
      this.type = Objects.requireNonNull(type, "type");
    }

    public static <T> Key<T> of(String name, Class<T> type) {
      return new Key<>(name, type);
    }

    public String name() {
      return name;
    }

    public Class<T> type() {
      return type;
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
