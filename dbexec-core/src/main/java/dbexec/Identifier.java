package dbexec;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Possibly schema-qualified SQL identifier, e.g. {@code Identifier.of("public", "orders")}.
 *
 * @param parts identifier segments, outermost first
 */
public record Identifier(List<String> parts) {

  public Identifier {
    Objects.requireNonNull(parts, "parts");
    parts = List.copyOf(parts);
    if (parts.isEmpty()) {
      throw new IllegalArgumentException("identifier must have at least one part");
    }
  }

  public static Identifier of(String... parts) {
    return new Identifier(List.of(parts));
  }

  /**
   * Returns the identifier quoted for safe inclusion in SQL text: every part is wrapped in
   * double quotes, embedded quotes are doubled and NUL characters dropped.
   */
  public String sanitize() {
    return parts.stream()
        .map(part -> '"' + part.replace("\u0000", "").replace("\"", "\"\"") + '"')
        .collect(Collectors.joining("."));
  }

  @Override
  public String toString() {
    return sanitize();
  }
}
