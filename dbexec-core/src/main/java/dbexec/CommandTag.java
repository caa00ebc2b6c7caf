package dbexec;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Completion tag of an executed statement: the statement verb and the number of rows it
 * affected, printed the way PostgreSQL reports it ({@code INSERT 0 1}, {@code UPDATE 3},
 * {@code CREATE}).
 *
 * @param command       upper-case leading keyword of the statement, empty when unknown
 * @param rowsAffected  rows inserted, updated, deleted or returned
 */
public record CommandTag(String command, long rowsAffected) {

  /**
   * Tag returned for a statement that was only queued.
   */
  public static final CommandTag QUEUED = new CommandTag("", 0);

  private static final Set<String> COUNTED = Set.of(
      "INSERT", "UPDATE", "DELETE", "SELECT", "MERGE", "MOVE", "FETCH", "COPY");

  public CommandTag {
    Objects.requireNonNull(command, "command");
    if (rowsAffected < 0) {
      throw new IllegalArgumentException("rowsAffected must be >= 0: " + rowsAffected);
    }
  }

  /**
   * Builds a tag from statement text and an update count.
   */
  public static CommandTag of(String sql, long rowsAffected) {
    return new CommandTag(leadingKeyword(sql), Math.max(0, rowsAffected));
  }

  public boolean isInsert() {
    return "INSERT".equals(command);
  }

  public boolean isUpdate() {
    return "UPDATE".equals(command);
  }

  public boolean isDelete() {
    return "DELETE".equals(command);
  }

  public boolean isSelect() {
    return "SELECT".equals(command);
  }

  @Override
  public String toString() {
    if ("INSERT".equals(command)) {
      return "INSERT 0 " + rowsAffected;
    }
    if (COUNTED.contains(command)) {
      return command + " " + rowsAffected;
    }
    return command;
  }

  static String leadingKeyword(String sql) {
    Objects.requireNonNull(sql, "sql");
    int i = 0;
    int n = sql.length();
    while (i < n) {
      char c = sql.charAt(i);
      if (Character.isWhitespace(c) || c == '(') {
        i++;
      } else if (sql.startsWith("--", i)) {
        int eol = sql.indexOf('\n', i);
        i = eol < 0 ? n : eol + 1;
      } else if (sql.startsWith("/*", i)) {
        int end = sql.indexOf("*/", i + 2);
        i = end < 0 ? n : end + 2;
      } else {
        break;
      }
    }
    int start = i;
    while (i < n && Character.isLetter(sql.charAt(i))) {
      i++;
    }
    return sql.substring(start, i).toUpperCase(Locale.ROOT);
  }
}
