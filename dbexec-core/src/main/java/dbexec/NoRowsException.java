package dbexec;

import java.sql.SQLException;

/**
 * Thrown by {@link Row#scan(RowMapper)} when the query returned no rows.
 */
public final class NoRowsException extends SQLException {
  /** SQLSTATE class 02, "no data". */
  public static final String SQL_STATE = "02000";

  public NoRowsException() {
    super("no rows in result set", SQL_STATE);
  }
}
