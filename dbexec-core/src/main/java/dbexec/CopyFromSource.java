package dbexec;

import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Row producer for {@link Executor#copyFrom}.
 *
 * <p>Call {@link #next()} before each {@link #values()}; the copy stops at the first
 * {@code false}. A source may reuse its value array between rows.
 */
public interface CopyFromSource {

  boolean next() throws SQLException;

  /**
   * Values of the current row, in column order.
   *
   * @throws SQLException if the row cannot be produced; the copy fails with it
   */
  Object[] values() throws SQLException;

  /**
   * Source over pre-built rows.
   */
  static CopyFromSource rows(List<Object[]> rows) {
    Objects.requireNonNull(rows, "rows");
    return slice(rows.size(), rows::get);
  }

  /**
   * Source producing {@code length} rows with {@code values}, indexed from 0.
   */
  static CopyFromSource slice(int length, SliceValues values) {
    Objects.requireNonNull(values, "values");
    if (length < 0) {
      throw new IllegalArgumentException("length must be >= 0: " + length);
    }
    return new CopyFromSource() {
      private int index = -1;

      @Override
      public boolean next() {
        if (index + 1 >= length) {
          index = length;
          return false;
        }
        index++;
        return true;
      }

      @Override
      public Object[] values() throws SQLException {
        if (index < 0 || index >= length) {
          throw new IllegalStateException("no current row");
        }
        return values.values(index);
      }
    };
  }

  @FunctionalInterface
  interface SliceValues {
    Object[] values(int index) throws SQLException;
  }
}
