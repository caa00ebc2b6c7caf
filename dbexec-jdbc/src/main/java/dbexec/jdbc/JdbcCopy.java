package dbexec.jdbc;

import dbexec.CopyFromSource;
import dbexec.CopyStatements;
import dbexec.Identifier;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generic JDBC bulk copy: chunked {@code INSERT} batches. On an auto-commit connection the
 * whole copy runs in its own transaction so a failure leaves no rows behind.
 */
final class JdbcCopy {
  private static final Logger logger = Logger.getLogger(JdbcCopy.class.getName());

  private JdbcCopy() {}

  static long copy(Connection connection, Identifier table, List<String> columns,
      CopyFromSource source, int chunkSize, Duration timeout) throws SQLException {
    String insertSql = insertSql(connection, table, columns);
    int columnCount = columns.size();
    boolean implicitTx = connection.getAutoCommit();
    if (implicitTx) {
      connection.setAutoCommit(false);
    }
    long copied;
    try {
      copied = insertAll(connection, insertSql, columnCount, source, chunkSize, timeout);
      if (implicitTx) {
        connection.commit();
      }
    } catch (SQLException | RuntimeException e) {
      if (implicitTx) {
        logger.log(Level.FINE, "Rolling back copy into {0}", insertSql);
        try {
          connection.rollback();
        } catch (SQLException rollbackFailure) {
          e.addSuppressed(rollbackFailure);
        }
        try {
          connection.setAutoCommit(true);
        } catch (SQLException restoreFailure) {
          e.addSuppressed(restoreFailure);
        }
      }
      throw e;
    }
    if (implicitTx) {
      connection.setAutoCommit(true);
    }
    return copied;
  }

  /**
   * Builds the copy {@code INSERT} for this connection's database. Names are folded the way the
   * database folds unquoted identifiers, then quoted, so {@code items} reaches a table created as
   * {@code items} on both upper- and lower-case folding databases, and reserved words still work.
   */
  static String insertSql(Connection connection, Identifier table, List<String> columns)
      throws SQLException {
    DatabaseMetaData metaData = connection.getMetaData();
    UnaryOperator<String> fold;
    if (metaData.storesUpperCaseIdentifiers()) {
      fold = name -> name.toUpperCase(Locale.ROOT);
    } else if (metaData.storesLowerCaseIdentifiers()) {
      fold = name -> name.toLowerCase(Locale.ROOT);
    } else {
      fold = UnaryOperator.identity();
    }
    String quote = metaData.getIdentifierQuoteString();
    if (quote == null || quote.isBlank()) {
      return CopyStatements.insert(table, columns, fold);
    }
    return CopyStatements.insert(table, columns, name -> quote
        + fold.apply(name).replace("\u0000", "").replace(quote, quote + quote) + quote);
  }

  private static long insertAll(Connection connection, String insertSql, int columnCount,
      CopyFromSource source, int chunkSize, Duration timeout) throws SQLException {
    try (PreparedStatement ps = JdbcSupport.prepare(connection, insertSql, timeout)) {
      long copied = 0;
      int pending = 0;
      while (source.next()) {
        JdbcSupport.bindParams(ps, CopyStatements.checkArity(source.values(), columnCount));
        ps.addBatch();
        pending++;
        copied++;
        if (pending == chunkSize) {
          ps.executeBatch();
          pending = 0;
        }
      }
      if (pending > 0) {
        ps.executeBatch();
      }
      return copied;
    }
  }
}
