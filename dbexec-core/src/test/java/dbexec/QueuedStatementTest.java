package dbexec;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueuedStatementTest {

  @Test
  void argsArrayIsACopy() {
    QueuedStatement statement = new Batch().queue("INSERT INTO t VALUES (?, ?)", 1, "a");

    Object[] args = statement.argsArray();
    args[0] = 99;

    assertArrayEquals(new Object[] {1, "a"}, statement.argsArray());
    assertEquals(List.of(1, "a"), statement.args());
  }

  @Test
  void withoutCallbackConsumesAsExec() throws SQLException {
    RecordingResults results = new RecordingResults();
    new Batch().queue("DELETE FROM t").consume(results);
    assertEquals(List.of("exec"), results.calls);
  }

  @Test
  void lastRegisteredCallbackWins() throws SQLException {
    RecordingResults results = new RecordingResults();
    List<CommandTag> seen = new ArrayList<>();
    QueuedStatement statement = new Batch().queue("UPDATE t SET a = 1")
        .onQueryRow(row -> fail("replaced"))
        .onExec(seen::add);

    statement.consume(results);

    assertEquals(List.of("exec"), results.calls);
    assertEquals(List.of(new CommandTag("UPDATE", 2)), seen);
  }

  @Test
  void rowCallbackReceivesRow() throws SQLException {
    RecordingResults results = new RecordingResults();
    List<Row> seen = new ArrayList<>();
    new Batch().queue("SELECT 1").onQueryRow(seen::add).consume(results);
    assertEquals(List.of("queryRow"), results.calls);
    assertEquals(1, seen.size());
  }

  private static final class RecordingResults implements BatchResults {
    final List<String> calls = new ArrayList<>();

    @Override
    public CommandTag exec() {
      calls.add("exec");
      return new CommandTag("UPDATE", 2);
    }

    @Override
    public Rows query() throws SQLException {
      calls.add("query");
      throw new SQLException("not used");
    }

    @Override
    public Row queryRow() {
      calls.add("queryRow");
      return Row.failed(new NoRowsException());
    }

    @Override
    public void close() {
    }
  }
}
