package dbexec;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CopyStatementsTest {

  @Test
  void buildsQuotedInsert() {
    String sql = CopyStatements.insert(Identifier.of("items"), List.of("id", "name"));
    assertEquals("INSERT INTO \"items\" (\"id\", \"name\") VALUES (?, ?)", sql);
  }

  @Test
  void rendersEveryNameThroughQuote() {
    String sql = CopyStatements.insert(Identifier.of("public", "items"), List.of("id", "name"),
        name -> "[" + name + "]");
    assertEquals("INSERT INTO [public].[items] ([id], [name]) VALUES (?, ?)", sql);
  }

  @Test
  void noColumnsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> CopyStatements.insert(Identifier.of("items"), List.of()));
  }

  @Test
  void arityMismatchReported() {
    SQLException ex = assertThrows(SQLException.class,
        () -> CopyStatements.checkArity(new Object[] {1}, 2));
    assertEquals("expected 2 values, got 1", ex.getMessage());
  }

  @Test
  void sliceSourceYieldsEachIndex() throws SQLException {
    CopyFromSource source = CopyFromSource.slice(2, i -> new Object[] {i});
    assertTrue(source.next());
    assertArrayEquals(new Object[] {0}, source.values());
    assertTrue(source.next());
    assertArrayEquals(new Object[] {1}, source.values());
    assertFalse(source.next());
    assertFalse(source.next());
  }
}
