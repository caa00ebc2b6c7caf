package dbexec;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierTest {

  @Test
  void quotesEachPart() {
    assertEquals("\"public\".\"orders\"", Identifier.of("public", "orders").sanitize());
  }

  @Test
  void doublesEmbeddedQuotesAndDropsNul() {
    assertEquals("\"we\"\"ird\"", Identifier.of("we\"i\u0000rd").sanitize());
  }

  @Test
  void emptyIdentifierRejected() {
    assertThrows(IllegalArgumentException.class, () -> new Identifier(List.of()));
  }

  @Test
  void partsAreCopied() {
    ArrayList<String> parts = new ArrayList<>(List.of("t"));
    Identifier id = new Identifier(parts);
    parts.add("u");
    assertEquals(List.of("t"), id.parts());
  }
}
