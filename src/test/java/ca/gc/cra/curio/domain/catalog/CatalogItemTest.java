package ca.gc.cra.curio.domain.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class CatalogItemTest {
  @Test
  void bookRendersTitleAndAuthor() {
    CatalogItem book = new Book("Dune", "Herbert");
    assertEquals("Book", book.type());
    assertEquals("Book: Dune by Herbert", book.display());
  }

  @Test
  void magazineRendersIssueNumber() {
    CatalogItem magazine = new Magazine("Time", 42);
    assertEquals("Magazine", magazine.type());
    assertEquals("Magazine: Time Issue: 42", magazine.display());
  }

  @Test
  void memberOrdersByName() {
    assertEquals("Member: Ada", new Member("Ada").display());
    assertEquals(-1, Integer.signum(new Member("Ada").compareTo(new Member("Bob"))));
  }

  @Test
  void nullFieldsAreRejected() {
    assertThrows(NullPointerException.class, () -> new Book(null, "x"));
    assertThrows(NullPointerException.class, () -> new Magazine(null, 1));
    assertThrows(NullPointerException.class, () -> new Member(null));
  }
}
