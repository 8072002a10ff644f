package ca.gc.cra.curio.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("Dune", Strings.requireNonBlank("title", "  Dune  "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("title", "   "));
    assertEquals("title must not be blank", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("title", "bad\u0001"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("title", null));
  }

  @Test
  void requireMaxLengthRejectsExcessLength() {
    assertEquals("abc", Strings.requireMaxLength("name", " abc ", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireMaxLength("name", "abcd", 3));
  }
}
