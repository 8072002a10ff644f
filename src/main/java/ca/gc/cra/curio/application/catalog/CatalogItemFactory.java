package ca.gc.cra.curio.application.catalog;

import ca.gc.cra.curio.domain.catalog.Book;
import ca.gc.cra.curio.domain.catalog.CatalogItem;
import ca.gc.cra.curio.domain.catalog.Magazine;

/**
 * <strong>What:</strong> Builds catalog items from a type tag and two text fields.
 * <p><strong>Role:</strong> Factory used by the library CLI before handing items to {@link Catalog}.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CatalogItemFactory {
  /** Tag selecting {@link Book}. */
  public static final String BOOK = "book";
  /** Tag selecting {@link Magazine}. */
  public static final String MAGAZINE = "magazine";

  private CatalogItemFactory() {}

  /**
   * Creates the item variant selected by {@code typeTag}.
   *
   * @param typeTag {@code "book"} or {@code "magazine"} (exact match)
   * @param title item title
   * @param authorOrIssue author for books; decimal issue number for magazines
   * @return new item
   * @throws UnknownItemTypeException if the tag selects no variant
   * @throws ItemParseException if a magazine issue number is not a decimal integer
   */
  public static CatalogItem create(String typeTag, String title, String authorOrIssue) {
    if (BOOK.equals(typeTag)) {
      return new Book(title, authorOrIssue);
    }
    if (MAGAZINE.equals(typeTag)) {
      return new Magazine(title, parseIssue(authorOrIssue));
    }
    throw new UnknownItemTypeException(typeTag);
  }

  private static int parseIssue(String text) {
    try {
      return Integer.parseInt(text == null ? "" : text.trim());
    } catch (NumberFormatException ex) {
      throw new ItemParseException("issue number must be an integer (was '" + text + "')", ex);
    }
  }
}
