package ca.gc.cra.curio.domain.catalog;

/**
 * <strong>What:</strong> Item held by the library catalog.
 * <p><strong>Why:</strong> Lets the catalog store books and magazines in one ordered collection while each variant
 * keeps only its own fields.</p>
 * <p><strong>Role:</strong> Domain value owned by {@code Catalog}.</p>
 * <p><strong>Thread-safety:</strong> All permitted variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface CatalogItem permits Book, Magazine {

  /**
   * Returns the variant tag fixed at construction.
   *
   * @return {@code "Book"} or {@code "Magazine"}
   */
  String type();

  /**
   * Returns the item title.
   *
   * @return title text; never {@code null}
   */
  String title();

  /**
   * Renders a single human-readable line describing the item.
   *
   * @return display line without a trailing newline
   */
  String display();
}
