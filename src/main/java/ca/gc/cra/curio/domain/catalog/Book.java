package ca.gc.cra.curio.domain.catalog;

import java.util.Objects;

/**
 * Book held by the catalog.
 *
 * @param title book title; never {@code null}
 * @param author author name; never {@code null}
 * @since 0.1.0
 */
public record Book(String title, String author) implements CatalogItem {
  /** Variant tag reported by {@link #type()}. */
  public static final String TYPE = "Book";

  public Book {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(author, "author");
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String display() {
    return "Book: " + title + " by " + author;
  }
}
