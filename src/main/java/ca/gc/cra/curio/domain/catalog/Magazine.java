package ca.gc.cra.curio.domain.catalog;

import java.util.Objects;

/**
 * Magazine issue held by the catalog.
 *
 * @param title magazine title; never {@code null}
 * @param issueNumber issue number as printed on the cover
 * @since 0.1.0
 */
public record Magazine(String title, int issueNumber) implements CatalogItem {
  /** Variant tag reported by {@link #type()}. */
  public static final String TYPE = "Magazine";

  public Magazine {
    Objects.requireNonNull(title, "title");
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String display() {
    return "Magazine: " + title + " Issue: " + issueNumber;
  }
}
