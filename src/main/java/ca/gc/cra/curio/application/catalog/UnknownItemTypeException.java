package ca.gc.cra.curio.application.catalog;

/**
 * Raised when a catalog item is requested with a type tag that matches no known variant.
 *
 * @since 0.1.0
 */
public final class UnknownItemTypeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String typeTag;

  /**
   * Creates the exception for the rejected tag.
   *
   * @param typeTag tag supplied by the caller; may be {@code null}
   */
  public UnknownItemTypeException(String typeTag) {
    super("Unknown library item type: " + typeTag);
    this.typeTag = typeTag;
  }

  /**
   * Returns the rejected tag.
   *
   * @return tag as supplied
   */
  public String typeTag() {
    return typeTag;
  }
}
