package ca.gc.cra.curio.application.registry;

/**
 * Raised when an animal is requested with a type tag that matches no known variant.
 *
 * @since 0.1.0
 */
public final class UnknownAnimalTypeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String typeTag;

  /**
   * Creates the exception for the rejected tag.
   *
   * @param typeTag tag supplied by the caller; may be {@code null}
   */
  public UnknownAnimalTypeException(String typeTag) {
    super("Unknown animal type: " + typeTag);
    this.typeTag = typeTag;
  }

  public String typeTag() {
    return typeTag;
  }
}
