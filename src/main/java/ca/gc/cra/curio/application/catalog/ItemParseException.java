package ca.gc.cra.curio.application.catalog;

/**
 * Raised when a catalog item field cannot be parsed, such as a non-numeric magazine issue number.
 *
 * @since 0.1.0
 */
public final class ItemParseException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description naming the field and the rejected text
   * @param cause underlying parse failure
   */
  public ItemParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
