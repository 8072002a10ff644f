package ca.gc.cra.curio.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the demo command-line tools.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including the menu's Exit option and end of input. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while reading configuration or console input. */
  IO_ERROR(3),
  /** Process was interrupted while waiting on the display worker. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
