package ca.gc.cra.curio.config;

import ca.gc.cra.curio.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Effective settings for one demo run.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param mode demo being run
 * @param displayDelay delay before the zoo worker thread prints the registry; ignored by the library demo
 * @param prompts whether field prompts such as {@code Enter book title:} are printed
 * @param logLevel root log level applied at startup (e.g. {@code WARN})
 * @since 0.1.0
 */
public record DemoConfig(DemoMode mode, Duration displayDelay, boolean prompts, String logLevel) {
  /** Upper bound for {@code displayDelayMs}. */
  public static final long MAX_DISPLAY_DELAY_MS = 60_000L;

  public DemoConfig {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(displayDelay, "displayDelay");
    Objects.requireNonNull(logLevel, "logLevel");
  }

  /**
   * Builds a configuration from a flattened key/value map such as the one produced by {@link ConfigMerger}.
   *
   * @param mode demo being run
   * @param values effective settings; missing keys fall back to {@link DefaultsForMode}
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static DemoConfig fromMap(DemoMode mode, Map<String, String> values) {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);
    long delayMs = Numbers.parseLong("displayDelayMs", value(values, defaults, "displayDelayMs"));
    Numbers.requireRange("displayDelayMs", delayMs, 0, MAX_DISPLAY_DELAY_MS);
    boolean prompts = Boolean.parseBoolean(value(values, defaults, "prompts").trim());
    String logLevel = value(values, defaults, "logLevel").trim();
    return new DemoConfig(mode, Duration.ofMillis(delayMs), prompts, logLevel);
  }

  /**
   * Returns the embedded defaults for a demo.
   *
   * @param mode demo being run
   * @return default configuration
   */
  public static DemoConfig defaults(DemoMode mode) {
    return fromMap(mode, Map.of());
  }

  private static String value(Map<String, String> values, Map<String, String> defaults, String key) {
    String value = values == null ? null : values.get(key);
    if (value == null || value.isBlank()) {
      return defaults.get(key);
    }
    return value;
  }
}
