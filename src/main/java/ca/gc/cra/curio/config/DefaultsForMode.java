package ca.gc.cra.curio.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each demo.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI overrides.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = Map.of(
      "prompts", "true",
      "logLevel", "WARN");

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested demo merged with common defaults.
   *
   * @param mode target demo
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(DemoMode mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode) {
      case LIBRARY -> Map.of("displayDelayMs", "0");
      case ZOO -> Map.of("displayDelayMs", "1000");
    });
    return Map.copyOf(defaults);
  }
}
