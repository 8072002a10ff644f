package ca.gc.cra.curio.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("displayDelayMs", "500", "logLevel", "INFO")),
        Map.of("displayDelayMs", "0"),
        DefaultsForMode.asFlatMap(DemoMode.ZOO),
        warnings::add);

    assertEquals("0", effective.get("displayDelayMs"));
    assertEquals("INFO", effective.get("logLevel"));
    assertEquals("true", effective.get("prompts"));
    assertEquals(List.of("CLI overrides YAML for key: displayDelayMs"), warnings);
  }

  @Test
  void defaultsApplyWithoutOtherSources() {
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), null, DefaultsForMode.asFlatMap(DemoMode.LIBRARY), null);

    assertEquals(DefaultsForMode.asFlatMap(DemoMode.LIBRARY), effective);
  }
}
