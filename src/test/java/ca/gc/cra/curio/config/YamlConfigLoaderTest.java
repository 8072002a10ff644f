package ca.gc.cra.curio.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("curio.yaml");
    Files.writeString(yaml, """
        common:
          logLevel: INFO
          prompts: true
        zoo:
          displayDelayMs: 250
          prompts: false
        library:
          prompts: true
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, DemoMode.ZOO).orElseThrow();

    assertEquals("INFO", map.get("logLevel"));
    assertEquals("250", map.get("displayDelayMs"));
    assertEquals("false", map.get("prompts"));
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        library:
          display:
            sorted: true
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, DemoMode.LIBRARY).orElseThrow();
    assertEquals("true", map.get("display.sorted"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result =
        YamlConfigLoader.load(tempDir.resolve("absent.yaml"), DemoMode.ZOO);
    assertFalse(result.isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");
    assertTrue(YamlConfigLoader.load(yaml, DemoMode.ZOO).orElseThrow().isEmpty());
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path yaml = tempDir.resolve("arrays.yaml");
    Files.writeString(yaml, """
        zoo:
          names: [Rex, Tom]
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, DemoMode.ZOO));
  }

  @Test
  void scalarRootIsRejected() throws IOException {
    Path yaml = tempDir.resolve("scalar.yaml");
    Files.writeString(yaml, "just text\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, DemoMode.LIBRARY));
  }
}
