package ca.gc.cra.curio.api;

import ca.gc.cra.curio.config.ConfigMerger;
import ca.gc.cra.curio.config.DefaultsForMode;
import ca.gc.cra.curio.config.DemoConfig;
import ca.gc.cra.curio.config.DemoMode;
import ca.gc.cra.curio.config.YamlConfigLoader;
import ca.gc.cra.curio.logging.LoggingConfigurator;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for the demo CLIs: configuration resolution and line-oriented console input.
 */
final class DemoCliSupport {
  static final String INVALID_OPTION = "Invalid option, please try again.";

  private DemoCliSupport() {
    // Utility class
  }

  /**
   * Resolves the effective configuration from defaults, an optional {@code config=PATH} YAML file, and CLI
   * overrides, then applies the configured log level.
   */
  static ConfigResult resolveConfig(DemoMode mode, CliInput input, String usage, Logger log) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ConfigResult.failed(ExitCode.INVALID_ARGS);
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = kv.remove("config");
    if (configPath != null) {
      Path path = Path.of(configPath);
      if (!Files.exists(path)) {
        log.error("Configuration file does not exist: {}", path);
        CliPrinter.println(usage);
        return ConfigResult.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(path, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return ConfigResult.failed(ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", path, ex);
        return ConfigResult.failed(ExitCode.IO_ERROR);
      }
    }

    DemoConfig config;
    try {
      Map<String, String> effective =
          ConfigMerger.buildEffectiveConfig(yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      config = DemoConfig.fromMap(mode, effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode.sectionName(), ex.getMessage());
      CliPrinter.println(usage);
      return ConfigResult.failed(ExitCode.INVALID_ARGS);
    }

    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} demo", mode.sectionName());
    } else {
      LoggingConfigurator.setRootLevel(config.logLevel());
    }
    log.debug("Effective {} configuration: {}", mode.sectionName(), config);
    return ConfigResult.ok(config);
  }

  /**
   * Reads one menu choice; non-numeric input maps to {@code -1}.
   *
   * @return parsed choice, {@code -1} when invalid, or {@code null} at end of input
   */
  static Integer readChoice(BufferedReader in, boolean prompts) throws IOException {
    String line = readField(in, prompts, "Choose an option: ");
    if (line == null) {
      return null;
    }
    try {
      return Integer.parseInt(line.trim());
    } catch (NumberFormatException ex) {
      return -1;
    }
  }

  /**
   * Prints {@code prompt} when prompts are enabled and reads the next line.
   *
   * @return raw line without terminator, or {@code null} at end of input
   */
  static String readField(BufferedReader in, boolean prompts, String prompt) throws IOException {
    if (prompts) {
      CliPrinter.prompt(prompt);
    }
    return in.readLine();
  }

  record ConfigResult(DemoConfig config, ExitCode failure) {
    static ConfigResult ok(DemoConfig config) {
      return new ConfigResult(config, null);
    }

    static ConfigResult failed(ExitCode failure) {
      return new ConfigResult(null, failure);
    }

    boolean succeeded() {
      return failure == null;
    }
  }
}
