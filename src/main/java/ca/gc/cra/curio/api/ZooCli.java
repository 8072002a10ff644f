package ca.gc.cra.curio.api;

import ca.gc.cra.curio.application.registry.AnimalFactory;
import ca.gc.cra.curio.application.registry.AnimalNotifier;
import ca.gc.cra.curio.application.registry.AnimalRegistry;
import ca.gc.cra.curio.config.DemoConfig;
import ca.gc.cra.curio.config.DemoMode;
import ca.gc.cra.curio.domain.registry.Animal;
import ca.gc.cra.curio.domain.registry.Cat;
import ca.gc.cra.curio.domain.registry.Dog;
import ca.gc.cra.curio.infrastructure.observer.ConsoleAnimalObserver;
import ca.gc.cra.curio.infrastructure.observer.LoggingAnimalObserver;
import ca.gc.cra.curio.validation.Strings;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive zoo demo: register dogs and cats, broadcast additions to observers, and query the registry.
 *
 * <p>After every handled choice a display worker thread prints the registry after the configured delay; the
 * control thread joins it before reading the next choice, so the registry is never read and mutated at once.</p>
 */
public final class ZooCli {
  private static final Logger log = LoggerFactory.getLogger(ZooCli.class);
  private static final int MAX_NAME_LENGTH = 100;
  private static final AtomicInteger WORKER_INDEX = new AtomicInteger();
  private static final String SUMMARY_USAGE =
      "usage: zoo [config=PATH] [displayDelayMs=N] [prompts=true|false] [logLevel=LEVEL] [--verbose]";
  private static final String HELP_TEXT = """
      Curio zoo demo

      Usage:
        zoo [options]

      Optional:
        config=PATH        YAML file with common/zoo sections
        displayDelayMs=N   Delay before the registry listing is printed (default 1000, max 60000)
        prompts=true|false Print the menu and field prompts (default true)
        logLevel=LEVEL     Root log level (default WARN)
        --verbose          Enable DEBUG logging
        --help             Show this message
      """;
  private static final List<String> MENU = List.of(
      "1. Add Dog",
      "2. Add Cat",
      "3. Remove Animals by Type",
      "4. Display Info by Type",
      "5. Sort by Type",
      "6. Show Registry Instances",
      "7. Exit");

  private ZooCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the demo against standard input.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
  }

  /**
   * Runs the demo against the supplied console input.
   *
   * @param args raw CLI arguments
   * @param in line-oriented console input
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args, BufferedReader in) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    DemoCliSupport.ConfigResult resolved =
        DemoCliSupport.resolveConfig(DemoMode.ZOO, input, SUMMARY_USAGE, log);
    if (!resolved.succeeded()) {
      return resolved.failure();
    }

    AnimalNotifier notifier = new AnimalNotifier();
    notifier.addObserver(new ConsoleAnimalObserver(CliPrinter.writer()));
    notifier.addObserver(new LoggingAnimalObserver());

    try (AnimalRegistry registry = new AnimalRegistry()) {
      return loop(registry, notifier, resolved.config(), in);
    } catch (IOException ex) {
      log.error("Failed to read console input", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the display worker");
      return ExitCode.INTERRUPTED;
    }
  }

  private static ExitCode loop(
      AnimalRegistry registry, AnimalNotifier notifier, DemoConfig config, BufferedReader in)
      throws IOException, InterruptedException {
    boolean prompts = config.prompts();
    while (true) {
      if (prompts) {
        CliPrinter.printLines(MENU);
      }
      Integer choice = DemoCliSupport.readChoice(in, prompts);
      if (choice == null) {
        log.debug("End of input; leaving zoo demo");
        return ExitCode.SUCCESS;
      }
      switch (choice) {
        case 1, 2 -> {
          String type = choice == 1 ? Dog.TYPE : Cat.TYPE;
          String name = DemoCliSupport.readField(
              in, prompts, "Enter " + type.toLowerCase(Locale.ROOT) + " name: ");
          if (name == null) {
            return ExitCode.SUCCESS;
          }
          addAnimal(registry, notifier, type, name);
        }
        case 3 -> {
          String tag = DemoCliSupport.readField(in, prompts, "Enter type to remove (Dog/Cat): ");
          if (tag == null) {
            return ExitCode.SUCCESS;
          }
          int removed = registry.removeByType(tag.trim());
          CliPrinter.println("Removed " + removed + " animal(s) of type " + tag.trim());
        }
        case 4 -> {
          String tag = DemoCliSupport.readField(in, prompts, "Enter type to display (Dog/Cat): ");
          if (tag == null) {
            return ExitCode.SUCCESS;
          }
          CliPrinter.printLines(registry.displayInfoByType(tag.trim()));
        }
        case 5 -> {
          registry.sortByType();
          CliPrinter.println("Animals sorted by type.");
        }
        case 6 -> CliPrinter.println("Live registries: " + AnimalRegistry.instanceCount());
        case 7 -> {
          return ExitCode.SUCCESS;
        }
        default -> CliPrinter.println(DemoCliSupport.INVALID_OPTION);
      }
      displayAfterDelay(registry, config.displayDelay());
    }
  }

  private static void addAnimal(AnimalRegistry registry, AnimalNotifier notifier, String type, String name) {
    Animal animal;
    try {
      animal = AnimalFactory.createAnimal(type, Strings.requireMaxLength("name", name, MAX_NAME_LENGTH));
    } catch (IllegalArgumentException ex) {
      log.warn("Rejected zoo input: {}", ex.getMessage());
      CliPrinter.println("Error: " + ex.getMessage());
      return;
    }
    registry.add(animal);
    notifier.notifyObservers(animal);
  }

  /**
   * Starts a worker that prints the registry after {@code delay} and waits for it to finish.
   */
  static void displayAfterDelay(AnimalRegistry registry, Duration delay) throws InterruptedException {
    Thread worker = new Thread(() -> {
      try {
        Thread.sleep(delay.toMillis());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.debug("Display worker interrupted before printing");
        return;
      }
      CliPrinter.println("Registry contents:");
      CliPrinter.printLines(registry.displayAll());
    }, "zoo-display-" + WORKER_INDEX.getAndIncrement());
    worker.setDaemon(true);
    worker.start();
    try {
      worker.join();
    } catch (InterruptedException ex) {
      worker.interrupt();
      throw ex;
    }
  }
}
