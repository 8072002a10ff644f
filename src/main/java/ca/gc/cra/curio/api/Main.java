package ca.gc.cra.curio.api;

import ca.gc.cra.curio.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Curio CLI dispatcher that routes to the library or zoo demo.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: curio <library|zoo> [options]";
  private static final String HELP_TEXT = """
      Curio console demos

      Usage:
        curio <command> [options]

      Commands:
        library   In-memory library catalog (library --help for details)
        zoo       In-memory animal registry with observers (zoo --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the demo
      """;

  private Main() {}

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
   * Dispatches a demo and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the demo name)
   * @return exit code reported by the delegated demo
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    CliInput globals = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (globals.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
      delegateArgs = append(delegateArgs, "--verbose");
    }

    return switch (command) {
      case "library" -> LibraryCli.run(delegateArgs);
      case "zoo" -> ZooCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg != null && !arg.isBlank() && !arg.trim().startsWith("-")
          && !arg.trim().equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }

  private static String[] append(String[] args, String extra) {
    String[] copy = Arrays.copyOf(args, args.length + 1);
    copy[args.length] = extra;
    return copy;
  }
}
