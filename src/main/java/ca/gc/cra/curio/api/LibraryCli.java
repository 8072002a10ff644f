package ca.gc.cra.curio.api;

import ca.gc.cra.curio.application.catalog.Catalog;
import ca.gc.cra.curio.application.catalog.CatalogItemFactory;
import ca.gc.cra.curio.config.DemoConfig;
import ca.gc.cra.curio.config.DemoMode;
import ca.gc.cra.curio.domain.catalog.Member;
import ca.gc.cra.curio.validation.Strings;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive library catalog demo: add books, magazines, and members, then list them.
 */
public final class LibraryCli {
  private static final Logger log = LoggerFactory.getLogger(LibraryCli.class);
  private static final int MAX_FIELD_LENGTH = 200;
  private static final String SUMMARY_USAGE =
      "usage: library [config=PATH] [prompts=true|false] [logLevel=LEVEL] [--verbose]";
  private static final String HELP_TEXT = """
      Curio library demo

      Usage:
        library [options]

      Optional:
        config=PATH        YAML file with common/library sections
        prompts=true|false Print the menu and field prompts (default true)
        logLevel=LEVEL     Root log level (default WARN)
        --verbose          Enable DEBUG logging
        --help             Show this message
      """;
  private static final List<String> MENU = List.of(
      "1. Add Book",
      "2. Add Magazine",
      "3. Add Member",
      "4. Display Items",
      "5. Display Members",
      "6. Display Members (sorted)",
      "7. Exit");

  private LibraryCli() {}

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
        DemoCliSupport.resolveConfig(DemoMode.LIBRARY, input, SUMMARY_USAGE, log);
    if (!resolved.succeeded()) {
      return resolved.failure();
    }

    try {
      return loop(new Catalog(), resolved.config(), in);
    } catch (IOException ex) {
      log.error("Failed to read console input", ex);
      return ExitCode.IO_ERROR;
    }
  }

  private static ExitCode loop(Catalog catalog, DemoConfig config, BufferedReader in) throws IOException {
    boolean prompts = config.prompts();
    while (true) {
      if (prompts) {
        CliPrinter.printLines(MENU);
      }
      Integer choice = DemoCliSupport.readChoice(in, prompts);
      if (choice == null) {
        log.debug("End of input; leaving library demo");
        return ExitCode.SUCCESS;
      }
      switch (choice) {
        case 1 -> {
          String title = DemoCliSupport.readField(in, prompts, "Enter book title: ");
          String author = DemoCliSupport.readField(in, prompts, "Enter book author: ");
          if (!addItem(catalog, CatalogItemFactory.BOOK, title, author)) {
            return ExitCode.SUCCESS;
          }
        }
        case 2 -> {
          String title = DemoCliSupport.readField(in, prompts, "Enter magazine title: ");
          String issue = DemoCliSupport.readField(in, prompts, "Enter magazine issue number: ");
          if (!addItem(catalog, CatalogItemFactory.MAGAZINE, title, issue)) {
            return ExitCode.SUCCESS;
          }
        }
        case 3 -> {
          String name = DemoCliSupport.readField(in, prompts, "Enter member name: ");
          if (name == null) {
            return ExitCode.SUCCESS;
          }
          try {
            catalog.addMember(new Member(Strings.requireMaxLength("member name", name, MAX_FIELD_LENGTH)));
          } catch (IllegalArgumentException ex) {
            reportRejected(ex);
          }
        }
        case 4 -> CliPrinter.printLines(catalog.displayItems().toList());
        case 5 -> CliPrinter.printLines(catalog.displayMembers().toList());
        case 6 -> CliPrinter.printLines(catalog.displayMembersSorted());
        case 7 -> {
          return ExitCode.SUCCESS;
        }
        default -> CliPrinter.println(DemoCliSupport.INVALID_OPTION);
      }
    }
  }

  /**
   * Builds and stores an item. Returns {@code false} when input ended before both fields were read.
   */
  private static boolean addItem(Catalog catalog, String type, String title, String second) {
    if (title == null || second == null) {
      return false;
    }
    try {
      String cleanTitle = Strings.requireMaxLength("title", title, MAX_FIELD_LENGTH);
      String cleanSecond = Strings.requireMaxLength(
          CatalogItemFactory.BOOK.equals(type) ? "author" : "issue number", second, MAX_FIELD_LENGTH);
      catalog.addItem(CatalogItemFactory.create(type, cleanTitle, cleanSecond));
    } catch (IllegalArgumentException ex) {
      reportRejected(ex);
    }
    return true;
  }

  private static void reportRejected(IllegalArgumentException ex) {
    log.warn("Rejected library input: {}", ex.getMessage());
    CliPrinter.println("Error: " + ex.getMessage());
  }
}
