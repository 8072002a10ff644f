package ca.gc.cra.curio.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Minimal console output helper for menus, prompts, and listings.
 *
 * <p>Uses native file descriptors in order to avoid direct {@code System.out} references while
 * preserving simple stdout writes that play nicely with logging configurations.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout using the shared CLI writer.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints zero or more lines to stdout using the shared CLI writer.
   *
   * @param lines lines to emit
   */
  public static void printLines(Iterable<String> lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  /**
   * Prints a prompt without a line terminator and flushes so it is visible before input is read.
   *
   * @param prompt prompt text such as {@code "Choose an option: "}
   */
  public static void prompt(String prompt) {
    PrintWriter writer = writer();
    writer.print(prompt);
    writer.flush();
  }

  /**
   * Overrides the CLI writer for tests.
   *
   * @param writer writer to use during the test
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  /**
   * Clears any test writer override.
   */
  static void clearTestWriter() {
    override = null;
  }

  /**
   * Resolves the active writer, preferring a test override.
   *
   * @return writer used for CLI output
   */
  static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
