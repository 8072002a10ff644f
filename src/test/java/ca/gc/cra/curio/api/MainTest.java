package ca.gc.cra.curio.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("library"));
    assertTrue(buffer.toString().contains("zoo"));
  }

  @Test
  void missingCommandReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: curio"));
  }

  @Test
  void unknownCommandReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"aquarium"}));
    assertTrue(buffer.toString().contains("usage: curio"));
  }

  @Test
  void subcommandHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"zoo", "--help"}));
    assertTrue(buffer.toString().contains("Curio zoo demo"));
  }
}
