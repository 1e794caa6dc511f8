package ca.gc.cra.recstream.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter printed;

  @BeforeEach
  void setUp() {
    printed = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(printed, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(printed.toString().contains("usage: recstream"));
  }

  @Test
  void unknownCommandIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(printed.toString().contains("stages"));
  }

  @Test
  void stagesCommandListsBuiltins() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"stages"}));

    String[] lines = printed.toString().split("\\R");
    assertEquals("eval", lines[0]);
    assertTrue(printed.toString().contains("totable"));
  }
}
