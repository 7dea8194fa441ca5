package ca.gc.cra.chronos.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private final StringWriter out = new StringWriter();

  @BeforeEach
  void captureOutput() {
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
  }

  @AfterEach
  void releaseOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(out.toString().startsWith("usage: chronos <reconcile|compare|adjust>"));
  }

  @Test
  void helpFlagPrintsCommandList() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(out.toString().contains("reconcile   Build ticket-labelled drafts"));
  }

  @Test
  void helpCommandPrintsCommandList() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"help"}));
    assertTrue(out.toString().contains("adjust      Plan (and with --apply, apply)"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"book"}));
    assertTrue(out.toString().contains("usage: chronos"));
  }

  @Test
  void commandHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"Compare", "--help"}));
    assertTrue(out.toString().startsWith("chronos compare"));
  }

  @Test
  void exitCodesAreDistinct() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(4, ExitCode.CONFIG_ERROR.code());
  }
}
