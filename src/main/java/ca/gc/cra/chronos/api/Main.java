package ca.gc.cra.chronos.api;

import ca.gc.cra.chronos.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * chronos command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: chronos <reconcile|compare|adjust> [options]";
  private static final String HELP_TEXT = """
      chronos command dispatcher

      Usage:
        chronos <command> [key=value ...] [flags]

      Commands:
        reconcile   Build ticket-labelled drafts from attendance, calendar and commits
        compare     Report differences between attendance and booked worklogs
        adjust      Plan (and with --apply, apply) corrections of booked worklogs

      Global flags:
        --help      Show this message (or the command's help after the command)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    String[] safe = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safe.length; i++) {
      if (safe[i] != null && !safe[i].isBlank() && !safe[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safe);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (CliInput.parse(Arrays.copyOfRange(safe, 0, commandIndex)).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String command = safe[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safe, commandIndex + 1, safe.length);
    return switch (command) {
      case "reconcile" -> ReconcileCli.run(delegateArgs);
      case "compare" -> CompareCli.run(delegateArgs);
      case "adjust" -> AdjustCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
