package ca.gc.cra.chronos.api;

import ca.gc.cra.chronos.application.compare.TimeComparator;
import ca.gc.cra.chronos.application.pipeline.RemoteWorklogCollector;
import ca.gc.cra.chronos.config.ChronosConfig;
import ca.gc.cra.chronos.config.CompositionRoot;
import ca.gc.cra.chronos.domain.attendance.AttendanceRow;
import ca.gc.cra.chronos.domain.compare.DayComparison;
import ca.gc.cra.chronos.domain.compare.TimeDifference;
import ca.gc.cra.chronos.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.chronos.logging.Logs;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares attendance with booked worklogs and prints the differences per day.
 *
 * @since 0.1.0
 */
public final class CompareCli {
  private static final Logger log = LoggerFactory.getLogger(CompareCli.class);
  private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");
  private static final String SUMMARY_USAGE =
      "usage: compare [config=PATH] accountId=ID attendanceFile=PATH ticketingFile=PATH [from=DATE] [to=DATE] "
          + "[--outlierMode] [--verbose]";
  private static final String HELP_TEXT = """
      chronos compare

      Usage:
        compare config=chronos.yaml [key=value ...] [--outlierMode]

      Required:
        accountId=ID              Ticketing author id
        attendanceFile=PATH       Attendance rows (JSON)
        ticketingFile=PATH        Ticketing export (JSON)

      Optional:
        from=DATE to=DATE         Days compared (default: attendance range)
        zone=ZONE                 Local zone (default system zone)
        --outlierMode             Report individual bookings outside attendance
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private CompareCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return CommandSupport.run("compare", args, SUMMARY_USAGE, HELP_TEXT, List.of("outlierMode"), CompareCli::execute);
  }

  private static ExitCode execute(ChronosConfig config) throws IOException {
    List<String> problems = new ArrayList<>();
    if (!config.validateForRemoteComparison(problems::add)) {
      problems.forEach(p -> log.error("Configuration incomplete: {}", p));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      List<AttendanceRow> rows = root.attendanceRows();
      TreeSet<LocalDate> dates = DateRange.of(config, rows);
      if (dates.isEmpty()) {
        CliPrinter.println("No days to compare");
        return ExitCode.SUCCESS;
      }
      RemoteWorklogCollector.Collected remote =
          root.remoteWorklogCollector().collect(config.accountId(), dates.first(), dates.last());
      List<DayComparison> results =
          new TimeComparator().compare(rows, remote.byDay(), dates, config.outlierMode());
      results.forEach(CompareCli::print);
      remote.outcomes().stream().filter(o -> !o.ok())
          .forEach(o -> CliPrinter.printf("FAILED %s: %s", o.unit(), o.message()));
      return ExitCode.SUCCESS;
    }
  }

  private static void print(DayComparison day) {
    String status = day.allGood() ? "OK" : day.remoteOnly() ? "REMOTE ONLY" : day.localOnly() ? "LOCAL ONLY" : "";
    CliPrinter.printf("%s %s (pause %s, paid non-work %s, booked gaps %s)", day.date(), status,
        Logs.minutes(day.groundTruthPause()), Logs.minutes(day.paidNonWork()), Logs.minutes(day.remotePause()));
    for (TimeDifference difference : day.differences()) {
      String line = String.format("  %-20s %s -> %s %s %s", difference.type(),
          describe(difference, true), describe(difference, false), difference.ticketKey(), difference.details());
      CliPrinter.println(line.stripTrailing());
    }
  }

  private static String describe(TimeDifference difference, boolean groundTruth) {
    if (groundTruth) {
      if (difference.groundTruthTime() != null) {
        return HH_MM.format(difference.groundTruthTime());
      }
      return difference.groundTruthDuration() == null ? "-" : Logs.minutes(difference.groundTruthDuration());
    }
    if (difference.remoteTime() != null) {
      return HH_MM.format(difference.remoteTime());
    }
    return difference.remoteDuration() == null ? "-" : Logs.minutes(difference.remoteDuration());
  }
}
