package ca.gc.cra.chronos.api;

import ca.gc.cra.chronos.application.adjust.AdjustmentApplier;
import ca.gc.cra.chronos.application.adjust.AdjustmentPlanner;
import ca.gc.cra.chronos.application.pipeline.RemoteWorklogCollector;
import ca.gc.cra.chronos.config.ChronosConfig;
import ca.gc.cra.chronos.config.CompositionRoot;
import ca.gc.cra.chronos.domain.adjust.AdjustmentOperation;
import ca.gc.cra.chronos.domain.adjust.AdjustmentOutcome;
import ca.gc.cra.chronos.domain.adjust.AdjustmentPlan;
import ca.gc.cra.chronos.domain.attendance.AttendanceRow;
import ca.gc.cra.chronos.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.chronos.infrastructure.ticketing.FileTicketingAdapter;
import ca.gc.cra.chronos.logging.Logs;
import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plans corrections of booked worklogs per day and, with {@code apply=true}, applies them.
 *
 * @since 0.1.0
 */
public final class AdjustCli {
  private static final Logger log = LoggerFactory.getLogger(AdjustCli.class);
  private static final String SUMMARY_USAGE =
      "usage: adjust [config=PATH] accountId=ID attendanceFile=PATH ticketingFile=PATH [from=DATE] [to=DATE] "
          + "[--apply] [--verbose]";
  private static final String HELP_TEXT = """
      chronos adjust

      Usage:
        adjust config=chronos.yaml [key=value ...] [--apply]

      Required:
        accountId=ID              Ticketing author id
        attendanceFile=PATH       Attendance rows (JSON)
        ticketingFile=PATH        Ticketing export (JSON)

      Optional:
        from=DATE to=DATE         Days planned (default: attendance range)
        zone=ZONE                 Local zone (default system zone)
        --apply                   Apply the plans and save the ticketing file
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private AdjustCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return CommandSupport.run("adjust", args, SUMMARY_USAGE, HELP_TEXT, List.of("apply"), AdjustCli::execute);
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
        CliPrinter.println("No days to adjust");
        return ExitCode.SUCCESS;
      }
      RemoteWorklogCollector.Collected remote =
          root.remoteWorklogCollector().collect(config.accountId(), dates.first(), dates.last());
      AdjustmentPlanner planner = new AdjustmentPlanner();
      AdjustmentApplier applier = config.apply() ? root.adjustmentApplier() : null;
      int failed = 0;
      for (LocalDate date : dates) {
        List<AttendanceRow> dayRows = rows.stream().filter(r -> r.date().equals(date)).toList();
        AdjustmentPlan plan = planner.generatePlan(date, dayRows, remote.byDay().getOrDefault(date, List.of()));
        if (!plan.hasChanges()) {
          continue;
        }
        CliPrinter.printf("%s (pause %s, booked gaps %s)", date,
            Logs.minutes(plan.groundTruthPause()), Logs.minutes(plan.remotePause()));
        for (AdjustmentOperation operation : plan.operations()) {
          CliPrinter.println("  " + operation.description());
        }
        if (applier != null) {
          for (AdjustmentOutcome outcome : applier.apply(plan)) {
            if (!outcome.succeeded()) {
              failed++;
              CliPrinter.printf("  %s %s: %s", outcome.status(), outcome.operation().description(), outcome.message());
            }
          }
        }
      }
      if (applier != null) {
        FileTicketingAdapter ticketing = root.ticketing().orElseThrow();
        if (ticketing.isDirty()) {
          ticketing.save();
        }
        CliPrinter.printf("Applied plans; %d operations did not complete", failed);
      }
      return ExitCode.SUCCESS;
    }
  }
}
