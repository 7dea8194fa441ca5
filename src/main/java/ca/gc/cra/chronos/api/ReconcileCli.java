package ca.gc.cra.chronos.api;

import ca.gc.cra.chronos.application.pipeline.ReconciliationReport;
import ca.gc.cra.chronos.application.pipeline.UnitOutcome;
import ca.gc.cra.chronos.application.pipeline.WorklogSubmissionUseCase;
import ca.gc.cra.chronos.config.ChronosConfig;
import ca.gc.cra.chronos.config.CompositionRoot;
import ca.gc.cra.chronos.domain.worklog.DraftSegment;
import ca.gc.cra.chronos.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.chronos.infrastructure.ticketing.FileTicketingAdapter;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a reconciliation pass and prints the classified drafts; books new drafts when {@code submit=true}.
 *
 * @since 0.1.0
 */
public final class ReconcileCli {
  private static final Logger log = LoggerFactory.getLogger(ReconcileCli.class);
  private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");
  private static final String SUMMARY_USAGE =
      "usage: reconcile [config=PATH] selfEmail=ADDR meetingTicket=KEY attendanceFile=PATH calendarFile=PATH "
          + "[commitsFile=PATH commitProjects=A,B] [ticketingFile=PATH accountId=ID] [from=DATE] [to=DATE] "
          + "[--submit] [--verbose]";
  private static final String HELP_TEXT = """
      chronos reconcile

      Usage:
        reconcile config=chronos.yaml [key=value ...] [--submit]

      Required:
        selfEmail=ADDR            Identity whose calendar participation counts
        meetingTicket=KEY         Ticket meetings are booked on when no rule matches
        attendanceFile=PATH       Attendance rows (JSON)
        calendarFile=PATH         Calendar export (.ics)

      Optional:
        commitsFile=PATH          Recorded commit pages (JSON); required with commitProjects
        commitProjects=A,B        Projects whose commits route work time
        authorEmails=A,B          Commit author filter (default selfEmail)
        lookbackDays=N            Commit history before the first day (default 30)
        ticketingFile=PATH        Ticketing export (JSON); enables summaries and classification
        accountId=ID              Ticketing author id; required with ticketingFile
        from=DATE to=DATE         Attendance days considered (ISO dates, inclusive)
        zone=ZONE                 Local zone (default system zone)
        --submit                  Book NEW and OVERLAP drafts and save the ticketing file
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ReconcileCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return CommandSupport.run("reconcile", args, SUMMARY_USAGE, HELP_TEXT, List.of("submit"), ReconcileCli::execute);
  }

  private static ExitCode execute(ChronosConfig config) throws IOException {
    List<String> problems = new ArrayList<>();
    if (!config.validateForPass(problems::add)) {
      problems.forEach(p -> log.error("Configuration incomplete: {}", p));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      ReconciliationReport report = root.reconciliationUseCase().run(config, root.attendanceRows());
      if (!report.configurationValid()) {
        report.configurationProblems().forEach(p -> log.error("Configuration incomplete: {}", p));
        return ExitCode.CONFIG_ERROR;
      }
      print(report);
      if (config.submit()) {
        WorklogSubmissionUseCase.Result result = root.submissionUseCase().submit(report.allDrafts());
        FileTicketingAdapter ticketing = root.ticketing().orElseThrow();
        if (ticketing.isDirty()) {
          ticketing.save();
        }
        CliPrinter.printf("Submitted: %d created, %d failed, %d duplicates skipped",
            result.created(), result.failed(), result.skipped());
      }
      return ExitCode.SUCCESS;
    }
  }

  private static void print(ReconciliationReport report) {
    for (Map.Entry<LocalDate, List<DraftSegment>> day : report.draftsByDay().entrySet()) {
      CliPrinter.println(day.getKey().toString());
      for (DraftSegment draft : day.getValue()) {
        CliPrinter.printf("  %s-%s  %-10s %-9s %s",
            HH_MM.format(draft.interval().start()),
            HH_MM.format(draft.interval().end()),
            draft.ticketKey(),
            draft.state(),
            draft.label());
      }
    }
    for (UnitOutcome failed : report.failedUnits()) {
      CliPrinter.printf("FAILED %s: %s", failed.unit(), failed.message());
    }
  }
}
