package ca.gc.cra.chronos.application.pipeline;

import ca.gc.cra.chronos.application.attendance.WorkWindowBuilder;
import ca.gc.cra.chronos.application.attendance.WorkWindowBuilder.DayWindows;
import ca.gc.cra.chronos.application.calendar.CalendarNormalizer;
import ca.gc.cra.chronos.application.delta.DeltaClassifier;
import ca.gc.cra.chronos.application.port.ClockPort;
import ca.gc.cra.chronos.application.port.CommitHistoryPort;
import ca.gc.cra.chronos.application.port.MetricsPort;
import ca.gc.cra.chronos.application.port.TicketingPort;
import ca.gc.cra.chronos.application.segment.SegmentationResult;
import ca.gc.cra.chronos.application.segment.Segmenter;
import ca.gc.cra.chronos.config.ChronosConfig;
import ca.gc.cra.chronos.domain.attendance.AttendanceDay;
import ca.gc.cra.chronos.domain.attendance.AttendanceRow;
import ca.gc.cra.chronos.domain.calendar.MeetingEvent;
import ca.gc.cra.chronos.domain.commit.CommitRecord;
import ca.gc.cra.chronos.domain.commit.TicketTimeline;
import ca.gc.cra.chronos.domain.worklog.DraftSegment;
import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import ca.gc.cra.chronos.logging.Logs;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one reconciliation pass from attendance rows to classified drafts.
 * <p><strong>Why:</strong> Ties calendar, commit history, attendance and booked worklogs together into the
 * drafts a user books.</p>
 * <p><strong>Role:</strong> Application-layer use case driven by {@code ReconcileCli}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Refuse to run when identities or sources are missing.</li>
 *   <li>Fetch commit history per project and build one ticket timeline.</li>
 *   <li>Segment every attendance day in range.</li>
 *   <li>Label work drafts with ticket summaries and classify all drafts against booked worklogs.</li>
 * </ul>
 * <p>Every external call is one unit of work: a failure is logged, recorded as a failed {@link UnitOutcome}
 * and the pass continues.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the calendar caches are mutated by the pass.</p>
 * <p><strong>Observability:</strong> Emits {@code reconcile.unit.succeeded}, {@code reconcile.unit.failed},
 * {@code reconcile.draft.created} and {@code reconcile.pass.millis}; log lines carry the day in the MDC key
 * {@code day}.</p>
 *
 * @since 0.1.0
 */
public final class ReconciliationUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReconciliationUseCase.class);
  static final int SUMMARY_BATCH_SIZE = 50;
  static final String SUMMARY_SEPARATOR = " – ";
  private static final int COMMIT_LOG_BYTES = 80;

  private final CalendarNormalizer calendar;
  private final CommitHistoryPort commits;
  private final TicketingPort ticketing;
  private final Segmenter segmenter;
  private final WorkWindowBuilder windowBuilder = new WorkWindowBuilder();
  private final DeltaClassifier classifier = new DeltaClassifier();
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * @param calendar normalized calendar
   * @param commits commit history source
   * @param ticketing ticketing system; {@code null} skips summaries and classification
   * @param segmenter day segmenter
   * @param metrics metrics sink; {@code null} means no-op
   * @param clock clock timing the pass; {@code null} means system clock
   */
  public ReconciliationUseCase(
      CalendarNormalizer calendar,
      CommitHistoryPort commits,
      TicketingPort ticketing,
      Segmenter segmenter,
      MetricsPort metrics,
      ClockPort clock) {
    this.calendar = Objects.requireNonNull(calendar, "calendar");
    this.commits = Objects.requireNonNull(commits, "commits");
    this.ticketing = ticketing;
    this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  /**
   * Runs the pass.
   *
   * @param config validated settings
   * @param rows attendance rows of any number of days
   * @return drafts, unit outcomes and trace; no drafts when the configuration is incomplete
   */
  public ReconciliationReport run(ChronosConfig config, List<AttendanceRow> rows) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(rows, "rows");
    List<String> problems = new ArrayList<>();
    if (!config.validateForPass(problems::add)) {
      problems.forEach(p -> log.warn("Configuration incomplete: {}", p));
      return ReconciliationReport.invalid(problems);
    }
    long started = clock.nowMillis();
    List<UnitOutcome> outcomes = new ArrayList<>();
    List<String> trace = new ArrayList<>();

    List<AttendanceDay> days = daysInRange(config, rows);
    if (days.isEmpty()) {
      trace.add("no attendance days in range");
      log.info("No attendance days in range; nothing to reconcile");
      return new ReconciliationReport(Map.of(), outcomes, trace, true, List.of());
    }
    LocalDate firstDay = days.get(0).date();
    LocalDate lastDay = days.get(days.size() - 1).date();
    calendar.buildRange(config.selfEmail(), firstDay, lastDay);

    TicketTimeline timeline = buildTimeline(config, firstDay, lastDay, outcomes);
    trace.add("ticket events: " + timeline.size());

    Map<LocalDate, List<DraftSegment>> draftsByDay = new LinkedHashMap<>();
    for (AttendanceDay day : days) {
      draftsByDay.put(day.date(), segmentDay(config, day, timeline, trace));
    }

    if (ticketing != null) {
      Map<String, String> summaries = fetchSummaries(draftsByDay, outcomes);
      draftsByDay.replaceAll((day, drafts) -> labelWork(drafts, summaries));
      classify(config, draftsByDay, outcomes);
    }

    int draftCount = 0;
    for (List<DraftSegment> drafts : draftsByDay.values()) {
      draftCount += drafts.size();
      drafts.forEach(d -> metrics.increment("reconcile.draft.created"));
    }
    long elapsed = clock.nowMillis() - started;
    metrics.observe("reconcile.pass.millis", elapsed);
    long failed = outcomes.stream().filter(o -> !o.ok()).count();
    log.info("Reconciled {} days into {} drafts ({} failed units) in {} ms",
        days.size(), draftCount, failed, elapsed);
    return new ReconciliationReport(draftsByDay, outcomes, trace, true, List.of());
  }

  private static List<AttendanceDay> daysInRange(ChronosConfig config, List<AttendanceRow> rows) {
    List<AttendanceDay> days = new ArrayList<>();
    for (AttendanceDay day : AttendanceDay.group(rows)) {
      boolean afterFrom = config.from().map(f -> !day.date().isBefore(f)).orElse(true);
      boolean beforeTo = config.to().map(t -> !day.date().isAfter(t)).orElse(true);
      if (afterFrom && beforeTo) {
        days.add(day);
      }
    }
    return days;
  }

  private TicketTimeline buildTimeline(
      ChronosConfig config, LocalDate firstDay, LocalDate lastDay, List<UnitOutcome> outcomes) {
    Instant since = firstDay.minusDays(config.lookbackDays()).atStartOfDay(config.zone()).toInstant();
    Instant until = lastDay.plusDays(1).atStartOfDay(config.zone()).toInstant();
    List<CommitRecord> kept = new ArrayList<>();
    for (String project : config.commitProjects()) {
      String unit = "commits:" + project;
      try {
        List<CommitRecord> fetched = commits.fetch(project, since, until);
        int before = kept.size();
        for (CommitRecord commit : fetched) {
          if (commit.madeByAny(config.authorEmails())) {
            kept.add(commit);
            if (log.isDebugEnabled()) {
              log.debug("{} {} {}", project, commit.timestamp(), Logs.truncate(commit.firstLine(), COMMIT_LOG_BYTES));
            }
          }
        }
        log.info("Project {}: {} commits, {} by configured authors", project, fetched.size(), kept.size() - before);
        succeeded(unit, outcomes);
      } catch (IOException | RuntimeException ex) {
        failed(unit, ex, outcomes);
      }
    }
    return TicketTimeline.fromCommits(kept);
  }

  private List<DraftSegment> segmentDay(
      ChronosConfig config, AttendanceDay day, TicketTimeline timeline, List<String> trace) {
    String previous = MDC.get("day");
    MDC.put("day", day.date().toString());
    try {
      DayWindows windows = windowBuilder.build(day);
      boolean ignoreMeetings = windows.productiveTime().isZero() || windows.absenceRecorded();
      List<MeetingEvent> meetings = ignoreMeetings
          ? List.of()
          : calendar.meetingsForRange(day.date(), config.selfEmail());
      SegmentationResult result = segmenter.segment(
          day.date(), windows.windows(), meetings, windows.paidNonWorkBudget(), timeline);
      trace.addAll(result.trace());
      String summary = day.date() + ": " + result.drafts().size() + " drafts, productive "
          + Logs.minutes(windows.productiveTime()) + ", " + meetings.size() + " meetings"
          + (ignoreMeetings ? " (ignored)" : "");
      trace.add(summary);
      log.info(summary);
      return result.drafts();
    } finally {
      if (previous == null) {
        MDC.remove("day");
      } else {
        MDC.put("day", previous);
      }
    }
  }

  private Map<String, String> fetchSummaries(
      Map<LocalDate, List<DraftSegment>> draftsByDay, List<UnitOutcome> outcomes) {
    Set<String> keys = new LinkedHashSet<>();
    for (List<DraftSegment> drafts : draftsByDay.values()) {
      for (DraftSegment draft : drafts) {
        if (!draft.isMeeting()) {
          keys.add(draft.ticketKey());
        }
      }
    }
    List<String> ordered = new ArrayList<>(keys);
    Map<String, String> summaries = new HashMap<>();
    for (int from = 0, batch = 1; from < ordered.size(); from += SUMMARY_BATCH_SIZE, batch++) {
      List<String> slice = ordered.subList(from, Math.min(ordered.size(), from + SUMMARY_BATCH_SIZE));
      String unit = "summaries:batch-" + batch;
      try {
        summaries.putAll(ticketing.fetchSummaries(slice));
        succeeded(unit, outcomes);
      } catch (IOException | RuntimeException ex) {
        failed(unit, ex, outcomes);
      }
    }
    return summaries;
  }

  private static List<DraftSegment> labelWork(List<DraftSegment> drafts, Map<String, String> summaries) {
    List<DraftSegment> out = new ArrayList<>(drafts.size());
    for (DraftSegment draft : drafts) {
      String summary = summaries.get(draft.ticketKey());
      if (draft.isMeeting() || summary == null || summary.isBlank()) {
        out.add(draft);
      } else {
        out.add(draft.withLabel(draft.label() + SUMMARY_SEPARATOR + summary.trim()));
      }
    }
    return out;
  }

  private void classify(
      ChronosConfig config, Map<LocalDate, List<DraftSegment>> draftsByDay, List<UnitOutcome> outcomes) {
    Set<String> tickets = new LinkedHashSet<>();
    draftsByDay.values().forEach(drafts -> drafts.forEach(d -> tickets.add(d.ticketKey())));
    Map<String, List<RemoteWorklogRecord>> booked = new HashMap<>();
    for (String ticket : tickets) {
      String unit = "worklogs:" + ticket;
      try {
        booked.put(ticket, byAuthor(ticketing.fetchWorklogs(ticket), config.accountId()));
        succeeded(unit, outcomes);
      } catch (IOException | RuntimeException ex) {
        failed(unit, ex, outcomes);
      }
    }
    draftsByDay.replaceAll((day, drafts) -> {
      List<DraftSegment> out = new ArrayList<>(drafts.size());
      for (DraftSegment draft : drafts) {
        List<RemoteWorklogRecord> records = booked.get(draft.ticketKey());
        out.add(records == null ? draft : draft.withState(classifier.classify(draft, records)));
      }
      return out;
    });
  }

  private static List<RemoteWorklogRecord> byAuthor(Collection<RemoteWorklogRecord> records, String accountId) {
    if (accountId.isEmpty()) {
      return List.copyOf(records);
    }
    return records.stream().filter(r -> accountId.equals(r.authorId())).toList();
  }

  private void succeeded(String unit, List<UnitOutcome> outcomes) {
    outcomes.add(UnitOutcome.succeeded(unit));
    metrics.increment("reconcile.unit.succeeded");
  }

  private void failed(String unit, Exception ex, List<UnitOutcome> outcomes) {
    String message = UnitOutcome.describe(ex);
    log.warn("Unit {} failed: {}", unit, message, ex);
    outcomes.add(UnitOutcome.failed(unit, message));
    metrics.increment("reconcile.unit.failed");
  }
}
