package ca.gc.cra.chronos.config;

import ca.gc.cra.chronos.application.adjust.AdjustmentApplier;
import ca.gc.cra.chronos.application.calendar.CalendarNormalizer;
import ca.gc.cra.chronos.application.calendar.MeetingTitleRewriter;
import ca.gc.cra.chronos.application.pipeline.ReconciliationUseCase;
import ca.gc.cra.chronos.application.pipeline.RemoteWorklogCollector;
import ca.gc.cra.chronos.application.pipeline.WorklogSubmissionUseCase;
import ca.gc.cra.chronos.application.port.ClockPort;
import ca.gc.cra.chronos.application.port.CommitHistoryPort;
import ca.gc.cra.chronos.application.port.MetricsPort;
import ca.gc.cra.chronos.application.port.TicketingPort;
import ca.gc.cra.chronos.application.segment.MeetingTicketRules;
import ca.gc.cra.chronos.application.segment.Segmenter;
import ca.gc.cra.chronos.domain.attendance.AttendanceRow;
import ca.gc.cra.chronos.infrastructure.attendance.JsonAttendanceReader;
import ca.gc.cra.chronos.infrastructure.commit.PagedCommitHistoryAdapter;
import ca.gc.cra.chronos.infrastructure.commit.RecordedCommitPageSource;
import ca.gc.cra.chronos.infrastructure.ticketing.FileTicketingAdapter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * <strong>What:</strong> Wires chronos use cases to the file adapters named by a {@link ChronosConfig}.
 * <p><strong>Role:</strong> Composition root used by the CLI commands.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the ticketing adapter is loaded once and shared by the
 * use cases it creates.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final ChronosConfig config;
  private final MetricsPort metrics;
  private FileTicketingAdapter ticketing;

  public CompositionRoot(ChronosConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  public ChronosConfig config() {
    return config;
  }

  /**
   * Reads the configured attendance file.
   *
   * @throws IOException when the file cannot be read
   */
  public List<AttendanceRow> attendanceRows() throws IOException {
    return new JsonAttendanceReader().read(required(config.attendanceFile(), "attendanceFile"));
  }

  /**
   * Parses the configured calendar export.
   *
   * @throws IOException when the file cannot be read
   */
  public CalendarNormalizer calendar() throws IOException {
    String text = Files.readString(required(config.calendarFile(), "calendarFile"), StandardCharsets.UTF_8);
    return CalendarNormalizer.fromText(text, config.selfEmail(), config.zone(), config.nonMeetingHints());
  }

  /**
   * Commit history from the recorded pages file; no commits when none is configured.
   *
   * @throws IOException when the file cannot be read
   */
  public CommitHistoryPort commitHistory() throws IOException {
    if (config.commitsFile().isEmpty()) {
      return (projectId, since, until) -> List.of();
    }
    return new PagedCommitHistoryAdapter(RecordedCommitPageSource.load(config.commitsFile().get()), config.zone());
  }

  /**
   * Ticketing adapter over the configured file, loaded on first use.
   *
   * @throws IOException when the file cannot be read
   */
  public Optional<FileTicketingAdapter> ticketing() throws IOException {
    if (ticketing == null && config.ticketingFile().isPresent()) {
      ticketing = FileTicketingAdapter.load(config.ticketingFile().get(), config.zone())
          .withCreateAuthor(config.accountId());
    }
    return Optional.ofNullable(ticketing);
  }

  public Segmenter segmenter() {
    List<MeetingTicketRules.Rule> ticketRules = config.meetingRules().stream()
        .map(r -> new MeetingTicketRules.Rule(r.pattern(), r.ticket()))
        .toList();
    List<MeetingTitleRewriter.Rule> titleRules = config.titleRules().stream()
        .map(r -> new MeetingTitleRewriter.Rule(r.trigger(), r.replacements()))
        .toList();
    return new Segmenter(
        new MeetingTicketRules(ticketRules, config.meetingTicket()),
        new MeetingTitleRewriter(titleRules, new Random()),
        metrics);
  }

  /**
   * Reconciliation pass over every configured source.
   *
   * @throws IOException when a source file cannot be read
   */
  public ReconciliationUseCase reconciliationUseCase() throws IOException {
    TicketingPort port = ticketing().orElse(null);
    return new ReconciliationUseCase(calendar(), commitHistory(), port, segmenter(), metrics, ClockPort.SYSTEM);
  }

  public WorklogSubmissionUseCase submissionUseCase() throws IOException {
    return new WorklogSubmissionUseCase(requiredTicketing(), metrics);
  }

  public RemoteWorklogCollector remoteWorklogCollector() throws IOException {
    return new RemoteWorklogCollector(requiredTicketing(), metrics);
  }

  public AdjustmentApplier adjustmentApplier() throws IOException {
    return new AdjustmentApplier(requiredTicketing(), metrics);
  }

  private FileTicketingAdapter requiredTicketing() throws IOException {
    return ticketing().orElseThrow(() -> new IllegalArgumentException("ticketingFile is required"));
  }

  private static Path required(Optional<Path> path, String key) {
    return path.orElseThrow(() -> new IllegalArgumentException(key + " is required"));
  }
}
