package ca.gc.cra.chronos.application.segment;

import ca.gc.cra.chronos.application.calendar.MeetingTitleRewriter;
import ca.gc.cra.chronos.application.port.MetricsPort;
import ca.gc.cra.chronos.domain.attendance.WorkWindow;
import ca.gc.cra.chronos.domain.calendar.MeetingEvent;
import ca.gc.cra.chronos.domain.commit.CommitTicketEvent;
import ca.gc.cra.chronos.domain.commit.TicketTimeline;
import ca.gc.cra.chronos.domain.time.IntervalAlgebra;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.domain.worklog.DraftSegment;
import ca.gc.cra.chronos.logging.Logs;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Partitions one day's attendance into meeting and ticket-routed work drafts.
 * <p><strong>Why:</strong> Attendance says when someone worked, the calendar says when they sat in
 * meetings and commits say which ticket they were on; segmentation combines the three into bookable
 * slices.</p>
 * <p><strong>Algorithm:</strong>
 * <ol>
 *   <li>Merge meetings with the touching policy and clip them against every work window; each clip is a
 *   meeting draft routed by {@link MeetingTicketRules}.</li>
 *   <li>Subtract the merged meetings from the work windows.</li>
 *   <li>Trim the paid-non-work budget from the end of the leftover time.</li>
 *   <li>Route every leftover piece by the latest ticket event at or before its start, forward-filling from
 *   the next event when none precedes it, and split it wherever the ticket changes inside it. Pieces
 *   without any ticket event are dropped.</li>
 * </ol>
 * <p><strong>Output invariant:</strong> Drafts are sorted by start, pairwise non-overlapping and at least
 * one minute long.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the title rewriter's random source.</p>
 * <p><strong>Observability:</strong> Emits {@code reconcile.piece.dropped} per dropped piece.</p>
 *
 * @since 0.1.0
 */
public final class Segmenter {
  private static final Logger log = LoggerFactory.getLogger(Segmenter.class);
  private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");
  private static final int TITLE_LOG_BYTES = 80;

  static final String MEETING_LABEL = "Meeting";
  static final String WORK_LABEL = "Work";

  private final MeetingTicketRules ticketRules;
  private final MeetingTitleRewriter titleRewriter;
  private final MetricsPort metrics;

  public Segmenter(MeetingTicketRules ticketRules, MeetingTitleRewriter titleRewriter, MetricsPort metrics) {
    this.ticketRules = Objects.requireNonNull(ticketRules, "ticketRules");
    this.titleRewriter = Objects.requireNonNull(titleRewriter, "titleRewriter");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Segments one day.
   *
   * @param day day being segmented
   * @param windows pause-net work windows
   * @param meetings meetings of the day, already filtered
   * @param paidNonWorkBudget time to trim from the end of the leftover work time
   * @param timeline ticket-change events, usually spanning more than the day
   * @return drafts and trace
   */
  public SegmentationResult segment(
      LocalDate day,
      List<WorkWindow> windows,
      List<MeetingEvent> meetings,
      Duration paidNonWorkBudget,
      TicketTimeline timeline) {
    Objects.requireNonNull(day, "day");
    Objects.requireNonNull(windows, "windows");
    Objects.requireNonNull(meetings, "meetings");
    Objects.requireNonNull(timeline, "timeline");
    List<String> trace = new ArrayList<>();
    List<DraftSegment> drafts = new ArrayList<>();
    List<TimeInterval> workIntervals = WorkWindow.intervals(windows);

    List<MeetingEvent> mergedMeetings = IntervalAlgebra.mergeTouching(
        meetings,
        MeetingEvent::interval,
        (left, right) -> left
            .withInterval(IntervalAlgebra.span(left.interval(), right.interval()))
            .withTitle(joinTitles(left.title(), right.title())));
    for (MeetingEvent meeting : mergedMeetings) {
      for (TimeInterval window : workIntervals) {
        Optional<TimeInterval> clip = IntervalAlgebra.clip(meeting.interval(), window);
        if (clip.isEmpty() || clip.get().duration().compareTo(IntervalAlgebra.MIN_PIECE) < 0) {
          continue;
        }
        drafts.add(meetingDraft(clip.get(), meeting.title(), trace));
      }
    }

    List<TimeInterval> cutters = new ArrayList<>(mergedMeetings.size());
    for (MeetingEvent meeting : mergedMeetings) {
      cutters.add(meeting.interval());
    }
    List<TimeInterval> leftover = IntervalAlgebra.subtractAll(workIntervals, cutters);
    List<TimeInterval> pieces = trimFromEnd(leftover, paidNonWorkBudget);
    if (paidNonWorkBudget != null && !paidNonWorkBudget.isZero()) {
      trace.add(day + ": trimmed " + Logs.minutes(paidNonWorkBudget) + " paid non-work from the end");
    }

    int dropped = 0;
    for (TimeInterval piece : pieces) {
      List<DraftSegment> routed = route(piece, timeline, trace);
      if (routed.isEmpty()) {
        dropped++;
        metrics.increment("reconcile.piece.dropped");
        String line = "no ticket for work " + hhmm(piece.start()) + "–" + hhmm(piece.end()) + ", piece dropped";
        log.warn("{}: {}", day, line);
        trace.add(day + ": " + line);
      }
      drafts.addAll(routed);
    }

    drafts.sort(Comparator.comparing(DraftSegment::interval));
    log.debug("{}: {} drafts ({} meetings, {} dropped pieces)",
        day, drafts.size(), drafts.stream().filter(DraftSegment::isMeeting).count(), dropped);
    return new SegmentationResult(day, drafts, trace, dropped);
  }

  /**
   * Removes {@code budget} from the end of {@code pieces}: whole pieces go first, the last piece touched is
   * truncated. Pieces left shorter than a minute are dropped.
   */
  static List<TimeInterval> trimFromEnd(Collection<TimeInterval> pieces, Duration budget) {
    List<TimeInterval> sorted = new ArrayList<>(pieces);
    sorted.sort(Comparator.naturalOrder());
    if (budget == null || budget.isZero() || budget.isNegative()) {
      return sorted;
    }
    Duration remaining = budget;
    List<TimeInterval> kept = new ArrayList<>();
    for (int i = sorted.size() - 1; i >= 0; i--) {
      TimeInterval piece = sorted.get(i);
      if (remaining.isZero()) {
        kept.add(piece);
        continue;
      }
      Duration length = piece.duration();
      if (remaining.compareTo(length) >= 0) {
        remaining = remaining.minus(length);
        continue;
      }
      LocalDateTime newEnd = piece.end().minus(remaining);
      remaining = Duration.ZERO;
      if (Duration.between(piece.start(), newEnd).compareTo(IntervalAlgebra.MIN_PIECE) >= 0) {
        kept.add(piece.withEnd(newEnd));
      }
    }
    kept.sort(Comparator.naturalOrder());
    return kept;
  }

  private List<DraftSegment> route(TimeInterval piece, TicketTimeline timeline, List<String> trace) {
    Optional<CommitTicketEvent> initial = timeline.latestAtOrBefore(piece.start());
    if (initial.isEmpty()) {
      initial = timeline.earliestAtOrAfter(piece.start());
      if (initial.isPresent() && piece.contains(initial.get().timestamp())
          && initial.get().timestamp().isAfter(piece.start())) {
        String line = "forward-fill " + hhmm(piece.start()) + "–" + hhmm(initial.get().timestamp())
            + " with [" + initial.get().ticketKey() + "]";
        log.info("{}: {}", piece.start().toLocalDate(), line);
        trace.add(piece.start().toLocalDate() + ": " + line);
      }
    }
    if (initial.isEmpty()) {
      return List.of();
    }

    List<DraftSegment> out = new ArrayList<>();
    String current = initial.get().ticketKey();
    LocalDateTime segmentStart = piece.start();
    for (CommitTicketEvent event : timeline.strictlyWithin(piece)) {
      if (event.ticketKey().equals(current)) {
        continue;
      }
      addWork(out, segmentStart, event.timestamp(), current, trace,
          " (commit " + hhmm(event.timestamp()) + " '" + Logs.truncate(event.firstLine(), TITLE_LOG_BYTES) + "')");
      current = event.ticketKey();
      segmentStart = event.timestamp();
    }
    addWork(out, segmentStart, piece.end(), current, trace, "");
    return out;
  }

  private static void addWork(
      List<DraftSegment> out,
      LocalDateTime start,
      LocalDateTime end,
      String ticket,
      List<String> trace,
      String reason) {
    if (Duration.between(start, end).compareTo(IntervalAlgebra.MIN_PIECE) < 0) {
      return;
    }
    out.add(DraftSegment.work(new TimeInterval(start, end), ticket, WORK_LABEL));
    trace.add(start.toLocalDate() + ": work " + hhmm(start) + "–" + hhmm(end) + " -> [" + ticket + "]" + reason);
  }

  private DraftSegment meetingDraft(TimeInterval interval, String title, List<String> trace) {
    MeetingTitleRewriter.Rewrite rewrite = titleRewriter.rewrite(title.trim());
    String shownTitle = rewrite.title();
    String label = meetingLabel(interval, shownTitle);
    String ticket = ticketRules.ticketFor(title);
    trace.add(interval.start().toLocalDate() + ": " + label + " -> [" + ticket + "]"
        + rewrite.originalTitle().map(original -> " (was '" + original + "')").orElse(""));
    return DraftSegment.meeting(interval, ticket, label);
  }

  static String meetingLabel(TimeInterval interval, String title) {
    String base = MEETING_LABEL + " " + hhmm(interval.start()) + "–" + hhmm(interval.end());
    return title == null || title.isBlank() ? base : base + " – " + title.trim();
  }

  private static String joinTitles(String left, String right) {
    if (left.isBlank()) {
      return right;
    }
    if (right.isBlank() || left.equals(right)) {
      return left;
    }
    return left + " + " + right;
  }

  private static String hhmm(LocalDateTime time) {
    return HH_MM.format(time);
  }
}
