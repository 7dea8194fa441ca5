package ca.gc.cra.chronos.application.adjust;

import ca.gc.cra.chronos.domain.adjust.AdjustmentOperation;
import ca.gc.cra.chronos.domain.adjust.AdjustmentPlan;
import ca.gc.cra.chronos.domain.attendance.AttendanceRow;
import ca.gc.cra.chronos.domain.time.IntervalAlgebra;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import ca.gc.cra.chronos.logging.Logs;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Computes the edit script that moves one day's booked worklogs onto attendance
 * ground truth.
 * <p><strong>Why:</strong> Bookings drift from attendance: the first starts late, the last ends early,
 * breaks are booked through or left as oversized gaps. The plan fixes the envelope first, then carves out
 * the breaks, then closes unjustified gaps.</p>
 * <p><strong>Steps:</strong>
 * <ol>
 *   <li>Move the first record's start to the ground-truth start.</li>
 *   <li>Move the last record's end to the ground-truth end.</li>
 *   <li>For each break in time order, delete, shorten or split every record overlapping it.</li>
 *   <li>While booked gaps exceed the recorded break time, extend the record preceding the gap with the
 *   largest unjustified portion.</li>
 * </ol>
 * Every step sees the records as the previous steps left them, so a record split by one break is targeted
 * by later steps through its pending second part ({@code <id>_split}).</p>
 * <p>A day that already matches ground truth yields an empty plan.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class AdjustmentPlanner {
  private static final Logger log = LoggerFactory.getLogger(AdjustmentPlanner.class);

  static final List<String> ABSENCE_WORDS = List.of(
      "urlaub", "krank", "zeitausgleich", "arzt", "pflege", "sonder", "eltern", "papamonat");
  static final String PAUSE_LABEL = "Pause";
  static final String CLOSE_GAP_LABEL = "Pause kürzen";

  /**
   * Plans the corrections for one day.
   *
   * @param date day
   * @param rows attendance rows of the day
   * @param records worklogs booked on the day
   * @return plan; empty when there is nothing to compare or nothing to change
   */
  public AdjustmentPlan generatePlan(
      LocalDate date, List<AttendanceRow> rows, List<RemoteWorklogRecord> records) {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(rows, "rows");
    Objects.requireNonNull(records, "records");
    if (records.isEmpty() || rows.isEmpty()) {
      return AdjustmentPlan.empty(date);
    }

    LocalDateTime groundTruthStart = null;
    LocalDateTime groundTruthEnd = null;
    Duration groundTruthPause = Duration.ZERO;
    List<TimeInterval> pauses = new ArrayList<>();
    for (AttendanceRow row : rows) {
      if (row.describedByAny(ABSENCE_WORDS)) {
        continue;
      }
      if (row.start() != null && (groundTruthStart == null || row.start().isBefore(groundTruthStart))) {
        groundTruthStart = row.start();
      }
      if (row.end() != null && (groundTruthEnd == null || row.end().isAfter(groundTruthEnd))) {
        groundTruthEnd = row.end();
      }
      groundTruthPause = groundTruthPause.plus(row.pauseTotal()).plus(row.paidNonWork());
      pauses.addAll(row.pauses());
    }
    if (groundTruthStart == null || groundTruthEnd == null) {
      log.debug("{}: no working attendance rows, nothing to plan", date);
      return AdjustmentPlan.empty(date);
    }

    List<RemoteWorklogRecord> current = new ArrayList<>(records);
    current.sort(Comparator.comparing(RemoteWorklogRecord::start));
    List<AdjustmentOperation> operations = new ArrayList<>();

    RemoteWorklogRecord first = current.get(0);
    if (!sameMinute(groundTruthStart, first.start())) {
      if (groundTruthStart.isBefore(first.end())) {
        AdjustmentOperation op = AdjustmentOperation.moveStart(first, groundTruthStart);
        operations.add(op);
        replace(current, first, op.updatedRecord().orElseThrow());
        current.sort(Comparator.comparing(RemoteWorklogRecord::start));
      } else {
        log.warn("{}: cannot move start of {} to {}, it would end before it starts",
            date, first.id(), groundTruthStart);
      }
    }

    RemoteWorklogRecord last = current.get(current.size() - 1);
    if (!sameMinute(groundTruthEnd, last.end())) {
      if (groundTruthEnd.isAfter(last.start())) {
        AdjustmentOperation op = AdjustmentOperation.moveEnd(last, groundTruthEnd);
        operations.add(op);
        replace(current, last, op.updatedRecord().orElseThrow());
      } else {
        log.warn("{}: cannot move end of {} to {}, it would end before it starts",
            date, last.id(), groundTruthEnd);
      }
    }

    for (TimeInterval pause : IntervalAlgebra.mergeOverlapping(pauses)) {
      carvePause(current, pause, operations);
    }

    Duration remotePause = gapTotal(current);
    if (remotePause.compareTo(groundTruthPause) > 0) {
      closeExcessGaps(current, remotePause.minus(groundTruthPause), pauses, operations);
    }

    if (!operations.isEmpty()) {
      log.info("{}: {} adjustments planned (booked pause {}, recorded pause {})",
          date, operations.size(), Logs.minutes(remotePause), Logs.minutes(groundTruthPause));
    }
    return new AdjustmentPlan(date, operations, groundTruthPause, remotePause);
  }

  private static void carvePause(
      List<RemoteWorklogRecord> current, TimeInterval pause, List<AdjustmentOperation> operations) {
    for (RemoteWorklogRecord record : List.copyOf(current)) {
      if (!record.interval().overlaps(pause)) {
        continue;
      }
      boolean startsBefore = record.start().isBefore(pause.start());
      boolean endsAfter = record.end().isAfter(pause.end());
      if (!startsBefore && !endsAfter) {
        operations.add(AdjustmentOperation.delete(record, pause, PAUSE_LABEL));
        current.remove(record);
      } else if (startsBefore && !endsAfter) {
        AdjustmentOperation op = AdjustmentOperation.shortenBefore(record, pause, PAUSE_LABEL);
        operations.add(op);
        replace(current, record, op.updatedRecord().orElseThrow());
      } else if (!startsBefore) {
        AdjustmentOperation op = AdjustmentOperation.shortenAfter(record, pause, PAUSE_LABEL);
        operations.add(op);
        replace(current, record, op.updatedRecord().orElseThrow());
      } else {
        AdjustmentOperation op = AdjustmentOperation.split(record, pause, PAUSE_LABEL);
        operations.add(op);
        replace(current, record, op.updatedRecord().orElseThrow());
        current.add(op.secondPart().orElseThrow());
        current.sort(Comparator.comparing(RemoteWorklogRecord::start));
      }
    }
  }

  private static void closeExcessGaps(
      List<RemoteWorklogRecord> current,
      Duration excess,
      List<TimeInterval> pauses,
      List<AdjustmentOperation> operations) {
    record Gap(int index, TimeInterval range, Duration unjustified) {}

    List<Gap> gaps = new ArrayList<>();
    for (int i = 0; i + 1 < current.size(); i++) {
      LocalDateTime gapStart = current.get(i).end();
      LocalDateTime gapEnd = current.get(i + 1).start();
      long minutes = minutesBetween(gapStart, gapEnd);
      if (minutes <= 0 || !gapEnd.isAfter(gapStart)) {
        continue;
      }
      TimeInterval range = new TimeInterval(gapStart, gapEnd);
      Duration justified = Duration.ZERO;
      for (TimeInterval pause : pauses) {
        justified = justified.plus(range.intersection(pause).map(TimeInterval::duration).orElse(Duration.ZERO));
      }
      Duration unjustified = Duration.ofMinutes(minutes).minus(justified);
      if (unjustified.isNegative() || unjustified.isZero()) {
        continue;
      }
      gaps.add(new Gap(i, range, unjustified));
    }
    gaps.sort(Comparator.comparing(Gap::unjustified).reversed().thenComparing(Gap::index));

    Duration remaining = excess;
    for (Gap gap : gaps) {
      if (remaining.isZero() || remaining.isNegative()) {
        break;
      }
      Duration close = gap.unjustified().compareTo(remaining) > 0 ? remaining : gap.unjustified();
      // Extends from the gap start even when a recorded pause lies inside the gap; only the amount
      // closed excludes the pause.
      LocalDateTime newEnd = gap.range().start().plus(close);
      if (newEnd.isAfter(gap.range().end())) {
        newEnd = gap.range().end();
      }
      RemoteWorklogRecord preceding = current.get(gap.index());
      AdjustmentOperation op = AdjustmentOperation.closeGap(
          preceding, newEnd, new TimeInterval(gap.range().start(), newEnd),
          CLOSE_GAP_LABEL + " (" + Logs.minutes(close) + ")");
      operations.add(op);
      current.set(gap.index(), op.updatedRecord().orElseThrow());
      remaining = remaining.minus(close);
    }
  }

  /** Sum of positive gaps between consecutive records, counted in whole minutes. */
  static Duration gapTotal(List<RemoteWorklogRecord> sorted) {
    long minutes = 0;
    for (int i = 1; i < sorted.size(); i++) {
      long gap = minutesBetween(sorted.get(i - 1).end(), sorted.get(i).start());
      if (gap > 0) {
        minutes += gap;
      }
    }
    return Duration.ofMinutes(minutes);
  }

  private static long minutesBetween(LocalDateTime from, LocalDateTime to) {
    return ChronoUnit.MINUTES.between(
        from.truncatedTo(ChronoUnit.MINUTES), to.truncatedTo(ChronoUnit.MINUTES));
  }

  static boolean sameMinute(LocalDateTime a, LocalDateTime b) {
    return a.getHour() == b.getHour() && a.getMinute() == b.getMinute();
  }

  private static void replace(
      List<RemoteWorklogRecord> current, RemoteWorklogRecord old, RemoteWorklogRecord updated) {
    int idx = current.indexOf(old);
    if (idx >= 0) {
      current.set(idx, updated);
    }
  }
}
