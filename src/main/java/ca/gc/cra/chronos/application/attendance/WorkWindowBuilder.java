package ca.gc.cra.chronos.application.attendance;

import ca.gc.cra.chronos.domain.attendance.AttendanceDay;
import ca.gc.cra.chronos.domain.attendance.AttendanceRow;
import ca.gc.cra.chronos.domain.attendance.PauseInterval;
import ca.gc.cra.chronos.domain.attendance.WorkWindow;
import ca.gc.cra.chronos.domain.time.IntervalAlgebra;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Derives the pause-net work windows of an attendance day.
 * <p><strong>Why:</strong> Segmentation partitions attendance time only; absence rows, non-productive rows
 * and the default home-office block must not produce drafts.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class WorkWindowBuilder {
  private static final Logger log = LoggerFactory.getLogger(WorkWindowBuilder.class);

  static final List<String> ABSENCE_WORDS = List.of("urlaub", "feiertag", "krank", "abwesen");
  static final List<String> NON_PRODUCTIVE_WORDS = List.of("pause", "arzt", "nichtleistung", "nicht-leistung");
  static final String HOME_OFFICE = "homeoffice";
  static final Duration HOME_OFFICE_MIN = Duration.ofMinutes(420);
  static final Duration HOME_OFFICE_MAX = Duration.ofMinutes(540);

  /**
   * Work windows of one day.
   *
   * @param date day
   * @param windows pause-net windows merged with the touching policy
   * @param pauses all pause ranges recorded for the day
   * @param paidNonWorkBudget time to trim from the end of the leftover work time
   * @param absenceRecorded {@code true} when an absence row exists for the day
   */
  public record DayWindows(
      LocalDate date,
      List<WorkWindow> windows,
      List<PauseInterval> pauses,
      Duration paidNonWorkBudget,
      boolean absenceRecorded) {
    public DayWindows {
      Objects.requireNonNull(date, "date");
      windows = List.copyOf(windows);
      pauses = List.copyOf(pauses);
      Objects.requireNonNull(paidNonWorkBudget, "paidNonWorkBudget");
    }

    public Duration productiveTime() {
      return IntervalAlgebra.totalDuration(WorkWindow.intervals(windows));
    }
  }

  public DayWindows build(AttendanceDay day) {
    Objects.requireNonNull(day, "day");
    List<TimeInterval> spans = new ArrayList<>();
    List<TimeInterval> pauses = new ArrayList<>();
    boolean absence = false;
    for (AttendanceRow row : day.rows()) {
      pauses.addAll(row.pauses());
      if (row.describedByAny(ABSENCE_WORDS)) {
        absence = true;
        continue;
      }
      if (row.describedByAny(NON_PRODUCTIVE_WORDS) || isDefaultHomeOfficeBlock(row)) {
        continue;
      }
      row.span().ifPresent(spans::add);
    }
    List<TimeInterval> net = IntervalAlgebra.mergeTouching(IntervalAlgebra.subtractAll(spans, pauses));
    Duration budget = day.hasStructuredAbsence() ? Duration.ZERO : day.paidNonWork();
    List<PauseInterval> pauseIntervals = new ArrayList<>();
    for (TimeInterval pause : IntervalAlgebra.mergeTouching(pauses)) {
      pauseIntervals.add(new PauseInterval(pause));
    }
    log.debug("{}: {} work windows, {} pauses, paid non-work budget {}",
        day.date(), net.size(), pauseIntervals.size(), budget);
    return new DayWindows(day.date(), WorkWindow.of(net), pauseIntervals, budget, absence);
  }

  private static boolean isDefaultHomeOfficeBlock(AttendanceRow row) {
    if (!row.describedByAny(List.of(HOME_OFFICE))) {
      return false;
    }
    Duration length = row.span().map(TimeInterval::duration).orElse(row.duration());
    return length.compareTo(HOME_OFFICE_MIN) >= 0 && length.compareTo(HOME_OFFICE_MAX) <= 0;
  }
}
