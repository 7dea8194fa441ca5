package ca.gc.cra.chronos.application.compare;

import ca.gc.cra.chronos.domain.attendance.AttendanceRow;
import ca.gc.cra.chronos.domain.compare.DayComparison;
import ca.gc.cra.chronos.domain.compare.DifferenceType;
import ca.gc.cra.chronos.domain.compare.TimeDifference;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Reports per-day discrepancies between attendance and booked worklogs.
 * <p><strong>Modes:</strong> The normal mode compares start, end, pause and net duration. The outlier mode
 * reports only individual worklogs booked before work started, after it ended or into a break.</p>
 * <p><strong>Day precedence:</strong>
 * <ol>
 *   <li>Full-absence days are skipped, except in outlier mode where every booking on them is reported.</li>
 *   <li>Weekend days without bookings are skipped.</li>
 *   <li>Days with neither attendance nor bookings are skipped.</li>
 *   <li>Days with bookings only are reported as remote-only.</li>
 *   <li>Days with attendance only are reported in normal mode.</li>
 *   <li>All other days are compared.</li>
 * </ol>
 * <p>All comparisons are done on hour and minute; seconds are ignored. Start and end tolerate one minute,
 * pause and net duration two minutes. Booked gaps of at most one minute count as work, not pause.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class TimeComparator {
  static final List<String> ABSENCE_WORDS = List.of("urlaub", "feiertag", "krank", "abwesen", "zeitausgleich");
  static final long TIME_TOLERANCE_MINUTES = 1;
  static final long DURATION_TOLERANCE_MINUTES = 2;
  static final long IGNORED_GAP_MINUTES = 1;
  private static final Duration ABSENCE_HOURS_THRESHOLD = Duration.ofMinutes(60);
  private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

  /**
   * Compares the given days.
   *
   * @param rows attendance rows, any days
   * @param remote booked worklogs grouped by local date
   * @param dates days to compare
   * @param outlierMode report individual outlier bookings instead of aggregate differences
   * @return one result per reported day, in date order
   */
  public List<DayComparison> compare(
      List<AttendanceRow> rows,
      Map<LocalDate, List<RemoteWorklogRecord>> remote,
      Collection<LocalDate> dates,
      boolean outlierMode) {
    Objects.requireNonNull(rows, "rows");
    Objects.requireNonNull(remote, "remote");
    Objects.requireNonNull(dates, "dates");
    List<DayComparison> results = new ArrayList<>();
    for (LocalDate date : new TreeSet<>(dates)) {
      List<AttendanceRow> dayRows = rows.stream().filter(r -> r.date().equals(date)).toList();
      List<RemoteWorklogRecord> dayRemote = new ArrayList<>(remote.getOrDefault(date, List.of()));
      dayRemote.sort(Comparator.comparing(RemoteWorklogRecord::start));
      compareDay(date, dayRows, dayRemote, outlierMode).ifPresent(results::add);
    }
    return results;
  }

  private Optional<DayComparison> compareDay(
      LocalDate date, List<AttendanceRow> rows, List<RemoteWorklogRecord> records, boolean outlierMode) {
    boolean hasWork = rows.stream().anyMatch(r -> r.span().isPresent() && !r.describedByAny(ABSENCE_WORDS));
    boolean hasAbsence = rows.stream().anyMatch(TimeComparator::isAbsenceRow);

    if (hasAbsence && !hasWork) {
      if (outlierMode && !records.isEmpty()) {
        String detail = "absence day (" + rows.get(0).description() + ")";
        return Optional.of(new DayComparison(date, allOutliers(date, records, detail),
            true, true, false, null, null, null));
      }
      return Optional.empty();
    }
    if (isWeekend(date) && records.isEmpty()) {
      return Optional.empty();
    }

    boolean hasGroundTruth = rows.stream().anyMatch(r -> r.span().isPresent());
    boolean hasRemote = !records.isEmpty();
    if (!hasGroundTruth && !hasRemote) {
      return Optional.empty();
    }
    if (!hasGroundTruth) {
      List<TimeDifference> differences = outlierMode
          ? allOutliers(date, records, "no attendance entry")
          : List.of();
      return Optional.of(new DayComparison(date, differences, false, true, true, null, null, null));
    }
    if (!hasRemote) {
      return outlierMode
          ? Optional.empty()
          : Optional.of(new DayComparison(date, List.of(), true, false, false, null, null, null));
    }

    GroundTruth truth = GroundTruth.of(rows);
    Duration remotePause = Duration.ofMinutes(gapMinutes(records, true));
    List<TimeDifference> differences = outlierMode
        ? findOutliers(date, truth, records)
        : compareAggregates(date, truth, records, remotePause);
    if (outlierMode && differences.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new DayComparison(date, differences, true, true, false,
        truth.pause(), truth.paidNonWork(), remotePause));
  }

  private static List<TimeDifference> compareAggregates(
      LocalDate date, GroundTruth truth, List<RemoteWorklogRecord> records, Duration remotePause) {
    List<TimeDifference> differences = new ArrayList<>();
    LocalDateTime remoteStart = records.get(0).start();
    LocalDateTime remoteEnd = records.stream().map(RemoteWorklogRecord::end)
        .max(Comparator.naturalOrder()).orElseThrow();
    Duration remoteNet = records.stream().map(RemoteWorklogRecord::duration).reduce(Duration.ZERO, Duration::plus)
        .plusMinutes(gapMinutes(records, false));

    if (truth.start() != null && !sameTime(truth.start(), remoteStart)) {
      differences.add(TimeDifference.ofTimes(date, DifferenceType.START_TIME, truth.start(), remoteStart));
    }
    if (truth.end() != null) {
      boolean endMatches = sameTime(truth.end(), remoteEnd)
          || !truth.paidNonWork().isZero() && sameTime(truth.end(), remoteEnd.plus(truth.paidNonWork()));
      if (!endMatches) {
        differences.add(TimeDifference.ofTimes(date, DifferenceType.END_TIME, truth.end(), remoteEnd));
      }
    }
    if (!sameDuration(truth.pause(), remotePause)) {
      differences.add(TimeDifference.ofDurations(date, DifferenceType.PAUSE_TIME, truth.pause(), remotePause));
    }
    if (!sameDuration(truth.net(), remoteNet)) {
      differences.add(TimeDifference.ofDurations(date, DifferenceType.DURATION, truth.net(), remoteNet));
    }
    return differences;
  }

  private static List<TimeDifference> findOutliers(
      LocalDate date, GroundTruth truth, List<RemoteWorklogRecord> records) {
    if (truth.start() == null || truth.end() == null) {
      return allOutliers(date, records, "no working time recorded");
    }
    int workStart = minuteOfDay(truth.start());
    int workEnd = minuteOfDay(truth.end());
    List<TimeDifference> outliers = new ArrayList<>();
    for (RemoteWorklogRecord record : records) {
      int start = minuteOfDay(record.start());
      int end = minuteOfDay(record.end());
      if (start < workStart - TIME_TOLERANCE_MINUTES) {
        outliers.add(TimeDifference.outlier(date, DifferenceType.REMOTE_BEFORE_WORK, truth.start(),
            record.start(), record.duration(), record.ticketKey(),
            "booked " + hhmm(record.start()) + " before work started " + hhmm(truth.start())));
        continue;
      }
      if (end > workEnd + TIME_TOLERANCE_MINUTES) {
        outliers.add(TimeDifference.outlier(date, DifferenceType.REMOTE_AFTER_WORK, truth.end(),
            record.end(), record.duration(), record.ticketKey(),
            "booked until " + hhmm(record.end()) + " after work ended " + hhmm(truth.end())));
        continue;
      }
      for (TimeInterval pause : truth.pauses()) {
        int pauseStart = minuteOfDay(pause.start());
        int pauseEnd = minuteOfDay(pause.end());
        boolean startsInPause = start >= pauseStart && start < pauseEnd;
        boolean endsInPause = end > pauseStart && end <= pauseEnd;
        boolean spansPause = start < pauseStart && end > pauseEnd;
        if (startsInPause || endsInPause || spansPause) {
          outliers.add(TimeDifference.outlier(date, DifferenceType.REMOTE_DURING_BREAK, null,
              record.start(), record.duration(), record.ticketKey(),
              "booked " + hhmm(record.start()) + "-" + hhmm(record.end())
                  + " during break " + hhmm(pause.start()) + "-" + hhmm(pause.end())));
          break;
        }
      }
    }
    return outliers;
  }

  private static List<TimeDifference> allOutliers(
      LocalDate date, List<RemoteWorklogRecord> records, String detail) {
    List<TimeDifference> out = new ArrayList<>(records.size());
    for (RemoteWorklogRecord record : records) {
      out.add(TimeDifference.outlier(date, DifferenceType.REMOTE_DURING_BREAK, null, record.start(),
          record.duration(), record.ticketKey(), detail));
    }
    return out;
  }

  /**
   * Sums minute-level gaps between consecutive records.
   *
   * @param pauses {@code true} for gaps longer than one minute, {@code false} for the ignored short ones
   */
  static long gapMinutes(List<RemoteWorklogRecord> sorted, boolean pauses) {
    long total = 0;
    for (int i = 1; i < sorted.size(); i++) {
      long gap = minuteOfDay(sorted.get(i).start()) - minuteOfDay(sorted.get(i - 1).end());
      if (pauses ? gap > IGNORED_GAP_MINUTES : gap > 0 && gap <= IGNORED_GAP_MINUTES) {
        total += gap;
      }
    }
    return total;
  }

  private static boolean isAbsenceRow(AttendanceRow row) {
    return row.sickDays() > 0
        || row.holidayDays() > 0
        || row.vacation().compareTo(ABSENCE_HOURS_THRESHOLD) > 0
        || row.timeCompensation().compareTo(ABSENCE_HOURS_THRESHOLD) > 0
        || row.describedByAny(ABSENCE_WORDS);
  }

  private static boolean isWeekend(LocalDate date) {
    return date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY;
  }

  private static boolean sameTime(LocalDateTime a, LocalDateTime b) {
    return Math.abs(minuteOfDay(a) - minuteOfDay(b)) <= TIME_TOLERANCE_MINUTES;
  }

  private static boolean sameDuration(Duration a, Duration b) {
    return Math.abs(a.toMinutes() - b.toMinutes()) <= DURATION_TOLERANCE_MINUTES;
  }

  private static int minuteOfDay(LocalDateTime t) {
    return t.getHour() * 60 + t.getMinute();
  }

  private static String hhmm(LocalDateTime t) {
    return HH_MM.format(t);
  }

  /** Aggregates of the non-absence attendance rows of one day. */
  private record GroundTruth(
      LocalDateTime start,
      LocalDateTime end,
      Duration pause,
      Duration paidNonWork,
      Duration net,
      List<TimeInterval> pauses) {

    static GroundTruth of(List<AttendanceRow> rows) {
      LocalDateTime start = null;
      LocalDateTime end = null;
      Duration pause = Duration.ZERO;
      Duration paidNonWork = Duration.ZERO;
      Duration net = Duration.ZERO;
      List<TimeInterval> pauses = new ArrayList<>();
      for (AttendanceRow row : rows) {
        if (row.describedByAny(ABSENCE_WORDS)) {
          continue;
        }
        if (row.start() != null && (start == null || row.start().isBefore(start))) {
          start = row.start();
        }
        if (row.end() != null && (end == null || row.end().isAfter(end))) {
          end = row.end();
        }
        pause = pause.plus(row.pauseTotal());
        paidNonWork = paidNonWork.plus(row.paidNonWork());
        net = net.plus(row.duration().minus(row.pauseTotal()));
        pauses.addAll(row.pauses());
      }
      return new GroundTruth(start, end, pause, paidNonWork, net, pauses);
    }
  }
}
