package ca.gc.cra.chronos.domain.attendance;

import ca.gc.cra.chronos.domain.time.IntervalAlgebra;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One row of the attendance export for a single day.
 * <p><strong>Why:</strong> Attendance is the ground truth the engine reconciles against; rows carry the
 * booked span, its breaks and any absence quantities recorded for the day.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param date calendar day of the row
 * @param description free-text row type (e.g. "Arbeitszeit", "Urlaub", "Homeoffice")
 * @param start booked start, or {@code null} for rows without a span
 * @param end booked end, or {@code null} for rows without a span
 * @param duration booked duration
 * @param pauseTotal total break time recorded on the row
 * @param pauses individual break ranges
 * @param paidNonWork away-from-desk time credited as work (e.g. a medical appointment)
 * @param sickDays sick leave in days
 * @param holidayDays public holiday in days
 * @param vacation vacation time
 * @param timeCompensation time-off-in-lieu
 * @since 0.1.0
 */
public record AttendanceRow(
    LocalDate date,
    String description,
    LocalDateTime start,
    LocalDateTime end,
    Duration duration,
    Duration pauseTotal,
    List<TimeInterval> pauses,
    Duration paidNonWork,
    double sickDays,
    double holidayDays,
    Duration vacation,
    Duration timeCompensation) {

  public AttendanceRow {
    Objects.requireNonNull(date, "date");
    description = description == null ? "" : description;
    duration = orZero(duration);
    pauseTotal = orZero(pauseTotal);
    pauses = pauses == null ? List.of() : List.copyOf(pauses);
    paidNonWork = orZero(paidNonWork);
    vacation = orZero(vacation);
    timeCompensation = orZero(timeCompensation);
    if ((start == null) != (end == null)) {
      throw new IllegalArgumentException("start and end must both be present or both absent");
    }
    if (start != null && !end.isAfter(start)) {
      throw new IllegalArgumentException("end must be after start on " + date);
    }
    if (sickDays < 0 || holidayDays < 0) {
      throw new IllegalArgumentException("absence day counts must be >= 0");
    }
  }

  /** Plain work row spanning {@code start..end} without breaks or absences. */
  public static AttendanceRow work(String description, LocalDateTime start, LocalDateTime end) {
    return new AttendanceRow(start.toLocalDate(), description, start, end,
        Duration.between(start, end), Duration.ZERO, List.of(), Duration.ZERO, 0, 0,
        Duration.ZERO, Duration.ZERO);
  }

  public Optional<TimeInterval> span() {
    return start == null ? Optional.empty() : Optional.of(new TimeInterval(start, end));
  }

  /**
   * Case-insensitive substring test of the description against a keyword list.
   *
   * @param keywords lower-case keywords
   * @return {@code true} when any keyword occurs in the description
   */
  public boolean describedByAny(Collection<String> keywords) {
    String lower = description.toLowerCase(Locale.ROOT);
    for (String keyword : keywords) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  public AttendanceRow withPauses(List<TimeInterval> newPauses) {
    return new AttendanceRow(date, description, start, end, duration,
        IntervalAlgebra.totalDuration(newPauses), newPauses, paidNonWork, sickDays, holidayDays, vacation,
        timeCompensation);
  }

  public AttendanceRow withPaidNonWork(Duration value) {
    return new AttendanceRow(date, description, start, end, duration, pauseTotal, pauses, value,
        sickDays, holidayDays, vacation, timeCompensation);
  }

  public AttendanceRow withAbsences(double sick, double holiday, Duration vacationTime, Duration compensation) {
    return new AttendanceRow(date, description, start, end, duration, pauseTotal, pauses, paidNonWork,
        sick, holiday, vacationTime, compensation);
  }

  private static Duration orZero(Duration value) {
    return value == null ? Duration.ZERO : value;
  }
}
