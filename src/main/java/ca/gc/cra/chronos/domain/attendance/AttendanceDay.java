package ca.gc.cra.chronos.domain.attendance;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * All attendance rows recorded for one calendar day.
 *
 * @param date calendar day
 * @param rows rows of that day in export order
 * @since 0.1.0
 */
public record AttendanceDay(LocalDate date, List<AttendanceRow> rows) {
  public AttendanceDay {
    Objects.requireNonNull(date, "date");
    rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    for (AttendanceRow row : rows) {
      if (!row.date().equals(date)) {
        throw new IllegalArgumentException("row for " + row.date() + " does not belong to " + date);
      }
    }
  }

  /**
   * Groups rows by date in ascending day order.
   *
   * @param rows rows of any number of days
   * @return one entry per day that has at least one row
   */
  public static List<AttendanceDay> group(Collection<AttendanceRow> rows) {
    Map<LocalDate, List<AttendanceRow>> byDate = new TreeMap<>();
    for (AttendanceRow row : rows) {
      byDate.computeIfAbsent(row.date(), d -> new ArrayList<>()).add(row);
    }
    List<AttendanceDay> days = new ArrayList<>(byDate.size());
    byDate.forEach((date, dayRows) -> days.add(new AttendanceDay(date, dayRows)));
    return days;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public double sickDays() {
    return rows.stream().mapToDouble(AttendanceRow::sickDays).sum();
  }

  public double holidayDays() {
    return rows.stream().mapToDouble(AttendanceRow::holidayDays).sum();
  }

  public Duration vacation() {
    return rows.stream().map(AttendanceRow::vacation).reduce(Duration.ZERO, Duration::plus);
  }

  public Duration timeCompensation() {
    return rows.stream().map(AttendanceRow::timeCompensation).reduce(Duration.ZERO, Duration::plus);
  }

  public Duration paidNonWork() {
    return rows.stream().map(AttendanceRow::paidNonWork).reduce(Duration.ZERO, Duration::plus);
  }

  /** {@code true} when sick leave, a public holiday or vacation is recorded for the day. */
  public boolean hasStructuredAbsence() {
    return sickDays() > 0 || holidayDays() > 0 || !vacation().isZero();
  }
}
