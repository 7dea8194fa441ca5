package ca.gc.cra.chronos.api;

import ca.gc.cra.chronos.config.ChronosConfig;
import ca.gc.cra.chronos.domain.attendance.AttendanceRow;
import java.time.LocalDate;
import java.util.List;
import java.util.TreeSet;

/** Days a compare or adjust run covers. */
final class DateRange {
  private DateRange() {
    // Utility
  }

  /**
   * Every day from {@code from} (default: first attendance day) to {@code to} (default: last attendance
   * day), weekends included.
   */
  static TreeSet<LocalDate> of(ChronosConfig config, List<AttendanceRow> rows) {
    TreeSet<LocalDate> attendanceDays = new TreeSet<>();
    rows.forEach(r -> attendanceDays.add(r.date()));
    TreeSet<LocalDate> days = new TreeSet<>();
    LocalDate from = config.from().orElse(attendanceDays.isEmpty() ? null : attendanceDays.first());
    LocalDate to = config.to().orElse(attendanceDays.isEmpty() ? null : attendanceDays.last());
    if (from == null || to == null || to.isBefore(from)) {
      return days;
    }
    for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
      days.add(day);
    }
    return days;
  }
}
