package ca.gc.cra.chronos.application.calendar;

import ca.gc.cra.chronos.domain.calendar.DayCalendar;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Per-day memo of normalized calendars, tied to the filter version that produced it.
 *
 * <p>Entries computed under an older version are discarded on the next lookup.</p>
 */
final class DayCalendarCache {
  private final Map<LocalDate, DayCalendar> entries = new HashMap<>();
  private long version = -1;

  DayCalendar get(LocalDate day, long currentVersion, Function<LocalDate, DayCalendar> compute) {
    if (version != currentVersion) {
      entries.clear();
      version = currentVersion;
    }
    return entries.computeIfAbsent(day, compute);
  }

  int size() {
    return entries.size();
  }

  void clear() {
    entries.clear();
    version = -1;
  }
}
