package ca.gc.cra.chronos.application.calendar;

import ca.gc.cra.chronos.domain.calendar.MeetingEvent;
import ca.gc.cra.chronos.domain.calendar.RecurrenceRule;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands DAILY and WEEKLY series into concrete occurrences inside a window.
 *
 * <p>Occurrences keep the series' wall-clock start time and duration. Walking starts at the series start
 * when the rule has a {@code COUNT} (counted across the whole series) and otherwise at the later of series
 * start and window start. Other frequencies are returned unexpanded when the series itself intersects the
 * window.</p>
 *
 * @since 0.1.0
 */
public final class RecurrenceExpander {
  private static final Logger log = LoggerFactory.getLogger(RecurrenceExpander.class);
  static final int MAX_ITERATIONS = 5000;

  private final ZoneId zone;

  public RecurrenceExpander(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Returns occurrences of {@code series} that intersect {@code window}.
   *
   * @param series recurring event
   * @param window half-open window
   * @param extraExclusions dates of cancelled or declined exception instances of the same series
   * @return occurrences in chronological order
   */
  public List<MeetingEvent> expand(
      MeetingEvent series, TimeInterval window, Collection<LocalDate> extraExclusions) {
    Objects.requireNonNull(series, "series");
    Objects.requireNonNull(window, "window");
    if (!series.isRecurring()) {
      return series.interval().overlaps(window) ? List.of(series) : List.of();
    }
    RecurrenceRule rule;
    try {
      rule = RecurrenceRule.parse(series.recurrenceRule(), zone);
    } catch (IllegalArgumentException ex) {
      log.warn("Ignoring unparsable recurrence '{}' of '{}': {}",
          series.recurrenceRule(), series.title(), ex.getMessage());
      return series.interval().overlaps(window) ? List.of(series) : List.of();
    }
    if (!rule.isSupported()) {
      return series.interval().overlaps(window) ? List.of(series) : List.of();
    }

    Set<LocalDate> excluded = new HashSet<>(series.exceptionDates());
    if (extraExclusions != null) {
      excluded.addAll(extraExclusions);
    }
    Set<DayOfWeek> byDay = rule.byDay().isEmpty()
        ? Set.of(series.start().getDayOfWeek())
        : rule.byDay();
    Duration length = series.duration();
    LocalDate baseDate = series.start().toLocalDate();
    LocalDate date = baseDate;
    if (rule.count() == null && window.start().toLocalDate().minusDays(1).isAfter(baseDate)) {
      // an occurrence of the previous day may still reach into the window
      date = window.start().toLocalDate().minusDays(1);
    }

    List<MeetingEvent> occurrences = new ArrayList<>();
    int emitted = 0;
    int iterations = 0;
    while (true) {
      if (++iterations > MAX_ITERATIONS) {
        log.warn("Stopped expanding '{}' after {} days", series.title(), MAX_ITERATIONS);
        break;
      }
      LocalDateTime start = date.atTime(series.start().toLocalTime());
      if (!start.isBefore(window.end())) {
        break;
      }
      if (rule.until() != null && start.isAfter(rule.until())) {
        break;
      }
      if (rule.count() != null && emitted >= rule.count()) {
        break;
      }
      if (occursOn(rule, byDay, baseDate, date) && !excluded.contains(date)) {
        emitted++;
        TimeInterval occurrence = new TimeInterval(start, start.plus(length));
        if (occurrence.overlaps(window)) {
          occurrences.add(series.withInterval(occurrence));
        }
      }
      date = date.plusDays(1);
    }
    return occurrences;
  }

  private static boolean occursOn(
      RecurrenceRule rule, Set<DayOfWeek> byDay, LocalDate baseDate, LocalDate date) {
    long days = ChronoUnit.DAYS.between(baseDate, date);
    return switch (rule.frequency()) {
      case DAILY -> days % rule.interval() == 0;
      case WEEKLY -> (days / 7) % rule.interval() == 0 && byDay.contains(date.getDayOfWeek());
      case UNSUPPORTED -> false;
    };
  }
}
