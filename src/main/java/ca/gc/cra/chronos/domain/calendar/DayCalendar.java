package ca.gc.cra.chronos.domain.calendar;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Filtered, clipped and merged meetings of one calendar day, plus whether an all-day absence
 * entry falls on that day.
 *
 * @param day calendar day
 * @param meetings meetings sorted by start
 * @param dayOff {@code true} when an all-day absence entry covers the day
 * @since 0.1.0
 */
public record DayCalendar(LocalDate day, List<MeetingEvent> meetings, boolean dayOff) {
  public DayCalendar {
    Objects.requireNonNull(day, "day");
    meetings = List.copyOf(Objects.requireNonNull(meetings, "meetings"));
  }

  public static DayCalendar empty(LocalDate day) {
    return new DayCalendar(day, List.of(), false);
  }
}
