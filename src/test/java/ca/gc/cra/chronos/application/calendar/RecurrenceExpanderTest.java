package ca.gc.cra.chronos.application.calendar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chronos.domain.calendar.MeetingEvent;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecurrenceExpanderTest {
  private final RecurrenceExpander expander = new RecurrenceExpander(ZoneId.of("Europe/Vienna"));

  private static MeetingEvent series(LocalDateTime start, int minutes, String rule, List<LocalDate> exdates) {
    return MeetingEvent.builder(new TimeInterval(start, start.plusMinutes(minutes)))
        .title("Standup")
        .attendeeCount(2)
        .recurrenceRule(rule)
        .exceptionDates(exdates)
        .build();
  }

  private static TimeInterval march() {
    return new TimeInterval(LocalDate.of(2024, 3, 1).atStartOfDay(), LocalDate.of(2024, 4, 1).atStartOfDay());
  }

  private static List<LocalDate> dates(List<MeetingEvent> occurrences) {
    return occurrences.stream().map(o -> o.start().toLocalDate()).toList();
  }

  @Test
  void weeklyByDayWithCountSkipsExcludedDates() {
    MeetingEvent standup = series(LocalDateTime.of(2024, 3, 4, 9, 15), 15,
        "FREQ=WEEKLY;BYDAY=MO,WE;COUNT=4", List.of(LocalDate.of(2024, 3, 6)));

    List<MeetingEvent> occurrences = expander.expand(standup, march(), List.of());

    assertEquals(List.of(
        LocalDate.of(2024, 3, 4),
        LocalDate.of(2024, 3, 11),
        LocalDate.of(2024, 3, 13),
        LocalDate.of(2024, 3, 18)), dates(occurrences));
    assertEquals(LocalDateTime.of(2024, 3, 18, 9, 30), occurrences.get(3).end());
  }

  @Test
  void countIsAppliedAcrossWholeSeries() {
    MeetingEvent standup = series(LocalDateTime.of(2024, 3, 4, 9, 15), 15,
        "FREQ=WEEKLY;BYDAY=MO,WE;COUNT=4", List.of());
    TimeInterval lateWindow = new TimeInterval(
        LocalDate.of(2024, 3, 11).atStartOfDay(), LocalDate.of(2024, 3, 31).atStartOfDay());

    assertEquals(List.of(LocalDate.of(2024, 3, 11), LocalDate.of(2024, 3, 13)),
        dates(expander.expand(standup, lateWindow, List.of())));
  }

  @Test
  void dailyWithIntervalAndDateOnlyUntilIncludesLastDay() {
    MeetingEvent daily = series(LocalDateTime.of(2024, 3, 4, 9, 0), 30,
        "FREQ=DAILY;INTERVAL=2;UNTIL=20240308", List.of());

    assertEquals(
        List.of(LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 6), LocalDate.of(2024, 3, 8)),
        dates(expander.expand(daily, march(), List.of())));
  }

  @Test
  void extraExclusionsRemoveCancelledInstances() {
    MeetingEvent daily = series(LocalDateTime.of(2024, 3, 4, 9, 0), 30, "FREQ=DAILY;COUNT=3", List.of());

    assertEquals(
        List.of(LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 6), LocalDate.of(2024, 3, 7)),
        dates(expander.expand(daily, march(), List.of(LocalDate.of(2024, 3, 5)))));
  }

  @Test
  void longRunningSeriesStartsWalkingNearWindow() {
    MeetingEvent daily = series(LocalDateTime.of(2020, 1, 1, 9, 0), 30, "FREQ=DAILY", List.of());
    TimeInterval day = new TimeInterval(
        LocalDate.of(2024, 3, 4).atStartOfDay(), LocalDate.of(2024, 3, 5).atStartOfDay());

    assertEquals(List.of(LocalDate.of(2024, 3, 4)), dates(expander.expand(daily, day, List.of())));
  }

  @Test
  void unsupportedFrequencyReturnsSeriesWhenItIntersects() {
    MeetingEvent monthly = series(LocalDateTime.of(2024, 3, 4, 9, 0), 30, "FREQ=MONTHLY", List.of());

    assertEquals(List.of(monthly), expander.expand(monthly, march(), List.of()));
  }

  @Test
  void singleEventOutsideWindowYieldsNothing() {
    MeetingEvent single = series(LocalDateTime.of(2024, 2, 4, 9, 0), 30, "", List.of());

    assertTrue(expander.expand(single, march(), List.of()).isEmpty());
  }
}
