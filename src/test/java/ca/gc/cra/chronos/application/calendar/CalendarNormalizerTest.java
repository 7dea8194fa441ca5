package ca.gc.cra.chronos.application.calendar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chronos.domain.calendar.DayCalendar;
import ca.gc.cra.chronos.domain.calendar.MeetingEvent;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.testutil.IcsFixtures;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CalendarNormalizerTest {
  private static final LocalDate MONDAY = LocalDate.of(2024, 3, 4);

  private CalendarNormalizer normalizer;

  @BeforeEach
  void setUp() {
    normalizer = CalendarNormalizer.fromText(
        IcsFixtures.WEEK, IcsFixtures.SELF, ZoneId.of("Europe/Vienna"), MeetingFilter.DEFAULT_NON_MEETING_HINTS);
  }

  private static List<String> titles(List<MeetingEvent> meetings) {
    return meetings.stream().map(MeetingEvent::title).toList();
  }

  @Test
  void dayPathMergesOverlapsAndJoinsTitles() {
    DayCalendar day = normalizer.dayCalendar(MONDAY);

    assertEquals(List.of("Daily Standup", "Sprint Review + Architecture sync"), titles(day.meetings()));
    assertEquals(
        new TimeInterval(MONDAY.atTime(10, 0), MONDAY.atTime(11, 30)), day.meetings().get(1).interval());
    assertFalse(day.dayOff());
  }

  @Test
  void allDayAbsenceMarksDayOff() {
    DayCalendar tuesday = normalizer.dayCalendar(MONDAY.plusDays(1));

    assertTrue(tuesday.dayOff());
    assertTrue(tuesday.meetings().isEmpty());
  }

  @Test
  void dayCalendarIsMemoized() {
    assertSame(normalizer.dayCalendar(MONDAY), normalizer.dayCalendar(MONDAY));
  }

  @Test
  void rangePathAppliesParticipationStatus() {
    normalizer.buildRange(" ME@example.org ", MONDAY, MONDAY.plusDays(2));

    assertEquals(List.of("Daily Standup", "Architecture sync"),
        titles(normalizer.meetingsForRange(MONDAY, IcsFixtures.SELF)));
    assertTrue(normalizer.meetingsForRange(MONDAY.plusDays(2), IcsFixtures.SELF).isEmpty());
    assertTrue(normalizer.rangeCovers(MONDAY.plusDays(2), IcsFixtures.SELF));
  }

  @Test
  void rangeMissesOtherIdentityAndDaysOutsideRange() {
    normalizer.buildRange(IcsFixtures.SELF, MONDAY, MONDAY);

    assertTrue(normalizer.meetingsForRange(MONDAY, "someone@example.org").isEmpty());
    assertFalse(normalizer.rangeCovers(MONDAY.plusDays(1), IcsFixtures.SELF));
  }

  @Test
  void cancelledExceptionInstanceRemovesOccurrence() {
    assertTrue(normalizer.dayCalendar(LocalDate.of(2024, 3, 11)).meetings().isEmpty());
    assertEquals(List.of("Daily Standup"), titles(normalizer.dayCalendar(LocalDate.of(2024, 3, 13)).meetings()));
  }

  @Test
  void updatingHintsInvalidatesDayAndRangeResults() {
    normalizer.buildRange(IcsFixtures.SELF, MONDAY, MONDAY);
    normalizer.dayCalendar(MONDAY);

    normalizer.updateNonMeetingHints(List.of("standup", "homeoffice"));

    assertEquals(List.of("Sprint Review + Architecture sync"), titles(normalizer.dayCalendar(MONDAY).meetings()));
    assertFalse(normalizer.rangeCovers(MONDAY, IcsFixtures.SELF));
    assertTrue(normalizer.meetingsForRange(MONDAY, IcsFixtures.SELF).isEmpty());
  }

  @Test
  void invertedRangeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> normalizer.buildRange(IcsFixtures.SELF, MONDAY, MONDAY.minusDays(1)));
  }
}
