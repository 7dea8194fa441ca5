package ca.gc.cra.chronos.application.compare;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chronos.domain.attendance.AttendanceRow;
import ca.gc.cra.chronos.domain.compare.DayComparison;
import ca.gc.cra.chronos.domain.compare.DifferenceType;
import ca.gc.cra.chronos.domain.compare.TimeDifference;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

class TimeComparatorTest {
  private static final LocalDate MONDAY = LocalDate.of(2024, 3, 4);
  private final TimeComparator comparator = new TimeComparator();

  private static LocalDateTime at(LocalDate day, int hour, int minute) {
    return day.atTime(hour, minute);
  }

  private static AttendanceRow workdayWithLunch(LocalDate day) {
    return AttendanceRow.work("Arbeitszeit", at(day, 8, 0), at(day, 16, 30))
        .withPauses(List.of(new TimeInterval(at(day, 12, 0), at(day, 12, 30))));
  }

  private static RemoteWorklogRecord booked(LocalDate day, String key, int fromHour, int fromMinute, int toHour,
      int toMinute) {
    return new RemoteWorklogRecord(key + "@" + fromHour + ":" + fromMinute, key, "me",
        new TimeInterval(at(day, fromHour, fromMinute), at(day, toHour, toMinute)), "");
  }

  private List<DayComparison> compare(List<AttendanceRow> rows, List<RemoteWorklogRecord> records,
      boolean outlierMode, LocalDate... dates) {
    Map<LocalDate, List<RemoteWorklogRecord>> byDay = new TreeMap<>();
    for (RemoteWorklogRecord record : records) {
      byDay.computeIfAbsent(record.start().toLocalDate(), d -> new ArrayList<>()).add(record);
    }
    return comparator.compare(rows, byDay, List.of(dates), outlierMode);
  }

  private static List<DifferenceType> types(DayComparison day) {
    return day.differences().stream().map(TimeDifference::type).toList();
  }

  @Test
  void matchingDayIsAllGood() {
    List<DayComparison> result = compare(List.of(workdayWithLunch(MONDAY)), List.of(
        booked(MONDAY, "ABC-1", 8, 0, 12, 0),
        booked(MONDAY, "ABC-2", 12, 30, 16, 30)), false, MONDAY);

    assertEquals(1, result.size());
    assertTrue(result.get(0).allGood());
    assertEquals(Duration.ofMinutes(30), result.get(0).remotePause());
  }

  @Test
  void lateStartIsReportedWithNetDuration() {
    DayComparison day = compare(List.of(workdayWithLunch(MONDAY)), List.of(
        booked(MONDAY, "ABC-1", 8, 10, 12, 0),
        booked(MONDAY, "ABC-2", 12, 30, 16, 30)), false, MONDAY).get(0);

    assertEquals(List.of(DifferenceType.START_TIME, DifferenceType.DURATION), types(day));
    assertEquals(at(MONDAY, 8, 0), day.differences().get(0).groundTruthTime());
    assertEquals(at(MONDAY, 8, 10), day.differences().get(0).remoteTime());
    assertEquals(Duration.ofMinutes(470), day.differences().get(1).remoteDuration());
  }

  @Test
  void oneMinuteGapsCountAsWork() {
    DayComparison day = compare(List.of(workdayWithLunch(MONDAY)), List.of(
        booked(MONDAY, "ABC-1", 8, 0, 12, 0),
        booked(MONDAY, "ABC-2", 12, 30, 14, 0),
        booked(MONDAY, "ABC-3", 14, 1, 16, 30)), false, MONDAY).get(0);

    assertTrue(day.allGood());
  }

  @Test
  void paidNonWorkMayExplainEarlyEnd() {
    AttendanceRow row = AttendanceRow.work("Arbeitszeit", at(MONDAY, 8, 0), at(MONDAY, 16, 30))
        .withPaidNonWork(Duration.ofMinutes(30));

    DayComparison day = compare(List.of(row), List.of(booked(MONDAY, "ABC-1", 8, 0, 16, 0)), false, MONDAY).get(0);

    assertFalse(types(day).contains(DifferenceType.END_TIME));
    assertEquals(Duration.ofMinutes(30), day.paidNonWork());
  }

  @Test
  void bookingsWithoutAttendanceAreRemoteOnly() {
    LocalDate tuesday = MONDAY.plusDays(1);

    DayComparison day = compare(List.of(), List.of(booked(tuesday, "ABC-1", 9, 0, 10, 0)), false, tuesday).get(0);

    assertTrue(day.remoteOnly());
    assertTrue(day.differences().isEmpty());
    assertTrue(day.hasIssues());
  }

  @Test
  void attendanceWithoutBookingsIsLocalOnlyInNormalModeOnly() {
    List<AttendanceRow> rows = List.of(workdayWithLunch(MONDAY));

    assertTrue(compare(rows, List.of(), false, MONDAY).get(0).localOnly());
    assertTrue(compare(rows, List.of(), true, MONDAY).isEmpty());
  }

  @Test
  void weekendWithoutBookingsAndEmptyDaysAreSkipped() {
    LocalDate saturday = LocalDate.of(2024, 3, 9);

    assertTrue(compare(List.of(workdayWithLunch(saturday)), List.of(), false, saturday).isEmpty());
    assertTrue(compare(List.of(), List.of(), false, MONDAY).isEmpty());
  }

  @Test
  void absenceDayIsSkippedUnlessOutliersRequested() {
    List<AttendanceRow> rows = List.of(AttendanceRow.work("Urlaub", at(MONDAY, 8, 0), at(MONDAY, 16, 0)));
    List<RemoteWorklogRecord> records = List.of(booked(MONDAY, "ABC-1", 9, 0, 10, 0));

    assertTrue(compare(rows, records, false, MONDAY).isEmpty());
    DayComparison outliers = compare(rows, records, true, MONDAY).get(0);
    assertEquals(List.of(DifferenceType.REMOTE_DURING_BREAK), types(outliers));
    assertEquals("absence day (Urlaub)", outliers.differences().get(0).details());
  }

  @Test
  void outlierModeReportsBookingsOutsideWorkAndInBreaks() {
    DayComparison day = compare(List.of(workdayWithLunch(MONDAY)), List.of(
        booked(MONDAY, "ABC-1", 7, 30, 8, 30),
        booked(MONDAY, "ABC-2", 9, 0, 11, 45),
        booked(MONDAY, "ABC-3", 11, 45, 12, 15),
        booked(MONDAY, "ABC-4", 15, 0, 17, 0)), true, MONDAY).get(0);

    assertEquals(List.of(
        DifferenceType.REMOTE_BEFORE_WORK,
        DifferenceType.REMOTE_DURING_BREAK,
        DifferenceType.REMOTE_AFTER_WORK), types(day));
    assertEquals("ABC-3", day.differences().get(1).ticketKey());
    assertEquals("booked 11:45-12:15 during break 12:00-12:30", day.differences().get(1).details());
  }

  @Test
  void outlierModeOmitsCleanDays() {
    assertTrue(compare(List.of(workdayWithLunch(MONDAY)), List.of(
        booked(MONDAY, "ABC-1", 8, 0, 12, 0),
        booked(MONDAY, "ABC-2", 12, 30, 16, 30)), true, MONDAY).isEmpty());
  }
}
