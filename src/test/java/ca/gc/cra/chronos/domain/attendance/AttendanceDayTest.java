package ca.gc.cra.chronos.domain.attendance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class AttendanceDayTest {
  private static final LocalDate MONDAY = LocalDate.of(2024, 3, 4);

  private static AttendanceRow work(LocalDate day, int fromHour, int toHour) {
    return AttendanceRow.work("Arbeitszeit", day.atTime(fromHour, 0), day.atTime(toHour, 0));
  }

  @Test
  void groupOrdersDaysAndKeepsRowOrder() {
    LocalDate tuesday = MONDAY.plusDays(1);
    AttendanceRow late = work(MONDAY, 13, 17);
    AttendanceRow early = work(MONDAY, 8, 12);

    List<AttendanceDay> days = AttendanceDay.group(List.of(work(tuesday, 8, 16), late, early));

    assertEquals(List.of(MONDAY, tuesday), days.stream().map(AttendanceDay::date).toList());
    assertEquals(List.of(late, early), days.get(0).rows());
  }

  @Test
  void rowsOfAnotherDayAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new AttendanceDay(MONDAY, List.of(work(MONDAY.plusDays(1), 8, 16))));
  }

  @Test
  void absenceQuantitiesAreSummed() {
    AttendanceRow sick = new AttendanceRow(MONDAY, "Krank", null, null, null, null, null, null, 0.5, 0, null, null);
    AttendanceRow paid = work(MONDAY, 8, 12).withPaidNonWork(Duration.ofMinutes(45));

    AttendanceDay day = new AttendanceDay(MONDAY, List.of(sick, paid));

    assertEquals(0.5, day.sickDays());
    assertEquals(Duration.ofMinutes(45), day.paidNonWork());
    assertTrue(day.hasStructuredAbsence());
    assertFalse(new AttendanceDay(MONDAY, List.of(paid)).hasStructuredAbsence());
  }

  @Test
  void rowValidatesItsSpan() {
    LocalDateTime nine = MONDAY.atTime(9, 0);

    assertThrows(IllegalArgumentException.class,
        () -> new AttendanceRow(MONDAY, "x", nine, null, null, null, null, null, 0, 0, null, null));
    assertThrows(IllegalArgumentException.class, () -> AttendanceRow.work("x", nine, nine));
    assertThrows(IllegalArgumentException.class,
        () -> work(MONDAY, 8, 9).withAbsences(-1, 0, Duration.ZERO, Duration.ZERO));
  }

  @Test
  void withPausesRecomputesPauseTotal() {
    AttendanceRow row = work(MONDAY, 8, 17).withPauses(List.of(
        new TimeInterval(MONDAY.atTime(10, 0), MONDAY.atTime(10, 15)),
        new TimeInterval(MONDAY.atTime(12, 0), MONDAY.atTime(12, 30))));

    assertEquals(Duration.ofMinutes(45), row.pauseTotal());
    assertTrue(row.describedByAny(List.of("arbeit")));
    assertFalse(row.describedByAny(List.of("urlaub")));
  }
}
