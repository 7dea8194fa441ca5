package ca.gc.cra.chronos.domain.commit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class TicketTimelineTest {
  private static final LocalDate DAY = LocalDate.of(2024, 3, 4);

  private static CommitRecord commit(String id, int hour, String message) {
    return new CommitRecord(id, "42", DAY.atTime(hour, 0), message, "dev@example.org", "");
  }

  private final TicketTimeline timeline = TicketTimeline.fromCommits(List.of(
      commit("c", 15, "ABC-3 third"),
      commit("a", 9, "ABC-1 first"),
      commit("m", 11, "Merge branch ABC-2"),
      commit("b", 12, "ABC-2 second")));

  @Test
  void commitsWithoutKeyAreSkippedAndEventsSorted() {
    assertEquals(3, timeline.size());
    assertEquals(
        List.of("ABC-1", "ABC-2", "ABC-3"),
        timeline.events().stream().map(CommitTicketEvent::ticketKey).toList());
  }

  @Test
  void latestAtOrBeforeIncludesExactTimestamp() {
    assertEquals("ABC-2", timeline.latestAtOrBefore(DAY.atTime(12, 0)).orElseThrow().ticketKey());
    assertEquals("ABC-1", timeline.latestAtOrBefore(DAY.atTime(11, 59)).orElseThrow().ticketKey());
    assertTrue(timeline.latestAtOrBefore(DAY.atTime(8, 0)).isEmpty());
  }

  @Test
  void earliestAtOrAfterFindsNextEvent() {
    assertEquals("ABC-3", timeline.earliestAtOrAfter(DAY.atTime(12, 1)).orElseThrow().ticketKey());
    assertTrue(timeline.earliestAtOrAfter(DAY.atTime(16, 0)).isEmpty());
  }

  @Test
  void strictlyWithinExcludesBounds() {
    TimeInterval interval = new TimeInterval(DAY.atTime(9, 0), DAY.atTime(15, 0));
    List<CommitTicketEvent> inside = timeline.strictlyWithin(interval);

    assertEquals(1, inside.size());
    assertEquals("ABC-2", inside.get(0).ticketKey());
  }

  @Test
  void onDayReturnsOnlyThatDay() {
    assertEquals(3, timeline.onDay(DAY).size());
    assertTrue(timeline.onDay(DAY.plusDays(1)).isEmpty());
    LocalDateTime ignored = DAY.atStartOfDay();
    assertTrue(timeline.latestAtOrBefore(ignored).isEmpty());
  }

  @Test
  void madeByAnyMatchesCommitterIgnoringCase() {
    CommitRecord record =
        new CommitRecord("x", "1", DAY.atTime(9, 0), "ABC-1", "other@example.org", "Dev@Example.org");

    assertTrue(record.madeByAny(List.of("dev@example.org")));
    assertTrue(record.madeByAny(List.of()));
  }
}
