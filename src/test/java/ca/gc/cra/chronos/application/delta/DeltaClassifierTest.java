package ca.gc.cra.chronos.application.delta;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.domain.worklog.DeltaState;
import ca.gc.cra.chronos.domain.worklog.DraftSegment;
import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class DeltaClassifierTest {
  private static final LocalDateTime NINE = LocalDateTime.of(2024, 3, 4, 9, 0);
  private final DeltaClassifier classifier = new DeltaClassifier();
  private final DraftSegment draft =
      DraftSegment.work(new TimeInterval(NINE, NINE.plusHours(1)), "ABC-1", "Work");

  @Test
  void noRecordsMeansNew() {
    assertEquals(DeltaState.NEW, classifier.classify(draft, List.of()));
  }

  @Test
  void closeStartAndDurationIsDuplicate() {
    RemoteWorklogRecord booked = RemoteWorklogRecord.of(
        "1", "abc-1", "me", NINE.plusMinutes(4), Duration.ofMinutes(60).plusSeconds(50));

    assertEquals(DeltaState.DUPLICATE, classifier.classify(draft, List.of(booked)));
  }

  @Test
  void overlapOutsideToleranceIsOverlap() {
    RemoteWorklogRecord booked = RemoteWorklogRecord.of("1", "ABC-1", "me", NINE.plusMinutes(30), Duration.ofHours(1));

    assertEquals(DeltaState.OVERLAP, classifier.classify(draft, List.of(booked)));
  }

  @Test
  void duplicateWinsOverEarlierOverlap() {
    RemoteWorklogRecord overlap = RemoteWorklogRecord.of("1", "ABC-1", "me", NINE.plusMinutes(30), Duration.ofHours(1));
    RemoteWorklogRecord same = RemoteWorklogRecord.of("2", "ABC-1", "me", NINE, Duration.ofHours(1));

    assertEquals(DeltaState.DUPLICATE, classifier.classify(draft, List.of(overlap, same)));
  }

  @Test
  void otherTicketsAndTouchingRecordsAreIgnored() {
    RemoteWorklogRecord otherTicket = RemoteWorklogRecord.of("1", "ABC-2", "me", NINE, Duration.ofHours(1));
    RemoteWorklogRecord touching = RemoteWorklogRecord.of("2", "ABC-1", "me", NINE.plusHours(1), Duration.ofHours(1));

    assertEquals(DeltaState.NEW, classifier.classify(draft, List.of(otherTicket, touching)));
  }

  @Test
  void classifyAllReturnsTaggedCopies() {
    RemoteWorklogRecord same = RemoteWorklogRecord.of("2", "ABC-1", "me", NINE, Duration.ofHours(1));

    List<DraftSegment> tagged = classifier.classifyAll(List.of(draft), List.of(same));

    assertEquals(DeltaState.DUPLICATE, tagged.get(0).state());
    assertEquals(DeltaState.NEW, draft.state());
  }
}
