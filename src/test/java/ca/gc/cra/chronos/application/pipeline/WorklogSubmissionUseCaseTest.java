package ca.gc.cra.chronos.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.domain.worklog.DeltaState;
import ca.gc.cra.chronos.domain.worklog.DraftSegment;
import ca.gc.cra.chronos.testutil.InMemoryTicketingPort;
import ca.gc.cra.chronos.testutil.RecordingMetricsPort;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class WorklogSubmissionUseCaseTest {
  private static final LocalDateTime NINE = LocalDateTime.of(2024, 3, 4, 9, 0);

  private static DraftSegment draft(String key, int hourOffset) {
    LocalDateTime start = NINE.plusHours(hourOffset);
    return DraftSegment.work(new TimeInterval(start, start.plusMinutes(45)), key, "Work");
  }

  @Test
  void submitsNewDraftsSkipsDuplicatesAndRecordsFailures() {
    InMemoryTicketingPort ticketing = new InMemoryTicketingPort()
        .withTicket("ABC-1", "Parser")
        .withTicket("REJ-1", "Locked");
    ticketing.rejectedWrites.add("REJ-1");
    ticketing.failing.add("BAD-1");
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    WorklogSubmissionUseCase.Result result = new WorklogSubmissionUseCase(ticketing, metrics).submit(List.of(
        draft("ABC-1", 0).withState(DeltaState.DUPLICATE),
        draft("ABC-1", 1),
        draft("REJ-1", 2),
        draft("BAD-1", 3),
        draft("NEW-1", 4)));

    assertEquals(2, result.created());
    assertEquals(2, result.failed());
    assertEquals(1, result.skipped());
    assertEquals(4, result.outcomes().size());
    assertEquals(2, metrics.count("submit.worklog.created"));
    assertEquals(2, metrics.count("submit.worklog.failed"));
    assertEquals(2700L, ticketing.worklogsOf("ABC-1").get(0).duration().getSeconds());
    assertEquals(1, ticketing.worklogsOf("NEW-1").size());
    assertTrue(result.outcomes().get(2).message().contains("503 for BAD-1"));
  }

  @Test
  void sameTicketIsBookedOncePerDraft() {
    InMemoryTicketingPort ticketing = new InMemoryTicketingPort().withTicket("ABC-1", "Parser");

    new WorklogSubmissionUseCase(ticketing, null).submit(List.of(draft("ABC-1", 0), draft("ABC-1", 1)));

    assertEquals(2, ticketing.worklogsOf("ABC-1").size());
    assertEquals(2, ticketing.calls.size());
  }
}
