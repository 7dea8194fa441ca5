package ca.gc.cra.chronos.application.pipeline;

import ca.gc.cra.chronos.application.port.MetricsPort;
import ca.gc.cra.chronos.application.port.TicketingPort;
import ca.gc.cra.chronos.application.port.TicketingPort.WriteResult;
import ca.gc.cra.chronos.domain.worklog.DeltaState;
import ca.gc.cra.chronos.domain.worklog.DraftSegment;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Books classified drafts as new worklogs.
 * <p>Drafts classified {@link DeltaState#DUPLICATE} are skipped. Each remaining draft is one unit; a failed
 * create is recorded and the next draft is submitted.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 * <p><strong>Observability:</strong> Emits {@code submit.worklog.created} and {@code submit.worklog.failed}.</p>
 *
 * @since 0.1.0
 */
public final class WorklogSubmissionUseCase {
  private static final Logger log = LoggerFactory.getLogger(WorklogSubmissionUseCase.class);

  private final TicketingPort ticketing;
  private final MetricsPort metrics;

  public WorklogSubmissionUseCase(TicketingPort ticketing, MetricsPort metrics) {
    this.ticketing = Objects.requireNonNull(ticketing, "ticketing");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Submission totals.
   *
   * @param created drafts booked
   * @param failed drafts whose create failed
   * @param skipped duplicates not submitted
   * @param outcomes one outcome per submitted draft
   */
  public record Result(int created, int failed, int skipped, List<UnitOutcome> outcomes) {
    public Result {
      outcomes = List.copyOf(outcomes);
    }
  }

  /**
   * Submits every draft that is not a duplicate.
   *
   * @param drafts classified drafts
   * @return totals and per-draft outcomes
   */
  public Result submit(List<DraftSegment> drafts) {
    Objects.requireNonNull(drafts, "drafts");
    Map<String, String> resolved = new HashMap<>();
    List<UnitOutcome> outcomes = new ArrayList<>();
    int created = 0;
    int failed = 0;
    int skipped = 0;
    for (DraftSegment draft : drafts) {
      if (draft.state() == DeltaState.DUPLICATE) {
        skipped++;
        continue;
      }
      String unit = "create:" + draft.ticketKey() + "@" + draft.interval().start();
      String target = resolved.computeIfAbsent(draft.ticketKey(), this::resolve);
      WriteResult result;
      try {
        result = ticketing.create(
            target, draft.interval().start(), draft.duration().getSeconds(), draft.label());
      } catch (IOException ex) {
        result = WriteResult.error(UnitOutcome.describe(ex));
      }
      if (result.ok()) {
        created++;
        metrics.increment("submit.worklog.created");
        outcomes.add(UnitOutcome.succeeded(unit));
        log.info("Booked {} {} ({}s) as worklog {}", draft.ticketKey(), draft.interval().start(),
            draft.duration().getSeconds(), result.id());
      } else {
        failed++;
        metrics.increment("submit.worklog.failed");
        outcomes.add(UnitOutcome.failed(unit, result.error()));
        log.warn("Booking {} {} failed: {}", draft.ticketKey(), draft.interval().start(), result.error());
      }
    }
    log.info("Submission finished: {} created, {} failed, {} duplicates skipped", created, failed, skipped);
    return new Result(created, failed, skipped, outcomes);
  }

  private String resolve(String key) {
    try {
      return ticketing.resolveId(key);
    } catch (IOException ex) {
      log.warn("Could not resolve ticket {} ({}); booking against the key", key, ex.getMessage());
      return key;
    }
  }
}
