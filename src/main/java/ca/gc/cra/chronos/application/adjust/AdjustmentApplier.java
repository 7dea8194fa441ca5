package ca.gc.cra.chronos.application.adjust;

import ca.gc.cra.chronos.application.port.MetricsPort;
import ca.gc.cra.chronos.application.port.TicketingPort;
import ca.gc.cra.chronos.application.port.TicketingPort.WriteResult;
import ca.gc.cra.chronos.domain.adjust.AdjustmentOperation;
import ca.gc.cra.chronos.domain.adjust.AdjustmentOutcome;
import ca.gc.cra.chronos.domain.adjust.AdjustmentPlan;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Executes an {@link AdjustmentPlan} against the ticketing system, one call at a time.
 * <p><strong>Semantics:</strong>
 * <ul>
 *   <li>Moves and shortenings are one update call; deletes are one delete call.</li>
 *   <li>A split updates the original to its first half and then creates the second half. A failed update
 *   fails the step without creating anything; a failed create after a successful update is reported as
 *   {@link AdjustmentOutcome.Status#PARTIAL}.</li>
 *   <li>Later steps targeting a split's second part use the id the create call returned; when that create
 *   failed they fail too.</li>
 *   <li>An {@link IOException} counts as the call failing. The applier always continues with the next step.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; create one per plan run.</p>
 * <p><strong>Observability:</strong> Emits {@code adjust.operation.applied} and {@code adjust.operation.failed}.</p>
 *
 * @since 0.1.0
 */
public final class AdjustmentApplier {
  private static final Logger log = LoggerFactory.getLogger(AdjustmentApplier.class);

  private final TicketingPort ticketing;
  private final MetricsPort metrics;
  private final Map<String, String> createdIds = new HashMap<>();
  private final Set<String> missingParts = new HashSet<>();

  public AdjustmentApplier(TicketingPort ticketing, MetricsPort metrics) {
    this.ticketing = Objects.requireNonNull(ticketing, "ticketing");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Applies every step of {@code plan} in order.
   *
   * @param plan plan to apply
   * @return one outcome per step, in plan order
   */
  public List<AdjustmentOutcome> apply(AdjustmentPlan plan) {
    Objects.requireNonNull(plan, "plan");
    List<AdjustmentOutcome> outcomes = new ArrayList<>(plan.operations().size());
    for (AdjustmentOperation op : plan.operations()) {
      AdjustmentOutcome outcome = applyOne(op);
      outcomes.add(outcome);
      if (outcome.succeeded()) {
        metrics.increment("adjust.operation.applied");
        log.info("{}: applied {}", plan.date(), op.description());
      } else {
        metrics.increment("adjust.operation.failed");
        log.warn("{}: {} {}: {}", plan.date(), outcome.status(), op.description(), outcome.message());
      }
    }
    return outcomes;
  }

  private AdjustmentOutcome applyOne(AdjustmentOperation op) {
    RemoteWorklogRecord target = op.target();
    if (missingParts.contains(target.id())) {
      return AdjustmentOutcome.failed(op, "worklog " + target.id() + " was never created");
    }
    String worklogId = createdIds.getOrDefault(target.id(), target.id());
    String ticket = target.ticketKey();

    return switch (op.type()) {
      case MOVE_START, MOVE_END, SHORTEN_BEFORE, SHORTEN_AFTER -> {
        WriteResult result = update(ticket, worklogId, op.newInterval());
        yield result.ok() ? AdjustmentOutcome.applied(op) : AdjustmentOutcome.failed(op, result.error());
      }
      case DELETE -> {
        WriteResult result = delete(ticket, worklogId);
        yield result.ok() ? AdjustmentOutcome.applied(op) : AdjustmentOutcome.failed(op, result.error());
      }
      case SPLIT -> {
        RemoteWorklogRecord second = op.secondPart().orElseThrow();
        WriteResult first = update(ticket, worklogId, op.newInterval());
        if (!first.ok()) {
          missingParts.add(second.id());
          yield AdjustmentOutcome.failed(op, "first part: " + first.error());
        }
        WriteResult created = create(ticket, second);
        if (!created.ok()) {
          missingParts.add(second.id());
          yield AdjustmentOutcome.partial(op, "second part: " + created.error());
        }
        createdIds.put(second.id(), created.id());
        yield AdjustmentOutcome.applied(op);
      }
    };
  }

  private WriteResult update(String ticket, String worklogId, TimeInterval interval) {
    try {
      return ticketing.update(ticket, worklogId, interval.start(), interval.duration().toSeconds());
    } catch (IOException ex) {
      return WriteResult.error(String.valueOf(ex.getMessage()));
    }
  }

  private WriteResult delete(String ticket, String worklogId) {
    try {
      return ticketing.delete(ticket, worklogId);
    } catch (IOException ex) {
      return WriteResult.error(String.valueOf(ex.getMessage()));
    }
  }

  private WriteResult create(String ticket, RemoteWorklogRecord part) {
    try {
      return ticketing.create(ticket, part.start(), part.duration().toSeconds(), part.comment());
    } catch (IOException ex) {
      return WriteResult.error(String.valueOf(ex.getMessage()));
    }
  }
}
