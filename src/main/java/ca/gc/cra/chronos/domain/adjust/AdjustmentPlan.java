package ca.gc.cra.chronos.domain.adjust;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Ordered adjustment steps for one day together with the pause totals they were derived from.
 *
 * @param date calendar day
 * @param operations steps in application order
 * @param groundTruthPause attendance pause plus paid-non-work time
 * @param remotePause total gap time between booked worklogs
 * @since 0.1.0
 */
public record AdjustmentPlan(
    LocalDate date, List<AdjustmentOperation> operations, Duration groundTruthPause, Duration remotePause) {
  public AdjustmentPlan {
    Objects.requireNonNull(date, "date");
    operations = List.copyOf(Objects.requireNonNull(operations, "operations"));
    groundTruthPause = groundTruthPause == null ? Duration.ZERO : groundTruthPause;
    remotePause = remotePause == null ? Duration.ZERO : remotePause;
  }

  public static AdjustmentPlan empty(LocalDate date) {
    return new AdjustmentPlan(date, List.of(), Duration.ZERO, Duration.ZERO);
  }

  public boolean hasChanges() {
    return !operations.isEmpty();
  }
}
