package ca.gc.cra.chronos.domain.adjust;

import java.util.Objects;

/**
 * Result of applying one {@link AdjustmentOperation}.
 *
 * @param operation applied step
 * @param status outcome
 * @param message failure detail; empty on success
 * @since 0.1.0
 */
public record AdjustmentOutcome(AdjustmentOperation operation, Status status, String message) {

  /** Outcome of one step. */
  public enum Status {
    APPLIED,
    FAILED,
    /** Split whose first half was updated but whose second half could not be created. */
    PARTIAL
  }

  public AdjustmentOutcome {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(status, "status");
    message = message == null ? "" : message;
  }

  public static AdjustmentOutcome applied(AdjustmentOperation operation) {
    return new AdjustmentOutcome(operation, Status.APPLIED, "");
  }

  public static AdjustmentOutcome failed(AdjustmentOperation operation, String message) {
    return new AdjustmentOutcome(operation, Status.FAILED, message);
  }

  public static AdjustmentOutcome partial(AdjustmentOperation operation, String message) {
    return new AdjustmentOutcome(operation, Status.PARTIAL, message);
  }

  public boolean succeeded() {
    return status == Status.APPLIED;
  }
}
