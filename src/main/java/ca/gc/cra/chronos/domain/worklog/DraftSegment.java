package ca.gc.cra.chronos.domain.worklog;

import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Provisional ticket-labelled time slice produced by one reconciliation pass.
 * <p><strong>Role:</strong> Output of segmentation, input to classification and submission. Never
 * persisted; a new pass produces new segments.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param interval time slice
 * @param ticketKey ticket the time is booked on
 * @param label free-text worklog comment
 * @param kind whether the slice stems from a meeting or from commit-routed work
 * @param state classification against booked worklogs
 * @since 0.1.0
 */
public record DraftSegment(
    TimeInterval interval, String ticketKey, String label, Kind kind, DeltaState state) {

  /** Origin of a draft segment. */
  public enum Kind {
    MEETING,
    WORK
  }

  public DraftSegment {
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(ticketKey, "ticketKey");
    Objects.requireNonNull(kind, "kind");
    label = label == null ? "" : label;
    state = state == null ? DeltaState.NEW : state;
  }

  public static DraftSegment meeting(TimeInterval interval, String ticketKey, String label) {
    return new DraftSegment(interval, ticketKey, label, Kind.MEETING, DeltaState.NEW);
  }

  public static DraftSegment work(TimeInterval interval, String ticketKey, String label) {
    return new DraftSegment(interval, ticketKey, label, Kind.WORK, DeltaState.NEW);
  }

  public Duration duration() {
    return interval.duration();
  }

  public boolean isMeeting() {
    return kind == Kind.MEETING;
  }

  public DraftSegment withState(DeltaState newState) {
    return new DraftSegment(interval, ticketKey, label, kind, newState);
  }

  public DraftSegment withLabel(String newLabel) {
    return new DraftSegment(interval, ticketKey, newLabel, kind, state);
  }
}
