package ca.gc.cra.chronos.domain.worklog;

/**
 * Classification of a draft segment against worklogs already booked on the same ticket.
 *
 * @since 0.1.0
 */
public enum DeltaState {
  /** No booked worklog on the ticket overlaps the draft. */
  NEW,
  /** A booked worklog overlaps and matches start and duration within tolerance. */
  DUPLICATE,
  /** A booked worklog overlaps but differs beyond tolerance. */
  OVERLAP
}
