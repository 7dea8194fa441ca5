package ca.gc.cra.chronos.domain.compare;

/**
 * Kind of discrepancy between attendance ground truth and booked worklogs.
 *
 * @since 0.1.0
 */
public enum DifferenceType {
  START_TIME,
  END_TIME,
  PAUSE_TIME,
  /** Net working time. */
  DURATION,
  REMOTE_BEFORE_WORK,
  REMOTE_AFTER_WORK,
  /** Booking overlapping a break, or booked on a day without attendance. */
  REMOTE_DURING_BREAK
}
