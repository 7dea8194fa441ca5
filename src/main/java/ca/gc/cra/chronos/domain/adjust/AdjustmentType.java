package ca.gc.cra.chronos.domain.adjust;

/**
 * Kind of correction applied to a booked worklog.
 *
 * @since 0.1.0
 */
public enum AdjustmentType {
  MOVE_START,
  MOVE_END,
  /** Record ends inside a pause; its end moves to the pause start. */
  SHORTEN_BEFORE,
  /** Record starts inside a pause; its start moves to the pause end. */
  SHORTEN_AFTER,
  /** Record spans a pause; it is cut in two around the pause. */
  SPLIT,
  /** Record lies completely within a pause. */
  DELETE
}
