package ca.gc.cra.chronos.domain.compare;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Comparison outcome for one day.
 *
 * @param date calendar day
 * @param differences discrepancies found; empty when the day matches
 * @param hasGroundTruth whether attendance has a timed row for the day
 * @param hasRemote whether worklogs are booked on the day
 * @param remoteOnly bookings exist but attendance does not
 * @param groundTruthPause regular attendance pause
 * @param paidNonWork paid-non-work time recorded in attendance
 * @param remotePause gap time between bookings
 * @since 0.1.0
 */
public record DayComparison(
    LocalDate date,
    List<TimeDifference> differences,
    boolean hasGroundTruth,
    boolean hasRemote,
    boolean remoteOnly,
    Duration groundTruthPause,
    Duration paidNonWork,
    Duration remotePause) {

  public DayComparison {
    Objects.requireNonNull(date, "date");
    differences = List.copyOf(Objects.requireNonNull(differences, "differences"));
    groundTruthPause = groundTruthPause == null ? Duration.ZERO : groundTruthPause;
    paidNonWork = paidNonWork == null ? Duration.ZERO : paidNonWork;
    remotePause = remotePause == null ? Duration.ZERO : remotePause;
  }

  /** {@code true} when attendance exists but nothing is booked. */
  public boolean localOnly() {
    return hasGroundTruth && !hasRemote;
  }

  public boolean hasIssues() {
    return !differences.isEmpty() || remoteOnly;
  }

  public boolean allGood() {
    return differences.isEmpty() && hasGroundTruth && hasRemote && !remoteOnly;
  }
}
