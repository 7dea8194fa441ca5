package ca.gc.cra.chronos.domain.compare;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One discrepancy on one day. Time-of-day differences fill the {@code *Time} fields, duration
 * differences the {@code *Duration} fields; outliers name the affected ticket.
 *
 * @param date calendar day
 * @param type discrepancy kind
 * @param groundTruthTime attendance time, or {@code null}
 * @param remoteTime booked time, or {@code null}
 * @param groundTruthDuration attendance duration, or {@code null}
 * @param remoteDuration booked duration, or {@code null}
 * @param ticketKey affected ticket for outliers; empty otherwise
 * @param details human-readable explanation; empty when the type says it all
 * @since 0.1.0
 */
public record TimeDifference(
    LocalDate date,
    DifferenceType type,
    LocalDateTime groundTruthTime,
    LocalDateTime remoteTime,
    Duration groundTruthDuration,
    Duration remoteDuration,
    String ticketKey,
    String details) {

  public TimeDifference {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(type, "type");
    ticketKey = ticketKey == null ? "" : ticketKey;
    details = details == null ? "" : details;
  }

  public static TimeDifference ofTimes(
      LocalDate date, DifferenceType type, LocalDateTime groundTruth, LocalDateTime remote) {
    return new TimeDifference(date, type, groundTruth, remote, null, null, "", "");
  }

  public static TimeDifference ofDurations(
      LocalDate date, DifferenceType type, Duration groundTruth, Duration remote) {
    return new TimeDifference(date, type, null, null, groundTruth, remote, "", "");
  }

  public static TimeDifference outlier(
      LocalDate date,
      DifferenceType type,
      LocalDateTime groundTruth,
      LocalDateTime remote,
      Duration remoteDuration,
      String ticketKey,
      String details) {
    return new TimeDifference(date, type, groundTruth, remote, null, remoteDuration, ticketKey, details);
  }
}
