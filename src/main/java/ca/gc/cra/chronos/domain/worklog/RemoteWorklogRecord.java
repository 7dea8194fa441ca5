package ca.gc.cra.chronos.domain.worklog;

import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Worklog previously booked in the ticketing system.
 *
 * @param id worklog identifier
 * @param ticketKey ticket the worklog is booked on
 * @param authorId author account id; empty when unknown
 * @param interval booked span ({@code started .. started + duration})
 * @param comment worklog comment; empty when absent
 * @since 0.1.0
 */
public record RemoteWorklogRecord(
    String id, String ticketKey, String authorId, TimeInterval interval, String comment) {
  public RemoteWorklogRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ticketKey, "ticketKey");
    Objects.requireNonNull(interval, "interval");
    if (id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
    authorId = authorId == null ? "" : authorId;
    comment = comment == null ? "" : comment;
  }

  public static RemoteWorklogRecord of(
      String id, String ticketKey, String authorId, LocalDateTime started, Duration duration) {
    return new RemoteWorklogRecord(id, ticketKey, authorId, new TimeInterval(started, started.plus(duration)), "");
  }

  public LocalDateTime start() {
    return interval.start();
  }

  public LocalDateTime end() {
    return interval.end();
  }

  public Duration duration() {
    return interval.duration();
  }
}
