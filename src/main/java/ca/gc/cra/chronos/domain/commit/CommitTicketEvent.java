package ca.gc.cra.chronos.domain.commit;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Point in time at which work switched to a ticket, derived from one commit.
 *
 * @param timestamp commit time
 * @param ticketKey upper-case ticket key, e.g. {@code ABC-123}
 * @param projectId source project
 * @param firstLine first line of the commit message
 * @since 0.1.0
 */
public record CommitTicketEvent(
    LocalDateTime timestamp, String ticketKey, String projectId, String firstLine) {
  public CommitTicketEvent {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(ticketKey, "ticketKey");
    if (ticketKey.isBlank()) {
      throw new IllegalArgumentException("ticketKey must not be blank");
    }
    projectId = projectId == null ? "" : projectId;
    firstLine = firstLine == null ? "" : firstLine;
  }
}
