package ca.gc.cra.chronos.domain.worklog;

import java.util.Objects;

/**
 * Ticket key with its summary line, as returned by ticket search.
 *
 * @param key ticket key
 * @param summary summary line; empty when unknown
 * @since 0.1.0
 */
public record TicketSummary(String key, String summary) {
  public TicketSummary {
    Objects.requireNonNull(key, "key");
    summary = summary == null ? "" : summary;
  }
}
