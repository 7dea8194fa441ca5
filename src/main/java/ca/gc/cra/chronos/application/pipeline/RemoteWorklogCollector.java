package ca.gc.cra.chronos.application.pipeline;

import ca.gc.cra.chronos.application.port.MetricsPort;
import ca.gc.cra.chronos.application.port.TicketingPort;
import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects one author's booked worklogs for a date range, grouped by local day.
 *
 * <p>Tickets are fetched one at a time. A failing ticket is recorded as a failed unit and skipped.</p>
 *
 * @since 0.1.0
 */
public final class RemoteWorklogCollector {
  private static final Logger log = LoggerFactory.getLogger(RemoteWorklogCollector.class);

  private final TicketingPort ticketing;
  private final MetricsPort metrics;

  public RemoteWorklogCollector(TicketingPort ticketing, MetricsPort metrics) {
    this.ticketing = Objects.requireNonNull(ticketing, "ticketing");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Worklogs per day plus the outcome of every call.
   *
   * @param byDay records per local day, ascending, each list sorted by start
   * @param outcomes per-unit outcomes
   */
  public record Collected(Map<LocalDate, List<RemoteWorklogRecord>> byDay, List<UnitOutcome> outcomes) {
    public Collected {
      Map<LocalDate, List<RemoteWorklogRecord>> copy = new TreeMap<>();
      byDay.forEach((day, records) -> copy.put(day, List.copyOf(records)));
      byDay = Collections.unmodifiableMap(copy);
      outcomes = List.copyOf(outcomes);
    }
  }

  /**
   * Collects worklogs by {@code authorId} starting within {@code [from, to]}.
   *
   * @param authorId author account id
   * @param from first day, inclusive
   * @param to last day, inclusive
   * @return grouped records and outcomes
   */
  public Collected collect(String authorId, LocalDate from, LocalDate to) {
    Objects.requireNonNull(authorId, "authorId");
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    List<UnitOutcome> outcomes = new ArrayList<>();
    Map<LocalDate, List<RemoteWorklogRecord>> byDay = new TreeMap<>();
    List<String> tickets;
    try {
      tickets = ticketing.findTicketsWithWorklogs(authorId, from, to);
      outcomes.add(UnitOutcome.succeeded("search"));
    } catch (IOException ex) {
      log.warn("Ticket search for {} failed: {}", authorId, ex.getMessage(), ex);
      metrics.increment("reconcile.unit.failed");
      outcomes.add(UnitOutcome.failed("search", UnitOutcome.describe(ex)));
      return new Collected(byDay, outcomes);
    }
    int kept = 0;
    for (String ticket : tickets) {
      String unit = "worklogs:" + ticket;
      try {
        for (RemoteWorklogRecord record : ticketing.fetchWorklogs(ticket)) {
          LocalDate day = record.start().toLocalDate();
          if (authorId.equals(record.authorId()) && !day.isBefore(from) && !day.isAfter(to)) {
            byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(record);
            kept++;
          }
        }
        outcomes.add(UnitOutcome.succeeded(unit));
        metrics.increment("reconcile.unit.succeeded");
      } catch (IOException ex) {
        log.warn("Fetching worklogs of {} failed: {}", ticket, ex.getMessage(), ex);
        metrics.increment("reconcile.unit.failed");
        outcomes.add(UnitOutcome.failed(unit, UnitOutcome.describe(ex)));
      }
    }
    byDay.values().forEach(records -> records.sort(Comparator.comparing(RemoteWorklogRecord::start)));
    log.info("Collected {} worklogs of {} on {} tickets for {}..{}", kept, authorId, tickets.size(), from, to);
    return new Collected(byDay, outcomes);
  }
}
