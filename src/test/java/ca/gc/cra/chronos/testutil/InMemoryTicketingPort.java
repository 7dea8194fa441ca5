package ca.gc.cra.chronos.testutil;

import ca.gc.cra.chronos.application.port.TicketingPort;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import ca.gc.cra.chronos.domain.worklog.TicketSummary;
import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ticketing fake keeping worklogs in memory. Keys listed in {@link #failing} throw on every call
 * touching them; write calls are recorded in {@link #calls}.
 */
public final class InMemoryTicketingPort implements TicketingPort {
  public final Map<String, String> summaries = new LinkedHashMap<>();
  public final Map<String, List<RemoteWorklogRecord>> worklogs = new LinkedHashMap<>();
  public final Set<String> failing = new HashSet<>();
  public final Set<String> rejectedWrites = new HashSet<>();
  public final Set<String> rejectedCreates = new HashSet<>();
  public final List<String> calls = new ArrayList<>();
  public boolean searchFails;
  private int nextId = 1000;

  public InMemoryTicketingPort withTicket(String key, String summary) {
    summaries.put(key, summary);
    worklogs.computeIfAbsent(key, k -> new ArrayList<>());
    return this;
  }

  public InMemoryTicketingPort withWorklog(
      String key, String id, String author, LocalDateTime started, Duration duration) {
    withTicket(key, summaries.getOrDefault(key, ""));
    worklogs.get(key).add(RemoteWorklogRecord.of(id, key, author, started, duration));
    return this;
  }

  public List<RemoteWorklogRecord> worklogsOf(String key) {
    return worklogs.getOrDefault(key, List.of());
  }

  @Override
  public String resolveId(String key) throws IOException {
    check(key);
    if (!summaries.containsKey(key)) {
      throw new IOException("Issue does not exist: " + key);
    }
    return "id-" + key;
  }

  @Override
  public List<TicketSummary> search(String text) throws IOException {
    if (searchFails) {
      throw new IOException("search unavailable");
    }
    List<TicketSummary> out = new ArrayList<>();
    summaries.forEach((key, summary) -> {
      if (key.contains(text) || summary.contains(text)) {
        out.add(new TicketSummary(key, summary));
      }
    });
    return out;
  }

  @Override
  public Map<String, String> fetchSummaries(Collection<String> keys) throws IOException {
    Map<String, String> out = new LinkedHashMap<>();
    for (String key : keys) {
      check(key);
      if (summaries.containsKey(key)) {
        out.put(key, summaries.get(key));
      }
    }
    return out;
  }

  @Override
  public List<RemoteWorklogRecord> fetchWorklogs(String ticketKey) throws IOException {
    check(ticketKey);
    return List.copyOf(worklogs.getOrDefault(ticketKey, List.of()));
  }

  @Override
  public List<String> findTicketsWithWorklogs(String authorId, LocalDate from, LocalDate to)
      throws IOException {
    if (searchFails) {
      throw new IOException("search unavailable");
    }
    List<String> out = new ArrayList<>();
    worklogs.forEach((key, records) -> {
      boolean hit = records.stream().anyMatch(r -> r.authorId().equals(authorId)
          && !r.start().toLocalDate().isBefore(from)
          && !r.start().toLocalDate().isAfter(to));
      if (hit) {
        out.add(key);
      }
    });
    return out;
  }

  @Override
  public WriteResult create(String ticket, LocalDateTime started, long durationSeconds, String comment)
      throws IOException {
    String key = ticket.startsWith("id-") ? ticket.substring(3) : ticket;
    check(key);
    calls.add("create " + key + " " + started + " " + durationSeconds);
    if (rejectedWrites.contains(key) || rejectedCreates.contains(key)) {
      return WriteResult.error("rejected " + key);
    }
    String id = String.valueOf(nextId++);
    worklogs.computeIfAbsent(key, k -> new ArrayList<>()).add(new RemoteWorklogRecord(
        id, key, "me", new TimeInterval(started, started.plusSeconds(durationSeconds)), comment));
    return WriteResult.ok(id);
  }

  @Override
  public WriteResult update(String ticket, String worklogId, LocalDateTime started, long durationSeconds)
      throws IOException {
    check(ticket);
    calls.add("update " + ticket + " " + worklogId + " " + started + " " + durationSeconds);
    if (rejectedWrites.contains(ticket)) {
      return WriteResult.error("rejected " + ticket);
    }
    List<RemoteWorklogRecord> records = worklogs.getOrDefault(ticket, new ArrayList<>());
    for (int i = 0; i < records.size(); i++) {
      RemoteWorklogRecord record = records.get(i);
      if (record.id().equals(worklogId)) {
        records.set(i, new RemoteWorklogRecord(worklogId, ticket, record.authorId(),
            new TimeInterval(started, started.plusSeconds(durationSeconds)), record.comment()));
        return WriteResult.ok(worklogId);
      }
    }
    return WriteResult.error("Worklog not found: " + worklogId);
  }

  @Override
  public WriteResult delete(String ticket, String worklogId) throws IOException {
    check(ticket);
    calls.add("delete " + ticket + " " + worklogId);
    if (rejectedWrites.contains(ticket)) {
      return WriteResult.error("rejected " + ticket);
    }
    boolean removed = worklogs.getOrDefault(ticket, new ArrayList<>()).removeIf(r -> r.id().equals(worklogId));
    return removed ? WriteResult.ok(worklogId) : WriteResult.error("Worklog not found: " + worklogId);
  }

  private void check(String key) throws IOException {
    if (failing.contains(key)) {
      throw new IOException("503 for " + key);
    }
  }
}
