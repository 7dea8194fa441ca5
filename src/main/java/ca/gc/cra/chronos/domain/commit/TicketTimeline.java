package ca.gc.cra.chronos.domain.commit;

import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Time-sorted sequence of {@link CommitTicketEvent}s with nearest-neighbour lookups.
 * <p><strong>Why:</strong> Segmentation asks "which ticket was active at time t" and "which ticket comes
 * next"; both are binary searches over one ordered list.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class TicketTimeline {
  private static final TicketTimeline EMPTY = new TicketTimeline(List.of());

  private final List<CommitTicketEvent> events;

  private TicketTimeline(List<CommitTicketEvent> sorted) {
    this.events = sorted;
  }

  public static TicketTimeline empty() {
    return EMPTY;
  }

  /**
   * Builds a timeline from events in any order. Events with equal timestamps keep their input order.
   *
   * @param events ticket events
   * @return sorted timeline
   */
  public static TicketTimeline of(Collection<CommitTicketEvent> events) {
    Objects.requireNonNull(events, "events");
    List<CommitTicketEvent> sorted = new ArrayList<>(events);
    sorted.sort(Comparator.comparing(CommitTicketEvent::timestamp));
    return new TicketTimeline(List.copyOf(sorted));
  }

  /**
   * Derives ticket events from commits; commits without a ticket key are skipped.
   *
   * @param commits commits of any project
   * @return sorted timeline
   */
  public static TicketTimeline fromCommits(Collection<CommitRecord> commits) {
    List<CommitTicketEvent> out = new ArrayList<>();
    for (CommitRecord commit : commits) {
      TicketKeys.extract(commit.message()).ifPresent(key -> out.add(
          new CommitTicketEvent(commit.timestamp(), key, commit.projectId(), commit.firstLine())));
    }
    return of(out);
  }

  public int size() {
    return events.size();
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }

  public List<CommitTicketEvent> events() {
    return events;
  }

  /**
   * Returns the last event whose timestamp is at or before {@code t}.
   *
   * @param t lookup instant
   * @return latest event not after {@code t}
   */
  public Optional<CommitTicketEvent> latestAtOrBefore(LocalDateTime t) {
    int lo = 0;
    int hi = events.size() - 1;
    int idx = -1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      if (events.get(mid).timestamp().isAfter(t)) {
        hi = mid - 1;
      } else {
        idx = mid;
        lo = mid + 1;
      }
    }
    return idx >= 0 ? Optional.of(events.get(idx)) : Optional.empty();
  }

  /**
   * Returns the first event whose timestamp is at or after {@code t}.
   *
   * @param t lookup instant
   * @return earliest event not before {@code t}
   */
  public Optional<CommitTicketEvent> earliestAtOrAfter(LocalDateTime t) {
    int idx = firstIndexNotBefore(t);
    return idx < events.size() ? Optional.of(events.get(idx)) : Optional.empty();
  }

  /**
   * Events strictly inside the open interval {@code (start, end)}, in time order.
   *
   * @param interval interval whose bounds are excluded
   * @return events strictly between the bounds
   */
  public List<CommitTicketEvent> strictlyWithin(TimeInterval interval) {
    List<CommitTicketEvent> out = new ArrayList<>();
    for (int i = firstIndexNotBefore(interval.start()); i < events.size(); i++) {
      CommitTicketEvent event = events.get(i);
      if (!event.timestamp().isBefore(interval.end())) {
        break;
      }
      if (event.timestamp().isAfter(interval.start())) {
        out.add(event);
      }
    }
    return out;
  }

  /** Events on the given calendar day, in time order. */
  public List<CommitTicketEvent> onDay(LocalDate day) {
    LocalDateTime from = day.atStartOfDay();
    LocalDateTime to = day.plusDays(1).atStartOfDay();
    List<CommitTicketEvent> out = new ArrayList<>();
    for (int i = firstIndexNotBefore(from); i < events.size(); i++) {
      CommitTicketEvent event = events.get(i);
      if (!event.timestamp().isBefore(to)) {
        break;
      }
      out.add(event);
    }
    return out;
  }

  private int firstIndexNotBefore(LocalDateTime t) {
    int lo = 0;
    int hi = events.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (events.get(mid).timestamp().isBefore(t)) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }
}
