package ca.gc.cra.chronos.application.calendar;

import ca.gc.cra.chronos.domain.calendar.MeetingEvent;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Meetings per day for one identity and date range, built in a single pass.
 *
 * <p>A lookup misses when the day lies outside the range, the identity differs or the filter version
 * moved on since the range was built.</p>
 */
final class RangeMeetingCache {
  private final Map<LocalDate, List<MeetingEvent>> buckets = new HashMap<>();
  private String identity;
  private LocalDate from;
  private LocalDate to;
  private long version = -1;

  void build(
      String identity,
      LocalDate from,
      LocalDate to,
      long currentVersion,
      Function<LocalDate, List<MeetingEvent>> meetingsOfDay) {
    buckets.clear();
    for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
      buckets.put(day, meetingsOfDay.apply(day));
    }
    this.identity = identity;
    this.from = from;
    this.to = to;
    this.version = currentVersion;
  }

  boolean covers(LocalDate day, String requestedIdentity, long currentVersion) {
    return identity != null
        && identity.equals(requestedIdentity)
        && version == currentVersion
        && !day.isBefore(from)
        && !day.isAfter(to);
  }

  Optional<List<MeetingEvent>> meetingsOn(LocalDate day, String requestedIdentity, long currentVersion) {
    if (!covers(day, requestedIdentity, currentVersion)) {
      return Optional.empty();
    }
    return Optional.of(buckets.getOrDefault(day, List.of()));
  }

  void clear() {
    buckets.clear();
    identity = null;
    from = null;
    to = null;
    version = -1;
  }
}
