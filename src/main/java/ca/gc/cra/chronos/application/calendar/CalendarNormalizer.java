package ca.gc.cra.chronos.application.calendar;

import ca.gc.cra.chronos.domain.calendar.DayCalendar;
import ca.gc.cra.chronos.domain.calendar.MeetingEvent;
import ca.gc.cra.chronos.domain.time.IntervalAlgebra;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns parsed calendar entries into the merged meeting list of a day.
 * <p><strong>Why:</strong> Segmentation needs non-overlapping meeting blocks clipped to one day, with
 * recurring series expanded and cancelled exceptions removed.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Collect the day's candidates: single entries plus expanded series occurrences.</li>
 *   <li>Flag the day off when an all-day absence entry is present.</li>
 *   <li>Filter, clip, sort and merge meetings; merged titles are joined with {@code " + "}.</li>
 *   <li>Memoize per-day results and per-identity range results.</li>
 * </ul>
 * <p>The day path ({@link #dayCalendar(LocalDate)}) does not look at the identity's participation status;
 * the range path ({@link #buildRange}) does.</p>
 * <p><strong>Cache invalidation:</strong> {@link #updateNonMeetingHints(Collection)} bumps a version that
 * both caches compare on lookup; {@link #invalidate()} drops everything.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per reconciliation pass.</p>
 *
 * @since 0.1.0
 */
public final class CalendarNormalizer {
  private static final Logger log = LoggerFactory.getLogger(CalendarNormalizer.class);
  static final String TITLE_SEPARATOR = " + ";

  private final List<MeetingEvent> singles;
  private final List<MeetingEvent> series;
  private final Map<String, List<LocalDate>> cancelledInstancesByUid;
  private final RecurrenceExpander expander;
  private final DayCalendarCache dayCache = new DayCalendarCache();
  private final RangeMeetingCache rangeCache = new RangeMeetingCache();
  private MeetingFilter filter;
  private long version;

  /**
   * @param events parsed entries
   * @param filter meeting filter holding the non-meeting hints
   * @param expander recurrence expander
   */
  public CalendarNormalizer(List<MeetingEvent> events, MeetingFilter filter, RecurrenceExpander expander) {
    Objects.requireNonNull(events, "events");
    this.filter = Objects.requireNonNull(filter, "filter");
    this.expander = Objects.requireNonNull(expander, "expander");
    List<MeetingEvent> single = new ArrayList<>();
    List<MeetingEvent> recurring = new ArrayList<>();
    Map<String, List<LocalDate>> cancelled = new HashMap<>();
    for (MeetingEvent event : events) {
      if (event.isRecurring() && !event.isExceptionInstance()) {
        recurring.add(event);
      } else {
        single.add(event);
      }
      if (event.isExceptionInstance() && event.isCancelledOrDeclined() && !event.uid().isEmpty()) {
        cancelled.computeIfAbsent(event.uid(), k -> new ArrayList<>())
            .add(event.recurrenceId().toLocalDate());
      }
    }
    this.singles = List.copyOf(single);
    this.series = List.copyOf(recurring);
    this.cancelledInstancesByUid = cancelled;
  }

  /**
   * Parses {@code icsText} and builds a normalizer over its entries.
   *
   * @param icsText calendar text
   * @param selfEmail identity whose participation status is retained
   * @param zone local zone
   * @param hints non-meeting hints
   * @return normalizer
   */
  public static CalendarNormalizer fromText(
      String icsText, String selfEmail, ZoneId zone, Collection<String> hints) {
    List<MeetingEvent> events = new IcsCalendarParser(zone).parse(icsText, selfEmail);
    return new CalendarNormalizer(events, new MeetingFilter(hints), new RecurrenceExpander(zone));
  }

  public List<String> nonMeetingHints() {
    return filter.hints();
  }

  /** Replaces the non-meeting hints; cached days and ranges become stale. */
  public void updateNonMeetingHints(Collection<String> hints) {
    this.filter = new MeetingFilter(hints);
    version++;
    log.debug("Non-meeting hints replaced ({} hints), calendar cache version {}", filter.hints().size(), version);
  }

  /** Drops all cached days and ranges. */
  public void invalidate() {
    dayCache.clear();
    rangeCache.clear();
  }

  /**
   * Merged meetings and day-off flag for {@code day}.
   *
   * @param day calendar day
   * @return normalized day, memoized until hints change or {@link #invalidate()} is called
   */
  public DayCalendar dayCalendar(LocalDate day) {
    Objects.requireNonNull(day, "day");
    return dayCache.get(day, version, d -> computeDay(d, filter::accepts));
  }

  /**
   * Computes every day of {@code [from, to]} for {@code identity} in one pass, applying the participation
   * status check in addition to the day path's rules.
   *
   * <p>{@code identity} only keys the range cache. Participation status was resolved for the
   * {@code selfEmail} given when the calendar text was parsed; passing a different identity here does not
   * change which meetings are kept.</p>
   */
  public void buildRange(String identity, LocalDate from, LocalDate to) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    if (to.isBefore(from)) {
      throw new IllegalArgumentException("range end " + to + " before start " + from);
    }
    String key = normalizeIdentity(identity);
    rangeCache.build(key, from, to, version, d -> computeDay(d, filter::acceptsForSelf).meetings());
    log.debug("Built meeting range {}..{} for {}", from, to, key);
  }

  public boolean rangeCovers(LocalDate day, String identity) {
    return rangeCache.covers(day, normalizeIdentity(identity), version);
  }

  /**
   * Meetings of {@code day} from the last {@link #buildRange} for {@code identity}.
   *
   * @return meetings, or an empty list when the range does not cover the day, the identity differs or the
   *     hints changed since it was built
   */
  public List<MeetingEvent> meetingsForRange(LocalDate day, String identity) {
    Optional<List<MeetingEvent>> cached = rangeCache.meetingsOn(day, normalizeIdentity(identity), version);
    return cached.orElse(List.of());
  }

  /** Single entries and expanded occurrences intersecting {@code day}, unfiltered. */
  public List<MeetingEvent> candidatesOn(LocalDate day) {
    TimeInterval window = dayWindow(day);
    List<MeetingEvent> candidates = new ArrayList<>();
    for (MeetingEvent event : singles) {
      if (event.interval().overlaps(window)) {
        candidates.add(event);
      }
    }
    for (MeetingEvent event : series) {
      List<LocalDate> exclusions = cancelledInstancesByUid.getOrDefault(event.uid(), List.of());
      candidates.addAll(expander.expand(event, window, exclusions));
    }
    candidates.sort(Comparator.comparing(MeetingEvent::interval));
    return candidates;
  }

  private DayCalendar computeDay(LocalDate day, Predicate<MeetingEvent> accepts) {
    TimeInterval window = dayWindow(day);
    List<MeetingEvent> candidates = candidatesOn(day);
    boolean dayOff = candidates.stream().anyMatch(MeetingEvent::isAllDayAbsence);

    List<MeetingEvent> clipped = new ArrayList<>();
    for (MeetingEvent candidate : candidates) {
      if (!accepts.test(candidate)) {
        if (log.isTraceEnabled()) {
          log.trace("{}: not a meeting '{}' ({})", day, candidate.title(),
              filter.rejectionReason(candidate).orElse("participation status"));
        }
        continue;
      }
      IntervalAlgebra.clip(candidate.interval(), window)
          .ifPresent(interval -> clipped.add(candidate.withInterval(interval)));
    }
    List<MeetingEvent> merged = IntervalAlgebra.mergeOverlapping(
        clipped,
        MeetingEvent::interval,
        (left, right) -> left
            .withInterval(IntervalAlgebra.span(left.interval(), right.interval()))
            .withTitle(left.title() + TITLE_SEPARATOR + right.title()));
    return new DayCalendar(day, merged, dayOff);
  }

  private static TimeInterval dayWindow(LocalDate day) {
    LocalDateTime start = day.atStartOfDay();
    return new TimeInterval(start, start.plusDays(1));
  }

  private static String normalizeIdentity(String identity) {
    return identity == null ? "" : identity.trim().toLowerCase(Locale.ROOT);
  }
}
