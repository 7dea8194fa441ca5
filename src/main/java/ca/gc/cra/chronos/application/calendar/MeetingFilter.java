package ca.gc.cra.chronos.application.calendar;

import ca.gc.cra.chronos.domain.calendar.MeetingEvent;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Decides whether a calendar entry counts as a meeting.
 * <p><strong>Why:</strong> Calendars mix meetings with location markers, focus blocks, travel and social
 * events; only real meetings become drafts.</p>
 * <p><strong>Rules:</strong> An entry is rejected when it is cancelled, all-day, crosses midnight, lasts more
 * than ten hours, is marked transparent or free/elsewhere/out-of-office/tentative, has no attendees (series
 * exception instances excepted), has no title, or its title contains a non-meeting hint.</p>
 * <p>{@link #acceptsForSelf(MeetingEvent)} additionally rejects entries whose participation status for the
 * configured identity is present and neither {@code NEEDS-ACTION} nor {@code ACCEPTED}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class MeetingFilter {
  /** Title fragments marking non-meeting entries, compared lower-case. */
  public static final List<String> DEFAULT_NON_MEETING_HINTS = List.of(
      "homeoffice", "an anderem ort tätig", "im büro", "im office", "office", "büro",
      "arbeitsort", "arbeitsplatz", "standort", "working elsewhere",
      "focus", "focus time", "fokuszeit",
      "reise", "anreise", "commute", "fahrt", "fahrtzeit", "travel",
      "anwesenheit", "präsenz", "teilzeit",
      "weihnacht", "christmas", "save the date", "ski", "ausflug", "bbq", "grillen", "feier");

  static final Duration MAX_MEETING_LENGTH = Duration.ofHours(10);
  private static final Set<String> NON_BUSY = Set.of("FREE", "WORKINGELSEWHERE", "OOF", "TENTATIVE");
  private static final Set<String> SELF_ACCEPTED = Set.of("NEEDS-ACTION", "ACCEPTED");

  private final List<String> hints;

  /**
   * @param hints non-meeting title fragments; blanks are ignored
   */
  public MeetingFilter(Collection<String> hints) {
    Objects.requireNonNull(hints, "hints");
    this.hints = hints.stream()
        .filter(Objects::nonNull)
        .map(h -> h.trim().toLowerCase(Locale.ROOT))
        .filter(h -> !h.isEmpty())
        .distinct()
        .toList();
  }

  public static MeetingFilter withDefaultHints() {
    return new MeetingFilter(DEFAULT_NON_MEETING_HINTS);
  }

  public List<String> hints() {
    return hints;
  }

  public boolean accepts(MeetingEvent event) {
    return rejectionReason(event).isEmpty();
  }

  public boolean acceptsForSelf(MeetingEvent event) {
    if (!accepts(event)) {
      return false;
    }
    return event.selfParticipationStatus().map(SELF_ACCEPTED::contains).orElse(true);
  }

  /**
   * Explains why {@link #accepts(MeetingEvent)} rejects {@code event}.
   *
   * @param event candidate entry
   * @return short reason, empty when the entry is a meeting
   */
  public Optional<String> rejectionReason(MeetingEvent event) {
    Objects.requireNonNull(event, "event");
    if (event.isCancelled()) {
      return Optional.of("cancelled");
    }
    if (event.allDay()) {
      return Optional.of("all-day");
    }
    if (event.crossesMidnight()) {
      return Optional.of("crosses midnight");
    }
    if (event.duration().compareTo(MAX_MEETING_LENGTH) > 0) {
      return Optional.of("longer than " + MAX_MEETING_LENGTH.toHours() + "h");
    }
    if ("TRANSPARENT".equalsIgnoreCase(event.transparency())) {
      return Optional.of("transparent");
    }
    String busy = event.busyStatus().toUpperCase(Locale.ROOT);
    if (NON_BUSY.contains(busy)) {
      return Optional.of("busy status " + busy);
    }
    if (event.attendeeCount() == 0 && !event.isExceptionInstance()) {
      return Optional.of("no attendees");
    }
    String title = event.title().toLowerCase(Locale.ROOT);
    if (title.isBlank()) {
      return Optional.of("no title");
    }
    for (String hint : hints) {
      if (title.contains(hint)) {
        return Optional.of("non-meeting hint '" + hint + "'");
      }
    }
    return Optional.empty();
  }
}
