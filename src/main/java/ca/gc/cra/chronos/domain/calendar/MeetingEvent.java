package ca.gc.cra.chronos.domain.calendar;

import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Calendar event as imported from calendar text, or one concrete occurrence of a
 * recurring series.
 * <p><strong>Why:</strong> Carries every attribute the meeting filter and recurrence expansion inspect, so
 * the calendar layer never has to go back to the raw text.</p>
 * <p><strong>Role:</strong> Domain value created once at import; occurrences and clipped copies are new
 * instances produced through the {@code with*} methods.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param interval event time span in local wall time
 * @param title event summary; empty when absent
 * @param allDay whether the event was declared with date-only bounds
 * @param status raw {@code STATUS} value; empty when absent
 * @param transparency raw {@code TRANSP} value; empty when absent
 * @param busyStatus vendor or standard busy status; empty when absent
 * @param attendeeCount number of attendee lines
 * @param selfParticipation participation status of the configured identity, upper-cased; empty when
 *     the identity is not listed
 * @param recurrenceRule raw {@code RRULE} value; empty for single events
 * @param exceptionDates dates excluded from the series
 * @param uid series identifier; empty when absent
 * @param recurrenceId original start of an exception instance, or {@code null}
 * @param categories raw categories; empty when absent
 * @param description event description; empty when absent
 * @since 0.1.0
 */
public record MeetingEvent(
    TimeInterval interval,
    String title,
    boolean allDay,
    String status,
    String transparency,
    String busyStatus,
    int attendeeCount,
    String selfParticipation,
    String recurrenceRule,
    List<LocalDate> exceptionDates,
    String uid,
    LocalDateTime recurrenceId,
    String categories,
    String description) {

  private static final Set<String> CANCEL_WORDS = Set.of("abgesagt", "canceled", "cancelled");
  private static final Set<String> ACTIVE_PARTICIPATION = Set.of("NEEDS-ACTION", "ACCEPTED", "TENTATIVE");
  private static final Set<String> DAY_OFF_WORDS = Set.of("urlaub", "feiertag", "krank", "abwesend");
  private static final Set<String> WORKING_ELSEWHERE_WORDS = Set.of("homeoffice", "an anderem ort");

  public MeetingEvent {
    Objects.requireNonNull(interval, "interval");
    title = title == null ? "" : title;
    status = status == null ? "" : status;
    transparency = transparency == null ? "" : transparency;
    busyStatus = busyStatus == null ? "" : busyStatus;
    selfParticipation = selfParticipation == null ? "" : selfParticipation.toUpperCase(Locale.ROOT);
    recurrenceRule = recurrenceRule == null ? "" : recurrenceRule;
    exceptionDates = exceptionDates == null ? List.of() : List.copyOf(exceptionDates);
    uid = uid == null ? "" : uid;
    categories = categories == null ? "" : categories;
    description = description == null ? "" : description;
    if (attendeeCount < 0) {
      throw new IllegalArgumentException("attendeeCount must be >= 0");
    }
  }

  public static Builder builder(TimeInterval interval) {
    return new Builder(interval);
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

  public boolean isRecurring() {
    return !recurrenceRule.isBlank();
  }

  public boolean isExceptionInstance() {
    return recurrenceId != null;
  }

  public Optional<String> selfParticipationStatus() {
    return selfParticipation.isEmpty() ? Optional.empty() : Optional.of(selfParticipation);
  }

  /**
   * Cancelled by status or by a cancellation word in title or description.
   *
   * @return {@code true} when the event should be treated as not taking place
   */
  public boolean isCancelled() {
    if (status.toUpperCase(Locale.ROOT).contains("CANCEL")) {
      return true;
    }
    String lowerTitle = title.toLowerCase(Locale.ROOT);
    String lowerDescription = description.toLowerCase(Locale.ROOT);
    for (String word : CANCEL_WORDS) {
      if (lowerTitle.contains(word) || lowerDescription.contains(word)) {
        return true;
      }
    }
    return false;
  }

  /** Cancelled, or the configured identity's status is something other than pending/accepted/tentative. */
  public boolean isCancelledOrDeclined() {
    if (isCancelled()) {
      return true;
    }
    return !selfParticipation.isEmpty() && !ACTIVE_PARTICIPATION.contains(selfParticipation);
  }

  /**
   * All-day entry marking the person as absent (vacation, public holiday, sick, out of office).
   * Working-elsewhere entries never count.
   */
  public boolean isAllDayAbsence() {
    if (!allDay) {
      return false;
    }
    String lower = title.toLowerCase(Locale.ROOT);
    for (String word : WORKING_ELSEWHERE_WORDS) {
      if (lower.contains(word)) {
        return false;
      }
    }
    for (String word : DAY_OFF_WORDS) {
      if (lower.contains(word)) {
        return true;
      }
    }
    return "OOF".equalsIgnoreCase(busyStatus);
  }

  public boolean crossesMidnight() {
    return !interval.start().toLocalDate().equals(interval.end().toLocalDate());
  }

  public MeetingEvent withInterval(TimeInterval newInterval) {
    return new MeetingEvent(newInterval, title, allDay, status, transparency, busyStatus, attendeeCount,
        selfParticipation, recurrenceRule, exceptionDates, uid, recurrenceId, categories, description);
  }

  public MeetingEvent withTitle(String newTitle) {
    return new MeetingEvent(interval, newTitle, allDay, status, transparency, busyStatus, attendeeCount,
        selfParticipation, recurrenceRule, exceptionDates, uid, recurrenceId, categories, description);
  }

  /** Fluent builder used by the calendar parser and tests. */
  public static final class Builder {
    private TimeInterval interval;
    private String title = "";
    private boolean allDay;
    private String status = "";
    private String transparency = "";
    private String busyStatus = "";
    private int attendeeCount;
    private String selfParticipation = "";
    private String recurrenceRule = "";
    private List<LocalDate> exceptionDates = List.of();
    private String uid = "";
    private LocalDateTime recurrenceId;
    private String categories = "";
    private String description = "";

    private Builder(TimeInterval interval) {
      this.interval = interval;
    }

    public Builder title(String value) {
      this.title = value;
      return this;
    }

    public Builder allDay(boolean value) {
      this.allDay = value;
      return this;
    }

    public Builder status(String value) {
      this.status = value;
      return this;
    }

    public Builder transparency(String value) {
      this.transparency = value;
      return this;
    }

    public Builder busyStatus(String value) {
      this.busyStatus = value;
      return this;
    }

    public Builder attendeeCount(int value) {
      this.attendeeCount = value;
      return this;
    }

    public Builder selfParticipation(String value) {
      this.selfParticipation = value;
      return this;
    }

    public Builder recurrenceRule(String value) {
      this.recurrenceRule = value;
      return this;
    }

    public Builder exceptionDates(List<LocalDate> value) {
      this.exceptionDates = value;
      return this;
    }

    public Builder uid(String value) {
      this.uid = value;
      return this;
    }

    public Builder recurrenceId(LocalDateTime value) {
      this.recurrenceId = value;
      return this;
    }

    public Builder categories(String value) {
      this.categories = value;
      return this;
    }

    public Builder description(String value) {
      this.description = value;
      return this;
    }

    public MeetingEvent build() {
      return new MeetingEvent(interval, title, allDay, status, transparency, busyStatus, attendeeCount,
          selfParticipation, recurrenceRule, exceptionDates, uid, recurrenceId, categories, description);
    }
  }
}
