package ca.gc.cra.chronos.domain.calendar;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Parsed {@code RRULE} value. Only {@code FREQ}, {@code UNTIL}, {@code COUNT}, {@code INTERVAL} and
 * {@code BYDAY} are interpreted.
 *
 * @param frequency recurrence frequency
 * @param until last permitted occurrence start, or {@code null}
 * @param count maximum number of occurrences, or {@code null}
 * @param interval step between periods; at least 1
 * @param byDay weekdays for weekly rules; empty means the series start's weekday
 * @since 0.1.0
 */
public record RecurrenceRule(
    Frequency frequency, LocalDateTime until, Integer count, int interval, Set<DayOfWeek> byDay) {

  private static final Map<String, DayOfWeek> WEEKDAYS = Map.of(
      "MO", DayOfWeek.MONDAY,
      "TU", DayOfWeek.TUESDAY,
      "WE", DayOfWeek.WEDNESDAY,
      "TH", DayOfWeek.THURSDAY,
      "FR", DayOfWeek.FRIDAY,
      "SA", DayOfWeek.SATURDAY,
      "SU", DayOfWeek.SUNDAY);

  /** Frequencies the expander understands; everything else is {@link #UNSUPPORTED}. */
  public enum Frequency {
    DAILY,
    WEEKLY,
    UNSUPPORTED
  }

  public RecurrenceRule {
    Objects.requireNonNull(frequency, "frequency");
    if (interval < 1) {
      throw new IllegalArgumentException("interval must be >= 1");
    }
    byDay = byDay == null || byDay.isEmpty() ? Set.of() : Set.copyOf(byDay);
  }

  /**
   * Parses a raw rule such as {@code FREQ=WEEKLY;BYDAY=MO,WE;COUNT=4}.
   *
   * @param raw rule text
   * @param zone zone for UTC {@code UNTIL} values
   * @return parsed rule
   * @throws IllegalArgumentException when {@code UNTIL} cannot be parsed
   */
  public static RecurrenceRule parse(String raw, ZoneId zone) {
    Objects.requireNonNull(raw, "raw");
    Frequency frequency = Frequency.UNSUPPORTED;
    LocalDateTime until = null;
    Integer count = null;
    int interval = 1;
    Set<DayOfWeek> byDay = EnumSet.noneOf(DayOfWeek.class);

    for (String part : raw.split(";")) {
      int idx = part.indexOf('=');
      if (idx <= 0) {
        continue;
      }
      String key = part.substring(0, idx).trim().toUpperCase(Locale.ROOT);
      String value = part.substring(idx + 1).trim();
      switch (key) {
        case "FREQ" -> frequency = switch (value.toUpperCase(Locale.ROOT)) {
          case "DAILY" -> Frequency.DAILY;
          case "WEEKLY" -> Frequency.WEEKLY;
          default -> Frequency.UNSUPPORTED;
        };
        case "UNTIL" -> until = IcsDateTimes.isDateOnly(value)
            ? IcsDateTimes.parse(value, zone).toLocalDate().atTime(LocalTime.MAX)
            : IcsDateTimes.parse(value, zone);
        case "COUNT" -> {
          OptionalInt parsed = parsePositive(value);
          count = parsed.isPresent() ? parsed.getAsInt() : null;
        }
        case "INTERVAL" -> interval = parsePositive(value).orElse(1);
        case "BYDAY" -> {
          for (String token : value.split(",")) {
            String code = token.trim().toUpperCase(Locale.ROOT);
            // ordinal prefixes such as 1MO are not interpreted
            if (code.length() > 2) {
              code = code.substring(code.length() - 2);
            }
            DayOfWeek day = WEEKDAYS.get(code);
            if (day != null) {
              byDay.add(day);
            }
          }
        }
        default -> {
          // ignored rule part
        }
      }
    }
    return new RecurrenceRule(frequency, until, count, interval, byDay);
  }

  public boolean isSupported() {
    return frequency != Frequency.UNSUPPORTED;
  }

  public Optional<LocalDateTime> untilValue() {
    return Optional.ofNullable(until);
  }

  private static OptionalInt parsePositive(String value) {
    try {
      int parsed = Integer.parseInt(value.trim());
      return parsed > 0 ? OptionalInt.of(parsed) : OptionalInt.empty();
    } catch (NumberFormatException ex) {
      return OptionalInt.empty();
    }
  }
}
