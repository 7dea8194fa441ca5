package ca.gc.cra.chronos.domain.calendar;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the date and date-time value forms found in calendar text into local wall time.
 *
 * <p>Accepted forms: {@code yyyyMMdd}, {@code yyyyMMdd'T'HHmm[ss][Z]} and ISO-8601 with or without
 * an offset. UTC and offset values are converted into the supplied zone; floating values are
 * taken as-is.</p>
 *
 * @since 0.1.0
 */
public final class IcsDateTimes {
  private static final Pattern DATE_ONLY = Pattern.compile("^(\\d{4})(\\d{2})(\\d{2})$");
  private static final Pattern BASIC =
      Pattern.compile("^(\\d{4})(\\d{2})(\\d{2})T(\\d{2})(\\d{2})(\\d{2})?(Z)?$");

  private IcsDateTimes() {
    // Utility
  }

  /**
   * Parses a date or date-time property value.
   *
   * @param raw raw value, e.g. {@code 20240115T083000Z}
   * @param zone zone that UTC values are converted into
   * @return local date-time; date-only values map to midnight
   * @throws IllegalArgumentException when the value matches none of the accepted forms
   */
  public static LocalDateTime parse(String raw, ZoneId zone) {
    Objects.requireNonNull(raw, "raw");
    Objects.requireNonNull(zone, "zone");
    String value = raw.trim();

    Matcher date = DATE_ONLY.matcher(value);
    if (date.matches()) {
      return LocalDate.of(
          Integer.parseInt(date.group(1)),
          Integer.parseInt(date.group(2)),
          Integer.parseInt(date.group(3))).atStartOfDay();
    }

    Matcher basic = BASIC.matcher(value);
    if (basic.matches()) {
      LocalDateTime local = LocalDateTime.of(
          Integer.parseInt(basic.group(1)),
          Integer.parseInt(basic.group(2)),
          Integer.parseInt(basic.group(3)),
          Integer.parseInt(basic.group(4)),
          Integer.parseInt(basic.group(5)),
          basic.group(6) != null ? Integer.parseInt(basic.group(6)) : 0);
      if (basic.group(7) != null) {
        return local.atOffset(ZoneOffset.UTC).atZoneSameInstant(zone).toLocalDateTime();
      }
      return local;
    }

    try {
      return OffsetDateTime.parse(value).atZoneSameInstant(zone).toLocalDateTime();
    } catch (DateTimeParseException ignored) {
      // not an offset form; try a floating ISO value next
    }
    try {
      return LocalDateTime.parse(value);
    } catch (DateTimeParseException ex) {
      try {
        return LocalDate.parse(value).atStartOfDay();
      } catch (DateTimeParseException dateEx) {
        throw new IllegalArgumentException("Unsupported calendar date-time: " + raw, ex);
      }
    }
  }

  /** Returns {@code true} when {@code raw} is a date-only value ({@code yyyyMMdd}). */
  public static boolean isDateOnly(String raw) {
    return raw != null && DATE_ONLY.matcher(raw.trim()).matches();
  }
}
