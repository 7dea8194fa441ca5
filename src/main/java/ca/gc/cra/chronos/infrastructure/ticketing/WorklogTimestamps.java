package ca.gc.cra.chronos.infrastructure.ticketing;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ticketing wire timestamps: {@code yyyy-MM-dd'T'HH:mm:ss.SSSZ}, e.g. {@code 2024-01-15T08:00:00.000+0100}.
 *
 * @since 0.1.0
 */
public final class WorklogTimestamps {
  static final DateTimeFormatter WIRE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");
  private static final Pattern COLONLESS_OFFSET = Pattern.compile("([+-]\\d{2})(\\d{2})$");

  private WorklogTimestamps() {
    // Utility
  }

  /**
   * Formats a local wall time in {@code zone}.
   *
   * @param local wall time
   * @param zone zone supplying the offset
   * @return wire text
   */
  public static String format(LocalDateTime local, ZoneId zone) {
    Objects.requireNonNull(local, "local");
    Objects.requireNonNull(zone, "zone");
    return local.atZone(zone).format(WIRE);
  }

  /**
   * Parses wire text into wall time of {@code zone}. A four-digit offset gets its colon inserted; ISO
   * date-times with or without offset are accepted as well.
   *
   * @param raw wire text
   * @param zone target zone
   * @return local wall time
   * @throws IllegalArgumentException when the text matches no accepted form
   */
  public static LocalDateTime parse(String raw, ZoneId zone) {
    Objects.requireNonNull(zone, "zone");
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("timestamp is blank");
    }
    String value = raw.trim();
    Matcher m = COLONLESS_OFFSET.matcher(value);
    String iso = m.find() ? value.substring(0, m.start()) + m.group(1) + ":" + m.group(2) : value;
    try {
      return OffsetDateTime.parse(iso).atZoneSameInstant(zone).toLocalDateTime();
    } catch (DateTimeParseException ex) {
      try {
        return LocalDateTime.parse(value);
      } catch (DateTimeParseException fallback) {
        throw new IllegalArgumentException("unrecognized timestamp: " + raw, fallback);
      }
    }
  }
}
