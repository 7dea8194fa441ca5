package ca.gc.cra.chronos.application.calendar;

import ca.gc.cra.chronos.domain.calendar.IcsDateTimes;
import ca.gc.cra.chronos.domain.calendar.MeetingEvent;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.logging.Logs;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Parses calendar text ({@code VCALENDAR}/{@code VEVENT}) into {@link MeetingEvent}s.
 * <p><strong>Why:</strong> Calendar exports are the only meeting source; the parser keeps every attribute
 * the meeting filter needs and resolves the configured identity's participation status.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Unfold continuation lines (leading space or tab).</li>
 *   <li>Read start/end in plain, date-only and zone-qualified forms.</li>
 *   <li>Count attendees and retain only the configured identity's {@code PARTSTAT}.</li>
 *   <li>Collect {@code EXDATE} and {@code RECURRENCE-ID} values.</li>
 * </ul>
 * <p><strong>Error handling:</strong> A malformed event is logged and skipped; parsing continues.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the configured zone; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class IcsCalendarParser {
  private static final Logger log = LoggerFactory.getLogger(IcsCalendarParser.class);
  private static final int TITLE_LOG_BYTES = 80;

  private final ZoneId zone;

  /**
   * Creates a parser converting UTC values into {@code zone}.
   *
   * @param zone local zone of the person whose day is reconciled
   */
  public IcsCalendarParser(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Parses all {@code VEVENT} blocks of {@code content}.
   *
   * @param content calendar text
   * @param selfEmail identity whose participation status is retained; blank disables the lookup
   * @return events in document order
   */
  public List<MeetingEvent> parse(String content, String selfEmail) {
    Objects.requireNonNull(content, "content");
    String self = selfEmail == null ? "" : selfEmail.trim().toLowerCase(Locale.ROOT);
    List<MeetingEvent> events = new ArrayList<>();
    EventLines current = null;
    int skipped = 0;

    for (String line : unfold(content)) {
      if (line.equalsIgnoreCase("BEGIN:VEVENT")) {
        current = new EventLines();
        continue;
      }
      if (line.equalsIgnoreCase("END:VEVENT")) {
        if (current != null) {
          try {
            MeetingEvent event = current.toEvent(zone);
            if (event != null) {
              events.add(event);
            } else {
              skipped++;
            }
          } catch (IllegalArgumentException | DateTimeException ex) {
            skipped++;
            log.warn("Skipping malformed calendar event '{}': {}",
                Logs.truncate(current.properties.getOrDefault("SUMMARY", ""), TITLE_LOG_BYTES),
                ex.getMessage());
          }
        }
        current = null;
        continue;
      }
      if (current != null) {
        current.accept(line, self);
      }
    }
    log.debug("Parsed {} calendar events ({} skipped)", events.size(), skipped);
    return events;
  }

  static List<String> unfold(String content) {
    List<String> lines = new ArrayList<>();
    for (String raw : content.split("\r?\n", -1)) {
      if ((raw.startsWith(" ") || raw.startsWith("\t")) && !lines.isEmpty()) {
        int last = lines.size() - 1;
        lines.set(last, lines.get(last) + raw.substring(1));
      } else if (!raw.isEmpty()) {
        lines.add(raw);
      }
    }
    return lines;
  }

  /** Property lines of one VEVENT collected until its END line. */
  private static final class EventLines {
    private final Map<String, String> properties = new LinkedHashMap<>();
    private final List<String> rawExceptionDates = new ArrayList<>();
    private int attendeeCount;
    private String selfParticipation = "";
    private String rawRecurrenceId;

    // Values are stored raw and converted in toEvent so a bad date skips only this event.
    void accept(String line, String self) {
      int colon = line.indexOf(':');
      if (colon <= 0) {
        return;
      }
      String key = line.substring(0, colon);
      String value = line.substring(colon + 1);
      String upperKey = key.toUpperCase(Locale.ROOT);

      if (upperKey.startsWith("RECURRENCE-ID")) {
        rawRecurrenceId = value;
        return;
      }
      if (upperKey.startsWith("EXDATE")) {
        for (String part : value.split(",")) {
          if (!part.isBlank()) {
            rawExceptionDates.add(part);
          }
        }
        return;
      }
      if (upperKey.startsWith("ATTENDEE")) {
        attendeeCount++;
        String partstat = null;
        for (String param : key.split(";")) {
          String[] kv = param.split("=", 2);
          if (kv.length == 2 && kv[0].trim().equalsIgnoreCase("PARTSTAT")) {
            partstat = kv[1].trim();
          }
        }
        String address = value.trim().toLowerCase(Locale.ROOT);
        if (address.startsWith("mailto:")) {
          address = address.substring("mailto:".length()).trim();
        }
        if (!self.isEmpty() && address.equals(self) && partstat != null) {
          selfParticipation = partstat.toUpperCase(Locale.ROOT);
        }
        return;
      }
      properties.putIfAbsent(upperKey, value);
      if (upperKey.startsWith("SUMMARY;")) {
        properties.putIfAbsent("SUMMARY", value);
      }
    }

    MeetingEvent toEvent(ZoneId zone) {
      Map.Entry<String, String> startEntry = find("DTSTART");
      if (startEntry == null) {
        throw new IllegalArgumentException("missing DTSTART");
      }
      Map.Entry<String, String> endEntry = find("DTEND");
      boolean allDay = isDateValued(startEntry);
      LocalDateTime start = IcsDateTimes.parse(startEntry.getValue(), zone);
      LocalDateTime end;
      if (endEntry != null) {
        end = IcsDateTimes.parse(endEntry.getValue(), zone);
        allDay = allDay || isDateValued(endEntry);
      } else if (allDay) {
        end = start.plusDays(1);
      } else {
        // no end and no duration: a point in time, never a meeting
        log.debug("Ignoring calendar event without end at {}", start);
        return null;
      }
      if (!end.isAfter(start)) {
        if (end.equals(start)) {
          log.debug("Ignoring zero-length calendar event at {}", start);
          return null;
        }
        throw new IllegalArgumentException("end " + end + " before start " + start);
      }

      LocalDateTime recurrenceId = rawRecurrenceId == null ? null : IcsDateTimes.parse(rawRecurrenceId, zone);
      List<LocalDate> exceptionDates = new ArrayList<>(rawExceptionDates.size());
      for (String raw : rawExceptionDates) {
        exceptionDates.add(IcsDateTimes.parse(raw, zone).toLocalDate());
      }

      String busy = properties.getOrDefault("X-MICROSOFT-CDO-BUSYSTATUS", properties.get("BUSYSTATUS"));
      return MeetingEvent.builder(new TimeInterval(start, end))
          .title(properties.getOrDefault("SUMMARY", "").trim())
          .allDay(allDay)
          .status(properties.get("STATUS"))
          .transparency(properties.get("TRANSP"))
          .busyStatus(busy)
          .attendeeCount(attendeeCount)
          .selfParticipation(selfParticipation)
          .recurrenceRule(properties.get("RRULE"))
          .exceptionDates(exceptionDates)
          .uid(properties.get("UID"))
          .recurrenceId(recurrenceId)
          .categories(properties.get("CATEGORIES"))
          .description(properties.get("DESCRIPTION"))
          .build();
    }

    private Map.Entry<String, String> find(String name) {
      String exact = properties.get(name);
      if (exact != null) {
        return Map.entry(name, exact);
      }
      for (Map.Entry<String, String> entry : properties.entrySet()) {
        if (entry.getKey().startsWith(name + ";")) {
          return entry;
        }
      }
      return null;
    }

    private static boolean isDateValued(Map.Entry<String, String> entry) {
      return entry.getKey().contains("VALUE=DATE") && !entry.getKey().contains("VALUE=DATE-TIME")
          || IcsDateTimes.isDateOnly(entry.getValue());
    }
  }
}
