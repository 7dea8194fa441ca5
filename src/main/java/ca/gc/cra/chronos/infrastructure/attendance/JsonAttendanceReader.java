package ca.gc.cra.chronos.infrastructure.attendance;

import ca.gc.cra.chronos.domain.attendance.AttendanceRow;
import ca.gc.cra.chronos.domain.time.IntervalAlgebra;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads attendance rows from a JSON array.
 * <p><strong>Format:</strong> Each element is an object with {@code date} (ISO date), {@code description},
 * optional {@code start}/{@code end} ({@code HH:mm} on {@code date}, or an ISO local date-time), optional
 * {@code pauses} (list of {@code start}/{@code end} objects in the same forms) and the optional quantities
 * {@code durationMinutes}, {@code pauseMinutes}, {@code paidNonWorkMinutes}, {@code sickDays},
 * {@code holidayDays}, {@code vacationMinutes} and {@code timeCompensationMinutes}.</p>
 * <p>{@code pauseMinutes} defaults to the sum of the pause ranges and {@code durationMinutes} to the span
 * minus the pause. A malformed row is logged at WARN and skipped.</p>
 *
 * @since 0.1.0
 */
public final class JsonAttendanceReader {
  private static final Logger log = LoggerFactory.getLogger(JsonAttendanceReader.class);

  private final JsonSupport json;

  public JsonAttendanceReader() {
    this(new JsonSupport());
  }

  JsonAttendanceReader(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Reads rows from a UTF-8 file.
   *
   * @param file attendance export
   * @return well-formed rows in file order
   * @throws IOException when the file cannot be read or is not a JSON array
   */
  public List<AttendanceRow> read(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    List<AttendanceRow> rows = parse(Files.readString(file, StandardCharsets.UTF_8));
    log.info("Read {} attendance rows from {}", rows.size(), file);
    return rows;
  }

  /**
   * Parses rows from JSON text.
   *
   * @param text JSON array
   * @return well-formed rows in document order
   * @throws IOException when the text is not a JSON array
   */
  public List<AttendanceRow> parse(String text) throws IOException {
    Object root = json.parse(text);
    if (!(root instanceof List<?> elements)) {
      throw new IOException("attendance document must be a JSON array");
    }
    List<AttendanceRow> rows = new ArrayList<>(elements.size());
    int index = 0;
    for (Object element : elements) {
      try {
        rows.add(toRow(JsonSupport.object(element)));
      } catch (IllegalArgumentException | DateTimeParseException ex) {
        log.warn("Skipping malformed attendance row #{}: {}", index, ex.getMessage());
      }
      index++;
    }
    return rows;
  }

  private static AttendanceRow toRow(Map<String, Object> node) {
    String rawDate = JsonSupport.text(node, "date");
    if (rawDate.isBlank()) {
      throw new IllegalArgumentException("date is missing");
    }
    LocalDate date = LocalDate.parse(rawDate.trim());
    LocalDateTime start = dateTime(date, JsonSupport.text(node, "start"));
    LocalDateTime end = dateTime(date, JsonSupport.text(node, "end"));
    if ((start == null) != (end == null)) {
      throw new IllegalArgumentException(date + ": start and end must both be present or both absent");
    }

    List<TimeInterval> pauses = new ArrayList<>();
    for (Object item : JsonSupport.list(node, "pauses")) {
      Map<String, Object> pause = JsonSupport.object(item);
      LocalDateTime pauseStart = dateTime(date, JsonSupport.text(pause, "start"));
      LocalDateTime pauseEnd = dateTime(date, JsonSupport.text(pause, "end"));
      if (pauseStart == null || pauseEnd == null) {
        throw new IllegalArgumentException("pause needs start and end");
      }
      pauses.add(new TimeInterval(pauseStart, pauseEnd));
    }

    Duration pauseTotal = minutes(node, "pauseMinutes", IntervalAlgebra.totalDuration(pauses));
    Duration span = start != null && end != null ? Duration.between(start, end) : Duration.ZERO;
    Duration netDefault = span.minus(pauseTotal).isNegative() ? Duration.ZERO : span.minus(pauseTotal);
    return new AttendanceRow(
        date,
        JsonSupport.text(node, "description").trim(),
        start,
        end,
        minutes(node, "durationMinutes", netDefault),
        pauseTotal,
        pauses,
        minutes(node, "paidNonWorkMinutes", Duration.ZERO),
        JsonSupport.number(node, "sickDays", 0),
        JsonSupport.number(node, "holidayDays", 0),
        minutes(node, "vacationMinutes", Duration.ZERO),
        minutes(node, "timeCompensationMinutes", Duration.ZERO));
  }

  private static LocalDateTime dateTime(LocalDate date, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String value = raw.trim();
    if (value.contains("T")) {
      return LocalDateTime.parse(value);
    }
    return date.atTime(LocalTime.parse(value));
  }

  private static Duration minutes(Map<String, Object> node, String key, Duration fallback) {
    if (!node.containsKey(key)) {
      return fallback;
    }
    double value = JsonSupport.number(node, key, 0);
    if (value < 0) {
      throw new IllegalArgumentException(key + " must be >= 0");
    }
    return Duration.ofSeconds(Math.round(value * 60));
  }
}
