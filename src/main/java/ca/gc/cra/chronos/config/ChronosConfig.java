package ca.gc.cra.chronos.config;

import ca.gc.cra.chronos.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Immutable settings of one chronos run.
 * <p><strong>Why:</strong> Every command reads the same flat key/value map (defaults, YAML, CLI); this record
 * parses it once and reports malformed values before any data is read.</p>
 * <p><strong>Validation:</strong> {@link #fromMap(Map)} rejects malformed values with
 * {@link IllegalArgumentException}. Missing identities and sources are not malformed; they are reported by
 * {@link #validateForPass(Consumer)} and {@link #validateForRemoteComparison(Consumer)} so a command can list
 * every problem at once.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param selfEmail identity for participation status and the meeting range cache
 * @param authorEmails commit author filter; empty keeps every commit
 * @param accountId ticketing author id
 * @param commitProjects project ids whose commit history is read
 * @param lookbackDays days of commit history read before the first attendance day
 * @param meetingTicket ticket meetings are booked on when no rule matches
 * @param meetingRules ordered title-substring to ticket rules
 * @param nonMeetingHints title fragments marking non-meeting calendar entries
 * @param titleRules meeting title rewrite rules
 * @param calendarFile calendar export
 * @param attendanceFile attendance rows (JSON)
 * @param commitsFile recorded commit history pages (JSON)
 * @param ticketingFile ticketing issues and worklogs (JSON)
 * @param from first attendance day considered, inclusive
 * @param to last attendance day considered, inclusive
 * @param zone local zone
 * @param outlierMode report outlier bookings instead of aggregate differences
 * @param submit book new drafts after reconciliation
 * @param apply apply adjustment plans
 * @since 0.1.0
 */
public record ChronosConfig(
    String selfEmail,
    List<String> authorEmails,
    String accountId,
    List<String> commitProjects,
    int lookbackDays,
    String meetingTicket,
    List<MeetingRule> meetingRules,
    List<String> nonMeetingHints,
    List<TitleRule> titleRules,
    Optional<Path> calendarFile,
    Optional<Path> attendanceFile,
    Optional<Path> commitsFile,
    Optional<Path> ticketingFile,
    Optional<LocalDate> from,
    Optional<LocalDate> to,
    ZoneId zone,
    boolean outlierMode,
    boolean submit,
    boolean apply) {

  static final int DEFAULT_LOOKBACK_DAYS = 30;
  private static final int MAX_LOOKBACK_DAYS = 366;
  private static final Pattern INDEXED = Pattern.compile("^(\\d+)(?:\\.(.+))?$");

  /** Meeting title fragment routed to a ticket. */
  public record MeetingRule(String pattern, String ticket) {
    public MeetingRule {
      pattern = Strings.requireNonBlank("meetingRules.pattern", pattern);
      ticket = Strings.requireTicketKey("meetingRules.ticket", ticket);
    }
  }

  /** Title trigger with its replacement candidates. */
  public record TitleRule(String trigger, List<String> replacements) {
    public TitleRule {
      trigger = Strings.requireNonBlank("titleRules.trigger", trigger);
      replacements = List.copyOf(replacements);
      if (replacements.isEmpty()) {
        throw new IllegalArgumentException("titleRules '" + trigger + "' needs at least one replacement");
      }
    }
  }

  public ChronosConfig {
    selfEmail = selfEmail == null ? "" : selfEmail.trim().toLowerCase(Locale.ROOT);
    authorEmails = List.copyOf(Strings.normalizeEmails(authorEmails));
    accountId = accountId == null ? "" : accountId.trim();
    commitProjects = List.copyOf(commitProjects);
    meetingTicket = meetingTicket == null ? "" : meetingTicket.trim().toUpperCase(Locale.ROOT);
    meetingRules = List.copyOf(meetingRules);
    nonMeetingHints = List.copyOf(nonMeetingHints);
    titleRules = List.copyOf(titleRules);
    Objects.requireNonNull(zone, "zone");
    if (lookbackDays < 0 || lookbackDays > MAX_LOOKBACK_DAYS) {
      throw new IllegalArgumentException("lookbackDays must be between 0 and " + MAX_LOOKBACK_DAYS);
    }
    if (from.isPresent() && to.isPresent() && to.get().isBefore(from.get())) {
      throw new IllegalArgumentException("to (" + to.get() + ") must not be before from (" + from.get() + ")");
    }
  }

  /**
   * Flat defaults shared by every command.
   *
   * @param defaultHints built-in non-meeting hints
   * @return unmodifiable defaults map
   */
  public static Map<String, String> defaultsAsFlatMap(List<String> defaultHints) {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("lookbackDays", Integer.toString(DEFAULT_LOOKBACK_DAYS));
    map.put("zone", ZoneId.systemDefault().getId());
    map.put("outlierMode", "false");
    map.put("submit", "false");
    map.put("apply", "false");
    for (int i = 0; i < defaultHints.size(); i++) {
      map.put("nonMeetingHints." + i, defaultHints.get(i));
    }
    return Map.copyOf(map);
  }

  /**
   * Parses a flat key/value map.
   *
   * @param args merged configuration
   * @return configuration
   * @throws IllegalArgumentException when a value is malformed
   */
  public static ChronosConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : args;
    String self = trim(kv.get("selfEmail"));
    List<String> authors = splitList(kv.get("authorEmails"));
    if (authors.isEmpty() && !self.isEmpty()) {
      authors = List.of(self);
    }

    List<MeetingRule> meetingRules = new ArrayList<>();
    for (Map<String, String> entry : indexedObjects(kv, "meetingRules").values()) {
      meetingRules.add(new MeetingRule(entry.get("pattern"), entry.get("ticket")));
    }
    List<TitleRule> titleRules = new ArrayList<>();
    for (Map<String, String> entry : indexedObjects(kv, "titleRules").values()) {
      List<String> replacements = new ArrayList<>(indexedObjects(entry, "replacements").values().stream()
          .map(m -> m.getOrDefault("", ""))
          .filter(s -> !s.isBlank())
          .toList());
      if (replacements.isEmpty()) {
        replacements.addAll(splitList(entry.get("replacements")));
      }
      titleRules.add(new TitleRule(entry.get("trigger"), replacements));
    }

    return new ChronosConfig(
        self,
        authors,
        trim(kv.get("accountId")),
        splitList(kv.get("commitProjects")),
        parseInt(kv, "lookbackDays", DEFAULT_LOOKBACK_DAYS),
        trim(kv.get("meetingTicket")),
        meetingRules,
        list(kv, "nonMeetingHints"),
        titleRules,
        parseOptionalPath("calendarFile", kv.get("calendarFile")),
        parseOptionalPath("attendanceFile", kv.get("attendanceFile")),
        parseOptionalPath("commitsFile", kv.get("commitsFile")),
        parseOptionalPath("ticketingFile", kv.get("ticketingFile")),
        parseOptionalDate("from", kv.get("from")),
        parseOptionalDate("to", kv.get("to")),
        parseZone(kv.get("zone")),
        parseBoolean(kv.get("outlierMode")),
        parseBoolean(kv.get("submit")),
        parseBoolean(kv.get("apply")));
  }

  /**
   * Checks what a reconciliation pass needs.
   *
   * @param problems receives one message per missing setting
   * @return {@code true} when the pass may run
   */
  public boolean validateForPass(Consumer<String> problems) {
    List<String> missing = new ArrayList<>();
    if (selfEmail.isEmpty()) {
      missing.add("selfEmail is required");
    }
    if (meetingTicket.isEmpty()) {
      missing.add("meetingTicket is required");
    } else if (!meetingTicket.matches("[A-Z][A-Z0-9]+-\\d+")) {
      missing.add("meetingTicket must look like ABC-123");
    }
    if (attendanceFile.isEmpty()) {
      missing.add("attendanceFile is required");
    }
    if (calendarFile.isEmpty()) {
      missing.add("calendarFile is required");
    }
    if (!commitProjects.isEmpty() && commitsFile.isEmpty()) {
      missing.add("commitsFile is required when commitProjects are configured");
    }
    if (ticketingFile.isPresent() && accountId.isEmpty()) {
      missing.add("accountId is required when ticketingFile is configured");
    }
    missing.forEach(problems);
    return missing.isEmpty();
  }

  /**
   * Checks what comparing or adjusting booked worklogs needs.
   *
   * @param problems receives one message per missing setting
   * @return {@code true} when the command may run
   */
  public boolean validateForRemoteComparison(Consumer<String> problems) {
    List<String> missing = new ArrayList<>();
    if (accountId.isEmpty()) {
      missing.add("accountId is required");
    }
    if (attendanceFile.isEmpty()) {
      missing.add("attendanceFile is required");
    }
    if (ticketingFile.isEmpty()) {
      missing.add("ticketingFile is required");
    }
    missing.forEach(problems);
    return missing.isEmpty();
  }

  private static List<String> list(Map<String, String> kv, String key) {
    Map<Integer, Map<String, String>> indexed = indexedObjects(kv, key);
    if (!indexed.isEmpty()) {
      return indexed.values().stream()
          .map(m -> m.getOrDefault("", "").trim())
          .filter(s -> !s.isEmpty())
          .toList();
    }
    return splitList(kv.get(key));
  }

  /**
   * Groups {@code prefix.N[.field]} keys by {@code N}; a bare {@code prefix.N} value is stored under the
   * empty field name.
   */
  static Map<Integer, Map<String, String>> indexedObjects(Map<String, String> kv, String prefix) {
    Map<Integer, Map<String, String>> out = new TreeMap<>();
    String start = prefix + '.';
    for (Map.Entry<String, String> entry : kv.entrySet()) {
      if (!entry.getKey().startsWith(start)) {
        continue;
      }
      Matcher m = INDEXED.matcher(entry.getKey().substring(start.length()));
      if (!m.matches()) {
        continue;
      }
      int index = Integer.parseInt(m.group(1));
      String field = m.group(2) == null ? "" : m.group(2);
      out.computeIfAbsent(index, i -> new LinkedHashMap<>()).put(field, entry.getValue());
    }
    return out;
  }

  private static List<String> splitList(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.stream(value.split("[,;\\s]+"))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  private static int parseInt(Map<String, String> kv, String key, int fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer but was '" + raw + "'", ex);
    }
  }

  private static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }

  private static Optional<Path> parseOptionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(value.trim()).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Optional<LocalDate> parseOptionalDate(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDate.parse(value.trim()));
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(name + " must be an ISO date (yyyy-MM-dd) but was '" + value + "'", ex);
    }
  }

  private static ZoneId parseZone(String value) {
    if (value == null || value.isBlank()) {
      return ZoneId.systemDefault();
    }
    try {
      return ZoneId.of(value.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("zone is not a valid zone id: " + value, ex);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
