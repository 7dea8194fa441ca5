package ca.gc.cra.chronos.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ChronosConfigTest {

  private static Map<String, String> complete() {
    Map<String, String> kv = new HashMap<>();
    kv.put("selfEmail", " Me@Example.org ");
    kv.put("meetingTicket", "meet-1");
    kv.put("attendanceFile", "attendance.json");
    kv.put("calendarFile", "calendar.ics");
    kv.put("zone", "Europe/Vienna");
    return kv;
  }

  @Test
  void normalizesIdentitiesAndAppliesDefaults() {
    ChronosConfig config = ChronosConfig.fromMap(complete());

    assertEquals("me@example.org", config.selfEmail());
    assertEquals(List.of("me@example.org"), config.authorEmails());
    assertEquals("MEET-1", config.meetingTicket());
    assertEquals(ChronosConfig.DEFAULT_LOOKBACK_DAYS, config.lookbackDays());
    assertEquals(ZoneId.of("Europe/Vienna"), config.zone());
    assertEquals(Optional.of(Path.of("attendance.json").toAbsolutePath().normalize()), config.attendanceFile());
    assertTrue(config.commitsFile().isEmpty());
    assertFalse(config.submit());
  }

  @Test
  void parsesListsAndIndexedRules() {
    Map<String, String> kv = complete();
    kv.put("authorEmails", "Me@example.org; bot@example.org");
    kv.put("commitProjects", "backend, frontend");
    kv.put("meetingRules.10.pattern", "retro");
    kv.put("meetingRules.10.ticket", "ops-2");
    kv.put("meetingRules.2.pattern", "standup");
    kv.put("meetingRules.2.ticket", "OPS-1");
    kv.put("nonMeetingHints.0", "homeoffice");
    kv.put("nonMeetingHints.1", " ");
    kv.put("titleRules.0.trigger", "standup");
    kv.put("titleRules.0.replacements.0", "Sync");
    kv.put("titleRules.0.replacements.1", "Daily");
    kv.put("titleRules.1.trigger", "retro");
    kv.put("titleRules.1.replacements", "Review, Lessons");

    ChronosConfig config = ChronosConfig.fromMap(kv);

    assertEquals(List.of("me@example.org", "bot@example.org"), config.authorEmails());
    assertEquals(List.of("backend", "frontend"), config.commitProjects());
    assertEquals(List.of(
        new ChronosConfig.MeetingRule("standup", "OPS-1"),
        new ChronosConfig.MeetingRule("retro", "OPS-2")), config.meetingRules());
    assertEquals(List.of("homeoffice"), config.nonMeetingHints());
    assertEquals(List.of("Sync", "Daily"), config.titleRules().get(0).replacements());
    assertEquals(List.of("Review", "Lessons"), config.titleRules().get(1).replacements());
  }

  @Test
  void indexedObjectsGroupsByNumericIndex() {
    Map<Integer, Map<String, String>> grouped = ChronosConfig.indexedObjects(Map.of(
        "hints.1", "b",
        "hints.0", "a",
        "hints.x", "ignored",
        "rules.0.pattern", "other"), "hints");

    assertEquals(List.of(0, 1), List.copyOf(grouped.keySet()));
    assertEquals(Map.of("", "a"), grouped.get(0));
  }

  @Test
  void malformedValuesAreRejected() {
    assertRejected("lookbackDays", "many", "lookbackDays must be an integer but was 'many'");
    assertRejected("lookbackDays", "400", "lookbackDays must be between 0 and 366");
    assertRejected("zone", "Mars/Olympus", "zone is not a valid zone id: Mars/Olympus");
    assertRejected("from", "04.03.2024", "from must be an ISO date (yyyy-MM-dd) but was '04.03.2024'");
    assertRejected("meetingRules.0.ticket", "nope", null);
  }

  @Test
  void rangeMustNotBeReversed() {
    Map<String, String> kv = complete();
    kv.put("from", "2024-03-08");
    kv.put("to", "2024-03-04");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ChronosConfig.fromMap(kv));
    assertEquals("to (2024-03-04) must not be before from (2024-03-08)", ex.getMessage());
  }

  @Test
  void validateForPassListsEveryProblem() {
    Map<String, String> kv = new HashMap<>();
    kv.put("meetingTicket", "meeting");
    kv.put("commitProjects", "backend");
    kv.put("ticketingFile", "ticketing.json");
    List<String> problems = new ArrayList<>();

    assertFalse(ChronosConfig.fromMap(kv).validateForPass(problems::add));

    assertEquals(List.of(
        "selfEmail is required",
        "meetingTicket must look like ABC-123",
        "attendanceFile is required",
        "calendarFile is required",
        "commitsFile is required when commitProjects are configured",
        "accountId is required when ticketingFile is configured"), problems);
    assertTrue(ChronosConfig.fromMap(complete()).validateForPass(p -> {}));
  }

  @Test
  void remoteComparisonNeedsAccountAndFiles() {
    List<String> problems = new ArrayList<>();
    assertFalse(ChronosConfig.fromMap(complete()).validateForRemoteComparison(problems::add));
    assertEquals(List.of("accountId is required", "ticketingFile is required"), problems);

    Map<String, String> kv = complete();
    kv.put("accountId", "me");
    kv.put("ticketingFile", "ticketing.json");
    kv.put("from", "2024-03-04");
    ChronosConfig config = ChronosConfig.fromMap(kv);
    assertTrue(config.validateForRemoteComparison(p -> {}));
    assertEquals(Optional.of(LocalDate.of(2024, 3, 4)), config.from());
  }

  @Test
  void defaultsCarryHintsAsIndexedKeys() {
    Map<String, String> defaults = ChronosConfig.defaultsAsFlatMap(List.of("homeoffice", "focus"));

    assertEquals("30", defaults.get("lookbackDays"));
    assertEquals("focus", defaults.get("nonMeetingHints.1"));
    assertEquals(List.of("homeoffice", "focus"), ChronosConfig.fromMap(defaults).nonMeetingHints());
  }

  private static void assertRejected(String key, String value, String message) {
    Map<String, String> kv = complete();
    kv.put(key, value);
    if (key.startsWith("meetingRules")) {
      kv.put("meetingRules.0.pattern", "standup");
    }
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ChronosConfig.fromMap(kv));
    if (message != null) {
      assertEquals(message, ex.getMessage());
    }
  }
}
