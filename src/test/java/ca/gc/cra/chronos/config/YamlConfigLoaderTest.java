package ca.gc.cra.chronos.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("chronos.yaml");
    Files.writeString(yaml, """
        common:
          selfEmail: me@example.org
          zone: Europe/Vienna
        reconcile:
          meetingTicket: MEET-1
          lookbackDays: 14
        compare:
          outlierMode: true
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "Reconcile");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("me@example.org", map.get("selfEmail"));
    assertEquals("Europe/Vienna", map.get("zone"));
    assertEquals("MEET-1", map.get("meetingTicket"));
    assertEquals("14", map.get("lookbackDays"));
    assertFalse(map.containsKey("outlierMode"));
  }

  @Test
  void loadFlattensListsOfRulesToIndexedKeys() throws IOException {
    Path yaml = tempDir.resolve("rules.yaml");
    Files.writeString(yaml, """
        common:
          meetingRules:
            - pattern: standup
              ticket: OPS-1
            - pattern: retro
              ticket: OPS-2
          calendarFile:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "reconcile").orElseThrow();

    assertEquals("standup", map.get("meetingRules.0.pattern"));
    assertEquals("OPS-2", map.get("meetingRules.1.ticket"));
    assertEquals("", map.get("calendarFile"));
  }

  @Test
  void modeListReplacesCommonList() throws IOException {
    Path yaml = tempDir.resolve("hints.yaml");
    Files.writeString(yaml, """
        common:
          nonMeetingHints: [homeoffice, focus, travel]
        reconcile:
          nonMeetingHints: [lunch]
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "reconcile").orElseThrow();

    assertEquals("lunch", map.get("nonMeetingHints.0"));
    assertFalse(map.containsKey("nonMeetingHints.1"));
    assertFalse(map.containsKey("nonMeetingHints.2"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "reconcile").isPresent());
  }

  @Test
  void emptyFileYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "compare").orElseThrow());
  }

  @Test
  void invalidStructuresThrow() throws IOException {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, """
        - reconcile:
            selfEmail: me@example.org
        """);
    Path nested = tempDir.resolve("nested.yaml");
    Files.writeString(nested, """
        common:
          nonMeetingHints:
            - [a, b]
        """);
    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "common: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "reconcile"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nested, "reconcile"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "reconcile"));
  }
}
