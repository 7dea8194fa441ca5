package ca.gc.cra.chronos.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("lookbackDays", "30", "zone", "UTC");
    Map<String, String> yaml = Map.of("lookbackDays", "14", "selfEmail", "me@example.org");
    Map<String, String> cli = Map.of("lookbackDays", "7", "zone", "Europe/Vienna");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "reconcile",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("7", merged.get("lookbackDays"));
    assertEquals("Europe/Vienna", merged.get("zone"));
    assertEquals("me@example.org", merged.get("selfEmail"));
    assertEquals(List.of("CLI overrides YAML for key: lookbackDays"), warnings);
  }

  @Test
  void cliListReplacesYamlAndDefaultEntries() {
    Map<String, String> defaults = Map.of("nonMeetingHints.0", "homeoffice", "nonMeetingHints.1", "focus");
    Map<String, String> yaml = Map.of("nonMeetingHints.0", "travel");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "reconcile",
        Optional.of(yaml),
        Map.of("nonMeetingHints", "lunch,standup"),
        defaults,
        warnings::add);

    assertEquals("lunch,standup", merged.get("nonMeetingHints"));
    assertFalse(merged.containsKey("nonMeetingHints.0"));
    assertFalse(merged.containsKey("nonMeetingHints.1"));
    assertEquals(List.of("CLI overrides YAML for key: nonMeetingHints"), warnings);
  }

  @Test
  void submitRequiresTicketingFile() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "reconcile",
            Optional.empty(),
            Map.of("submit", "true"),
            Map.of(),
            msg -> {}));

    assertEquals("submit=true requires ticketingFile", ex.getMessage());
  }

  @Test
  void applyRequiresTicketingFileOnlyWhenAdjusting() {
    Map<String, String> cli = Map.of("apply", "true");

    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("adjust", Optional.empty(), cli, Map.of(), msg -> {}));
    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig("compare", Optional.empty(), cli, Map.of(), null);
    assertTrue(Boolean.parseBoolean(merged.get("apply")));
  }
}
