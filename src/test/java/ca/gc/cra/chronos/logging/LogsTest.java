package ca.gc.cra.chronos.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreKept() {
    assertEquals("ABC-1 parser", Logs.truncate("ABC-1 parser", 80));
    assertEquals("<null>", Logs.truncate(null, 80));
  }

  @Test
  void longValuesAreCutAtByteBudget() {
    assertEquals("Daily... (5 of 13 bytes)", Logs.truncate("Daily Standup", 5));
  }

  @Test
  void cutNeverSplitsMultiByteCharacter() {
    assertEquals("K... (2 of 5 bytes)", Logs.truncate("Käse", 2));
  }

  @Test
  void budgetMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void minutesRenderCompactly() {
    assertEquals("45m", Logs.minutes(Duration.ofMinutes(45)));
    assertEquals("2h05m", Logs.minutes(Duration.ofMinutes(125)));
    assertEquals("-10m", Logs.minutes(Duration.ofMinutes(-10)));
    assertEquals("0m", Logs.minutes(Duration.ofSeconds(59)));
  }
}
