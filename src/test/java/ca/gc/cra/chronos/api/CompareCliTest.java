package ca.gc.cra.chronos.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompareCliTest {
  @TempDir Path tempDir;

  private final StringWriter out = new StringWriter();

  @BeforeEach
  void captureOutput() {
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
  }

  @AfterEach
  void releaseOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void yamlConfiguredComparisonPrintsEachDay() throws IOException {
    Path attendance = CliFixtures.write(tempDir, "attendance.json", """
        [
          {"date": "2024-03-04", "description": "Arbeitszeit", "start": "08:00", "end": "16:30",
           "pauses": [{"start": "12:00", "end": "12:30"}]},
          {"date": "2024-03-05", "description": "Arbeitszeit", "start": "08:00", "end": "16:30",
           "pauses": [{"start": "12:00", "end": "12:30"}]}
        ]
        """);
    Path ticketing = CliFixtures.write(tempDir, "ticketing.json", "{\"issues\": ["
        + "{\"key\": \"ABC-1\", \"worklogs\": ["
        + CliFixtures.booking("1", "2024-03-04T08:00:00.000+0100", 14400) + ", "
        + CliFixtures.booking("2", "2024-03-05T08:10:00.000+0100", 13800) + "]}, "
        + "{\"key\": \"ABC-2\", \"worklogs\": ["
        + CliFixtures.booking("3", "2024-03-04T12:30:00.000+0100", 14400) + ", "
        + CliFixtures.booking("4", "2024-03-05T12:30:00.000+0100", 14400) + "]}]}");
    Path yaml = CliFixtures.write(tempDir, "chronos.yaml", "common:\n"
        + "  accountId: me\n"
        + "  zone: Europe/Vienna\n"
        + "compare:\n"
        + "  attendanceFile: '" + attendance + "'\n"
        + "  ticketingFile: '" + ticketing + "'\n");

    assertEquals(ExitCode.SUCCESS, CompareCli.run(new String[] {"config=" + yaml}));

    String printed = out.toString();
    assertTrue(printed.contains("2024-03-04 OK (pause 30m, paid non-work 0m, booked gaps 30m)"));
    assertTrue(printed.contains("2024-03-05  (pause 30m"));
    assertTrue(printed.contains("  START_TIME"));
  }

  @Test
  void emptyAttendanceHasNothingToCompare() throws IOException {
    Path attendance = CliFixtures.write(tempDir, "attendance.json", "[]");
    Path ticketing = CliFixtures.write(tempDir, "ticketing.json", "{\"issues\": []}");

    ExitCode code = CompareCli.run(new String[] {
        "accountId=me", "attendanceFile=" + attendance, "ticketingFile=" + ticketing});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(out.toString().contains("No days to compare"));
  }

  @Test
  void missingAccountIsAConfigError() throws IOException {
    Path attendance = CliFixtures.write(tempDir, "attendance.json", "[]");

    assertEquals(ExitCode.CONFIG_ERROR, CompareCli.run(new String[] {"attendanceFile=" + attendance}));
    assertTrue(out.toString().startsWith("usage: compare"));
  }
}
