package ca.gc.cra.chronos.api;

import ca.gc.cra.chronos.testutil.IcsFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Source files for command tests, written into a temporary directory. */
final class CliFixtures {
  static final String ATTENDANCE = """
      [
        {"date": "2024-03-04", "description": "Arbeitszeit", "start": "08:00", "end": "16:30",
         "pauses": [{"start": "12:00", "end": "12:30"}]}
      ]
      """;

  static final String COMMITS = """
      {"projects": {"backend": [
        {"headers": {}, "commits": [
          {"id": "a1", "committed_date": "2024-03-01T09:00:00+01:00", "message": "ABC-1 parser",
           "author_email": "me@example.org"},
          {"id": "a2", "committed_date": "2024-03-04T13:00:00+01:00", "message": "ABC-2: cache",
           "author_email": "me@example.org"}
        ]}
      ]}}
      """;

  static final String TICKETING = """
      {"issues": [
        {"key": "ABC-1", "id": "10001", "summary": "Parser rewrite", "worklogs": []},
        {"key": "ABC-2", "id": "10002", "summary": "Cache warmup", "worklogs": [
          {"id": "500", "author": "me", "started": "2024-03-04T13:00:00.000+0100", "timeSpentSeconds": 12600}
        ]},
        {"key": "MEET-1", "id": "10003", "summary": "Meetings", "worklogs": []}
      ]}
      """;

  private CliFixtures() {
    // Utility
  }

  static Path write(Path dir, String name, String content) throws IOException {
    Path file = dir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  static Path calendar(Path dir) throws IOException {
    return write(dir, "calendar.ics", IcsFixtures.WEEK);
  }

  static String booking(String id, String started, long seconds) {
    return "{\"id\": \"" + id + "\", \"author\": \"me\", \"started\": \"" + started
        + "\", \"timeSpentSeconds\": " + seconds + "}";
  }
}
