package ca.gc.cra.chronos.infrastructure.commit;

import ca.gc.cra.chronos.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serves commit pages recorded in a JSON file.
 *
 * <p>Format: {@code {"projects":{"<id>":[{"headers":{...},"commits":[...]}, ...]}}}; page {@code N} is the
 * {@code N}-th recorded response. Pages past the end are empty.</p>
 *
 * @since 0.1.0
 */
public final class RecordedCommitPageSource implements CommitPageSource {
  private final Map<String, List<Page>> pagesByProject;

  RecordedCommitPageSource(Map<String, List<Page>> pagesByProject) {
    this.pagesByProject = Map.copyOf(pagesByProject);
  }

  /**
   * Loads a recording.
   *
   * @param file recorded pages
   * @return page source
   * @throws IOException when the file cannot be read or is malformed
   */
  public static RecordedCommitPageSource load(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    return parse(Files.readString(file, StandardCharsets.UTF_8));
  }

  static RecordedCommitPageSource parse(String text) throws IOException {
    Object root = new JsonSupport().parse(text);
    if (!(root instanceof Map<?, ?>)) {
      throw new IOException("commit recording must be a JSON object");
    }
    Map<String, Object> projects = JsonSupport.object(JsonSupport.object(root).get("projects"));
    Map<String, List<Page>> pages = new HashMap<>();
    for (Map.Entry<String, Object> project : projects.entrySet()) {
      if (!(project.getValue() instanceof List<?> responses)) {
        throw new IOException("project " + project.getKey() + " must hold a list of pages");
      }
      List<Page> recorded = new ArrayList<>();
      for (Object response : responses) {
        Map<String, Object> node = JsonSupport.object(response);
        Map<String, String> headers = new LinkedHashMap<>();
        JsonSupport.object(node.get("headers")).forEach((name, value) -> {
          if (value != null) {
            headers.put(name, value.toString());
          }
        });
        List<Map<String, Object>> items = new ArrayList<>();
        for (Object item : JsonSupport.list(node, "commits")) {
          items.add(JsonSupport.object(item));
        }
        recorded.add(new Page(items, headers));
      }
      pages.put(project.getKey(), recorded);
    }
    return new RecordedCommitPageSource(pages);
  }

  @Override
  public Page fetch(String projectId, Instant sinceUtc, Instant untilUtc, int page, int perPage)
      throws IOException {
    List<Page> pages = pagesByProject.get(projectId);
    if (pages == null) {
      throw new IOException("404 project not found: " + projectId);
    }
    if (page < 1 || page > pages.size()) {
      return new Page(List.of(), Map.of());
    }
    return pages.get(page - 1);
  }
}
