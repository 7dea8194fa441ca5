package ca.gc.cra.chronos.infrastructure.commit;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One page of a commit listing as the source-control system returns it.
 *
 * @since 0.1.0
 */
public interface CommitPageSource {

  /**
   * Raw page.
   *
   * @param items commit objects with the system's field names
   * @param headers response headers
   */
  record Page(List<Map<String, Object>> items, Map<String, String> headers) {
    public Page {
      items = List.copyOf(items);
      headers = Map.copyOf(headers);
    }
  }

  /**
   * Fetches one page.
   *
   * @param projectId project identifier
   * @param sinceUtc inclusive lower bound
   * @param untilUtc exclusive upper bound
   * @param page page number, starting at 1
   * @param perPage requested page size
   * @return page; an empty item list past the end
   * @throws IOException when the project is unknown or the source fails
   */
  Page fetch(String projectId, Instant sinceUtc, Instant untilUtc, int page, int perPage) throws IOException;
}
