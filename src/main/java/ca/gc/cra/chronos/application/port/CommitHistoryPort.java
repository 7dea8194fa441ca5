package ca.gc.cra.chronos.application.port;

import ca.gc.cra.chronos.domain.commit.CommitRecord;
import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * <strong>What:</strong> Port to the source-control system holding commit history.
 * <p><strong>Role:</strong> Driven port; adapters handle pagination and timestamp selection.</p>
 * <p><strong>Thread-safety:</strong> Called sequentially from a single pass; implementations need not be
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface CommitHistoryPort {
  /**
   * Fetches all commits of one project in a time range.
   *
   * @param projectId project identifier
   * @param sinceUtc inclusive lower bound
   * @param untilUtc exclusive upper bound
   * @return commits in the order the source returned them, timestamps in local wall time
   * @throws IOException when the source cannot be reached or answers with an error
   */
  List<CommitRecord> fetch(String projectId, Instant sinceUtc, Instant untilUtc) throws IOException;
}
