package ca.gc.cra.chronos.infrastructure.commit;

import ca.gc.cra.chronos.application.port.CommitHistoryPort;
import ca.gc.cra.chronos.domain.commit.CommitRecord;
import ca.gc.cra.chronos.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CommitHistoryPort} that walks a paged commit listing.
 * <p><strong>Mapping:</strong> the commit time is {@code committed_date}, else {@code created_at}, else
 * {@code authored_date}, converted to wall time of the configured zone. Commits outside
 * {@code [since, until)} or without id or time are skipped.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class PagedCommitHistoryAdapter implements CommitHistoryPort {
  private static final Logger log = LoggerFactory.getLogger(PagedCommitHistoryAdapter.class);
  static final int DEFAULT_PER_PAGE = 100;
  private static final List<String> TIME_FIELDS = List.of("committed_date", "created_at", "authored_date");

  private final CommitPageSource source;
  private final ZoneId zone;
  private final int perPage;

  public PagedCommitHistoryAdapter(CommitPageSource source, ZoneId zone) {
    this(source, zone, DEFAULT_PER_PAGE);
  }

  public PagedCommitHistoryAdapter(CommitPageSource source, ZoneId zone, int perPage) {
    this.source = Objects.requireNonNull(source, "source");
    this.zone = Objects.requireNonNull(zone, "zone");
    if (perPage <= 0) {
      throw new IllegalArgumentException("perPage must be positive");
    }
    this.perPage = perPage;
  }

  @Override
  public List<CommitRecord> fetch(String projectId, Instant sinceUtc, Instant untilUtc) throws IOException {
    Objects.requireNonNull(projectId, "projectId");
    List<CommitRecord> out = new ArrayList<>();
    int page = 1;
    int fetched = 0;
    boolean exhausted = false;
    while (!exhausted && fetched < CommitPagination.MAX_PAGES) {
      CommitPageSource.Page response = source.fetch(projectId, sinceUtc, untilUtc, page, perPage);
      fetched++;
      for (Map<String, Object> item : response.items()) {
        toCommit(projectId, item, sinceUtc, untilUtc).ifPresent(out::add);
      }
      OptionalInt next = CommitPagination.nextPage(response.headers(), page, response.items().size(), perPage);
      if (next.isEmpty() || next.getAsInt() <= page) {
        exhausted = true;
      } else {
        page = next.getAsInt();
      }
    }
    if (!exhausted) {
      log.warn("Project {}: stopped after {} pages", projectId, CommitPagination.MAX_PAGES);
    }
    log.debug("Project {}: {} commits on {} pages", projectId, out.size(), fetched);
    return out;
  }

  private Optional<CommitRecord> toCommit(
      String projectId, Map<String, Object> item, Instant since, Instant until) {
    String id = JsonSupport.text(item, "id");
    String raw = "";
    for (String field : TIME_FIELDS) {
      raw = JsonSupport.text(item, field);
      if (!raw.isBlank()) {
        break;
      }
    }
    if (id.isBlank() || raw.isBlank()) {
      log.warn("Project {}: skipping commit without id or time ({})", projectId, id);
      return Optional.empty();
    }
    OffsetDateTime time;
    try {
      time = OffsetDateTime.parse(raw.trim());
    } catch (DateTimeParseException ex) {
      log.warn("Project {}: skipping commit {} with unreadable time '{}'", projectId, id, raw);
      return Optional.empty();
    }
    Instant instant = time.toInstant();
    if (instant.isBefore(since) || !instant.isBefore(until)) {
      return Optional.empty();
    }
    LocalDateTime local = LocalDateTime.ofInstant(instant, zone);
    return Optional.of(new CommitRecord(
        id,
        projectId,
        local,
        JsonSupport.text(item, "message"),
        JsonSupport.text(item, "author_email"),
        JsonSupport.text(item, "committer_email")));
  }
}
