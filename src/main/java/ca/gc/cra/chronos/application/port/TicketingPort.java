package ca.gc.cra.chronos.application.port;

import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import ca.gc.cra.chronos.domain.worklog.TicketSummary;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Port to the ticketing system that stores worklogs.
 * <p><strong>Why:</strong> Reconciliation reads booked worklogs and writes corrections; keeping the system
 * behind a port makes every use case testable with an in-memory fake.</p>
 * <p><strong>Role:</strong> Driven port. Each call is one unit of work; callers catch {@link IOException}
 * per call and continue with the next unit.</p>
 * <p><strong>Thread-safety:</strong> Called sequentially; implementations need not be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface TicketingPort {

  /**
   * Resolves a ticket key to the system's internal id.
   *
   * @param key ticket key
   * @return internal id
   * @throws IOException when the ticket is unknown or the system cannot be reached
   */
  String resolveId(String key) throws IOException;

  /**
   * Free-text ticket search. Key-like queries also match keys.
   *
   * @param text query text
   * @return matching tickets
   * @throws IOException on transport failure
   */
  List<TicketSummary> search(String text) throws IOException;

  /**
   * Fetches summaries for a batch of ticket keys. Unknown keys are absent from the result.
   *
   * @param keys ticket keys
   * @return summaries keyed by ticket key
   * @throws IOException on transport failure
   */
  Map<String, String> fetchSummaries(Collection<String> keys) throws IOException;

  /**
   * Fetches all worklogs of one ticket.
   *
   * @param ticketKey ticket key
   * @return worklogs of any author
   * @throws IOException on transport failure
   */
  List<RemoteWorklogRecord> fetchWorklogs(String ticketKey) throws IOException;

  /**
   * Finds tickets carrying worklogs of an author within a date range.
   *
   * @param authorId author account id
   * @param from first day, inclusive
   * @param to last day, inclusive
   * @return ticket keys
   * @throws IOException on transport failure
   */
  List<String> findTicketsWithWorklogs(String authorId, LocalDate from, LocalDate to) throws IOException;

  /**
   * Creates a worklog.
   *
   * @param ticket ticket key or internal id
   * @param started local start
   * @param durationSeconds positive duration
   * @param comment worklog comment
   * @return outcome carrying the new worklog id on success
   * @throws IOException on transport failure
   */
  WriteResult create(String ticket, LocalDateTime started, long durationSeconds, String comment)
      throws IOException;

  /**
   * Updates start and duration of an existing worklog.
   *
   * @param ticket ticket key
   * @param worklogId worklog id
   * @param started new local start
   * @param durationSeconds new positive duration
   * @return outcome
   * @throws IOException on transport failure
   */
  WriteResult update(String ticket, String worklogId, LocalDateTime started, long durationSeconds)
      throws IOException;

  /**
   * Deletes a worklog.
   *
   * @param ticket ticket key
   * @param worklogId worklog id
   * @return outcome
   * @throws IOException on transport failure
   */
  WriteResult delete(String ticket, String worklogId) throws IOException;

  /**
   * Outcome of a write call that reached the system.
   *
   * @param ok whether the system accepted the call
   * @param id affected worklog id; empty on failure
   * @param error error body; empty on success
   */
  record WriteResult(boolean ok, String id, String error) {
    public WriteResult {
      id = id == null ? "" : id;
      error = error == null ? "" : error;
    }

    public static WriteResult ok(String id) {
      return new WriteResult(true, Objects.requireNonNull(id, "id"), "");
    }

    public static WriteResult error(String error) {
      return new WriteResult(false, "", error);
    }
  }
}
