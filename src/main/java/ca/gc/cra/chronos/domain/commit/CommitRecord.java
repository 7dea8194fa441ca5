package ca.gc.cra.chronos.domain.commit;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * Commit as returned by the commit-history collaborator.
 *
 * @param id commit identifier
 * @param projectId source project
 * @param timestamp commit time in local wall time
 * @param message full commit message
 * @param authorEmail author address; empty when unknown
 * @param committerEmail committer address; empty when unknown
 * @since 0.1.0
 */
public record CommitRecord(
    String id,
    String projectId,
    LocalDateTime timestamp,
    String message,
    String authorEmail,
    String committerEmail) {

  public CommitRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(timestamp, "timestamp");
    message = message == null ? "" : message;
    authorEmail = authorEmail == null ? "" : authorEmail;
    committerEmail = committerEmail == null ? "" : committerEmail;
  }

  /** First line of the message, trimmed. */
  public String firstLine() {
    int newline = message.indexOf('\n');
    String line = newline >= 0 ? message.substring(0, newline) : message;
    return line.trim();
  }

  /**
   * Whether author or committer address is one of {@code emails}. An empty filter matches all.
   *
   * @param emails lower-case addresses
   * @return {@code true} when the commit belongs to one of the addresses
   */
  public boolean madeByAny(Collection<String> emails) {
    if (emails.isEmpty()) {
      return true;
    }
    return emails.contains(authorEmail.toLowerCase(Locale.ROOT))
        || emails.contains(committerEmail.toLowerCase(Locale.ROOT));
  }
}
