package ca.gc.cra.chronos.infrastructure.ticketing;

import ca.gc.cra.chronos.application.port.TicketingPort;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import ca.gc.cra.chronos.domain.worklog.TicketSummary;
import ca.gc.cra.chronos.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TicketingPort} over a JSON export of issues and their worklogs.
 * <p><strong>Format:</strong> {@code {"issues":[{"key","id","summary","worklogs":[{"id","author","started",
 * "timeSpentSeconds","comment"}]}]}} with {@code started} in the {@link WorklogTimestamps} wire form.</p>
 * <p><strong>Mutations:</strong> create, update and delete change the in-memory document only;
 * {@link #save()} writes it back. Fields the adapter does not know are preserved.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class FileTicketingAdapter implements TicketingPort {
  private static final Logger log = LoggerFactory.getLogger(FileTicketingAdapter.class);

  private final Path file;
  private final ZoneId zone;
  private final JsonSupport json;
  private final Map<String, Object> document;
  private final List<Map<String, Object>> issues = new ArrayList<>();
  private long nextWorklogId;
  private boolean dirty;
  private String createAuthor = "";

  private FileTicketingAdapter(Path file, ZoneId zone, JsonSupport json, Map<String, Object> document) {
    this.file = file;
    this.zone = Objects.requireNonNull(zone, "zone");
    this.json = json;
    this.document = document;
    List<Object> rawIssues = new ArrayList<>(JsonSupport.list(document, "issues"));
    for (Object raw : rawIssues) {
      Map<String, Object> issue = new LinkedHashMap<>(JsonSupport.object(raw));
      List<Object> worklogs = new ArrayList<>();
      for (Object worklog : JsonSupport.list(issue, "worklogs")) {
        Map<String, Object> copy = new LinkedHashMap<>(JsonSupport.object(worklog));
        worklogs.add(copy);
        nextWorklogId = Math.max(nextWorklogId, numericId(JsonSupport.text(copy, "id")));
      }
      issue.put("worklogs", worklogs);
      issues.add(issue);
    }
    document.put("issues", new ArrayList<Object>(issues));
    nextWorklogId++;
  }

  /**
   * Loads the export at {@code file}.
   *
   * @param file ticketing export
   * @param zone zone of local wall times
   * @return adapter bound to the file
   * @throws IOException when the file cannot be read or is not a JSON object
   */
  public static FileTicketingAdapter load(Path file, ZoneId zone) throws IOException {
    Objects.requireNonNull(file, "file");
    FileTicketingAdapter adapter = fromJson(Files.readString(file, StandardCharsets.UTF_8), zone, file);
    log.info("Loaded {} issues from {}", adapter.issues.size(), file);
    return adapter;
  }

  /**
   * Builds an adapter from JSON text; {@link #save()} then requires {@code file}.
   *
   * @param text ticketing export
   * @param zone zone of local wall times
   * @param file target of {@link #save()}; may be {@code null}
   * @return adapter
   * @throws IOException when the text is not a JSON object
   */
  public static FileTicketingAdapter fromJson(String text, ZoneId zone, Path file) throws IOException {
    JsonSupport json = new JsonSupport();
    Object root = json.parse(text);
    if (!(root instanceof Map<?, ?>)) {
      throw new IOException("ticketing document must be a JSON object");
    }
    return new FileTicketingAdapter(file, zone, json, new LinkedHashMap<>(JsonSupport.object(root)));
  }

  /** Whether mutations happened since load or the last {@link #save()}. */
  public boolean isDirty() {
    return dirty;
  }

  /**
   * Writes the document back to its file, via a temporary sibling.
   *
   * @throws IOException when writing fails or the adapter has no file
   */
  public void save() throws IOException {
    if (file == null) {
      throw new IOException("no ticketing file to save to");
    }
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    Files.writeString(tmp, json.write(document), StandardCharsets.UTF_8);
    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    dirty = false;
    log.info("Saved ticketing document to {}", file);
  }

  @Override
  public String resolveId(String key) throws IOException {
    Map<String, Object> issue = requireIssue(key);
    String id = JsonSupport.text(issue, "id");
    return id.isBlank() ? JsonSupport.text(issue, "key") : id;
  }

  @Override
  public List<TicketSummary> search(String text) {
    String needle = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    List<TicketSummary> out = new ArrayList<>();
    for (Map<String, Object> issue : issues) {
      String key = JsonSupport.text(issue, "key");
      String summary = JsonSupport.text(issue, "summary");
      if (key.toLowerCase(Locale.ROOT).contains(needle) || summary.toLowerCase(Locale.ROOT).contains(needle)) {
        out.add(new TicketSummary(key, summary));
      }
    }
    return out;
  }

  @Override
  public Map<String, String> fetchSummaries(Collection<String> keys) {
    Map<String, String> out = new LinkedHashMap<>();
    for (String key : keys) {
      findIssue(key).ifPresent(issue -> out.put(key, JsonSupport.text(issue, "summary")));
    }
    return out;
  }

  @Override
  public List<RemoteWorklogRecord> fetchWorklogs(String ticketKey) throws IOException {
    Map<String, Object> issue = requireIssue(ticketKey);
    String key = JsonSupport.text(issue, "key");
    List<RemoteWorklogRecord> out = new ArrayList<>();
    for (Object raw : worklogs(issue)) {
      toRecord(key, JsonSupport.object(raw)).ifPresent(out::add);
    }
    return out;
  }

  @Override
  public List<String> findTicketsWithWorklogs(String authorId, LocalDate from, LocalDate to) {
    List<String> out = new ArrayList<>();
    for (Map<String, Object> issue : issues) {
      String key = JsonSupport.text(issue, "key");
      for (Object raw : worklogs(issue)) {
        Optional<RemoteWorklogRecord> record = toRecord(key, JsonSupport.object(raw));
        if (record.isPresent() && authorId.equals(record.get().authorId())) {
          LocalDate day = record.get().start().toLocalDate();
          if (!day.isBefore(from) && !day.isAfter(to)) {
            out.add(key);
            break;
          }
        }
      }
    }
    return out;
  }

  @Override
  public WriteResult create(String ticket, LocalDateTime started, long durationSeconds, String comment) {
    Optional<Map<String, Object>> issue = findIssue(ticket);
    if (issue.isEmpty()) {
      return WriteResult.error("Issue does not exist: " + ticket);
    }
    if (durationSeconds <= 0) {
      return WriteResult.error("timeSpentSeconds must be positive");
    }
    String id = Long.toString(nextWorklogId++);
    Map<String, Object> worklog = new LinkedHashMap<>();
    worklog.put("id", id);
    worklog.put("author", createAuthor);
    worklog.put("started", WorklogTimestamps.format(started, zone));
    worklog.put("timeSpentSeconds", durationSeconds);
    worklog.put("comment", comment == null ? "" : comment);
    worklogs(issue.get()).add(worklog);
    dirty = true;
    log.debug("Created worklog {} on {}", id, ticket);
    return WriteResult.ok(id);
  }

  @Override
  public WriteResult update(String ticket, String worklogId, LocalDateTime started, long durationSeconds) {
    if (durationSeconds <= 0) {
      return WriteResult.error("timeSpentSeconds must be positive");
    }
    Optional<Map<String, Object>> worklog = findWorklog(ticket, worklogId);
    if (worklog.isEmpty()) {
      return WriteResult.error("Worklog " + worklogId + " not found on " + ticket);
    }
    worklog.get().put("started", WorklogTimestamps.format(started, zone));
    worklog.get().put("timeSpentSeconds", durationSeconds);
    dirty = true;
    return WriteResult.ok(worklogId);
  }

  @Override
  public WriteResult delete(String ticket, String worklogId) {
    Optional<Map<String, Object>> issue = findIssue(ticket);
    if (issue.isEmpty()) {
      return WriteResult.error("Issue does not exist: " + ticket);
    }
    boolean removed = worklogs(issue.get())
        .removeIf(raw -> worklogId.equals(JsonSupport.text(JsonSupport.object(raw), "id")));
    if (!removed) {
      return WriteResult.error("Worklog " + worklogId + " not found on " + ticket);
    }
    dirty = true;
    return WriteResult.ok(worklogId);
  }

  /**
   * Sets the author id written on created worklogs.
   *
   * @param authorId account id
   * @return this adapter
   */
  public FileTicketingAdapter withCreateAuthor(String authorId) {
    this.createAuthor = authorId == null ? "" : authorId;
    return this;
  }

  private Optional<RemoteWorklogRecord> toRecord(String key, Map<String, Object> node) {
    String id = JsonSupport.text(node, "id");
    String started = JsonSupport.text(node, "started");
    double seconds = JsonSupport.number(node, "timeSpentSeconds", 0);
    if (id.isBlank() || started.isBlank() || seconds <= 0) {
      log.warn("Skipping invalid worklog on {} (id='{}', started='{}', seconds={})", key, id, started, seconds);
      return Optional.empty();
    }
    try {
      LocalDateTime start = WorklogTimestamps.parse(started, zone);
      RemoteWorklogRecord record = new RemoteWorklogRecord(
          id, key, JsonSupport.text(node, "author"),
          new TimeInterval(start, start.plus(Duration.ofSeconds((long) seconds))),
          JsonSupport.text(node, "comment"));
      return Optional.of(record);
    } catch (IllegalArgumentException ex) {
      log.warn("Skipping worklog {} on {}: {}", id, key, ex.getMessage());
      return Optional.empty();
    }
  }

  private Map<String, Object> requireIssue(String ticket) throws IOException {
    return findIssue(ticket).orElseThrow(() -> new IOException("Issue does not exist: " + ticket));
  }

  private Optional<Map<String, Object>> findIssue(String ticket) {
    if (ticket == null) {
      return Optional.empty();
    }
    for (Map<String, Object> issue : issues) {
      if (ticket.equalsIgnoreCase(JsonSupport.text(issue, "key")) || ticket.equals(JsonSupport.text(issue, "id"))) {
        return Optional.of(issue);
      }
    }
    return Optional.empty();
  }

  private Optional<Map<String, Object>> findWorklog(String ticket, String worklogId) {
    return findIssue(ticket).flatMap(issue -> worklogs(issue).stream()
        .map(JsonSupport::object)
        .filter(w -> worklogId.equals(JsonSupport.text(w, "id")))
        .findFirst());
  }

  @SuppressWarnings("unchecked")
  private static List<Object> worklogs(Map<String, Object> issue) {
    return (List<Object>) issue.get("worklogs");
  }

  private static long numericId(String id) {
    try {
      return Long.parseLong(id.trim());
    } catch (NumberFormatException ex) {
      return 0;
    }
  }
}
