package ca.gc.cra.chronos.domain.commit;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the ticket key a commit message refers to.
 *
 * <p>The first line is stripped of leading noise (anything that is neither a word character nor an
 * opening bracket); a key such as {@code ABC-12}, {@code [abc-12]} or {@code ABC-12:} at the start wins.
 * Otherwise the first key anywhere in the first line is used. Merge commits never yield a key.</p>
 *
 * @since 0.1.0
 */
public final class TicketKeys {
  private static final Pattern LEADING_NOISE = Pattern.compile("^[^\\w\\[]+");
  private static final Pattern LEADING_KEY =
      Pattern.compile("^\\[?([A-Za-z][A-Za-z0-9]+-\\d+)]?:?", Pattern.CASE_INSENSITIVE);
  private static final Pattern ANY_KEY =
      Pattern.compile("([A-Za-z][A-Za-z0-9]+-\\d+)", Pattern.CASE_INSENSITIVE);

  private TicketKeys() {
    // Utility
  }

  /**
   * Returns the upper-cased ticket key referenced by {@code message}.
   *
   * @param message commit message; {@code null} or blank yields empty
   * @return ticket key, or empty for merge commits and messages without a key
   */
  public static Optional<String> extract(String message) {
    if (message == null || message.isEmpty()) {
      return Optional.empty();
    }
    if (message.toLowerCase(Locale.ROOT).startsWith("merge")) {
      return Optional.empty();
    }
    int newline = message.indexOf('\n');
    String line = (newline >= 0 ? message.substring(0, newline) : message).stripLeading();
    String cleaned = LEADING_NOISE.matcher(line).replaceFirst("");
    Matcher leading = LEADING_KEY.matcher(cleaned);
    if (leading.find()) {
      return Optional.of(leading.group(1).toUpperCase(Locale.ROOT));
    }
    Matcher anywhere = ANY_KEY.matcher(line);
    if (anywhere.find()) {
      return Optional.of(anywhere.group(1).toUpperCase(Locale.ROOT));
    }
    return Optional.empty();
  }
}
