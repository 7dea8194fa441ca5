package ca.gc.cra.chronos.validation;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation helpers for identifiers read from configuration and the command line.
 * <p><strong>Why:</strong> E-mail identities, ticket keys and project ids are compared textually across
 * calendar, commit and ticketing data; they are normalized once at the edge.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern TICKET_KEY = Pattern.compile("^[A-Z][A-Z0-9]+-\\d+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name used in messages; {@code null} becomes {@code "value"}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Validates a ticket key such as {@code ABC-123}; the key is upper-cased first.
   *
   * @param name parameter name used in messages
   * @param value candidate key
   * @return upper-cased key
   * @throws IllegalArgumentException if the key does not look like {@code PROJECT-NUMBER}
   */
  public static String requireTicketKey(String name, String value) {
    String key = requireNonBlank(name, value).toUpperCase(Locale.ROOT);
    if (!TICKET_KEY.matcher(key).matches()) {
      throw new IllegalArgumentException(message(name, "must look like ABC-123 but was '" + value + "'"));
    }
    return key;
  }

  /** Lower-cases and trims each address, dropping blanks. */
  public static List<String> normalizeEmails(Collection<String> emails) {
    if (emails == null) {
      return List.of();
    }
    return emails.stream()
        .filter(Objects::nonNull)
        .map(e -> e.trim().toLowerCase(Locale.ROOT))
        .filter(e -> !e.isEmpty())
        .distinct()
        .toList();
  }

  /** Returns {@code true} when {@code value} is {@code null} or blank. */
  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
