package ca.gc.cra.chronos.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * <strong>What:</strong> Formatting helpers for log and trace lines.
 * <p><strong>Why:</strong> Meeting titles and commit messages are free text of unbounded length; log lines
 * carry a bounded prefix plus a marker instead.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Shortens {@code value} to at most {@code maxBytes} UTF-8 bytes.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the original value when it fits, otherwise the prefix followed by {@code "... (N of M bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String prefix;
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      prefix = buffer.toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "... (" + maxBytes + " of " + bytes.length + " bytes)";
  }

  /**
   * Renders a duration as {@code 2h05m}, {@code 45m} or {@code -10m}.
   *
   * @param duration duration to render; seconds are dropped
   * @return compact hour/minute text
   */
  public static String minutes(Duration duration) {
    long total = duration.toMinutes();
    String sign = total < 0 ? "-" : "";
    long abs = Math.abs(total);
    if (abs < 60) {
      return sign + abs + "m";
    }
    return String.format("%s%dh%02dm", sign, abs / 60, abs % 60);
  }
}
