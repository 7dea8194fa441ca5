package ca.gc.cra.chronos.application.pipeline;

import java.util.Objects;

/**
 * Result of one unit of external work (a project, a ticket, a summary batch or a draft).
 *
 * @param unit unit name, e.g. {@code commits:backend} or {@code worklogs:ABC-1}
 * @param ok whether the unit completed
 * @param message failure cause; empty on success
 * @since 0.1.0
 */
public record UnitOutcome(String unit, boolean ok, String message) {
  public UnitOutcome {
    Objects.requireNonNull(unit, "unit");
    message = message == null ? "" : message;
  }

  public static UnitOutcome succeeded(String unit) {
    return new UnitOutcome(unit, true, "");
  }

  public static UnitOutcome failed(String unit, String message) {
    return new UnitOutcome(unit, false, message);
  }

  static String describe(Exception ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }
}
