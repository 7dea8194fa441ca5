package ca.gc.cra.chronos.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Raises the log level of the {@code ca.gc.cra.chronos} loggers when a CLI run passes
 * {@code --verbose}.
 * <p><strong>Why:</strong> Per-commit and per-day segmentation details are logged at DEBUG; operators switch
 * them on per run instead of editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Only Logback supports the level change; other SLF4J bindings keep their configuration and a
 *     warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String BASE_LOGGER = "ca.gc.cra.chronos";

  private LoggingConfigurator() {
    // Utility
  }

  /** Sets the root and {@code ca.gc.cra.chronos} loggers to DEBUG. */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      context.getLogger(BASE_LOGGER).setLevel(Level.DEBUG);
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
