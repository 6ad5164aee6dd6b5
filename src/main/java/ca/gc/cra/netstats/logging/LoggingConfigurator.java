package ca.gc.cra.netstats.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts NETSTATS runtime logging for CLI-driven workflows.
 * <p><strong>Why:</strong> Lets operators see cache hits, device queries and pool parsing decisions when a
 * statistic looks wrong, without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String APP_LOGGER = "ca.gc.cra.netstats";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root and application loggers to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setLevel(Level.DEBUG);
  }

  private static void setLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      context.getLogger(APP_LOGGER).setLevel(level);
      return;
    }
    log.warn("Logging level change to {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
