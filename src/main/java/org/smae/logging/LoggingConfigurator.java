package org.smae.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts SMAE runtime logging from configuration.
 * <p><strong>Why:</strong> Lets operators raise verbosity for a troublesome run without editing {@code logback.xml}.</p>
 * <p><strong>Role:</strong> Bootstrap utility invoked by the composition root.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup.</p>
 * <p><strong>Observability:</strong> Emits an SLF4J warning when the backend does not support dynamic changes.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setRootLevel("DEBUG");
  }

  /**
   * Sets the root logger level by name ({@code TRACE}, {@code DEBUG}, {@code INFO}, {@code WARN}, {@code ERROR}).
   *
   * @param levelName level name; unknown names fall back to {@code INFO}
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setRootLevel(String levelName) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Level level = Level.toLevel(levelName == null ? "" : levelName.trim().toUpperCase(Locale.ROOT), Level.INFO);
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return true;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        levelName, factory.getClass().getName());
    return false;
  }
}
