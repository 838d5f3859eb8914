package de.ialistannen.ocmirror.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Maps the command line verbosity to the logback root level.
 */
public final class LoggingConfigurator {

  public static final int DEFAULT_VERBOSITY = 2;

  private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * @param verbosity 0 = error, 1 = warn, 2 = info, 3 = debug, anything above = trace
   * @return the matching level
   */
  public static Level levelFor(int verbosity) {
    if (verbosity <= 0) {
      return Level.ERROR;
    }
    return switch (verbosity) {
      case 1 -> Level.WARN;
      case 2 -> Level.INFO;
      case 3 -> Level.DEBUG;
      default -> Level.TRACE;
    };
  }

  /**
   * Sets the root level. Called once during startup.
   *
   * @param verbosity the requested verbosity
   */
  public static void applyVerbosity(int verbosity) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      root.setLevel(levelFor(verbosity));
      return;
    }
    LOGGER.warn(
      "Verbosity {} requested but backend {} does not support dynamic level updates",
      verbosity,
      factory.getClass().getName()
    );
  }
}
