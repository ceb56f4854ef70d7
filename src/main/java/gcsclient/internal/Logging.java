package gcsclient.internal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Simple wrappers for the library's logging calls. Messages use Log4j {@code {}} placeholders.
 */
public final class Logging {

  public static final String LOGGER_NAME = "gcsclient";

  static final Logger LOGGER = LogManager.getLogger(LOGGER_NAME);

  private Logging() {}

  public static void debug(String msg, Object... args) {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(msg, args);
    }
  }

  public static void info(String msg, Object... args) {
    if (LOGGER.isInfoEnabled()) {
      LOGGER.info(msg, args);
    }
  }

  public static void warn(String msg, Object... args) {
    if (LOGGER.isWarnEnabled()) {
      LOGGER.warn(msg, args);
    }
  }
}
