package ddlsync.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top-level supervisor for {@link DdlFatalException}s that cannot be thrown back to a caller, such
 * as those raised on the elimination loop thread.
 */
@FunctionalInterface
public interface FatalErrorHandler {

  void onFatal(DdlFatalException error);

  /** Logs the error and terminates the JVM with exit status {@code 1}. */
  static FatalErrorHandler exitProcess() {
    return error -> {
      Logger log = LoggerFactory.getLogger(FatalErrorHandler.class);
      log.error("DDL coordination hit an unrecoverable error, terminating the process", error);
      System.exit(1);
    };
  }
}
