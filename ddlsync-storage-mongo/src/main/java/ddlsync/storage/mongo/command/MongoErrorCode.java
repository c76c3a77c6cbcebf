package ddlsync.storage.mongo.command;

import com.mongodb.MongoException;
import java.util.Arrays;

/**
 * Server error codes the metadata commands react to.
 *
 * @see <a href="https://www.mongodb.com/docs/manual/reference/error-codes/">MongoDB error codes</a>
 */
public enum MongoErrorCode {
  UNKNOWN_ERROR(8, "UnknownError", false),
  HOST_UNREACHABLE(6, "HostUnreachable", true),
  HOST_NOT_FOUND(7, "HostNotFound", false),
  LOCK_TIMEOUT(24, "LockTimeout", true),
  LOCK_BUSY(46, "LockBusy", true),
  NETWORK_TIMEOUT(89, "NetworkTimeout", true),
  SHUTDOWN_IN_PROGRESS(91, "ShutdownInProgress", true),
  WRITE_CONFLICT(112, "WriteConflict", true),
  INTERRUPTED_AT_SHUTDOWN(11600, "InterruptedAtShutdown", true),
  NOT_WRITABLE_PRIMARY(10107, "NotWritablePrimary", true),
  NOT_PRIMARY_OR_SECONDARY(13436, "NotPrimaryOrSecondary", true),
  // Routing table of a mongos lags behind a chunk migration.
  STALE_CONFIG(13388, "StaleConfig", true),
  ;

  private final int code;
  private final String codeName;
  private final boolean retryable;

  MongoErrorCode(int code, String codeName, boolean retryable) {
    this.code = code;
    this.codeName = codeName;
    this.retryable = retryable;
  }

  public static MongoErrorCode fromException(MongoException error) {
    return Arrays.stream(MongoErrorCode.values())
        .filter(t -> t.code == error.getCode())
        .findFirst()
        .orElse(MongoErrorCode.UNKNOWN_ERROR);
  }

  /** @return whether the same read is expected to succeed once the server settles */
  public static boolean isRetryable(MongoException error) {
    return fromException(error).retryable;
  }

  public int getCode() {
    return code;
  }

  public String getCodeName() {
    return codeName;
  }
}
