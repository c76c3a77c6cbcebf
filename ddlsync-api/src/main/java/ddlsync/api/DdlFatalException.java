package ddlsync.api;

import ddlsync.api.ddl.DdlKey;
import java.util.Optional;

/**
 * An unrecoverable invariant violation or an explicitly unsupported DDL.
 *
 * <p>Nothing in the core retries or swallows this exception. It travels up to the worker that
 * reported the DDL, or to the {@link FatalErrorHandler} when raised by the elimination loop, and the
 * process is expected to stop: replicating a schema change wrongly is worse than not replicating
 * it at all.
 */
public class DdlFatalException extends DdlSyncException {

  private final String replicaSet;
  private final DdlKey key;

  public DdlFatalException(String message, String replicaSet, DdlKey key) {
    super(describe(message, replicaSet, key));
    this.replicaSet = replicaSet;
    this.key = key;
  }

  public DdlFatalException(String message, String replicaSet, DdlKey key, Throwable cause) {
    super(describe(message, replicaSet, key), cause);
    this.replicaSet = replicaSet;
    this.key = key;
  }

  /** @return the replica set involved, if known */
  public Optional<String> getReplicaSet() {
    return Optional.ofNullable(replicaSet);
  }

  /** @return the identity of the DDL involved, if it could be computed */
  public Optional<DdlKey> getKey() {
    return Optional.ofNullable(key);
  }

  private static String describe(String message, String replicaSet, DdlKey key) {
    StringBuilder sb = new StringBuilder(message);
    if (replicaSet != null) {
      sb.append(" [replicaSet=").append(replicaSet).append(']');
    }
    if (key != null) {
      sb.append(" [ddl=").append(key).append(']');
    }
    return sb.toString();
  }
}
