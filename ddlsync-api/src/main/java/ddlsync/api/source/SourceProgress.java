package ddlsync.api.source;

import java.time.Instant;
import org.bson.BsonTimestamp;

/**
 * Progress of one source replica set, owned and advanced by its streaming worker.
 *
 * <p>Reads must be cheap and must not block the worker: the elimination loop polls every known
 * source on each run.
 */
public interface SourceProgress {

  /** @return name of the replica set this progress belongs to */
  String replicaSet();

  /** @return the timestamp up to which the source has been applied downstream */
  BsonTimestamp syncedTimestamp();

  /** @return the timestamp of the last entry fetched into a batch, applied or not */
  BsonTimestamp fetchedTimestamp();

  /** @return when the source last made forward progress */
  Instant lastResponseTime();

  /**
   * Declares everything fetched so far as synced.
   *
   * <p>Called by the barrier right before the worker blocks on a DDL. A DDL is always alone in its
   * batch, so nothing fetched is left unapplied at that point, and a checkpoint written while the
   * worker is blocked must see the DDL's position.
   */
  void settle();
}
