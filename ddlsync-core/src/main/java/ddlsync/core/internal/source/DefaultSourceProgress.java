package ddlsync.core.internal.source;

import com.google.errorprone.annotations.ThreadSafe;
import ddlsync.api.oplog.Timestamps;
import ddlsync.api.source.SourceProgress;
import java.time.Clock;
import java.time.Instant;
import org.bson.BsonTimestamp;

/**
 * {@link SourceProgress} backed by volatile fields.
 *
 * <p>Only the owning worker writes; any thread may read without blocking it.
 */
@ThreadSafe
public class DefaultSourceProgress implements SourceProgress {

  private final String replicaSet;
  private final Clock clock;

  private volatile BsonTimestamp syncedTimestamp;
  private volatile BsonTimestamp fetchedTimestamp;
  private volatile Instant lastResponseTime;

  public DefaultSourceProgress(String replicaSet) {
    this(replicaSet, new BsonTimestamp(), Clock.systemUTC());
  }

  /**
   * @param replicaSet the source's name
   * @param start the checkpoint the source resumes from
   * @param clock stamps every advance as a response time
   */
  public DefaultSourceProgress(String replicaSet, BsonTimestamp start, Clock clock) {
    this.replicaSet = replicaSet;
    this.clock = clock;
    this.syncedTimestamp = start;
    this.fetchedTimestamp = start;
    this.lastResponseTime = clock.instant();
  }

  @Override
  public String replicaSet() {
    return replicaSet;
  }

  @Override
  public BsonTimestamp syncedTimestamp() {
    return syncedTimestamp;
  }

  @Override
  public BsonTimestamp fetchedTimestamp() {
    return fetchedTimestamp;
  }

  @Override
  public Instant lastResponseTime() {
    return lastResponseTime;
  }

  /** Records that entries up to {@code ts} were fetched into a batch. */
  public synchronized void onFetched(BsonTimestamp ts) {
    if (ts.compareTo(fetchedTimestamp) > 0) {
      fetchedTimestamp = ts;
    }
    lastResponseTime = clock.instant();
  }

  /** Records that entries up to {@code ts} were applied downstream. */
  public synchronized void onSynced(BsonTimestamp ts) {
    if (ts.compareTo(syncedTimestamp) > 0) {
      syncedTimestamp = ts;
    }
    lastResponseTime = clock.instant();
  }

  /** Records that the source is alive without having moved, e.g. an empty oplog poll. */
  public void touch() {
    lastResponseTime = clock.instant();
  }

  @Override
  public synchronized void settle() {
    if (fetchedTimestamp.compareTo(syncedTimestamp) > 0) {
      syncedTimestamp = fetchedTimestamp;
    }
  }

  @Override
  public String toString() {
    return "DefaultSourceProgress{"
        + replicaSet
        + ", synced="
        + Timestamps.format(syncedTimestamp)
        + ", fetched="
        + Timestamps.format(fetchedTimestamp)
        + ", lastResponse="
        + lastResponseTime
        + '}';
  }
}
