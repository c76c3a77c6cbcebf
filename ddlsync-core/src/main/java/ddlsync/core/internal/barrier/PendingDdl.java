package ddlsync.core.internal.barrier;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.ThreadSafe;
import ddlsync.api.ddl.DdlKey;
import ddlsync.api.oplog.OplogEntry;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.bson.BsonTimestamp;

/**
 * A DDL that at least one source has reported and that has not been released yet.
 *
 * <p>The reporter table is guarded by the owning {@link DdlRegistry}'s lock. The release signal has
 * its own lock so that reporters can sleep on it without holding the registry.
 */
@ThreadSafe
public final class PendingDdl {

  private final DdlKey key;
  private final OplogEntry entry;

  // Guarded by the registry lock.
  private final Map<String, BsonTimestamp> reporters = new HashMap<>();

  private final ReentrantLock signalLock = new ReentrantLock();
  private final Condition releasedCondition = signalLock.newCondition();

  // Guarded by signalLock.
  private boolean released;

  PendingDdl(DdlKey key, OplogEntry entry) {
    this.key = key;
    this.entry = entry;
  }

  public DdlKey key() {
    return key;
  }

  /** @return the oplog entry of the first report */
  public OplogEntry entry() {
    return entry;
  }

  void report(String replicaSet, BsonTimestamp timestamp) {
    reporters.put(replicaSet, timestamp);
  }

  Snapshot snapshot() {
    return new Snapshot(this, ImmutableMap.copyOf(reporters));
  }

  /** Fires the release signal, waking every reporter blocked in {@link #await()}. */
  void fire() {
    signalLock.lock();
    try {
      checkState(!released, "DDL %s released twice", key);
      released = true;
      releasedCondition.signalAll();
    } finally {
      signalLock.unlock();
    }
  }

  /**
   * Blocks until the release signal fires. Returns at once if it already has.
   *
   * @return always {@code true}: the signal is a broadcast and only ever authorizes
   */
  boolean await() throws InterruptedException {
    signalLock.lock();
    try {
      while (!released) {
        releasedCondition.await();
      }
      return true;
    } finally {
      signalLock.unlock();
    }
  }

  public boolean isReleased() {
    signalLock.lock();
    try {
      return released;
    } finally {
      signalLock.unlock();
    }
  }

  @Override
  public String toString() {
    return "PendingDdl{" + key + '}';
  }

  /**
   * Immutable view of a pending DDL at the time the registry was snapshotted.
   *
   * @param pending the live entry, compared by identity against the last released one
   * @param reporters replica set to the timestamp it reported the DDL at
   */
  public record Snapshot(PendingDdl pending, ImmutableMap<String, BsonTimestamp> reporters) {

    public DdlKey key() {
      return pending.key();
    }

    public OplogEntry entry() {
      return pending.entry();
    }

    /** @return the earliest timestamp any source reported this DDL at */
    public BsonTimestamp minTimestamp() {
      return reporters.values().stream()
          .min(BsonTimestamp::compareTo)
          .orElseThrow(() -> new IllegalStateException("Pending DDL without reporter " + key()));
    }
  }
}
