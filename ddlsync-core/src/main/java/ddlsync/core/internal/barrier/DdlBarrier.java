package ddlsync.core.internal.barrier;

import com.google.errorprone.annotations.ThreadSafe;
import ddlsync.api.DdlFatalException;
import ddlsync.api.oplog.OplogEntry;
import ddlsync.api.source.SourceProgress;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Where source workers stop when they meet a DDL.
 *
 * <p>A worker calls {@link #block(String, OplogEntry)} while holding the read lock of the checkpoint
 * lock. The barrier gives that read lock up for as long as the worker sleeps, so that checkpoints
 * of other sources keep being written, and takes it back before returning.
 */
@ThreadSafe
public class DdlBarrier {

  private static final Logger log = LoggerFactory.getLogger(DdlBarrier.class);

  private final DdlRegistry registry;
  private final ReadWriteLock checkpointLock;
  private final Map<String, SourceProgress> sources = new ConcurrentHashMap<>();

  public DdlBarrier(DdlRegistry registry, ReadWriteLock checkpointLock) {
    this.registry = registry;
    this.checkpointLock = checkpointLock;
  }

  public void addSource(SourceProgress progress) {
    sources.put(progress.replicaSet(), progress);
  }

  public void removeSource(String replicaSet) {
    sources.remove(replicaSet);
  }

  /** @return a live, read-only view of the known sources keyed by replica set */
  public Map<String, SourceProgress> sources() {
    return Collections.unmodifiableMap(sources);
  }

  public DdlRegistry registry() {
    return registry;
  }

  /**
   * Reports the DDL {@code entry} met by {@code replicaSet} and blocks until it is released.
   *
   * <p>The caller must hold the checkpoint read lock. It holds it again when this method returns,
   * normally or not. Without the read lock the call fails with {@link
   * IllegalMonitorStateException} and reports nothing.
   *
   * @return {@code true} once released
   * @throws DdlFatalException if the replica set is unknown or the DDL's identity cannot be
   *     computed
   * @throws InterruptedException if the worker is interrupted while waiting
   */
  public boolean block(String replicaSet, OplogEntry entry) throws InterruptedException {
    SourceProgress progress = sources.get(replicaSet);
    if (progress == null) {
      throw new DdlFatalException("DDL reported by an unregistered replica set", replicaSet, null);
    }
    // Give the read lock up first: a caller that does not hold it fails here, before anything is
    // reported.
    Lock readLock = checkpointLock.readLock();
    readLock.unlock();
    try {
      PendingDdl handle = registry.report(replicaSet, entry);
      log.info("Oplog syncer {} block at ddl log {}", replicaSet, entry);

      // The DDL is the only entry of its batch: nothing fetched is waiting to be applied.
      progress.settle();

      boolean released = registry.awaitRelease(handle);
      log.info("Oplog syncer {} unblocked at ddl {}", replicaSet, handle.key());
      return released;
    } finally {
      readLock.lock();
    }
  }
}
