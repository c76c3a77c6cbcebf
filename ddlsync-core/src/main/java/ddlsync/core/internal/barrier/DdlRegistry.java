package ddlsync.core.internal.barrier;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import ddlsync.api.DdlFatalException;
import ddlsync.api.ddl.DdlKey;
import ddlsync.api.oplog.OplogEntry;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Table of DDLs that sources have reported and that are waiting to be released.
 *
 * <p>Every method runs under one lock. The lock is never held while a reporter waits for release,
 * otherwise two sources blocked on two different DDLs would lock out the elimination loop.
 */
@ThreadSafe
public class DdlRegistry {

  private static final Logger log = LoggerFactory.getLogger(DdlRegistry.class);

  private final ReentrantLock lock = new ReentrantLock();

  // Guarded by lock.
  private final Map<DdlKey, PendingDdl> pending = new HashMap<>();

  // Guarded by lock. Compared by identity: the same key reported again after its release is a new
  // entry. release() removes the entry under the same lock snapshot() takes, so no snapshot holds
  // the marked entry; the elimination loop's check against it guards release paths that would
  // fire without removing.
  private PendingDdl lastReleased;

  /**
   * Registers that {@code replicaSet} reached the DDL {@code entry}.
   *
   * <p>Creates the pending entry on the first report of its identity. Reporting the same identity
   * again from the same source only overwrites that source's timestamp.
   *
   * @return the handle shared by every reporter of this identity
   * @throws DdlFatalException if the identity of the entry cannot be computed
   */
  public PendingDdl report(String replicaSet, OplogEntry entry) {
    DdlKey key = DdlKey.of(replicaSet, entry);
    lock.lock();
    try {
      PendingDdl ddl = pending.computeIfAbsent(key, k -> new PendingDdl(k, entry));
      ddl.report(replicaSet, entry.timestamp());
      return ddl;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks the calling source until {@code handle} is released.
   *
   * @return {@code true}; the release broadcast itself authorizes the caller to proceed
   */
  public boolean awaitRelease(PendingDdl handle) throws InterruptedException {
    checkState(!lock.isHeldByCurrentThread(), "Must not wait for release under the registry lock");
    return handle.await();
  }

  /**
   * Releases the pending DDL {@code key}: fires its signal once and removes it.
   *
   * @throws DdlFatalException if no such DDL is pending, which means two release paths raced
   */
  public void release(DdlKey key) {
    lock.lock();
    try {
      PendingDdl ddl = pending.remove(key);
      if (ddl == null) {
        throw new DdlFatalException("Release requested for a DDL that is not pending", null, key);
      }
      lastReleased = ddl;
      ddl.fire();
      log.debug("Released DDL {}, {} still pending", key, pending.size());
    } finally {
      lock.unlock();
    }
  }

  /** @return a consistent view of every pending DDL */
  public ImmutableList<PendingDdl.Snapshot> snapshot() {
    lock.lock();
    try {
      return pending.values().stream()
          .map(PendingDdl::snapshot)
          .collect(ImmutableList.toImmutableList());
    } finally {
      lock.unlock();
    }
  }

  /** @return whether {@code ddl} is the very entry released last */
  public boolean isLastReleased(PendingDdl ddl) {
    lock.lock();
    try {
      return lastReleased == ddl;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  Optional<PendingDdl> get(DdlKey key) {
    lock.lock();
    try {
      return Optional.ofNullable(pending.get(key));
    } finally {
      lock.unlock();
    }
  }
}
