package ddlsync.client;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import ddlsync.api.DdlFatalException;
import ddlsync.api.DdlSyncException;
import ddlsync.api.FatalErrorHandler;
import ddlsync.api.ddl.DdlNamespaces;
import ddlsync.api.metadata.MetadataStore;
import ddlsync.api.metadata.ShardCollectionSpec;
import ddlsync.api.metadata.command.ShardingCommand;
import ddlsync.api.oplog.OplogEntry;
import ddlsync.api.source.SourceProgress;
import ddlsync.core.internal.barrier.DdlBarrier;
import ddlsync.core.internal.barrier.DdlEliminator;
import ddlsync.core.internal.barrier.DdlRegistry;
import ddlsync.core.internal.barrier.EliminationResult;
import ddlsync.core.internal.transform.DdlTransformer;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the DDL coordination core. One instance per process, shared by every source
 * worker.
 *
 * <p>Workers register their {@link SourceProgress}, call {@link #blockDdl(String, OplogEntry)} when
 * they meet a DDL and, once released, {@link #transform(String, OplogEntry)} to get what to apply
 * on the target. {@link #start()} launches the elimination loop that releases blocked DDLs.
 *
 * <p>A {@link DdlFatalException} raised on a worker's call is thrown back to that worker. One
 * raised by the elimination loop stops the loop and goes to the {@link FatalErrorHandler}, as does
 * any unexpected runtime exception of the loop. A plain {@link DdlSyncException} is retried on
 * the next run.
 */
@ThreadSafe
public class DdlSyncClient implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(DdlSyncClient.class);

  private final DdlSyncOptions options;
  private final MetadataStore sourceMetadata;
  private final MetadataStore targetMetadata;
  private final FatalErrorHandler fatalErrorHandler;
  private final boolean targetSharded;

  private final DdlRegistry registry = new DdlRegistry();
  private final DdlBarrier barrier;
  private final DdlEliminator eliminator;
  private final ScheduledExecutorService scheduleExecutor;

  private ScheduledFuture<?> eliminationTask;
  private boolean closed;

  /**
   * Resolves the target topology right away.
   *
   * @param options loop timing
   * @param sourceMetadata metadata store of the source cluster, {@code null} unless the source is
   *     sharded
   * @param targetMetadata metadata store of the target
   * @param checkpointLock lock guarding checkpoint persistence; workers hold its read lock
   * @param fatalErrorHandler receives the fatal errors of the elimination loop
   */
  public DdlSyncClient(
      DdlSyncOptions options,
      MetadataStore sourceMetadata,
      MetadataStore targetMetadata,
      ReadWriteLock checkpointLock,
      FatalErrorHandler fatalErrorHandler) {
    this(
        options,
        sourceMetadata,
        targetMetadata,
        checkpointLock,
        fatalErrorHandler,
        Clock.systemUTC());
  }

  @VisibleForTesting
  DdlSyncClient(
      DdlSyncOptions options,
      MetadataStore sourceMetadata,
      MetadataStore targetMetadata,
      ReadWriteLock checkpointLock,
      FatalErrorHandler fatalErrorHandler,
      Clock clock) {
    this.options = options;
    this.sourceMetadata = sourceMetadata;
    this.targetMetadata = targetMetadata;
    this.fatalErrorHandler = fatalErrorHandler;
    this.targetSharded = targetMetadata.execute(new ShardingCommand.IsSharded());
    this.barrier = new DdlBarrier(registry, checkpointLock);
    this.eliminator =
        new DdlEliminator(
            registry, barrier.sources(), sourceMetadata, options.unresponsiveThreshold(), clock);
    this.scheduleExecutor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat(options.eliminatorThreadName())
                .setDaemon(true)
                .build());
    log.info(
        "DDL sync client created, sharded source: {}, sharded target: {}",
        sourceMetadata != null,
        targetSharded);
  }

  /** Starts the elimination loop. Runs never overlap: the next one is scheduled after the last. */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DDL sync client is closed");
    }
    if (eliminationTask != null) {
      return;
    }
    long intervalMillis = options.checkInterval().toMillis();
    eliminationTask =
        scheduleExecutor.scheduleWithFixedDelay(
            this::runElimination, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
  }

  @VisibleForTesting
  void runElimination() {
    try {
      EliminationResult result = eliminator.eliminate();
      if (result.outcome() != EliminationResult.Outcome.IDLE) {
        log.debug("Elimination run: {}", result);
      }
    } catch (DdlFatalException e) {
      stopElimination();
      fatalErrorHandler.onFatal(e);
    } catch (DdlSyncException e) {
      log.warn("Elimination run failed, retrying in {}", options.checkInterval(), e);
    } catch (RuntimeException e) {
      // Escaping the scheduled task would cancel the loop and leave every worker blocked.
      stopElimination();
      fatalErrorHandler.onFatal(
          new DdlFatalException("Elimination run failed unexpectedly", null, null, e));
    }
  }

  private synchronized void stopElimination() {
    if (eliminationTask != null) {
      eliminationTask.cancel(false);
    }
  }

  public void registerSource(SourceProgress progress) {
    barrier.addSource(progress);
    log.info("Registered source {}", progress.replicaSet());
  }

  public void unregisterSource(String replicaSet) {
    barrier.removeSource(replicaSet);
    log.info("Unregistered source {}", replicaSet);
  }

  /** @return a read-only view of the registered sources */
  public Map<String, SourceProgress> sources() {
    return barrier.sources();
  }

  /**
   * Reports the DDL met by {@code replicaSet} and blocks until the elimination loop releases it.
   * The caller must hold the checkpoint read lock, which is given up while blocked.
   *
   * @return {@code true} once released
   * @throws DdlFatalException if the DDL cannot be identified or the replica set is unknown
   * @throws InterruptedException if interrupted while blocked
   */
  public boolean blockDdl(String replicaSet, OplogEntry entry) throws InterruptedException {
    return barrier.block(replicaSet, entry);
  }

  /**
   * Rewrites a released DDL into the operations to apply on the target, in order.
   *
   * @throws DdlFatalException if the DDL cannot be expressed on the target
   */
  public ImmutableList<OplogEntry> transform(String replicaSet, OplogEntry entry) {
    ShardCollectionSpec shardSpec = null;
    if (sourceMetadata != null) {
      shardSpec =
          sourceMetadata
              .execute(new ShardingCommand.GetCollectionSpec(DdlNamespaces.targetNamespace(entry)))
              .orElse(null);
    }
    return DdlTransformer.transform(replicaSet, entry, shardSpec, targetSharded);
  }

  public boolean isTargetSharded() {
    return targetSharded;
  }

  /** @return the number of DDLs currently blocked */
  public int pendingDdlCount() {
    return registry.size();
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    scheduleExecutor.shutdownNow();
    if (sourceMetadata != null) {
      sourceMetadata.close();
    }
    targetMetadata.close();
  }
}
