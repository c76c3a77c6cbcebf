package ddlsync.core.internal.barrier;

import com.google.common.base.Joiner;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import ddlsync.api.DdlFatalException;
import ddlsync.api.ddl.DdlCategory;
import ddlsync.api.ddl.DdlCommand;
import ddlsync.api.ddl.DdlKey;
import ddlsync.api.ddl.DdlNamespaces;
import ddlsync.api.metadata.MetadataStore;
import ddlsync.api.metadata.ShardCollectionSpec;
import ddlsync.api.metadata.command.ShardingCommand;
import ddlsync.api.oplog.Timestamps;
import ddlsync.api.source.SourceProgress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which pending DDL may be released.
 *
 * <p>Each call to {@link #eliminate()} looks at the DDL reported earliest across all sources and
 * either releases it, defers it to a later run, or fails fatally. At most one DDL is released per
 * run. The caller must never run two eliminations at the same time.
 *
 * <h3>Release rules</h3>
 *
 * <ol>
 *   <li>Without a sharded source, or when the DDL's namespace is not sharded at the source, there
 *       is nothing to coordinate: release.
 *   <li>Index bookkeeping inserts only ever create an index on one shard: release.
 *   <li>Additive commands ({@code create}, {@code createIndexes}, {@code collMod}): release.
 *   <li>Destructive commands ({@code drop}, {@code dropDatabase}, index drops): release once every
 *       other known source has reported the same DDL, has synced past the DDL's earliest
 *       timestamp, or has been silent for longer than the unresponsiveness threshold.
 *   <li>{@code renameCollection}, {@code convertToCapped}, {@code emptycapped}, {@code applyOps}:
 *       fatal.
 *   <li>Any other command: release with a warning; the transformer rejects what it cannot express.
 * </ol>
 *
 * <p>A source that stays silent past the threshold is treated as having nothing more to deliver.
 * If it was only paused and resumes later, data it delivers for a dropped namespace is lost.
 */
public class DdlEliminator {

  private static final Logger log = LoggerFactory.getLogger(DdlEliminator.class);

  private static final Comparator<PendingDdl.Snapshot> EARLIEST_FIRST =
      Comparator.comparing(PendingDdl.Snapshot::minTimestamp)
          .thenComparing(PendingDdl.Snapshot::key);

  private final DdlRegistry registry;
  private final Map<String, SourceProgress> sources;
  private final MetadataStore sourceMetadata;
  private final Duration unresponsiveThreshold;
  private final Clock clock;

  /**
   * @param registry the pending DDLs
   * @param sources live view of every known source, keyed by replica set
   * @param sourceMetadata metadata of the sharded source cluster, {@code null} when no source is
   *     sharded
   * @param unresponsiveThreshold how long a source may stay silent before a destructive DDL is
   *     forced through without it
   * @param clock time source for the unresponsiveness check
   */
  public DdlEliminator(
      DdlRegistry registry,
      Map<String, SourceProgress> sources,
      MetadataStore sourceMetadata,
      Duration unresponsiveThreshold,
      Clock clock) {
    this.registry = registry;
    this.sources = sources;
    this.sourceMetadata = sourceMetadata;
    this.unresponsiveThreshold = unresponsiveThreshold;
    this.clock = clock;
  }

  /**
   * Runs one elimination.
   *
   * @return what was decided
   * @throws DdlFatalException if the earliest DDL cannot be coordinated at all
   * @throws ddlsync.api.DdlSyncException if the sharding metadata lookup failed; the run can be
   *     retried
   */
  @CanIgnoreReturnValue
  public EliminationResult eliminate() {
    List<PendingDdl.Snapshot> snapshots = registry.snapshot();
    if (snapshots.isEmpty()) {
      return EliminationResult.idle();
    }
    log.info("DDL block map size={}", snapshots.size());
    if (log.isDebugEnabled()) {
      snapshots.forEach(s -> log.debug("DDL block key {} reporters {}", s.key(), s.reporters()));
    }

    PendingDdl.Snapshot earliest = snapshots.stream().min(EARLIEST_FIRST).orElseThrow();
    DdlKey key = earliest.key();
    if (registry.isLastReleased(earliest.pending())) {
      log.info("DDL {} has already been released", key);
      return EliminationResult.alreadyReleased(key);
    }

    if (sourceMetadata == null) {
      return release(key, "no sharded source");
    }
    String namespace = DdlNamespaces.targetNamespace(earliest.entry());
    Optional<ShardCollectionSpec> shardSpec =
        sourceMetadata.execute(new ShardingCommand.GetCollectionSpec(namespace));
    if (shardSpec.isEmpty()) {
      return release(key, "namespace " + namespace + " is not sharded");
    }

    if (DdlCategory.isIndexBookkeeping(key.namespace())) {
      return release(key, "index bookkeeping");
    }

    Document body = key.decodeBody();
    String command = DdlCommand.nameOf(body);
    return switch (DdlCategory.classify(key.namespace(), command)) {
      case ADDITIVE, INDEX_BOOKKEEPING -> release(key, "additive command " + command);
      case DESTRUCTIVE -> eliminateDestructive(earliest, shardSpec.get());
      case UNSUPPORTED -> throw new DdlFatalException(
          "Illegal DDL " + command + ", it cannot be coordinated across shards",
          Joiner.on(',').join(earliest.reporters().keySet()),
          key);
      case UNKNOWN -> {
        log.warn("DDL {} has unknown command {}, releasing it without coordination", key, command);
        yield release(key, "unknown command " + command);
      }
    };
  }

  private EliminationResult eliminateDestructive(
      PendingDdl.Snapshot earliest, ShardCollectionSpec shardSpec) {
    DdlKey key = earliest.key();
    BsonTimestamp minTs = earliest.minTimestamp();
    Instant now = clock.instant();
    List<String> forced = new ArrayList<>();

    for (Map.Entry<String, SourceProgress> e : sources.entrySet()) {
      String replicaSet = e.getKey();
      SourceProgress progress = e.getValue();
      if (earliest.reporters().containsKey(replicaSet)) {
        continue;
      }
      if (progress.syncedTimestamp().compareTo(minTs) >= 0) {
        continue;
      }
      if (now.isAfter(progress.lastResponseTime().plus(unresponsiveThreshold))) {
        forced.add(replicaSet);
        continue;
      }
      log.info(
          "DDL {} with shard spec {} cannot run yet: replica set {} ddlMinTs[{}] syncTs[{}]"
              + " lastResponse[{}]",
          key,
          shardSpec,
          replicaSet,
          Timestamps.format(minTs),
          Timestamps.format(progress.syncedTimestamp()),
          progress.lastResponseTime());
      return EliminationResult.deferred(key, "waiting for replica set " + replicaSet);
    }

    if (!forced.isEmpty()) {
      log.info("DDL {} forced through, unresponsive replica sets {}", key, forced);
      return release(key, "destructive command, forced past " + forced);
    }
    return release(key, "destructive command, all sources caught up");
  }

  private EliminationResult release(DdlKey key, String reason) {
    log.info("Release DDL {}: {}", key, reason);
    registry.release(key);
    return EliminationResult.released(key, reason);
  }
}
