package ddlsync.core.internal.transform;

import com.google.common.collect.ImmutableList;
import ddlsync.api.DdlFatalException;
import ddlsync.api.ddl.DdlCategory;
import ddlsync.api.ddl.DdlCommand;
import ddlsync.api.ddl.DdlKey;
import ddlsync.api.metadata.ShardCollectionSpec;
import ddlsync.api.oplog.OplogEntry;
import java.util.Map;
import java.util.Optional;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a captured DDL into the operations the target must receive, in order.
 *
 * <ul>
 *   <li>An insert into {@code <db>.system.indexes} becomes one {@code createIndexes} command on
 *       the collection it indexes.
 *   <li>{@code create} on a sharded target, for a collection sharded at the source, becomes {@code
 *       enableSharding} on the database followed by {@code shardCollection}. The database must be
 *       enabled first or the target refuses to shard the collection.
 *   <li>Other known additive and destructive commands pass through unchanged.
 *   <li>Anything else is fatal: forwarding a command this class cannot reason about could corrupt
 *       the target.
 * </ul>
 */
public final class DdlTransformer {

  private static final Logger log = LoggerFactory.getLogger(DdlTransformer.class);

  private DdlTransformer() {}

  /**
   * @param replicaSet the source the DDL was captured from
   * @param entry the captured DDL
   * @param shardSpec sharding spec of the DDL's namespace at the source, {@code null} when the
   *     namespace is not sharded or the source is not sharded
   * @param targetSharded whether the target is a sharded deployment
   * @return the target operations in application order
   * @throws DdlFatalException if the DDL cannot be expressed on the target
   */
  public static ImmutableList<OplogEntry> transform(
      String replicaSet, OplogEntry entry, ShardCollectionSpec shardSpec, boolean targetSharded) {
    if (DdlCategory.isIndexBookkeeping(entry.namespace())) {
      return ImmutableList.of(toCreateIndexes(replicaSet, entry, shardSpec));
    }

    String command = entry.commandName();
    Optional<DdlCommand> known = DdlCommand.fromName(command);
    if (known.isEmpty()) {
      throw new DdlFatalException(
          "Unsupported DDL command " + command, replicaSet, keyOf(replicaSet, entry));
    }
    if (known.get() == DdlCommand.CREATE && targetSharded && shardSpec != null) {
      OplogEntry enableSharding =
          entry.withBody(
              entry.operation(),
              entry.namespace(),
              new Document("enableSharding", entry.databaseName()));
      OplogEntry shardCollection =
          entry.withBody(
              entry.operation(),
              entry.namespace(),
              new Document("shardCollection", shardSpec.namespace())
                  .append("key", shardSpec.key())
                  .append("unique", shardSpec.unique()));
      log.info(
          "Syncer {} transform DDL {} to {} and {}",
          replicaSet,
          entry,
          enableSharding,
          shardCollection);
      return ImmutableList.of(enableSharding, shardCollection);
    }

    return switch (known.get().category()) {
      case ADDITIVE, DESTRUCTIVE -> ImmutableList.of(entry);
      default -> throw new DdlFatalException(
          "Illegal DDL " + command + " cannot be applied to the target",
          replicaSet,
          keyOf(replicaSet, entry));
    };
  }

  /**
   * An insert into {@code system.indexes} creates the index on one shard only. At the target the
   * index has to be created on the collection itself.
   */
  private static OplogEntry toCreateIndexes(
      String replicaSet, OplogEntry entry, ShardCollectionSpec shardSpec) {
    String namespace;
    if (shardSpec != null) {
      namespace = shardSpec.namespace();
    } else if (entry.object().get("ns") instanceof String ns) {
      namespace = ns;
    } else {
      throw new DdlFatalException(
          "Index bookkeeping entry without target namespace", replicaSet, keyOf(replicaSet, entry));
    }
    int dot = namespace.indexOf('.');
    if (dot < 0) {
      throw new DdlFatalException(
          "Index bookkeeping entry on non collection namespace " + namespace,
          replicaSet,
          keyOf(replicaSet, entry));
    }

    Document body = new Document("createIndexes", namespace.substring(dot + 1));
    for (Map.Entry<String, Object> field : entry.object().entrySet()) {
      if (!"ns".equals(field.getKey())) {
        body.append(field.getKey(), field.getValue());
      }
    }
    OplogEntry transformed = entry.withBody(OplogEntry.OP_COMMAND, namespace, body);
    log.info("Syncer {} transform index insert {} to {}", replicaSet, entry, transformed);
    return transformed;
  }

  private static DdlKey keyOf(String replicaSet, OplogEntry entry) {
    return DdlKey.of(replicaSet, entry);
  }
}
