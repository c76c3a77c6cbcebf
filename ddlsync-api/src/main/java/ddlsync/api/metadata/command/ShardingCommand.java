package ddlsync.api.metadata.command;

import ddlsync.api.metadata.ShardCollectionSpec;
import java.util.Optional;

/** Defines the commands and result types for sharding metadata lookups. */
public final class ShardingCommand {

  private ShardingCommand() {}

  // --- Commands ---

  /**
   * Looks up the sharding spec of a namespace.
   *
   * <p>A collection namespace resolves to its own spec. A bare database name resolves to the spec
   * of one of its sharded collections, so callers can tell whether a database-wide DDL touches
   * sharded data.
   */
  public record GetCollectionSpec(String namespace)
      implements Command<Optional<ShardCollectionSpec>> {}

  /** Asks whether the cluster behind the store is a sharded deployment (reached via mongos). */
  public record IsSharded() implements Command<Boolean> {}
}
