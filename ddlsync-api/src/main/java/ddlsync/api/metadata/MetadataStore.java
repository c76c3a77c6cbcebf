package ddlsync.api.metadata;

import ddlsync.api.metadata.command.Command;

/**
 * Read access to cluster metadata, expressed as commands.
 *
 * <p>The coordinator holds one store for the source cluster (only when the source is sharded) and
 * one for the target.
 */
public interface MetadataStore extends AutoCloseable {

  /**
   * Executes a command against the cluster.
   *
   * @param command The command to execute.
   * @param <R> The type of the result expected from this command.
   * @return A command-specific result object.
   * @throws ddlsync.api.DdlSyncException if the command fails after the store's retry policy
   */
  <R> R execute(Command<R> command);

  @Override
  void close();
}
