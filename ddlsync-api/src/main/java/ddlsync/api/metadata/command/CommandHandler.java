package ddlsync.api.metadata.command;

/**
 * Answers one kind of {@link Command} for a particular store implementation. Stores discover their
 * handlers at runtime, so implementations need a public no-arg constructor and a {@link
 * HandlesCommand} annotation.
 *
 * @param <C> the command answered
 * @param <R> the answer
 */
@FunctionalInterface
public interface CommandHandler<C extends Command<R>, R> {

  /**
   * @param context connection and naming of the cluster being asked
   * @throws ddlsync.api.DdlSyncException if the cluster could not answer
   */
  R execute(C command, CommandHandlerContext context);
}
