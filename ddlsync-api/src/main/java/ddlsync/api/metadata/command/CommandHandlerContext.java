package ddlsync.api.metadata.command;

/** Provides a {@link CommandHandler} with what it needs to run. */
public interface CommandHandlerContext {

  /** @return a human readable name of the cluster the command runs against, used in logs */
  String getClusterName();
}
