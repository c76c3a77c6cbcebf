package ddlsync.storage.mongo.command;

import com.google.auto.service.AutoService;
import ddlsync.api.Result;
import ddlsync.api.metadata.command.CommandHandler;
import ddlsync.api.metadata.command.HandlesCommand;
import ddlsync.api.metadata.command.ShardingCommand;
import org.bson.Document;

/** A deployment is sharded when the client talks to a mongos, whose {@code hello} says so. */
@SuppressWarnings("rawtypes")
@HandlesCommand(ShardingCommand.IsSharded.class)
@AutoService({CommandHandler.class})
public class IsShardedCommandHandler
    extends MongoCommandHandler<ShardingCommand.IsSharded, Boolean> {

  @Override
  protected Boolean execute(ShardingCommand.IsSharded command, MongoCommandHandlerContext context) {
    Result<Boolean> result =
        newExecution(context)
            .withTimeout(METADATA_TIMEOUT)
            .execute(
                client -> {
                  Document reply =
                      client
                          .getDatabase(ConfigNamespace.ADMIN_DB)
                          .runCommand(new Document("hello", 1));
                  return ConfigNamespace.MONGOS_MARKER.equals(reply.getString("msg"));
                });
    return result.getOrThrow("hello against " + context.getClusterName());
  }
}
