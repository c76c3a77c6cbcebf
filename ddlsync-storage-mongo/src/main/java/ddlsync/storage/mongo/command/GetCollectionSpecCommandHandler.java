package ddlsync.storage.mongo.command;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.ne;
import static com.mongodb.client.model.Filters.regex;

import com.google.auto.service.AutoService;
import com.mongodb.client.MongoCollection;
import ddlsync.api.Result;
import ddlsync.api.ddl.DdlNamespaces;
import ddlsync.api.metadata.ShardCollectionSpec;
import ddlsync.api.metadata.command.CommandHandler;
import ddlsync.api.metadata.command.HandlesCommand;
import ddlsync.api.metadata.command.ShardingCommand;
import java.util.Optional;
import java.util.regex.Pattern;
import org.bson.Document;
import org.bson.conversions.Bson;

/**
 * Looks up the sharding spec of a namespace in {@code config.collections}.
 *
 * <p>A collection namespace matches its own document. A bare database name matches the first
 * sharded collection of that database. Documents flagged {@code dropped} (left behind by servers
 * older than 5.0) are ignored.
 *
 * <h3>config.collections document</h3>
 *
 * <pre>{@code
 * {
 *   "_id": "db.coll",
 *   "key": { "userId": 1 },
 *   "unique": false,
 *   "dropped": false
 * }
 * }</pre>
 */
@SuppressWarnings("rawtypes")
@HandlesCommand(ShardingCommand.GetCollectionSpec.class)
@AutoService({CommandHandler.class})
public class GetCollectionSpecCommandHandler
    extends MongoCommandHandler<ShardingCommand.GetCollectionSpec, Optional<ShardCollectionSpec>> {

  @Override
  protected Optional<ShardCollectionSpec> execute(
      ShardingCommand.GetCollectionSpec command, MongoCommandHandlerContext context) {
    String namespace = command.namespace();
    Bson filter =
        DdlNamespaces.isDatabase(namespace)
            ? and(regex("_id", "^" + Pattern.quote(namespace + ".")), ne("dropped", true))
            : and(eq("_id", namespace), ne("dropped", true));

    Result<Optional<ShardCollectionSpec>> result =
        newExecution(context)
            .withTimeout(METADATA_TIMEOUT)
            .execute(
                client -> {
                  MongoCollection<Document> collections =
                      client
                          .getDatabase(ConfigNamespace.CONFIG_DB)
                          .getCollection(ConfigNamespace.COLLECTIONS);
                  return Optional.ofNullable(collections.find(filter).first())
                      .map(GetCollectionSpecCommandHandler::toSpec);
                });
    return result.getOrThrow(
        "Lookup of " + namespace + " in config.collections of " + context.getClusterName());
  }

  static ShardCollectionSpec toSpec(Document doc) {
    Document key = doc.get("key", Document.class);
    return new ShardCollectionSpec(
        doc.getString("_id"), key == null ? new Document() : key, doc.getBoolean("unique", false));
  }
}
