package ddlsync.storage.mongo;

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.ThreadSafe;
import com.mongodb.ConnectionString;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import ddlsync.api.DdlSyncException;
import ddlsync.api.metadata.MetadataStore;
import ddlsync.api.metadata.command.Command;
import ddlsync.api.metadata.command.CommandHandler;
import ddlsync.api.metadata.command.HandlesCommand;
import ddlsync.storage.mongo.command.MongoCommandHandler;
import ddlsync.storage.mongo.command.MongoCommandHandlerContext;
import dev.failsafe.CircuitBreaker;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetadataStore} reading a MongoDB cluster.
 *
 * <p>Command handlers are discovered with {@link ServiceLoader} and dispatched on the command type
 * named by their {@link HandlesCommand} annotation.
 */
@ThreadSafe
public class MongoMetadataStore implements MetadataStore {

  private static final Logger log = LoggerFactory.getLogger(MongoMetadataStore.class);

  private final MongoClient mongoClient;
  private final String clusterName;
  private final boolean ownsClient;
  private final CircuitBreaker<Object> circuitBreaker = MongoCommandHandler.newCircuitBreaker();

  @SuppressWarnings("rawtypes")
  private final Map<Class<? extends Command>, CommandHandler> commandHandlerRegistry =
      new ConcurrentHashMap<>();

  /**
   * @param mongoClient client connected to the cluster; the caller keeps ownership
   * @param clusterName name used in logs and error messages
   */
  public MongoMetadataStore(MongoClient mongoClient, String clusterName) {
    this(mongoClient, clusterName, false);
  }

  private MongoMetadataStore(MongoClient mongoClient, String clusterName, boolean ownsClient) {
    this.mongoClient = mongoClient;
    this.clusterName = clusterName;
    this.ownsClient = ownsClient;

    // Discover and register all command handlers
    ServiceLoader.load(CommandHandler.class).forEach(this::registerHandler);
  }

  /** Connects to {@code connectionString}; closing the store closes the connection. */
  public static MongoMetadataStore create(String connectionString) {
    ConnectionString cs = new ConnectionString(connectionString);
    return new MongoMetadataStore(
        MongoClients.create(cs), String.join(",", cs.getHosts()), true);
  }

  @SuppressWarnings("rawtypes")
  @VisibleForTesting
  void registerHandler(CommandHandler handler) {
    HandlesCommand annotation = handler.getClass().getAnnotation(HandlesCommand.class);
    if (annotation != null) {
      commandHandlerRegistry.put(annotation.value(), handler);
      log.debug("Registered {} for {}", handler.getClass().getSimpleName(), annotation.value());
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R execute(Command<R> command) {
    CommandHandler<Command<R>, R> handler = commandHandlerRegistry.get(command.getClass());
    if (handler == null) {
      throw new DdlSyncException(
          "No command handler found for command: " + command.getClass().getName());
    }
    MongoCommandHandlerContext context =
        new MongoCommandHandlerContext(mongoClient, clusterName, circuitBreaker);
    return handler.execute(command, context);
  }

  @Override
  public void close() {
    if (ownsClient) {
      mongoClient.close();
    }
  }

  @Override
  public String toString() {
    return "MongoMetadataStore{" + clusterName + '}';
  }
}
