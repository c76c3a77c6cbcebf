package ddlsync.storage.mongo.command;

import com.mongodb.client.MongoClient;
import ddlsync.api.metadata.command.CommandHandlerContext;
import dev.failsafe.CircuitBreaker;

public class MongoCommandHandlerContext implements CommandHandlerContext {

  private final MongoClient client;
  private final String clusterName;
  private final CircuitBreaker<Object> circuitBreaker;

  public MongoCommandHandlerContext(
      MongoClient client, String clusterName, CircuitBreaker<Object> circuitBreaker) {
    this.client = client;
    this.clusterName = clusterName;
    this.circuitBreaker = circuitBreaker;
  }

  @Override
  public String getClusterName() {
    return clusterName;
  }

  public MongoClient getClient() {
    return client;
  }

  /** @return the breaker shared by every command against this cluster */
  public CircuitBreaker<Object> getCircuitBreaker() {
    return circuitBreaker;
  }
}
