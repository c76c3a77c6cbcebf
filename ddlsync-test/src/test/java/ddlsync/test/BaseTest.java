package ddlsync.test;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import ddlsync.storage.mongo.MongoMetadataStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Base class of the tests that run against a real MongoDB. The container is a single node replica
 * set shared by every test class; tests are skipped when no Docker daemon is available.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseTest {

  @Container
  protected static final MongoDBContainer mongoDBContainer =
      new MongoDBContainer("mongo:7.0").withExposedPorts(27017);

  protected MongoClient mongoClient;

  public MongoMetadataStore newMetadataStore() {
    return new MongoMetadataStore(mongoClient, "ddlsync-test");
  }

  @BeforeEach
  void setUp() {
    mongoClient = MongoClients.create(mongoDBContainer.getConnectionString());
  }

  @AfterEach
  void tearDown() {
    if (mongoClient != null) {
      mongoClient.close();
    }
  }
}
