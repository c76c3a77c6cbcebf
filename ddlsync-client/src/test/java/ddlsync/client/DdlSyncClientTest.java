package ddlsync.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import ddlsync.api.DdlFatalException;
import ddlsync.api.DdlSyncException;
import ddlsync.api.metadata.MetadataStore;
import ddlsync.api.metadata.ShardCollectionSpec;
import ddlsync.api.metadata.command.ShardingCommand;
import ddlsync.api.oplog.OplogEntry;
import ddlsync.core.internal.source.DefaultSourceProgress;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DdlSyncClientTest {

  private static final ShardCollectionSpec SPEC =
      new ShardCollectionSpec("db.coll", new Document("_id", 1), false);

  @Mock private MetadataStore sourceMetadata;
  @Mock private MetadataStore targetMetadata;

  private final ReentrantReadWriteLock checkpointLock = new ReentrantReadWriteLock();
  private final AtomicReference<DdlFatalException> fatal = new AtomicReference<>();
  private ExecutorService executor;
  private DdlSyncClient client;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
    if (client != null) {
      client.close();
    }
  }

  private DdlSyncClient newClient(MetadataStore source, boolean targetSharded) {
    when(targetMetadata.execute(any(ShardingCommand.IsSharded.class))).thenReturn(targetSharded);
    DdlSyncOptions options =
        DdlSyncOptions.builder()
            .checkInterval(Duration.ofMillis(20))
            .unresponsiveThreshold(Duration.ofMinutes(5))
            .build();
    client =
        new DdlSyncClient(
            options, source, targetMetadata, checkpointLock, fatal::set, Clock.systemUTC());
    client.registerSource(new DefaultSourceProgress("rs0"));
    client.registerSource(new DefaultSourceProgress("rs1"));
    return client;
  }

  private static OplogEntry command(int seconds, Document body) {
    return OplogEntry.command(new BsonTimestamp(seconds, 0), "db.$cmd", body);
  }

  private Future<Boolean> blockInBackground(String replicaSet, OplogEntry entry) {
    return executor.submit(
        () -> {
          checkpointLock.readLock().lock();
          try {
            return client.blockDdl(replicaSet, entry);
          } finally {
            checkpointLock.readLock().unlock();
          }
        });
  }

  private void awaitPending(int count) throws InterruptedException {
    while (client.pendingDdlCount() < count) {
      TimeUnit.MILLISECONDS.sleep(10);
    }
  }

  @Test
  void targetTopologyIsResolvedOnCreation() {
    newClient(null, true);

    assertThat(client.isTargetSharded()).isTrue();
    assertThat(client.sources()).containsOnlyKeys("rs0", "rs1");
  }

  @Test
  @Timeout(10)
  void eliminationLoopReleasesBlockedWorker() throws Exception {
    newClient(null, false);
    client.start();

    Future<Boolean> worker = blockInBackground("rs0", command(100, new Document("drop", "coll")));

    assertThat(worker.get(5, TimeUnit.SECONDS)).isTrue();
    assertThat(client.pendingDdlCount()).isZero();
    assertThat(fatal.get()).isNull();
  }

  @Test
  @Timeout(10)
  void destructiveDdlWaitsForEverySource() throws Exception {
    when(sourceMetadata.execute(any(ShardingCommand.GetCollectionSpec.class)))
        .thenReturn(Optional.of(SPEC));
    newClient(sourceMetadata, false);
    client.start();

    Future<Boolean> first = blockInBackground("rs0", command(100, new Document("drop", "coll")));
    awaitPending(1);
    TimeUnit.MILLISECONDS.sleep(100);
    assertThat(first.isDone()).isFalse();

    Future<Boolean> second = blockInBackground("rs1", command(105, new Document("drop", "coll")));

    assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
    assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  @Timeout(10)
  void fatalEliminationGoesToHandler() throws Exception {
    when(sourceMetadata.execute(any(ShardingCommand.GetCollectionSpec.class)))
        .thenReturn(Optional.of(SPEC));
    newClient(sourceMetadata, true);
    blockInBackground(
        "rs0", command(100, new Document("convertToCapped", "coll").append("size", 1024)));
    awaitPending(1);

    client.runElimination();

    assertThat(fatal.get())
        .isNotNull()
        .hasMessageContaining("convertToCapped")
        .hasMessageContaining("rs0");
    assertThat(client.pendingDdlCount()).isEqualTo(1);
  }

  @Test
  @Timeout(10)
  void metadataFailureIsRetriedOnNextRun() throws Exception {
    when(sourceMetadata.execute(any(ShardingCommand.GetCollectionSpec.class)))
        .thenThrow(new DdlSyncException("config server down"))
        .thenReturn(Optional.empty());
    newClient(sourceMetadata, false);
    Future<Boolean> worker = blockInBackground("rs0", command(100, new Document("drop", "coll")));
    awaitPending(1);

    client.runElimination();
    assertThat(client.pendingDdlCount()).isEqualTo(1);
    assertThat(fatal.get()).isNull();

    client.runElimination();
    assertThat(worker.get(5, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void createOfShardedCollectionIsRewrittenForShardedTarget() {
    when(sourceMetadata.execute(new ShardingCommand.GetCollectionSpec("db.coll")))
        .thenReturn(Optional.of(SPEC));
    newClient(sourceMetadata, true);

    ImmutableList<OplogEntry> ops =
        client.transform("rs0", command(100, new Document("create", "coll")));

    assertThat(ops)
        .extracting(OplogEntry::commandName)
        .containsExactly("enableSharding", "shardCollection");
  }

  @Test
  void unregisteredSourceCannotBlock() {
    newClient(null, false);
    client.unregisterSource("rs1");

    checkpointLock.readLock().lock();
    try {
      assertThatThrownBy(() -> client.blockDdl("rs1", command(1, new Document("drop", "coll"))))
          .isInstanceOf(DdlFatalException.class);
    } finally {
      checkpointLock.readLock().unlock();
    }
  }

  @Test
  void closeReleasesStores() {
    newClient(sourceMetadata, false);

    client.close();

    verify(sourceMetadata).close();
    verify(targetMetadata).close();
    assertThatThrownBy(client::start).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @Timeout(10)
  void unexpectedLoopFailureGoesToHandler() throws Exception {
    IllegalStateException cause = new IllegalStateException("driver state corrupted");
    when(sourceMetadata.execute(any(ShardingCommand.GetCollectionSpec.class)))
        .thenThrow(cause)
        .thenReturn(Optional.empty());
    newClient(sourceMetadata, false);
    blockInBackground("rs0", command(100, new Document("drop", "coll")));
    awaitPending(1);
    client.start();

    while (fatal.get() == null) {
      TimeUnit.MILLISECONDS.sleep(10);
    }

    assertThat(fatal.get()).hasCause(cause);
    TimeUnit.MILLISECONDS.sleep(200);
    verify(sourceMetadata, times(1)).execute(any(ShardingCommand.GetCollectionSpec.class));
    assertThat(client.pendingDdlCount()).isEqualTo(1);
  }

  @Test
  void renameOfShardedCollectionIsRejectedOnTransform() {
    when(sourceMetadata.execute(new ShardingCommand.GetCollectionSpec("db.coll")))
        .thenReturn(Optional.of(SPEC));
    newClient(sourceMetadata, true);
    OplogEntry rename =
        OplogEntry.command(
            new BsonTimestamp(100, 0),
            "admin.$cmd",
            new Document("renameCollection", "db.coll").append("to", "db.new"));

    assertThatThrownBy(() -> client.transform("rs0", rename))
        .isInstanceOf(DdlFatalException.class)
        .hasMessageContaining("renameCollection");
  }
}
