package ddlsync.core.internal.source;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;
import org.bson.BsonTimestamp;
import org.junit.jupiter.api.Test;

class DefaultSourceProgressTest {

  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

  /** A clock the test moves by hand. */
  private static final class MutableClock extends Clock {
    private final AtomicReference<Instant> now = new AtomicReference<>(START);

    void advance(Duration d) {
      now.updateAndGet(i -> i.plus(d));
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now.get();
    }
  }

  @Test
  void progressNeverMovesBackwards() {
    DefaultSourceProgress progress =
        new DefaultSourceProgress("rs0", new BsonTimestamp(100, 0), Clock.systemUTC());

    progress.onSynced(new BsonTimestamp(150, 1));
    progress.onSynced(new BsonTimestamp(120, 0));
    progress.onFetched(new BsonTimestamp(90, 0));

    assertThat(progress.syncedTimestamp()).isEqualTo(new BsonTimestamp(150, 1));
    assertThat(progress.fetchedTimestamp()).isEqualTo(new BsonTimestamp(100, 0));
  }

  @Test
  void everyAdvanceRefreshesResponseTime() {
    MutableClock clock = new MutableClock();
    DefaultSourceProgress progress = new DefaultSourceProgress("rs0", new BsonTimestamp(), clock);
    assertThat(progress.lastResponseTime()).isEqualTo(START);

    clock.advance(Duration.ofSeconds(5));
    progress.onFetched(new BsonTimestamp(1, 0));
    assertThat(progress.lastResponseTime()).isEqualTo(START.plusSeconds(5));

    clock.advance(Duration.ofSeconds(5));
    progress.touch();
    assertThat(progress.lastResponseTime()).isEqualTo(START.plusSeconds(10));
  }

  @Test
  void settleCatchesSyncedUpWithFetched() {
    DefaultSourceProgress progress = new DefaultSourceProgress("rs0");
    progress.onFetched(new BsonTimestamp(200, 3));

    progress.settle();

    assertThat(progress.syncedTimestamp()).isEqualTo(new BsonTimestamp(200, 3));
    assertThat(progress.toString()).contains("rs0").contains("200:3");
  }

  @Test
  void settleNeverMovesSyncedBackwards() {
    DefaultSourceProgress progress = new DefaultSourceProgress("rs0");
    progress.onFetched(new BsonTimestamp(100, 0));
    progress.onSynced(new BsonTimestamp(150, 0));

    progress.settle();

    assertThat(progress.syncedTimestamp()).isEqualTo(new BsonTimestamp(150, 0));
  }
}
