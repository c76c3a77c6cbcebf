package ddlsync.client;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of a {@link DdlSyncClient}.
 *
 * @param checkInterval delay between two runs of the elimination loop
 * @param unresponsiveThreshold how long a source may make no progress before a destructive DDL is
 *     forced through without it
 * @param eliminatorThreadName name format of the elimination loop thread
 */
public record DdlSyncOptions(
    Duration checkInterval, Duration unresponsiveThreshold, String eliminatorThreadName) {

  public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_UNRESPONSIVE_THRESHOLD = Duration.ofSeconds(60);
  public static final String DEFAULT_ELIMINATOR_THREAD_NAME = "ddlsync-eliminator-%d";

  public DdlSyncOptions {
    Objects.requireNonNull(checkInterval, "checkInterval");
    Objects.requireNonNull(unresponsiveThreshold, "unresponsiveThreshold");
    Objects.requireNonNull(eliminatorThreadName, "eliminatorThreadName");
    checkArgument(
        !checkInterval.isNegative() && !checkInterval.isZero(),
        "checkInterval must be positive: %s",
        checkInterval);
    checkArgument(
        !unresponsiveThreshold.isNegative() && !unresponsiveThreshold.isZero(),
        "unresponsiveThreshold must be positive: %s",
        unresponsiveThreshold);
  }

  public static DdlSyncOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
    private Duration unresponsiveThreshold = DEFAULT_UNRESPONSIVE_THRESHOLD;
    private String eliminatorThreadName = DEFAULT_ELIMINATOR_THREAD_NAME;

    private Builder() {}

    public Builder checkInterval(Duration checkInterval) {
      this.checkInterval = checkInterval;
      return this;
    }

    public Builder unresponsiveThreshold(Duration unresponsiveThreshold) {
      this.unresponsiveThreshold = unresponsiveThreshold;
      return this;
    }

    public Builder eliminatorThreadName(String eliminatorThreadName) {
      this.eliminatorThreadName = eliminatorThreadName;
      return this;
    }

    public DdlSyncOptions build() {
      return new DdlSyncOptions(checkInterval, unresponsiveThreshold, eliminatorThreadName);
    }
  }
}
