package ddlsync.api.oplog;

import java.time.Instant;
import org.bson.BsonTimestamp;

/** Helpers for oplog {@link BsonTimestamp}s. */
public final class Timestamps {

  private Timestamps() {}

  /** @return {@code <seconds>:<increment>(<ISO instant>)}, or {@code "null"} */
  public static String format(BsonTimestamp ts) {
    if (ts == null) {
      return "null";
    }
    return ts.getTime() + ":" + ts.getInc() + "(" + Instant.ofEpochSecond(ts.getTime()) + ")";
  }

  /** @return the timestamp made of the given seconds and increment */
  public static BsonTimestamp of(int seconds, int increment) {
    return new BsonTimestamp(seconds, increment);
  }
}
