package ddlsync.core.internal.barrier;

import ddlsync.api.ddl.DdlKey;
import java.util.Optional;

/**
 * What one run of the {@link DdlEliminator} decided.
 *
 * @param outcome the decision
 * @param key the DDL the decision is about, {@code null} for {@link Outcome#IDLE}
 * @param reason short explanation, logged and asserted on in tests
 */
public record EliminationResult(Outcome outcome, DdlKey key, String reason) {

  public enum Outcome {
    /** Nothing was pending. */
    IDLE,
    /** The earliest DDL is the one released by a previous run. */
    ALREADY_RELEASED,
    /** The earliest DDL was released. */
    RELEASED,
    /** The earliest DDL is destructive and some source may still deliver data it would drop. */
    DEFERRED
  }

  static EliminationResult idle() {
    return new EliminationResult(Outcome.IDLE, null, "nothing pending");
  }

  static EliminationResult alreadyReleased(DdlKey key) {
    return new EliminationResult(Outcome.ALREADY_RELEASED, key, "released by a previous run");
  }

  static EliminationResult released(DdlKey key, String reason) {
    return new EliminationResult(Outcome.RELEASED, key, reason);
  }

  static EliminationResult deferred(DdlKey key, String reason) {
    return new EliminationResult(Outcome.DEFERRED, key, reason);
  }

  public Optional<DdlKey> getKey() {
    return Optional.ofNullable(key);
  }

  public boolean isReleased() {
    return outcome == Outcome.RELEASED;
  }
}
