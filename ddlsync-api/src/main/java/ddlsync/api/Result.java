package ddlsync.api;

/**
 * Outcome of a metadata command that ran through a retry pipeline: its value, or the error that
 * survived the retries.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

  /**
   * @param operation names the command in the error message, e.g. {@code "hello against rs0"}
   * @return the value of a success
   * @throws DdlSyncException the failure itself when it already is one, else the failure wrapped
   */
  T getOrThrow(String operation);

  default boolean isSuccess() {
    return this instanceof Result.Success<T>;
  }

  record Success<T>(T value) implements Result<T> {
    @Override
    public T getOrThrow(String operation) {
      return value;
    }
  }

  record Failure<T>(Throwable cause) implements Result<T> {
    @Override
    public T getOrThrow(String operation) {
      if (cause instanceof DdlSyncException e) {
        throw e;
      }
      throw new DdlSyncException(operation + " failed", cause);
    }
  }
}
