package ddlsync.storage.mongo.command;

import com.mongodb.MongoConfigurationException;
import com.mongodb.MongoConnectionPoolClearedException;
import com.mongodb.MongoException;
import com.mongodb.MongoIncompatibleDriverException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoClient;
import ddlsync.api.DdlSyncException;
import ddlsync.api.MetadataTimeoutException;
import ddlsync.api.Result;
import ddlsync.api.metadata.command.Command;
import ddlsync.api.metadata.command.CommandHandler;
import ddlsync.api.metadata.command.CommandHandlerContext;
import dev.failsafe.CircuitBreaker;
import dev.failsafe.CircuitBreakerOpenException;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.Policy;
import dev.failsafe.RetryPolicy;
import dev.failsafe.Timeout;
import dev.failsafe.TimeoutExceededException;
import dev.failsafe.function.CheckedSupplier;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Base class of the MongoDB metadata command handlers.
 *
 * <p>Handlers run their driver calls through {@link #newExecution(MongoCommandHandlerContext)},
 * which retries transient server errors and trips the cluster's circuit breaker on errors that no
 * retry can fix.
 */
public abstract class MongoCommandHandler<C extends Command<R>, R> implements CommandHandler<C, R> {

  /** Errors that no retry can fix; they count against the circuit breaker. */
  static final List<Class<? extends Throwable>> NON_RETRYABLE =
      List.of(
          MongoConfigurationException.class,
          MongoSecurityException.class,
          MongoIncompatibleDriverException.class);

  /** Builds the breaker a store shares among all commands against one cluster. */
  public static CircuitBreaker<Object> newCircuitBreaker() {
    return CircuitBreaker.builder()
        .handle(NON_RETRYABLE)
        .handle(List.of(MongoSocketException.class, MongoConnectionPoolClearedException.class))
        .withFailureThreshold(3)
        .withDelay(Duration.ofSeconds(10))
        .build();
  }

  /** Upper bound of one metadata read, retries included. */
  static final Duration METADATA_TIMEOUT = Duration.ofSeconds(30);

  @Override
  public R execute(C command, CommandHandlerContext context) {
    return this.execute(command, (MongoCommandHandlerContext) context);
  }

  protected abstract R execute(C command, MongoCommandHandlerContext context);

  public ExecutionBuilder<R> newExecution(MongoCommandHandlerContext context) {
    return new ExecutionBuilder<>(context.getClient(), context.getCircuitBreaker());
  }

  public static class ExecutionBuilder<R> {
    private final MongoClient client;
    private final List<Policy<Object>> policies = new ArrayList<>(4);

    private ExecutionBuilder(MongoClient client, CircuitBreaker<Object> circuitBreaker) {
      this.client = client;
      this.policies.add(
          RetryPolicy.builder()
              .handleIf(
                  throwable ->
                      throwable instanceof MongoException dbError
                          && (dbError.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)
                              || dbError instanceof MongoTimeoutException
                              || MongoErrorCode.isRetryable(dbError)))
              .withDelay(Duration.ofMillis(100))
              .withMaxRetries(3)
              .build());
      this.policies.add(circuitBreaker);
    }

    public ExecutionBuilder<R> withTimeout(Duration timeout) {
      this.policies.add(Timeout.of(timeout));
      return this;
    }

    public Result<R> execute(Function<MongoClient, R> command) {
      CheckedSupplier<R> block = () -> command.apply(client);
      try {
        return new Result.Success<>(Failsafe.with(policies).get(block));
      } catch (TimeoutExceededException timeout) {
        return new Result.Failure<>(new MetadataTimeoutException(timeout));
      } catch (CircuitBreakerOpenException circuitBreak) {
        return new Result.Failure<>(
            new DdlSyncException("Metadata circuit breaker is open", circuitBreak));
      } catch (FailsafeException e) {
        return new Result.Failure<>(e.getCause() != null ? e.getCause() : e);
      } catch (Throwable e) {
        return new Result.Failure<>(e);
      }
    }
  }
}
