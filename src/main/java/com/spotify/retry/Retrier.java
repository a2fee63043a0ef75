package com.spotify.retry;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Invokes an operation until it succeeds, runs out of attempts, or fails with an error the {@link
 * RetryPredicate} refuses to retry.
 *
 * <p>A retrier holds the default {@link RetryConfig} of its callers; each call may override any
 * setting through {@link RetryOption}s. Calls share no state, so one instance can serve any number
 * of threads. A call blocks its thread while waiting between attempts. An interrupt, whether it
 * hits the wait or the operation itself, ends the call with {@link InterruptedException} and leaves
 * the thread's interrupt flag set.
 *
 * <p>When a call fails, the error thrown is either a {@link RetryException} listing every recorded
 * failure, or, with {@link RetryConfig#lastErrorOnly()}, the last failure itself. Failures tagged
 * with {@link Failures#unrecoverable(Exception)} are reported without the tag.
 */
public class Retrier {
  private static final Logger log = LoggerFactory.getLogger(Retrier.class);

  private final RetryConfig defaults;
  private final Sleeper sleeper;

  @VisibleForTesting
  Retrier(RetryConfig defaults, Sleeper sleeper) {
    this.defaults = defaults;
    this.sleeper = sleeper;
  }

  /** A retrier using {@link RetryConfigLoader#loadDefaults()} as its defaults. */
  public static Retrier create() {
    return create(RetryConfigLoader.loadDefaults());
  }

  public static Retrier create(@Nonnull RetryConfig defaults) {
    return new Retrier(defaults, Sleeper.SYSTEM);
  }

  public RetryConfig defaults() {
    return defaults;
  }

  /** Calls {@code operation} until it returns a value. */
  public <T> T call(@Nonnull Callable<T> operation, RetryOption... options) throws Exception {
    return execute(operation, configure(options));
  }

  /** Runs {@code operation} until it completes without throwing. */
  public void run(@Nonnull RetryableRunnable operation, RetryOption... options) throws Exception {
    Objects.requireNonNull(operation, "operation");
    execute(
        () -> {
          operation.run();
          return null;
        },
        configure(options));
  }

  /** Calls {@code operation} until it returns a response, whatever its status. */
  public <T> StatusResponse<T> callWithStatus(
      @Nonnull Callable<StatusResponse<T>> operation, RetryOption... options) throws Exception {
    return execute(operation, configure(options));
  }

  @VisibleForTesting
  RetryConfig configure(RetryOption... options) {
    final RetryConfig.Builder builder = defaults.toBuilder();
    for (RetryOption option : options) {
      option.apply(builder);
    }
    return builder.build();
  }

  private <T> T execute(Callable<T> operation, RetryConfig config) throws Exception {
    Objects.requireNonNull(operation, "operation");
    final ErrorLog errorLog = ErrorLog.create(config);
    int attempt = 0;
    while (attempt < config.attempts()) {
      try {
        return operation.call();
      } catch (InterruptedException e) {
        errorLog.record(attempt, e);
        log.debug("Attempt {} of {} interrupted", attempt + 1, config.attempts());
        Thread.currentThread().interrupt();
        throw e;
      } catch (Exception e) {
        errorLog.record(attempt, e);
        log.debug("Attempt {} of {} failed: {}", attempt + 1, config.attempts(), e.getMessage());

        if (!config.retryPredicate().shouldRetry(e)) {
          log.debug("Not retrying after attempt {}: {}", attempt + 1, Failures.kind(e));
          break;
        }

        config.retryListener().onRetry(attempt, e);

        if (attempt == config.attempts() - 1) {
          break;
        }

        try {
          sleeper.sleep(delay(config, attempt));
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw ie;
        }
      }
      attempt++;
    }

    log.debug("Giving up after {} attempt(s)", config.attempts() > 0 ? attempt + 1 : 0);
    throw failure(config, errorLog);
  }

  @VisibleForTesting
  static Duration delay(RetryConfig config, int attempt) {
    final Duration delay = config.delayStrategy().delay(attempt, config);
    final Duration maxDelay = config.maxDelay();
    if (!maxDelay.isNegative() && !maxDelay.isZero() && delay.compareTo(maxDelay) > 0) {
      return maxDelay;
    }
    return delay;
  }

  private static Exception failure(RetryConfig config, ErrorLog errorLog) {
    if (config.lastErrorOnly()) {
      final Exception last = errorLog.last();
      if (last != null) {
        return last;
      }
    }
    return new RetryException(errorLog);
  }
}
