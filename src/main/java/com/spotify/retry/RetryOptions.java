package com.spotify.retry;

import java.time.Duration;

/** Factory methods for the {@link RetryOption}s a call can override. */
public final class RetryOptions {

  private RetryOptions() {}

  public static RetryOption attempts(int attempts) {
    return builder -> builder.attempts(attempts);
  }

  public static RetryOption delay(Duration delay) {
    return builder -> builder.delay(delay);
  }

  public static RetryOption maxJitter(Duration maxJitter) {
    return builder -> builder.maxJitter(maxJitter);
  }

  public static RetryOption maxDelay(Duration maxDelay) {
    return builder -> builder.maxDelay(maxDelay);
  }

  public static RetryOption delayStrategy(DelayStrategy delayStrategy) {
    return builder -> builder.delayStrategy(delayStrategy);
  }

  public static RetryOption retryIf(RetryPredicate retryPredicate) {
    return builder -> builder.retryPredicate(retryPredicate);
  }

  public static RetryOption onRetry(RetryListener retryListener) {
    return builder -> builder.retryListener(retryListener);
  }

  public static RetryOption lastErrorOnly(boolean lastErrorOnly) {
    return builder -> builder.lastErrorOnly(lastErrorOnly);
  }
}
