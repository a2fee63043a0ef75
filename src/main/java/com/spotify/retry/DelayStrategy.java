package com.spotify.retry;

import java.time.Duration;

/**
 * Computes how long to wait after a failed attempt.
 *
 * @see DelayStrategies
 */
@FunctionalInterface
public interface DelayStrategy {

  /**
   * Returns the wait before the next attempt.
   *
   * @param attempt zero-based index of the attempt that just failed
   * @param config the configuration of the current call
   * @return the raw delay, before the {@link RetryConfig#maxDelay()} ceiling is applied
   */
  Duration delay(int attempt, RetryConfig config);
}
