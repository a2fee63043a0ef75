package com.spotify.retry;

/** Observes failed attempts that the retry predicate accepted. */
@FunctionalInterface
public interface RetryListener {

  RetryListener NOOP = (attempt, error) -> {};

  /**
   * @param attempt zero-based index of the attempt that failed
   * @param error the failure as thrown by the operation
   */
  void onRetry(int attempt, Exception error);
}
