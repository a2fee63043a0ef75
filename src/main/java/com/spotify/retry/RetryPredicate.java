package com.spotify.retry;

/** Decides whether a failed attempt may be followed by another one. */
@FunctionalInterface
public interface RetryPredicate {

  /**
   * @param error the failure as thrown by the operation, still carrying any terminal tag
   * @return {@code true} to keep retrying
   */
  boolean shouldRetry(Exception error);

  /** Retries every failure except those tagged with {@link Failures#unrecoverable(Exception)}. */
  static RetryPredicate recoverable() {
    return error -> Failures.kind(error) == FailureKind.TRANSIENT;
  }

  default RetryPredicate and(RetryPredicate other) {
    return error -> shouldRetry(error) && other.shouldRetry(error);
  }
}
