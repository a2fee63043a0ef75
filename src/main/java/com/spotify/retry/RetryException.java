package com.spotify.retry;

import java.util.List;

/**
 * Thrown when every permitted attempt failed, or the retry predicate stopped the loop. Carries the
 * recorded failures in attempt order; the last one is also the cause.
 */
public class RetryException extends Exception {

  private final List<Exception> errors;

  RetryException(ErrorLog errorLog) {
    super(errorLog.format(), errorLog.last());
    this.errors = errorLog.errors();
  }

  /** The recorded failures, oldest first. Never contains the unrecoverable wrapper. */
  public List<Exception> getErrors() {
    return errors;
  }
}
