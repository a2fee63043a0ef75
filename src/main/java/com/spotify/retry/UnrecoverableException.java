package com.spotify.retry;

/**
 * Marks a failure as terminal. An operation throws this to stop the retry loop immediately; the
 * wrapped cause is what gets recorded and reported.
 */
public class UnrecoverableException extends Exception {

  public UnrecoverableException(Exception cause) {
    super(cause.getMessage(), cause);
  }

  /** The failure this exception marks as terminal. */
  public Exception unwrap() {
    return (Exception) getCause();
  }
}
