package com.spotify.retry;

/** An operation that produces no value, only success or failure. */
@FunctionalInterface
public interface RetryableRunnable {

  void run() throws Exception;
}
