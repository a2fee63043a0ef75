package com.spotify.retry;

import javax.annotation.Nonnull;

/** Helpers for tagging and classifying attempt failures. */
public final class Failures {

  private Failures() {}

  /** Wraps {@code error} so the retry loop stops after the current attempt. */
  public static UnrecoverableException unrecoverable(@Nonnull Exception error) {
    if (error instanceof UnrecoverableException) {
      return (UnrecoverableException) error;
    }
    return new UnrecoverableException(error);
  }

  public static FailureKind kind(Exception error) {
    return error instanceof UnrecoverableException ? FailureKind.TERMINAL : FailureKind.TRANSIENT;
  }

  /** Returns the error an operation actually failed with, stripping the terminal tag if present. */
  static Exception unwrap(Exception error) {
    if (error instanceof UnrecoverableException) {
      return ((UnrecoverableException) error).unwrap();
    }
    return error;
  }
}
