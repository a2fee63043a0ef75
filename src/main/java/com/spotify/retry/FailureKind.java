package com.spotify.retry;

/** How a failed attempt affects the rest of the retry loop. */
public enum FailureKind {
  /** The operation may succeed if invoked again. */
  TRANSIENT,
  /** The operation asked for the loop to stop, regardless of attempts remaining. */
  TERMINAL
}
