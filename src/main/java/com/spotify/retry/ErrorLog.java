package com.spotify.retry;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Objects;

/**
 * Per-call record of attempt failures. Holds one slot per attempt, or a single slot that every
 * attempt overwrites when only the last error is kept.
 */
final class ErrorLog {

  private final Exception[] slots;
  private final boolean lastErrorOnly;

  private ErrorLog(int size, boolean lastErrorOnly) {
    this.slots = new Exception[size];
    this.lastErrorOnly = lastErrorOnly;
  }

  static ErrorLog create(RetryConfig config) {
    if (config.lastErrorOnly()) {
      return new ErrorLog(1, true);
    }
    return new ErrorLog(Math.max(config.attempts(), 0), false);
  }

  void record(int attempt, Exception error) {
    slots[lastErrorOnly ? 0 : attempt] = Failures.unwrap(error);
  }

  /** The most recently recorded failure, or {@code null} if no attempt failed. */
  Exception last() {
    for (int i = slots.length - 1; i >= 0; i--) {
      if (slots[i] != null) {
        return slots[i];
      }
    }
    return null;
  }

  ImmutableList<Exception> errors() {
    return Arrays.stream(slots).filter(Objects::nonNull).collect(ImmutableList.toImmutableList());
  }

  /**
   * Renders the log as a header followed by one {@code #<n>: <message>} line per filled slot,
   * numbered by slot.
   */
  String format() {
    final StringBuilder builder = new StringBuilder("All attempts fail:");
    for (int i = 0; i < slots.length; i++) {
      if (slots[i] != null) {
        builder.append('\n').append('#').append(i + 1).append(": ").append(slots[i].getMessage());
      }
    }
    return builder.toString();
  }
}
