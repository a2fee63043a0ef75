package com.spotify.retry;

import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import javax.annotation.Nonnull;

/** Built-in {@link DelayStrategy} implementations. */
public final class DelayStrategies {

  // 1 << 63 overflows a signed long, so the shift stops at 62
  private static final int MAX_SHIFT = 62;
  private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);
  private static final Duration MIN_NANOS = Duration.ofNanos(Long.MIN_VALUE);

  private DelayStrategies() {}

  /** Doubles the configured base delay for every attempt: {@code delay * 2^attempt}. */
  public static DelayStrategy backOff() {
    return (attempt, config) -> {
      final long base = Math.max(1, saturatedNanos(config.delay()));
      final int maxShift = MAX_SHIFT - LongMath.log2(base, RoundingMode.FLOOR);
      final int shift = Math.min(Math.max(attempt, 0), maxShift);
      return Duration.ofNanos(LongMath.saturatedMultiply(base, 1L << shift));
    };
  }

  /** Always waits the configured base delay. */
  public static DelayStrategy fixed() {
    return (attempt, config) -> config.delay();
  }

  /** Waits {@code step * attempt}, so the first retry follows immediately. */
  public static DelayStrategy linear(@Nonnull Duration step) {
    final long stepNanos = saturatedNanos(step);
    return (attempt, config) -> Duration.ofNanos(LongMath.saturatedMultiply(stepNanos, attempt));
  }

  /** A uniformly random wait in {@code [0, maxJitter)}; zero when no jitter is configured. */
  public static DelayStrategy randomJitter() {
    return (attempt, config) -> {
      final long bound = saturatedNanos(config.maxJitter());
      if (bound <= 0) {
        return Duration.ZERO;
      }
      return Duration.ofNanos(ThreadLocalRandom.current().nextLong(bound));
    };
  }

  /** Sums the delays of the given strategies. */
  public static DelayStrategy combine(@Nonnull DelayStrategy... strategies) {
    final List<DelayStrategy> components = ImmutableList.copyOf(strategies);
    return (attempt, config) -> {
      long total = 0;
      for (DelayStrategy component : components) {
        total = LongMath.saturatedAdd(total, saturatedNanos(component.delay(attempt, config)));
      }
      return Duration.ofNanos(total);
    };
  }

  /** Converts to nanoseconds, capping at the range of a {@code long} instead of overflowing. */
  static long saturatedNanos(Duration duration) {
    if (duration.compareTo(MAX_NANOS) >= 0) {
      return Long.MAX_VALUE;
    }
    if (duration.compareTo(MIN_NANOS) <= 0) {
      return Long.MIN_VALUE;
    }
    return duration.toNanos();
  }

  /** Back-off plus random jitter. */
  public static DelayStrategy defaultStrategy() {
    return combine(backOff(), randomJitter());
  }
}
