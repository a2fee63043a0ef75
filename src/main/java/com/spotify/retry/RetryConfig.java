package com.spotify.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of a retry loop.
 *
 * <p>A {@link Retrier} holds one instance as its defaults and derives the configuration of each
 * call from it by applying that call's {@link RetryOption}s to a {@link #toBuilder() copy}. Values
 * are not validated: a non-positive {@link #attempts()} is accepted and means the operation is
 * never invoked.
 */
public final class RetryConfig {

  static final int DEFAULT_ATTEMPTS = 10;
  static final Duration DEFAULT_DELAY = Duration.ofMillis(100);
  static final Duration DEFAULT_MAX_JITTER = Duration.ofMillis(100);
  private static final DelayStrategy DEFAULT_DELAY_STRATEGY = DelayStrategies.defaultStrategy();
  private static final RetryPredicate DEFAULT_RETRY_PREDICATE = RetryPredicate.recoverable();

  private final int attempts;
  private final Duration delay;
  private final Duration maxJitter;
  private final Duration maxDelay;
  private final DelayStrategy delayStrategy;
  private final RetryPredicate retryPredicate;
  private final RetryListener retryListener;
  private final boolean lastErrorOnly;

  private RetryConfig(Builder builder) {
    this.attempts = builder.attempts;
    this.delay = builder.delay;
    this.maxJitter = builder.maxJitter;
    this.maxDelay = builder.maxDelay;
    this.delayStrategy = builder.delayStrategy;
    this.retryPredicate = builder.retryPredicate;
    this.retryListener = builder.retryListener;
    this.lastErrorOnly = builder.lastErrorOnly;
  }

  /**
   * The library defaults: 10 attempts, exponential back-off from 100ms plus up to 100ms of jitter,
   * no delay ceiling, retrying everything not marked unrecoverable.
   */
  public static RetryConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Total number of invocations allowed, including the first one. */
  public int attempts() {
    return attempts;
  }

  /** Base unit of the delay strategies. */
  public Duration delay() {
    return delay;
  }

  /** Upper bound (exclusive) of {@link DelayStrategies#randomJitter()}. */
  public Duration maxJitter() {
    return maxJitter;
  }

  /** Ceiling applied to every computed delay; zero means unbounded. */
  public Duration maxDelay() {
    return maxDelay;
  }

  public DelayStrategy delayStrategy() {
    return delayStrategy;
  }

  public RetryPredicate retryPredicate() {
    return retryPredicate;
  }

  public RetryListener retryListener() {
    return retryListener;
  }

  /** Whether a failed call reports only the most recent error instead of all of them. */
  public boolean lastErrorOnly() {
    return lastErrorOnly;
  }

  @Override
  public String toString() {
    return "RetryConfig{"
        + "attempts="
        + attempts
        + ", delay="
        + delay
        + ", maxJitter="
        + maxJitter
        + ", maxDelay="
        + maxDelay
        + ", lastErrorOnly="
        + lastErrorOnly
        + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final RetryConfig that = (RetryConfig) o;
    return attempts == that.attempts
        && lastErrorOnly == that.lastErrorOnly
        && delay.equals(that.delay)
        && maxJitter.equals(that.maxJitter)
        && maxDelay.equals(that.maxDelay)
        && delayStrategy.equals(that.delayStrategy)
        && retryPredicate.equals(that.retryPredicate)
        && retryListener.equals(that.retryListener);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        attempts,
        delay,
        maxJitter,
        maxDelay,
        delayStrategy,
        retryPredicate,
        retryListener,
        lastErrorOnly);
  }

  public static class Builder {
    private int attempts = DEFAULT_ATTEMPTS;
    private Duration delay = DEFAULT_DELAY;
    private Duration maxJitter = DEFAULT_MAX_JITTER;
    private Duration maxDelay = Duration.ZERO;
    private DelayStrategy delayStrategy = DEFAULT_DELAY_STRATEGY;
    private RetryPredicate retryPredicate = DEFAULT_RETRY_PREDICATE;
    private RetryListener retryListener = RetryListener.NOOP;
    private boolean lastErrorOnly = false;

    private Builder() {}

    private Builder(RetryConfig config) {
      this.attempts = config.attempts;
      this.delay = config.delay;
      this.maxJitter = config.maxJitter;
      this.maxDelay = config.maxDelay;
      this.delayStrategy = config.delayStrategy;
      this.retryPredicate = config.retryPredicate;
      this.retryListener = config.retryListener;
      this.lastErrorOnly = config.lastErrorOnly;
    }

    public Builder attempts(int attempts) {
      this.attempts = attempts;
      return this;
    }

    public Builder delay(Duration delay) {
      this.delay = Objects.requireNonNull(delay);
      return this;
    }

    public Builder maxJitter(Duration maxJitter) {
      this.maxJitter = Objects.requireNonNull(maxJitter);
      return this;
    }

    public Builder maxDelay(Duration maxDelay) {
      this.maxDelay = Objects.requireNonNull(maxDelay);
      return this;
    }

    public Builder delayStrategy(DelayStrategy delayStrategy) {
      this.delayStrategy = Objects.requireNonNull(delayStrategy);
      return this;
    }

    public Builder retryPredicate(RetryPredicate retryPredicate) {
      this.retryPredicate = Objects.requireNonNull(retryPredicate);
      return this;
    }

    public Builder retryListener(RetryListener retryListener) {
      this.retryListener = Objects.requireNonNull(retryListener);
      return this;
    }

    public Builder lastErrorOnly(boolean lastErrorOnly) {
      this.lastErrorOnly = lastErrorOnly;
      return this;
    }

    public RetryConfig build() {
      return new RetryConfig(this);
    }
  }
}
