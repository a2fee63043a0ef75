package com.spotify.retry;

/**
 * A per-call change to the configuration a {@link Retrier} starts from. Options are applied in
 * the order given, so a later option overrides an earlier one touching the same setting.
 *
 * @see RetryOptions
 */
@FunctionalInterface
public interface RetryOption {

  void apply(RetryConfig.Builder builder);
}
