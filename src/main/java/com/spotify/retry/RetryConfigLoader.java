package com.spotify.retry;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the default {@link RetryConfig} of a process from properties.
 *
 * <p>Recognized keys are {@value #ATTEMPTS}, {@value #DELAY}, {@value #MAX_JITTER}, {@value
 * #MAX_DELAY} and {@value #LAST_ERROR_ONLY}. Durations are either ISO-8601 ({@code PT1.5S}) or a
 * plain number of seconds. Keys that are absent keep the library defaults.
 */
public final class RetryConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(RetryConfigLoader.class);

  static final String RESOURCE = "/retry.properties";
  static final String ATTEMPTS = "retry.attempts";
  static final String DELAY = "retry.delay";
  static final String MAX_JITTER = "retry.max-jitter";
  static final String MAX_DELAY = "retry.max-delay";
  static final String LAST_ERROR_ONLY = "retry.last-error-only";

  private RetryConfigLoader() {}

  /**
   * Loads {@value #RESOURCE} from the classpath, if present, then lets system properties override
   * it.
   */
  public static RetryConfig loadDefaults() {
    final Properties properties = new Properties();
    properties.putAll(loadResource(RESOURCE));
    for (String key : new String[] {ATTEMPTS, DELAY, MAX_JITTER, MAX_DELAY, LAST_ERROR_ONLY}) {
      final String value = System.getProperty(key);
      if (value != null) {
        properties.setProperty(key, value);
      }
    }
    return load(properties);
  }

  public static RetryConfig load(Properties properties) {
    final RetryConfig.Builder builder = RetryConfig.builder();
    final String attempts = properties.getProperty(ATTEMPTS);
    if (attempts != null) {
      try {
        builder.attempts(Integer.parseInt(attempts.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid " + ATTEMPTS + ": " + attempts, e);
      }
    }
    final String delay = properties.getProperty(DELAY);
    if (delay != null) {
      builder.delay(parseDuration(DELAY, delay));
    }
    final String maxJitter = properties.getProperty(MAX_JITTER);
    if (maxJitter != null) {
      builder.maxJitter(parseDuration(MAX_JITTER, maxJitter));
    }
    final String maxDelay = properties.getProperty(MAX_DELAY);
    if (maxDelay != null) {
      builder.maxDelay(parseDuration(MAX_DELAY, maxDelay));
    }
    final String lastErrorOnly = properties.getProperty(LAST_ERROR_ONLY);
    if (lastErrorOnly != null) {
      builder.lastErrorOnly(parseBoolean(LAST_ERROR_ONLY, lastErrorOnly));
    }
    final RetryConfig config = builder.build();
    log.debug("Loaded retry defaults {}", config);
    return config;
  }

  @VisibleForTesting
  static Properties loadResource(String resource) {
    final Properties properties = new Properties();
    try (InputStream in = RetryConfigLoader.class.getResourceAsStream(resource)) {
      if (in != null) {
        properties.load(in);
      }
    } catch (IOException e) {
      throw new RuntimeException("Can't read retry defaults from " + resource, e);
    }
    return properties;
  }

  static boolean parseBoolean(String key, String value) {
    final String trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("Invalid " + key + ": " + value);
  }

  static Duration parseDuration(String key, String value) {
    final String trimmed = value.trim();
    try {
      if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
        return Duration.parse(trimmed);
      }
      final double nanos = Double.parseDouble(trimmed) * 1_000_000_000d;
      if (!Double.isFinite(nanos) || Math.abs(nanos) >= Long.MAX_VALUE) {
        throw new IllegalArgumentException("Invalid " + key + ": " + value);
      }
      return Duration.ofNanos(Math.round(nanos));
    } catch (DateTimeParseException | NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
    }
  }
}
