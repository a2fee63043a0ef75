package com.spotify.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class RetryConfigLoaderTest {

  @AfterEach
  public void clearSystemProperties() {
    System.clearProperty(RetryConfigLoader.ATTEMPTS);
    System.clearProperty(RetryConfigLoader.MAX_DELAY);
  }

  @Test
  public void testEmptyPropertiesGiveLibraryDefaults() {
    assertThat(RetryConfigLoader.load(new Properties())).isEqualTo(RetryConfig.defaults());
  }

  @Test
  public void testPlainNumbersAreSeconds() {
    final Properties properties = new Properties();
    properties.setProperty("retry.attempts", "3");
    properties.setProperty("retry.delay", "2");
    properties.setProperty("retry.max-jitter", "0.5");
    properties.setProperty("retry.max-delay", "30");
    properties.setProperty("retry.last-error-only", "true");

    final RetryConfig config = RetryConfigLoader.load(properties);

    assertThat(config.attempts()).isEqualTo(3);
    assertThat(config.delay()).isEqualTo(Duration.ofSeconds(2));
    assertThat(config.maxJitter()).isEqualTo(Duration.ofMillis(500));
    assertThat(config.maxDelay()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.lastErrorOnly()).isTrue();
  }

  @Test
  public void testIsoDurations() {
    final Properties properties = new Properties();
    properties.setProperty("retry.delay", "PT0.25S");

    assertThat(RetryConfigLoader.load(properties).delay()).isEqualTo(Duration.ofMillis(250));
  }

  @Test
  public void testInvalidValuesAreRejected() {
    final Properties badAttempts = new Properties();
    badAttempts.setProperty("retry.attempts", "many");
    final Properties badDelay = new Properties();
    badDelay.setProperty("retry.delay", "soon");

    assertThatThrownBy(() -> RetryConfigLoader.load(badAttempts))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("retry.attempts");
    assertThatThrownBy(() -> RetryConfigLoader.load(badDelay))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("retry.delay");
  }

  @Test
  public void testLoadsClasspathResource() {
    final Properties properties = RetryConfigLoader.loadResource("/retry-test.properties");

    final RetryConfig config = RetryConfigLoader.load(properties);

    assertThat(config.attempts()).isEqualTo(5);
    assertThat(config.delay()).isEqualTo(Duration.ofSeconds(1));
    assertThat(config.maxJitter()).isZero();
  }

  @Test
  public void testMissingResourceIsEmpty() {
    assertThat(RetryConfigLoader.loadResource("/does-not-exist.properties")).isEmpty();
  }

  @Test
  public void testSystemPropertiesOverrideDefaults() {
    System.setProperty(RetryConfigLoader.ATTEMPTS, "2");
    System.setProperty(RetryConfigLoader.MAX_DELAY, "PT1M");

    final RetryConfig config = RetryConfigLoader.loadDefaults();

    assertThat(config.attempts()).isEqualTo(2);
    assertThat(config.maxDelay()).isEqualTo(Duration.ofMinutes(1));
    assertThat(Retrier.create().defaults().attempts()).isEqualTo(2);
  }

  @Test
  public void testLastErrorOnlyAcceptsOnlyBooleans() {
    final Properties upperCase = new Properties();
    upperCase.setProperty("retry.last-error-only", " TRUE ");
    final Properties typo = new Properties();
    typo.setProperty("retry.last-error-only", "yes");

    assertThat(RetryConfigLoader.load(upperCase).lastErrorOnly()).isTrue();
    assertThatThrownBy(() -> RetryConfigLoader.load(typo))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("retry.last-error-only");
  }

  @Test
  public void testNonFiniteSecondsAreRejected() {
    for (String value : new String[] {"NaN", "Infinity", "-Infinity", "1e30"}) {
      final Properties properties = new Properties();
      properties.setProperty("retry.max-delay", value);

      assertThatThrownBy(() -> RetryConfigLoader.load(properties))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("retry.max-delay");
    }
  }
}
