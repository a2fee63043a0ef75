package com.spotify.retry;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.event.Level;

public class LoggingRetryListenerTest {

  private static final String FORMAT = "Retrying number: {}, for {}, last err: {}";

  @Test
  public void testLogsAtInfoByDefault() {
    final Logger log = mock(Logger.class);
    final LoggingRetryListener listener =
        new LoggingRetryListener("GET http://localhost/health", Level.INFO, log);

    listener.onRetry(1, new IOException("connection reset"));

    verify(log).info(FORMAT, 1, "GET http://localhost/health", "connection reset");
    verifyNoMoreInteractions(log);
  }

  @Test
  public void testLogsAtConfiguredLevel() {
    final Logger log = mock(Logger.class);
    final LoggingRetryListener listener = new LoggingRetryListener("upload", Level.WARN, log);

    listener.onRetry(0, new IOException("503"));

    verify(log).warn(FORMAT, 0, "upload", "503");
    verifyNoMoreInteractions(log);
  }

  @Test
  public void testWorksAsRetryCallback() throws Exception {
    final Logger log = mock(Logger.class);
    final Retrier retrier = new Retrier(RetryConfig.defaults(), new FakeSleeper());

    retrier.call(
        new FlakyOperation<>(1, "ok"),
        RetryOptions.onRetry(new LoggingRetryListener("flaky", Level.DEBUG, log)));

    verify(log).debug(FORMAT, 0, "flaky", "failure 1");
  }
}
