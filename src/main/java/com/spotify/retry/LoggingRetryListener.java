package com.spotify.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/** A {@link RetryListener} that logs every retry of a named operation. */
public class LoggingRetryListener implements RetryListener {
  private static final Logger logger = LoggerFactory.getLogger(LoggingRetryListener.class);

  private static final String FORMAT = "Retrying number: {}, for {}, last err: {}";

  private final String operationName;
  private final Level level;
  private final Logger log;

  public LoggingRetryListener(String operationName) {
    this(operationName, Level.INFO);
  }

  public LoggingRetryListener(String operationName, Level level) {
    this(operationName, level, logger);
  }

  LoggingRetryListener(String operationName, Level level, Logger log) {
    this.operationName = operationName;
    this.level = level;
    this.log = log;
  }

  @Override
  public void onRetry(int attempt, Exception error) {
    final String message = error.getMessage();
    switch (level) {
      case ERROR -> log.error(FORMAT, attempt, operationName, message);
      case WARN -> log.warn(FORMAT, attempt, operationName, message);
      case INFO -> log.info(FORMAT, attempt, operationName, message);
      case DEBUG -> log.debug(FORMAT, attempt, operationName, message);
      case TRACE -> log.trace(FORMAT, attempt, operationName, message);
    }
  }
}
