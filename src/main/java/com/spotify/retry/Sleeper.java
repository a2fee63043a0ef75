package com.spotify.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Blocks the calling thread between attempts. */
interface Sleeper {

  Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(DelayStrategies.saturatedNanos(duration));

  void sleep(Duration duration) throws InterruptedException;
}
