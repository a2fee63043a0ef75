package com.spotify.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class FakeSleeper implements Sleeper {
  public final List<Duration> sleeps = new ArrayList<>();

  @Override
  public void sleep(Duration duration) {
    sleeps.add(duration);
  }
}
