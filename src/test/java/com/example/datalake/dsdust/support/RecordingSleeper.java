package com.example.datalake.dsdust.support;

import com.example.datalake.dsdust.fetch.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Records requested pauses instead of sleeping. */
public class RecordingSleeper implements Sleeper {

  private final List<Duration> sleeps = new ArrayList<>();

  @Override
  public synchronized void sleep(Duration duration) {
    sleeps.add(duration);
  }

  public synchronized List<Duration> sleeps() {
    return List.copyOf(sleeps);
  }

  public synchronized List<Long> millis() {
    return sleeps.stream().map(Duration::toMillis).toList();
  }
}
