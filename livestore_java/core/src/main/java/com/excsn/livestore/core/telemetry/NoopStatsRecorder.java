package com.excsn.livestore.core.telemetry;

import java.time.Duration;
import java.util.Map;

/**
 * Used when no stats recorder is configured.
 */
public final class NoopStatsRecorder implements StatsRecorder {

  public static final NoopStatsRecorder INSTANCE = new NoopStatsRecorder();

  private NoopStatsRecorder() {}

  @Override
  public void recordCounterIncrement(Map<String, Object> tags, String name) {

  }

  @Override
  public void recordTimer(Map<String, Object> tags, String name, Duration value) {

  }

  @Override
  public void recordGauge(Map<String, Object> tags, String name, Number value) {

  }
}
