package ca.gc.cra.recstream.application.pipeline;

import ca.gc.cra.recstream.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, Long> counters = new HashMap<>();
  private final Map<String, List<Long>> observations = new HashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1L, Long::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
  }

  long counter(String key) {
    return counters.getOrDefault(key, 0L);
  }

  List<Long> observations(String key) {
    return observations.getOrDefault(key, List.of());
  }
}
