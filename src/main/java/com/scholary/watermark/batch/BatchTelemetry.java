package com.scholary.watermark.batch;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Timing and counters for one batch, kept in a batch-local meter registry.
 *
 * <p>Stage durations ({@code setup}, {@code dispatch}, {@code collection}) are recorded by the
 * executor. Operation timers ({@code decode}, {@code resize}, {@code composite}, ...) are recorded
 * concurrently by workers.
 */
public class BatchTelemetry {

  public static final String STAGE_SETUP = "setup";
  public static final String STAGE_DISPATCH = "dispatch";
  public static final String STAGE_COLLECTION = "collection";

  static final String STAGE_METER = "watermark.batch.stage";
  static final String OPERATION_METER = "watermark.batch.operation";

  private final MeterRegistry registry = new SimpleMeterRegistry();
  private final Set<String> stageOrder = Collections.synchronizedSet(new LinkedHashSet<>());

  /** Work that can be timed. */
  @FunctionalInterface
  public interface TimedWork<T> {
    T call() throws IOException;
  }

  public void recordStage(String stage, Duration duration) {
    stageOrder.add(stage);
    registry.timer(STAGE_METER, "stage", stage).record(duration);
  }

  public void record(String operation, Duration duration) {
    operationTimer(operation).record(duration);
  }

  /** Run {@code work} and add its duration to {@code operation}, even if it fails. */
  public <T> T time(String operation, TimedWork<T> work) throws IOException {
    Timer.Sample sample = Timer.start(registry);
    try {
      return work.call();
    } finally {
      sample.stop(operationTimer(operation));
    }
  }

  public Snapshot snapshot() {
    Map<String, Duration> stages = new LinkedHashMap<>();
    synchronized (stageOrder) {
      for (String stage : stageOrder) {
        stages.put(stage, total(registry.timer(STAGE_METER, "stage", stage)));
      }
    }
    Map<String, OperationStats> operations = new TreeMap<>();
    for (Timer timer : registry.find(OPERATION_METER).timers()) {
      String name = timer.getId().getTag("operation");
      operations.put(name, new OperationStats(name, timer.count(), total(timer)));
    }
    return new Snapshot(stages, operations);
  }

  private Timer operationTimer(String operation) {
    return registry.timer(OPERATION_METER, "operation", operation);
  }

  private static Duration total(Timer timer) {
    return Duration.ofNanos((long) timer.totalTime(TimeUnit.NANOSECONDS));
  }

  /** Count and cumulative time of one operation. */
  public record OperationStats(String name, long count, Duration total) {

    public Duration average() {
      return count == 0 ? Duration.ZERO : total.dividedBy(count);
    }
  }

  /** Immutable view of the telemetry at one point in time. */
  public record Snapshot(Map<String, Duration> stages, Map<String, OperationStats> operations) {

    public static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());

    public Snapshot {
      stages = Collections.unmodifiableMap(new LinkedHashMap<>(stages));
      operations = Collections.unmodifiableMap(new TreeMap<>(operations));
    }

    public Duration stage(String name) {
      return stages.getOrDefault(name, Duration.ZERO);
    }

    public long count(String operation) {
      OperationStats stats = operations.get(operation);
      return stats == null ? 0 : stats.count();
    }
  }
}
