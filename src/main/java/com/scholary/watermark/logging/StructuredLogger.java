package com.scholary.watermark.logging;

import com.scholary.watermark.batch.BatchTelemetry;
import com.scholary.watermark.scan.Task;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured batch events.
 *
 * <p>Each event is written twice: as a plain line to the durable batch log through a
 * {@link SinkHandle}, and to the application logger with MDC fields ({@code event_type},
 * {@code source}, ...) so the events can be queried by field.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log batch started event. */
  public void logBatchStarted(SinkHandle sink, int taskCount, int workers) {
    sink.info("Batch started: tasks={}, workers={}", taskCount, workers);
    try {
      MDC.put("event_type", "batch_started");
      MDC.put("taskCount", String.valueOf(taskCount));
      MDC.put("workers", String.valueOf(workers));

      logger.info("Batch started: tasks={}, workers={}", taskCount, workers);
    } finally {
      clearEventFields();
    }
  }

  /** Log skipped input file event. */
  public void logFileSkipped(SinkHandle sink, Path entry) {
    sink.info("Skipped unsupported entry: {}", entry);
    try {
      MDC.put("event_type", "file_skipped");
      MDC.put("source", String.valueOf(entry));

      logger.debug("Skipped unsupported entry: {}", entry);
    } finally {
      clearEventFields();
    }
  }

  /** Log task finished event. */
  public void logTaskFinished(SinkHandle sink, Task task, Duration duration) {
    sink.info(
        "Processed: {} -> {} ({}ms)",
        task.sourcePath(),
        task.destinationPath(),
        duration.toMillis());
    try {
      MDC.put("event_type", "task_finished");
      MDC.put("source", task.sourcePath().toString());
      MDC.put("destination", task.destinationPath().toString());
      MDC.put("durationMs", String.valueOf(duration.toMillis()));

      logger.debug(
          "Task finished: source={}, destination={}, duration={}ms",
          task.sourcePath(),
          task.destinationPath(),
          duration.toMillis());
    } finally {
      clearEventFields();
    }
  }

  /** Log task failure event. */
  public void logTaskFailed(SinkHandle sink, Task task, String errorType, String message) {
    sink.error(
        "Failed: {} -> {} [{}] {}", task.sourcePath(), task.destinationPath(), errorType, message);
    try {
      MDC.put("event_type", "task_failed");
      MDC.put("source", task.sourcePath().toString());
      MDC.put("destination", task.destinationPath().toString());
      MDC.put("errorType", errorType);

      logger.warn(
          "Task failed: source={}, destination={}, error={}, message={}",
          task.sourcePath(),
          task.destinationPath(),
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch completed event. */
  public void logBatchCompleted(
      SinkHandle sink, int total, int successes, int failures, Duration duration) {
    sink.info(
        "Batch completed: total={}, succeeded={}, failed={}, duration={}ms",
        total,
        successes,
        failures,
        duration.toMillis());
    try {
      MDC.put("event_type", "batch_completed");
      MDC.put("taskCount", String.valueOf(total));
      MDC.put("successes", String.valueOf(successes));
      MDC.put("failures", String.valueOf(failures));
      MDC.put("durationMs", String.valueOf(duration.toMillis()));

      logger.info(
          "Batch completed: total={}, succeeded={}, failed={}, duration={}ms",
          total,
          successes,
          failures,
          duration.toMillis());
    } finally {
      clearEventFields();
    }
  }

  /** Log stage timings and operation counters. */
  public void logTelemetry(SinkHandle sink, BatchTelemetry.Snapshot snapshot) {
    snapshot
        .stages()
        .forEach((stage, duration) -> sink.debug("Stage {}: {}ms", stage, duration.toMillis()));
    snapshot
        .operations()
        .values()
        .forEach(
            stats ->
                sink.debug(
                    "Operation {}: count={}, total={}ms, avg={}ms",
                    stats.name(),
                    stats.count(),
                    stats.total().toMillis(),
                    stats.average().toMillis()));
    try {
      MDC.put("event_type", "batch_telemetry");
      logger.info(
          "Batch telemetry: stages={}, operations={}",
          snapshot.stages(),
          snapshot.operations().values());
    } finally {
      clearEventFields();
    }
  }

  /** Set batch context in MDC. */
  public static void setBatchContext(String batchId, String variant) {
    MDC.put("batchId", batchId);
    MDC.put("variant", variant);
  }

  /** Clear batch context from MDC. */
  public static void clearBatchContext() {
    MDC.remove("batchId");
    MDC.remove("variant");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("taskCount");
    MDC.remove("workers");
    MDC.remove("source");
    MDC.remove("destination");
    MDC.remove("durationMs");
    MDC.remove("errorType");
    MDC.remove("successes");
    MDC.remove("failures");
  }
}
