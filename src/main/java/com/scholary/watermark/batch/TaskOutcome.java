package com.scholary.watermark.batch;

import com.scholary.watermark.scan.Task;
import java.time.Duration;

/**
 * Result of one task. Failures are values, not exceptions: a failed task never escapes the worker
 * that ran it.
 */
public record TaskOutcome(
    Task task, boolean success, Duration duration, String failureCategory, String failureMessage) {

  public static final String CANCELLED = "Cancelled";

  public static TaskOutcome success(Task task, Duration duration) {
    return new TaskOutcome(task, true, duration, null, null);
  }

  public static TaskOutcome failure(Task task, Duration duration, Throwable cause) {
    return new TaskOutcome(
        task,
        false,
        duration,
        cause.getClass().getSimpleName(),
        String.valueOf(cause.getMessage()));
  }

  public static TaskOutcome cancelled(Task task) {
    return new TaskOutcome(
        task, false, Duration.ZERO, CANCELLED, "Batch interrupted before task ran");
  }
}
