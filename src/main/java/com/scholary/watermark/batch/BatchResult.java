package com.scholary.watermark.batch;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a whole batch.
 *
 * <p>Outcomes are in completion order, not submission order.
 */
public record BatchResult(List<TaskOutcome> outcomes, BatchTelemetry.Snapshot telemetry) {

  public BatchResult {
    outcomes = List.copyOf(outcomes);
  }

  public static BatchResult empty() {
    return new BatchResult(List.of(), BatchTelemetry.Snapshot.EMPTY);
  }

  public List<Path> successPaths() {
    return outcomes.stream()
        .filter(TaskOutcome::success)
        .map(outcome -> outcome.task().destinationPath())
        .toList();
  }

  public List<TaskOutcome> failures() {
    return outcomes.stream().filter(outcome -> !outcome.success()).toList();
  }

  public int total() {
    return outcomes.size();
  }

  public int successCount() {
    return (int) outcomes.stream().filter(TaskOutcome::success).count();
  }

  public int failureCount() {
    return total() - successCount();
  }
}
