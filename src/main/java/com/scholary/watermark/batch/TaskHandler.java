package com.scholary.watermark.batch;

import com.scholary.watermark.scan.Task;
import java.io.IOException;

/**
 * The per-task operation the executor runs.
 *
 * <p>Implementations may throw; the executor turns any failure into a {@link TaskOutcome}.
 */
@FunctionalInterface
public interface TaskHandler {

  /**
   * Process one task.
   *
   * @param task the task
   * @param telemetry batch telemetry for operation timings
   * @throws IOException if reading or writing an image fails
   */
  void process(Task task, BatchTelemetry telemetry) throws IOException;
}
