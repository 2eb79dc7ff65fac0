package com.scholary.watermark.batch;

import com.scholary.watermark.logging.AsyncLogSink;
import com.scholary.watermark.logging.SinkHandle;
import com.scholary.watermark.logging.StructuredLogger;
import com.scholary.watermark.scan.Task;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs one batch of tasks on a bounded worker pool.
 *
 * <p>A fresh pool is created per batch, sized to {@code min(maxParallelism, taskCount)}, and torn
 * down when the batch ends. Every worker thread gets its own {@link SinkHandle} when it starts.
 *
 * <p>Task failures are isolated: whatever a task throws is caught on the worker and turned into an
 * unsuccessful {@link TaskOutcome}. Only setup problems escape as {@link BatchSetupException}.
 */
public class BatchExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchExecutor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public static final String THREAD_PREFIX = "watermark-";
  public static final String OPERATION_TASK = "task";

  private static final ThreadLocal<SinkHandle> WORKER_SINK = new ThreadLocal<>();

  private final AsyncLogSink sink;
  private final int maxParallelism;
  private final Duration flushTimeout;

  /**
   * @param sink shared batch log channel
   * @param maxParallelism upper bound on workers; {@code 0} or less means available processors
   * @param flushTimeout how long to wait for the log channel to drain at the end of a batch
   */
  public BatchExecutor(AsyncLogSink sink, int maxParallelism, Duration flushTimeout) {
    this.sink = sink;
    this.maxParallelism =
        maxParallelism > 0 ? maxParallelism : Runtime.getRuntime().availableProcessors();
    this.flushTimeout = flushTimeout;
  }

  public int maxParallelism() {
    return maxParallelism;
  }

  /** Number of workers a batch of {@code taskCount} tasks will get. */
  public int degreeFor(int taskCount) {
    return Math.max(1, Math.min(maxParallelism, taskCount));
  }

  /**
   * The sink handle of the current worker thread, or a fresh handle when called outside a worker.
   */
  public SinkHandle currentSink() {
    SinkHandle handle = WORKER_SINK.get();
    return handle != null ? handle : sink.handle();
  }

  /**
   * Run all tasks and wait for them to finish.
   *
   * <p>If the calling thread is interrupted, tasks that have not started yet are reported as
   * cancelled; tasks already running are waited for and report their real outcome.
   *
   * @param tasks tasks to run, each exactly once
   * @param handler the per-task operation
   * @return one outcome per task, in completion order
   * @throws BatchSetupException if the worker pool cannot be created
   */
  public BatchResult run(List<Task> tasks, TaskHandler handler) {
    SinkHandle batchSink = sink.handle();
    if (tasks.isEmpty()) {
      batchSink.warn("No tasks to process; batch is empty");
      LOGGER.warn("Batch is empty, no workers started");
      flush();
      return BatchResult.empty();
    }

    BatchTelemetry telemetry = new BatchTelemetry();
    long batchStart = System.nanoTime();
    int degree = degreeFor(tasks.size());

    ThreadPoolTaskExecutor pool = null;
    BatchResult result = null;
    try {
      long setupStart = System.nanoTime();
      pool = createPool(degree);
      telemetry.recordStage(BatchTelemetry.STAGE_SETUP, since(setupStart));

      structuredLogger.logBatchStarted(batchSink, tasks.size(), degree);

      List<TaskOutcome> outcomes = new ArrayList<>(tasks.size());
      CompletionService<TaskOutcome> completion = new ExecutorCompletionService<>(pool);
      Map<Future<TaskOutcome>, Dispatch> pending = new LinkedHashMap<>();

      long dispatchStart = System.nanoTime();
      for (Task task : tasks) {
        Dispatch dispatch = new Dispatch(task);
        pending.put(
            completion.submit(
                () ->
                    dispatch.claim()
                        ? runIsolated(task, handler, telemetry)
                        : TaskOutcome.cancelled(task)),
            dispatch);
      }
      telemetry.recordStage(BatchTelemetry.STAGE_DISPATCH, since(dispatchStart));

      long collectionStart = System.nanoTime();
      collect(completion, pending, outcomes);
      telemetry.recordStage(BatchTelemetry.STAGE_COLLECTION, since(collectionStart));

      result = new BatchResult(outcomes, telemetry.snapshot());
      structuredLogger.logBatchCompleted(
          batchSink,
          result.total(),
          result.successCount(),
          result.failureCount(),
          since(batchStart));
      return result;
    } catch (BatchSetupException e) {
      batchSink.error("Batch setup failed: {}", e.getMessage());
      throw e;
    } finally {
      cleanup(pool, batchSink, result != null ? result.telemetry() : telemetry.snapshot());
    }
  }

  private void collect(
      CompletionService<TaskOutcome> completion,
      Map<Future<TaskOutcome>, Dispatch> pending,
      List<TaskOutcome> outcomes) {
    while (!pending.isEmpty()) {
      Future<TaskOutcome> future;
      try {
        future = completion.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelRemaining(pending, outcomes);
        return;
      }
      Task task = pending.remove(future).task();
      try {
        outcomes.add(future.get());
      } catch (InterruptedException e) {
        // the future is already done; keep its outcome
        Thread.currentThread().interrupt();
        outcomes.add(awaitOutcome(future, task));
        cancelRemaining(pending, outcomes);
        return;
      } catch (ExecutionException e) {
        // runIsolated catches everything it can; only a VirtualMachineError gets here
        outcomes.add(TaskOutcome.failure(task, Duration.ZERO, e.getCause()));
      } catch (CancellationException e) {
        outcomes.add(TaskOutcome.cancelled(task));
      }
    }
  }

  /** Cancel tasks no worker has picked up yet, then wait for the ones already running. */
  private void cancelRemaining(
      Map<Future<TaskOutcome>, Dispatch> pending, List<TaskOutcome> outcomes) {
    Map<Future<TaskOutcome>, Task> running = new LinkedHashMap<>();
    int cancelled = 0;
    for (Map.Entry<Future<TaskOutcome>, Dispatch> entry : pending.entrySet()) {
      Dispatch dispatch = entry.getValue();
      if (dispatch.claim()) {
        entry.getKey().cancel(false);
        outcomes.add(TaskOutcome.cancelled(dispatch.task()));
        cancelled++;
      } else {
        running.put(entry.getKey(), dispatch.task());
      }
    }
    pending.clear();
    LOGGER.warn(
        "Batch interrupted: cancelled {} pending tasks, waiting for {} running tasks",
        cancelled,
        running.size());
    running.forEach((future, task) -> outcomes.add(awaitOutcome(future, task)));
  }

  /** Wait for a started task regardless of interrupts; the interrupt status is restored. */
  private static TaskOutcome awaitOutcome(Future<TaskOutcome> future, Task task) {
    boolean interrupted = Thread.interrupted();
    try {
      while (true) {
        try {
          return future.get();
        } catch (InterruptedException e) {
          interrupted = true;
        } catch (ExecutionException e) {
          return TaskOutcome.failure(task, Duration.ZERO, e.getCause());
        } catch (CancellationException e) {
          return TaskOutcome.cancelled(task);
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private TaskOutcome runIsolated(Task task, TaskHandler handler, BatchTelemetry telemetry) {
    SinkHandle workerSink = currentSink();
    long start = System.nanoTime();
    try {
      handler.process(task, telemetry);
      Duration duration = since(start);
      telemetry.record(OPERATION_TASK, duration);
      structuredLogger.logTaskFinished(workerSink, task, duration);
      return TaskOutcome.success(task, duration);
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Exception | Error e) {
      Duration duration = since(start);
      telemetry.record(OPERATION_TASK, duration);
      TaskOutcome outcome = TaskOutcome.failure(task, duration, e);
      structuredLogger.logTaskFailed(
          workerSink, task, outcome.failureCategory(), outcome.failureMessage());
      return outcome;
    }
  }

  private ThreadPoolTaskExecutor createPool(int degree) {
    try {
      ThreadPoolTaskExecutor executor = newPoolExecutor();
      executor.setCorePoolSize(degree);
      executor.setMaxPoolSize(degree);
      executor.setThreadFactory(workerThreadFactory());
      executor.setTaskDecorator(mdcPropagating());
      executor.setWaitForTasksToCompleteOnShutdown(true);
      executor.initialize();
      return executor;
    } catch (RuntimeException e) {
      throw new BatchSetupException("Failed to start worker pool: " + e.getMessage(), e);
    }
  }

  /** The unconfigured executor a batch pool is built from. */
  protected ThreadPoolTaskExecutor newPoolExecutor() {
    return new ThreadPoolTaskExecutor();
  }

  /** Worker init: each thread acquires its own handle on the shared log channel. */
  private ThreadFactory workerThreadFactory() {
    CustomizableThreadFactory names = new CustomizableThreadFactory(THREAD_PREFIX);
    return runnable ->
        names.newThread(
            () -> {
              WORKER_SINK.set(sink.handle());
              try {
                runnable.run();
              } finally {
                WORKER_SINK.remove();
              }
            });
  }

  /** Carries the caller's MDC (batch id, variant) onto the worker. */
  private static TaskDecorator mdcPropagating() {
    return runnable -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
          MDC.setContextMap(context);
        }
        try {
          runnable.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }

  private void cleanup(
      ThreadPoolTaskExecutor pool, SinkHandle batchSink, BatchTelemetry.Snapshot snapshot) {
    if (pool != null) {
      try {
        pool.shutdown();
      } catch (RuntimeException e) {
        LOGGER.warn("Worker pool shutdown failed: {}", e.getMessage(), e);
      }
    }
    try {
      structuredLogger.logTelemetry(batchSink, snapshot);
    } catch (RuntimeException e) {
      LOGGER.warn("Could not log batch telemetry: {}", e.getMessage(), e);
    }
    flush();
  }

  /** Flush the batch log even when the caller has been interrupted. */
  private void flush() {
    boolean interrupted = Thread.interrupted();
    try {
      sink.flush(flushTimeout);
    } catch (RuntimeException e) {
      LOGGER.warn("Batch log flush failed: {}", e.getMessage(), e);
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private static Duration since(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  /** A submitted task; whoever claims it first, its worker or a cancelling caller, owns it. */
  private static final class Dispatch {

    private final Task task;
    private final AtomicBoolean claimed = new AtomicBoolean();

    Dispatch(Task task) {
      this.task = task;
    }

    Task task() {
      return task;
    }

    boolean claim() {
      return claimed.compareAndSet(false, true);
    }
  }
}
