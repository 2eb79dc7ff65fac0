package com.scholary.watermark.batch;

/**
 * Thrown when a batch cannot be set up: unreadable input, an output directory that cannot be
 * created, or a worker pool that fails to start.
 *
 * <p>Raised before any task runs. Individual task failures never surface as this exception.
 */
public class BatchSetupException extends RuntimeException {

  public BatchSetupException(String message) {
    super(message);
  }

  public BatchSetupException(String message, Throwable cause) {
    super(message, cause);
  }
}
