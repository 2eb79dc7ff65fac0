package com.scholary.watermark.logging;

/**
 * Thrown when the batch log channel cannot be initialised.
 *
 * <p>No batch can run without a working log channel, so this is always fatal for the caller.
 */
public class LogSinkException extends RuntimeException {

  public LogSinkException(String message) {
    super(message);
  }

  public LogSinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
