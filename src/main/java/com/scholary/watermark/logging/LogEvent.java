package com.scholary.watermark.logging;

import java.time.Instant;
import java.util.Objects;
import org.slf4j.event.Level;

/**
 * A single batch log event.
 *
 * <p>The timestamp and originating thread are captured by the producer, so the delivery worker
 * writes them as they were at emit time rather than at write time.
 */
public record LogEvent(Instant timestamp, String originThread, Level level, String message) {

  public LogEvent {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(originThread, "originThread");
    Objects.requireNonNull(level, "level");
    message = message == null ? "" : message;
  }

  /** Create an event stamped with the current time and calling thread. */
  public static LogEvent now(Level level, String message) {
    return new LogEvent(Instant.now(), Thread.currentThread().getName(), level, message);
  }
}
