package com.scholary.watermark.logging;

import java.lang.ref.WeakReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * A worker's reference to the shared {@link AsyncLogSink}.
 *
 * <p>Holds the sink weakly: a worker never keeps the channel alive. If the sink is gone, events go
 * to the application logger instead.
 */
public final class SinkHandle {

  private static final Logger LOGGER = LoggerFactory.getLogger(SinkHandle.class);

  private final WeakReference<AsyncLogSink> sink;

  SinkHandle(AsyncLogSink sink) {
    this.sink = new WeakReference<>(sink);
  }

  public boolean isAttached() {
    AsyncLogSink target = sink.get();
    return target != null && target.isRunning();
  }

  public void emit(LogEvent event) {
    AsyncLogSink target = sink.get();
    if (target != null) {
      target.emit(event);
    } else {
      LOGGER.info("[{}] {} {}", event.originThread(), event.level(), event.message());
    }
  }

  public void debug(String format, Object... args) {
    emit(LogEvent.now(Level.DEBUG, AsyncLogSink.format(format, args)));
  }

  public void info(String format, Object... args) {
    emit(LogEvent.now(Level.INFO, AsyncLogSink.format(format, args)));
  }

  public void warn(String format, Object... args) {
    emit(LogEvent.now(Level.WARN, AsyncLogSink.format(format, args)));
  }

  public void error(String format, Object... args) {
    emit(LogEvent.now(Level.ERROR, AsyncLogSink.format(format, args)));
  }
}
