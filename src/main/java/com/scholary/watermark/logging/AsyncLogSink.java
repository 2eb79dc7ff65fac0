package com.scholary.watermark.logging;

import ch.qos.logback.classic.AsyncAppender;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.AppenderBase;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import com.scholary.watermark.config.LogSinkProperties;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.helpers.MessageFormatter;

/**
 * Process-wide asynchronous log channel for batch events.
 *
 * <p>Producers (worker threads) only enqueue. A single Logback {@link AsyncAppender} worker
 * dequeues events and writes them, in arrival order, to an append-only file and optionally to the
 * console.
 *
 * <p>Lifecycle:
 *
 * <ul>
 *   <li>{@link #start()} is idempotent and safe under concurrent first use; the delivery chain is
 *       built exactly once.
 *   <li>{@link #shutdown()} drains every queued event before the worker stops.
 *   <li>Events emitted after shutdown fall back to the regular application logger.
 * </ul>
 */
public class AsyncLogSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(AsyncLogSink.class);
  private static final String FQCN = AsyncLogSink.class.getName();
  private final LogSinkProperties properties;
  private final Object lifecycleLock = new Object();

  // Read lock: emit. Write lock: shutdown. Keeps shutdown from racing an in-flight enqueue.
  private final ReadWriteLock emitLock = new ReentrantReadWriteLock();

  private volatile Delivery delivery;
  private volatile boolean shutdown;

  public AsyncLogSink(LogSinkProperties properties) {
    this.properties = properties;
  }

  /**
   * Build and start the delivery chain if it is not running yet.
   *
   * @return this sink
   * @throws LogSinkException if the chain cannot be started or the sink was already shut down
   */
  public AsyncLogSink start() {
    if (delivery != null) {
      return this;
    }
    synchronized (lifecycleLock) {
      if (shutdown) {
        throw new LogSinkException("Log sink has already been shut down");
      }
      if (delivery == null) {
        delivery = createDelivery();
        LOGGER.info(
            "Batch log channel started: channel={}, file={}, queueSize={}",
            properties.channel(),
            properties.file(),
            properties.queueSize());
      }
    }
    return this;
  }

  public boolean isRunning() {
    return delivery != null && !shutdown;
  }

  /** Obtain a weak handle to this sink for a worker thread. */
  public SinkHandle handle() {
    return new SinkHandle(this);
  }

  /**
   * Hand an event over to the delivery worker.
   *
   * <p>Only enqueues. The queue is bounded by configuration and never discards by level.
   */
  public void emit(LogEvent event) {
    emitLock.readLock().lock();
    try {
      Delivery current = delivery;
      if (current == null || shutdown) {
        fallback(event);
        return;
      }
      ch.qos.logback.classic.Level level = toLogbackLevel(event.level());
      if (!current.logger.isEnabledFor(level)) {
        return;
      }
      LoggingEvent loggingEvent =
          new LoggingEvent(FQCN, current.logger, level, event.message(), null, null);
      loggingEvent.setTimeStamp(event.timestamp().toEpochMilli());
      loggingEvent.setThreadName(event.originThread());
      current.tracker.enqueued();
      current.logger.callAppenders(loggingEvent);
    } finally {
      emitLock.readLock().unlock();
    }
  }

  public void debug(String format, Object... args) {
    emit(LogEvent.now(Level.DEBUG, format(format, args)));
  }

  public void info(String format, Object... args) {
    emit(LogEvent.now(Level.INFO, format(format, args)));
  }

  public void warn(String format, Object... args) {
    emit(LogEvent.now(Level.WARN, format(format, args)));
  }

  public void error(String format, Object... args) {
    emit(LogEvent.now(Level.ERROR, format(format, args)));
  }

  /**
   * Wait until every event emitted before this call has been written by the delivery worker.
   *
   * <p>An empty queue is not enough: the worker drains events in bulk before writing them.
   *
   * @param timeout maximum time to wait
   * @return true if all those events were written before the timeout
   */
  public boolean flush(Duration timeout) {
    Delivery current = delivery;
    if (current == null) {
      return true;
    }
    long target = current.tracker.enqueuedCount();
    try {
      if (current.tracker.awaitDelivered(target, timeout)) {
        return true;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
    LOGGER.warn(
        "Batch log flush timed out after {}ms with {} events pending",
        timeout.toMillis(),
        target - current.tracker.deliveredCount());
    return false;
  }

  /**
   * Stop the delivery worker after draining everything already enqueued.
   *
   * <p>Safe to call more than once. Spring calls it on context close.
   */
  public void shutdown() {
    synchronized (lifecycleLock) {
      if (shutdown) {
        return;
      }
      emitLock.writeLock().lock();
      try {
        shutdown = true;
      } finally {
        emitLock.writeLock().unlock();
      }

      Delivery current = delivery;
      if (current == null) {
        return;
      }
      // maxFlushTime is 0, so stop() joins the worker until the queue is empty
      current.appender.stop();
      current.logger.detachAppender(current.appender);
      LOGGER.info("Batch log channel stopped: channel={}", properties.channel());
    }
  }

  private Delivery createDelivery() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      throw new LogSinkException(
          "Batch log channel requires Logback, found " + factory.getClass().getName());
    }

    try {
      FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
      fileAppender.setContext(context);
      fileAppender.setName(properties.channel() + "-file");
      fileAppender.setFile(properties.file());
      fileAppender.setAppend(true);
      fileAppender.setEncoder(encoder(context));
      fileAppender.start();
      if (!fileAppender.isStarted()) {
        throw new LogSinkException("Could not open batch log file: " + properties.file());
      }

      AsyncAppender asyncAppender = new AsyncAppender();
      asyncAppender.setContext(context);
      asyncAppender.setName(properties.channel() + "-async");
      asyncAppender.setQueueSize(properties.queueSize());
      asyncAppender.setDiscardingThreshold(0);
      asyncAppender.setMaxFlushTime(0);
      asyncAppender.setNeverBlock(false);
      asyncAppender.setIncludeCallerData(false);
      asyncAppender.addAppender(fileAppender);

      if (properties.console()) {
        ConsoleAppender<ILoggingEvent> consoleAppender = new ConsoleAppender<>();
        consoleAppender.setContext(context);
        consoleAppender.setName(properties.channel() + "-console");
        consoleAppender.setEncoder(encoder(context));
        consoleAppender.start();
        asyncAppender.addAppender(consoleAppender);
      }

      // attached last: sees an event only after the appenders above have written it
      DeliveryTracker tracker = new DeliveryTracker();
      tracker.setContext(context);
      tracker.setName(properties.channel() + "-delivered");
      tracker.start();
      asyncAppender.addAppender(tracker);

      asyncAppender.start();

      ch.qos.logback.classic.Logger channelLogger = context.getLogger(properties.channel());
      channelLogger.setAdditive(false);
      channelLogger.setLevel(ch.qos.logback.classic.Level.toLevel(properties.level()));
      channelLogger.addAppender(asyncAppender);

      return new Delivery(channelLogger, asyncAppender, tracker);
    } catch (LogSinkException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new LogSinkException("Failed to start batch log channel: " + e.getMessage(), e);
    }
  }

  private PatternLayoutEncoder encoder(LoggerContext context) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(properties.pattern());
    encoder.start();
    return encoder;
  }

  private static void fallback(LogEvent event) {
    switch (event.level()) {
      case ERROR -> LOGGER.error("[{}] {}", event.originThread(), event.message());
      case WARN -> LOGGER.warn("[{}] {}", event.originThread(), event.message());
      case INFO -> LOGGER.info("[{}] {}", event.originThread(), event.message());
      default -> LOGGER.debug("[{}] {}", event.originThread(), event.message());
    }
  }

  static String format(String format, Object... args) {
    return MessageFormatter.arrayFormat(format, args).getMessage();
  }

  private static ch.qos.logback.classic.Level toLogbackLevel(Level level) {
    return switch (level) {
      case ERROR -> ch.qos.logback.classic.Level.ERROR;
      case WARN -> ch.qos.logback.classic.Level.WARN;
      case INFO -> ch.qos.logback.classic.Level.INFO;
      case DEBUG -> ch.qos.logback.classic.Level.DEBUG;
      case TRACE -> ch.qos.logback.classic.Level.TRACE;
    };
  }

  private record Delivery(
      ch.qos.logback.classic.Logger logger, AsyncAppender appender, DeliveryTracker tracker) {}

  /** Counts events handed to the async appender against events it has finished delivering. */
  private static final class DeliveryTracker extends AppenderBase<ILoggingEvent> {

    private final AtomicLong enqueued = new AtomicLong();
    private long delivered; // guarded by this

    void enqueued() {
      enqueued.incrementAndGet();
    }

    long enqueuedCount() {
      return enqueued.get();
    }

    synchronized long deliveredCount() {
      return delivered;
    }

    // doAppend holds this monitor
    @Override
    protected void append(ILoggingEvent event) {
      delivered++;
      notifyAll();
    }

    synchronized boolean awaitDelivered(long target, Duration timeout)
        throws InterruptedException {
      long remaining = timeout.toNanos();
      long deadline = System.nanoTime() + remaining;
      while (delivered < target) {
        if (remaining <= 0) {
          return false;
        }
        TimeUnit.NANOSECONDS.timedWait(this, remaining);
        remaining = deadline - System.nanoTime();
      }
      return true;
    }
  }
}
