package com.scholary.watermark.logging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import com.scholary.watermark.config.LogSinkProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

class AsyncLogSinkTest {

  @TempDir Path tempDir;

  private Path logFile;
  private String channel;
  private AsyncLogSink sink;

  @BeforeEach
  void setUp() {
    logFile = tempDir.resolve("logs").resolve("batch.log");
    channel = "test.sink." + UUID.randomUUID();
    sink =
        new AsyncLogSink(
            new LogSinkProperties(
                logFile.toString(), "%thread | %level | %msg%n", 1024, false, channel, "INFO"));
  }

  @AfterEach
  void tearDown() {
    sink.shutdown();
  }

  @Test
  void start_shouldAttachExactlyOneAppenderUnderConcurrentFirstUse() throws Exception {
    int threads = 8;
    CountDownLatch ready = new CountDownLatch(threads);
    CountDownLatch go = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<AsyncLogSink>> starts = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        starts.add(
            pool.submit(
                () -> {
                  ready.countDown();
                  go.await();
                  return sink.start();
                }));
      }
      ready.await(5, TimeUnit.SECONDS);
      go.countDown();
      for (Future<AsyncLogSink> start : starts) {
        assertThat(start.get(5, TimeUnit.SECONDS)).isSameAs(sink);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(sink.isRunning()).isTrue();
    assertThat(appenderCount()).isEqualTo(1);
  }

  @Test
  void shutdown_shouldDrainEveryQueuedEventInOrder() throws IOException {
    sink.start();
    for (int i = 0; i < 500; i++) {
      sink.info("event {}", i);
    }

    sink.shutdown();

    List<String> lines = Files.readAllLines(logFile);
    assertThat(lines).hasSize(500);
    assertThat(lines.get(0)).endsWith("| INFO | event 0");
    assertThat(lines.get(499)).endsWith("| INFO | event 499");
    assertThat(appenderCount()).isZero();
  }

  @Test
  void emit_shouldRecordOriginThreadAndRespectLevel() throws Exception {
    sink.start();
    Thread worker = new Thread(() -> sink.warn("from worker"), "worker-7");
    worker.start();
    worker.join();
    sink.debug("too detailed");

    sink.shutdown();

    assertThat(Files.readAllLines(logFile))
        .containsExactly("worker-7 | WARN | from worker");
  }

  @Test
  void flush_shouldReturnOnlyAfterEveryEmittedEventIsWritten() throws IOException {
    sink.start();
    for (int i = 0; i < 2000; i++) {
      sink.info("event {}", i);
    }

    assertThat(sink.flush(Duration.ofSeconds(10))).isTrue();

    List<String> lines = Files.readAllLines(logFile);
    assertThat(lines).hasSize(2000);
    assertThat(lines.get(1999)).endsWith("| INFO | event 1999");
    assertThat(sink.isRunning()).isTrue();
  }

  @Test
  void flush_shouldCoverEventsFromSeveralThreads() throws Exception {
    sink.start();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> producers = new ArrayList<>();
      for (int t = 0; t < 4; t++) {
        int producer = t;
        producers.add(
            pool.submit(
                () -> {
                  for (int i = 0; i < 250; i++) {
                    sink.info("producer {} event {}", producer, i);
                  }
                }));
      }
      for (Future<?> future : producers) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(sink.flush(Duration.ofSeconds(10))).isTrue();

    assertThat(Files.readAllLines(logFile)).hasSize(1000);
  }

  @Test
  void flush_shouldReturnImmediatelyWhenNotStarted() {
    assertThat(sink.flush(Duration.ofMillis(1))).isTrue();
  }

  @Test
  void emit_shouldFallBackAfterShutdown() {
    sink.start();
    sink.shutdown();

    sink.emit(LogEvent.now(Level.ERROR, "late event"));

    assertThat(sink.isRunning()).isFalse();
  }

  @Test
  void start_shouldFailAfterShutdown() {
    sink.start();
    sink.shutdown();

    assertThatThrownBy(() -> sink.start()).isInstanceOf(LogSinkException.class);
  }

  @Test
  void start_shouldFailWhenLogFileCannotBeOpened() throws IOException {
    Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");
    AsyncLogSink broken =
        new AsyncLogSink(
            new LogSinkProperties(
                blocker.resolve("batch.log").toString(),
                "%msg%n",
                16,
                false,
                channel + ".broken",
                "INFO"));

    assertThatThrownBy(broken::start).isInstanceOf(LogSinkException.class);
  }

  @Test
  void handle_shouldTrackSinkLifecycle() {
    SinkHandle handle = sink.handle();
    assertThat(handle.isAttached()).isFalse();

    sink.start();
    assertThat(handle.isAttached()).isTrue();

    sink.shutdown();
    assertThat(handle.isAttached()).isFalse();
  }

  @Test
  void handle_shouldWriteThroughToSink() throws IOException {
    sink.start();
    SinkHandle handle = sink.handle();

    handle.info("via handle {}", 42);
    sink.shutdown();

    assertThat(Files.readString(logFile)).contains("via handle 42");
  }

  private int appenderCount() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    Iterator<Appender<ILoggingEvent>> appenders =
        context.getLogger(channel).iteratorForAppenders();
    int count = 0;
    while (appenders.hasNext()) {
      appenders.next();
      count++;
    }
    return count;
  }
}
