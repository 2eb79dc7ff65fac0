package com.scholary.watermark.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class BatchTelemetryTest {

  @Test
  void snapshot_shouldKeepStagesInRecordingOrder() {
    BatchTelemetry telemetry = new BatchTelemetry();

    telemetry.recordStage(BatchTelemetry.STAGE_SETUP, Duration.ofMillis(3));
    telemetry.recordStage(BatchTelemetry.STAGE_DISPATCH, Duration.ofMillis(1));
    telemetry.recordStage(BatchTelemetry.STAGE_COLLECTION, Duration.ofMillis(40));

    BatchTelemetry.Snapshot snapshot = telemetry.snapshot();
    assertThat(snapshot.stages().keySet())
        .containsExactly(
            BatchTelemetry.STAGE_SETUP,
            BatchTelemetry.STAGE_DISPATCH,
            BatchTelemetry.STAGE_COLLECTION);
    assertThat(snapshot.stage(BatchTelemetry.STAGE_COLLECTION)).isEqualTo(Duration.ofMillis(40));
    assertThat(snapshot.stage("missing")).isEqualTo(Duration.ZERO);
  }

  @Test
  void record_shouldAccumulateCountAndTotalPerOperation() {
    BatchTelemetry telemetry = new BatchTelemetry();

    telemetry.record("resize", Duration.ofMillis(10));
    telemetry.record("resize", Duration.ofMillis(30));
    telemetry.record("encode", Duration.ofMillis(5));

    BatchTelemetry.OperationStats resize = telemetry.snapshot().operations().get("resize");
    assertThat(resize.count()).isEqualTo(2);
    assertThat(resize.total()).isEqualTo(Duration.ofMillis(40));
    assertThat(resize.average()).isEqualTo(Duration.ofMillis(20));
    assertThat(telemetry.snapshot().operations().keySet()).containsExactly("encode", "resize");
  }

  @Test
  void time_shouldCountFailedWork() {
    BatchTelemetry telemetry = new BatchTelemetry();

    assertThatThrownBy(
            () ->
                telemetry.time(
                    "decode",
                    () -> {
                      throw new IOException("truncated");
                    }))
        .isInstanceOf(IOException.class);

    assertThat(telemetry.snapshot().count("decode")).isEqualTo(1);
    assertThat(telemetry.snapshot().count("encode")).isZero();
  }
}
