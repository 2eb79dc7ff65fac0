package com.scholary.watermark.api;

import static org.hamcrest.Matchers.contains;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.watermark.batch.BatchResult;
import com.scholary.watermark.batch.BatchSetupException;
import com.scholary.watermark.batch.BatchTelemetry;
import com.scholary.watermark.batch.TaskOutcome;
import com.scholary.watermark.parameter.ParameterValidationException;
import com.scholary.watermark.processor.WatermarkVariant;
import com.scholary.watermark.scan.Task;
import com.scholary.watermark.service.VariantDescriptor;
import com.scholary.watermark.service.WatermarkService;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(WatermarkController.class)
class WatermarkControllerTest {

  private static final String BODY =
      """
      {"inputDir": "/data/in", "outputDir": "/data/out", "overrides": {"opacity": 40}}
      """;

  @Autowired private MockMvc mockMvc;

  @MockBean private WatermarkService watermarkService;

  @Test
  void runBatch_shouldReturnCountsAndOutputs() throws Exception {
    Task ok = new Task(Path.of("/data/in/a.png"), Path.of("/data/out/a.png"));
    Task bad = new Task(Path.of("/data/in/b.png"), Path.of("/data/out/b.png"));
    BatchResult result =
        new BatchResult(
            List.of(
                TaskOutcome.success(ok, Duration.ofMillis(5)),
                TaskOutcome.failure(bad, Duration.ofMillis(1), new IOException("corrupt"))),
            BatchTelemetry.Snapshot.EMPTY);
    when(watermarkService.runBatch(eq(WatermarkVariant.FOGGY), any(), any(), anyMap()))
        .thenReturn(result);

    mockMvc
        .perform(
            post("/api/watermark/foggy/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.variant").value("foggy"))
        .andExpect(jsonPath("$.successCount").value(1))
        .andExpect(jsonPath("$.failureCount").value(1))
        .andExpect(jsonPath("$.outputs", contains(Path.of("/data/out/a.png").toString())));

    verify(watermarkService)
        .runBatch(
            WatermarkVariant.FOGGY,
            Path.of("/data/in"),
            Path.of("/data/out"),
            Map.of("opacity", 40));
  }

  @Test
  void runBatch_shouldMapValidationErrorsToBadRequest() throws Exception {
    when(watermarkService.runBatch(any(), any(), any(), anyMap()))
        .thenThrow(ParameterValidationException.outOfRange("opacity", 150, 0, 100));

    mockMvc
        .perform(
            post("/api/watermark/normal/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.parameter").value("opacity"))
        .andExpect(jsonPath("$.reason").value("OUT_OF_RANGE"));
  }

  @Test
  void runBatch_shouldMapSetupErrorsToUnprocessableEntity() throws Exception {
    when(watermarkService.runBatch(any(), any(), any(), anyMap()))
        .thenThrow(new BatchSetupException("Input directory does not exist: /data/in"));

    mockMvc
        .perform(
            post("/api/watermark/normal/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.message").value("Input directory does not exist: /data/in"));
  }

  @Test
  void runBatch_shouldReturnNotFoundForUnknownVariant() throws Exception {
    mockMvc
        .perform(
            post("/api/watermark/sepia/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isNotFound());
  }

  @Test
  void runBatch_shouldRejectMissingDirectories() throws Exception {
    mockMvc
        .perform(
            post("/api/watermark/normal/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"inputDir\": \"\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void variants_shouldListDescriptors() throws Exception {
    when(watermarkService.describeVariants())
        .thenReturn(
            List.of(new VariantDescriptor("normal", "plain", 1000, 95, 0.8, false, List.of())));

    mockMvc
        .perform(get("/api/watermark/variants"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].variant").value("normal"))
        .andExpect(jsonPath("$[0].quality").value(95));
  }
}
