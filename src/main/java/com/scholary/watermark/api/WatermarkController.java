package com.scholary.watermark.api;

import com.scholary.watermark.batch.BatchResult;
import com.scholary.watermark.processor.WatermarkVariant;
import com.scholary.watermark.service.VariantDescriptor;
import com.scholary.watermark.service.WatermarkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for batch watermarking.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Running a batch for one variant
 *   <li>Listing variants with their defaults and parameter schema
 * </ul>
 */
@RestController
@RequestMapping("/api/watermark")
@Tag(name = "Watermark", description = "Batch image watermarking API")
public class WatermarkController {

  private static final Logger LOGGER = LoggerFactory.getLogger(WatermarkController.class);

  private final WatermarkService watermarkService;

  public WatermarkController(WatermarkService watermarkService) {
    this.watermarkService = watermarkService;
  }

  /**
   * Watermark every supported image in a directory.
   *
   * <p>Blocks until the whole batch is done. Images that fail are counted, not reported as an
   * error.
   */
  @PostMapping("/{variant}/batch")
  @Operation(
      summary = "Run a watermark batch",
      description =
          "Watermark every jpg/jpeg/png file in inputDir and write the results to outputDir. "
              + "Overrides are validated against the variant's parameter schema before any "
              + "file is touched.")
  public ResponseEntity<BatchResponse> runBatch(
      @PathVariable String variant, @Valid @RequestBody BatchRequest request) {
    WatermarkVariant watermarkVariant = WatermarkVariant.fromTag(variant);
    LOGGER.info(
        "Batch request: variant={}, inputDir={}, outputDir={}, overrides={}",
        watermarkVariant.tag(),
        request.inputDir(),
        request.outputDir(),
        request.overrides().keySet());

    BatchResult result =
        watermarkService.runBatch(
            watermarkVariant,
            Path.of(request.inputDir()),
            Path.of(request.outputDir()),
            request.overrides());
    return ResponseEntity.ok(BatchResponse.from(watermarkVariant.tag(), result));
  }

  @GetMapping("/variants")
  @Operation(
      summary = "List watermark variants",
      description = "Defaults and overridable parameters of every configured variant")
  public List<VariantDescriptor> variants() {
    return watermarkService.describeVariants();
  }
}
