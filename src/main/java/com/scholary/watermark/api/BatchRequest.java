package com.scholary.watermark.api;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * Request to watermark one directory of images.
 *
 * <p>{@code overrides} maps parameter names to values; omitted parameters take the variant's
 * defaults.
 */
public record BatchRequest(
    @NotBlank String inputDir, @NotBlank String outputDir, Map<String, Object> overrides) {

  public BatchRequest {
    overrides = overrides == null ? Map.of() : overrides;
  }
}
