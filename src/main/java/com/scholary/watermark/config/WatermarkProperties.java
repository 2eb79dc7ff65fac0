package com.scholary.watermark.config;

import com.scholary.watermark.processor.WatermarkVariant;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for batch watermarking.
 *
 * <p>Controls worker parallelism, which files are picked up, and the per-variant defaults and
 * parameter schemas.
 */
@ConfigurationProperties(prefix = "watermark")
@Validated
public record WatermarkProperties(
    @Valid @NotNull BatchProperties batch,
    @Valid @NotEmpty Map<WatermarkVariant, VariantProperties> variants) {

  public Optional<VariantProperties> variant(WatermarkVariant variant) {
    return Optional.ofNullable(variants.get(variant));
  }

  /**
   * @param maxParallelism upper bound on workers per batch, {@code 0} for available processors
   * @param supportedExtensions file extensions picked up by the scanner, without the dot
   * @param flushTimeout how long a batch waits for its log events to be written
   */
  public record BatchProperties(
      @PositiveOrZero int maxParallelism,
      @NotEmpty List<String> supportedExtensions,
      @NotNull Duration flushTimeout) {}
}
