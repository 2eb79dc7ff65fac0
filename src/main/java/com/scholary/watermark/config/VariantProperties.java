package com.scholary.watermark.config;

import com.scholary.watermark.parameter.ParameterSpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * Configuration of one watermark variant.
 *
 * <p>The scalar fields are the variant's defaults. {@code params} is the schema of named
 * parameters a caller may override; a declared parameter named {@code opacity},
 * {@code output_height}, {@code quality} or {@code enhancement} takes precedence over the scalar
 * default of the same meaning.
 */
public record VariantProperties(
    String description,
    @Positive int outputHeight,
    @Min(0) @Max(100) int quality,
    @NotNull @DecimalMin("0") @DecimalMax("100") Double opacity,
    @NotBlank String overlayAsset,
    boolean enhancement,
    @Valid List<ParameterSpec> params) {

  public VariantProperties {
    params = params == null ? List.of() : List.copyOf(params);
  }
}
