package com.scholary.watermark.processor;

import com.scholary.watermark.compositing.BlendMode;
import com.scholary.watermark.parameter.Opacity;

/**
 * Parameters of the foggy variant.
 *
 * <p>{@code quality} drives the pre-composite re-encode; the final file is always written at
 * {@link FoggyWatermarkProcessor#OUTPUT_QUALITY}.
 */
public record FoggyParams(
    Opacity opacity, int outputHeight, int quality, BlendMode blendMode, double boostRatio) {}
