package com.scholary.watermark.processor;

import com.scholary.watermark.parameter.Opacity;

/** Parameters of the normal variant: resize, overlay at opacity, save at quality. */
public record NormalParams(Opacity opacity, int outputHeight, int quality) {}
