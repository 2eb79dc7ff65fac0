package com.scholary.watermark.service;

import com.scholary.watermark.parameter.ParameterSpec;
import java.util.List;

/** A variant's defaults and the parameters a caller may override. */
public record VariantDescriptor(
    String variant,
    String description,
    int outputHeight,
    int quality,
    double opacity,
    boolean enhancement,
    List<ParameterSpec> params) {}
