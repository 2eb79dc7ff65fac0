package com.scholary.watermark.parameter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated, merged parameters for one batch.
 *
 * <p>Built once before dispatch and shared read-only by every worker in the batch.
 */
public record ResolvedParameters(
    Opacity opacity,
    int outputHeight,
    int quality,
    boolean enhancement,
    Map<String, Object> extra) {

  public ResolvedParameters {
    Objects.requireNonNull(opacity, "opacity");
    extra = Collections.unmodifiableMap(new LinkedHashMap<>(extra == null ? Map.of() : extra));
  }

  public Optional<Object> extra(String name) {
    return Optional.ofNullable(extra.get(name));
  }

  public double extraDouble(String name, double fallback) {
    return extra(name)
        .filter(Number.class::isInstance)
        .map(value -> ((Number) value).doubleValue())
        .orElse(fallback);
  }

  public String extraString(String name, String fallback) {
    return extra(name).map(String::valueOf).orElse(fallback);
  }
}
