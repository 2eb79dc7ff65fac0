package com.scholary.watermark.parameter;

import com.scholary.watermark.config.VariantProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges a variant's configured defaults with caller overrides.
 *
 * <p>For each declared parameter, in declaration order:
 *
 * <ol>
 *   <li>required and not supplied: {@link ValidationFailure#MISSING_PARAMETER}
 *   <li>cast to the declared type: {@link ValidationFailure#TYPE_MISMATCH}
 *   <li>check against declared options, case-insensitively, element-wise for lists: {@link
 *       ValidationFailure#INVALID_OPTION}
 *   <li>check numeric min/max: {@link ValidationFailure#OUT_OF_RANGE}
 * </ol>
 *
 * <p>The resolver fails fast on the first violation. The core fields are checked last.
 */
@Component
public class ParameterResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParameterResolver.class);

  public static final String OPACITY = "opacity";
  public static final String OUTPUT_HEIGHT = "output_height";
  public static final String QUALITY = "quality";
  public static final String ENHANCEMENT = "enhancement";

  private static final Set<String> CORE_PARAMETERS =
      Set.of(OPACITY, OUTPUT_HEIGHT, QUALITY, ENHANCEMENT);

  /**
   * Resolve the parameters for one batch.
   *
   * @param variant the variant's configuration and parameter schema
   * @param overrides caller supplied values, keyed by parameter name; may be null
   * @return the validated parameters
   * @throws ParameterValidationException on the first invalid parameter
   */
  public ResolvedParameters resolve(VariantProperties variant, Map<String, ?> overrides) {
    Map<String, ?> supplied = overrides == null ? Map.of() : overrides;
    Map<String, Object> values = resolveDeclared(variant.params(), supplied);

    logIgnoredOverrides(variant.params(), supplied);

    Opacity opacity = resolveOpacity(values, variant.opacity());
    int outputHeight = resolveOutputHeight(values, variant.outputHeight());
    int quality = resolveQuality(values, variant.quality());
    boolean enhancement = resolveEnhancement(values, variant.enhancement());

    Map<String, Object> extra = new LinkedHashMap<>(values);
    CORE_PARAMETERS.forEach(extra::remove);

    return new ResolvedParameters(opacity, outputHeight, quality, enhancement, extra);
  }

  /** Resolve only the declared schema, without the core fields. */
  public Map<String, Object> resolveDeclared(List<ParameterSpec> specs, Map<String, ?> supplied) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (ParameterSpec spec : specs) {
      Object raw = supplied.get(spec.name());
      if (raw == null) {
        if (spec.required()) {
          throw ParameterValidationException.missing(spec.name());
        }
        raw = spec.defaultValue();
      }
      if (raw == null) {
        continue;
      }

      Object value = cast(spec, raw);
      checkOptions(spec, value);
      checkRange(spec, value);
      values.put(spec.name(), value);
    }
    return values;
  }

  private Object cast(ParameterSpec spec, Object raw) {
    ParameterType type = spec.type();
    try {
      return type.cast(raw);
    } catch (IllegalArgumentException | ArithmeticException e) {
      throw ParameterValidationException.typeMismatch(spec.name(), type.typeName(), raw);
    }
  }

  private void checkOptions(ParameterSpec spec, Object value) {
    if (!spec.hasOptions()) {
      return;
    }
    Set<String> allowed =
        spec.options().stream()
            .map(option -> option.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

    if (value instanceof List<?> items) {
      for (Object item : items) {
        if (!allowed.contains(String.valueOf(item).toLowerCase(Locale.ROOT))) {
          throw ParameterValidationException.invalidOption(spec.name(), item, spec.options());
        }
      }
    } else if (!allowed.contains(String.valueOf(value).toLowerCase(Locale.ROOT))) {
      throw ParameterValidationException.invalidOption(spec.name(), value, spec.options());
    }
  }

  private void checkRange(ParameterSpec spec, Object value) {
    if (!(value instanceof Number number)) {
      return;
    }
    double numeric = number.doubleValue();
    if ((spec.min() != null && numeric < spec.min())
        || (spec.max() != null && numeric > spec.max())) {
      throw ParameterValidationException.outOfRange(spec.name(), value, spec.min(), spec.max());
    }
  }

  private Opacity resolveOpacity(Map<String, Object> values, Double configured) {
    Object value = values.getOrDefault(OPACITY, configured);
    if (!(value instanceof Number number)) {
      throw ParameterValidationException.typeMismatch(OPACITY, "number", value);
    }
    try {
      return Opacity.of(number);
    } catch (IllegalArgumentException e) {
      throw ParameterValidationException.outOfRange(OPACITY, value, 0, 100);
    }
  }

  private int resolveOutputHeight(Map<String, Object> values, int configured) {
    int height = intValue(OUTPUT_HEIGHT, values.getOrDefault(OUTPUT_HEIGHT, configured));
    if (height <= 0) {
      throw ParameterValidationException.outOfRange(OUTPUT_HEIGHT, height, 1, null);
    }
    return height;
  }

  private int resolveQuality(Map<String, Object> values, int configured) {
    int quality = intValue(QUALITY, values.getOrDefault(QUALITY, configured));
    if (quality < 0 || quality > 100) {
      throw ParameterValidationException.outOfRange(QUALITY, quality, 0, 100);
    }
    return quality;
  }

  private boolean resolveEnhancement(Map<String, Object> values, boolean configured) {
    Object value = values.getOrDefault(ENHANCEMENT, configured);
    if (!(value instanceof Boolean enabled)) {
      throw ParameterValidationException.typeMismatch(ENHANCEMENT, "bool", value);
    }
    return enabled;
  }

  private int intValue(String name, Object value) {
    if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
      return number.intValue();
    }
    throw ParameterValidationException.typeMismatch(name, "int", value);
  }

  private void logIgnoredOverrides(List<ParameterSpec> specs, Map<String, ?> supplied) {
    if (!LOGGER.isDebugEnabled()) {
      return;
    }
    Set<String> declared = specs.stream().map(ParameterSpec::name).collect(Collectors.toSet());
    supplied.keySet().stream()
        .filter(name -> !declared.contains(name))
        .forEach(name -> LOGGER.debug("Ignoring undeclared parameter override: {}", name));
  }
}
