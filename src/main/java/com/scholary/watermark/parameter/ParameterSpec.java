package com.scholary.watermark.parameter;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Declaration of one named variant parameter, as bound from configuration.
 *
 * <p>{@code defaultValue} is kept as text and cast with {@link #type()} at resolve time, so a
 * default goes through exactly the same checks as a user override.
 */
public record ParameterSpec(
    @NotBlank String name,
    String inputType,
    String defaultValue,
    Double min,
    Double max,
    List<String> options,
    boolean required,
    String label) {

  /**
   * @throws IllegalArgumentException if {@code inputType} names no known type, so a bad
   *     declaration fails when configuration is bound
   */
  public ParameterSpec {
    ParameterType.fromName(inputType);
    options = options == null ? List.of() : List.copyOf(options);
  }

  public ParameterType type() {
    return ParameterType.fromName(inputType);
  }

  public boolean hasOptions() {
    return !options.isEmpty();
  }
}
