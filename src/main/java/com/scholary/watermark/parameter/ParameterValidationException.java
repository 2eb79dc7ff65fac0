package com.scholary.watermark.parameter;

import java.util.List;

/**
 * Thrown when batch parameters fail validation.
 *
 * <p>Always raised before any task is dispatched. Carries the offending parameter and the kind of
 * failure so the caller can report which field was rejected and why.
 */
public class ParameterValidationException extends RuntimeException {

  private final String parameter;
  private final ValidationFailure failure;

  public ParameterValidationException(String parameter, ValidationFailure failure, String message) {
    super(message);
    this.parameter = parameter;
    this.failure = failure;
  }

  public static ParameterValidationException missing(String parameter) {
    return new ParameterValidationException(
        parameter,
        ValidationFailure.MISSING_PARAMETER,
        "Missing required parameter: " + parameter);
  }

  public static ParameterValidationException typeMismatch(
      String parameter, String expected, Object actual) {
    return new ParameterValidationException(
        parameter,
        ValidationFailure.TYPE_MISMATCH,
        String.format(
            "Parameter %s expects %s but got '%s' (%s)",
            parameter,
            expected,
            actual,
            actual == null ? "null" : actual.getClass().getSimpleName()));
  }

  public static ParameterValidationException invalidOption(
      String parameter, Object value, List<String> options) {
    return new ParameterValidationException(
        parameter,
        ValidationFailure.INVALID_OPTION,
        String.format("Parameter %s value '%s' is not one of %s", parameter, value, options));
  }

  public static ParameterValidationException outOfRange(
      String parameter, Object value, Number min, Number max) {
    return new ParameterValidationException(
        parameter,
        ValidationFailure.OUT_OF_RANGE,
        String.format(
            "Parameter %s value %s is outside [%s, %s]",
            parameter, value, min == null ? "-inf" : min, max == null ? "+inf" : max));
  }

  public String getParameter() {
    return parameter;
  }

  public ValidationFailure getFailure() {
    return failure;
  }
}
