package com.scholary.watermark.parameter;

/**
 * Overlay opacity, normalised to a fraction in {@code [0, 1]}.
 *
 * <p>Configuration and callers may express opacity either as a fraction ({@code 0.8}) or as an
 * integer percentage ({@code 80}). Values up to and including {@code 1} are fractions; values
 * above {@code 1} up to {@code 100} are percentages. So {@code 1} and {@code 100} both mean fully
 * governed by the overlay's own alpha.
 */
public record Opacity(double fraction) {

  public static final Opacity OPAQUE = new Opacity(1.0);
  public static final Opacity TRANSPARENT = new Opacity(0.0);

  public Opacity {
    if (Double.isNaN(fraction) || fraction < 0.0 || fraction > 1.0) {
      throw new IllegalArgumentException("opacity fraction must be within [0, 1]: " + fraction);
    }
  }

  /**
   * Normalise a configured or user supplied value.
   *
   * @throws IllegalArgumentException if the value is negative, NaN or above 100
   */
  public static Opacity of(Number value) {
    double raw = value.doubleValue();
    if (Double.isNaN(raw) || raw < 0.0 || raw > 100.0) {
      throw new IllegalArgumentException("opacity must be within [0, 1] or [0, 100]: " + value);
    }
    return new Opacity(raw <= 1.0 ? raw : raw / 100.0);
  }
}
