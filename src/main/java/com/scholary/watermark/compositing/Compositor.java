package com.scholary.watermark.compositing;

import com.scholary.watermark.parameter.Opacity;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Pixel-level watermark compositing.
 *
 * <p>All functions are pure: inputs are never modified and every result is a new image. Blending
 * happens in normalised {@code [0, 1]} doubles and is re-quantised to 8 bits per channel.
 *
 * <p>Two blend paths exist:
 *
 * <ul>
 *   <li>{@link #overlayAndCrop} scales the overlay's alpha by the requested opacity.
 *   <li>{@link #enhanceBrightness} brightens the overlay relative to the base image and blends
 *       with the overlay's own alpha only. Opacity does not apply on this path.
 * </ul>
 */
public final class Compositor {

  static final double LUMA_RED = 0.2126;
  static final double LUMA_GREEN = 0.7152;
  static final double LUMA_BLUE = 0.0722;

  static final double EPSILON = 1e-6;
  static final double MIN_GAIN = 1.0;
  static final double MAX_GAIN = 5.0;

  /** sRGB 8-bit value to linear light. */
  private static final double[] LINEAR = new double[256];

  static {
    for (int i = 0; i < LINEAR.length; i++) {
      double c = i / 255.0;
      LINEAR[i] = c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }
  }

  private Compositor() {}

  /**
   * Scale uniformly to {@code targetHeight}; width follows with integer truncation.
   *
   * @throws IllegalArgumentException if {@code targetHeight} is not positive
   */
  public static BufferedImage resize(BufferedImage image, int targetHeight) {
    if (targetHeight <= 0) {
      throw new IllegalArgumentException("targetHeight must be positive: " + targetHeight);
    }
    double scale = (double) targetHeight / image.getHeight();
    int width = Math.max(1, (int) (image.getWidth() * scale));
    int type =
        ImageCodec.hasAlpha(image) ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;

    BufferedImage resized = new BufferedImage(width, targetHeight, type);
    Graphics2D g = resized.createGraphics();
    try {
      g.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      g.drawImage(image, 0, 0, width, targetHeight, null);
    } finally {
      g.dispose();
    }
    return resized;
  }

  /**
   * Resize, then round-trip through the output codec at {@code quality}.
   *
   * <p>The overlay is meant to sit on top of the compressed look of the base image, so compression
   * happens before compositing, not after.
   */
  public static BufferedImage resizeAndReencode(BufferedImage image, int targetHeight, int quality)
      throws IOException {
    return ImageCodec.reencode(resize(image, targetHeight), quality);
  }

  /**
   * Blend {@code overlay} onto the top-left corner of {@code base}.
   *
   * <p>An overlay larger than the base is cropped to the base's bounds first. The overlay's alpha
   * is multiplied by {@code opacity}, then composited source-over with straight alpha. Pixels
   * outside the overlay's footprint keep their original values.
   *
   * @return a new ARGB image with the base's dimensions
   */
  public static BufferedImage overlayAndCrop(
      BufferedImage base, BufferedImage overlay, Opacity opacity) {
    BufferedImage result = copyArgb(base);
    BufferedImage cropped = cropTo(overlay, base.getWidth(), base.getHeight());
    int width = cropped.getWidth();
    int height = cropped.getHeight();

    int[] dst = result.getRGB(0, 0, width, height, null, 0, width);
    int[] src = cropped.getRGB(0, 0, width, height, null, 0, width);
    double alphaScale = opacity.fraction();
    for (int i = 0; i < dst.length; i++) {
      dst[i] = sourceOver(src[i], dst[i], alphaScale);
    }
    result.setRGB(0, 0, width, height, dst, 0, width);
    return result;
  }

  /**
   * Brighten the overlay to stand out against the base, then blend it onto the top-left corner.
   *
   * <p>The target luminance is the base's brightest pixel times {@code boostRatio}, capped at 1.
   * Overlay pixels darker than the target have their RGB scaled by {@code (target + e) / (current
   * + e)}, clamped to {@code [1, 5]}, so no pixel is darkened. Blending uses the overlay's own
   * alpha and the output alpha is the larger of the two inputs.
   *
   * @param opacity accepted for signature parity with {@link #overlayAndCrop}; not applied
   * @return a new ARGB image with the base's dimensions
   */
  public static BufferedImage enhanceBrightness(
      BufferedImage base, BufferedImage overlay, double boostRatio, Opacity opacity) {
    double target = targetLuminance(base, boostRatio);
    BufferedImage brightened = brighten(cropTo(overlay, base.getWidth(), base.getHeight()), target);

    BufferedImage result = copyArgb(base);
    int width = brightened.getWidth();
    int height = brightened.getHeight();
    int[] dst = result.getRGB(0, 0, width, height, null, 0, width);
    int[] src = brightened.getRGB(0, 0, width, height, null, 0, width);
    for (int i = 0; i < dst.length; i++) {
      dst[i] = blendKeepMaxAlpha(src[i], dst[i]);
    }
    result.setRGB(0, 0, width, height, dst, 0, width);
    return result;
  }

  /** {@code min(maxLuminance(base) * boostRatio, 1.0)}. */
  public static double targetLuminance(BufferedImage base, double boostRatio) {
    return Math.min(maxLuminance(base) * boostRatio, 1.0);
  }

  /**
   * Lift every pixel darker than {@code targetLuminance} towards it. Alpha is preserved.
   *
   * @return a new ARGB image
   */
  public static BufferedImage brighten(BufferedImage overlay, double targetLuminance) {
    int width = overlay.getWidth();
    int height = overlay.getHeight();
    int[] pixels = overlay.getRGB(0, 0, width, height, null, 0, width);

    for (int i = 0; i < pixels.length; i++) {
      int argb = pixels[i];
      double current = luminance(argb);
      if (current >= targetLuminance) {
        continue;
      }
      double gain = clamp((targetLuminance + EPSILON) / (current + EPSILON), MIN_GAIN, MAX_GAIN);
      pixels[i] =
          pack(
              alpha(argb) / 255.0,
              Math.min(1.0, red(argb) / 255.0 * gain),
              Math.min(1.0, green(argb) / 255.0 * gain),
              Math.min(1.0, blue(argb) / 255.0 * gain));
    }

    BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    result.setRGB(0, 0, width, height, pixels, 0, width);
    return result;
  }

  /** Highest relative luminance in the image, in {@code [0, 1]}. */
  public static double maxLuminance(BufferedImage image) {
    int width = image.getWidth();
    int[] row = new int[width];
    double max = 0.0;
    for (int y = 0; y < image.getHeight(); y++) {
      image.getRGB(0, y, width, 1, row, 0, width);
      for (int argb : row) {
        max = Math.max(max, luminance(argb));
      }
    }
    return max;
  }

  /** BT.709 relative luminance of a gamma-decoded sRGB pixel. Alpha is ignored. */
  public static double luminance(int argb) {
    return LUMA_RED * LINEAR[red(argb)]
        + LUMA_GREEN * LINEAR[green(argb)]
        + LUMA_BLUE * LINEAR[blue(argb)];
  }

  /** Top-left crop to at most {@code width x height}; returns the image itself if it fits. */
  static BufferedImage cropTo(BufferedImage image, int width, int height) {
    if (image.getWidth() <= width && image.getHeight() <= height) {
      return image;
    }
    return image.getSubimage(
        0, 0, Math.min(image.getWidth(), width), Math.min(image.getHeight(), height));
  }

  private static BufferedImage copyArgb(BufferedImage source) {
    int width = source.getWidth();
    int height = source.getHeight();
    BufferedImage copy = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    copy.setRGB(0, 0, width, height, source.getRGB(0, 0, width, height, null, 0, width), 0, width);
    return copy;
  }

  private static int sourceOver(int src, int dst, double alphaScale) {
    double sa = alpha(src) / 255.0 * alphaScale;
    if (sa <= 0.0) {
      return dst;
    }
    double da = alpha(dst) / 255.0;
    double outA = sa + da * (1.0 - sa);
    if (outA <= 0.0) {
      return 0;
    }
    double dw = da * (1.0 - sa);
    return pack(
        outA,
        (red(src) / 255.0 * sa + red(dst) / 255.0 * dw) / outA,
        (green(src) / 255.0 * sa + green(dst) / 255.0 * dw) / outA,
        (blue(src) / 255.0 * sa + blue(dst) / 255.0 * dw) / outA);
  }

  private static int blendKeepMaxAlpha(int src, int dst) {
    double sa = alpha(src) / 255.0;
    double da = alpha(dst) / 255.0;
    return pack(
        Math.max(sa, da),
        red(src) / 255.0 * sa + red(dst) / 255.0 * (1.0 - sa),
        green(src) / 255.0 * sa + green(dst) / 255.0 * (1.0 - sa),
        blue(src) / 255.0 * sa + blue(dst) / 255.0 * (1.0 - sa));
  }

  private static int pack(double a, double r, double g, double b) {
    return quantize(a) << 24 | quantize(r) << 16 | quantize(g) << 8 | quantize(b);
  }

  private static int quantize(double value) {
    return (int) Math.round(clamp(value, 0.0, 1.0) * 255.0);
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  static int alpha(int argb) {
    return (argb >>> 24) & 0xFF;
  }

  static int red(int argb) {
    return (argb >> 16) & 0xFF;
  }

  static int green(int argb) {
    return (argb >> 8) & 0xFF;
  }

  static int blue(int argb) {
    return argb & 0xFF;
  }
}
