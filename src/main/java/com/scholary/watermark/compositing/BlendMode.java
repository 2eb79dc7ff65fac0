package com.scholary.watermark.compositing;

/**
 * The two compositing paths a processor can take.
 *
 * <p>Both are legitimate; the {@code enhancement} parameter chooses between them.
 */
public enum BlendMode {
  /** Opacity-scaled straight-alpha overlay ({@link Compositor#overlayAndCrop}). */
  ALPHA_OVERLAY,

  /** Brightened overlay blended with its own alpha ({@link Compositor#enhanceBrightness}). */
  LUMINANCE_BOOST;

  public static BlendMode forEnhancement(boolean enhancement) {
    return enhancement ? LUMINANCE_BOOST : ALPHA_OVERLAY;
  }
}
