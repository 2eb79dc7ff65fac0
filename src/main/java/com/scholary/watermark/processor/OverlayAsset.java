package com.scholary.watermark.processor;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * A decoded overlay image and where it came from.
 *
 * <p>Loaded once per processor and shared read-only by every worker. Compositing never writes to
 * the overlay.
 */
public record OverlayAsset(String location, BufferedImage image) {

  public OverlayAsset {
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(image, "image");
    if (image.getType() != BufferedImage.TYPE_INT_ARGB) {
      image = toArgb(image);
    }
  }

  private static BufferedImage toArgb(BufferedImage source) {
    BufferedImage argb =
        new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = argb.createGraphics();
    try {
      g.drawImage(source, 0, 0, null);
    } finally {
      g.dispose();
    }
    return argb;
  }
}
